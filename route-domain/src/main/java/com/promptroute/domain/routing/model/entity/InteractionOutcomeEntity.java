package com.promptroute.domain.routing.model.entity;

import com.promptroute.types.enums.RouteChannelEnum;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 已完成交互的观测结果。权重学习只在存在结果记录后发生。
 */
@Data
public class InteractionOutcomeEntity {

    private Long id;
    private Long decisionId;
    private String organization;
    private String user;
    private RouteChannelEnum channel;
    private String model;
    private Double observedUtility;
    private BigDecimal actualCost;
    private Integer tokensIn;
    private Integer tokensOut;
    private Integer latencyMs;
    private LocalDateTime createdAt;

    public void validate() {
        if (decisionId == null) {
            throw new IllegalStateException("Decision id cannot be null");
        }
        if (channel == null) {
            throw new IllegalStateException("Channel cannot be null");
        }
        if (observedUtility == null || observedUtility.isNaN() || observedUtility.isInfinite()) {
            throw new IllegalStateException("Observed utility must be a finite number");
        }
        if (actualCost == null || actualCost.signum() < 0) {
            throw new IllegalStateException("Actual cost cannot be negative");
        }
    }

    public int normalizedTokensIn() {
        return tokensIn == null ? 0 : Math.max(tokensIn, 0);
    }

    public int normalizedTokensOut() {
        return tokensOut == null ? 0 : Math.max(tokensOut, 0);
    }

    public int normalizedLatencyMs() {
        return latencyMs == null ? 0 : Math.max(latencyMs, 0);
    }
}
