package com.promptroute.infrastructure.dao.po;

import com.promptroute.types.enums.RouteChannelEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 交互结果 PO。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InteractionOutcomePO {

    private Long id;
    private Long decisionId;
    private String organization;
    private String userKey;
    private RouteChannelEnum channel;
    private String model;
    private Double observedUtility;
    private BigDecimal actualCost;
    private Integer tokensIn;
    private Integer tokensOut;
    private Integer latencyMs;
    private LocalDateTime createdAt;
}
