package com.promptroute.api.dto;

import lombok.Data;

import java.math.BigDecimal;

/**
 * 交互结果上报 DTO。observedUtility 与 outcome 二选一。
 */
@Data
public class RecordOutcomeRequestDTO {

    private Long decisionId;
    private String organization;
    private String user;
    private String channel;
    /** 观测效用，通常在 [0,2] */
    private Double observedUtility;
    /** good / neutral / bad */
    private String outcome;
    private BigDecimal actualCost;
    private String model;
    private Integer tokensIn;
    private Integer tokensOut;
    private Integer latencyMs;
}
