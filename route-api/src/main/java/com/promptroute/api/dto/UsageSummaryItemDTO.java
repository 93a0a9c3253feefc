package com.promptroute.api.dto;

import lombok.Data;

import java.math.BigDecimal;

@Data
public class UsageSummaryItemDTO {

    private String key;
    private Long requests;
    private Long tokensIn;
    private Long tokensOut;
    private BigDecimal costUsd;
    private Integer latencyMsP95;
}
