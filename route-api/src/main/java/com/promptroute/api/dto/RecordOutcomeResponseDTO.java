package com.promptroute.api.dto;

import lombok.Data;

import java.math.BigDecimal;

/**
 * 交互结果上报回执。
 */
@Data
public class RecordOutcomeResponseDTO {

    private Long outcomeId;
    private Long decisionId;
    private BigDecimal cumulativeSpend;
    private String budgetState;
    /** 权重反馈是否已写入 */
    private Boolean weightUpdated;
    private Double userWeight;
    private Double orgWeight;
}
