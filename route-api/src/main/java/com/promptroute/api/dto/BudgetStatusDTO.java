package com.promptroute.api.dto;

import lombok.Data;

import java.math.BigDecimal;
import java.util.List;

/**
 * 预算状态 DTO。
 */
@Data
public class BudgetStatusDTO {

    private String organization;
    private String period;
    private String state;
    private String mode;
    private BigDecimal cumulativeSpend;
    private BigDecimal monthlyLimit;
    private BigDecimal alertThreshold;
    private BigDecimal percentageUsed;
    private BigDecimal projectedSpend;
    private Integer daysRemaining;
    private Boolean policyFound;
    private List<BudgetAlertDTO> alerts;
}
