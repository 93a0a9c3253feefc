package com.promptroute.domain.budget.model.valobj;

import com.promptroute.types.enums.BudgetModeEnum;
import com.promptroute.types.enums.BudgetStateEnum;
import lombok.Data;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * 组织当前周期的预算状态。
 */
@Data
public class BudgetStatus {

    private String organization;
    private String period;
    private BudgetStateEnum state;
    private BigDecimal cumulativeSpend;
    private BigDecimal monthlyLimit;
    private BudgetModeEnum mode;
    private BigDecimal alertThreshold;
    private BigDecimal percentageUsed;
    private BigDecimal projectedSpend;
    private Integer daysRemaining;
    private boolean policyFound;
    private List<BudgetAlert> alerts = new ArrayList<>();
}
