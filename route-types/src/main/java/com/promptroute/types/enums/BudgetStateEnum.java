package com.promptroute.types.enums;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 账本周期内的预算状态。
 * <p>
 * 状态不落库，每次检查都由累计花费与月度额度重新计算，周期内单调推进，
 * 进入新周期后回到 UNDER_THRESHOLD。
 * </p>
 */
public enum BudgetStateEnum {

    UNDER_THRESHOLD,

    NEAR_THRESHOLD,

    OVER_LIMIT;

    /**
     * 根据累计花费计算状态。
     *
     * @param cumulativeSpend 当前周期累计花费
     * @param monthlyLimit 月度额度，为空或非正数时表示没有额度感知
     * @param alertThreshold 告警阈值比例 (0,1]
     * @return 预算状态
     */
    public static BudgetStateEnum evaluate(BigDecimal cumulativeSpend,
                                           BigDecimal monthlyLimit,
                                           BigDecimal alertThreshold) {
        if (monthlyLimit == null || monthlyLimit.signum() <= 0) {
            return UNDER_THRESHOLD;
        }
        BigDecimal spend = cumulativeSpend == null ? BigDecimal.ZERO : cumulativeSpend;
        if (spend.compareTo(monthlyLimit) >= 0) {
            return OVER_LIMIT;
        }
        if (alertThreshold == null) {
            return UNDER_THRESHOLD;
        }
        BigDecimal ratio = spend.divide(monthlyLimit, 8, RoundingMode.HALF_UP);
        return ratio.compareTo(alertThreshold) >= 0 ? NEAR_THRESHOLD : UNDER_THRESHOLD;
    }

    public boolean atLeast(BudgetStateEnum other) {
        return other != null && this.ordinal() >= other.ordinal();
    }
}
