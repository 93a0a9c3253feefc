package com.promptroute.domain.budget.service;

import com.promptroute.domain.budget.model.entity.LedgerEntryEntity;
import com.promptroute.domain.budget.model.valobj.BudgetAlert;
import com.promptroute.domain.budget.model.valobj.BudgetDirective;
import com.promptroute.domain.budget.model.valobj.BudgetPolicy;
import com.promptroute.domain.budget.model.valobj.BudgetStatus;
import com.promptroute.types.enums.BudgetModeEnum;
import com.promptroute.types.enums.BudgetStateEnum;
import com.promptroute.types.enums.DirectiveTypeEnum;
import com.promptroute.types.enums.RouteChannelEnum;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * 预算账本规则领域服务：周期计算、状态评估、指令生成与预算状态投影。
 */
@Service
public class BudgetLedgerDomainService {

    private static final DateTimeFormatter PERIOD_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM");
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100L);
    private static final BigDecimal CRITICAL_PERCENT = BigDecimal.valueOf(90L);
    private static final BigDecimal WARNING_PERCENT = BigDecimal.valueOf(80L);
    private static final BigDecimal PROJECTED_OVERRUN_RATIO = new BigDecimal("1.1");
    private static final BigDecimal LOW_USAGE_PERCENT = BigDecimal.valueOf(50L);
    private static final int LOW_USAGE_AFTER_DAY = 15;

    public String periodOf(LocalDate date) {
        return YearMonth.from(date).format(PERIOD_FORMAT);
    }

    public YearMonth parsePeriod(String period) {
        try {
            return YearMonth.parse(period, PERIOD_FORMAT);
        } catch (RuntimeException ex) {
            throw new IllegalArgumentException("period 格式应为 yyyy-MM: " + period, ex);
        }
    }

    public LocalDateTime periodStart(String period) {
        return parsePeriod(period).atDay(1).atStartOfDay();
    }

    public LocalDateTime periodEnd(String period) {
        return parsePeriod(period).plusMonths(1).atDay(1).atStartOfDay();
    }

    public BudgetStateEnum evaluateState(BudgetPolicy policy, LedgerEntryEntity entry) {
        BigDecimal spend = entry == null ? BigDecimal.ZERO : entry.normalizedSpend();
        return BudgetStateEnum.evaluate(spend, policy.getMonthlyLimit(), policy.getAlertThreshold());
    }

    /**
     * 依据策略模式与当前状态给出指令。
     *
     * @param policy 组织策略，为空时按只观察处理
     * @param entry 最近一次已知的账本条目，可为空
     * @param requestedModel 请求的模型
     * @param requestedChannel 决策引擎选出的通道
     * @param estimatedCost 本次请求的预估花费，只影响告警
     */
    public BudgetDirective evaluateDirective(String organization,
                                             BudgetPolicy policy,
                                             LedgerEntryEntity entry,
                                             String requestedModel,
                                             RouteChannelEnum requestedChannel,
                                             BigDecimal estimatedCost) {
        boolean policyFound = policy != null;
        BudgetPolicy effective = policyFound ? policy : BudgetPolicy.observeOnly(organization);
        BudgetStateEnum state = evaluateState(effective, entry);
        boolean alert = state.atLeast(BudgetStateEnum.NEAR_THRESHOLD) || wouldExceed(effective, entry, estimatedCost);

        BudgetDirective.BudgetDirectiveBuilder builder = BudgetDirective.builder()
                .type(DirectiveTypeEnum.ALLOW)
                .state(state)
                .mode(effective.getMode())
                .alert(alert)
                .policyFound(policyFound);

        if (state != BudgetStateEnum.OVER_LIMIT || effective.getMode() == BudgetModeEnum.OBSERVE) {
            return builder.reason(policyFound ? null : "POLICY_NOT_FOUND").build();
        }
        if (effective.getMode() == BudgetModeEnum.HARD) {
            return builder.type(DirectiveTypeEnum.BLOCK)
                    .reason("Hard budget limit reached")
                    .build();
        }
        String fallbackModel = effective.modelFallbackFor(requestedModel);
        if (fallbackModel == null) {
            return builder.reason("No fallback configured for model " + requestedModel).build();
        }
        return builder.type(DirectiveTypeEnum.DOWNGRADE)
                .targetModel(fallbackModel)
                .targetChannel(effective.channelFallbackFor(requestedChannel))
                .reason("Budget exceeded: downgraded " + requestedModel + " -> " + fallbackModel)
                .build();
    }

    public BudgetStatus buildStatus(String organization,
                                    BudgetPolicy policy,
                                    LedgerEntryEntity entry,
                                    LocalDate today) {
        boolean policyFound = policy != null;
        BudgetPolicy effective = policyFound ? policy : BudgetPolicy.observeOnly(organization);
        BigDecimal spend = entry == null ? BigDecimal.ZERO : entry.normalizedSpend();
        BigDecimal limit = effective.getMonthlyLimit();

        int daysInMonth = today.lengthOfMonth();
        int daysElapsed = today.getDayOfMonth();
        BigDecimal projected = spend
                .divide(BigDecimal.valueOf(daysElapsed), 8, RoundingMode.HALF_UP)
                .multiply(BigDecimal.valueOf(daysInMonth))
                .setScale(2, RoundingMode.HALF_UP);

        BudgetStatus status = new BudgetStatus();
        status.setOrganization(organization);
        status.setPeriod(periodOf(today));
        status.setState(evaluateState(effective, entry));
        status.setCumulativeSpend(spend);
        status.setMonthlyLimit(limit);
        status.setMode(effective.getMode());
        status.setAlertThreshold(effective.getAlertThreshold());
        status.setProjectedSpend(projected);
        status.setDaysRemaining(daysInMonth - daysElapsed);
        status.setPolicyFound(policyFound);
        if (limit == null) {
            status.setPercentageUsed(BigDecimal.ZERO);
            status.setAlerts(policyFound ? new ArrayList<>() : List.of(new BudgetAlert("info",
                    "No budget policy configured; spend is observed only",
                    "Add a budget policy for this organization", false)));
            return status;
        }
        BigDecimal percentage = spend.multiply(HUNDRED).divide(limit, 1, RoundingMode.HALF_UP);
        status.setPercentageUsed(percentage);
        status.setAlerts(buildAlerts(spend, limit, projected, percentage, daysElapsed));
        return status;
    }

    private List<BudgetAlert> buildAlerts(BigDecimal spend,
                                          BigDecimal limit,
                                          BigDecimal projected,
                                          BigDecimal percentage,
                                          int dayOfMonth) {
        List<BudgetAlert> alerts = new ArrayList<>();
        if (percentage.compareTo(HUNDRED) >= 0) {
            alerts.add(new BudgetAlert("critical",
                    "Budget exceeded! Current spend: $" + money(spend) + " / $" + money(limit),
                    "Consider enabling hard budget limits or upgrading your plan", true));
        } else if (percentage.compareTo(CRITICAL_PERCENT) >= 0) {
            alerts.add(new BudgetAlert("critical",
                    "Budget nearly exhausted: " + percentage + "% used",
                    "Enable cost-saving measures immediately", true));
        } else if (percentage.compareTo(WARNING_PERCENT) >= 0) {
            alerts.add(new BudgetAlert("warning",
                    "Budget alert: " + percentage + "% of monthly limit used",
                    "Consider reviewing routing patterns to optimize costs", false));
        } else if (projected.compareTo(limit.multiply(PROJECTED_OVERRUN_RATIO)) > 0) {
            alerts.add(new BudgetAlert("warning",
                    "Projected to exceed budget: $" + money(projected) + " estimated for month",
                    "Current usage patterns may lead to budget overrun", false));
        }
        if (percentage.compareTo(LOW_USAGE_PERCENT) < 0 && dayOfMonth > LOW_USAGE_AFTER_DAY) {
            alerts.add(new BudgetAlert("info",
                    "Budget usage is lower than expected - good cost management!",
                    "Consider investing saved budget in advanced features", false));
        }
        return alerts;
    }

    private boolean wouldExceed(BudgetPolicy policy, LedgerEntryEntity entry, BigDecimal estimatedCost) {
        if (policy.getMonthlyLimit() == null || estimatedCost == null || estimatedCost.signum() <= 0) {
            return false;
        }
        BigDecimal spend = entry == null ? BigDecimal.ZERO : entry.normalizedSpend();
        return spend.add(estimatedCost).compareTo(policy.getMonthlyLimit()) >= 0;
    }

    private String money(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }
}
