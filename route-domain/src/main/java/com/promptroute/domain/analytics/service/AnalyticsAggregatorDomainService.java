package com.promptroute.domain.analytics.service;

import com.promptroute.domain.analytics.model.valobj.UsageSummaryItem;
import com.promptroute.domain.analytics.model.valobj.UserEfficiency;
import com.promptroute.domain.analytics.model.valobj.WeeklyRecommendation;
import com.promptroute.domain.budget.model.valobj.ModelCostCatalog;
import com.promptroute.domain.learning.model.entity.ChannelWeightEntity;
import com.promptroute.domain.routing.model.entity.InteractionOutcomeEntity;
import com.promptroute.domain.routing.model.entity.RouteDecisionEntity;
import com.promptroute.types.common.Constants;
import com.promptroute.types.enums.RationaleTagEnum;
import com.promptroute.types.enums.RouteChannelEnum;
import com.promptroute.types.enums.UsageGroupByEnum;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * 分析聚合领域服务：对历史数据只读折叠，不修改任何输入。
 */
@Service
public class AnalyticsAggregatorDomainService {

    /** 效用不低于该值的结果视为高价值 */
    public static final double HIGH_VALUE_UTILITY = 1.0D;
    /** 组织级权重偏离 1.0 超过该值时建议调整策略权重 */
    public static final double WEIGHT_DRIFT_THRESHOLD = 0.15D;
    static final double SIMPLE_QA_RATIO_THRESHOLD = 0.3D;
    static final long FRESHNESS_HITS_THRESHOLD = 50L;
    static final double AGENT_OVERUSE_THRESHOLD = 0.2D;
    /** 未采纳优化建议时的可节省比例估算 */
    static final BigDecimal POTENTIAL_SAVINGS_RATIO = new BigDecimal("0.25");

    public List<UsageSummaryItem> summarize(List<InteractionOutcomeEntity> outcomes, UsageGroupByEnum groupBy) {
        Map<String, List<InteractionOutcomeEntity>> grouped = new TreeMap<>();
        for (InteractionOutcomeEntity outcome : safe(outcomes)) {
            grouped.computeIfAbsent(groupKey(outcome, groupBy), key -> new ArrayList<>()).add(outcome);
        }
        List<UsageSummaryItem> items = new ArrayList<>(grouped.size());
        grouped.forEach((key, rows) -> {
            long tokensIn = 0L;
            long tokensOut = 0L;
            BigDecimal cost = BigDecimal.ZERO;
            List<Integer> latencies = new ArrayList<>(rows.size());
            for (InteractionOutcomeEntity row : rows) {
                tokensIn += row.normalizedTokensIn();
                tokensOut += row.normalizedTokensOut();
                cost = cost.add(row.getActualCost() == null ? BigDecimal.ZERO : row.getActualCost());
                latencies.add(row.normalizedLatencyMs());
            }
            items.add(new UsageSummaryItem(key, rows.size(), tokensIn, tokensOut,
                    cost.setScale(6, RoundingMode.HALF_UP), p95(latencies)));
        });
        return items;
    }

    /**
     * 最近秩法求 p95。
     */
    public int p95(List<Integer> latencies) {
        if (latencies == null || latencies.isEmpty()) {
            return 0;
        }
        List<Integer> sorted = new ArrayList<>(latencies);
        sorted.sort(Comparator.naturalOrder());
        int rank = (int) Math.ceil(0.95D * sorted.size());
        return sorted.get(Math.max(rank - 1, 0));
    }

    public Map<String, Long> channelDistribution(List<RouteDecisionEntity> decisions) {
        Map<String, Long> distribution = new LinkedHashMap<>();
        for (RouteChannelEnum channel : RouteChannelEnum.values()) {
            distribution.put(channel.getCode(), 0L);
        }
        for (RouteDecisionEntity decision : safe(decisions)) {
            if (decision.getChosenChannel() != null) {
                distribution.merge(decision.getChosenChannel().getCode(), 1L, Long::sum);
            }
        }
        return distribution;
    }

    public double dedupRate(List<RouteDecisionEntity> decisions) {
        List<RouteDecisionEntity> rows = safe(decisions);
        if (rows.isEmpty()) {
            return 0D;
        }
        Set<String> distinct = new HashSet<>();
        int hashed = 0;
        for (RouteDecisionEntity decision : rows) {
            if (decision.getContentHash() != null) {
                distinct.add(decision.getContentHash());
                hashed++;
            }
        }
        if (hashed == 0) {
            return 0D;
        }
        return 1D - ((double) distinct.size() / hashed);
    }

    /**
     * 降级决策中请求模型与实际服务模型的成本差之和，按结果记录的 token 数计价。
     */
    public BigDecimal estimateSavings(List<RouteDecisionEntity> decisions,
                                      List<InteractionOutcomeEntity> outcomes,
                                      ModelCostCatalog catalog) {
        Map<Long, InteractionOutcomeEntity> outcomeByDecision = indexByDecision(outcomes);
        BigDecimal total = BigDecimal.ZERO;
        for (RouteDecisionEntity decision : safe(decisions)) {
            if (!decision.isDowngradedDecision()) {
                continue;
            }
            InteractionOutcomeEntity outcome = outcomeByDecision.get(decision.getId());
            if (outcome == null || Objects.equals(decision.getRequestedModel(), decision.getServedModel())) {
                continue;
            }
            BigDecimal requested = catalog.estimate(outcome.normalizedTokensIn(), outcome.normalizedTokensOut(),
                    decision.getRequestedModel());
            BigDecimal served = catalog.estimate(outcome.normalizedTokensIn(), outcome.normalizedTokensOut(),
                    decision.getServedModel());
            total = total.add(requested.subtract(served));
        }
        return total.setScale(4, RoundingMode.HALF_UP);
    }

    public List<UserEfficiency> userEfficiency(List<RouteDecisionEntity> decisions,
                                               List<InteractionOutcomeEntity> outcomes) {
        Map<Long, InteractionOutcomeEntity> outcomeByDecision = indexByDecision(outcomes);
        Map<String, long[]> counters = new TreeMap<>();
        for (RouteDecisionEntity decision : safe(decisions)) {
            InteractionOutcomeEntity outcome = outcomeByDecision.get(decision.getId());
            if (outcome == null) {
                continue;
            }
            long[] counter = counters.computeIfAbsent(userKey(decision.getUser()), key -> new long[2]);
            counter[0]++;
            if (!decision.isDowngradedDecision() && outcome.getObservedUtility() >= HIGH_VALUE_UTILITY) {
                counter[1]++;
            }
        }
        List<UserEfficiency> result = new ArrayList<>(counters.size());
        counters.forEach((user, counter) ->
                result.add(new UserEfficiency(user, counter[0], counter[1], (double) counter[1] / counter[0])));
        return result;
    }

    /**
     * 周建议：先是按偏离幅度降序的策略权重调整，再是基于决策分布的规则建议。
     */
    public List<WeeklyRecommendation> weeklyRecommendations(List<ChannelWeightEntity> weights,
                                                            List<RouteDecisionEntity> decisions,
                                                            List<InteractionOutcomeEntity> outcomes) {
        List<WeeklyRecommendation> recommendations = new ArrayList<>(weightRecommendations(weights));
        recommendations.addAll(ruleRecommendations(decisions, outcomes));
        return recommendations;
    }

    public String optimizeReportMarkdown(BigDecimal realizedSavings,
                                         BigDecimal totalCost,
                                         List<WeeklyRecommendation> recommendations) {
        BigDecimal potential = totalCost == null ? BigDecimal.ZERO : totalCost.multiply(POTENTIAL_SAVINGS_RATIO);
        StringBuilder markdown = new StringBuilder();
        markdown.append("# Prompt Route - ROI Report\n\n");
        markdown.append("**Estimated monthly savings:** $")
                .append(potential.setScale(2, RoundingMode.HALF_UP).toPlainString())
                .append("\n\n");
        markdown.append("**Realized savings from downgrades:** $")
                .append((realizedSavings == null ? BigDecimal.ZERO : realizedSavings)
                        .setScale(2, RoundingMode.HALF_UP).toPlainString())
                .append("\n\n");
        markdown.append("Recommendations:\n");
        if (recommendations == null || recommendations.isEmpty()) {
            markdown.append("- Downshift short Q&A to cheaper/local models\n");
            markdown.append("- Prefer web for freshness keywords\n");
            markdown.append("- Set agent threshold requiring action verbs\n");
        } else {
            for (WeeklyRecommendation recommendation : recommendations) {
                markdown.append("- ").append(recommendation.getAction()).append('\n');
            }
        }
        return markdown.toString();
    }

    private List<WeeklyRecommendation> weightRecommendations(List<ChannelWeightEntity> weights) {
        List<ChannelWeightEntity> drifted = new ArrayList<>();
        for (ChannelWeightEntity weight : safe(weights)) {
            if (weight.isOrgLevel() && Math.abs(weight.normalizedMultiplier() - Constants.DEFAULT_WEIGHT) >= WEIGHT_DRIFT_THRESHOLD) {
                drifted.add(weight);
            }
        }
        drifted.sort(Comparator
                .comparingDouble((ChannelWeightEntity weight) -> Math.abs(weight.normalizedMultiplier() - Constants.DEFAULT_WEIGHT))
                .reversed()
                .thenComparing(weight -> weight.getChannel().getTieBreakPriority()));
        List<WeeklyRecommendation> result = new ArrayList<>(drifted.size());
        for (ChannelWeightEntity weight : drifted) {
            double suggested = BigDecimal.valueOf(weight.normalizedMultiplier())
                    .setScale(2, RoundingMode.HALF_UP)
                    .doubleValue();
            boolean raise = weight.normalizedMultiplier() > Constants.DEFAULT_WEIGHT;
            result.add(WeeklyRecommendation.builder()
                    .type(WeeklyRecommendation.TYPE_POLICY_WEIGHT)
                    .rule("weight_" + weight.getChannel().getCode())
                    .channel(weight.getChannel().getCode())
                    .currentWeight(weight.normalizedMultiplier())
                    .suggestedWeight(suggested)
                    .action("Set policy weight for '" + weight.getChannel().getCode() + "' to " + suggested)
                    .reason(raise
                            ? "Team outcomes on this channel beat the default"
                            : "Team outcomes on this channel fall short of the default")
                    .build());
        }
        return result;
    }

    private List<WeeklyRecommendation> ruleRecommendations(List<RouteDecisionEntity> decisions,
                                                           List<InteractionOutcomeEntity> outcomes) {
        List<RouteDecisionEntity> rows = safe(decisions);
        List<WeeklyRecommendation> result = new ArrayList<>();
        if (rows.isEmpty()) {
            return result;
        }
        long simpleQa = rows.stream().filter(d -> d.hasRationale(RationaleTagEnum.SHORT_SINGLE_QUESTION)).count();
        long freshnessHits = rows.stream().filter(d -> d.hasRationale(RationaleTagEnum.FRESHNESS)).count();

        Map<Long, InteractionOutcomeEntity> outcomeByDecision = indexByDecision(outcomes);
        long agentWithOutcome = 0L;
        long agentLowValue = 0L;
        for (RouteDecisionEntity decision : rows) {
            InteractionOutcomeEntity outcome = outcomeByDecision.get(decision.getId());
            if (decision.getChosenChannel() != RouteChannelEnum.AGENT || outcome == null) {
                continue;
            }
            agentWithOutcome++;
            if (outcome.getObservedUtility() < HIGH_VALUE_UTILITY) {
                agentLowValue++;
            }
        }

        if ((double) simpleQa / rows.size() > SIMPLE_QA_RATIO_THRESHOLD) {
            result.add(rule("downshift_simple_qa",
                    "use gpt-3.5 or local tiny-llama for short single-question prompts",
                    "Short single questions make up a large share of prompts"));
        }
        if (freshnessHits > FRESHNESS_HITS_THRESHOLD) {
            result.add(rule("prefer_web_for_freshness",
                    "route 'latest/pricing/update/version' prompts to web first",
                    "Frequent freshness-sensitive prompts"));
        }
        if (agentWithOutcome > 0 && (double) agentLowValue / agentWithOutcome > AGENT_OVERUSE_THRESHOLD) {
            result.add(rule("agent_threshold",
                    "require 'plan/implement/deploy' verbs before agent route",
                    "Agent runs often end below neutral utility"));
        }
        return result;
    }

    private WeeklyRecommendation rule(String name, String action, String reason) {
        return WeeklyRecommendation.builder()
                .type(WeeklyRecommendation.TYPE_RULE)
                .rule(name)
                .action(action)
                .reason(reason)
                .build();
    }

    private String groupKey(InteractionOutcomeEntity outcome, UsageGroupByEnum groupBy) {
        UsageGroupByEnum resolved = groupBy == null ? UsageGroupByEnum.USER : groupBy;
        return switch (resolved) {
            case USER -> userKey(outcome.getUser());
            case CHANNEL -> outcome.getChannel() == null ? "unknown" : outcome.getChannel().getCode();
            case MODEL -> outcome.getModel() == null || outcome.getModel().isBlank() ? "unknown" : outcome.getModel();
        };
    }

    private String userKey(String user) {
        return user == null || user.isBlank() ? "unknown" : user;
    }

    private Map<Long, InteractionOutcomeEntity> indexByDecision(List<InteractionOutcomeEntity> outcomes) {
        Map<Long, InteractionOutcomeEntity> index = new HashMap<>();
        for (InteractionOutcomeEntity outcome : safe(outcomes)) {
            if (outcome.getDecisionId() != null) {
                index.putIfAbsent(outcome.getDecisionId(), outcome);
            }
        }
        return index;
    }

    private <T> List<T> safe(List<T> rows) {
        return rows == null ? List.of() : rows;
    }
}
