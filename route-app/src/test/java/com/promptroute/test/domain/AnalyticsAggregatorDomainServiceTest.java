package com.promptroute.test.domain;

import com.promptroute.domain.analytics.model.valobj.UsageSummaryItem;
import com.promptroute.domain.analytics.model.valobj.UserEfficiency;
import com.promptroute.domain.analytics.model.valobj.WeeklyRecommendation;
import com.promptroute.domain.analytics.service.AnalyticsAggregatorDomainService;
import com.promptroute.domain.budget.model.valobj.ModelCostCatalog;
import com.promptroute.domain.budget.model.valobj.ModelPrice;
import com.promptroute.domain.learning.model.entity.ChannelWeightEntity;
import com.promptroute.domain.learning.model.valobj.ChannelWeightKey;
import com.promptroute.domain.routing.model.entity.InteractionOutcomeEntity;
import com.promptroute.domain.routing.model.entity.RouteDecisionEntity;
import com.promptroute.types.enums.RationaleTagEnum;
import com.promptroute.types.enums.RouteChannelEnum;
import com.promptroute.types.enums.UsageGroupByEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

public class AnalyticsAggregatorDomainServiceTest {

    private final AnalyticsAggregatorDomainService service = new AnalyticsAggregatorDomainService();

    private final ModelCostCatalog catalog = new ModelCostCatalog(Map.of(
            "openai/gpt-4o", new ModelPrice(new BigDecimal("2.50"), new BigDecimal("10.00")),
            "openai/gpt-4o-mini", new ModelPrice(new BigDecimal("0.15"), new BigDecimal("0.60"))));

    @Test
    public void shouldComputeNearestRankP95() {
        List<Integer> latencies = IntStream.rangeClosed(1, 20).boxed().collect(Collectors.toList());

        Assertions.assertEquals(19, service.p95(latencies));
        Assertions.assertEquals(100, service.p95(List.of(100)));
        Assertions.assertEquals(0, service.p95(List.of()));
    }

    @Test
    public void shouldSummarizeByChannel() {
        List<InteractionOutcomeEntity> outcomes = List.of(
                outcome(1L, "alice", RouteChannelEnum.WEB, "openai/gpt-4o", 1.0D, "0.10", 100, 50, 300),
                outcome(2L, "bob", RouteChannelEnum.WEB, "openai/gpt-4o", 1.5D, "0.20", 200, 100, 500),
                outcome(3L, "alice", RouteChannelEnum.AGENT, "openai/gpt-4o-mini", 0.5D, "0.05", 10, 10, 900));

        List<UsageSummaryItem> items = service.summarize(outcomes, UsageGroupByEnum.CHANNEL);

        Assertions.assertEquals(2, items.size());
        UsageSummaryItem agent = items.get(0);
        UsageSummaryItem web = items.get(1);
        Assertions.assertEquals("agent", agent.getKey());
        Assertions.assertEquals("web", web.getKey());
        Assertions.assertEquals(2L, web.getRequests());
        Assertions.assertEquals(300L, web.getTokensIn());
        Assertions.assertEquals(0, new BigDecimal("0.30").compareTo(web.getCostUsd()));
        Assertions.assertEquals(500, web.getLatencyMsP95());
    }

    @Test
    public void shouldEstimateSavingsFromDowngradedDecisionsOnly() {
        RouteDecisionEntity downgraded = decision(1L, "alice", RouteChannelEnum.WEB, "h1");
        downgraded.setDowngraded(true);
        downgraded.setRequestedModel("openai/gpt-4o");
        downgraded.setServedModel("openai/gpt-4o-mini");
        RouteDecisionEntity normal = decision(2L, "alice", RouteChannelEnum.WEB, "h2");
        normal.setRequestedModel("openai/gpt-4o");
        normal.setServedModel("openai/gpt-4o");
        RouteDecisionEntity noOutcome = decision(3L, "alice", RouteChannelEnum.WEB, "h3");
        noOutcome.setDowngraded(true);
        noOutcome.setRequestedModel("openai/gpt-4o");
        noOutcome.setServedModel("openai/gpt-4o-mini");

        BigDecimal savings = service.estimateSavings(List.of(downgraded, normal, noOutcome), List.of(
                outcome(1L, "alice", RouteChannelEnum.WEB, "openai/gpt-4o-mini", 1.0D, "0.00075", 1000, 1000, 10),
                outcome(2L, "alice", RouteChannelEnum.WEB, "openai/gpt-4o", 1.0D, "0.0125", 1000, 1000, 10)), catalog);

        Assertions.assertEquals(0, new BigDecimal("11.75").compareTo(savings));
    }

    @Test
    public void shouldScoreUserEfficiency() {
        RouteDecisionEntity good = decision(1L, "alice", RouteChannelEnum.DIRECT, "h1");
        RouteDecisionEntity downgraded = decision(2L, "alice", RouteChannelEnum.DIRECT, "h2");
        downgraded.setDowngraded(true);
        RouteDecisionEntity poor = decision(3L, "bob", RouteChannelEnum.AGENT, "h3");

        List<UserEfficiency> efficiency = service.userEfficiency(List.of(good, downgraded, poor), List.of(
                outcome(1L, "alice", RouteChannelEnum.DIRECT, "m", 1.5D, "0", 0, 0, 0),
                outcome(2L, "alice", RouteChannelEnum.DIRECT, "m", 1.5D, "0", 0, 0, 0),
                outcome(3L, "bob", RouteChannelEnum.AGENT, "m", 0.5D, "0", 0, 0, 0)));

        Assertions.assertEquals(2, efficiency.size());
        Assertions.assertEquals("alice", efficiency.get(0).getUser());
        Assertions.assertEquals(0.5D, efficiency.get(0).getEfficiencyScore(), 1e-12);
        Assertions.assertEquals(0D, efficiency.get(1).getEfficiencyScore(), 1e-12);
    }

    @Test
    public void shouldComputeDedupRateAndChannelDistribution() {
        List<RouteDecisionEntity> decisions = List.of(
                decision(1L, "alice", RouteChannelEnum.WEB, "a"),
                decision(2L, "alice", RouteChannelEnum.WEB, "a"),
                decision(3L, "bob", RouteChannelEnum.ASK, "b"),
                decision(4L, "bob", RouteChannelEnum.ASK, null));

        Assertions.assertEquals(1D / 3D, service.dedupRate(decisions), 1e-12);
        Map<String, Long> distribution = service.channelDistribution(decisions);
        Assertions.assertEquals(2L, distribution.get("web"));
        Assertions.assertEquals(2L, distribution.get("ask"));
        Assertions.assertEquals(0L, distribution.get("agent"));
    }

    @Test
    public void shouldOrderWeightRecommendationsByDeviationBeforeRuleSuggestions() {
        List<ChannelWeightEntity> weights = List.of(
                weight("", RouteChannelEnum.AGENT, 0.8D),
                weight("", RouteChannelEnum.WEB, 1.5D),
                weight("", RouteChannelEnum.ASK, 1.05D),
                weight("alice", RouteChannelEnum.DIRECT, 1.9D));
        List<RouteDecisionEntity> decisions = new ArrayList<>();
        for (long id = 1; id <= 4; id++) {
            RouteDecisionEntity decision = decision(id, "alice", RouteChannelEnum.DIRECT, "h" + id);
            decision.getRationale().add(RationaleTagEnum.SHORT_SINGLE_QUESTION);
            decisions.add(decision);
        }
        decisions.add(decision(5L, "bob", RouteChannelEnum.AGENT, "h5"));

        List<WeeklyRecommendation> recommendations = service.weeklyRecommendations(weights, decisions,
                List.of(outcome(5L, "bob", RouteChannelEnum.AGENT, "m", 0.5D, "0", 0, 0, 0)));

        Assertions.assertEquals(List.of("weight_web", "weight_agent", "downshift_simple_qa", "agent_threshold"),
                recommendations.stream().map(WeeklyRecommendation::getRule).collect(Collectors.toList()));
        Assertions.assertEquals(1.5D, recommendations.get(0).getSuggestedWeight());
        Assertions.assertEquals(WeeklyRecommendation.TYPE_POLICY_WEIGHT, recommendations.get(0).getType());
        Assertions.assertEquals(WeeklyRecommendation.TYPE_RULE, recommendations.get(2).getType());
    }

    @Test
    public void shouldReportLiveMultiplierAsCurrentWeight() {
        List<WeeklyRecommendation> recommendations = service.weeklyRecommendations(
                List.of(weight("", RouteChannelEnum.AGENT, 0.7368D)), List.of(), List.of());

        Assertions.assertEquals(1, recommendations.size());
        Assertions.assertEquals(0.7368D, recommendations.get(0).getCurrentWeight(), 1e-12);
        Assertions.assertEquals(0.74D, recommendations.get(0).getSuggestedWeight(), 1e-12);
        Assertions.assertEquals("Set policy weight for 'agent' to 0.74", recommendations.get(0).getAction());
    }

    @Test
    public void shouldRenderOptimizeReport() {
        String markdown = service.optimizeReportMarkdown(new BigDecimal("1.234"), new BigDecimal("100"), List.of());

        Assertions.assertTrue(markdown.startsWith("# Prompt Route - ROI Report"));
        Assertions.assertTrue(markdown.contains("**Estimated monthly savings:** $25.00"));
        Assertions.assertTrue(markdown.contains("**Realized savings from downgrades:** $1.23"));
        Assertions.assertTrue(markdown.contains("- Prefer web for freshness keywords"));
    }

    private RouteDecisionEntity decision(Long id, String user, RouteChannelEnum channel, String hash) {
        RouteDecisionEntity decision = new RouteDecisionEntity();
        decision.setId(id);
        decision.setOrganization("acme");
        decision.setUser(user);
        decision.setChosenChannel(channel);
        decision.setContentHash(hash);
        return decision;
    }

    private InteractionOutcomeEntity outcome(Long decisionId, String user, RouteChannelEnum channel, String model,
                                             double utility, String cost, int tokensIn, int tokensOut, int latencyMs) {
        InteractionOutcomeEntity outcome = new InteractionOutcomeEntity();
        outcome.setDecisionId(decisionId);
        outcome.setOrganization("acme");
        outcome.setUser(user);
        outcome.setChannel(channel);
        outcome.setModel(model);
        outcome.setObservedUtility(utility);
        outcome.setActualCost(new BigDecimal(cost));
        outcome.setTokensIn(tokensIn);
        outcome.setTokensOut(tokensOut);
        outcome.setLatencyMs(latencyMs);
        return outcome;
    }

    private ChannelWeightEntity weight(String user, RouteChannelEnum channel, double multiplier) {
        return ChannelWeightEntity.of(new ChannelWeightKey("acme", user, channel), multiplier, null);
    }
}
