package com.promptroute.domain.routing.service;

import com.promptroute.domain.routing.model.valobj.PromptFeatures;
import com.promptroute.domain.routing.model.valobj.RouteDecisionResult;
import com.promptroute.types.common.Constants;
import com.promptroute.types.enums.RationaleTagEnum;
import com.promptroute.types.enums.RouteChannelEnum;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 路由决策领域服务：规则分 × 学习权重取最大值，平局按 ask > direct > agent > web 决出。
 * <p>
 * 纯计算，不做任何 I/O。
 * </p>
 */
@Service
public class RoutingDecisionDomainService {

    /** 差值不超过该值的分数视为相同 */
    static final double TIE_EPSILON = 1e-9D;

    private final RuleScoringDomainService ruleScoringDomainService;

    public RoutingDecisionDomainService(RuleScoringDomainService ruleScoringDomainService) {
        this.ruleScoringDomainService = ruleScoringDomainService;
    }

    public RouteDecisionResult decide(PromptFeatures features,
                                      Map<RouteChannelEnum, Double> ruleScores,
                                      Map<RouteChannelEnum, Double> weights) {
        if (ruleScores == null || ruleScores.isEmpty()) {
            throw new IllegalStateException("Rule scores cannot be empty");
        }
        Map<RouteChannelEnum, Double> resolvedWeights = new EnumMap<>(RouteChannelEnum.class);
        Map<RouteChannelEnum, Double> finalScores = new EnumMap<>(RouteChannelEnum.class);
        for (RouteChannelEnum channel : RouteChannelEnum.values()) {
            double weight = weights == null ? Constants.DEFAULT_WEIGHT
                    : weights.getOrDefault(channel, Constants.DEFAULT_WEIGHT);
            resolvedWeights.put(channel, weight);
            finalScores.put(channel, ruleScores.getOrDefault(channel, 0D) * weight);
        }

        RouteChannelEnum chosen = argmax(finalScores);
        double top = finalScores.get(chosen);
        double second = secondBest(finalScores, chosen);

        RouteDecisionResult result = new RouteDecisionResult();
        result.setChosenChannel(chosen);
        result.setRuleScores(new EnumMap<>(ruleScores));
        result.setWeights(resolvedWeights);
        result.setFinalScores(finalScores);
        result.setConfidence(confidence(top, second));
        result.setRationale(rationale(features, chosen, argmax(ruleScores), top - second <= TIE_EPSILON));
        return result;
    }

    /**
     * 按平局优先级遍历，只有严格更大的分数才会替换当前候选。
     */
    public RouteChannelEnum argmax(Map<RouteChannelEnum, Double> scores) {
        RouteChannelEnum best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (RouteChannelEnum channel : RouteChannelEnum.inTieBreakOrder()) {
            double score = scores.getOrDefault(channel, 0D);
            if (best == null || score > bestScore + TIE_EPSILON) {
                best = channel;
                bestScore = score;
            }
        }
        return best;
    }

    /**
     * 各通道的使用建议。
     */
    public Map<String, Object> suggestionPack() {
        Map<String, Object> pack = new LinkedHashMap<>();
        pack.put(RouteChannelEnum.ASK.getCode(), List.of(
                "Goal & success metric?",
                "Constraints (budget, deadline, platform)?",
                "Inputs available (files, URLs, APIs)?"));
        pack.put(RouteChannelEnum.WEB.getCode(), "Prefer official docs and changelogs, newest first");
        pack.put(RouteChannelEnum.AGENT.getCode(), List.of(
                "Plan:\n1) Subtasks\n2) Tools\n3) Execute\n4) Verify\n5) Summarize",
                "Tools: web.search -> parse -> write.md / commit PR"));
        pack.put(RouteChannelEnum.DIRECT.getCode(), "Answer concisely with 3 bullets and a short example.");
        return pack;
    }

    private double secondBest(Map<RouteChannelEnum, Double> scores, RouteChannelEnum chosen) {
        double second = 0D;
        boolean found = false;
        for (Map.Entry<RouteChannelEnum, Double> entry : scores.entrySet()) {
            if (entry.getKey() == chosen) {
                continue;
            }
            if (!found || entry.getValue() > second) {
                second = entry.getValue();
                found = true;
            }
        }
        return second;
    }

    private double confidence(double top, double second) {
        if (top <= 0D) {
            return 0D;
        }
        return Math.max(0D, Math.min(1D, (top - second) / top));
    }

    private List<RationaleTagEnum> rationale(PromptFeatures features,
                                             RouteChannelEnum chosen,
                                             RouteChannelEnum ruleOnlyWinner,
                                             boolean tie) {
        List<RationaleTagEnum> tags = new ArrayList<>();
        if (features != null) {
            switch (chosen) {
                case WEB -> {
                    addIf(tags, features.isMentionsFreshness(), RationaleTagEnum.FRESHNESS);
                    addIf(tags, features.isMentionsComparison(), RationaleTagEnum.COMPARISON);
                }
                case AGENT -> {
                    addIf(tags, features.isMentionsImplementationVerb(), RationaleTagEnum.IMPLEMENTATION_VERB);
                    addIf(tags, features.isMultiStepStructure(), RationaleTagEnum.MULTI_STEP);
                    addIf(tags, features.isHasCodeSelection(), RationaleTagEnum.CODE_SELECTION);
                }
                case ASK -> addIf(tags, features.getQuestionAmbiguityScore() > 0D, RationaleTagEnum.AMBIGUITY);
                case DIRECT -> {
                    addIf(tags, ruleScoringDomainService.isShortFactualQuestion(features),
                            RationaleTagEnum.SHORT_SINGLE_QUESTION);
                    addIf(tags, features.isRecentSession(), RationaleTagEnum.RECENT_SESSION);
                }
                default -> {
                }
            }
        }
        if (tags.isEmpty()) {
            tags.add(RationaleTagEnum.NO_STRONG_SIGNAL);
        }
        addIf(tags, chosen != ruleOnlyWinner, RationaleTagEnum.LEARNED_WEIGHT);
        addIf(tags, tie, RationaleTagEnum.TIE_BREAK);
        return tags;
    }

    private void addIf(List<RationaleTagEnum> tags, boolean condition, RationaleTagEnum tag) {
        if (condition) {
            tags.add(tag);
        }
    }
}
