package com.promptroute.domain.routing.service;

import com.promptroute.domain.routing.model.valobj.PromptFeatures;
import com.promptroute.types.enums.RouteChannelEnum;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Map;

/**
 * 静态规则打分领域服务：特征加权求和后经 logistic 压缩到 (0,1)。
 * <p>
 * 每条规则只会抬高其对应通道的分数，输出对每个信号单调且无副作用。
 * </p>
 */
@Service
public class RuleScoringDomainService {

    static final double FRESHNESS_WEB = 1.2D;
    static final double COMPARISON_WEB = 0.4D;
    static final double IMPLEMENTATION_AGENT = 1.1D;
    static final double CODE_SELECTION_AGENT = 0.3D;
    static final double AMBIGUITY_ASK = 1.8D;
    static final double SHORT_QUESTION_DIRECT = 0.9D;
    static final double RECENT_SESSION_DIRECT = 0.2D;

    public Map<RouteChannelEnum, Double> score(PromptFeatures features) {
        Map<RouteChannelEnum, Double> raw = new EnumMap<>(RouteChannelEnum.class);
        for (RouteChannelEnum channel : RouteChannelEnum.values()) {
            raw.put(channel, 0D);
        }
        if (features.isMentionsFreshness()) {
            raw.merge(RouteChannelEnum.WEB, FRESHNESS_WEB, Double::sum);
        }
        if (features.isMentionsComparison()) {
            raw.merge(RouteChannelEnum.WEB, COMPARISON_WEB, Double::sum);
        }
        if (features.isMentionsImplementationVerb() || features.isMultiStepStructure()) {
            raw.merge(RouteChannelEnum.AGENT, IMPLEMENTATION_AGENT, Double::sum);
        }
        if (features.isHasCodeSelection()) {
            raw.merge(RouteChannelEnum.AGENT, CODE_SELECTION_AGENT, Double::sum);
        }
        raw.merge(RouteChannelEnum.ASK, AMBIGUITY_ASK * clampUnit(features.getQuestionAmbiguityScore()), Double::sum);
        if (isShortFactualQuestion(features)) {
            raw.merge(RouteChannelEnum.DIRECT, SHORT_QUESTION_DIRECT, Double::sum);
        }
        if (features.isRecentSession()) {
            raw.merge(RouteChannelEnum.DIRECT, RECENT_SESSION_DIRECT, Double::sum);
        }

        Map<RouteChannelEnum, Double> scores = new EnumMap<>(RouteChannelEnum.class);
        raw.forEach((channel, value) -> scores.put(channel, sigmoid(value)));
        return scores;
    }

    public boolean isShortFactualQuestion(PromptFeatures features) {
        return features.shortPrompt()
                && features.isSingleQuestion()
                && !features.isMentionsFreshness()
                && !features.isMentionsImplementationVerb();
    }

    private double clampUnit(double value) {
        if (Double.isNaN(value)) {
            return 0D;
        }
        return Math.max(0D, Math.min(1D, value));
    }

    private double sigmoid(double x) {
        return 1D / (1D + Math.exp(-x));
    }
}
