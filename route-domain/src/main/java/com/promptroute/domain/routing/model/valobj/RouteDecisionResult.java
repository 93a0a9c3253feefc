package com.promptroute.domain.routing.model.valobj;

import com.promptroute.types.enums.RationaleTagEnum;
import com.promptroute.types.enums.RouteChannelEnum;
import lombok.Data;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 路由决策计算结果值对象。
 */
@Data
public class RouteDecisionResult {

    private RouteChannelEnum chosenChannel;
    private Map<RouteChannelEnum, Double> ruleScores = new EnumMap<>(RouteChannelEnum.class);
    private Map<RouteChannelEnum, Double> weights = new EnumMap<>(RouteChannelEnum.class);
    private Map<RouteChannelEnum, Double> finalScores = new EnumMap<>(RouteChannelEnum.class);
    private double confidence;
    private List<RationaleTagEnum> rationale = new ArrayList<>();

    public List<String> explanations() {
        List<String> lines = new ArrayList<>(rationale.size());
        for (RationaleTagEnum tag : rationale) {
            lines.add(tag.getExplanation());
        }
        return lines;
    }

    /**
     * 按最终分数降序排列的通道，分数相同按平局优先级。
     */
    public List<RouteChannelEnum> ranking() {
        List<RouteChannelEnum> ordered = new ArrayList<>(RouteChannelEnum.inTieBreakOrder());
        ordered.sort((left, right) -> Double.compare(
                finalScores.getOrDefault(right, 0D),
                finalScores.getOrDefault(left, 0D)));
        return ordered;
    }
}
