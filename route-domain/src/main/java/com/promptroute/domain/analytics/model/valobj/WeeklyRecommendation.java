package com.promptroute.domain.analytics.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 周建议条目。type 为 policy_weight 时给出建议的策略权重，为 rule 时给出路由规则建议。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WeeklyRecommendation {

    public static final String TYPE_POLICY_WEIGHT = "policy_weight";
    public static final String TYPE_RULE = "rule";

    private String type;
    private String rule;
    private String channel;
    /** 当前生效的组织级学习权重 */
    private Double currentWeight;
    /** 建议固化的策略权重，保留两位小数 */
    private Double suggestedWeight;
    private String action;
    private String reason;
}
