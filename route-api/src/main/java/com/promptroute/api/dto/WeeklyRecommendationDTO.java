package com.promptroute.api.dto;

import lombok.Data;

/**
 * 周建议 DTO。
 */
@Data
public class WeeklyRecommendationDTO {

    /** policy_weight / rule */
    private String type;
    private String rule;
    private String channel;
    private Double currentWeight;
    private Double suggestedWeight;
    private String action;
    private String reason;
}
