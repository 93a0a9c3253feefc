package com.promptroute.api.dto;

import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * 路由建议结果 DTO。refused 为 true 时 channel 与 model 为空。
 */
@Data
public class SuggestRouteResponseDTO {

    private Long decisionId;
    /** 实际服务通道 */
    private String channel;
    /** 决策引擎选出的通道，降级前 */
    private String chosenChannel;
    private String model;
    private String requestedModel;
    private Double confidence;
    private List<String> rationale;
    private List<String> explanations;
    private Map<String, Double> ruleScores;
    private Map<String, Double> weights;
    private Map<String, Double> finalScores;
    private String directive;
    private String budgetState;
    private Boolean downgraded;
    private Boolean refused;
    private Boolean degraded;
    private Boolean alert;
    private String reason;
    private Map<String, Object> suggestions;
}
