package com.promptroute.api.dto;

import lombok.Data;

import java.math.BigDecimal;

/**
 * 路由建议请求 DTO。prompt 与 features 二选一，同时提供时以 prompt 为准。
 */
@Data
public class SuggestRouteRequestDTO {

    /**
     * 组织标识
     */
    private String organization;

    /**
     * 用户标识（可选）
     */
    private String user;

    /**
     * Prompt 原文，只用于特征提取，不落库
     */
    private String prompt;

    private Boolean hasCodeSelection;

    private Boolean recentSession;

    /**
     * 预计算特征
     */
    private PromptFeaturesDTO features;

    /**
     * 期望使用的模型
     */
    private String requestedModel;

    /**
     * 预估花费（美元），只用于告警判断
     */
    private BigDecimal estimatedCost;
}
