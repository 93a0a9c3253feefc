package com.promptroute.api.dto;

import lombok.Data;

/**
 * 预计算的 Prompt 特征。调用方不传原文时使用。
 */
@Data
public class PromptFeaturesDTO {

    private Boolean mentionsFreshness;
    private Boolean mentionsComparison;
    private Boolean mentionsImplementationVerb;
    private Boolean multiStepStructure;
    private Boolean singleQuestion;
    private Boolean hasCodeSelection;
    private Boolean recentSession;
    /** 0~1 */
    private Double questionAmbiguityScore;
    /** short / medium / long */
    private String lengthBucket;
    private String contentHash;
}
