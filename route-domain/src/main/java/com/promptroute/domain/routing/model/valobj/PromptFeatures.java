package com.promptroute.domain.routing.model.valobj;

import com.promptroute.types.enums.LengthBucketEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Prompt 特征记录值对象。
 * <p>
 * 只包含由原文派生的布尔/标量信号与内容无关的哈希，不包含原文。
 * </p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PromptFeatures {

    private boolean mentionsFreshness;
    private boolean mentionsComparison;
    private boolean mentionsImplementationVerb;
    private boolean multiStepStructure;
    /** 0 表示明确，1 表示高度含糊 */
    private double questionAmbiguityScore;
    private boolean singleQuestion;
    private LengthBucketEnum lengthBucket;
    private boolean hasCodeSelection;
    private boolean recentSession;
    /** 规范化原文的 SHA-256，仅用于去重统计 */
    private String contentHash;

    public boolean shortPrompt() {
        return lengthBucket == LengthBucketEnum.SHORT;
    }
}
