package com.promptroute.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 交互结果的分类评价，映射为权重学习使用的效用值。
 */
public enum OutcomeRatingEnum {

    GOOD("good", 1.5D),

    NEUTRAL("neutral", 1.0D),

    BAD("bad", 0.5D);

    private final String code;
    private final double utility;

    OutcomeRatingEnum(String code, double utility) {
        this.code = code;
        this.utility = utility;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public double getUtility() {
        return utility;
    }

    public static OutcomeRatingEnum fromText(String text) {
        if (text == null || text.trim().isEmpty()) {
            return null;
        }
        String normalized = text.trim();
        for (OutcomeRatingEnum value : OutcomeRatingEnum.values()) {
            if (value.code.equalsIgnoreCase(normalized) || value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown outcome rating: " + text);
    }
}
