package com.promptroute.types.enums;

/**
 * 用量汇总的分组维度。
 */
public enum UsageGroupByEnum {

    USER,

    CHANNEL,

    MODEL;

    public static UsageGroupByEnum fromText(String text) {
        if (text == null || text.trim().isEmpty()) {
            return USER;
        }
        String normalized = text.trim();
        for (UsageGroupByEnum value : UsageGroupByEnum.values()) {
            if (value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown usage group: " + text);
    }
}
