package com.promptroute.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Prompt 长度分桶。
 */
public enum LengthBucketEnum {

    /** 少于 280 个字符 */
    SHORT("short", 280),

    /** 少于 1200 个字符 */
    MEDIUM("medium", 1200),

    LONG("long", Integer.MAX_VALUE);

    private final String code;
    private final int upperBoundExclusive;

    LengthBucketEnum(String code, int upperBoundExclusive) {
        this.code = code;
        this.upperBoundExclusive = upperBoundExclusive;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static LengthBucketEnum ofLength(int length) {
        for (LengthBucketEnum value : values()) {
            if (length < value.upperBoundExclusive) {
                return value;
            }
        }
        return LONG;
    }

    public static LengthBucketEnum fromText(String text) {
        if (text == null || text.trim().isEmpty()) {
            return null;
        }
        String normalized = text.trim();
        for (LengthBucketEnum value : LengthBucketEnum.values()) {
            if (value.code.equalsIgnoreCase(normalized) || value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown length bucket: " + text);
    }
}
