package com.promptroute.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 预算账本给出的执行指令类型。
 */
public enum DirectiveTypeEnum {

    ALLOW("allow"),

    DOWNGRADE("downgrade"),

    BLOCK("block");

    private final String code;

    DirectiveTypeEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static DirectiveTypeEnum fromText(String text) {
        if (text == null || text.trim().isEmpty()) {
            return null;
        }
        String normalized = text.trim();
        for (DirectiveTypeEnum value : DirectiveTypeEnum.values()) {
            if (value.code.equalsIgnoreCase(normalized) || value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown directive type: " + text);
    }
}
