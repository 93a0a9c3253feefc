package com.promptroute.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 预算执行模式。
 */
public enum BudgetModeEnum {

    /**
     * 只观察：始终放行，超过告警阈值时给出告警信号。
     */
    OBSERVE("observe"),

    /**
     * 软限制：超限后按回退映射降级，无映射时放行。
     */
    SOFT("soft"),

    /**
     * 硬限制：超限后拒绝。
     */
    HARD("hard");

    private final String code;

    BudgetModeEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static BudgetModeEnum fromText(String text) {
        if (text == null) {
            return null;
        }
        String normalized = text.trim();
        if (normalized.isEmpty()) {
            return null;
        }
        for (BudgetModeEnum value : BudgetModeEnum.values()) {
            if (value.code.equalsIgnoreCase(normalized) || value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown budget mode: " + text);
    }
}
