package com.promptroute.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * 路由通道。
 * <p>
 * tieBreakPriority 越小越优先：分数相同时依次选择 ask、direct、agent、web，
 * 即优先更便宜、风险更低的通道。
 * </p>
 */
public enum RouteChannelEnum {

    /**
     * 联网检索。
     */
    WEB("web", 3),

    /**
     * 自主 Agent 执行。
     */
    AGENT("agent", 2),

    /**
     * 反问澄清。
     */
    ASK("ask", 0),

    /**
     * 直接回答。
     */
    DIRECT("direct", 1);

    private final String code;
    private final int tieBreakPriority;

    RouteChannelEnum(String code, int tieBreakPriority) {
        this.code = code;
        this.tieBreakPriority = tieBreakPriority;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public int getTieBreakPriority() {
        return tieBreakPriority;
    }

    /**
     * 按平局优先级排序后的通道列表。
     */
    public static List<RouteChannelEnum> inTieBreakOrder() {
        return Arrays.stream(values())
                .sorted(Comparator.comparingInt(RouteChannelEnum::getTieBreakPriority))
                .toList();
    }

    public static RouteChannelEnum fromText(String text) {
        if (text == null) {
            return null;
        }
        String normalized = text.trim();
        if (normalized.isEmpty()) {
            return null;
        }
        for (RouteChannelEnum value : RouteChannelEnum.values()) {
            if (value.code.equalsIgnoreCase(normalized) || value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown route channel: " + text);
    }
}
