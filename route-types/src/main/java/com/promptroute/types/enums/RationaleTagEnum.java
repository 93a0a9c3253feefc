package com.promptroute.types.enums;

import lombok.Getter;

/**
 * 路由决策依据标签，用于展示以及周建议生成。
 */
@Getter
public enum RationaleTagEnum {

    FRESHNESS("Fresh/volatile info -> web"),

    COMPARISON("Price or comparison lookup -> web"),

    IMPLEMENTATION_VERB("Implementation/tooling verbs -> agent"),

    MULTI_STEP("Multi-step structure -> agent"),

    CODE_SELECTION("Code selection present -> agent"),

    AMBIGUITY("Underspecified request -> ask"),

    SHORT_SINGLE_QUESTION("Short single question -> direct"),

    RECENT_SESSION("Continuing session context -> direct"),

    LEARNED_WEIGHT("Team learned weights changed the winner"),

    TIE_BREAK("Equal scores resolved by channel priority"),

    NO_STRONG_SIGNAL("No strong signals; direct or ask are safe defaults");

    private final String explanation;

    RationaleTagEnum(String explanation) {
        this.explanation = explanation;
    }
}
