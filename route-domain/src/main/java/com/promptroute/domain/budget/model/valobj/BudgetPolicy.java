package com.promptroute.domain.budget.model.valobj;

import com.promptroute.types.enums.BudgetModeEnum;
import com.promptroute.types.enums.RouteChannelEnum;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 组织预算策略，只读快照。
 */
@Value
@Builder(toBuilder = true)
public class BudgetPolicy {

    public static final BigDecimal DEFAULT_ALERT_THRESHOLD = new BigDecimal("0.8");

    String organization;
    /** 月度额度，为空表示没有额度感知 */
    BigDecimal monthlyLimit;
    BudgetModeEnum mode;
    BigDecimal alertThreshold;
    Map<String, String> modelFallbacks;
    Map<RouteChannelEnum, RouteChannelEnum> channelFallbacks;

    /**
     * 组织未配置策略时使用：只观察，没有额度。
     */
    public static BudgetPolicy observeOnly(String organization) {
        return BudgetPolicy.builder()
                .organization(organization)
                .mode(BudgetModeEnum.OBSERVE)
                .alertThreshold(DEFAULT_ALERT_THRESHOLD)
                .modelFallbacks(Collections.emptyMap())
                .channelFallbacks(Collections.emptyMap())
                .build();
    }

    public void validate() {
        if (organization == null || organization.isBlank()) {
            throw new IllegalStateException("Budget policy organization cannot be blank");
        }
        if (mode == null) {
            throw new IllegalStateException("Budget mode cannot be null: " + organization);
        }
        if (monthlyLimit != null && monthlyLimit.signum() <= 0) {
            throw new IllegalStateException("Monthly limit must be positive: " + organization);
        }
        if (alertThreshold == null
                || alertThreshold.signum() <= 0
                || alertThreshold.compareTo(BigDecimal.ONE) > 0) {
            throw new IllegalStateException("Alert threshold must be in (0,1]: " + organization);
        }
    }

    /**
     * 返回不可变副本，回退映射做防御性拷贝。
     */
    public BudgetPolicy frozen() {
        Map<RouteChannelEnum, RouteChannelEnum> channels = new EnumMap<>(RouteChannelEnum.class);
        if (channelFallbacks != null) {
            channels.putAll(channelFallbacks);
        }
        return toBuilder()
                .alertThreshold(alertThreshold == null ? DEFAULT_ALERT_THRESHOLD : alertThreshold)
                .modelFallbacks(Collections.unmodifiableMap(modelFallbacks == null
                        ? new LinkedHashMap<>() : new LinkedHashMap<>(modelFallbacks)))
                .channelFallbacks(Collections.unmodifiableMap(channels))
                .build();
    }

    /**
     * 单跳查找：不会继续追踪目标模型自身的回退。
     */
    public String modelFallbackFor(String model) {
        if (model == null || modelFallbacks == null) {
            return null;
        }
        return modelFallbacks.get(model);
    }

    public RouteChannelEnum channelFallbackFor(RouteChannelEnum channel) {
        if (channel == null || channelFallbacks == null) {
            return null;
        }
        return channelFallbacks.get(channel);
    }
}
