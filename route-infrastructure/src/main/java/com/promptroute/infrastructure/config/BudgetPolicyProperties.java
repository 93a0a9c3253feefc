package com.promptroute.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 预算策略配置，前缀 route.budget。
 * <p>
 * policies 以组织为键；mode 取 observe / soft / hard，
 * monthly-limit 为空表示不设额度。
 * </p>
 */
@Data
@ConfigurationProperties(prefix = "route.budget")
public class BudgetPolicyProperties {

    private Map<String, Policy> policies = new LinkedHashMap<>();

    @Data
    public static class Policy {

        /** 月度额度（美元） */
        private BigDecimal monthlyLimit;

        /** 执行模式，默认 observe */
        private String mode = "observe";

        /** 告警阈值，默认 0.8 */
        private BigDecimal alertThreshold = new BigDecimal("0.8");

        /** 模型回退映射，单跳 */
        private Map<String, String> modelFallbacks = new LinkedHashMap<>();

        /** 通道回退映射，仅软限制降级时使用 */
        private Map<String, String> channelFallbacks = new LinkedHashMap<>();
    }
}
