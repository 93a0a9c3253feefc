package com.promptroute.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 模型价格配置，前缀 route.cost，单位美元 / 1K tokens。配置项覆盖内置价格。
 */
@Data
@ConfigurationProperties(prefix = "route.cost")
public class ModelCostProperties {

    private Map<String, Price> models = new LinkedHashMap<>();

    @Data
    public static class Price {

        private BigDecimal input = BigDecimal.ZERO;

        private BigDecimal output = BigDecimal.ZERO;
    }
}
