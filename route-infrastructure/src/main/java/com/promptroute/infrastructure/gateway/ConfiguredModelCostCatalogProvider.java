package com.promptroute.infrastructure.gateway;

import com.promptroute.domain.budget.adapter.gateway.IModelCostCatalogProvider;
import com.promptroute.domain.budget.model.valobj.ModelCostCatalog;
import com.promptroute.domain.budget.model.valobj.ModelPrice;
import com.promptroute.infrastructure.config.ModelCostProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 模型价格目录提供者：内置常用模型价格，配置项 route.cost.models 可覆盖或追加。
 */
@Slf4j
@Component
@EnableConfigurationProperties(ModelCostProperties.class)
public class ConfiguredModelCostCatalogProvider implements IModelCostCatalogProvider {

    private final ModelCostCatalog catalog;

    public ConfiguredModelCostCatalogProvider(ModelCostProperties properties) {
        Map<String, ModelPrice> prices = defaults();
        if (properties != null && properties.getModels() != null) {
            properties.getModels().forEach((model, price) ->
                    prices.put(model, new ModelPrice(price.getInput(), price.getOutput())));
        }
        this.catalog = new ModelCostCatalog(prices);
        log.info("Model cost catalog loaded. models={}", prices.keySet());
    }

    @Override
    public ModelCostCatalog catalog() {
        return catalog;
    }

    static Map<String, ModelPrice> defaults() {
        Map<String, ModelPrice> prices = new LinkedHashMap<>();
        prices.put("openai/gpt-4o-mini", price("0.15", "0.60"));
        prices.put("openai/gpt-4o", price("2.50", "10.00"));
        prices.put("openai/gpt-3.5-turbo", price("0.50", "1.50"));
        prices.put("anthropic/claude-3-haiku", price("0.25", "1.25"));
        prices.put("local/tiny-llama", ModelPrice.FREE);
        return prices;
    }

    private static ModelPrice price(String input, String output) {
        return new ModelPrice(new BigDecimal(input), new BigDecimal(output));
    }
}
