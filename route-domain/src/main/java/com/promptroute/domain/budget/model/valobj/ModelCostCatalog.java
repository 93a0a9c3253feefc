package com.promptroute.domain.budget.model.valobj;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 模型价格目录。未知模型按 0 成本估算。
 */
public final class ModelCostCatalog {

    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1000L);

    private final Map<String, ModelPrice> prices;

    public ModelCostCatalog(Map<String, ModelPrice> prices) {
        this.prices = Collections.unmodifiableMap(prices == null ? new LinkedHashMap<>() : new LinkedHashMap<>(prices));
    }

    public ModelPrice priceOf(String model) {
        if (model == null) {
            return ModelPrice.FREE;
        }
        return prices.getOrDefault(model, ModelPrice.FREE);
    }

    public boolean contains(String model) {
        return model != null && prices.containsKey(model);
    }

    public BigDecimal estimate(int tokensIn, int tokensOut, String model) {
        ModelPrice price = priceOf(model);
        BigDecimal in = BigDecimal.valueOf(Math.max(tokensIn, 0)).multiply(price.inputPer1k());
        BigDecimal out = BigDecimal.valueOf(Math.max(tokensOut, 0)).multiply(price.outputPer1k());
        return in.add(out).divide(THOUSAND, 8, RoundingMode.HALF_UP);
    }

    public Map<String, ModelPrice> getPrices() {
        return prices;
    }
}
