package com.promptroute.domain.budget.model.valobj;

import java.math.BigDecimal;

/**
 * 模型单价，单位：美元 / 1K tokens。
 */
public record ModelPrice(BigDecimal inputPer1k, BigDecimal outputPer1k) {

    public static final ModelPrice FREE = new ModelPrice(BigDecimal.ZERO, BigDecimal.ZERO);

    public ModelPrice {
        inputPer1k = inputPer1k == null ? BigDecimal.ZERO : inputPer1k;
        outputPer1k = outputPer1k == null ? BigDecimal.ZERO : outputPer1k;
    }
}
