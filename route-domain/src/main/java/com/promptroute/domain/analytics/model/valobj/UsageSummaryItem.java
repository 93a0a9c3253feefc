package com.promptroute.domain.analytics.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 单个分组键的用量汇总。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UsageSummaryItem {

    private String key;
    private long requests;
    private long tokensIn;
    private long tokensOut;
    private BigDecimal costUsd;
    private int latencyMsP95;
}
