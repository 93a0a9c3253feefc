package com.promptroute.domain.analytics.model.valobj;

import com.promptroute.types.enums.UsageGroupByEnum;
import lombok.Data;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 组织在一个计费周期内的用量汇总。
 */
@Data
public class UsageSummary {

    private String organization;
    private String period;
    private UsageGroupByEnum groupBy;
    private List<UsageSummaryItem> items = new ArrayList<>();
    private long totalDecisions;
    private long totalOutcomes;
    private BigDecimal totalCost = BigDecimal.ZERO;
    private Map<String, Long> channelDistribution = new LinkedHashMap<>();
    private long downgradedCount;
    private long blockedCount;
    private long degradedCount;
    /** 重复 Prompt 占比：1 - 去重后数量 / 总数 */
    private double dedupRate;
    private BigDecimal estimatedSavings = BigDecimal.ZERO;
    private List<UserEfficiency> userEfficiency = new ArrayList<>();
}
