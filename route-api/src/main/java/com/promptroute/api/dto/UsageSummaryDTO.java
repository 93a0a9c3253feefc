package com.promptroute.api.dto;

import lombok.Data;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * 用量汇总 DTO。
 */
@Data
public class UsageSummaryDTO {

    private String organization;
    private String period;
    private String groupBy;
    private List<UsageSummaryItemDTO> items;
    private Long totalDecisions;
    private Long totalOutcomes;
    private BigDecimal totalCost;
    private Map<String, Long> channelDistribution;
    private Long downgradedCount;
    private Long blockedCount;
    private Long degradedCount;
    private Double dedupRate;
    private BigDecimal estimatedSavings;
    private List<UserEfficiencyDTO> userEfficiency;
}
