package com.promptroute.api.dto;

import lombok.Data;

import java.math.BigDecimal;

/**
 * ROI 优化报告 DTO，正文为 Markdown。
 */
@Data
public class OptimizeReportDTO {

    private String organization;
    private String period;
    private BigDecimal totalCost;
    private BigDecimal realizedSavings;
    private String markdown;
}
