package com.promptroute.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 账本条目 PO。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LedgerEntryPO {

    private Long id;
    private String organization;
    private String period;
    private BigDecimal cumulativeSpend;
    private LocalDateTime lastUpdated;
}
