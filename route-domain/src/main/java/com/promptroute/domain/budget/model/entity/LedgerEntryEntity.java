package com.promptroute.domain.budget.model.entity;

import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 账本条目：每个 (组织, 周期) 一条，周期内累计花费只增不减。
 */
@Data
public class LedgerEntryEntity {

    private Long id;
    private String organization;
    /** 计费周期，格式 yyyy-MM（UTC） */
    private String period;
    private BigDecimal cumulativeSpend;
    private LocalDateTime lastUpdated;

    public static LedgerEntryEntity empty(String organization, String period) {
        LedgerEntryEntity entity = new LedgerEntryEntity();
        entity.setOrganization(organization);
        entity.setPeriod(period);
        entity.setCumulativeSpend(BigDecimal.ZERO);
        return entity;
    }

    public BigDecimal normalizedSpend() {
        return cumulativeSpend == null ? BigDecimal.ZERO : cumulativeSpend;
    }
}
