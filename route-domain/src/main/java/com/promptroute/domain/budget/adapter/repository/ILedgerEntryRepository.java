package com.promptroute.domain.budget.adapter.repository;

import com.promptroute.domain.budget.model.entity.LedgerEntryEntity;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 账本仓储接口。
 */
public interface ILedgerEntryRepository {

    /**
     * 查询条目，不存在时返回 null。
     */
    LedgerEntryEntity find(String organization, String period);

    /**
     * 原子累加花费，条目不存在时创建。同一 (组织, 周期) 的调用必须串行化。
     *
     * @param amount 非负金额
     * @return 累加后的条目
     */
    LedgerEntryEntity addSpend(String organization, String period, BigDecimal amount, LocalDateTime updatedAt);
}
