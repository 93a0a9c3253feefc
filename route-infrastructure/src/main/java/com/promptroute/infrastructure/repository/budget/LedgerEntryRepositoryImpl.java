package com.promptroute.infrastructure.repository.budget;

import com.promptroute.domain.budget.adapter.repository.ILedgerEntryRepository;
import com.promptroute.domain.budget.model.entity.LedgerEntryEntity;
import com.promptroute.infrastructure.dao.LedgerEntryDao;
import com.promptroute.infrastructure.dao.po.LedgerEntryPO;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 账本仓储实现。累加通过单条 upsert 语句完成，行级原子。
 */
@Repository
public class LedgerEntryRepositoryImpl implements ILedgerEntryRepository {

    private final LedgerEntryDao ledgerEntryDao;

    public LedgerEntryRepositoryImpl(LedgerEntryDao ledgerEntryDao) {
        this.ledgerEntryDao = ledgerEntryDao;
    }

    @Override
    public LedgerEntryEntity find(String organization, String period) {
        LedgerEntryPO po = ledgerEntryDao.selectByOrganizationAndPeriod(organization, period);
        return po == null ? null : toEntity(po);
    }

    @Override
    public LedgerEntryEntity addSpend(String organization, String period, BigDecimal amount, LocalDateTime updatedAt) {
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("Ledger amount cannot be negative");
        }
        LedgerEntryPO po = ledgerEntryDao.upsertAddSpend(LedgerEntryPO.builder()
                .organization(organization)
                .period(period)
                .cumulativeSpend(amount)
                .lastUpdated(updatedAt)
                .build());
        return toEntity(po);
    }

    private LedgerEntryEntity toEntity(LedgerEntryPO po) {
        LedgerEntryEntity entity = new LedgerEntryEntity();
        entity.setId(po.getId());
        entity.setOrganization(po.getOrganization());
        entity.setPeriod(po.getPeriod());
        entity.setCumulativeSpend(po.getCumulativeSpend());
        entity.setLastUpdated(po.getLastUpdated());
        return entity;
    }
}
