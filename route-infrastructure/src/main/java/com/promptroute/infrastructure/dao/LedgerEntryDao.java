package com.promptroute.infrastructure.dao;

import com.promptroute.infrastructure.dao.po.LedgerEntryPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

/**
 * 账本条目 DAO
 *
 * @author promptroute
 * @since 2026-10-01
 */
@Mapper
public interface LedgerEntryDao {

    /**
     * 按组织与周期查询
     */
    LedgerEntryPO selectByOrganizationAndPeriod(@Param("organization") String organization,
                                               @Param("period") String period);

    /**
     * 原子累加花费 (upsert)，返回累加后的行
     */
    LedgerEntryPO upsertAddSpend(LedgerEntryPO po);
}
