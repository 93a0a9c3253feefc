package com.promptroute.infrastructure.dao;

import com.promptroute.infrastructure.dao.po.InteractionOutcomePO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 交互结果 DAO。
 */
@Mapper
public interface InteractionOutcomeDao {

    /**
     * decision_id 冲突时不写入，返回 0。
     */
    int insertIfAbsent(InteractionOutcomePO po);

    int deleteByDecisionId(@Param("decisionId") Long decisionId);

    InteractionOutcomePO selectByDecisionId(@Param("decisionId") Long decisionId);

    List<InteractionOutcomePO> selectByOrganizationBetween(@Param("organization") String organization,
                                                           @Param("from") LocalDateTime from,
                                                           @Param("to") LocalDateTime to);
}
