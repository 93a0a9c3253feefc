package com.promptroute.domain.routing.adapter.repository;

import com.promptroute.domain.routing.model.entity.InteractionOutcomeEntity;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 交互结果仓储接口。
 */
public interface IInteractionOutcomeRepository {

    /**
     * 以决策 id 为唯一键写入结果记录，相当于认领该决策。
     *
     * @return 写入后的结果记录；该决策已有结果时不写入并返回 null
     */
    InteractionOutcomeEntity saveIfAbsent(InteractionOutcomeEntity entity);

    /**
     * 撤销决策的结果记录，账本提交失败时释放认领。
     */
    boolean deleteByDecisionId(Long decisionId);

    InteractionOutcomeEntity findByDecisionId(Long decisionId);

    /**
     * 查询组织在 [from, to) 区间内的交互结果。
     */
    List<InteractionOutcomeEntity> findByOrganizationBetween(String organization, LocalDateTime from, LocalDateTime to);
}
