package com.promptroute.infrastructure.repository.routing;

import com.promptroute.domain.routing.adapter.repository.IInteractionOutcomeRepository;
import com.promptroute.domain.routing.model.entity.InteractionOutcomeEntity;
import com.promptroute.infrastructure.dao.InteractionOutcomeDao;
import com.promptroute.infrastructure.dao.po.InteractionOutcomePO;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 交互结果仓储实现。
 */
@Repository
public class InteractionOutcomeRepositoryImpl implements IInteractionOutcomeRepository {

    private final InteractionOutcomeDao interactionOutcomeDao;

    public InteractionOutcomeRepositoryImpl(InteractionOutcomeDao interactionOutcomeDao) {
        this.interactionOutcomeDao = interactionOutcomeDao;
    }

    @Override
    public InteractionOutcomeEntity saveIfAbsent(InteractionOutcomeEntity entity) {
        entity.validate();
        InteractionOutcomePO po = toPO(entity);
        if (interactionOutcomeDao.insertIfAbsent(po) == 0) {
            return null;
        }
        return toEntity(po);
    }

    @Override
    public boolean deleteByDecisionId(Long decisionId) {
        return interactionOutcomeDao.deleteByDecisionId(decisionId) > 0;
    }

    @Override
    public InteractionOutcomeEntity findByDecisionId(Long decisionId) {
        InteractionOutcomePO po = interactionOutcomeDao.selectByDecisionId(decisionId);
        return po == null ? null : toEntity(po);
    }

    @Override
    public List<InteractionOutcomeEntity> findByOrganizationBetween(String organization,
                                                                   LocalDateTime from,
                                                                   LocalDateTime to) {
        return interactionOutcomeDao.selectByOrganizationBetween(organization, from, to).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    private InteractionOutcomeEntity toEntity(InteractionOutcomePO po) {
        InteractionOutcomeEntity entity = new InteractionOutcomeEntity();
        entity.setId(po.getId());
        entity.setDecisionId(po.getDecisionId());
        entity.setOrganization(po.getOrganization());
        entity.setUser(po.getUserKey());
        entity.setChannel(po.getChannel());
        entity.setModel(po.getModel());
        entity.setObservedUtility(po.getObservedUtility());
        entity.setActualCost(po.getActualCost());
        entity.setTokensIn(po.getTokensIn());
        entity.setTokensOut(po.getTokensOut());
        entity.setLatencyMs(po.getLatencyMs());
        entity.setCreatedAt(po.getCreatedAt());
        return entity;
    }

    private InteractionOutcomePO toPO(InteractionOutcomeEntity entity) {
        return InteractionOutcomePO.builder()
                .id(entity.getId())
                .decisionId(entity.getDecisionId())
                .organization(entity.getOrganization())
                .userKey(StringUtils.defaultString(entity.getUser()))
                .channel(entity.getChannel())
                .model(entity.getModel())
                .observedUtility(entity.getObservedUtility())
                .actualCost(entity.getActualCost())
                .tokensIn(entity.getTokensIn())
                .tokensOut(entity.getTokensOut())
                .latencyMs(entity.getLatencyMs())
                .createdAt(entity.getCreatedAt())
                .build();
    }
}
