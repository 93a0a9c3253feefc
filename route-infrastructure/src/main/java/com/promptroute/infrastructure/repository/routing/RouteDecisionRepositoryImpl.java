package com.promptroute.infrastructure.repository.routing;

import com.promptroute.domain.routing.adapter.repository.IRouteDecisionRepository;
import com.promptroute.domain.routing.model.entity.RouteDecisionEntity;
import com.promptroute.infrastructure.dao.RouteDecisionDao;
import com.promptroute.infrastructure.dao.po.RouteDecisionPO;
import com.promptroute.infrastructure.util.JsonCodec;
import com.promptroute.types.enums.RationaleTagEnum;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 路由决策仓储实现。
 */
@Repository
public class RouteDecisionRepositoryImpl implements IRouteDecisionRepository {

    private final RouteDecisionDao routeDecisionDao;
    private final JsonCodec jsonCodec;

    public RouteDecisionRepositoryImpl(RouteDecisionDao routeDecisionDao,
                                       JsonCodec jsonCodec) {
        this.routeDecisionDao = routeDecisionDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public RouteDecisionEntity save(RouteDecisionEntity entity) {
        entity.validate();
        RouteDecisionPO po = toPO(entity);
        routeDecisionDao.insert(po);
        return toEntity(po);
    }

    @Override
    public RouteDecisionEntity findById(Long id) {
        RouteDecisionPO po = routeDecisionDao.selectById(id);
        return po == null ? null : toEntity(po);
    }

    @Override
    public List<RouteDecisionEntity> findByOrganizationBetween(String organization, LocalDateTime from, LocalDateTime to) {
        return routeDecisionDao.selectByOrganizationBetween(organization, from, to).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    private RouteDecisionEntity toEntity(RouteDecisionPO po) {
        RouteDecisionEntity entity = new RouteDecisionEntity();
        entity.setId(po.getId());
        entity.setEventId(po.getEventId());
        entity.setOrganization(po.getOrganization());
        entity.setUser(po.getUserKey());
        entity.setContentHash(po.getContentHash());
        entity.setChosenChannel(po.getChosenChannel());
        entity.setRuleScores(jsonCodec.readChannelScores(po.getRuleScores()));
        entity.setWeights(jsonCodec.readChannelScores(po.getWeights()));
        entity.setFinalScores(jsonCodec.readChannelScores(po.getFinalScores()));
        entity.setConfidence(po.getConfidence());
        entity.setRationale(readRationale(po.getRationale()));
        entity.setDirective(po.getDirective());
        entity.setBudgetState(po.getBudgetState());
        entity.setRequestedModel(po.getRequestedModel());
        entity.setServedModel(po.getServedModel());
        entity.setServedChannel(po.getServedChannel());
        entity.setDowngraded(po.getDowngraded());
        entity.setBlocked(po.getBlocked());
        entity.setDegraded(po.getDegraded());
        entity.setAlert(po.getAlert());
        entity.setCreatedAt(po.getCreatedAt());
        return entity;
    }

    private RouteDecisionPO toPO(RouteDecisionEntity entity) {
        RouteDecisionPO po = RouteDecisionPO.builder()
                .id(entity.getId())
                .eventId(entity.getEventId())
                .organization(entity.getOrganization())
                .userKey(StringUtils.defaultString(entity.getUser()))
                .contentHash(entity.getContentHash())
                .chosenChannel(entity.getChosenChannel())
                .confidence(entity.getConfidence())
                .directive(entity.getDirective())
                .budgetState(entity.getBudgetState())
                .requestedModel(entity.getRequestedModel())
                .servedModel(entity.getServedModel())
                .servedChannel(entity.getServedChannel())
                .downgraded(entity.getDowngraded())
                .blocked(entity.getBlocked())
                .degraded(entity.getDegraded())
                .alert(entity.getAlert())
                .createdAt(entity.getCreatedAt())
                .build();
        po.setRuleScores(jsonCodec.writeChannelScores(entity.getRuleScores()));
        po.setWeights(jsonCodec.writeChannelScores(entity.getWeights()));
        po.setFinalScores(jsonCodec.writeChannelScores(entity.getFinalScores()));
        po.setRationale(jsonCodec.writeValue(entity.getRationale() == null ? null
                : entity.getRationale().stream().map(RationaleTagEnum::name).collect(Collectors.toList())));
        return po;
    }

    private List<RationaleTagEnum> readRationale(String json) {
        List<String> names = jsonCodec.readStringList(json);
        List<RationaleTagEnum> tags = new ArrayList<>();
        if (names != null) {
            names.forEach(name -> tags.add(RationaleTagEnum.valueOf(name)));
        }
        return tags;
    }
}
