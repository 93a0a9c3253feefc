package com.promptroute.domain.routing.adapter.repository;

import com.promptroute.domain.routing.model.entity.RouteDecisionEntity;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 路由决策仓储接口。
 */
public interface IRouteDecisionRepository {

    RouteDecisionEntity save(RouteDecisionEntity entity);

    RouteDecisionEntity findById(Long id);

    /**
     * 查询组织在 [from, to) 区间内的决策。
     */
    List<RouteDecisionEntity> findByOrganizationBetween(String organization, LocalDateTime from, LocalDateTime to);
}
