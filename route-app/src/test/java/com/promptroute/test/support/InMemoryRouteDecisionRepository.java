package com.promptroute.test.support;

import com.promptroute.domain.routing.adapter.repository.IRouteDecisionRepository;
import com.promptroute.domain.routing.model.entity.RouteDecisionEntity;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

public class InMemoryRouteDecisionRepository implements IRouteDecisionRepository {

    private final AtomicLong sequence = new AtomicLong();
    private final Map<Long, RouteDecisionEntity> rows = new ConcurrentHashMap<>();

    @Override
    public RouteDecisionEntity save(RouteDecisionEntity entity) {
        entity.validate();
        entity.setId(sequence.incrementAndGet());
        rows.put(entity.getId(), entity);
        return entity;
    }

    @Override
    public RouteDecisionEntity findById(Long id) {
        return id == null ? null : rows.get(id);
    }

    @Override
    public List<RouteDecisionEntity> findByOrganizationBetween(String organization, LocalDateTime from, LocalDateTime to) {
        return rows.values().stream()
                .filter(row -> row.getOrganization().equals(organization))
                .filter(row -> !row.getCreatedAt().isBefore(from) && row.getCreatedAt().isBefore(to))
                .sorted(Comparator.comparing(RouteDecisionEntity::getId))
                .collect(Collectors.toList());
    }

    public List<RouteDecisionEntity> all() {
        return new ArrayList<>(rows.values());
    }
}
