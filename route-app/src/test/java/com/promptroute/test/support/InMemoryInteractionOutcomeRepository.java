package com.promptroute.test.support;

import com.promptroute.domain.routing.adapter.repository.IInteractionOutcomeRepository;
import com.promptroute.domain.routing.model.entity.InteractionOutcomeEntity;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

public class InMemoryInteractionOutcomeRepository implements IInteractionOutcomeRepository {

    private final AtomicLong sequence = new AtomicLong();
    /**
     * 以 decisionId 为键，putIfAbsent 模拟 interaction_outcomes.decision_id 唯一约束。
     */
    private final Map<Long, InteractionOutcomeEntity> rows = new ConcurrentHashMap<>();

    @Override
    public InteractionOutcomeEntity saveIfAbsent(InteractionOutcomeEntity entity) {
        entity.validate();
        entity.setId(sequence.incrementAndGet());
        if (rows.putIfAbsent(entity.getDecisionId(), entity) != null) {
            entity.setId(null);
            return null;
        }
        return entity;
    }

    @Override
    public boolean deleteByDecisionId(Long decisionId) {
        return rows.remove(decisionId) != null;
    }

    @Override
    public InteractionOutcomeEntity findByDecisionId(Long decisionId) {
        return rows.get(decisionId);
    }

    @Override
    public List<InteractionOutcomeEntity> findByOrganizationBetween(String organization, LocalDateTime from, LocalDateTime to) {
        return rows.values().stream()
                .filter(row -> row.getOrganization().equals(organization))
                .filter(row -> !row.getCreatedAt().isBefore(from) && row.getCreatedAt().isBefore(to))
                .sorted(Comparator.comparing(InteractionOutcomeEntity::getId))
                .collect(Collectors.toList());
    }

    public List<InteractionOutcomeEntity> all() {
        return new ArrayList<>(rows.values());
    }
}
