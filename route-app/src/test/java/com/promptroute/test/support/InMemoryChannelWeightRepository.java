package com.promptroute.test.support;

import com.promptroute.domain.learning.adapter.repository.IChannelWeightRepository;
import com.promptroute.domain.learning.model.entity.ChannelWeightEntity;
import com.promptroute.domain.learning.model.valobj.ChannelWeightKey;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.DoubleUnaryOperator;
import java.util.stream.Collectors;

/**
 * 以 ConcurrentHashMap.compute 实现单元级原子读-改-写。
 */
public class InMemoryChannelWeightRepository implements IChannelWeightRepository {

    private final Map<ChannelWeightKey, ChannelWeightEntity> cells = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryChannelWeightRepository(Clock clock) {
        this.clock = clock;
    }

    @Override
    public ChannelWeightEntity find(ChannelWeightKey key) {
        return cells.get(key);
    }

    @Override
    public List<ChannelWeightEntity> findByOrganization(String organization) {
        return cells.values().stream()
                .filter(cell -> cell.getOrganization().equals(organization))
                .collect(Collectors.toList());
    }

    @Override
    public ChannelWeightEntity updateAtomically(ChannelWeightKey key, double seed, DoubleUnaryOperator updater) {
        return cells.compute(key, (k, existing) -> {
            double old = existing == null ? seed : existing.normalizedMultiplier();
            return ChannelWeightEntity.of(k, updater.applyAsDouble(old), LocalDateTime.now(clock));
        });
    }

    public void put(ChannelWeightKey key, double multiplier) {
        cells.put(key, ChannelWeightEntity.of(key, multiplier, LocalDateTime.now(clock)));
    }
}
