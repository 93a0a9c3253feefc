package com.promptroute.infrastructure.repository.learning;

import com.promptroute.domain.learning.adapter.repository.IChannelWeightRepository;
import com.promptroute.domain.learning.model.entity.ChannelWeightEntity;
import com.promptroute.domain.learning.model.valobj.ChannelWeightKey;
import com.promptroute.infrastructure.dao.ChannelWeightDao;
import com.promptroute.infrastructure.dao.po.ChannelWeightPO;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.function.DoubleUnaryOperator;
import java.util.stream.Collectors;

/**
 * 通道权重仓储实现。
 * <p>
 * 原子更新依赖数据库行锁：先 INSERT ... ON CONFLICT DO NOTHING 确保行存在，
 * 再 SELECT ... FOR UPDATE 锁定后写回。
 * </p>
 */
@Repository
public class ChannelWeightRepositoryImpl implements IChannelWeightRepository {

    private final ChannelWeightDao channelWeightDao;
    private final Clock clock;

    public ChannelWeightRepositoryImpl(ChannelWeightDao channelWeightDao, Clock clock) {
        this.channelWeightDao = channelWeightDao;
        this.clock = clock;
    }

    @Override
    public ChannelWeightEntity find(ChannelWeightKey key) {
        ChannelWeightPO po = channelWeightDao.selectByKey(key.organization(), key.user(), key.channel());
        return po == null ? null : toEntity(po);
    }

    @Override
    public List<ChannelWeightEntity> findByOrganization(String organization) {
        return channelWeightDao.selectByOrganization(organization).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public ChannelWeightEntity updateAtomically(ChannelWeightKey key, double seed, DoubleUnaryOperator updater) {
        LocalDateTime now = LocalDateTime.now(clock);
        channelWeightDao.insertIfAbsent(ChannelWeightPO.builder()
                .organization(key.organization())
                .userKey(key.user())
                .channel(key.channel())
                .multiplier(seed)
                .updatedAt(now)
                .build());
        ChannelWeightPO locked = channelWeightDao.selectByKeyForUpdate(key.organization(), key.user(), key.channel());
        if (locked == null) {
            throw new IllegalStateException("Channel weight row missing after insert: " + key);
        }
        double current = locked.getMultiplier() == null ? seed : locked.getMultiplier();
        locked.setMultiplier(updater.applyAsDouble(current));
        locked.setUpdatedAt(now);
        channelWeightDao.updateMultiplier(locked);
        return toEntity(locked);
    }

    private ChannelWeightEntity toEntity(ChannelWeightPO po) {
        ChannelWeightEntity entity = new ChannelWeightEntity();
        entity.setId(po.getId());
        entity.setOrganization(po.getOrganization());
        entity.setUser(po.getUserKey());
        entity.setChannel(po.getChannel());
        entity.setMultiplier(po.getMultiplier());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }
}
