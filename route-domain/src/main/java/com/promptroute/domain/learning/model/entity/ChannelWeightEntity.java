package com.promptroute.domain.learning.model.entity;

import com.promptroute.domain.learning.model.valobj.ChannelWeightKey;
import com.promptroute.types.common.Constants;
import com.promptroute.types.enums.RouteChannelEnum;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 通道权重领域实体。只会原地更新，不会删除。
 */
@Data
public class ChannelWeightEntity {

    private Long id;
    private String organization;
    private String user;
    private RouteChannelEnum channel;
    private Double multiplier;
    private LocalDateTime updatedAt;

    public static ChannelWeightEntity of(ChannelWeightKey key, double multiplier, LocalDateTime updatedAt) {
        ChannelWeightEntity entity = new ChannelWeightEntity();
        entity.setOrganization(key.organization());
        entity.setUser(key.user());
        entity.setChannel(key.channel());
        entity.setMultiplier(multiplier);
        entity.setUpdatedAt(updatedAt);
        return entity;
    }

    public ChannelWeightKey key() {
        return new ChannelWeightKey(organization, user, channel);
    }

    public double normalizedMultiplier() {
        return multiplier == null ? Constants.DEFAULT_WEIGHT : multiplier;
    }

    public boolean isOrgLevel() {
        return user == null || Constants.ORG_LEVEL_USER.equals(user);
    }
}
