package com.promptroute.domain.learning.model.valobj;

import com.promptroute.types.common.Constants;
import com.promptroute.types.enums.RouteChannelEnum;

/**
 * 权重单元键。user 为空串表示组织级单元。
 */
public record ChannelWeightKey(String organization, String user, RouteChannelEnum channel) {

    public ChannelWeightKey {
        if (organization == null || organization.isBlank()) {
            throw new IllegalArgumentException("organization cannot be blank");
        }
        if (channel == null) {
            throw new IllegalArgumentException("channel cannot be null");
        }
        organization = organization.trim();
        user = user == null ? Constants.ORG_LEVEL_USER : user.trim();
    }

    public static ChannelWeightKey orgLevel(String organization, RouteChannelEnum channel) {
        return new ChannelWeightKey(organization, Constants.ORG_LEVEL_USER, channel);
    }

    public boolean isOrgLevel() {
        return Constants.ORG_LEVEL_USER.equals(user);
    }

    public ChannelWeightKey toOrgLevel() {
        return isOrgLevel() ? this : orgLevel(organization, channel);
    }
}
