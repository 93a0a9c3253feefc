package com.promptroute.trigger.application.command;

import com.promptroute.domain.learning.adapter.repository.IChannelWeightRepository;
import com.promptroute.domain.learning.model.entity.ChannelWeightEntity;
import com.promptroute.domain.learning.model.valobj.ChannelWeightKey;
import com.promptroute.domain.learning.service.ChannelWeightDomainService;
import com.promptroute.types.common.Constants;
import com.promptroute.types.enums.RouteChannelEnum;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 权重存储用例：查找链读取与 EMA 反馈写入。
 * <p>
 * 读取顺序为用户级单元、组织级单元、缺省值 1.0。
 * 反馈时用户单元以查找链上的有效值为初值，组织单元以自身值为初值，
 * 两者各自做单元级原子读-改-写。
 * </p>
 */
@Slf4j
@Service
public class ChannelWeightStoreService {

    private final IChannelWeightRepository channelWeightRepository;
    private final ChannelWeightDomainService channelWeightDomainService;
    private final double learningRate;

    public ChannelWeightStoreService(IChannelWeightRepository channelWeightRepository,
                                     ChannelWeightDomainService channelWeightDomainService,
                                     @Value("${route.learning.rate:0.2}") double learningRate) {
        this.channelWeightRepository = channelWeightRepository;
        this.channelWeightDomainService = channelWeightDomainService;
        this.learningRate = channelWeightDomainService.normalizeLearningRate(learningRate);
    }

    public double getWeight(String organization, String user, RouteChannelEnum channel) {
        ChannelWeightEntity userCell = StringUtils.isBlank(user)
                ? null
                : channelWeightRepository.find(new ChannelWeightKey(organization, user, channel));
        ChannelWeightEntity orgCell = channelWeightRepository.find(ChannelWeightKey.orgLevel(organization, channel));
        return channelWeightDomainService.resolveEffective(userCell, orgCell);
    }

    /**
     * 一次读取组织下全部单元，解析出每个通道的有效权重。
     */
    public Map<RouteChannelEnum, Double> getWeights(String organization, String user) {
        String normalizedUser = StringUtils.trimToEmpty(user);
        List<ChannelWeightEntity> cells = channelWeightRepository.findByOrganization(organization);
        Map<RouteChannelEnum, ChannelWeightEntity> userCells = new HashMap<>();
        Map<RouteChannelEnum, ChannelWeightEntity> orgCells = new HashMap<>();
        for (ChannelWeightEntity cell : cells) {
            if (cell.isOrgLevel()) {
                orgCells.put(cell.getChannel(), cell);
            } else if (!normalizedUser.isEmpty() && normalizedUser.equals(cell.getUser())) {
                userCells.put(cell.getChannel(), cell);
            }
        }
        Map<RouteChannelEnum, Double> weights = new EnumMap<>(RouteChannelEnum.class);
        for (RouteChannelEnum channel : RouteChannelEnum.values()) {
            weights.put(channel, channelWeightDomainService.resolveEffective(userCells.get(channel), orgCells.get(channel)));
        }
        return weights;
    }

    public FeedbackResult applyFeedback(String organization, String user, RouteChannelEnum channel, double observedUtility) {
        Double userWeight = null;
        if (StringUtils.isNotBlank(user)) {
            double seed = getWeight(organization, user, channel);
            ChannelWeightEntity updated = channelWeightRepository.updateAtomically(
                    new ChannelWeightKey(organization, user, channel),
                    seed,
                    old -> channelWeightDomainService.applyEma(old, observedUtility, learningRate));
            userWeight = updated.normalizedMultiplier();
        }
        ChannelWeightEntity orgUpdated = channelWeightRepository.updateAtomically(
                ChannelWeightKey.orgLevel(organization, channel),
                Constants.DEFAULT_WEIGHT,
                old -> channelWeightDomainService.applyEma(old, observedUtility, learningRate));
        log.debug("WEIGHT_FEEDBACK_APPLIED organization={}, user={}, channel={}, utility={}, userWeight={}, orgWeight={}",
                organization, user, channel.getCode(), observedUtility, userWeight, orgUpdated.normalizedMultiplier());
        return new FeedbackResult(userWeight, orgUpdated.normalizedMultiplier());
    }

    public double getLearningRate() {
        return learningRate;
    }

    /**
     * 反馈写入后的权重，userWeight 在没有用户时为空。
     */
    public record FeedbackResult(Double userWeight, double orgWeight) {
    }
}
