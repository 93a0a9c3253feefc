package com.promptroute.domain.learning.service;

import com.promptroute.domain.learning.model.entity.ChannelWeightEntity;
import com.promptroute.types.common.Constants;
import org.springframework.stereotype.Service;

/**
 * 通道权重规则领域服务：查找链解析与 EMA 更新公式。
 */
@Service
public class ChannelWeightDomainService {

    /**
     * 用户级 → 组织级 → 缺省值。
     */
    public double resolveEffective(ChannelWeightEntity userCell, ChannelWeightEntity orgCell) {
        if (userCell != null && userCell.getMultiplier() != null) {
            return userCell.getMultiplier();
        }
        if (orgCell != null && orgCell.getMultiplier() != null) {
            return orgCell.getMultiplier();
        }
        return Constants.DEFAULT_WEIGHT;
    }

    /**
     * new = old + learningRate * (observedUtility - old)，结果截断到 [0, 2]。
     */
    public double applyEma(double old, double observedUtility, double learningRate) {
        if (Double.isNaN(observedUtility) || Double.isInfinite(observedUtility)) {
            throw new IllegalArgumentException("Observed utility must be finite: " + observedUtility);
        }
        return clamp(old + normalizeLearningRate(learningRate) * (observedUtility - old));
    }

    public double clamp(double multiplier) {
        if (Double.isNaN(multiplier)) {
            return Constants.DEFAULT_WEIGHT;
        }
        return Math.max(Constants.MIN_WEIGHT, Math.min(Constants.MAX_WEIGHT, multiplier));
    }

    public double normalizeLearningRate(double learningRate) {
        if (Double.isNaN(learningRate) || learningRate <= 0D) {
            return 0D;
        }
        return Math.min(learningRate, 1D);
    }
}
