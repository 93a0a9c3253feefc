package com.promptroute.domain.learning.adapter.repository;

import com.promptroute.domain.learning.model.entity.ChannelWeightEntity;
import com.promptroute.domain.learning.model.valobj.ChannelWeightKey;

import java.util.List;
import java.util.function.DoubleUnaryOperator;

/**
 * 通道权重仓储接口。
 */
public interface IChannelWeightRepository {

    /**
     * 查询单元，不存在时返回 null。
     */
    ChannelWeightEntity find(ChannelWeightKey key);

    List<ChannelWeightEntity> findByOrganization(String organization);

    /**
     * 对单个单元做原子读-改-写。
     * <p>
     * 单元不存在时以 seed 作为旧值；同一单元的并发调用必须串行化，
     * 不同单元互不阻塞。
     * </p>
     *
     * @param key 单元键
     * @param seed 单元不存在时使用的旧值
     * @param updater 旧值到新值的映射
     * @return 更新后的单元
     */
    ChannelWeightEntity updateAtomically(ChannelWeightKey key, double seed, DoubleUnaryOperator updater);
}
