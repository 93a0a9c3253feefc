package com.promptroute.infrastructure.dao;

import com.promptroute.infrastructure.dao.po.ChannelWeightPO;
import com.promptroute.types.enums.RouteChannelEnum;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 通道权重 DAO
 *
 * @author promptroute
 * @since 2026-10-01
 */
@Mapper
public interface ChannelWeightDao {

    /**
     * 单元不存在时插入，已存在则忽略
     */
    int insertIfAbsent(ChannelWeightPO po);

    /**
     * 按键查询
     */
    ChannelWeightPO selectByKey(@Param("organization") String organization,
                                @Param("userKey") String userKey,
                                @Param("channel") RouteChannelEnum channel);

    /**
     * 按键查询并加行锁，需在事务内调用
     */
    ChannelWeightPO selectByKeyForUpdate(@Param("organization") String organization,
                                         @Param("userKey") String userKey,
                                         @Param("channel") RouteChannelEnum channel);

    /**
     * 查询组织下全部单元
     */
    List<ChannelWeightPO> selectByOrganization(@Param("organization") String organization);

    /**
     * 更新乘数
     */
    int updateMultiplier(ChannelWeightPO po);
}
