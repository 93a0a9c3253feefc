package com.promptroute.infrastructure.dao;

import com.promptroute.infrastructure.dao.po.RouteDecisionPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 路由决策 DAO。
 */
@Mapper
public interface RouteDecisionDao {

    int insert(RouteDecisionPO po);

    RouteDecisionPO selectById(@Param("id") Long id);

    List<RouteDecisionPO> selectByOrganizationBetween(@Param("organization") String organization,
                                                      @Param("from") LocalDateTime from,
                                                      @Param("to") LocalDateTime to);
}
