package com.promptroute.infrastructure.dao;

import com.promptroute.infrastructure.dao.po.PromptEventPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

/**
 * Prompt 事件 DAO。
 */
@Mapper
public interface PromptEventDao {

    int insert(PromptEventPO po);

    PromptEventPO selectById(@Param("id") Long id);
}
