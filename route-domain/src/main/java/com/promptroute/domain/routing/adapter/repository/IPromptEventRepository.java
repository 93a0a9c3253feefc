package com.promptroute.domain.routing.adapter.repository;

import com.promptroute.domain.routing.model.entity.PromptEventEntity;

/**
 * Prompt 事件仓储接口。
 */
public interface IPromptEventRepository {

    PromptEventEntity save(PromptEventEntity entity);

    PromptEventEntity findById(Long id);
}
