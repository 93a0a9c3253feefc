package com.promptroute.domain.routing.model.entity;

import com.promptroute.domain.routing.model.valobj.PromptFeatures;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Prompt 事件领域实体。每次请求创建一次，打分后不再修改。
 */
@Data
public class PromptEventEntity {

    private Long id;
    private String organization;
    private String user;
    private PromptFeatures features;
    private String contentHash;
    private LocalDateTime createdAt;

    public void validate() {
        if (organization == null || organization.isBlank()) {
            throw new IllegalStateException("Organization cannot be blank");
        }
        if (features == null) {
            throw new IllegalStateException("Prompt features cannot be null");
        }
    }
}
