package com.promptroute.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Prompt 事件 PO。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PromptEventPO {

    private Long id;
    private String organization;
    private String userKey;
    private String features;
    private String contentHash;
    private LocalDateTime createdAt;
}
