package com.promptroute.infrastructure.dao.po;

import com.promptroute.types.enums.RouteChannelEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 通道权重 PO。userKey 为空串表示组织级。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChannelWeightPO {

    private Long id;
    private String organization;
    private String userKey;
    private RouteChannelEnum channel;
    private Double multiplier;
    private LocalDateTime updatedAt;
}
