package com.promptroute.domain.budget.model.valobj;

import com.promptroute.types.enums.RouteChannelEnum;
import lombok.Builder;
import lombok.Value;

/**
 * 执行解析结果。blocked 为 true 时 channel 与 model 为空，表示拒绝而不是路由。
 */
@Value
@Builder
public class EnforcementResult {

    RouteChannelEnum channel;
    String model;
    boolean wasDowngraded;
    boolean blocked;
}
