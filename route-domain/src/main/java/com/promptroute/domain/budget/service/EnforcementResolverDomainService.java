package com.promptroute.domain.budget.service;

import com.promptroute.domain.budget.model.valobj.BudgetDirective;
import com.promptroute.domain.budget.model.valobj.EnforcementResult;
import com.promptroute.types.enums.RouteChannelEnum;
import org.springframework.stereotype.Service;

import java.util.Objects;

/**
 * 执行解析领域服务：把预算指令应用到请求的通道与模型上。
 */
@Service
public class EnforcementResolverDomainService {

    public EnforcementResult resolve(BudgetDirective directive, RouteChannelEnum requestedChannel, String requestedModel) {
        if (directive == null || directive.getType() == null) {
            throw new IllegalStateException("Directive cannot be null");
        }
        if (directive.isBlock()) {
            return EnforcementResult.builder()
                    .blocked(true)
                    .wasDowngraded(false)
                    .build();
        }
        if (directive.isDowngrade()) {
            RouteChannelEnum channel = directive.getTargetChannel() == null
                    ? requestedChannel
                    : directive.getTargetChannel();
            String model = directive.getTargetModel() == null ? requestedModel : directive.getTargetModel();
            return EnforcementResult.builder()
                    .channel(channel)
                    .model(model)
                    .wasDowngraded(channel != requestedChannel || !Objects.equals(model, requestedModel))
                    .blocked(false)
                    .build();
        }
        return EnforcementResult.builder()
                .channel(requestedChannel)
                .model(requestedModel)
                .wasDowngraded(false)
                .blocked(false)
                .build();
    }
}
