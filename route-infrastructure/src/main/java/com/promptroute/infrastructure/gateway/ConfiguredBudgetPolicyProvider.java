package com.promptroute.infrastructure.gateway;

import com.promptroute.domain.budget.adapter.gateway.IBudgetPolicyProvider;
import com.promptroute.domain.budget.model.valobj.BudgetPolicy;
import com.promptroute.domain.budget.model.valobj.BudgetPolicySnapshot;
import com.promptroute.infrastructure.config.BudgetPolicyProperties;
import com.promptroute.types.enums.BudgetModeEnum;
import com.promptroute.types.enums.RouteChannelEnum;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 基于 Spring 配置的预算策略提供者。
 * <p>
 * 启动时从 route.budget.policies 构建快照；replace 以新快照整体替换，
 * 正在进行的决策继续使用其已取得的旧快照。
 * </p>
 */
@Slf4j
@Component
@EnableConfigurationProperties(BudgetPolicyProperties.class)
public class ConfiguredBudgetPolicyProvider implements IBudgetPolicyProvider {

    private final AtomicReference<BudgetPolicySnapshot> current;
    private final Clock clock;

    public ConfiguredBudgetPolicyProvider(BudgetPolicyProperties properties, Clock clock) {
        this.clock = clock;
        BudgetPolicySnapshot initial = new BudgetPolicySnapshot(toPolicies(properties), 1L, LocalDateTime.now(clock));
        this.current = new AtomicReference<>(initial);
        log.info("Budget policies loaded. organizations={}, version={}",
                initial.getPolicies().keySet(), initial.getVersion());
    }

    @Override
    public BudgetPolicySnapshot snapshot() {
        return current.get();
    }

    /**
     * 整体替换策略集合。校验失败时保留旧快照并抛出异常；并发替换时版本号依次递增。
     */
    public BudgetPolicySnapshot replace(Map<String, BudgetPolicy> policies) {
        BudgetPolicySnapshot next = current.updateAndGet(previous ->
                new BudgetPolicySnapshot(policies, previous.getVersion() + 1, LocalDateTime.now(clock)));
        log.info("Budget policies replaced. organizations={}, version={}",
                next.getPolicies().keySet(), next.getVersion());
        return next;
    }

    private Map<String, BudgetPolicy> toPolicies(BudgetPolicyProperties properties) {
        Map<String, BudgetPolicy> policies = new LinkedHashMap<>();
        if (properties == null || properties.getPolicies() == null) {
            return policies;
        }
        properties.getPolicies().forEach((organization, item) -> {
            if (StringUtils.isBlank(organization) || item == null) {
                return;
            }
            Map<RouteChannelEnum, RouteChannelEnum> channelFallbacks = new EnumMap<>(RouteChannelEnum.class);
            if (item.getChannelFallbacks() != null) {
                item.getChannelFallbacks().forEach((from, to) ->
                        channelFallbacks.put(RouteChannelEnum.fromText(from), RouteChannelEnum.fromText(to)));
            }
            BudgetModeEnum mode = BudgetModeEnum.fromText(item.getMode());
            policies.put(organization.trim(), BudgetPolicy.builder()
                    .organization(organization.trim())
                    .monthlyLimit(item.getMonthlyLimit())
                    .mode(mode == null ? BudgetModeEnum.OBSERVE : mode)
                    .alertThreshold(item.getAlertThreshold())
                    .modelFallbacks(item.getModelFallbacks())
                    .channelFallbacks(channelFallbacks)
                    .build());
        });
        return policies;
    }
}
