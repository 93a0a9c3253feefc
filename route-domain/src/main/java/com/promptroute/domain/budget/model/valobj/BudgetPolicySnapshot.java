package com.promptroute.domain.budget.model.valobj;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 一次决策周期内使用的全部预算策略快照，整体替换。
 */
public final class BudgetPolicySnapshot {

    private final Map<String, BudgetPolicy> policies;
    private final long version;
    private final LocalDateTime loadedAt;

    public BudgetPolicySnapshot(Map<String, BudgetPolicy> policies, long version, LocalDateTime loadedAt) {
        Map<String, BudgetPolicy> copied = new LinkedHashMap<>();
        if (policies != null) {
            policies.forEach((organization, policy) -> {
                policy.validate();
                copied.put(organization, policy.frozen());
            });
        }
        this.policies = Collections.unmodifiableMap(copied);
        this.version = version;
        this.loadedAt = loadedAt;
    }

    public static BudgetPolicySnapshot empty() {
        return new BudgetPolicySnapshot(Collections.emptyMap(), 0L, null);
    }

    /**
     * 查找组织策略，不存在时返回 null。
     */
    public BudgetPolicy find(String organization) {
        return organization == null ? null : policies.get(organization);
    }

    public Map<String, BudgetPolicy> getPolicies() {
        return policies;
    }

    public long getVersion() {
        return version;
    }

    public LocalDateTime getLoadedAt() {
        return loadedAt;
    }
}
