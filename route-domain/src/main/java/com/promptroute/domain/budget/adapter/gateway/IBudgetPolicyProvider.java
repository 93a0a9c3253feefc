package com.promptroute.domain.budget.adapter.gateway;

import com.promptroute.domain.budget.model.valobj.BudgetPolicySnapshot;

/**
 * 预算策略来源。由外部配置协作方加载，核心只读取不可变快照。
 */
public interface IBudgetPolicyProvider {

    BudgetPolicySnapshot snapshot();
}
