/**
 * Analytics 领域 - 用量分析与建议域
 *
 * <p>职责：对历史决策、交互结果与权重做只读折叠，产出节省估算、用户效率与周建议。
 * 本域从不修改 PromptEvent / RouteDecision / LedgerEntry。</p>
 *
 * @author promptroute
 * @since 2026-10-01
 */
package com.promptroute.domain.analytics;
