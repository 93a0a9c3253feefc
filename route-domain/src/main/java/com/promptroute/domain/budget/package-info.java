/**
 * Budget 领域 - 预算账本与执行域
 *
 * <p>职责：按组织、按计费周期累计花费，依据预算策略给出 allow / downgrade / block 指令，
 * 并把指令映射为最终可用的通道与模型</p>
 *
 * <h3>状态机</h3>
 * <ul>
 *   <li>UNDER_THRESHOLD → NEAR_THRESHOLD（≥ 告警阈值）→ OVER_LIMIT（≥ 100%）</li>
 *   <li>周期内只前进不后退，新周期回到 UNDER_THRESHOLD</li>
 *   <li>状态每次由累计花费重新计算，不单独存储</li>
 * </ul>
 *
 * @author promptroute
 * @since 2026-10-01
 */
package com.promptroute.domain.budget;
