/**
 * Learning 领域 - 团队自适应权重域
 *
 * <p>职责：维护组织级与用户级的通道乘数，并用交互效用的指数移动平均进行更新</p>
 *
 * <p>查找链：用户级单元 → 组织级单元 → 缺省 1.0；乘数始终位于 [0.0, 2.0]。</p>
 *
 * @author promptroute
 * @since 2026-10-01
 */
package com.promptroute.domain.learning;
