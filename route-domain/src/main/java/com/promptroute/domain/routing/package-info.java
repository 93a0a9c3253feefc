/**
 * Routing 领域 - Prompt 路由决策域
 *
 * <p>职责：从 Prompt 提取分类特征、按静态规则打分、结合团队学习权重选出处理通道</p>
 *
 * <h3>核心概念</h3>
 * <ul>
 *   <li>通道：web / agent / ask / direct 四种处理方式</li>
 *   <li>特征记录：由原文派生的定长信号集合，原文在提取后即被丢弃</li>
 *   <li>决策依据：驱动本次选择的主要信号，用于展示与周建议</li>
 * </ul>
 *
 * <h3>核心实体</h3>
 * <ul>
 *   <li>{@link com.promptroute.domain.routing.model.entity.PromptEventEntity}</li>
 *   <li>{@link com.promptroute.domain.routing.model.entity.RouteDecisionEntity}</li>
 *   <li>{@link com.promptroute.domain.routing.model.entity.InteractionOutcomeEntity}</li>
 * </ul>
 *
 * @author promptroute
 * @since 2026-10-01
 */
package com.promptroute.domain.routing;
