/**
 * Planning 领域 - 规划与编排域
 *
 * <p>职责：拆解规则与协作链管理、执行计划生成、计划历史留存</p>
 *
 * <h3>核心概念</h3>
 * <ul>
 *   <li>拆解规则：关键字命中后，把问题拆成有序步骤并指派 Agent</li>
 *   <li>协作链：描述多个角色之间交接顺序的模板</li>
 *   <li>执行计划：一次拆解的不可变结果，任务之间构成线性依赖链</li>
 * </ul>
 *
 * <h3>聚合根</h3>
 * <ul>
 *   <li>{@link com.chatbi.domain.planning.model.aggregate.PlanningDocument}</li>
 * </ul>
 *
 * <h3>领域服务</h3>
 * <ul>
 *   <li>{@link com.chatbi.domain.planning.service.PlanBuilderDomainService} - 生成执行计划</li>
 * </ul>
 *
 * @author chatbi
 * @since 2025-01-30
 */
package com.chatbi.domain.planning;
