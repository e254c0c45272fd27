/**
 * Execution 领域 - 执行状态机域
 *
 * <p>职责：把执行计划实例化为可变的执行实例，驱动每个任务走完生命周期</p>
 *
 * <h3>核心概念</h3>
 * <ul>
 *   <li>任务状态：pending -> ready -> running -> completed / failed / skipped，failed 可重试回 pending</li>
 *   <li>执行状态：由任务状态推导，completed / failed / cancelled 为终态，进入后不再推导</li>
 *   <li>自动推进：tick 每次完成一个任务，run 在步数预算内反复 tick</li>
 *   <li>执行日志：所有迁移都追加一条审计记录</li>
 * </ul>
 *
 * <h3>聚合根</h3>
 * <ul>
 *   <li>{@link com.chatbi.domain.execution.model.entity.ExecutionEntity}</li>
 * </ul>
 *
 * @author chatbi
 * @since 2025-01-30
 */
package com.chatbi.domain.execution;
