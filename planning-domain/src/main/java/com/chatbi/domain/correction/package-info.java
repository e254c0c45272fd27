/**
 * Correction 领域 - SQL 自纠错重试域
 *
 * <p>职责：执行查询，失败时请纠错 Agent 给出替换语句并在重试预算内再次执行，每次尝试落一条纠错日志</p>
 *
 * <h3>端口</h3>
 * <ul>
 *   <li>{@link com.chatbi.domain.correction.adapter.gateway.IQueryExecutorGateway} - 查询执行</li>
 *   <li>{@link com.chatbi.domain.correction.adapter.gateway.ISqlCorrectionGateway} - 纠错 Agent</li>
 *   <li>{@link com.chatbi.domain.correction.adapter.repository.ICorrectionLogRepository} - 纠错日志</li>
 * </ul>
 *
 * @author chatbi
 * @since 2025-02-03
 */
package com.chatbi.domain.correction;
