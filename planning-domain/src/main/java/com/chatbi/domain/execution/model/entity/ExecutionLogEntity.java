package com.chatbi.domain.execution.model.entity;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 执行日志实体，只追加不修改。
 *
 * @author chatbi
 * @since 2025-01-30
 */
@Data
public class ExecutionLogEntity {

    /**
     * 执行 ID（人工记录可为空）
     */
    private String executionId;

    /**
     * 计划 ID（仅人工记录携带）
     */
    private String planId;

    /**
     * 步骤名
     */
    private String step;

    /**
     * 状态
     */
    private String status;

    /**
     * 描述
     */
    private String detail;

    /**
     * 元数据
     */
    private Map<String, Object> metadata = new LinkedHashMap<>();

    /**
     * 记录时间
     */
    private LocalDateTime timestamp;

    public static ExecutionLogEntity of(String executionId,
                                        String step,
                                        String status,
                                        String detail,
                                        Map<String, Object> metadata) {
        ExecutionLogEntity entity = new ExecutionLogEntity();
        entity.setExecutionId(executionId);
        entity.setStep(step);
        entity.setStatus(status);
        entity.setDetail(detail);
        entity.setMetadata(metadata == null ? new LinkedHashMap<>() : new LinkedHashMap<>(metadata));
        entity.setTimestamp(LocalDateTime.now());
        return entity;
    }
}
