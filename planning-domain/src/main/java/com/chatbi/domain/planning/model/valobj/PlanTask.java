package com.chatbi.domain.planning.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 计划期任务定义。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlanTask {

    /**
     * 任务 ID，计划内顺序编号（task_1, task_2 ...）
     */
    private String taskId;

    /**
     * 步骤标题
     */
    private String title;

    /**
     * 任务目标
     */
    private String objective;

    /**
     * 指派 Agent
     */
    private String assignedAgent;

    /**
     * 依赖任务 ID
     */
    @Builder.Default
    private List<String> dependsOn = new ArrayList<>();

    /**
     * 工具开关
     */
    @Builder.Default
    private Map<String, Boolean> toolchain = new LinkedHashMap<>();
}
