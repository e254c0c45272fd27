package com.chatbi.domain.execution.service;

import com.chatbi.domain.execution.model.entity.ExecutionTaskEntity;
import com.chatbi.types.enums.TaskStatusEnum;

import java.util.Map;

/**
 * Task 依赖判定策略：根据依赖任务状态返回任务可推进决策。
 */
public interface TaskDependencyPolicy {

    DependencyDecision resolveDependencyDecision(ExecutionTaskEntity task,
                                                 Map<String, TaskStatusEnum> statusByTask);

    enum DependencyDecision {
        SATISFIED,
        WAITING,
        BLOCKED
    }
}
