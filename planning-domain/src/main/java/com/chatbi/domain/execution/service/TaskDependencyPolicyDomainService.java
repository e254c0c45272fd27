package com.chatbi.domain.execution.service;

import com.chatbi.domain.execution.model.entity.ExecutionTaskEntity;
import com.chatbi.types.enums.TaskStatusEnum;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Task 依赖判定领域服务：全部依赖 completed 才可推进。
 * <p>
 * 依赖列表按通用 DAG 处理，不假设只依赖前一个任务；未知的依赖 ID 视为未完成。
 * </p>
 */
@Service
public class TaskDependencyPolicyDomainService implements TaskDependencyPolicy {

    @Override
    public DependencyDecision resolveDependencyDecision(ExecutionTaskEntity task,
                                                        Map<String, TaskStatusEnum> statusByTask) {
        if (task == null) {
            return DependencyDecision.WAITING;
        }
        List<String> dependencies = task.getDependsOn();
        if (dependencies == null || dependencies.isEmpty()) {
            return DependencyDecision.SATISFIED;
        }
        if (statusByTask == null || statusByTask.isEmpty()) {
            return DependencyDecision.WAITING;
        }

        DependencyStatusSummary summary = summarizeDependencies(dependencies, statusByTask);
        if (summary.total <= 0 || summary.completedCount == summary.total) {
            return DependencyDecision.SATISFIED;
        }
        if (summary.failedOrSkippedCount > 0) {
            return DependencyDecision.BLOCKED;
        }
        return DependencyDecision.WAITING;
    }

    private DependencyStatusSummary summarizeDependencies(List<String> dependencies,
                                                          Map<String, TaskStatusEnum> statusByTask) {
        int total = 0;
        int completed = 0;
        int failedOrSkipped = 0;

        for (String dependency : dependencies) {
            if (StringUtils.isBlank(dependency)) {
                continue;
            }
            total++;
            TaskStatusEnum status = statusByTask.get(dependency);
            if (status == TaskStatusEnum.COMPLETED) {
                completed++;
            } else if (status == TaskStatusEnum.FAILED || status == TaskStatusEnum.SKIPPED) {
                failedOrSkipped++;
            }
        }
        return new DependencyStatusSummary(total, completed, failedOrSkipped);
    }

    private record DependencyStatusSummary(int total,
                                           int completedCount,
                                           int failedOrSkippedCount) {
    }
}
