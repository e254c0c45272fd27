package com.chatbi.domain.execution.service;

import com.chatbi.domain.execution.model.entity.ExecutionEntity;
import com.chatbi.domain.execution.model.entity.ExecutionTaskEntity;
import com.chatbi.types.enums.ExecutionStateEnum;
import com.chatbi.types.enums.TaskStatusEnum;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 执行状态推导领域服务：执行状态由任务状态推导，终态不再重算。
 */
@Service
public class ExecutionStateDomainService {

    private final TaskDependencyPolicy taskDependencyPolicy;

    public ExecutionStateDomainService(TaskDependencyPolicy taskDependencyPolicy) {
        this.taskDependencyPolicy = taskDependencyPolicy;
    }

    /**
     * 归一化执行实例：依赖满足的 pending 任务提升为 ready，再按任务状态重算执行状态。
     *
     * @return 同一个执行实例
     */
    public ExecutionEntity normalize(ExecutionEntity execution) {
        if (execution == null || execution.isTerminal()) {
            return execution;
        }
        List<ExecutionTaskEntity> tasks = execution.getTasks() == null
                ? Collections.emptyList()
                : execution.getTasks();

        Map<String, TaskStatusEnum> statusByTask = statusByTask(tasks);
        for (ExecutionTaskEntity task : tasks) {
            if (task.getStatus() != TaskStatusEnum.PENDING) {
                continue;
            }
            if (taskDependencyPolicy.resolveDependencyDecision(task, statusByTask)
                    == TaskDependencyPolicy.DependencyDecision.SATISFIED) {
                task.markReady();
            }
        }

        LocalDateTime now = LocalDateTime.now();
        ExecutionStateEnum derived = deriveState(tasks, execution.getState());
        execution.setState(derived);
        if (derived == ExecutionStateEnum.COMPLETED && execution.getFinishedAt() == null) {
            execution.setFinishedAt(now);
        }
        execution.setUpdatedAt(now);
        return execution;
    }

    /**
     * 纯函数：全部 completed/skipped 为 completed（空任务列表同样视为完成），
     * 任一 failed 为 failed，任一 running/ready 为 running，否则保持当前状态。
     */
    public ExecutionStateEnum deriveState(List<ExecutionTaskEntity> tasks, ExecutionStateEnum current) {
        TaskStatusSummary summary = summarize(tasks);
        if (summary.settledCount == summary.total) {
            return ExecutionStateEnum.COMPLETED;
        }
        if (summary.failedCount > 0) {
            return ExecutionStateEnum.FAILED;
        }
        if (summary.runningLikeCount > 0) {
            return ExecutionStateEnum.RUNNING;
        }
        return current == null ? ExecutionStateEnum.PENDING : current;
    }

    public Map<String, TaskStatusEnum> statusByTask(List<ExecutionTaskEntity> tasks) {
        Map<String, TaskStatusEnum> statusByTask = new LinkedHashMap<>();
        if (tasks == null) {
            return statusByTask;
        }
        for (ExecutionTaskEntity task : tasks) {
            if (task.getTaskId() != null) {
                statusByTask.put(task.getTaskId(), task.getStatus());
            }
        }
        return statusByTask;
    }

    private TaskStatusSummary summarize(List<ExecutionTaskEntity> tasks) {
        if (tasks == null) {
            return new TaskStatusSummary(0, 0, 0, 0);
        }
        int settled = 0;
        int failed = 0;
        int runningLike = 0;
        for (ExecutionTaskEntity task : tasks) {
            TaskStatusEnum status = task.getStatus();
            if (status == TaskStatusEnum.COMPLETED || status == TaskStatusEnum.SKIPPED) {
                settled++;
            } else if (status == TaskStatusEnum.FAILED) {
                failed++;
            } else if (status == TaskStatusEnum.RUNNING || status == TaskStatusEnum.READY) {
                runningLike++;
            }
        }
        return new TaskStatusSummary(tasks.size(), settled, failed, runningLike);
    }

    private record TaskStatusSummary(int total,
                                     int settledCount,
                                     int failedCount,
                                     int runningLikeCount) {
    }
}
