package com.chatbi.domain.execution.service;

import com.chatbi.domain.execution.model.entity.ExecutionEntity;
import com.chatbi.domain.execution.model.entity.ExecutionLogEntity;
import com.chatbi.domain.execution.model.entity.ExecutionTaskEntity;
import com.chatbi.types.common.Constants;
import com.chatbi.types.enums.ExecutionStateEnum;
import com.chatbi.types.enums.TaskActionEnum;
import com.chatbi.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 人工任务动作领域服务：start / complete / fail / retry / skip。
 * <p>
 * 校验顺序：任务不存在为 NotFound，动作非法为 InvalidArgument，状态不允许为 PreconditionFailed。
 * </p>
 */
@Service
public class TaskActionDomainService {

    private static final String DEFAULT_FAIL_ERROR = "Task failed";
    private static final String DEFAULT_SKIP_SUMMARY = "Task skipped";

    private final TaskDependencyPolicy taskDependencyPolicy;
    private final ExecutionStateDomainService executionStateDomainService;

    public TaskActionDomainService(TaskDependencyPolicy taskDependencyPolicy,
                                   ExecutionStateDomainService executionStateDomainService) {
        this.taskDependencyPolicy = taskDependencyPolicy;
        this.executionStateDomainService = executionStateDomainService;
    }

    /**
     * 应用一次人工动作并重新归一化执行实例。
     *
     * @return 需要追加的 task_&lt;action&gt; 执行日志
     */
    public ExecutionLogEntity apply(ExecutionEntity execution, String taskId, String rawAction, String note) {
        ExecutionTaskEntity task = execution.findTask(taskId);
        if (task == null) {
            throw AppException.notFound("Task not found: " + taskId);
        }
        TaskActionEnum action = TaskActionEnum.fromCode(rawAction);
        if (action == null) {
            throw AppException.invalidArgument("Unsupported task action: " + rawAction);
        }
        if (execution.getState() == ExecutionStateEnum.CANCELLED) {
            throw AppException.preconditionFailed("Execution cancelled: " + execution.getExecutionId());
        }

        try {
            switch (action) {
                case START -> start(execution, task);
                case COMPLETE -> task.complete(StringUtils.defaultIfBlank(note, task.getTitle() + "完成"));
                case FAIL -> {
                    task.fail(StringUtils.defaultIfBlank(note, DEFAULT_FAIL_ERROR));
                    execution.markFailed();
                }
                case RETRY -> {
                    task.retry();
                    execution.resumeRunning();
                }
                case SKIP -> task.skip(StringUtils.defaultIfBlank(note, DEFAULT_SKIP_SUMMARY));
                default -> throw AppException.invalidArgument("Unsupported task action: " + rawAction);
            }
        } catch (IllegalStateException ex) {
            throw AppException.preconditionFailed(ex.getMessage());
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("note", note);
        ExecutionLogEntity logEntity = ExecutionLogEntity.of(execution.getExecutionId(),
                action.logStep(),
                Constants.LOG_STATUS_SUCCESS,
                taskId + " -> " + action.getCode(),
                metadata);
        logEntity.setPlanId(execution.getPlanId());

        executionStateDomainService.normalize(execution);
        return logEntity;
    }

    private void start(ExecutionEntity execution, ExecutionTaskEntity task) {
        TaskDependencyPolicy.DependencyDecision decision = taskDependencyPolicy.resolveDependencyDecision(task,
                executionStateDomainService.statusByTask(execution.getTasks()));
        if (decision != TaskDependencyPolicy.DependencyDecision.SATISFIED) {
            throw AppException.preconditionFailed("Task dependencies are not completed: " + task.getTaskId());
        }
        task.start();
        execution.markRunning();
    }
}
