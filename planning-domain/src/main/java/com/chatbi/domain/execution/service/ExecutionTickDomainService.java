package com.chatbi.domain.execution.service;

import com.chatbi.domain.execution.model.entity.ExecutionEntity;
import com.chatbi.domain.execution.model.entity.ExecutionLogEntity;
import com.chatbi.domain.execution.model.entity.ExecutionTaskEntity;
import com.chatbi.domain.execution.model.valobj.TickOutcome;
import com.chatbi.types.common.Constants;
import com.chatbi.types.enums.ExecutionStateEnum;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 自动推进领域服务：一次 tick 同步完成一个任务。
 * <p>
 * 优先完成 running 任务；没有时把第一个 ready 任务提升为 running 并在同一步完成。
 * 自动推进不会让任务失败。终态执行原样返回，不追加日志。
 * </p>
 */
@Service
public class ExecutionTickDomainService {

    public static final String COMPLETED_RESULT_SUMMARY = "A2A流程已完成，全部任务执行结束。";
    private static final String TICK_DETAIL = "State machine advanced by one step";

    private final ExecutionStateDomainService executionStateDomainService;

    public ExecutionTickDomainService(ExecutionStateDomainService executionStateDomainService) {
        this.executionStateDomainService = executionStateDomainService;
    }

    public TickOutcome tick(ExecutionEntity execution) {
        executionStateDomainService.normalize(execution);
        if (execution.isTerminal()) {
            return TickOutcome.noop();
        }

        ExecutionTaskEntity target = firstRunning(execution);
        if (target == null) {
            target = firstReady(execution);
            if (target != null) {
                target.start();
            }
        }
        if (target != null) {
            target.complete(target.getTitle() + "自动执行完成");
        }

        executionStateDomainService.normalize(execution);
        if (execution.getState() == ExecutionStateEnum.COMPLETED) {
            execution.setResultSummary(COMPLETED_RESULT_SUMMARY);
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("state", execution.getState() == null ? null : execution.getState().getCode());
        ExecutionLogEntity logEntity = ExecutionLogEntity.of(execution.getExecutionId(),
                Constants.STEP_TICK,
                Constants.LOG_STATUS_SUCCESS,
                TICK_DETAIL,
                metadata);
        logEntity.setPlanId(execution.getPlanId());
        return new TickOutcome(true, target == null ? null : target.getTaskId(), logEntity);
    }

    private ExecutionTaskEntity firstRunning(ExecutionEntity execution) {
        if (execution.getTasks() == null) {
            return null;
        }
        for (ExecutionTaskEntity task : execution.getTasks()) {
            if (task.isRunning()) {
                return task;
            }
        }
        return null;
    }

    private ExecutionTaskEntity firstReady(ExecutionEntity execution) {
        if (execution.getTasks() == null) {
            return null;
        }
        for (ExecutionTaskEntity task : execution.getTasks()) {
            if (task.isReady()) {
                return task;
            }
        }
        return null;
    }
}
