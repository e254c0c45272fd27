package com.chatbi.test.domain;

import com.chatbi.domain.execution.model.entity.ExecutionEntity;
import com.chatbi.domain.execution.model.entity.ExecutionLogEntity;
import com.chatbi.domain.execution.model.entity.ExecutionTaskEntity;
import com.chatbi.domain.execution.service.ExecutionStateDomainService;
import com.chatbi.domain.execution.service.TaskActionDomainService;
import com.chatbi.test.support.PlanningFixtures;
import com.chatbi.types.enums.ExecutionStateEnum;
import com.chatbi.types.enums.ResponseCode;
import com.chatbi.types.enums.TaskStatusEnum;
import com.chatbi.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class TaskActionDomainServiceTest {

    private final TaskActionDomainService service = PlanningFixtures.taskActionService();
    private final ExecutionStateDomainService stateService = PlanningFixtures.stateService();

    private ExecutionEntity execution;

    @BeforeEach
    public void setUp() {
        execution = ExecutionEntity.fromPlan(PlanningFixtures.linearPlan("p1", "指标拆解", "风险评估", "策略建议"), true);
        stateService.normalize(execution);
    }

    @Test
    public void shouldStartReadyTaskAndIncrementAttempts() {
        ExecutionLogEntity logEntity = service.apply(execution, "task_1", "start", null);

        ExecutionTaskEntity task = execution.findTask("task_1");
        Assertions.assertEquals(TaskStatusEnum.RUNNING, task.getStatus());
        Assertions.assertEquals(1, task.getAttempts());
        Assertions.assertNotNull(task.getStartedAt());
        Assertions.assertEquals(ExecutionStateEnum.RUNNING, execution.getState());
        Assertions.assertNotNull(execution.getStartedAt());
        Assertions.assertEquals("task_start", logEntity.getStep());
        Assertions.assertEquals("success", logEntity.getStatus());
        Assertions.assertEquals("task_1 -> start", logEntity.getDetail());
        Assertions.assertEquals("p1", logEntity.getPlanId());
    }

    @Test
    public void shouldRejectStartWhenDependenciesIncomplete() {
        AppException ex = Assertions.assertThrows(AppException.class,
                () -> service.apply(execution, "task_2", "start", null));

        Assertions.assertEquals(ResponseCode.PRECONDITION_FAILED.getCode(), ex.getCode());
        Assertions.assertEquals(TaskStatusEnum.PENDING, execution.findTask("task_2").getStatus());
    }

    @Test
    public void shouldCompleteFromPendingWithDefaultSummary() {
        service.apply(execution, "task_2", "complete", null);

        ExecutionTaskEntity task = execution.findTask("task_2");
        Assertions.assertEquals(TaskStatusEnum.COMPLETED, task.getStatus());
        Assertions.assertEquals("风险评估完成", task.getOutputSummary());
        Assertions.assertNotNull(task.getFinishedAt());
    }

    @Test
    public void shouldFailTaskAndForceExecutionFailed() {
        service.apply(execution, "task_1", "fail", null);

        Assertions.assertEquals(TaskStatusEnum.FAILED, execution.findTask("task_1").getStatus());
        Assertions.assertEquals("Task failed", execution.findTask("task_1").getError());
        Assertions.assertEquals(ExecutionStateEnum.FAILED, execution.getState());
    }

    @Test
    public void shouldRetryFailedTaskWithoutResettingAttempts() {
        service.apply(execution, "task_1", "start", null);
        service.apply(execution, "task_1", "fail", "timeout");

        service.apply(execution, "task_1", "retry", null);

        ExecutionTaskEntity task = execution.findTask("task_1");
        Assertions.assertEquals(TaskStatusEnum.READY, task.getStatus());
        Assertions.assertEquals(1, task.getAttempts());
        Assertions.assertNull(task.getError());
        Assertions.assertNull(task.getFinishedAt());
        Assertions.assertEquals(ExecutionStateEnum.RUNNING, execution.getState());

        service.apply(execution, "task_1", "start", null);
        Assertions.assertEquals(2, execution.findTask("task_1").getAttempts());
    }

    @Test
    public void shouldRejectRetryOfNonFailedTask() {
        AppException ex = Assertions.assertThrows(AppException.class,
                () -> service.apply(execution, "task_1", "retry", null));

        Assertions.assertEquals(ResponseCode.PRECONDITION_FAILED.getCode(), ex.getCode());
    }

    @Test
    public void shouldRejectSkipOfCompletedTask() {
        service.apply(execution, "task_1", "complete", "done");

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> service.apply(execution, "task_1", "skip", null));

        Assertions.assertEquals(ResponseCode.PRECONDITION_FAILED.getCode(), ex.getCode());
    }

    @Test
    public void shouldSkipWithDefaultSummaryAndUnblockNextTask() {
        service.apply(execution, "task_1", "skip", null);

        Assertions.assertEquals(TaskStatusEnum.SKIPPED, execution.findTask("task_1").getStatus());
        Assertions.assertEquals("Task skipped", execution.findTask("task_1").getOutputSummary());
        Assertions.assertEquals(TaskStatusEnum.PENDING, execution.findTask("task_2").getStatus());
    }

    @Test
    public void shouldRejectUnknownActionAndUnknownTask() {
        AppException invalid = Assertions.assertThrows(AppException.class,
                () -> service.apply(execution, "task_1", "pause", null));
        AppException missing = Assertions.assertThrows(AppException.class,
                () -> service.apply(execution, "task_9", "start", null));

        Assertions.assertEquals(ResponseCode.ILLEGAL_PARAMETER.getCode(), invalid.getCode());
        Assertions.assertEquals(ResponseCode.NOT_FOUND.getCode(), missing.getCode());
    }

    @Test
    public void shouldRejectActionsOnCancelledExecution() {
        execution.cancel("stop");

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> service.apply(execution, "task_1", "complete", null));

        Assertions.assertEquals(ResponseCode.PRECONDITION_FAILED.getCode(), ex.getCode());
    }
}
