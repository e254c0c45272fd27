package com.chatbi.test.trigger;

import com.chatbi.domain.execution.model.entity.ExecutionEntity;
import com.chatbi.domain.execution.model.entity.ExecutionLogEntity;
import com.chatbi.domain.planning.model.aggregate.PlanningDocument;
import com.chatbi.domain.planning.model.entity.PlanEntity;
import com.chatbi.domain.planning.model.valobj.PlanningRetention;
import com.chatbi.test.support.InMemoryPlanningStoreRepository;
import com.chatbi.test.support.PlanningFixtures;
import com.chatbi.trigger.application.command.ExecutionCommandService;
import com.chatbi.trigger.application.query.PlanningQueryService;
import com.chatbi.types.enums.ExecutionStateEnum;
import com.chatbi.types.enums.ResponseCode;
import com.chatbi.types.enums.TaskStatusEnum;
import com.chatbi.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

public class ExecutionCommandServiceTest {

    private static final String PLAN_ID = "plan-1";

    private InMemoryPlanningStoreRepository store;
    private ExecutionCommandService commandService;
    private PlanningQueryService queryService;

    @BeforeEach
    public void setUp() {
        PlanningDocument document = new PlanningDocument();
        document.appendPlan(PlanningFixtures.linearPlan(PLAN_ID, "漏斗诊断", "客群分层", "策略动作建议"), 10);
        store = new InMemoryPlanningStoreRepository(document);
        commandService = PlanningFixtures.executionCommandService(store, PlanningRetention.defaults());
        queryService = new PlanningQueryService(store, PlanningFixtures.stateService());
    }

    @Test
    public void shouldCreateRunningExecutionWithFirstTaskReady() {
        ExecutionEntity execution = commandService.startExecution(PLAN_ID, null, null, null, true);

        Assertions.assertEquals(ExecutionStateEnum.RUNNING, execution.getState());
        Assertions.assertNotNull(execution.getStartedAt());
        Assertions.assertEquals(TaskStatusEnum.READY, execution.findTask("task_1").getStatus());
        Assertions.assertEquals(TaskStatusEnum.PENDING, execution.findTask("task_2").getStatus());

        PlanningDocument stored = store.snapshot();
        Assertions.assertEquals(1, stored.getExecutions().size());
        ExecutionLogEntity startLog = stored.getExecutionLogs().get(0);
        Assertions.assertEquals("execution_start", startLog.getStep());
        Assertions.assertEquals(PLAN_ID, startLog.getMetadata().get("plan_id"));
        Assertions.assertEquals(3, startLog.getMetadata().get("task_count"));
    }

    @Test
    public void shouldDeriveRunningWithoutStampingStartWhenAutoStartOff() {
        ExecutionEntity execution = commandService.startExecution(PLAN_ID, null, null, null, false);

        Assertions.assertEquals(ExecutionStateEnum.RUNNING, execution.getState());
        Assertions.assertNull(execution.getStartedAt());
        Assertions.assertEquals(Boolean.FALSE, execution.getAutoStart());
    }

    @Test
    public void shouldBuildPlanOnTheFlyWhenOnlyQuestionIsGiven() {
        ExecutionEntity execution = commandService.startExecution(null, "消费贷逾期率为什么上升", null, null, true);

        PlanningDocument stored = store.snapshot();
        Assertions.assertEquals(2, stored.getPlanHistory().size());
        PlanEntity built = stored.getPlanHistory().get(1);
        Assertions.assertEquals(built.getPlanId(), execution.getPlanId());
        Assertions.assertEquals(built.taskCount(), execution.getTasks().size());
    }

    @Test
    public void shouldRejectUnknownPlanAndMissingInput() {
        AppException notFound = Assertions.assertThrows(AppException.class,
                () -> commandService.startExecution("missing", null, null, null, true));
        Assertions.assertEquals(ResponseCode.NOT_FOUND.getCode(), notFound.getCode());

        AppException invalid = Assertions.assertThrows(AppException.class,
                () -> commandService.startExecution(" ", " ", null, null, true));
        Assertions.assertEquals(ResponseCode.ILLEGAL_PARAMETER.getCode(), invalid.getCode());
        Assertions.assertTrue(store.snapshot().getExecutions().isEmpty());
    }

    @Test
    public void shouldRejectStartingTaskWithOpenDependencies() {
        ExecutionEntity execution = commandService.startExecution(PLAN_ID, null, null, null, true);
        int logsBefore = store.snapshot().getExecutionLogs().size();

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> commandService.taskAction(execution.getExecutionId(), "task_2", "start", null));

        Assertions.assertEquals(ResponseCode.PRECONDITION_FAILED.getCode(), ex.getCode());
        Assertions.assertTrue(ex.getInfo().contains("task_2"));
        ExecutionEntity stored = store.snapshot().findExecution(execution.getExecutionId());
        Assertions.assertEquals(TaskStatusEnum.PENDING, stored.findTask("task_2").getStatus());
        Assertions.assertEquals(logsBefore, store.snapshot().getExecutionLogs().size());
    }

    @Test
    public void shouldCompleteExecutionAfterManualCompletions() {
        ExecutionEntity execution = commandService.startExecution(PLAN_ID, null, null, null, true);
        String executionId = execution.getExecutionId();

        commandService.taskAction(executionId, "task_1", "complete", null);
        commandService.taskAction(executionId, "task_2", "complete", null);
        ExecutionEntity finished = commandService.taskAction(executionId, "task_3", "complete", "done");

        Assertions.assertEquals(ExecutionStateEnum.COMPLETED, finished.getState());
        LocalDateTime finishedAt = finished.getFinishedAt();
        Assertions.assertNotNull(finishedAt);

        ExecutionEntity reread = commandService.getExecution(executionId);
        Assertions.assertEquals(finishedAt, reread.getFinishedAt());
        Assertions.assertEquals(ExecutionStateEnum.COMPLETED, reread.getState());
    }

    @Test
    public void shouldAdvanceOneTaskPerRunStep() {
        ExecutionEntity execution = commandService.startExecution(PLAN_ID, null, null, null, true);

        ExecutionEntity afterRun = commandService.run(execution.getExecutionId(), 1);

        Assertions.assertEquals(ExecutionStateEnum.RUNNING, afterRun.getState());
        Assertions.assertEquals(TaskStatusEnum.COMPLETED, afterRun.findTask("task_1").getStatus());
        Assertions.assertEquals(TaskStatusEnum.READY, afterRun.findTask("task_2").getStatus());
        Assertions.assertEquals(TaskStatusEnum.PENDING, afterRun.findTask("task_3").getStatus());
    }

    @Test
    public void shouldRunToCompletionAndStopEarly() {
        ExecutionEntity execution = commandService.startExecution(PLAN_ID, null, null, null, true);

        ExecutionEntity finished = commandService.run(execution.getExecutionId(), 50);

        Assertions.assertEquals(ExecutionStateEnum.COMPLETED, finished.getState());
        Assertions.assertNotNull(finished.getResultSummary());
        long ticks = store.snapshot().getExecutionLogs().stream()
                .filter(item -> "tick".equals(item.getStep()))
                .count();
        Assertions.assertEquals(3, ticks);
    }

    @Test
    public void shouldTreatNonPositiveStepBudgetAsSingleTick() {
        ExecutionEntity first = commandService.startExecution(PLAN_ID, null, null, null, true);
        ExecutionEntity second = commandService.startExecution(PLAN_ID, null, null, null, true);

        ExecutionEntity afterZero = commandService.run(first.getExecutionId(), 0);
        ExecutionEntity afterNegative = commandService.run(second.getExecutionId(), -3);

        Assertions.assertEquals(1, tickCount(first.getExecutionId()));
        Assertions.assertEquals(1, tickCount(second.getExecutionId()));
        Assertions.assertEquals(TaskStatusEnum.COMPLETED, afterZero.findTask("task_1").getStatus());
        Assertions.assertEquals(TaskStatusEnum.PENDING, afterNegative.findTask("task_3").getStatus());
    }

    @Test
    public void shouldStopStalledExecutionAfterStepBudget() {
        String executionId = stalledExecution();

        ExecutionEntity afterRun = commandService.run(executionId, 5);

        Assertions.assertEquals(5, tickCount(executionId));
        Assertions.assertEquals(ExecutionStateEnum.RUNNING, afterRun.getState());
        Assertions.assertEquals(TaskStatusEnum.PENDING, afterRun.findTask("task_2").getStatus());
    }

    @Test
    public void shouldDefaultAndCapStepBudgetOnStalledExecution() {
        String defaulted = stalledExecution();
        String capped = stalledExecution();

        commandService.run(defaulted, null);
        commandService.run(capped, 500);

        Assertions.assertEquals(20, tickCount(defaulted));
        Assertions.assertEquals(200, tickCount(capped));
    }

    @Test
    public void shouldNotLogTickOnTerminalExecution() {
        ExecutionEntity execution = commandService.startExecution(PLAN_ID, null, null, null, true);
        commandService.run(execution.getExecutionId(), 10);
        int logsBefore = store.snapshot().getExecutionLogs().size();

        ExecutionEntity after = commandService.tick(execution.getExecutionId());

        Assertions.assertEquals(ExecutionStateEnum.COMPLETED, after.getState());
        Assertions.assertEquals(logsBefore, store.snapshot().getExecutionLogs().size());
    }

    @Test
    public void shouldCancelOnceAndRejectSecondCancel() {
        ExecutionEntity execution = commandService.startExecution(PLAN_ID, null, null, null, true);

        ExecutionEntity cancelled = commandService.cancel(execution.getExecutionId(), null);

        Assertions.assertEquals(ExecutionStateEnum.CANCELLED, cancelled.getState());
        Assertions.assertNotNull(cancelled.getFinishedAt());
        Assertions.assertEquals("Execution cancelled", cancelled.getResultSummary());

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> commandService.cancel(execution.getExecutionId(), "again"));
        Assertions.assertEquals(ResponseCode.PRECONDITION_FAILED.getCode(), ex.getCode());

        ExecutionEntity ticked = commandService.tick(execution.getExecutionId());
        Assertions.assertEquals(ExecutionStateEnum.CANCELLED, ticked.getState());
    }

    @Test
    public void shouldReportMissingExecution() {
        AppException ex = Assertions.assertThrows(AppException.class,
                () -> commandService.tick("nope"));
        Assertions.assertEquals(ResponseCode.NOT_FOUND.getCode(), ex.getCode());
    }

    @Test
    public void shouldRecordManualLogEntry() {
        ExecutionLogEntity entry = commandService.recordLog(PLAN_ID, null, null, "人工确认口径", Map.of("owner", "ops"));

        Assertions.assertEquals("manual_record", entry.getStep());
        Assertions.assertEquals("planned", entry.getStatus());
        Assertions.assertEquals("人工确认口径", entry.getDetail());
        Assertions.assertEquals(1, store.snapshot().getExecutionLogs().size());

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> commandService.recordLog(null, null, "done", "x", null));
        Assertions.assertEquals(ResponseCode.ILLEGAL_PARAMETER.getCode(), ex.getCode());
    }

    @Test
    public void shouldCapExecutionsAndLogsByRetention() {
        commandService = PlanningFixtures.executionCommandService(store, new PlanningRetention(10, 2, 3, 10));

        ExecutionEntity first = commandService.startExecution(PLAN_ID, null, null, null, true);
        commandService.startExecution(PLAN_ID, null, null, null, true);
        ExecutionEntity third = commandService.startExecution(PLAN_ID, null, null, null, true);
        commandService.tick(third.getExecutionId());
        commandService.tick(third.getExecutionId());

        PlanningDocument stored = store.snapshot();
        Assertions.assertEquals(2, stored.getExecutions().size());
        Assertions.assertNull(stored.findExecution(first.getExecutionId()));
        Assertions.assertEquals(3, stored.getExecutionLogs().size());
        Assertions.assertEquals("tick", stored.getExecutionLogs().get(2).getStep());
    }

    @Test
    public void shouldFilterLogsAndClampLimits() {
        ExecutionEntity first = commandService.startExecution(PLAN_ID, null, null, null, true);
        ExecutionEntity second = commandService.startExecution(PLAN_ID, null, null, null, true);
        commandService.tick(first.getExecutionId());
        commandService.tick(second.getExecutionId());

        List<ExecutionLogEntity> firstLogs = queryService.listExecutionLogs(null, first.getExecutionId());
        Assertions.assertEquals(2, firstLogs.size());
        Assertions.assertEquals("tick", firstLogs.get(0).getStep());
        Assertions.assertTrue(firstLogs.stream().allMatch(item -> first.getExecutionId().equals(item.getExecutionId())));

        Assertions.assertEquals(1, queryService.listExecutionLogs(0, null).size());
        Assertions.assertEquals(4, queryService.listExecutionLogs(5000, null).size());

        List<ExecutionEntity> executions = queryService.listExecutions(1);
        Assertions.assertEquals(1, executions.size());
        Assertions.assertEquals(second.getExecutionId(), executions.get(0).getExecutionId());
        Assertions.assertEquals(1, queryService.listPlans(null).size());
    }

    /**
     * task_1 跳过后 task_2 被阻塞，之后每次 tick 都没有可推进的任务。
     */
    private String stalledExecution() {
        ExecutionEntity execution = commandService.startExecution(PLAN_ID, null, null, null, true);
        commandService.taskAction(execution.getExecutionId(), "task_1", "skip", null);
        return execution.getExecutionId();
    }

    private long tickCount(String executionId) {
        return store.snapshot().getExecutionLogs().stream()
                .filter(item -> executionId.equals(item.getExecutionId()))
                .filter(item -> "tick".equals(item.getStep()))
                .count();
    }
}
