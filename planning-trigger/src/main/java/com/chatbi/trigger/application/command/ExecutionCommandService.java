package com.chatbi.trigger.application.command;

import com.chatbi.domain.execution.model.entity.ExecutionEntity;
import com.chatbi.domain.execution.model.entity.ExecutionLogEntity;
import com.chatbi.domain.execution.model.valobj.TickOutcome;
import com.chatbi.domain.execution.service.ExecutionStateDomainService;
import com.chatbi.domain.execution.service.ExecutionTickDomainService;
import com.chatbi.domain.execution.service.TaskActionDomainService;
import com.chatbi.domain.planning.adapter.repository.IPlanningStoreRepository;
import com.chatbi.domain.planning.model.aggregate.PlanningDocument;
import com.chatbi.domain.planning.model.entity.PlanEntity;
import com.chatbi.domain.planning.model.valobj.PlanningRetention;
import com.chatbi.domain.planning.service.PlanBuilderDomainService;
import com.chatbi.types.common.Constants;
import com.chatbi.types.exception.AppException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 执行实例写用例：创建、人工动作、单步/多步推进、取消与人工记录。
 * <p>
 * 每个用例都在仓储的一次 load -> modify -> save 周期内完成。
 * </p>
 */
@Slf4j
@Service
public class ExecutionCommandService {

    private static final String DEFAULT_CANCEL_REASON = "Execution cancelled";
    private static final String DEFAULT_RECORD_STATUS = "planned";

    private final IPlanningStoreRepository planningStoreRepository;
    private final PlanBuilderDomainService planBuilderDomainService;
    private final ExecutionStateDomainService executionStateDomainService;
    private final TaskActionDomainService taskActionDomainService;
    private final ExecutionTickDomainService executionTickDomainService;
    private final PlanningRetention planningRetention;
    private final Counter executionStartCounter;
    private final Counter tickCounter;

    public ExecutionCommandService(IPlanningStoreRepository planningStoreRepository,
                                   PlanBuilderDomainService planBuilderDomainService,
                                   ExecutionStateDomainService executionStateDomainService,
                                   TaskActionDomainService taskActionDomainService,
                                   ExecutionTickDomainService executionTickDomainService,
                                   PlanningRetention planningRetention) {
        this.planningStoreRepository = planningStoreRepository;
        this.planBuilderDomainService = planBuilderDomainService;
        this.executionStateDomainService = executionStateDomainService;
        this.taskActionDomainService = taskActionDomainService;
        this.executionTickDomainService = executionTickDomainService;
        this.planningRetention = planningRetention;
        this.executionStartCounter = Counter.builder("planning.execution.start.total").register(Metrics.globalRegistry);
        this.tickCounter = Counter.builder("planning.execution.tick.total").register(Metrics.globalRegistry);
    }

    /**
     * 创建执行实例。planId 优先；未提供 planId 时按 question 现场生成计划。
     */
    public ExecutionEntity startExecution(String planId,
                                          String question,
                                          String scene,
                                          String category,
                                          boolean autoStart) {
        ExecutionEntity created = planningStoreRepository.execute(document -> {
            PlanEntity plan = resolvePlan(document, planId, question, scene, category);
            ExecutionEntity execution = ExecutionEntity.fromPlan(plan, autoStart);
            executionStateDomainService.normalize(execution);
            if (autoStart) {
                execution.markRunning();
            }
            document.appendExecution(execution, planningRetention.executionLimit());

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("plan_id", plan.getPlanId());
            metadata.put("task_count", plan.taskCount());
            appendLog(document, execution, Constants.STEP_EXECUTION_START, Constants.LOG_STATUS_SUCCESS,
                    "A2A execution created", metadata);
            return execution;
        });
        executionStartCounter.increment();
        log.info("EXECUTION_START executionId={}, planId={}, autoStart={}, state={}, taskCount={}",
                created.getExecutionId(),
                created.getPlanId(),
                autoStart,
                stateOf(created),
                created.getTasks().size());
        return created;
    }

    /**
     * 人工任务动作，动作码见 TaskActionEnum。
     */
    public ExecutionEntity taskAction(String executionId, String taskId, String action, String note) {
        ExecutionEntity execution = planningStoreRepository.execute(document -> {
            ExecutionEntity target = requireExecution(document, executionId);
            ExecutionLogEntity logEntity = taskActionDomainService.apply(target, taskId, action, note);
            document.appendExecutionLog(logEntity, planningRetention.executionLogLimit());
            return target;
        });
        String actionCode = StringUtils.trimToEmpty(action).toLowerCase(Locale.ROOT);
        Counter.builder("planning.execution.task_action.total")
                .tag("action", actionCode)
                .register(Metrics.globalRegistry)
                .increment();
        log.info("TASK_ACTION executionId={}, taskId={}, action={}, state={}",
                executionId, taskId, actionCode, stateOf(execution));
        return execution;
    }

    /**
     * 单步推进。终态执行原样返回。
     */
    public ExecutionEntity tick(String executionId) {
        TickResult result = planningStoreRepository.execute(document -> {
            ExecutionEntity target = requireExecution(document, executionId);
            TickOutcome outcome = executionTickDomainService.tick(target);
            if (outcome.logEntry() != null) {
                document.appendExecutionLog(outcome.logEntry(), planningRetention.executionLogLimit());
            }
            return new TickResult(target, outcome);
        });
        if (result.outcome().applied()) {
            tickCounter.increment();
            log.info("EXECUTION_TICK executionId={}, completedTaskId={}, state={}",
                    executionId, result.outcome().completedTaskId(), stateOf(result.execution()));
        } else {
            log.debug("EXECUTION_TICK_NOOP executionId={}, state={}", executionId, stateOf(result.execution()));
        }
        return result.execution();
    }

    /**
     * 多步推进，步数限制在 [1, 200]，到达终态提前结束。
     */
    public ExecutionEntity run(String executionId, Integer maxSteps) {
        int steps = Math.max(1, Math.min(maxSteps == null ? 20 : maxSteps, Constants.MAX_RUN_STEPS));
        ExecutionEntity execution = getExecution(executionId);
        int performed = 0;
        for (int i = 0; i < steps; i++) {
            if (execution.isTerminal()) {
                break;
            }
            execution = tick(executionId);
            performed++;
        }
        log.info("EXECUTION_RUN executionId={}, maxSteps={}, ticks={}, state={}",
                executionId, steps, performed, stateOf(execution));
        return execution;
    }

    /**
     * 取消执行，已处于终态时报 PreconditionFailed。
     */
    public ExecutionEntity cancel(String executionId, String note) {
        ExecutionEntity execution = planningStoreRepository.execute(document -> {
            ExecutionEntity target = requireExecution(document, executionId);
            try {
                target.cancel(StringUtils.defaultIfBlank(note, DEFAULT_CANCEL_REASON));
            } catch (IllegalStateException ex) {
                throw AppException.preconditionFailed(ex.getMessage());
            }
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("note", note);
            appendLog(document, target, Constants.STEP_EXECUTION_CANCEL, Constants.LOG_STATUS_SUCCESS,
                    "A2A execution cancelled", metadata);
            return target;
        });
        log.info("EXECUTION_CANCEL executionId={}, planId={}", executionId, execution.getPlanId());
        return execution;
    }

    /**
     * 读取单个执行实例，归一化结果会写回。
     */
    public ExecutionEntity getExecution(String executionId) {
        return planningStoreRepository.execute(document -> {
            ExecutionEntity target = requireExecution(document, executionId);
            executionStateDomainService.normalize(target);
            return target;
        });
    }

    /**
     * 人工追加一条执行记录。
     */
    public ExecutionLogEntity recordLog(String planId,
                                        String executionId,
                                        String status,
                                        String note,
                                        Map<String, Object> metadata) {
        if (StringUtils.isBlank(planId)) {
            throw AppException.invalidArgument("planId is required");
        }
        ExecutionLogEntity entry = ExecutionLogEntity.of(StringUtils.trimToNull(executionId),
                Constants.STEP_MANUAL_RECORD,
                StringUtils.defaultIfBlank(status, DEFAULT_RECORD_STATUS),
                note,
                metadata);
        entry.setPlanId(planId);
        planningStoreRepository.execute(document -> {
            document.appendExecutionLog(entry, planningRetention.executionLogLimit());
            return entry;
        });
        log.info("EXECUTION_RECORD planId={}, executionId={}, status={}", planId, executionId, entry.getStatus());
        return entry;
    }

    private PlanEntity resolvePlan(PlanningDocument document,
                                   String planId,
                                   String question,
                                   String scene,
                                   String category) {
        if (StringUtils.isNotBlank(planId)) {
            PlanEntity plan = document.findPlan(planId);
            if (plan == null) {
                throw AppException.notFound("Plan not found: " + planId);
            }
            return plan;
        }
        if (StringUtils.isBlank(question)) {
            throw AppException.invalidArgument("Either planId or question is required");
        }
        PlanEntity plan = planBuilderDomainService.buildPlan(question,
                scene,
                category,
                document.activeRules(),
                document.activeChains());
        document.appendPlan(plan, planningRetention.planHistoryLimit());
        return plan;
    }

    private ExecutionEntity requireExecution(PlanningDocument document, String executionId) {
        ExecutionEntity execution = document.findExecution(executionId);
        if (execution == null) {
            throw AppException.notFound("Execution not found: " + executionId);
        }
        return execution;
    }

    private void appendLog(PlanningDocument document,
                           ExecutionEntity execution,
                           String step,
                           String status,
                           String detail,
                           Map<String, Object> metadata) {
        ExecutionLogEntity entry = ExecutionLogEntity.of(execution.getExecutionId(), step, status, detail, metadata);
        entry.setPlanId(execution.getPlanId());
        document.appendExecutionLog(entry, planningRetention.executionLogLimit());
    }

    private String stateOf(ExecutionEntity execution) {
        return execution == null || execution.getState() == null ? "-" : execution.getState().getCode();
    }

    private record TickResult(ExecutionEntity execution, TickOutcome outcome) {
    }
}
