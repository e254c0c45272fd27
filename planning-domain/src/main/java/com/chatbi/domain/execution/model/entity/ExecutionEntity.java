package com.chatbi.domain.execution.model.entity;

import com.chatbi.domain.planning.model.entity.PlanEntity;
import com.chatbi.domain.planning.model.valobj.PlanTask;
import com.chatbi.types.enums.ExecutionStateEnum;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * 执行实例实体（聚合根），每次编排运行创建一个。
 *
 * @author chatbi
 * @since 2025-01-30
 */
@Data
public class ExecutionEntity {

    /**
     * 执行 ID
     */
    private String executionId;

    /**
     * 来源计划 ID
     */
    private String planId;

    /**
     * 原始问题
     */
    private String question;

    /**
     * 场景
     */
    private String scene;

    /**
     * 分类
     */
    private String category;

    /**
     * 协作模式
     */
    private String workflowMode;

    /**
     * 执行状态，由任务状态推导
     */
    private ExecutionStateEnum state;

    /**
     * 是否创建后立即进入运行
     */
    private Boolean autoStart;

    /**
     * 创建时间
     */
    private LocalDateTime createdAt;

    /**
     * 更新时间
     */
    private LocalDateTime updatedAt;

    /**
     * 开始时间
     */
    private LocalDateTime startedAt;

    /**
     * 结束时间
     */
    private LocalDateTime finishedAt;

    /**
     * 执行任务
     */
    private List<ExecutionTaskEntity> tasks = new ArrayList<>();

    /**
     * 结果摘要
     */
    private String resultSummary;

    /**
     * 按计划实例化执行实例，所有任务初始为 PENDING。
     */
    public static ExecutionEntity fromPlan(PlanEntity plan, boolean autoStart) {
        LocalDateTime now = LocalDateTime.now();
        ExecutionEntity execution = new ExecutionEntity();
        execution.setExecutionId(UUID.randomUUID().toString());
        execution.setPlanId(plan.getPlanId());
        execution.setQuestion(plan.getQuestion());
        execution.setScene(plan.getScene());
        execution.setCategory(plan.getCategory());
        execution.setWorkflowMode(plan.getWorkflowMode());
        execution.setState(ExecutionStateEnum.PENDING);
        execution.setAutoStart(autoStart);
        execution.setCreatedAt(now);
        execution.setUpdatedAt(now);

        List<ExecutionTaskEntity> tasks = new ArrayList<>();
        if (plan.getTasks() != null) {
            for (PlanTask planTask : plan.getTasks()) {
                tasks.add(ExecutionTaskEntity.fromPlanTask(planTask));
            }
        }
        execution.setTasks(tasks);
        return execution;
    }

    public ExecutionTaskEntity findTask(String taskId) {
        if (taskId == null || tasks == null) {
            return null;
        }
        for (ExecutionTaskEntity task : tasks) {
            if (taskId.equals(task.getTaskId())) {
                return task;
            }
        }
        return null;
    }

    public boolean isTerminal() {
        return state != null && state.isTerminal();
    }

    /**
     * 强制进入运行态，首次进入时记录开始时间
     */
    public void markRunning() {
        this.state = ExecutionStateEnum.RUNNING;
        if (this.startedAt == null) {
            this.startedAt = LocalDateTime.now();
        }
    }

    /**
     * 强制进入运行态，不记录开始时间（用于失败重试）
     */
    public void resumeRunning() {
        this.state = ExecutionStateEnum.RUNNING;
    }

    /**
     * 强制进入失败态
     */
    public void markFailed() {
        this.state = ExecutionStateEnum.FAILED;
    }

    /**
     * 取消执行
     */
    public void cancel(String reason) {
        if (isTerminal()) {
            throw new IllegalStateException("Execution already finished: " + state.getCode());
        }
        LocalDateTime now = LocalDateTime.now();
        this.state = ExecutionStateEnum.CANCELLED;
        this.finishedAt = now;
        this.updatedAt = now;
        this.resultSummary = reason;
    }
}
