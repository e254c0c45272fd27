package com.chatbi.domain.execution.model.entity;

import com.chatbi.domain.planning.model.valobj.PlanTask;
import com.chatbi.types.enums.TaskStatusEnum;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 执行期任务实体，仅归属于一个执行实例。
 *
 * @author chatbi
 * @since 2025-01-30
 */
@Data
public class ExecutionTaskEntity {

    /**
     * 任务 ID，与计划任务一一对应
     */
    private String taskId;

    /**
     * 标题
     */
    private String title;

    /**
     * 指派 Agent
     */
    private String assignedAgent;

    /**
     * 依赖任务 ID
     */
    private List<String> dependsOn = new ArrayList<>();

    /**
     * 工具开关
     */
    private Map<String, Boolean> toolchain = new LinkedHashMap<>();

    /**
     * 状态
     */
    private TaskStatusEnum status;

    /**
     * 累计启动次数，每次 start 递增
     */
    private Integer attempts;

    /**
     * 首次启动时间
     */
    private LocalDateTime startedAt;

    /**
     * 结束时间
     */
    private LocalDateTime finishedAt;

    /**
     * 输出摘要
     */
    private String outputSummary;

    /**
     * 错误信息
     */
    private String error;

    /**
     * 由计划任务实例化，初始为 PENDING、attempts=0。
     */
    public static ExecutionTaskEntity fromPlanTask(PlanTask planTask) {
        ExecutionTaskEntity task = new ExecutionTaskEntity();
        task.setTaskId(planTask.getTaskId());
        task.setTitle(planTask.getTitle());
        task.setAssignedAgent(planTask.getAssignedAgent());
        task.setDependsOn(planTask.getDependsOn() == null
                ? new ArrayList<>()
                : new ArrayList<>(planTask.getDependsOn()));
        task.setToolchain(planTask.getToolchain() == null
                ? new LinkedHashMap<>()
                : new LinkedHashMap<>(planTask.getToolchain()));
        task.setStatus(TaskStatusEnum.PENDING);
        task.setAttempts(0);
        return task;
    }

    /**
     * 标记为就绪
     */
    public void markReady() {
        if (this.status != TaskStatusEnum.PENDING) {
            throw new IllegalStateException("Task must be in PENDING status to be marked ready");
        }
        this.status = TaskStatusEnum.READY;
    }

    /**
     * 开始执行，依赖判定由调用方完成
     */
    public void start() {
        this.status = TaskStatusEnum.RUNNING;
        this.attempts = normalizedAttempts() + 1;
        if (this.startedAt == null) {
            this.startedAt = LocalDateTime.now();
        }
        this.error = null;
    }

    /**
     * 完成任务
     */
    public void complete(String outputSummary) {
        if (!isOpen()) {
            throw new IllegalStateException("Task status does not allow complete: " + describeStatus());
        }
        this.status = TaskStatusEnum.COMPLETED;
        this.finishedAt = LocalDateTime.now();
        this.outputSummary = outputSummary;
        this.error = null;
    }

    /**
     * 失败任务
     */
    public void fail(String errorMessage) {
        if (!isOpen()) {
            throw new IllegalStateException("Task status does not allow fail: " + describeStatus());
        }
        this.status = TaskStatusEnum.FAILED;
        this.finishedAt = LocalDateTime.now();
        this.error = errorMessage;
    }

    /**
     * 失败后回到待处理，attempts 保持累计
     */
    public void retry() {
        if (this.status != TaskStatusEnum.FAILED) {
            throw new IllegalStateException("Only failed task can retry, current status: " + describeStatus());
        }
        this.status = TaskStatusEnum.PENDING;
        this.finishedAt = null;
        this.error = null;
    }

    /**
     * 跳过任务
     */
    public void skip(String outputSummary) {
        if (this.status != null && this.status.isSettled()) {
            throw new IllegalStateException("Task already finalized: " + describeStatus());
        }
        this.status = TaskStatusEnum.SKIPPED;
        this.finishedAt = LocalDateTime.now();
        this.outputSummary = outputSummary;
    }

    /**
     * pending / ready / running 允许直接完成或失败
     */
    public boolean isOpen() {
        return this.status == TaskStatusEnum.PENDING
                || this.status == TaskStatusEnum.READY
                || this.status == TaskStatusEnum.RUNNING;
    }

    public boolean isRunning() {
        return this.status == TaskStatusEnum.RUNNING;
    }

    public boolean isReady() {
        return this.status == TaskStatusEnum.READY;
    }

    public int normalizedAttempts() {
        return this.attempts == null ? 0 : Math.max(this.attempts, 0);
    }

    private String describeStatus() {
        return this.status == null ? "-" : this.status.getCode();
    }
}
