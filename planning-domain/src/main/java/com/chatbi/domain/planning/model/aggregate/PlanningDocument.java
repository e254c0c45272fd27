package com.chatbi.domain.planning.model.aggregate;

import com.chatbi.domain.correction.model.entity.CorrectionLogEntity;
import com.chatbi.domain.execution.model.entity.ExecutionEntity;
import com.chatbi.domain.execution.model.entity.ExecutionLogEntity;
import com.chatbi.domain.planning.model.entity.PlanEntity;
import com.chatbi.domain.planning.model.entity.PlanningRuleEntity;
import com.chatbi.domain.planning.model.entity.WorkflowChainEntity;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 规划文档聚合：规则、协作链、计划历史、执行实例与日志作为一个整体读写。
 * <p>
 * 计划历史、执行实例与日志均为有界列表，新元素追加到尾部，超过上限时从头部淘汰。
 * </p>
 *
 * @author chatbi
 * @since 2025-01-30
 */
@Data
public class PlanningDocument {

    private List<PlanningRuleEntity> rules = new ArrayList<>();

    private List<WorkflowChainEntity> chains = new ArrayList<>();

    private List<PlanEntity> planHistory = new ArrayList<>();

    private List<ExecutionEntity> executions = new ArrayList<>();

    private List<ExecutionLogEntity> executionLogs = new ArrayList<>();

    private List<CorrectionLogEntity> correctionLogs = new ArrayList<>();

    private LocalDateTime updatedAt;

    public List<PlanningRuleEntity> activeRules() {
        return safe(rules).stream()
                .filter(rule -> rule != null && rule.isActive())
                .collect(Collectors.toList());
    }

    public List<WorkflowChainEntity> activeChains() {
        return safe(chains).stream()
                .filter(chain -> chain != null && chain.isActive())
                .collect(Collectors.toList());
    }

    public void replaceRules(List<PlanningRuleEntity> nextRules) {
        this.rules = nextRules == null ? new ArrayList<>() : new ArrayList<>(nextRules);
        this.updatedAt = LocalDateTime.now();
    }

    public void replaceChains(List<WorkflowChainEntity> nextChains) {
        this.chains = nextChains == null ? new ArrayList<>() : new ArrayList<>(nextChains);
        this.updatedAt = LocalDateTime.now();
    }

    public PlanEntity findPlan(String planId) {
        if (planId == null) {
            return null;
        }
        for (PlanEntity plan : safe(planHistory)) {
            if (plan != null && planId.equals(plan.getPlanId())) {
                return plan;
            }
        }
        return null;
    }

    public ExecutionEntity findExecution(String executionId) {
        if (executionId == null) {
            return null;
        }
        for (ExecutionEntity execution : safe(executions)) {
            if (execution != null && executionId.equals(execution.getExecutionId())) {
                return execution;
            }
        }
        return null;
    }

    public void appendPlan(PlanEntity plan, int limit) {
        this.planHistory = appendCapped(planHistory, plan, limit);
    }

    public void appendExecution(ExecutionEntity execution, int limit) {
        this.executions = appendCapped(executions, execution, limit);
    }

    public void appendExecutionLog(ExecutionLogEntity logEntity, int limit) {
        this.executionLogs = appendCapped(executionLogs, logEntity, limit);
    }

    public void appendCorrectionLog(CorrectionLogEntity logEntity, int limit) {
        this.correctionLogs = appendCapped(correctionLogs, logEntity, limit);
    }

    /**
     * 取最近 limit 条，最新的排在最前。
     */
    public static <T> List<T> latestFirst(List<T> source, int limit) {
        List<T> items = safe(source);
        int from = Math.max(0, items.size() - Math.max(limit, 0));
        List<T> latest = new ArrayList<>(items.subList(from, items.size()));
        Collections.reverse(latest);
        return latest;
    }

    private static <T> List<T> appendCapped(List<T> source, T item, int limit) {
        List<T> items = source == null ? new ArrayList<>() : source;
        items.add(item);
        int max = Math.max(limit, 1);
        if (items.size() > max) {
            items.subList(0, items.size() - max).clear();
        }
        return items;
    }

    private static <T> List<T> safe(List<T> source) {
        return source == null ? new ArrayList<>() : source;
    }
}
