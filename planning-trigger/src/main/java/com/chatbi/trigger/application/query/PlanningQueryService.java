package com.chatbi.trigger.application.query;

import com.chatbi.domain.execution.model.entity.ExecutionEntity;
import com.chatbi.domain.execution.model.entity.ExecutionLogEntity;
import com.chatbi.domain.execution.service.ExecutionStateDomainService;
import com.chatbi.domain.planning.adapter.repository.IPlanningStoreRepository;
import com.chatbi.domain.planning.model.aggregate.PlanningDocument;
import com.chatbi.domain.planning.model.entity.PlanEntity;
import com.chatbi.domain.planning.model.entity.PlanningRuleEntity;
import com.chatbi.domain.planning.model.entity.WorkflowChainEntity;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 规划读用例：目录、计划历史、执行实例与执行日志查询。
 * <p>
 * 列表查询只读：执行实例在返回前归一化，但不写回文档。
 * </p>
 */
@Service
public class PlanningQueryService {

    public static final int DEFAULT_PLAN_LIMIT = 100;
    public static final int MAX_PLAN_LIMIT = 500;
    public static final int DEFAULT_EXECUTION_LIMIT = 100;
    public static final int MAX_EXECUTION_LIMIT = 500;
    public static final int DEFAULT_LOG_LIMIT = 200;
    public static final int MAX_LOG_LIMIT = 1000;

    private final IPlanningStoreRepository planningStoreRepository;
    private final ExecutionStateDomainService executionStateDomainService;

    public PlanningQueryService(IPlanningStoreRepository planningStoreRepository,
                                ExecutionStateDomainService executionStateDomainService) {
        this.planningStoreRepository = planningStoreRepository;
        this.executionStateDomainService = executionStateDomainService;
    }

    public List<PlanningRuleEntity> listRules() {
        return new ArrayList<>(planningStoreRepository.load().getRules());
    }

    public List<WorkflowChainEntity> listChains() {
        return new ArrayList<>(planningStoreRepository.load().getChains());
    }

    public List<PlanEntity> listPlans(Integer limit) {
        PlanningDocument document = planningStoreRepository.load();
        return PlanningDocument.latestFirst(document.getPlanHistory(),
                clamp(limit, DEFAULT_PLAN_LIMIT, MAX_PLAN_LIMIT));
    }

    public List<ExecutionEntity> listExecutions(Integer limit) {
        PlanningDocument document = planningStoreRepository.load();
        List<ExecutionEntity> executions = PlanningDocument.latestFirst(document.getExecutions(),
                clamp(limit, DEFAULT_EXECUTION_LIMIT, MAX_EXECUTION_LIMIT));
        executions.forEach(executionStateDomainService::normalize);
        return executions;
    }

    /**
     * 先按 executionId 过滤，再取最近 limit 条。
     */
    public List<ExecutionLogEntity> listExecutionLogs(Integer limit, String executionId) {
        List<ExecutionLogEntity> logs = planningStoreRepository.load().getExecutionLogs();
        if (StringUtils.isNotBlank(executionId)) {
            logs = logs.stream()
                    .filter(item -> executionId.equals(item.getExecutionId()))
                    .collect(Collectors.toList());
        }
        return PlanningDocument.latestFirst(logs, clamp(limit, DEFAULT_LOG_LIMIT, MAX_LOG_LIMIT));
    }

    private int clamp(Integer limit, int defaultValue, int max) {
        if (limit == null) {
            return defaultValue;
        }
        return Math.max(1, Math.min(limit, max));
    }
}
