package com.chatbi.trigger.application.common;

import com.chatbi.api.dto.ChainStepDTO;
import com.chatbi.api.dto.ExecutionDetailDTO;
import com.chatbi.api.dto.ExecutionLogDTO;
import com.chatbi.api.dto.ExecutionTaskDTO;
import com.chatbi.api.dto.PlanDetailDTO;
import com.chatbi.api.dto.PlanTaskDTO;
import com.chatbi.api.dto.PlanningRuleDTO;
import com.chatbi.api.dto.WorkflowChainDTO;
import com.chatbi.domain.execution.model.entity.ExecutionEntity;
import com.chatbi.domain.execution.model.entity.ExecutionLogEntity;
import com.chatbi.domain.execution.model.entity.ExecutionTaskEntity;
import com.chatbi.domain.planning.model.entity.PlanEntity;
import com.chatbi.domain.planning.model.entity.PlanningRuleEntity;
import com.chatbi.domain.planning.model.entity.WorkflowChainEntity;
import com.chatbi.domain.planning.model.valobj.ChainStep;
import com.chatbi.domain.planning.model.valobj.PlanTask;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 规划视图组装器：领域实体与接口 DTO 之间的双向映射。
 */
@Component
public class PlanningViewAssembler {

    public PlanningRuleDTO toRuleDTO(PlanningRuleEntity rule) {
        if (rule == null) {
            return null;
        }
        PlanningRuleDTO dto = new PlanningRuleDTO();
        dto.setId(rule.getId());
        dto.setName(rule.getName());
        dto.setEnabled(rule.isActive());
        dto.setMatchKeywords(copy(rule.getMatchKeywords()));
        dto.setSplitTemplate(copy(rule.getSplitTemplate()));
        dto.setPreferredAgents(copy(rule.getPreferredAgents()));
        dto.setToolchain(rule.getToolchain() == null ? new LinkedHashMap<>() : new LinkedHashMap<>(rule.getToolchain()));
        return dto;
    }

    /**
     * 缺少 ID 的规则补发 UUID，enabled 缺省为 true。
     */
    public PlanningRuleEntity toRuleEntity(PlanningRuleDTO dto) {
        if (dto == null) {
            return null;
        }
        PlanningRuleEntity rule = new PlanningRuleEntity();
        rule.setId(dto.getId() == null || dto.getId().isBlank() ? UUID.randomUUID().toString() : dto.getId());
        rule.setName(dto.getName());
        rule.setEnabled(dto.getEnabled() == null || dto.getEnabled());
        rule.setMatchKeywords(copy(dto.getMatchKeywords()));
        rule.setSplitTemplate(copy(dto.getSplitTemplate()));
        rule.setPreferredAgents(copy(dto.getPreferredAgents()));
        rule.setToolchain(dto.getToolchain() == null ? new LinkedHashMap<>() : new LinkedHashMap<>(dto.getToolchain()));
        return rule;
    }

    public WorkflowChainDTO toChainDTO(WorkflowChainEntity chain) {
        if (chain == null) {
            return null;
        }
        WorkflowChainDTO dto = new WorkflowChainDTO();
        dto.setId(chain.getId());
        dto.setName(chain.getName());
        dto.setEnabled(chain.isActive());
        dto.setMode(chain.getMode());
        dto.setSteps(mapList(chain.getSteps(), this::toChainStepDTO));
        return dto;
    }

    public WorkflowChainEntity toChainEntity(WorkflowChainDTO dto) {
        if (dto == null) {
            return null;
        }
        WorkflowChainEntity chain = new WorkflowChainEntity();
        chain.setId(dto.getId() == null || dto.getId().isBlank() ? UUID.randomUUID().toString() : dto.getId());
        chain.setName(dto.getName());
        chain.setEnabled(dto.getEnabled() == null || dto.getEnabled());
        chain.setMode(dto.getMode());
        chain.setSteps(mapList(dto.getSteps(),
                step -> new ChainStep(step.getName(), step.getRole(), step.getHandoffTo())));
        return chain;
    }

    public PlanDetailDTO toPlanDTO(PlanEntity plan) {
        if (plan == null) {
            return null;
        }
        PlanDetailDTO dto = new PlanDetailDTO();
        dto.setPlanId(plan.getPlanId());
        dto.setScene(plan.getScene());
        dto.setQuestion(plan.getQuestion());
        dto.setCategory(plan.getCategory());
        dto.setWorkflowMode(plan.getWorkflowMode());
        dto.setWorkflowChain(toChainDTO(plan.getWorkflowChain()));
        dto.setStrategyFocus(plan.getStrategyFocus());
        dto.setTasks(mapList(plan.getTasks(), this::toPlanTaskDTO));
        dto.setRationale(copy(plan.getRationale()));
        dto.setCreatedAt(plan.getCreatedAt());
        return dto;
    }

    public ExecutionDetailDTO toExecutionDTO(ExecutionEntity execution) {
        if (execution == null) {
            return null;
        }
        ExecutionDetailDTO dto = new ExecutionDetailDTO();
        dto.setExecutionId(execution.getExecutionId());
        dto.setPlanId(execution.getPlanId());
        dto.setQuestion(execution.getQuestion());
        dto.setScene(execution.getScene());
        dto.setCategory(execution.getCategory());
        dto.setWorkflowMode(execution.getWorkflowMode());
        dto.setState(execution.getState() == null ? null : execution.getState().getCode());
        dto.setAutoStart(execution.getAutoStart());
        dto.setCreatedAt(execution.getCreatedAt());
        dto.setUpdatedAt(execution.getUpdatedAt());
        dto.setStartedAt(execution.getStartedAt());
        dto.setFinishedAt(execution.getFinishedAt());
        dto.setTasks(mapList(execution.getTasks(), this::toExecutionTaskDTO));
        dto.setResultSummary(execution.getResultSummary());
        return dto;
    }

    public ExecutionLogDTO toLogDTO(ExecutionLogEntity logEntity) {
        if (logEntity == null) {
            return null;
        }
        ExecutionLogDTO dto = new ExecutionLogDTO();
        dto.setExecutionId(logEntity.getExecutionId());
        dto.setPlanId(logEntity.getPlanId());
        dto.setStep(logEntity.getStep());
        dto.setStatus(logEntity.getStatus());
        dto.setDetail(logEntity.getDetail());
        dto.setMetadata(logEntity.getMetadata());
        dto.setTimestamp(logEntity.getTimestamp());
        return dto;
    }

    public <S, T> List<T> mapList(List<S> source, Function<S, T> mapper) {
        if (source == null || source.isEmpty()) {
            return Collections.emptyList();
        }
        return source.stream()
                .filter(Objects::nonNull)
                .map(mapper)
                .collect(Collectors.toList());
    }

    private ChainStepDTO toChainStepDTO(ChainStep step) {
        ChainStepDTO dto = new ChainStepDTO();
        dto.setName(step.getName());
        dto.setRole(step.getRole());
        dto.setHandoffTo(step.getHandoffTo());
        return dto;
    }

    private PlanTaskDTO toPlanTaskDTO(PlanTask task) {
        PlanTaskDTO dto = new PlanTaskDTO();
        dto.setTaskId(task.getTaskId());
        dto.setTitle(task.getTitle());
        dto.setObjective(task.getObjective());
        dto.setAssignedAgent(task.getAssignedAgent());
        dto.setDependsOn(copy(task.getDependsOn()));
        dto.setToolchain(task.getToolchain());
        return dto;
    }

    private ExecutionTaskDTO toExecutionTaskDTO(ExecutionTaskEntity task) {
        ExecutionTaskDTO dto = new ExecutionTaskDTO();
        dto.setTaskId(task.getTaskId());
        dto.setTitle(task.getTitle());
        dto.setAssignedAgent(task.getAssignedAgent());
        dto.setDependsOn(copy(task.getDependsOn()));
        dto.setToolchain(task.getToolchain());
        dto.setStatus(task.getStatus() == null ? null : task.getStatus().getCode());
        dto.setAttempts(task.normalizedAttempts());
        dto.setStartedAt(task.getStartedAt());
        dto.setFinishedAt(task.getFinishedAt());
        dto.setOutputSummary(task.getOutputSummary());
        dto.setError(task.getError());
        return dto;
    }

    private List<String> copy(List<String> source) {
        return source == null ? new ArrayList<>() : new ArrayList<>(source);
    }
}
