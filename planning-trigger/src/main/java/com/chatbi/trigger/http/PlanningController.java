package com.chatbi.trigger.http;

import com.chatbi.api.dto.ExecutionCancelRequestDTO;
import com.chatbi.api.dto.ExecutionDetailDTO;
import com.chatbi.api.dto.ExecutionLogDTO;
import com.chatbi.api.dto.ExecutionLogRecordRequestDTO;
import com.chatbi.api.dto.ExecutionRunRequestDTO;
import com.chatbi.api.dto.ExecutionStartRequestDTO;
import com.chatbi.api.dto.PlanDetailDTO;
import com.chatbi.api.dto.PlanRequestDTO;
import com.chatbi.api.dto.PlanningChainsUpdateRequestDTO;
import com.chatbi.api.dto.PlanningRuleDTO;
import com.chatbi.api.dto.PlanningRulesUpdateRequestDTO;
import com.chatbi.api.dto.TaskActionRequestDTO;
import com.chatbi.api.dto.WorkflowChainDTO;
import com.chatbi.api.response.Response;
import com.chatbi.trigger.application.command.ExecutionCommandService;
import com.chatbi.trigger.application.command.PlanningCatalogCommandService;
import com.chatbi.trigger.application.common.PlanningViewAssembler;
import com.chatbi.trigger.application.query.PlanningQueryService;
import com.chatbi.types.enums.ResponseCode;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 规划与执行编排 API。
 * <p>
 * 业务错误统一抛出 AppException，由 {@link GlobalApiExceptionHandler} 转换为响应码。
 * </p>
 */
@RestController
@RequestMapping("/api/v1/planning")
public class PlanningController {

    private final PlanningCatalogCommandService planningCatalogCommandService;
    private final ExecutionCommandService executionCommandService;
    private final PlanningQueryService planningQueryService;
    private final PlanningViewAssembler planningViewAssembler;

    public PlanningController(PlanningCatalogCommandService planningCatalogCommandService,
                              ExecutionCommandService executionCommandService,
                              PlanningQueryService planningQueryService,
                              PlanningViewAssembler planningViewAssembler) {
        this.planningCatalogCommandService = planningCatalogCommandService;
        this.executionCommandService = executionCommandService;
        this.planningQueryService = planningQueryService;
        this.planningViewAssembler = planningViewAssembler;
    }

    @GetMapping("/rules")
    public Response<List<PlanningRuleDTO>> listRules() {
        return success(planningViewAssembler.mapList(planningQueryService.listRules(),
                planningViewAssembler::toRuleDTO));
    }

    @PutMapping("/rules")
    public Response<List<PlanningRuleDTO>> replaceRules(@RequestBody PlanningRulesUpdateRequestDTO request) {
        if (request == null || request.getRules() == null) {
            throw new IllegalArgumentException("rules is required");
        }
        return success(planningViewAssembler.mapList(
                planningCatalogCommandService.replaceRules(
                        planningViewAssembler.mapList(request.getRules(), planningViewAssembler::toRuleEntity)),
                planningViewAssembler::toRuleDTO));
    }

    @GetMapping("/chains")
    public Response<List<WorkflowChainDTO>> listChains() {
        return success(planningViewAssembler.mapList(planningQueryService.listChains(),
                planningViewAssembler::toChainDTO));
    }

    @PutMapping("/chains")
    public Response<List<WorkflowChainDTO>> replaceChains(@RequestBody PlanningChainsUpdateRequestDTO request) {
        if (request == null || request.getChains() == null) {
            throw new IllegalArgumentException("chains is required");
        }
        return success(planningViewAssembler.mapList(
                planningCatalogCommandService.replaceChains(
                        planningViewAssembler.mapList(request.getChains(), planningViewAssembler::toChainEntity)),
                planningViewAssembler::toChainDTO));
    }

    @PostMapping("/plan")
    public Response<PlanDetailDTO> buildPlan(@RequestBody PlanRequestDTO request) {
        return success(planningViewAssembler.toPlanDTO(planningCatalogCommandService.buildPlan(
                request.getQuestion(),
                request.getScene(),
                request.getCategory())));
    }

    @GetMapping("/plans")
    public Response<List<PlanDetailDTO>> listPlans(@RequestParam(value = "limit", required = false) Integer limit) {
        return success(planningViewAssembler.mapList(planningQueryService.listPlans(limit),
                planningViewAssembler::toPlanDTO));
    }

    @PostMapping("/executions/start")
    public Response<ExecutionDetailDTO> startExecution(@RequestBody ExecutionStartRequestDTO request) {
        boolean autoStart = request.getAutoStart() == null || request.getAutoStart();
        return success(planningViewAssembler.toExecutionDTO(executionCommandService.startExecution(
                request.getPlanId(),
                request.getQuestion(),
                request.getScene(),
                request.getCategory(),
                autoStart)));
    }

    @GetMapping("/executions")
    public Response<List<ExecutionDetailDTO>> listExecutions(@RequestParam(value = "limit", required = false) Integer limit) {
        return success(planningViewAssembler.mapList(planningQueryService.listExecutions(limit),
                planningViewAssembler::toExecutionDTO));
    }

    @GetMapping("/executions/{id}")
    public Response<ExecutionDetailDTO> getExecution(@PathVariable("id") String executionId) {
        return success(planningViewAssembler.toExecutionDTO(executionCommandService.getExecution(executionId)));
    }

    @PostMapping("/executions/{id}/task-action")
    public Response<ExecutionDetailDTO> taskAction(@PathVariable("id") String executionId,
                                                   @RequestBody TaskActionRequestDTO request) {
        return success(planningViewAssembler.toExecutionDTO(executionCommandService.taskAction(
                executionId,
                request.getTaskId(),
                request.getAction(),
                request.getNote())));
    }

    @PostMapping("/executions/{id}/tick")
    public Response<ExecutionDetailDTO> tick(@PathVariable("id") String executionId) {
        return success(planningViewAssembler.toExecutionDTO(executionCommandService.tick(executionId)));
    }

    @PostMapping("/executions/{id}/run")
    public Response<ExecutionDetailDTO> run(@PathVariable("id") String executionId,
                                            @RequestBody(required = false) ExecutionRunRequestDTO request) {
        Integer maxSteps = request == null ? null : request.getMaxSteps();
        return success(planningViewAssembler.toExecutionDTO(executionCommandService.run(executionId, maxSteps)));
    }

    @PostMapping("/executions/{id}/cancel")
    public Response<ExecutionDetailDTO> cancel(@PathVariable("id") String executionId,
                                               @RequestBody(required = false) ExecutionCancelRequestDTO request) {
        String note = request == null ? null : request.getNote();
        return success(planningViewAssembler.toExecutionDTO(executionCommandService.cancel(executionId, note)));
    }

    @PostMapping("/execution")
    public Response<ExecutionLogDTO> recordExecution(@RequestBody ExecutionLogRecordRequestDTO request) {
        return success(planningViewAssembler.toLogDTO(executionCommandService.recordLog(
                request.getPlanId(),
                request.getExecutionId(),
                request.getStatus(),
                request.getNote(),
                request.getMetadata())));
    }

    @GetMapping("/execution")
    public Response<List<ExecutionLogDTO>> listExecutionLogs(
            @RequestParam(value = "limit", required = false) Integer limit,
            @RequestParam(value = "executionId", required = false) String executionId) {
        return success(planningViewAssembler.mapList(planningQueryService.listExecutionLogs(limit, executionId),
                planningViewAssembler::toLogDTO));
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
