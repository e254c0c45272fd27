package com.chatbi.api.dto;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 计划详情 DTO。
 */
@Data
public class PlanDetailDTO {

    private String planId;
    private String scene;
    private String question;
    private String category;
    private String workflowMode;
    private WorkflowChainDTO workflowChain;
    private String strategyFocus;
    private List<PlanTaskDTO> tasks;
    private List<String> rationale;
    private LocalDateTime createdAt;
}
