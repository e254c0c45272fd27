package com.chatbi.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 协作链整体替换请求 DTO。
 */
@Data
public class PlanningChainsUpdateRequestDTO {

    private List<WorkflowChainDTO> chains;
}
