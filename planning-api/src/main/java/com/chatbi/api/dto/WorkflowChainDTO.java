package com.chatbi.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 协作链 DTO。
 */
@Data
public class WorkflowChainDTO {

    private String id;
    private String name;
    private Boolean enabled;
    private String mode;
    private List<ChainStepDTO> steps;
}
