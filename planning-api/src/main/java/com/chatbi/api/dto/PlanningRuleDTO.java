package com.chatbi.api.dto;

import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * 拆解规则 DTO。
 */
@Data
public class PlanningRuleDTO {

    private String id;
    private String name;
    private Boolean enabled;
    private List<String> matchKeywords;
    private List<String> splitTemplate;
    private List<String> preferredAgents;
    private Map<String, Boolean> toolchain;
}
