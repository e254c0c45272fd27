package com.chatbi.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 规则整体替换请求 DTO。
 */
@Data
public class PlanningRulesUpdateRequestDTO {

    private List<PlanningRuleDTO> rules;
}
