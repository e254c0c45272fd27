package com.chatbi.domain.planning.model.entity;

import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 任务拆解规则实体
 *
 * @author chatbi
 * @since 2025-01-30
 */
@Data
public class PlanningRuleEntity {

    /**
     * 规则 ID
     */
    private String id;

    /**
     * 规则名称
     */
    private String name;

    /**
     * 是否启用，缺省视为启用
     */
    private Boolean enabled;

    /**
     * 命中关键字（按顺序）
     */
    private List<String> matchKeywords = new ArrayList<>();

    /**
     * 拆解步骤标题模板
     */
    private List<String> splitTemplate = new ArrayList<>();

    /**
     * 按位置指派的 Agent 名称
     */
    private List<String> preferredAgents = new ArrayList<>();

    /**
     * 工具开关
     */
    private Map<String, Boolean> toolchain = new LinkedHashMap<>();

    public boolean isActive() {
        return enabled == null || enabled;
    }

    /**
     * 任意关键字（忽略大小写）出现在问题中即命中。
     */
    public boolean matches(String question) {
        if (question == null || matchKeywords == null || matchKeywords.isEmpty()) {
            return false;
        }
        String normalizedQuestion = question.toLowerCase(Locale.ROOT);
        for (String keyword : matchKeywords) {
            if (keyword == null || keyword.isEmpty()) {
                continue;
            }
            if (normalizedQuestion.contains(keyword.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }
}
