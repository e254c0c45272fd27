package com.chatbi.domain.planning.model.entity;

import com.chatbi.domain.planning.model.valobj.PlanTask;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 执行计划实体，生成后不再修改。
 *
 * @author chatbi
 * @since 2025-01-30
 */
@Data
public class PlanEntity {

    /**
     * 计划 ID
     */
    private String planId;

    /**
     * 场景
     */
    private String scene;

    /**
     * 原始问题
     */
    private String question;

    /**
     * 推断分类
     */
    private String category;

    /**
     * 协作模式
     */
    private String workflowMode;

    /**
     * 选中的协作链快照
     */
    private WorkflowChainEntity workflowChain;

    /**
     * 策略关注点
     */
    private String strategyFocus;

    /**
     * 有序任务列表
     */
    private List<PlanTask> tasks = new ArrayList<>();

    /**
     * 规划依据
     */
    private List<String> rationale = new ArrayList<>();

    /**
     * 创建时间
     */
    private LocalDateTime createdAt;

    public int taskCount() {
        return tasks == null ? 0 : tasks.size();
    }
}
