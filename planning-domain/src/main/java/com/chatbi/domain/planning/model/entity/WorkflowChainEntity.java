package com.chatbi.domain.planning.model.entity;

import com.chatbi.domain.planning.model.valobj.ChainStep;
import com.chatbi.types.common.Constants;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 协作链模板实体
 *
 * @author chatbi
 * @since 2025-01-30
 */
@Data
public class WorkflowChainEntity {

    /**
     * 协作链 ID
     */
    private String id;

    /**
     * 名称
     */
    private String name;

    /**
     * 是否启用，缺省视为启用
     */
    private Boolean enabled;

    /**
     * 协作模式
     */
    private String mode;

    /**
     * 角色步骤
     */
    private List<ChainStep> steps = new ArrayList<>();

    public boolean isActive() {
        return enabled == null || enabled;
    }

    /**
     * 无可用协作链时的兜底模板。
     */
    public static WorkflowChainEntity defaultChain() {
        WorkflowChainEntity chain = new WorkflowChainEntity();
        chain.setName("Default A2A Chain");
        chain.setEnabled(true);
        chain.setMode(Constants.DEFAULT_WORKFLOW_MODE);
        chain.setSteps(new ArrayList<>());
        return chain;
    }
}
