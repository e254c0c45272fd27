package com.chatbi.domain.planning.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 协作链中的单个角色步骤。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChainStep {

    /**
     * 角色名称
     */
    private String name;

    /**
     * 职责描述
     */
    private String role;

    /**
     * 交接目标
     */
    private String handoffTo;
}
