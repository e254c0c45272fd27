package com.chatbi.infrastructure.repository.planning;

import com.chatbi.domain.planning.model.aggregate.PlanningDocument;
import com.chatbi.domain.planning.model.entity.PlanningRuleEntity;
import com.chatbi.domain.planning.model.entity.WorkflowChainEntity;
import com.chatbi.domain.planning.model.valobj.ChainStep;
import com.chatbi.types.common.Constants;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * 规划文档首次创建时写入的默认规则与协作链。
 */
final class DefaultPlanningCatalog {

    private DefaultPlanningCatalog() {
    }

    static PlanningDocument newDocument() {
        PlanningDocument document = new PlanningDocument();
        document.setRules(defaultRules());
        document.setChains(defaultChains());
        document.setUpdatedAt(LocalDateTime.now());
        return document;
    }

    static List<PlanningRuleEntity> defaultRules() {
        List<PlanningRuleEntity> rules = new ArrayList<>();
        rules.add(rule("消费贷经营诊断拆解规则",
                List.of("消费贷", "转化", "逾期", "客群"),
                List.of("漏斗诊断", "客群分层", "风险收益联动", "策略动作建议"),
                List.of("消费贷风险分析Agent", Constants.DEFAULT_AGENT)));
        rules.add(rule("经营贷专项分析拆解规则",
                List.of("经营贷", "额度", "迁徙", "RAROC"),
                List.of("授信与额度使用", "动支与留存表现", "迁徙与逾期质量", "策略执行排程"),
                List.of(Constants.DEFAULT_AGENT)));
        return rules;
    }

    static List<WorkflowChainEntity> defaultChains() {
        WorkflowChainEntity chain = new WorkflowChainEntity();
        chain.setId(UUID.randomUUID().toString());
        chain.setName("SmartBI A2A 标准协作链");
        chain.setEnabled(true);
        chain.setMode(Constants.DEFAULT_WORKFLOW_MODE);
        chain.setSteps(new ArrayList<>(List.of(
                new ChainStep("Planner", "任务拆分与优先级", "Data Analyst Agent"),
                new ChainStep("Data Analyst Agent", "SQL+指标计算", "Risk Agent"),
                new ChainStep("Risk Agent", "风险收益校验", "Strategy Agent"),
                new ChainStep("Strategy Agent", "策略建议与渠道动作草案", "Approval Agent"),
                new ChainStep("Approval Agent", "邮件发送与回邮确认", "Executor Agent")
        )));
        List<WorkflowChainEntity> chains = new ArrayList<>();
        chains.add(chain);
        return chains;
    }

    private static PlanningRuleEntity rule(String name,
                                           List<String> keywords,
                                           List<String> splitTemplate,
                                           List<String> preferredAgents) {
        PlanningRuleEntity rule = new PlanningRuleEntity();
        rule.setId(UUID.randomUUID().toString());
        rule.setName(name);
        rule.setEnabled(true);
        rule.setMatchKeywords(new ArrayList<>(keywords));
        rule.setSplitTemplate(new ArrayList<>(splitTemplate));
        rule.setPreferredAgents(new ArrayList<>(preferredAgents));
        Map<String, Boolean> toolchain = new LinkedHashMap<>();
        toolchain.put("sql", true);
        toolchain.put("rag", true);
        toolchain.put("rule_validation", true);
        rule.setToolchain(toolchain);
        return rule;
    }
}
