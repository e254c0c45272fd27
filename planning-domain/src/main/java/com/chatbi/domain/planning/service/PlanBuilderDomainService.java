package com.chatbi.domain.planning.service;

import com.chatbi.domain.planning.model.entity.PlanEntity;
import com.chatbi.domain.planning.model.entity.PlanningRuleEntity;
import com.chatbi.domain.planning.model.entity.WorkflowChainEntity;
import com.chatbi.domain.planning.model.valobj.PlanTask;
import com.chatbi.types.common.Constants;
import com.chatbi.types.enums.PlanCategoryEnum;
import com.chatbi.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * 计划生成领域服务：分类推断、规则匹配、按拆解模板生成线性任务链。
 * <p>
 * 生成的计划只做组装，不负责落库；调用方追加到计划历史。
 * </p>
 */
@Service
public class PlanBuilderDomainService {

    public static final String STRATEGY_FOCUS = "客群理解 + 漏斗转化 + 风险收益平衡 + 远程协作执行";

    public static final List<String> DEFAULT_SPLIT_TEMPLATE = List.of("指标拆解", "风险评估", "策略建议");

    private static final List<String> RATIONALE = List.of(
            "先诊断再决策，避免直接给策略导致误判。",
            "消费贷关注转化效率与逾期弹性，经营贷关注额度效率与迁徙稳定性。",
            "策略动作需先邮件审批，再进入执行队列。"
    );

    /**
     * 生成计划。
     *
     * @param question 原始问题，必填
     * @param scene 场景，空时使用默认场景
     * @param categoryHint 分类提示，非空时原样使用
     * @param activeRules 已启用规则，按目录顺序
     * @param activeChains 已启用协作链，按目录顺序
     */
    public PlanEntity buildPlan(String question,
                                String scene,
                                String categoryHint,
                                List<PlanningRuleEntity> activeRules,
                                List<WorkflowChainEntity> activeChains) {
        if (StringUtils.isBlank(question)) {
            throw AppException.invalidArgument("question is required");
        }

        WorkflowChainEntity chain = selectChain(activeChains);
        String category = StringUtils.isNotBlank(categoryHint) ? categoryHint : inferCategory(question);
        PlanningRuleEntity rule = matchRule(question, activeRules);

        List<String> splitTemplate = rule == null ? DEFAULT_SPLIT_TEMPLATE : nullToEmpty(rule.getSplitTemplate());
        List<String> preferredAgents = rule == null
                ? List.of(Constants.DEFAULT_AGENT)
                : nullToEmpty(rule.getPreferredAgents());
        Map<String, Boolean> toolchain = rule == null || rule.getToolchain() == null || rule.getToolchain().isEmpty()
                ? defaultToolchain()
                : rule.getToolchain();

        List<PlanTask> tasks = new ArrayList<>();
        String previousId = null;
        for (int index = 0; index < splitTemplate.size(); index++) {
            String title = splitTemplate.get(index);
            String taskId = "task_" + (index + 1);
            tasks.add(PlanTask.builder()
                    .taskId(taskId)
                    .title(title)
                    .objective("围绕" + category + "贷款完成[" + title + "]并输出可执行结论")
                    .assignedAgent(assignAgent(preferredAgents, index))
                    .dependsOn(previousId == null ? new ArrayList<>() : new ArrayList<>(List.of(previousId)))
                    .toolchain(new LinkedHashMap<>(toolchain))
                    .build());
            previousId = taskId;
        }

        PlanEntity plan = new PlanEntity();
        plan.setPlanId(UUID.randomUUID().toString());
        plan.setScene(StringUtils.defaultIfBlank(scene, Constants.DEFAULT_SCENE));
        plan.setQuestion(question);
        plan.setCategory(category);
        plan.setWorkflowMode(StringUtils.defaultIfBlank(chain.getMode(), Constants.DEFAULT_WORKFLOW_MODE));
        plan.setWorkflowChain(chain);
        plan.setStrategyFocus(STRATEGY_FOCUS);
        plan.setTasks(tasks);
        plan.setRationale(new ArrayList<>(RATIONALE));
        plan.setCreatedAt(LocalDateTime.now());
        return plan;
    }

    /**
     * 按子串探测分类：经营贷优先，其次消费贷，否则兜底 mixed。
     */
    public String inferCategory(String question) {
        if (question == null) {
            return PlanCategoryEnum.MIXED.getCode();
        }
        String normalized = question.toLowerCase(Locale.ROOT);
        for (PlanCategoryEnum category : PlanCategoryEnum.values()) {
            if (category.getKeyword() == null) {
                continue;
            }
            if (question.contains(category.getKeyword()) || normalized.contains(category.getCode())) {
                return category.getCode();
            }
        }
        return PlanCategoryEnum.MIXED.getCode();
    }

    /**
     * 第一个关键字命中的规则；都不命中时取第一条规则；没有规则返回 null。
     */
    public PlanningRuleEntity matchRule(String question, List<PlanningRuleEntity> activeRules) {
        if (activeRules == null || activeRules.isEmpty()) {
            return null;
        }
        for (PlanningRuleEntity rule : activeRules) {
            if (rule.matches(question)) {
                return rule;
            }
        }
        return activeRules.get(0);
    }

    private WorkflowChainEntity selectChain(List<WorkflowChainEntity> activeChains) {
        if (activeChains == null || activeChains.isEmpty()) {
            return WorkflowChainEntity.defaultChain();
        }
        return activeChains.get(0);
    }

    private String assignAgent(List<String> preferredAgents, int index) {
        if (preferredAgents.isEmpty()) {
            return Constants.DEFAULT_AGENT;
        }
        return preferredAgents.get(Math.min(index, preferredAgents.size() - 1));
    }

    private Map<String, Boolean> defaultToolchain() {
        Map<String, Boolean> toolchain = new LinkedHashMap<>();
        toolchain.put("sql", true);
        toolchain.put("rag", true);
        toolchain.put("rule_validation", true);
        return toolchain;
    }

    private List<String> nullToEmpty(List<String> values) {
        return values == null ? List.of() : values;
    }
}
