package com.chatbi.test.domain;

import com.chatbi.domain.planning.model.entity.PlanEntity;
import com.chatbi.domain.planning.model.entity.PlanningRuleEntity;
import com.chatbi.domain.planning.model.entity.WorkflowChainEntity;
import com.chatbi.domain.planning.model.valobj.PlanTask;
import com.chatbi.domain.planning.service.PlanBuilderDomainService;
import com.chatbi.test.support.PlanningFixtures;
import com.chatbi.types.enums.ResponseCode;
import com.chatbi.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

public class PlanBuilderDomainServiceTest {

    private final PlanBuilderDomainService service = new PlanBuilderDomainService();

    @Test
    public void shouldBuildLinearDependencyChain() {
        PlanningRuleEntity rule = PlanningFixtures.rule("consumer", true,
                List.of("消费贷"),
                List.of("漏斗诊断", "客群分层", "风险收益联动", "策略动作建议"),
                List.of("A", "B"));

        PlanEntity plan = service.buildPlan("消费贷转化下降", null, null, List.of(rule), List.of());

        List<PlanTask> tasks = plan.getTasks();
        Assertions.assertEquals(4, tasks.size());
        Assertions.assertEquals(List.of(), tasks.get(0).getDependsOn());
        for (int k = 1; k < tasks.size(); k++) {
            Assertions.assertEquals("task_" + (k + 1), tasks.get(k).getTaskId());
            Assertions.assertEquals(List.of("task_" + k), tasks.get(k).getDependsOn());
        }
    }

    @Test
    public void shouldClampAgentAssignmentToLastPreferredAgent() {
        PlanningRuleEntity rule = PlanningFixtures.rule("consumer", true,
                List.of("消费贷"),
                List.of("s1", "s2", "s3"),
                List.of("A", "B"));

        PlanEntity plan = service.buildPlan("消费贷", "scene_x", null, List.of(rule), List.of());

        Assertions.assertEquals("A", plan.getTasks().get(0).getAssignedAgent());
        Assertions.assertEquals("B", plan.getTasks().get(1).getAssignedAgent());
        Assertions.assertEquals("B", plan.getTasks().get(2).getAssignedAgent());
        Assertions.assertEquals("scene_x", plan.getScene());
        Assertions.assertEquals(Boolean.TRUE, plan.getTasks().get(0).getToolchain().get("sql"));
        Assertions.assertEquals(Boolean.FALSE, plan.getTasks().get(0).getToolchain().get("rag"));
    }

    @Test
    public void shouldInferCategoryFromQuestion() {
        Assertions.assertEquals("business", service.inferCategory("经营贷额度使用率"));
        Assertions.assertEquals("business", service.inferCategory("Business loan drawdown"));
        Assertions.assertEquals("consumer", service.inferCategory("消费贷逾期"));
        Assertions.assertEquals("consumer", service.inferCategory("CONSUMER funnel"));
        Assertions.assertEquals("mixed", service.inferCategory("整体贷款规模"));
    }

    @Test
    public void shouldUseCategoryHintVerbatim() {
        PlanEntity plan = service.buildPlan("消费贷逾期", null, "custom", List.of(), List.of());

        Assertions.assertEquals("custom", plan.getCategory());
        Assertions.assertEquals("围绕custom贷款完成[指标拆解]并输出可执行结论", plan.getTasks().get(0).getObjective());
    }

    @Test
    public void shouldMatchRuleByKeywordIgnoringCase() {
        PlanningRuleEntity first = PlanningFixtures.rule("first", true, List.of("逾期"), List.of("a"), List.of("A"));
        PlanningRuleEntity second = PlanningFixtures.rule("second", true, List.of("RAROC"), List.of("b"), List.of("B"));

        PlanEntity plan = service.buildPlan("看一下 raroc 变化", null, null, List.of(first, second), List.of());

        Assertions.assertEquals("b", plan.getTasks().get(0).getTitle());
        Assertions.assertEquals("B", plan.getTasks().get(0).getAssignedAgent());
    }

    @Test
    public void shouldFallBackToFirstRuleWhenNoKeywordMatches() {
        PlanningRuleEntity first = PlanningFixtures.rule("first", true, List.of("逾期"), List.of("a", "b"), List.of("A"));
        PlanningRuleEntity second = PlanningFixtures.rule("second", true, List.of("额度"), List.of("c"), List.of("C"));

        PlanEntity plan = service.buildPlan("整体规模", null, null, List.of(first, second), List.of());

        Assertions.assertEquals(2, plan.getTasks().size());
        Assertions.assertEquals("a", plan.getTasks().get(0).getTitle());
    }

    @Test
    public void shouldUseDefaultTemplateWhenNoRules() {
        PlanEntity plan = service.buildPlan("整体规模", null, null, List.of(), List.of());

        Assertions.assertEquals(List.of("指标拆解", "风险评估", "策略建议"),
                plan.getTasks().stream().map(PlanTask::getTitle).toList());
        Assertions.assertEquals("贷款经营分析Agent", plan.getTasks().get(2).getAssignedAgent());
        Assertions.assertEquals(Boolean.TRUE, plan.getTasks().get(0).getToolchain().get("rule_validation"));
        Assertions.assertEquals("mixed", plan.getCategory());
        Assertions.assertEquals("data_discuss", plan.getScene());
        Assertions.assertEquals(3, plan.getRationale().size());
        Assertions.assertNotNull(plan.getPlanId());
        Assertions.assertNotNull(plan.getCreatedAt());
    }

    @Test
    public void shouldStampWorkflowModeFromFirstChainOrDefault() {
        WorkflowChainEntity chain = new WorkflowChainEntity();
        chain.setName("custom");
        chain.setEnabled(true);
        chain.setMode("sequential");

        PlanEntity withChain = service.buildPlan("q", null, null, List.of(), List.of(chain));
        PlanEntity withoutChain = service.buildPlan("q", null, null, List.of(), List.of());

        Assertions.assertEquals("sequential", withChain.getWorkflowMode());
        Assertions.assertEquals("custom", withChain.getWorkflowChain().getName());
        Assertions.assertEquals("a2a_dispatch", withoutChain.getWorkflowMode());
        Assertions.assertEquals("Default A2A Chain", withoutChain.getWorkflowChain().getName());
        Assertions.assertTrue(withoutChain.getWorkflowChain().getSteps().isEmpty());
    }

    @Test
    public void shouldRejectBlankQuestion() {
        AppException ex = Assertions.assertThrows(AppException.class,
                () -> service.buildPlan("  ", null, null, List.of(), List.of()));

        Assertions.assertEquals(ResponseCode.ILLEGAL_PARAMETER.getCode(), ex.getCode());
    }
}
