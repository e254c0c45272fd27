package com.chatbi.trigger.application.command;

import com.chatbi.domain.planning.adapter.repository.IPlanningStoreRepository;
import com.chatbi.domain.planning.model.entity.PlanEntity;
import com.chatbi.domain.planning.model.entity.PlanningRuleEntity;
import com.chatbi.domain.planning.model.entity.WorkflowChainEntity;
import com.chatbi.domain.planning.model.valobj.PlanningRetention;
import com.chatbi.domain.planning.service.PlanBuilderDomainService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 规划目录写用例：规则/协作链整体替换、生成计划。
 */
@Slf4j
@Service
public class PlanningCatalogCommandService {

    private final IPlanningStoreRepository planningStoreRepository;
    private final PlanBuilderDomainService planBuilderDomainService;
    private final PlanningRetention planningRetention;

    public PlanningCatalogCommandService(IPlanningStoreRepository planningStoreRepository,
                                         PlanBuilderDomainService planBuilderDomainService,
                                         PlanningRetention planningRetention) {
        this.planningStoreRepository = planningStoreRepository;
        this.planBuilderDomainService = planBuilderDomainService;
        this.planningRetention = planningRetention;
    }

    public List<PlanningRuleEntity> replaceRules(List<PlanningRuleEntity> rules) {
        return planningStoreRepository.execute(document -> {
            document.replaceRules(rules);
            log.info("PLANNING_RULES_REPLACED count={}", document.getRules().size());
            return new ArrayList<>(document.getRules());
        });
    }

    public List<WorkflowChainEntity> replaceChains(List<WorkflowChainEntity> chains) {
        return planningStoreRepository.execute(document -> {
            document.replaceChains(chains);
            log.info("PLANNING_CHAINS_REPLACED count={}", document.getChains().size());
            return new ArrayList<>(document.getChains());
        });
    }

    public PlanEntity buildPlan(String question, String scene, String category) {
        return planningStoreRepository.execute(document -> {
            PlanEntity plan = planBuilderDomainService.buildPlan(question,
                    scene,
                    category,
                    document.activeRules(),
                    document.activeChains());
            document.appendPlan(plan, planningRetention.planHistoryLimit());
            log.info("PLAN_BUILT planId={}, category={}, workflowMode={}, taskCount={}",
                    plan.getPlanId(), plan.getCategory(), plan.getWorkflowMode(), plan.taskCount());
            return plan;
        });
    }
}
