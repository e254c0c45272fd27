package com.chatbi.test;

import com.chatbi.domain.correction.service.SqlCorrectionDomainService;
import com.chatbi.domain.planning.model.aggregate.PlanningDocument;
import com.chatbi.infrastructure.repository.planning.PlanningStoreRepositoryImpl;
import com.chatbi.trigger.http.PlanningController;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;

/**
 * 上下文装配测试。
 * <p>
 * 规划文档写到 target 目录，避免污染工作目录下的 runs/。
 * </p>
 */
@Slf4j
@ActiveProfiles("test")
@SpringBootTest(properties = "planning.store.path=target/test-runs/planning_store.json")
public class ApiTest {

    @Autowired
    private ApplicationContext applicationContext;

    @Autowired
    private PlanningStoreRepositoryImpl planningStoreRepository;

    @Test
    public void shouldLoadContextWithDefaultCatalog() {
        Assertions.assertNotNull(applicationContext.getBean(PlanningController.class));
        Assertions.assertTrue(applicationContext.getBeansOfType(SqlCorrectionDomainService.class).isEmpty());

        PlanningDocument document = planningStoreRepository.load();
        Assertions.assertFalse(document.getChains().isEmpty());
        log.info("测试完成 storePath={}", planningStoreRepository.getStorePath());
    }
}
