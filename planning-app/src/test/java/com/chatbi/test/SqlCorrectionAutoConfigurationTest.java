package com.chatbi.test;

import com.chatbi.config.SqlCorrectionAutoConfiguration;
import com.chatbi.domain.correction.adapter.gateway.IQueryExecutorGateway;
import com.chatbi.domain.correction.adapter.gateway.ISqlCorrectionGateway;
import com.chatbi.domain.correction.adapter.repository.ICorrectionLogRepository;
import com.chatbi.domain.correction.service.SqlCorrectionDomainService;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.mockito.Mockito.mock;

public class SqlCorrectionAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(SqlCorrectionAutoConfiguration.class))
            .withBean(ICorrectionLogRepository.class, () -> mock(ICorrectionLogRepository.class));

    @Test
    public void shouldSkipServiceWithoutGateways() {
        contextRunner.run(context ->
                Assertions.assertTrue(context.getBeansOfType(SqlCorrectionDomainService.class).isEmpty()));
    }

    @Test
    public void shouldRegisterServiceWhenGatewaysArePresent() {
        contextRunner
                .withBean(IQueryExecutorGateway.class, () -> mock(IQueryExecutorGateway.class))
                .withBean(ISqlCorrectionGateway.class, () -> mock(ISqlCorrectionGateway.class))
                .withPropertyValues("planning.correction.max-retries=1")
                .run(context -> {
                    Assertions.assertEquals(1, context.getBeansOfType(SqlCorrectionDomainService.class).size());
                    Assertions.assertEquals(1, context.getBean(SqlCorrectionDomainService.class).getDefaultMaxRetries());
                });
    }
}
