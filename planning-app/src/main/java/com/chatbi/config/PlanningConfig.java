package com.chatbi.config;

import com.chatbi.domain.planning.model.valobj.PlanningRetention;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 规划文档保留策略配置。
 */
@Slf4j
@Configuration
public class PlanningConfig {

    @Bean
    public PlanningRetention planningRetention(
            @Value("${planning.retention.plan-history-limit:300}") int planHistoryLimit,
            @Value("${planning.retention.execution-limit:500}") int executionLimit,
            @Value("${planning.retention.execution-log-limit:2000}") int executionLogLimit,
            @Value("${planning.retention.correction-log-limit:2000}") int correctionLogLimit) {
        PlanningRetention retention = new PlanningRetention(planHistoryLimit,
                executionLimit,
                executionLogLimit,
                correctionLogLimit);
        log.info("Planning retention configured. planHistory={}, executions={}, executionLogs={}, correctionLogs={}",
                retention.planHistoryLimit(),
                retention.executionLimit(),
                retention.executionLogLimit(),
                retention.correctionLogLimit());
        return retention;
    }
}
