package com.chatbi.config;

import com.chatbi.domain.correction.adapter.gateway.IQueryExecutorGateway;
import com.chatbi.domain.correction.adapter.gateway.ISqlCorrectionGateway;
import com.chatbi.domain.correction.adapter.repository.ICorrectionLogRepository;
import com.chatbi.domain.correction.service.SqlCorrectionDomainService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

/**
 * SQL 自纠错服务装配：宿主同时提供查询执行器与纠错 Agent 时才注册。
 */
@AutoConfiguration
@ConditionalOnBean({IQueryExecutorGateway.class, ISqlCorrectionGateway.class, ICorrectionLogRepository.class})
public class SqlCorrectionAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public SqlCorrectionDomainService sqlCorrectionDomainService(
            IQueryExecutorGateway queryExecutorGateway,
            ISqlCorrectionGateway sqlCorrectionGateway,
            ICorrectionLogRepository correctionLogRepository,
            @Value("${planning.correction.max-retries:3}") int maxRetries) {
        return new SqlCorrectionDomainService(queryExecutorGateway,
                sqlCorrectionGateway,
                correctionLogRepository,
                maxRetries);
    }
}
