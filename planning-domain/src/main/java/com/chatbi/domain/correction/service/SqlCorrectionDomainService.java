package com.chatbi.domain.correction.service;

import com.chatbi.domain.correction.adapter.gateway.IQueryExecutorGateway;
import com.chatbi.domain.correction.adapter.gateway.ISqlCorrectionGateway;
import com.chatbi.domain.correction.adapter.repository.ICorrectionLogRepository;
import com.chatbi.domain.correction.model.entity.CorrectionLogEntity;
import com.chatbi.domain.correction.model.valobj.CorrectionContext;
import com.chatbi.domain.correction.model.valobj.CorrectionResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * SQL 自纠错重试领域服务。
 * <p>
 * 第 1 次执行初始语句；失败后请纠错 Agent 给出替换语句再执行，最多重试 maxRetries 次。
 * 重试用尽时抛出最后一次执行异常；纠错 Agent 自身失败时抛出当次执行异常，而不是 Agent 的异常。
 * </p>
 * 执行器与纠错 Agent 由宿主应用注入，因此本服务不注册为 Spring Bean。
 */
@Slf4j
public class SqlCorrectionDomainService {

    public static final int DEFAULT_MAX_RETRIES = 3;

    /**
     * 开头围栏：紧跟换行的语言标记，或后接空白的 sql 标记；其余内容属于 SQL 本身。
     */
    private static final Pattern OPENING_FENCE = Pattern.compile("^```(?:[A-Za-z0-9_-]*\\r?\\n|(?i:sql)(?=\\s))?");
    private static final Pattern CLOSING_FENCE = Pattern.compile("\\s*```$");

    private final IQueryExecutorGateway queryExecutorGateway;
    private final ISqlCorrectionGateway sqlCorrectionGateway;
    private final ICorrectionLogRepository correctionLogRepository;
    private final int defaultMaxRetries;
    private final Counter failedAttemptCounter;
    private final Counter succeededAttemptCounter;

    public SqlCorrectionDomainService(IQueryExecutorGateway queryExecutorGateway,
                                      ISqlCorrectionGateway sqlCorrectionGateway,
                                      ICorrectionLogRepository correctionLogRepository) {
        this(queryExecutorGateway, sqlCorrectionGateway, correctionLogRepository, DEFAULT_MAX_RETRIES);
    }

    public SqlCorrectionDomainService(IQueryExecutorGateway queryExecutorGateway,
                                      ISqlCorrectionGateway sqlCorrectionGateway,
                                      ICorrectionLogRepository correctionLogRepository,
                                      int defaultMaxRetries) {
        this.queryExecutorGateway = queryExecutorGateway;
        this.sqlCorrectionGateway = sqlCorrectionGateway;
        this.correctionLogRepository = correctionLogRepository;
        this.defaultMaxRetries = Math.max(defaultMaxRetries, 0);
        this.failedAttemptCounter = Counter.builder("planning.correction.attempt.total")
                .tag("outcome", "failed")
                .register(Metrics.globalRegistry);
        this.succeededAttemptCounter = Counter.builder("planning.correction.attempt.total")
                .tag("outcome", "succeeded")
                .register(Metrics.globalRegistry);
    }

    public int getDefaultMaxRetries() {
        return defaultMaxRetries;
    }

    public CorrectionResult executeWithCorrection(String queryId, String initialSql, CorrectionContext context) {
        return executeWithCorrection(queryId, initialSql, context, defaultMaxRetries);
    }

    public CorrectionResult executeWithCorrection(String queryId,
                                                  String initialSql,
                                                  CorrectionContext context,
                                                  int maxRetries) {
        int retryLimit = Math.max(maxRetries, 0);
        String question = context == null ? null : context.question();
        String tableSchema = context == null ? null : context.tableSchema();

        String currentSql = initialSql;
        String failedSql = null;
        String lastErrorMessage = null;
        RuntimeException lastError = null;

        for (int attempt = 1; attempt <= retryLimit + 1; attempt++) {
            List<Map<String, Object>> rows;
            try {
                log.debug("SQL_CORRECTION_EXECUTE queryId={}, attempt={}, sql={}", queryId, attempt, currentSql);
                rows = queryExecutorGateway.execute(currentSql);
            } catch (RuntimeException ex) {
                lastError = ex;
                lastErrorMessage = describe(ex);
                failedAttemptCounter.increment();
                log.warn("SQL_CORRECTION_ATTEMPT_FAILED queryId={}, attempt={}, error={}",
                        queryId, attempt, lastErrorMessage);
                recordAttempt(CorrectionLogEntity.failure(queryId, attempt, currentSql, lastErrorMessage));

                if (attempt > retryLimit) {
                    log.error("SQL_CORRECTION_EXHAUSTED queryId={}, maxRetries={}", queryId, retryLimit);
                    throw ex;
                }

                String proposal;
                try {
                    proposal = sqlCorrectionGateway.proposeCorrection(queryId,
                            question,
                            tableSchema,
                            currentSql,
                            lastErrorMessage);
                } catch (RuntimeException correctionError) {
                    log.error("SQL_CORRECTION_AGENT_FAILED queryId={}, attempt={}, agentError={}",
                            queryId, attempt, correctionError.getMessage(), correctionError);
                    throw ex;
                }
                String nextSql = stripCodeFence(proposal);
                if (StringUtils.isBlank(nextSql)) {
                    log.error("SQL_CORRECTION_AGENT_EMPTY queryId={}, attempt={}", queryId, attempt);
                    throw ex;
                }
                failedSql = currentSql;
                currentSql = nextSql;
                continue;
            }

            succeededAttemptCounter.increment();
            if (attempt > 1) {
                recordAttempt(CorrectionLogEntity.success(queryId, attempt, failedSql, lastErrorMessage, currentSql));
                log.info("SQL_CORRECTION_RECOVERED queryId={}, attempt={}", queryId, attempt);
            }
            return new CorrectionResult(currentSql, rows, attempt);
        }

        throw lastError;
    }

    /**
     * 去掉纠错结果外层的 Markdown 代码块标记。
     */
    public static String stripCodeFence(String proposal) {
        if (proposal == null) {
            return null;
        }
        String text = proposal.trim();
        if (!text.contains("```")) {
            return text;
        }
        text = OPENING_FENCE.matcher(text).replaceFirst("");
        return CLOSING_FENCE.matcher(text).replaceFirst("").trim();
    }

    private void recordAttempt(CorrectionLogEntity entity) {
        try {
            correctionLogRepository.save(entity);
        } catch (RuntimeException ex) {
            log.error("SQL_CORRECTION_LOG_FAILED queryId={}, attempt={}, error={}",
                    entity.getQueryId(), entity.getAttemptNumber(), ex.getMessage(), ex);
        }
    }

    private String describe(RuntimeException ex) {
        return StringUtils.defaultIfBlank(ex.getMessage(), ex.getClass().getSimpleName());
    }
}
