package com.chatbi.domain.correction.model.entity;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * SQL 纠错尝试记录
 *
 * @author chatbi
 * @since 2025-02-03
 */
@Data
public class CorrectionLogEntity {

    /**
     * 查询 ID
     */
    private String queryId;

    /**
     * 第几次尝试，从 1 开始
     */
    private Integer attemptNumber;

    /**
     * 本次执行的语句；成功记录中为上一次失败的语句
     */
    private String originalSql;

    /**
     * 错误信息；成功记录中为上一次失败的错误
     */
    private String errorMessage;

    /**
     * 纠正后的语句，失败记录为空
     */
    private String correctedSql;

    /**
     * 本次尝试是否成功
     */
    private Boolean wasSuccessful;

    /**
     * 记录时间
     */
    private LocalDateTime createdAt;

    public static CorrectionLogEntity failure(String queryId, int attemptNumber, String sql, String errorMessage) {
        CorrectionLogEntity entity = new CorrectionLogEntity();
        entity.setQueryId(queryId);
        entity.setAttemptNumber(attemptNumber);
        entity.setOriginalSql(sql);
        entity.setErrorMessage(errorMessage);
        entity.setWasSuccessful(false);
        entity.setCreatedAt(LocalDateTime.now());
        return entity;
    }

    public static CorrectionLogEntity success(String queryId,
                                              int attemptNumber,
                                              String failedSql,
                                              String priorError,
                                              String correctedSql) {
        CorrectionLogEntity entity = new CorrectionLogEntity();
        entity.setQueryId(queryId);
        entity.setAttemptNumber(attemptNumber);
        entity.setOriginalSql(failedSql);
        entity.setErrorMessage(priorError);
        entity.setCorrectedSql(correctedSql);
        entity.setWasSuccessful(true);
        entity.setCreatedAt(LocalDateTime.now());
        return entity;
    }
}
