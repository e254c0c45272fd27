package com.chatbi.domain.planning.model.valobj;

/**
 * 规划文档各环形列表的保留上限。
 *
 * @param planHistoryLimit 计划历史上限
 * @param executionLimit 执行实例上限
 * @param executionLogLimit 执行日志上限
 * @param correctionLogLimit SQL 纠错日志上限
 */
public record PlanningRetention(int planHistoryLimit,
                                int executionLimit,
                                int executionLogLimit,
                                int correctionLogLimit) {

    public static final int DEFAULT_PLAN_HISTORY_LIMIT = 300;
    public static final int DEFAULT_EXECUTION_LIMIT = 500;
    public static final int DEFAULT_EXECUTION_LOG_LIMIT = 2000;
    public static final int DEFAULT_CORRECTION_LOG_LIMIT = 2000;

    public PlanningRetention {
        planHistoryLimit = planHistoryLimit > 0 ? planHistoryLimit : DEFAULT_PLAN_HISTORY_LIMIT;
        executionLimit = executionLimit > 0 ? executionLimit : DEFAULT_EXECUTION_LIMIT;
        executionLogLimit = executionLogLimit > 0 ? executionLogLimit : DEFAULT_EXECUTION_LOG_LIMIT;
        correctionLogLimit = correctionLogLimit > 0 ? correctionLogLimit : DEFAULT_CORRECTION_LOG_LIMIT;
    }

    public static PlanningRetention defaults() {
        return new PlanningRetention(DEFAULT_PLAN_HISTORY_LIMIT,
                DEFAULT_EXECUTION_LIMIT,
                DEFAULT_EXECUTION_LOG_LIMIT,
                DEFAULT_CORRECTION_LOG_LIMIT);
    }
}
