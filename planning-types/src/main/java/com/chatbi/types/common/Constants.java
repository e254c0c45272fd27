package com.chatbi.types.common;

/**
 * 全局常量定义类。
 * <p>
 * 编排引擎使用的日志步骤名、默认文案等常量。
 * </p>
 *
 * @author chatbi
 * @since 2025-01-29
 */
public class Constants {

    /** 默认场景 */
    public final static String DEFAULT_SCENE = "data_discuss";

    /** 默认协作模式 */
    public final static String DEFAULT_WORKFLOW_MODE = "a2a_dispatch";

    /** 默认执行 Agent */
    public final static String DEFAULT_AGENT = "贷款经营分析Agent";

    /** 执行日志步骤：创建执行实例 */
    public final static String STEP_EXECUTION_START = "execution_start";

    /** 执行日志步骤：自动推进 */
    public final static String STEP_TICK = "tick";

    /** 执行日志步骤：取消执行 */
    public final static String STEP_EXECUTION_CANCEL = "execution_cancel";

    /** 执行日志步骤：人工记录 */
    public final static String STEP_MANUAL_RECORD = "manual_record";

    /** 执行日志状态：成功 */
    public final static String LOG_STATUS_SUCCESS = "success";

    /** run 单次最大推进步数 */
    public final static int MAX_RUN_STEPS = 200;

}
