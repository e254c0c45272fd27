package com.chatbi.domain.execution.model.valobj;

import com.chatbi.domain.execution.model.entity.ExecutionLogEntity;

/**
 * 单步推进结果。
 *
 * @param applied 是否执行了本次推进（终态执行为 false）
 * @param completedTaskId 本步完成的任务，无可推进任务时为 null
 * @param logEntry 需要追加的 tick 日志，未推进时为 null
 */
public record TickOutcome(boolean applied,
                          String completedTaskId,
                          ExecutionLogEntity logEntry) {

    public static TickOutcome noop() {
        return new TickOutcome(false, null, null);
    }
}
