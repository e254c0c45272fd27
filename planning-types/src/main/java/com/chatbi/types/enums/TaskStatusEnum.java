package com.chatbi.types.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 执行任务状态枚举
 *
 * @author chatbi
 * @since 2025-01-29
 */
public enum TaskStatusEnum {

    /**
     * 待处理 - 任务已创建，等待前置依赖完成
     */
    PENDING("pending"),

    /**
     * 就绪 - 前置依赖已全部完成，可以执行
     */
    READY("ready"),

    /**
     * 运行中 - 任务正在执行
     */
    RUNNING("running"),

    /**
     * 已完成 - 任务执行完成
     */
    COMPLETED("completed"),

    /**
     * 失败 - 任务被标记失败，可通过 retry 回到待处理
     */
    FAILED("failed"),

    /**
     * 已跳过 - 任务被人工跳过
     */
    SKIPPED("skipped");

    private final String code;

    TaskStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * 已完成或已跳过，视为执行收敛。
     */
    public boolean isSettled() {
        return this == COMPLETED || this == SKIPPED;
    }

    @JsonCreator
    public static TaskStatusEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (TaskStatusEnum status : TaskStatusEnum.values()) {
            if (status.code.equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown task status code: " + code);
    }
}
