package com.chatbi.types.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 执行实例状态枚举
 *
 * @author chatbi
 * @since 2025-01-29
 */
public enum ExecutionStateEnum {

    /**
     * 待执行 - 执行实例已创建，尚无可推进任务
     */
    PENDING("pending"),

    /**
     * 运行中 - 存在就绪或运行中的任务
     */
    RUNNING("running"),

    /**
     * 已完成 - 所有任务完成或跳过
     */
    COMPLETED("completed"),

    /**
     * 失败 - 存在失败任务
     */
    FAILED("failed"),

    /**
     * 已取消 - 人工取消执行
     */
    CANCELLED("cancelled");

    private final String code;

    ExecutionStateEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * 终态不再参与状态推导。
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    @JsonCreator
    public static ExecutionStateEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (ExecutionStateEnum state : ExecutionStateEnum.values()) {
            if (state.code.equals(code)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown execution state code: " + code);
    }
}
