package com.chatbi.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 人工任务动作枚举
 *
 * @author chatbi
 * @since 2025-01-30
 */
public enum TaskActionEnum {

    /** 开始执行 */
    START("start"),

    /** 标记完成 */
    COMPLETE("complete"),

    /** 标记失败 */
    FAIL("fail"),

    /** 失败重试 */
    RETRY("retry"),

    /** 跳过 */
    SKIP("skip");

    private final String code;

    TaskActionEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * 执行日志中的步骤名，例如 task_start。
     */
    public String logStep() {
        return "task_" + code;
    }

    /**
     * 按动作码解析，未知动作返回 null，由调用方决定错误语义。
     */
    public static TaskActionEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (TaskActionEnum action : TaskActionEnum.values()) {
            if (action.code.equals(normalized)) {
                return action;
            }
        }
        return null;
    }
}
