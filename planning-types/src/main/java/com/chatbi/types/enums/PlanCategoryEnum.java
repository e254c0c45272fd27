package com.chatbi.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 计划业务分类枚举（贷款类型）。
 *
 * @author chatbi
 * @since 2025-01-30
 */
public enum PlanCategoryEnum {

    /** 经营贷 */
    BUSINESS("business", "经营贷"),

    /** 消费贷 */
    CONSUMER("consumer", "消费贷"),

    /** 兜底分类 */
    MIXED("mixed", null);

    private final String code;
    private final String keyword;

    PlanCategoryEnum(String code, String keyword) {
        this.code = code;
        this.keyword = keyword;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * 中文探测关键字，兜底分类没有关键字。
     */
    public String getKeyword() {
        return keyword;
    }
}
