package com.chatbi.domain.correction.model.valobj;

/**
 * 纠错上下文：原始问题与表结构。
 *
 * @param question 原始问题
 * @param tableSchema 表结构文本
 */
public record CorrectionContext(String question, String tableSchema) {
}
