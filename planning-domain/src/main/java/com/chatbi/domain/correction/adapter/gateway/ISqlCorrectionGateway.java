package com.chatbi.domain.correction.adapter.gateway;

/**
 * SQL 纠错 Agent 端口：根据失败语句与错误信息给出替换语句。
 */
public interface ISqlCorrectionGateway {

    /**
     * 生成替换语句。返回文本可能带有 Markdown 代码块包裹。
     *
     * @param queryId 查询 ID
     * @param question 原始问题
     * @param tableSchema 表结构上下文
     * @param previousSql 上一次执行失败的语句
     * @param errorMessage 失败信息
     * @return 替换语句
     */
    String proposeCorrection(String queryId,
                             String question,
                             String tableSchema,
                             String previousSql,
                             String errorMessage);
}
