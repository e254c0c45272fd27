package com.chatbi.domain.correction.adapter.gateway;

import java.util.List;
import java.util.Map;

/**
 * 查询执行端口。瞬时失败与永久失败不做区分，统一以运行时异常抛出。
 */
public interface IQueryExecutorGateway {

    /**
     * 执行查询语句。
     *
     * @param sql 查询语句
     * @return 结果行
     */
    List<Map<String, Object>> execute(String sql);
}
