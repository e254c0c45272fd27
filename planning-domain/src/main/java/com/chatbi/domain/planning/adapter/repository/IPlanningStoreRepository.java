package com.chatbi.domain.planning.adapter.repository;

import com.chatbi.domain.planning.model.aggregate.PlanningDocument;

import java.util.function.Function;

/**
 * 规划文档仓储接口：整份文档读取、整份文档写回。
 *
 * @author chatbi
 * @since 2025-01-30
 */
public interface IPlanningStoreRepository {

    /**
     * 读取整份文档
     */
    PlanningDocument load();

    /**
     * 写回整份文档
     */
    void save(PlanningDocument document);

    /**
     * 在一次 load -> modify -> save 周期内执行变更。
     * 默认实现不加锁，支持并发的实现需要覆盖为临界区。
     */
    default <T> T execute(Function<PlanningDocument, T> mutation) {
        PlanningDocument document = load();
        T result = mutation.apply(document);
        save(document);
        return result;
    }
}
