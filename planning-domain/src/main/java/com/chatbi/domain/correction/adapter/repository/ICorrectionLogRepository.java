package com.chatbi.domain.correction.adapter.repository;

import com.chatbi.domain.correction.model.entity.CorrectionLogEntity;

import java.util.List;

/**
 * 纠错日志仓储接口
 *
 * @author chatbi
 * @since 2025-02-03
 */
public interface ICorrectionLogRepository {

    /**
     * 保存纠错日志
     */
    CorrectionLogEntity save(CorrectionLogEntity entity);

    /**
     * 按查询 ID 查询，按写入顺序返回
     */
    List<CorrectionLogEntity> findByQueryId(String queryId);
}
