package com.chatbi.infrastructure.repository.correction;

import com.chatbi.domain.correction.adapter.repository.ICorrectionLogRepository;
import com.chatbi.domain.correction.model.entity.CorrectionLogEntity;
import com.chatbi.domain.planning.adapter.repository.IPlanningStoreRepository;
import com.chatbi.domain.planning.model.valobj.PlanningRetention;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 纠错日志仓储实现类，记录保存在规划文档的有界列表中。
 *
 * @author chatbi
 * @since 2025-02-03
 */
@Repository
public class CorrectionLogRepositoryImpl implements ICorrectionLogRepository {

    private final IPlanningStoreRepository planningStoreRepository;
    private final PlanningRetention planningRetention;

    /**
     * 创建 CorrectionLogRepositoryImpl。
     */
    public CorrectionLogRepositoryImpl(IPlanningStoreRepository planningStoreRepository,
                                       PlanningRetention planningRetention) {
        this.planningStoreRepository = planningStoreRepository;
        this.planningRetention = planningRetention;
    }

    @Override
    public CorrectionLogEntity save(CorrectionLogEntity entity) {
        planningStoreRepository.execute(document -> {
            document.appendCorrectionLog(entity, planningRetention.correctionLogLimit());
            return null;
        });
        return entity;
    }

    @Override
    public List<CorrectionLogEntity> findByQueryId(String queryId) {
        List<CorrectionLogEntity> logs = planningStoreRepository.load().getCorrectionLogs();
        if (logs == null || queryId == null) {
            return new ArrayList<>();
        }
        return logs.stream()
                .filter(item -> queryId.equals(item.getQueryId()))
                .collect(Collectors.toList());
    }
}
