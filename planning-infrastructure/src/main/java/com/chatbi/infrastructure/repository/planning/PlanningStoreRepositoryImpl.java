package com.chatbi.infrastructure.repository.planning;

import com.chatbi.domain.planning.adapter.repository.IPlanningStoreRepository;
import com.chatbi.domain.planning.model.aggregate.PlanningDocument;
import com.chatbi.infrastructure.util.JsonCodec;
import com.chatbi.types.enums.ResponseCode;
import com.chatbi.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * 规划文档仓储实现类。
 * <p>
 * 整份文档保存在单个 JSON 文件中：
 * <ul>
 *   <li>文件不存在时写入默认规则与协作链</li>
 *   <li>写入先落临时文件再替换，避免半截文件</li>
 *   <li>{@link #execute(Function)} 在同一把锁内完成 load -> modify -> save</li>
 * </ul>
 * </p>
 *
 * @author chatbi
 * @since 2025-02-01
 */
@Slf4j
@Repository
public class PlanningStoreRepositoryImpl implements IPlanningStoreRepository {

    private final Path storePath;
    private final JsonCodec jsonCodec;
    private final ReentrantLock lock = new ReentrantLock();

    /**
     * 创建 PlanningStoreRepositoryImpl。
     */
    public PlanningStoreRepositoryImpl(@Value("${planning.store.path:runs/planning_store.json}") String storePath,
                                       JsonCodec jsonCodec) {
        this.storePath = Paths.get(storePath).toAbsolutePath();
        this.jsonCodec = jsonCodec;
    }

    /**
     * 读取整份文档，首次访问时初始化默认目录。
     */
    @Override
    public PlanningDocument load() {
        lock.lock();
        try {
            if (!Files.exists(storePath)) {
                PlanningDocument bootstrap = DefaultPlanningCatalog.newDocument();
                write(bootstrap);
                log.info("Planning store bootstrapped. path={}, rules={}, chains={}",
                        storePath, bootstrap.getRules().size(), bootstrap.getChains().size());
                return bootstrap;
            }
            String json = Files.readString(storePath, StandardCharsets.UTF_8);
            PlanningDocument document = jsonCodec.readDocument(json);
            return fillDefaults(document == null ? new PlanningDocument() : document);
        } catch (IOException ex) {
            log.error("Failed to read planning store. path={}, error={}", storePath, ex.getMessage(), ex);
            throw new AppException(ResponseCode.UN_ERROR.getCode(), "Failed to read planning store", ex);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 写回整份文档。
     */
    @Override
    public void save(PlanningDocument document) {
        lock.lock();
        try {
            write(document);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 加锁执行 load -> modify -> save，变更抛出异常时不写回。
     */
    @Override
    public <T> T execute(Function<PlanningDocument, T> mutation) {
        lock.lock();
        try {
            PlanningDocument document = load();
            T result = mutation.apply(document);
            write(document);
            return result;
        } finally {
            lock.unlock();
        }
    }

    public Path getStorePath() {
        return storePath;
    }

    private void write(PlanningDocument document) {
        try {
            Path parent = storePath.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = storePath.resolveSibling(storePath.getFileName() + ".tmp");
            Files.writeString(temp, jsonCodec.writeDocument(document), StandardCharsets.UTF_8);
            try {
                Files.move(temp, storePath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(temp, storePath, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException ex) {
            log.error("Failed to write planning store. path={}, error={}", storePath, ex.getMessage(), ex);
            throw new AppException(ResponseCode.UN_ERROR.getCode(), "Failed to write planning store", ex);
        }
    }

    private PlanningDocument fillDefaults(PlanningDocument document) {
        if (document.getRules() == null) {
            document.setRules(new ArrayList<>());
        }
        if (document.getChains() == null) {
            document.setChains(new ArrayList<>());
        }
        if (document.getPlanHistory() == null) {
            document.setPlanHistory(new ArrayList<>());
        }
        if (document.getExecutions() == null) {
            document.setExecutions(new ArrayList<>());
        }
        if (document.getExecutionLogs() == null) {
            document.setExecutionLogs(new ArrayList<>());
        }
        if (document.getCorrectionLogs() == null) {
            document.setCorrectionLogs(new ArrayList<>());
        }
        return document;
    }
}
