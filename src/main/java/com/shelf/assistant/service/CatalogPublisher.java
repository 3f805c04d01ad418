package com.shelf.assistant.service;

import com.shelf.assistant.config.YamlConfig;
import com.shelf.assistant.core.catalog.ProductCatalog;
import com.shelf.assistant.core.phase.CatalogSink;
import com.shelf.assistant.core.retry.RetryPolicy;
import com.shelf.assistant.core.store.BackendStoreClient;
import com.shelf.assistant.core.store.StoreException;
import com.shelf.assistant.core.store.StoreRejectedException;
import com.shelf.assistant.event.CatalogUploadEvent;
import com.shelf.assistant.model.CatalogRecord;
import com.shelf.assistant.repository.CatalogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * 商品清单发布：先保存到本地，再后台上传
 * <p>
 * 上传失败的记录留在本地，由 {@link com.shelf.assistant.schedule.CatalogRetryScheduler} 定时重传。
 * 结束时发布 {@link CatalogUploadEvent}。
 */
@Service
public class CatalogPublisher implements CatalogSink {
    private static final Logger logger = LoggerFactory.getLogger(CatalogPublisher.class);

    private final CatalogRepository repository;
    private final BackendStoreClient storeClient;
    private final RetryPolicy storeRetry;
    private final ApplicationEventPublisher eventPublisher;
    private final Executor executor;
    private final String deviceId;

    // 正在上传的记录，避免定时重传与首次上传重叠
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public CatalogPublisher(CatalogRepository repository, BackendStoreClient storeClient,
                            @Qualifier("storeRetryPolicy") RetryPolicy storeRetry,
                            ApplicationEventPublisher eventPublisher,
                            @Qualifier("catalogPublishExecutor") Executor executor,
                            YamlConfig config) {
        this.repository = repository;
        this.storeClient = storeClient;
        this.storeRetry = storeRetry;
        this.eventPublisher = eventPublisher;
        this.executor = executor;
        this.deviceId = config.getSystem().getDeviceId();
    }

    /**
     * 保存清单并异步上传
     */
    @Override
    public void submit(ProductCatalog catalog) {
        CatalogRecord record = new CatalogRecord();
        record.setDeviceId(deviceId);
        record.setVersion(catalog.getVersion());
        record.setFilename(BackendStoreClient.catalogFilename(catalog.getVersion()));
        record.setCsv(storeClient.getCodec().encode(catalog));
        record.setItemCount(catalog.size());
        record.setCreatedAt(LocalDateTime.now());
        repository.insert(record);
        logger.info("Catalog {} saved as record {} ({} items)", catalog.getVersion(), record.getId(), catalog.size());

        executor.execute(() -> publish(record));
    }

    /**
     * 重传所有未完成的记录
     * @return 本次上传成功的数量
     */
    public int retryPending() {
        List<CatalogRecord> pending = repository.findPending();
        if (pending.isEmpty()) {
            logger.debug("No pending catalog records");
            return 0;
        }
        logger.info("Retrying {} pending catalog records", pending.size());
        int successCount = 0;
        for (CatalogRecord record : pending) {
            if (publish(record)) {
                successCount++;
            }
        }
        logger.info("Catalog retry completed. Success: {}, Remaining: {}", successCount, pending.size() - successCount);
        return successCount;
    }

    /**
     * 上传一条记录
     * @return 是否上传成功
     */
    boolean publish(CatalogRecord record) {
        if (!inFlight.add(record.getId())) {
            logger.debug("Record {} is already being uploaded", record.getId());
            return false;
        }
        try {
            record.setAttempts(record.getAttempts() + 1);
            String remoteId = storeRetry.execute(StoreException.class,
                    () -> storeClient.publishCatalog(record.getFilename(), record.getCsv()),
                    StoreException::isRetryable);
            record.setUploaded(true);
            record.setRemoteId(remoteId);
            record.setLastError(null);
            repository.update(record);
            logger.info("Successfully uploaded catalog record: {}", record.getId());
            eventPublisher.publishEvent(new CatalogUploadEvent(this, record, CatalogUploadEvent.Outcome.PUBLISHED));
            return true;
        } catch (StoreRejectedException e) {
            record.setRejected(true);
            record.setLastError(e.getMessage());
            repository.update(record);
            logger.error("Catalog record {} rejected by backend: {}", record.getId(), e.getMessage());
            eventPublisher.publishEvent(new CatalogUploadEvent(this, record, CatalogUploadEvent.Outcome.REJECTED));
            return false;
        } catch (StoreException e) {
            record.setLastError(e.getMessage());
            repository.update(record);
            logger.warn("Failed to upload catalog record {}, will retry: {}", record.getId(), e.getMessage());
            return false;
        } finally {
            inFlight.remove(record.getId());
        }
    }
}
