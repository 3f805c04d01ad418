package com.shelf.assistant.schedule;

import com.shelf.assistant.service.CatalogPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 商品清单重传定时任务
 * 按固定间隔重传上传失败（且未被后端拒绝）的记录
 */
@Component
public class CatalogRetryScheduler {

    private static final Logger logger = LoggerFactory.getLogger(CatalogRetryScheduler.class);

    @Autowired
    private CatalogPublisher catalogPublisher;

    @Scheduled(initialDelayString = "${shelf-assistant.backend.retry-delay-ms:30000}",
            fixedDelayString = "${shelf-assistant.backend.retry-delay-ms:30000}")
    public void retryFailedUploads() {
        try {
            catalogPublisher.retryPending();
        } catch (RuntimeException e) {
            logger.error("Catalog retry task failed", e);
        }
    }
}
