package com.shelf.assistant.model;

import lombok.Data;

import java.time.Instant;
import java.time.LocalDateTime;

/**
 * 本地保存的商品清单上传记录
 */
@Data
public class CatalogRecord {
    private String id;
    private String deviceId;
    private Instant version;          // 对应 ProductCatalog 的 version
    private String filename;          // 上传时使用的文件名
    private String csv;
    private int itemCount;
    private LocalDateTime createdAt;

    // 上传状态
    private boolean uploaded = false;
    private boolean rejected = false;
    private String remoteId;
    private int attempts;
    private String lastError;

    /**
     * 尚未成功且未被后端拒绝，需要重传
     */
    public boolean isPending() {
        return !uploaded && !rejected;
    }
}
