package com.shelf.assistant.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * GET /csv/get-summary 的响应
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class CatalogSummary {
    private String id;
    private String filename;
    private String content;
    @JsonProperty("file_size_bytes")
    private long fileSizeBytes;
    @JsonProperty("created_at")
    private String createdAt;
    @JsonProperty("updated_at")
    private String updatedAt;
}
