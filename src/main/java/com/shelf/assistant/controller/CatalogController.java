package com.shelf.assistant.controller;

import com.shelf.assistant.core.catalog.CatalogFormatException;
import com.shelf.assistant.core.catalog.ProductCatalog;
import com.shelf.assistant.core.catalog.ProductRecord;
import com.shelf.assistant.core.store.BackendStoreClient;
import com.shelf.assistant.core.store.StoreException;
import com.shelf.assistant.core.store.StoreUnavailableException;
import com.shelf.assistant.model.CatalogRecord;
import com.shelf.assistant.model.CatalogSummary;
import com.shelf.assistant.repository.CatalogRepository;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 商品清单控制器
 */
@RestController
@RequestMapping("/api/catalogs")
@Tag(name = "商品清单", description = "本地上传记录及后端最新清单")
public class CatalogController {
    private static final Logger logger = LoggerFactory.getLogger(CatalogController.class);

    @Autowired
    private CatalogRepository repository;

    @Autowired
    private BackendStoreClient storeClient;

    @GetMapping
    @Operation(
            summary = "本地上传记录",
            description = """
                    最近的清单上传记录，最新的在前。

                    - `uploaded=true`：已上传
                    - `rejected=true`：后端拒绝，不再重传
                    - 其他：等待定时重传

                    **记录存储位置**：`data/catalogs/` 目录
                    """
    )
    public ResponseEntity<Map<String, Object>> listRecords(
            @Parameter(description = "返回条数", example = "20")
            @RequestParam(required = false, defaultValue = "20") Integer limit) {
        if (limit == null || limit < 1 || limit > 200) {
            limit = 20;
        }
        List<CatalogRecord> records = repository.findAll(limit);

        Map<String, Object> response = new HashMap<>();
        response.put("status", "success");
        response.put("data", records);
        return ResponseEntity.ok(response);
    }

    @GetMapping("/latest")
    @Operation(summary = "后端最新清单", description = "读取后端 `GET /csv/get-summary` 并解析为商品列表")
    public ResponseEntity<Map<String, Object>> latest() {
        Map<String, Object> response = new HashMap<>();
        try {
            Optional<CatalogSummary> summary = storeClient.fetchLatestCatalog();
            if (summary.isEmpty()) {
                response.put("status", "error");
                response.put("message", "No catalog found");
                return ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
            }

            ProductCatalog catalog = storeClient.getCodec().decode(summary.get().getContent());
            List<Map<String, Object>> items = new ArrayList<>();
            for (ProductRecord product : catalog.getProducts()) {
                items.add(AssistantController.productToMap(product));
            }
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("id", summary.get().getId());
            data.put("filename", summary.get().getFilename());
            data.put("createdAt", summary.get().getCreatedAt());
            data.put("items", items);

            response.put("status", "success");
            response.put("data", data);
            return ResponseEntity.ok(response);
        } catch (CatalogFormatException e) {
            logger.warn("Latest backend catalog is malformed: {}", e.getMessage());
            response.put("status", "error");
            response.put("message", "Malformed catalog: " + e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(response);
        } catch (StoreUnavailableException e) {
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(response);
        } catch (StoreException e) {
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(response);
        }
    }
}
