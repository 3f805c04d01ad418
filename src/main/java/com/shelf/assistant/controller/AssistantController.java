package com.shelf.assistant.controller;

import com.shelf.assistant.core.audio.SpokenPhrase;
import com.shelf.assistant.core.catalog.ProductCatalog;
import com.shelf.assistant.core.catalog.ProductRecord;
import com.shelf.assistant.core.guidance.GuidanceTranslator;
import com.shelf.assistant.core.guidance.Offset;
import com.shelf.assistant.core.phase.SessionSnapshot;
import com.shelf.assistant.core.store.BackendStoreClient;
import com.shelf.assistant.core.store.StoreException;
import com.shelf.assistant.core.store.StoreUnavailableException;
import com.shelf.assistant.dto.ChoiceRequest;
import com.shelf.assistant.dto.ResetRequest;
import com.shelf.assistant.service.AssistantService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 会话控制器
 *
 * 提供会话状态查询、重置、语音记录和手动选择
 */
@RestController
@RequestMapping("/api/assistant")
@Tag(name = "购物会话", description = "会话状态、重置、语音播报记录及手动选择商品")
public class AssistantController {
    private static final Logger logger = LoggerFactory.getLogger(AssistantController.class);

    @Autowired
    private AssistantService assistantService;

    @Autowired
    private BackendStoreClient storeClient;

    @Autowired
    private GuidanceTranslator translator;

    @GetMapping("/status")
    @Operation(
            summary = "查询会话状态",
            description = """
                    返回当前阶段、商品清单、已选商品、最近一次手部偏移，以及照片队列和监听目录的状态。

                    `sourceAvailable=false` 表示监听目录不可用，会话暂停直到目录恢复。
                    """
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "查询成功",
                    content = @Content(
                            mediaType = "application/json",
                            examples = @ExampleObject(
                                    value = """
                                            {
                                              "status": "success",
                                              "data": {
                                                "phase": "GUIDING",
                                                "selectedItem": { "itemNumber": 1, "name": "Cola", "location": "top shelf" },
                                                "lastOffset": { "angleDegrees": 90.0, "clockPosition": 3, "distance": "FAR" },
                                                "queueDepth": 0,
                                                "sourceAvailable": true
                                              }
                                            }
                                            """
                            )
                    )
            )
    })
    public ResponseEntity<Map<String, Object>> getStatus() {
        SessionSnapshot snapshot = assistantService.getSnapshot();

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("phase", snapshot.getPhase().name());
        data.put("generation", snapshot.getGeneration());
        data.put("catalog", catalogToMap(snapshot.getActiveCatalog(), snapshot.isCatalogPublished()));
        data.put("selectedItem", snapshot.getSelectedItem() != null ? productToMap(snapshot.getSelectedItem()) : null);
        data.put("lastOffset", offsetToMap(snapshot.getLastGuidanceOffset()));
        data.put("consecutiveReachedCycles", snapshot.getConsecutiveReachedCycles());
        data.put("consecutiveStoreFailures", snapshot.getConsecutiveStoreFailures());
        data.put("pendingAcknowledgements", snapshot.getPendingAcknowledgements());
        data.put("queueDepth", assistantService.getQueueDepth());
        data.put("droppedPhotos", assistantService.getDroppedPhotos());
        data.put("sourceAvailable", assistantService.isSourceAvailable());

        Map<String, Object> response = new HashMap<>();
        response.put("status", "success");
        response.put("data", data);
        return ResponseEntity.ok(response);
    }

    @PostMapping("/reset")
    @Operation(summary = "重置会话", description = "用户主动结束当前会话，回到 POSITIONING 阶段，丢弃未处理的照片")
    public ResponseEntity<Map<String, Object>> reset(@RequestBody(required = false) ResetRequest request) {
        String reason = request != null && request.getReason() != null ? request.getReason() : "user stop";
        assistantService.reset(reason);

        Map<String, Object> data = new HashMap<>();
        data.put("phase", assistantService.getSnapshot().getPhase().name());

        Map<String, Object> response = new HashMap<>();
        response.put("status", "success");
        response.put("data", data);
        return ResponseEntity.ok(response);
    }

    @GetMapping("/feedback")
    @Operation(summary = "最近的语音播报", description = "最新的在前")
    public ResponseEntity<Map<String, Object>> getFeedback(
            @Parameter(description = "返回条数", example = "20")
            @RequestParam(required = false, defaultValue = "20") Integer limit) {
        List<Map<String, Object>> phrases = new ArrayList<>();
        for (SpokenPhrase phrase : assistantService.recentFeedback(limit == null ? 20 : limit)) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("text", phrase.getText());
            item.put("spokenAt", phrase.getSpokenAt().toString());
            phrases.add(item);
        }

        Map<String, Object> response = new HashMap<>();
        response.put("status", "success");
        response.put("data", phrases);
        return ResponseEntity.ok(response);
    }

    @PostMapping("/choice")
    @Operation(
            summary = "手动选择商品",
            description = """
                    代替语音对话提交用户选择，转发到后端 `POST /user-choice`。
                    状态机会在下一次轮询时读取。

                    **请求示例**：
                    ```json
                    { "itemName": "Cola", "itemLocation": "top shelf" }
                    ```
                    """
    )
    public ResponseEntity<Map<String, Object>> submitChoice(@RequestBody ChoiceRequest request) {
        Map<String, Object> response = new HashMap<>();
        if (request == null || request.getItemName() == null || request.getItemName().isBlank()) {
            response.put("status", "error");
            response.put("message", "itemName is required");
            return ResponseEntity.badRequest().body(response);
        }

        try {
            String id = storeClient.submitChoice(request.getItemName().trim(), request.getItemLocation());
            logger.info("Manual choice '{}' submitted as {}", request.getItemName(), id);
            Map<String, Object> data = new HashMap<>();
            data.put("id", id);
            response.put("status", "success");
            response.put("data", data);
            return ResponseEntity.ok(response);
        } catch (StoreUnavailableException e) {
            logger.warn("Failed to submit choice: {}", e.getMessage());
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(response);
        } catch (StoreException e) {
            logger.warn("Choice rejected by backend: {}", e.getMessage());
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(response);
        }
    }

    static Map<String, Object> productToMap(ProductRecord product) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("itemNumber", product.getItemNumber());
        map.put("name", product.getName());
        map.put("brand", product.getBrand());
        map.put("location", product.getLocation());
        map.put("price", product.getPrice() != null ? product.getPrice().toPlainString() : null);
        return map;
    }

    private static Map<String, Object> catalogToMap(ProductCatalog catalog, boolean published) {
        if (catalog == null) {
            return null;
        }
        List<Map<String, Object>> items = new ArrayList<>();
        for (ProductRecord product : catalog.getProducts()) {
            items.add(productToMap(product));
        }
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("version", catalog.getVersion().toString());
        map.put("itemCount", catalog.size());
        map.put("published", published);
        map.put("items", items);
        return map;
    }

    private Map<String, Object> offsetToMap(Offset offset) {
        if (offset == null) {
            return null;
        }
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("angleDegrees", offset.getAngleDegrees());
        map.put("clockPosition", translator.clockPosition(offset.getAngleDegrees()));
        map.put("distance", offset.getDistanceHint().name());
        return map;
    }
}
