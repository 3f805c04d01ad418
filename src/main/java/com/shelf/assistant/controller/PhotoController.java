package com.shelf.assistant.controller;

import com.shelf.assistant.service.PhotoUploadService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * 照片上传控制器（手机端使用）
 */
@RestController
@RequestMapping("/api/photos")
@Tag(name = "照片上传", description = "手机端上传穿戴设备拍摄的照片")
public class PhotoController {
    private static final Logger logger = LoggerFactory.getLogger(PhotoController.class);

    @Autowired
    private PhotoUploadService photoUploadService;

    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(
            summary = "上传照片",
            description = """
                    照片按命名约定 `upload_<时间戳>_<flag>.<ext>` 写入监听目录，由照片监听线程处理。

                    | flag | 用途 |
                    |------|------|
                    | `low` | 摄像头定位 / 手部引导 |
                    | `high` | 货架商品识别 |
                    """
    )
    public ResponseEntity<Map<String, Object>> upload(
            @Parameter(description = "照片文件（jpg/jpeg/png）")
            @RequestParam("file") MultipartFile file,
            @Parameter(description = "拍摄标记: low 或 high", example = "low")
            @RequestParam("flag") String flag) {
        Map<String, Object> response = new HashMap<>();
        try {
            String filename = photoUploadService.store(file.getBytes(), flag, file.getOriginalFilename());
            Map<String, Object> data = new HashMap<>();
            data.put("filename", filename);
            response.put("status", "success");
            response.put("data", data);
            return ResponseEntity.ok(response);
        } catch (IllegalArgumentException e) {
            response.put("status", "error");
            response.put("message", e.getMessage());
            return ResponseEntity.badRequest().body(response);
        } catch (IOException e) {
            logger.error("Failed to store uploaded photo", e);
            response.put("status", "error");
            response.put("message", "Failed to store photo: " + e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
        }
    }
}
