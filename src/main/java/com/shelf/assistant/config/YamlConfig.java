package com.shelf.assistant.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "shelf-assistant")
public class YamlConfig {
    private SystemConfig system = new SystemConfig();
    private PhotoConfig photos = new PhotoConfig();
    private VisionConfig vision = new VisionConfig();
    private BackendConfig backend = new BackendConfig();
    private SessionConfig session = new SessionConfig();
    private AudioConfig audio = new AudioConfig();

    @Data
    public static class SystemConfig {
        private String deviceId = "wearable-01";
        private boolean saveLocal = true;
        private String dataDir = "data";
    }

    @Data
    public static class PhotoConfig {
        private String watchDir = System.getProperty("user.home") + "/Documents/JuliePhotos";
        private int queueCapacity = 8;
        // 等待文件写完
        private long settleDelayMs = 500;
        private boolean processExistingOnStart = false;
        // 发送给视觉模型前的最长边（像素），<=0 不缩放
        private int maxEdgePixels = 1600;
        private int jpegQuality = 85;
        private long sourceRetryBaseMs = 1000;
        private long sourceRetryMaxMs = 30000;
    }

    @Data
    public static class VisionConfig {
        private String baseUrl = "https://generativelanguage.googleapis.com/v1beta";
        private String model = "gemini-2.0-flash-exp";
        private String apiKey;
        private int timeoutSeconds = 30;
        private int maxAttempts = 3;
        private long baseDelayMs = 500;
        private long maxDelayMs = 4000;
        private double jitter = 0.2;
    }

    @Data
    public static class BackendConfig {
        private String baseUrl = "http://localhost:8000";
        private int timeoutSeconds = 10;
        private int maxAttempts = 3;
        private long baseDelayMs = 1000;
        private long maxDelayMs = 8000;
        private double jitter = 0.2;
        // 本地待上传目录表的重传间隔
        private long retryDelayMs = 30000;
    }

    @Data
    public static class SessionConfig {
        private double framingConfidenceThreshold = 0.7;
        private double reachedToleranceDegrees = 15.0;
        private int reachedConsecutiveCycles = 1;
        private long pollIntervalMs = 2000;
        private int storeFailureCeiling = 5;
    }

    @Data
    public static class AudioConfig {
        private String provider = "log";   // log 或 elevenlabs
        private String baseUrl = "https://api.elevenlabs.io/v1";
        private String apiKey;
        private String voiceId = "21m00Tcm4TlvDq8ikWAM";
        private String modelId = "eleven_turbo_v2";
        private String outputDir = "data/speech";
        private int timeoutSeconds = 15;
        private int journalSize = 50;
    }
}
