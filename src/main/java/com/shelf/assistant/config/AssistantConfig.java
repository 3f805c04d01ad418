package com.shelf.assistant.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shelf.assistant.core.audio.AudioFeedbackEmitter;
import com.shelf.assistant.core.audio.ElevenLabsAudioFeedbackEmitter;
import com.shelf.assistant.core.audio.JournalingAudioFeedbackEmitter;
import com.shelf.assistant.core.audio.LoggingAudioFeedbackEmitter;
import com.shelf.assistant.core.catalog.ProductCatalogCodec;
import com.shelf.assistant.core.guidance.GuidanceTranslator;
import com.shelf.assistant.core.phase.PhaseStateMachine;
import com.shelf.assistant.core.photo.DirectoryPhotoSource;
import com.shelf.assistant.core.photo.PhotoClassifier;
import com.shelf.assistant.core.photo.PhotoEventQueue;
import com.shelf.assistant.core.photo.PhotoPreprocessor;
import com.shelf.assistant.core.photo.PhotoSource;
import com.shelf.assistant.core.photo.PhotoWatcher;
import com.shelf.assistant.core.retry.RetryPolicy;
import com.shelf.assistant.core.store.BackendStoreClient;
import com.shelf.assistant.core.vision.GeminiVisionClient;
import com.shelf.assistant.core.vision.VisionClient;
import com.shelf.assistant.core.vision.VisionResponseParser;
import com.shelf.assistant.service.CatalogPublisher;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.nio.file.Paths;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 会话核心组件装配
 * <p>
 * 从 application.yml 读取配置并创建各组件
 */
@Configuration
public class AssistantConfig {
    private static final Logger logger = LoggerFactory.getLogger(AssistantConfig.class);

    @Autowired
    private YamlConfig yamlConfig;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // ==================== 照片 ====================

    @Bean
    public PhotoClassifier photoClassifier() {
        return new PhotoClassifier();
    }

    @Bean
    public PhotoEventQueue photoEventQueue() {
        return new PhotoEventQueue(yamlConfig.getPhotos().getQueueCapacity());
    }

    @Bean
    public PhotoSource photoSource() {
        YamlConfig.PhotoConfig photos = yamlConfig.getPhotos();
        return new DirectoryPhotoSource(Paths.get(photos.getWatchDir()), photos.isProcessExistingOnStart());
    }

    @Bean
    public PhotoWatcher photoWatcher(PhotoSource photoSource, PhotoClassifier classifier, PhotoEventQueue queue) {
        YamlConfig.PhotoConfig photos = yamlConfig.getPhotos();
        return new PhotoWatcher(photoSource, classifier, queue, photos.getSettleDelayMs(),
                photos.getSourceRetryBaseMs(), photos.getSourceRetryMaxMs());
    }

    @Bean
    public PhotoPreprocessor photoPreprocessor() {
        YamlConfig.PhotoConfig photos = yamlConfig.getPhotos();
        PhotoPreprocessor preprocessor = PhotoPreprocessor.withOpenCvIfLoaded(
                photos.getMaxEdgePixels(), photos.getJpegQuality());
        logger.info("Photo preprocessing: maxEdge={}, OpenCV={}",
                photos.getMaxEdgePixels(), NativeLibraryLoader.isOpenCvLoaded());
        return preprocessor;
    }

    // ==================== 视觉模型 ====================

    @Bean
    public ProductCatalogCodec productCatalogCodec() {
        return new ProductCatalogCodec();
    }

    @Bean
    public OkHttpClient visionHttpClient() {
        return httpClient(yamlConfig.getVision().getTimeoutSeconds());
    }

    @Bean
    public VisionClient visionClient(@Qualifier("visionHttpClient") OkHttpClient httpClient,
                                     ObjectMapper objectMapper, ProductCatalogCodec codec) {
        YamlConfig.VisionConfig vision = yamlConfig.getVision();
        logger.info("Vision model: {} (timeout {}s)", vision.getModel(), vision.getTimeoutSeconds());
        return new GeminiVisionClient(httpClient, objectMapper, new VisionResponseParser(objectMapper, codec),
                vision.getBaseUrl(), vision.getModel(), vision.getApiKey());
    }

    @Bean
    public RetryPolicy visionRetryPolicy() {
        YamlConfig.VisionConfig vision = yamlConfig.getVision();
        return RetryPolicy.of("vision", vision.getMaxAttempts(), vision.getBaseDelayMs(), vision.getMaxDelayMs(), vision.getJitter());
    }

    // ==================== 后端 ====================

    @Bean
    public OkHttpClient backendHttpClient() {
        return httpClient(yamlConfig.getBackend().getTimeoutSeconds());
    }

    @Bean
    public BackendStoreClient backendStoreClient(@Qualifier("backendHttpClient") OkHttpClient httpClient,
                                                 ObjectMapper objectMapper, ProductCatalogCodec codec) {
        logger.info("Backend: {}", yamlConfig.getBackend().getBaseUrl());
        return new BackendStoreClient(httpClient, objectMapper, codec, yamlConfig.getBackend().getBaseUrl());
    }

    @Bean
    public RetryPolicy storeRetryPolicy() {
        YamlConfig.BackendConfig backend = yamlConfig.getBackend();
        return RetryPolicy.of("backend-store", backend.getMaxAttempts(), backend.getBaseDelayMs(), backend.getMaxDelayMs(), backend.getJitter());
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService catalogPublishExecutor() {
        return Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "catalog-publisher");
            t.setDaemon(true);
            return t;
        });
    }

    // ==================== 语音 ====================

    @Bean
    public JournalingAudioFeedbackEmitter audioFeedbackEmitter(ObjectMapper objectMapper) {
        YamlConfig.AudioConfig audio = yamlConfig.getAudio();
        AudioFeedbackEmitter emitter;
        if ("elevenlabs".equalsIgnoreCase(audio.getProvider())) {
            emitter = new ElevenLabsAudioFeedbackEmitter(httpClient(audio.getTimeoutSeconds()), objectMapper,
                    audio.getBaseUrl(), audio.getApiKey(), audio.getVoiceId(), audio.getModelId(),
                    Paths.get(audio.getOutputDir()));
        } else if ("log".equalsIgnoreCase(audio.getProvider())) {
            emitter = new LoggingAudioFeedbackEmitter();
        } else {
            throw new IllegalStateException("Unknown audio provider: " + audio.getProvider());
        }
        logger.info("Audio provider: {}", audio.getProvider());
        return new JournalingAudioFeedbackEmitter(emitter, audio.getJournalSize());
    }

    // ==================== 状态机 ====================

    @Bean
    public GuidanceTranslator guidanceTranslator() {
        return new GuidanceTranslator();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService sessionScheduler() {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "selection-poller");
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public PhaseStateMachine phaseStateMachine(VisionClient visionClient, PhotoPreprocessor preprocessor,
                                               BackendStoreClient storeClient, CatalogPublisher catalogPublisher,
                                               GuidanceTranslator translator, JournalingAudioFeedbackEmitter audio,
                                               @Qualifier("visionRetryPolicy") RetryPolicy visionRetry,
                                               ScheduledExecutorService sessionScheduler, Clock clock) {
        YamlConfig.SessionConfig session = yamlConfig.getSession();
        logger.info("Session: framingThreshold={}, reachedTolerance={}°, reachedCycles={}, pollInterval={}ms",
                session.getFramingConfidenceThreshold(), session.getReachedToleranceDegrees(),
                session.getReachedConsecutiveCycles(), session.getPollIntervalMs());
        return new PhaseStateMachine(visionClient, preprocessor, storeClient, catalogPublisher, translator, audio,
                visionRetry, sessionScheduler, session, clock);
    }

    /**
     * {@code @Scheduled} 任务使用，与选择轮询线程分开
     */
    @Bean
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("catalog-retry-");
        return scheduler;
    }

    private static OkHttpClient httpClient(int timeoutSeconds) {
        return new OkHttpClient.Builder()
                .connectTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .readTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .writeTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .callTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .build();
    }
}
