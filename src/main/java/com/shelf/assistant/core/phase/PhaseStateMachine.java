package com.shelf.assistant.core.phase;

import com.shelf.assistant.config.YamlConfig;
import com.shelf.assistant.core.audio.AudioFeedbackEmitter;
import com.shelf.assistant.core.catalog.ProductCatalog;
import com.shelf.assistant.core.catalog.ProductRecord;
import com.shelf.assistant.core.guidance.GuidanceTranslator;
import com.shelf.assistant.core.guidance.Offset;
import com.shelf.assistant.core.photo.CaptureFlag;
import com.shelf.assistant.core.photo.PhotoEvent;
import com.shelf.assistant.core.photo.PhotoPreprocessor;
import com.shelf.assistant.core.photo.PhotoPreprocessor.PreparedPhoto;
import com.shelf.assistant.core.retry.RetryPolicy;
import com.shelf.assistant.core.store.BackendStoreClient;
import com.shelf.assistant.core.store.StoreException;
import com.shelf.assistant.core.store.StoreRejectedException;
import com.shelf.assistant.core.store.StoreUnavailableException;
import com.shelf.assistant.core.vision.FramingVerdict;
import com.shelf.assistant.core.vision.GuidanceResult;
import com.shelf.assistant.core.vision.IdentificationResult;
import com.shelf.assistant.core.vision.VisionClient;
import com.shelf.assistant.core.vision.VisionException;
import com.shelf.assistant.core.vision.VisionParseException;
import com.shelf.assistant.core.vision.VisionRequest;
import com.shelf.assistant.core.vision.VisionResult;
import com.shelf.assistant.core.vision.VisionUnavailableException;
import com.shelf.assistant.model.UserChoice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 购物会话状态机
 * <p>
 * POSITIONING → IDENTIFYING → AWAITING_SELECTION → GUIDING → COMPLETED → POSITIONING
 * <p>
 * 状态读写都在对象锁内完成。照片由 photoLock 串行处理，同一时刻最多只有一个视觉调用，
 * 且视觉调用期间不持有对象锁，reset 可立即生效。
 * 视觉结果返回后若会话代数或阶段已变化，结果直接丢弃。
 * AWAITING_SELECTION 期间由 scheduler 周期性调用 {@link #onPollTick()} 查询用户选择，离开该阶段即取消。
 */
public class PhaseStateMachine {
    private static final Logger logger = LoggerFactory.getLogger(PhaseStateMachine.class);

    private final VisionClient visionClient;
    private final PhotoPreprocessor preprocessor;
    private final BackendStoreClient storeClient;
    private final CatalogSink catalogSink;
    private final GuidanceTranslator translator;
    private final AudioFeedbackEmitter audio;
    private final RetryPolicy visionRetry;
    private final ScheduledExecutorService scheduler;
    private final YamlConfig.SessionConfig settings;
    private final Clock clock;

    private final Object photoLock = new Object();
    private final AtomicLong generation = new AtomicLong();
    private final Set<UUID> pendingAcknowledgements = ConcurrentHashMap.newKeySet();

    private SessionState state = new SessionState();
    private ScheduledFuture<?> pollTimer;
    private volatile SessionSnapshot snapshot;

    public PhaseStateMachine(VisionClient visionClient, PhotoPreprocessor preprocessor,
                             BackendStoreClient storeClient, CatalogSink catalogSink,
                             GuidanceTranslator translator, AudioFeedbackEmitter audio,
                             RetryPolicy visionRetry, ScheduledExecutorService scheduler,
                             YamlConfig.SessionConfig settings, Clock clock) {
        this.visionClient = visionClient;
        this.preprocessor = preprocessor;
        this.storeClient = storeClient;
        this.catalogSink = catalogSink;
        this.translator = translator;
        this.audio = audio;
        this.visionRetry = visionRetry;
        this.scheduler = scheduler;
        this.settings = settings;
        this.clock = clock;
        this.snapshot = state.snapshot(0, 0);
    }

    // ==================== 事件入口 ====================

    /**
     * 处理一张照片。不属于当前阶段的照片记录 DEBUG 日志后忽略。
     */
    public void onPhoto(PhotoEvent event) {
        synchronized (photoLock) {
            long gen;
            Phase phase;
            ProductRecord target;
            synchronized (this) {
                gen = generation.get();
                phase = state.phase;
                target = state.selectedItem;
                if (!accepts(phase, event.getFlag())) {
                    logger.debug("Ignoring {} photo {} in phase {}", event.getFlag(), event.getFilename(), phase);
                    return;
                }
            }

            VisionResult result = null;
            Exception failure = null;
            try {
                result = analyze(event, phase, target);
            } catch (IOException | VisionException e) {
                failure = e;
            }

            synchronized (this) {
                try {
                    if (gen != generation.get() || phase != state.phase) {
                        logger.info("Discarding result for {}: session moved on", event.getFilename());
                        return;
                    }
                    if (failure != null) {
                        reportFailure(event, failure);
                        return;
                    }
                    switch (phase) {
                        case POSITIONING:
                            expect(result, FramingVerdict.class, event).ifPresent(this::handlePositioning);
                            break;
                        case IDENTIFYING:
                            expect(result, IdentificationResult.class, event).ifPresent(this::handleIdentification);
                            break;
                        case GUIDING:
                            expect(result, GuidanceResult.class, event).ifPresent(this::handleGuiding);
                            break;
                        default:
                            break;
                    }
                } finally {
                    publishSnapshot();
                }
            }
        }
    }

    /**
     * 查询用户选择（AWAITING_SELECTION 期间由定时器触发）
     */
    public void onPollTick() {
        onPollTick(generation.get());
    }

    synchronized void onPollTick(long expectedGeneration) {
        if (expectedGeneration != generation.get() || state.phase != Phase.AWAITING_SELECTION) {
            logger.debug("Ignoring stray poll tick (phase {})", state.phase);
            return;
        }
        try {
            pollChoice();
        } finally {
            publishSnapshot();
        }
    }

    /**
     * 商品清单已被后端接受
     */
    public synchronized void onCatalogPublished(Instant version, String catalogId) {
        if (!isActiveCatalog(version)) {
            logger.debug("Catalog {} published but is no longer active", version);
            return;
        }
        state.catalogPublished = true;
        if (state.phase == Phase.AWAITING_SELECTION) {
            logger.info("Catalog {} published as {}", version, catalogId);
            speak(Phrases.catalogSummary(state.activeCatalog));
        } else {
            logger.debug("Catalog {} published while in phase {}", version, state.phase);
        }
        publishSnapshot();
    }

    /**
     * 后端拒绝了商品清单，需要重新拍摄货架
     */
    public synchronized void onCatalogRejected(Instant version) {
        if (!isActiveCatalog(version) || state.phase != Phase.AWAITING_SELECTION) {
            logger.debug("Ignoring rejection of catalog {} in phase {}", version, state.phase);
            return;
        }
        state.activeCatalog = null;
        state.catalogPublished = false;
        speak(Phrases.CATALOG_REJECTED);
        transition(Phase.IDENTIFYING, "catalog rejected");
        publishSnapshot();
    }

    /**
     * 用户主动结束当前会话
     */
    public synchronized void reset(String reason) {
        generation.incrementAndGet();
        clearSession(reason);
        speak(Phrases.SESSION_RESET);
        publishSnapshot();
    }

    /**
     * 停止定时器（应用关闭时调用）
     */
    public synchronized void stop() {
        generation.incrementAndGet();
        cancelPollTimer();
    }

    public SessionSnapshot getSnapshot() {
        return snapshot;
    }

    public Phase getPhase() {
        return snapshot.getPhase();
    }

    public Set<UUID> getPendingAcknowledgements() {
        return Set.copyOf(pendingAcknowledgements);
    }

    // ==================== 各阶段处理 ====================

    private void handlePositioning(FramingVerdict verdict) {
        if (verdict.isFramed(settings.getFramingConfidenceThreshold())) {
            speak(Phrases.READY_FOR_SHELF);
            transition(Phase.IDENTIFYING, "shelf framed, confidence " + verdict.getConfidence());
        } else {
            logger.debug("Not framed yet (framed={}, confidence={})", verdict.isFramed(), verdict.getConfidence());
            speak(orDefault(verdict.getInstruction(), Phrases.ADJUST_CAMERA));
        }
    }

    private void handleIdentification(IdentificationResult result) {
        if (result.getDrafts().isEmpty()) {
            speak(Phrases.NO_PRODUCTS);
            transition(Phase.POSITIONING, "no products identified");
            return;
        }
        ProductCatalog catalog = ProductCatalog.fromDrafts(result.getDrafts(), clock.instant());
        state.activeCatalog = catalog;
        state.catalogPublished = false;
        logger.info("Identified {} products (catalog {})", catalog.size(), catalog.getVersion());
        try {
            catalogSink.submit(catalog);
        } catch (RuntimeException e) {
            logger.error("Could not hand over catalog {}", catalog.getVersion(), e);
            state.activeCatalog = null;
            speak(Phrases.CATALOG_REJECTED);
            return;
        }
        transition(Phase.AWAITING_SELECTION, "catalog created");
    }

    private void handleGuiding(GuidanceResult guidance) {
        ProductRecord target = state.selectedItem;
        Offset offset = guidance.getOffset();
        if (offset == null) {
            state.consecutiveReachedCycles = 0;
            speak(orDefault(guidance.getInstruction(), Phrases.HAND_NOT_VISIBLE));
            return;
        }
        state.lastGuidanceOffset = offset;
        if (!translator.isReached(offset, settings.getReachedToleranceDegrees())) {
            state.consecutiveReachedCycles = 0;
            speak(translator.translate(offset));
            return;
        }
        state.consecutiveReachedCycles++;
        if (state.consecutiveReachedCycles < settings.getReachedConsecutiveCycles()) {
            speak(Phrases.HOLD_STEADY);
            return;
        }
        speak(Phrases.itemReached(target));
        acknowledge(state.activeChoice.getId());
        transition(Phase.COMPLETED, "reached " + target.getName());
        generation.incrementAndGet();
        clearSession("item reached");
    }

    private void pollChoice() {
        retryPendingAcknowledgements();

        Optional<UserChoice> polled;
        try {
            polled = storeClient.pollLatestChoice();
            state.consecutiveStoreFailures = 0;
        } catch (StoreUnavailableException e) {
            onStoreUnavailable(e);
            return;
        } catch (StoreRejectedException e) {
            logger.warn("Choice poll rejected: {}", e.getMessage());
            return;
        } catch (StoreException e) {
            logger.warn("Choice poll failed: {}", e.getMessage());
            return;
        }
        if (polled.isEmpty()) {
            return;
        }

        UserChoice choice = polled.get();
        if (pendingAcknowledgements.contains(choice.getId())) {
            logger.debug("Choice {} already handled, acknowledgement pending", choice.getId());
            return;
        }
        Optional<ProductRecord> match = state.activeCatalog.findByName(choice.getItemName());
        if (match.isEmpty()) {
            logger.info("Choice '{}' not in catalog {}", choice.getItemName(), state.activeCatalog.getVersion());
            speak(Phrases.notRecognized(choice.getItemName()));
            acknowledge(choice.getId());
            return;
        }
        state.activeChoice = choice;
        state.selectedItem = match.get();
        state.consecutiveReachedCycles = 0;
        state.lastGuidanceOffset = null;
        transition(Phase.GUIDING, "selected item " + match.get().getItemNumber());
        speak(Phrases.startGuiding(match.get()));
    }

    // ==================== 辅助方法 ====================

    private static boolean accepts(Phase phase, CaptureFlag flag) {
        switch (phase) {
            case POSITIONING:
            case GUIDING:
                return flag == CaptureFlag.POSITIONING;
            case IDENTIFYING:
                return flag == CaptureFlag.IDENTIFICATION;
            default:
                return false;
        }
    }

    /**
     * 读取照片并调用视觉模型（不持有对象锁）
     */
    private VisionResult analyze(PhotoEvent event, Phase phase, ProductRecord target)
            throws IOException, VisionException {
        PreparedPhoto photo = preprocessor.prepare(event.getPath());
        VisionRequest request;
        switch (phase) {
            case POSITIONING:
                request = VisionRequest.positioning(photo.getData(), photo.getMimeType());
                break;
            case IDENTIFYING:
                request = VisionRequest.identifying(photo.getData(), photo.getMimeType());
                break;
            default:
                request = VisionRequest.guiding(photo.getData(), photo.getMimeType(), target);
                break;
        }
        return visionRetry.execute(VisionException.class,
                () -> visionClient.analyze(request), PhaseStateMachine::isTransient);
    }

    private void reportFailure(PhotoEvent event, Exception failure) {
        if (failure instanceof IOException) {
            logger.warn("Dropping unreadable photo {}: {}", event.getFilename(), failure.getMessage());
            speak(Phrases.PHOTO_RETRY);
        } else if (failure instanceof VisionParseException) {
            logger.warn("Unparsable response for {}: {}", event.getFilename(), failure.getMessage());
            speak(Phrases.PHOTO_RETRY);
        } else {
            logger.error("Vision unavailable for {}: {}", event.getFilename(), failure.getMessage());
            speak(Phrases.VISION_UNAVAILABLE);
        }
    }

    private <R extends VisionResult> Optional<R> expect(VisionResult result, Class<R> resultType, PhotoEvent event) {
        if (resultType.isInstance(result)) {
            return Optional.of(resultType.cast(result));
        }
        logger.warn("Expected {} for {} but got {}", resultType.getSimpleName(), event.getFilename(),
                result == null ? "nothing" : result.getClass().getSimpleName());
        speak(Phrases.PHOTO_RETRY);
        return Optional.empty();
    }

    private static boolean isTransient(VisionException e) {
        return e instanceof VisionUnavailableException && ((VisionUnavailableException) e).isTransientFailure();
    }

    private void onStoreUnavailable(StoreUnavailableException e) {
        state.consecutiveStoreFailures++;
        logger.warn("Backend unavailable ({}/{}): {}", state.consecutiveStoreFailures,
                settings.getStoreFailureCeiling(), e.getMessage());
        if (state.consecutiveStoreFailures >= settings.getStoreFailureCeiling()) {
            speak(Phrases.STORE_UNAVAILABLE);
            generation.incrementAndGet();
            clearSession("backend unavailable");
        }
    }

    private void acknowledge(UUID choiceId) {
        try {
            storeClient.acknowledgeChoice(choiceId);
            pendingAcknowledgements.remove(choiceId);
        } catch (StoreUnavailableException e) {
            pendingAcknowledgements.add(choiceId);
            logger.warn("Acknowledging choice {} failed, will retry: {}", choiceId, e.getMessage());
        } catch (StoreException e) {
            pendingAcknowledgements.remove(choiceId);
            logger.warn("Acknowledgement of choice {} rejected: {}", choiceId, e.getMessage());
        }
    }

    private void retryPendingAcknowledgements() {
        for (UUID choiceId : new ArrayList<>(pendingAcknowledgements)) {
            acknowledge(choiceId);
        }
    }

    private boolean isActiveCatalog(Instant version) {
        return state.activeCatalog != null && state.activeCatalog.getVersion().equals(version);
    }

    private void transition(Phase next, String reason) {
        Phase previous = state.phase;
        if (previous == Phase.AWAITING_SELECTION && next != Phase.AWAITING_SELECTION) {
            cancelPollTimer();
        }
        state.phase = next;
        logger.info("Phase {} -> {} ({})", previous, next, reason);
        if (next == Phase.AWAITING_SELECTION) {
            startPollTimer();
        }
    }

    /**
     * 回到初始状态，调用方负责先递增会话代数
     */
    private void clearSession(String reason) {
        cancelPollTimer();
        Phase previous = state.phase;
        state = new SessionState();
        logger.info("Session reset from {} ({})", previous, reason);
    }

    private void startPollTimer() {
        cancelPollTimer();
        long gen = generation.get();
        long interval = settings.getPollIntervalMs();
        pollTimer = scheduler.scheduleWithFixedDelay(() -> {
            try {
                onPollTick(gen);
            } catch (RuntimeException e) {
                logger.error("Poll tick failed", e);
            }
        }, interval, interval, TimeUnit.MILLISECONDS);
    }

    private void cancelPollTimer() {
        if (pollTimer != null) {
            pollTimer.cancel(false);
            pollTimer = null;
        }
    }

    private void speak(String phrase) {
        try {
            audio.speak(phrase);
        } catch (RuntimeException e) {
            logger.error("Audio feedback failed for \"{}\"", phrase, e);
        }
    }

    private void publishSnapshot() {
        snapshot = state.snapshot(generation.get(), pendingAcknowledgements.size());
    }

    private static String orDefault(String text, String fallback) {
        return text == null || text.isBlank() ? fallback : text;
    }

    boolean isPollTimerActive() {
        synchronized (this) {
            return pollTimer != null && !pollTimer.isCancelled();
        }
    }
}
