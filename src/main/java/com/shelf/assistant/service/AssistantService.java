package com.shelf.assistant.service;

import com.shelf.assistant.core.audio.JournalingAudioFeedbackEmitter;
import com.shelf.assistant.core.audio.SpokenPhrase;
import com.shelf.assistant.core.phase.PhaseStateMachine;
import com.shelf.assistant.core.phase.SessionSnapshot;
import com.shelf.assistant.core.photo.PhotoEvent;
import com.shelf.assistant.core.photo.PhotoEventQueue;
import com.shelf.assistant.core.photo.PhotoWatcher;
import com.shelf.assistant.event.CatalogUploadEvent;
import com.shelf.assistant.model.CatalogRecord;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationListener;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

/**
 * 会话运行时：照片监听线程 + 事件消费线程
 * <p>
 * 同时把清单上传结果转发给状态机。
 */
@Service
public class AssistantService implements ApplicationListener<CatalogUploadEvent> {
    private static final Logger logger = LoggerFactory.getLogger(AssistantService.class);

    private static final Duration CONSUMER_POLL = Duration.ofMillis(500);

    private final PhaseStateMachine stateMachine;
    private final PhotoWatcher photoWatcher;
    private final PhotoEventQueue photoQueue;
    private final JournalingAudioFeedbackEmitter journal;

    private volatile boolean running = false;
    private Thread watcherThread;
    private Thread consumerThread;

    public AssistantService(PhaseStateMachine stateMachine, PhotoWatcher photoWatcher,
                            PhotoEventQueue photoQueue, JournalingAudioFeedbackEmitter journal) {
        this.stateMachine = stateMachine;
        this.photoWatcher = photoWatcher;
        this.photoQueue = photoQueue;
        this.journal = journal;
    }

    @PostConstruct
    public void start() {
        running = true;
        watcherThread = new Thread(photoWatcher, "photo-watcher");
        watcherThread.setDaemon(true);
        watcherThread.start();

        consumerThread = new Thread(this::consume, "phase-consumer");
        consumerThread.setDaemon(true);
        consumerThread.start();
        logger.info("Shelf assistant started in phase {}", stateMachine.getPhase());
    }

    @PreDestroy
    public void shutdown() {
        running = false;
        photoWatcher.stop();
        stateMachine.stop();
        interruptAndJoin(watcherThread);
        interruptAndJoin(consumerThread);
        logger.info("Shelf assistant stopped");
    }

    /**
     * 用户主动结束会话，丢弃尚未处理的照片
     */
    public void reset(String reason) {
        int discarded = photoQueue.size();
        photoQueue.clear();
        stateMachine.reset(reason);
        if (discarded > 0) {
            logger.info("Discarded {} queued photos on reset", discarded);
        }
    }

    public SessionSnapshot getSnapshot() {
        return stateMachine.getSnapshot();
    }

    public boolean isSourceAvailable() {
        return photoWatcher.isSourceAvailable();
    }

    public int getQueueDepth() {
        return photoQueue.size();
    }

    public long getDroppedPhotos() {
        return photoQueue.getDroppedCount();
    }

    public List<SpokenPhrase> recentFeedback(int limit) {
        return journal.recent(limit);
    }

    @Override
    public void onApplicationEvent(CatalogUploadEvent event) {
        CatalogRecord record = event.getRecord();
        if (event.getOutcome() == CatalogUploadEvent.Outcome.PUBLISHED) {
            stateMachine.onCatalogPublished(record.getVersion(), record.getRemoteId());
        } else {
            stateMachine.onCatalogRejected(record.getVersion());
        }
    }

    private void consume() {
        while (running) {
            PhotoEvent event;
            try {
                event = photoQueue.poll(CONSUMER_POLL);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (event == null) {
                continue;
            }
            try {
                stateMachine.onPhoto(event);
            } catch (RuntimeException e) {
                logger.error("Failed to handle {}", event, e);
            }
        }
    }

    private static void interruptAndJoin(Thread thread) {
        if (thread == null) {
            return;
        }
        thread.interrupt();
        try {
            thread.join(2000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
