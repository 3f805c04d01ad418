package com.shelf.assistant.core.photo;

import io.github.resilience4j.core.IntervalFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 照片监听任务（独立生产者线程）
 * <p>
 * 从 {@link PhotoSource} 读取新文件 → 按文件名去重 → 分类 → 放入 {@link PhotoEventQueue}。
 * 命名不合规的文件只记录警告；来源不可用时指数退避后重新打开。
 */
public class PhotoWatcher implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(PhotoWatcher.class);

    private static final Duration POLL_TIMEOUT = Duration.ofMillis(500);
    private static final int MAX_REMEMBERED_FILES = 10_000;

    private final PhotoSource source;
    private final PhotoClassifier classifier;
    private final PhotoEventQueue queue;
    private final long settleDelayMs;
    private final IntervalFunction reopenBackoff;

    private final Set<String> seenFilenames = new LinkedHashSet<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean sourceAvailable = new AtomicBoolean(false);
    private boolean opened = false;
    private int consecutiveOpenFailures = 0;

    public PhotoWatcher(PhotoSource source, PhotoClassifier classifier, PhotoEventQueue queue,
                        long settleDelayMs, long retryBaseMs, long retryMaxMs) {
        this.source = source;
        this.classifier = classifier;
        this.queue = queue;
        this.settleDelayMs = Math.max(0, settleDelayMs);
        long base = Math.max(1, retryBaseMs);
        this.reopenBackoff = IntervalFunction.ofExponentialBackoff(base, 2.0, Math.max(base, retryMaxMs));
    }

    @Override
    public void run() {
        running.set(true);
        logger.info("Photo watcher started on {}", source.describe());
        try {
            while (running.get() && !Thread.currentThread().isInterrupted()) {
                try {
                    pollOnce(POLL_TIMEOUT);
                } catch (SourceUnavailableException e) {
                    long backoff = nextBackoffMs();
                    logger.warn("Photo source unavailable ({}), retrying in {} ms", e.getMessage(), backoff);
                    Thread.sleep(backoff);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            source.close();
            opened = false;
            sourceAvailable.set(false);
            logger.info("Photo watcher stopped");
        }
    }

    /**
     * 执行一次轮询，返回本次入队的事件数
     */
    public int pollOnce(Duration timeout) throws SourceUnavailableException, InterruptedException {
        try {
            if (!opened) {
                source.open();
                opened = true;
                if (consecutiveOpenFailures > 0) {
                    logger.info("Photo source {} is available again", source.describe());
                }
                consecutiveOpenFailures = 0;
                sourceAvailable.set(true);
            }
            return enqueue(source.poll(timeout));
        } catch (SourceUnavailableException e) {
            opened = false;
            sourceAvailable.set(false);
            consecutiveOpenFailures++;
            source.close();
            throw e;
        }
    }

    public void stop() {
        running.set(false);
    }

    public boolean isSourceAvailable() {
        return sourceAvailable.get();
    }

    public boolean isRunning() {
        return running.get();
    }

    long nextBackoffMs() {
        return reopenBackoff.apply(Math.max(consecutiveOpenFailures, 1));
    }

    private int enqueue(List<Path> arrivals) throws InterruptedException {
        List<Path> fresh = new ArrayList<>();
        for (Path path : arrivals) {
            String filename = path.getFileName().toString();
            if (!remember(filename)) {
                logger.debug("Ignoring repeated notification for {}", filename);
                continue;
            }
            fresh.add(path);
        }
        if (fresh.isEmpty()) {
            return 0;
        }

        if (settleDelayMs > 0) {
            Thread.sleep(settleDelayMs);
        }

        int enqueued = 0;
        for (Path path : fresh) {
            PhotoEvent event;
            try {
                event = classifier.classify(path);
            } catch (PhotoClassificationException e) {
                logger.warn("Ignoring file that does not match the naming convention: {}", e.getMessage());
                continue;
            }
            if (!Files.exists(path)) {
                logger.warn("Photo {} disappeared before it could be queued", path.getFileName());
                continue;
            }
            logger.info("New photo detected: {} ({})", event.getFilename(), event.getFlag());
            queue.offer(event);
            enqueued++;
        }
        return enqueued;
    }

    private boolean remember(String filename) {
        if (!seenFilenames.add(filename)) {
            return false;
        }
        if (seenFilenames.size() > MAX_REMEMBERED_FILES) {
            Iterator<String> it = seenFilenames.iterator();
            it.next();
            it.remove();
        }
        return true;
    }
}
