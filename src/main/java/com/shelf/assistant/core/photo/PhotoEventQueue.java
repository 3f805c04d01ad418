package com.shelf.assistant.core.photo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 有界照片事件队列
 * <p>
 * 队列满时丢弃最旧的事件：状态机落后时只有最新的取景 / 手部位置有意义。
 */
public class PhotoEventQueue {
    private static final Logger logger = LoggerFactory.getLogger(PhotoEventQueue.class);

    private final LinkedBlockingDeque<PhotoEvent> deque;
    private final int capacity;
    private final AtomicLong droppedCount = new AtomicLong();

    public PhotoEventQueue(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Queue capacity must be >= 1, got " + capacity);
        }
        this.capacity = capacity;
        this.deque = new LinkedBlockingDeque<>(capacity);
    }

    /**
     * 入队，必要时丢弃最旧的事件
     * @return 被丢弃的事件数量
     */
    public int offer(PhotoEvent event) {
        int dropped = 0;
        while (!deque.offerLast(event)) {
            PhotoEvent oldest = deque.pollFirst();
            if (oldest != null) {
                dropped++;
                droppedCount.incrementAndGet();
                logger.warn("Photo queue full ({}), dropping oldest event {}", capacity, oldest.getFilename());
            }
        }
        return dropped;
    }

    /**
     * 取出下一个事件，超时返回 null
     */
    public PhotoEvent poll(Duration timeout) throws InterruptedException {
        return deque.pollFirst(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public void clear() {
        deque.clear();
    }

    public int size() {
        return deque.size();
    }

    public int getCapacity() {
        return capacity;
    }

    public long getDroppedCount() {
        return droppedCount.get();
    }
}
