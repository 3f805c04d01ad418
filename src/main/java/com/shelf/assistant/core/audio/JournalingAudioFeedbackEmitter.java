package com.shelf.assistant.core.audio;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * 记录最近播报内容的装饰器，供状态接口查询
 */
public class JournalingAudioFeedbackEmitter implements AudioFeedbackEmitter, AutoCloseable {
    private final AudioFeedbackEmitter delegate;
    private final int capacity;
    private final Clock clock;
    private final Deque<SpokenPhrase> journal = new ArrayDeque<>();

    public JournalingAudioFeedbackEmitter(AudioFeedbackEmitter delegate, int capacity) {
        this(delegate, capacity, Clock.systemUTC());
    }

    public JournalingAudioFeedbackEmitter(AudioFeedbackEmitter delegate, int capacity, Clock clock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.delegate = delegate;
        this.capacity = capacity;
        this.clock = clock;
    }

    @Override
    public void speak(String phrase) {
        synchronized (journal) {
            if (journal.size() == capacity) {
                journal.removeFirst();
            }
            journal.addLast(new SpokenPhrase(phrase, clock.instant()));
        }
        delegate.speak(phrase);
    }

    /**
     * 最近的播报，最新的在前
     */
    public List<SpokenPhrase> recent(int limit) {
        List<SpokenPhrase> result = new ArrayList<>();
        synchronized (journal) {
            Iterator<SpokenPhrase> it = journal.descendingIterator();
            while (it.hasNext() && (limit <= 0 || result.size() < limit)) {
                result.add(it.next());
            }
        }
        return result;
    }

    public AudioFeedbackEmitter getDelegate() {
        return delegate;
    }

    @Override
    public void close() throws Exception {
        if (delegate instanceof AutoCloseable) {
            ((AutoCloseable) delegate).close();
        }
    }
}
