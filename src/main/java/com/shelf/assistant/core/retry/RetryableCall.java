package com.shelf.assistant.core.retry;

/**
 * 可重试的调用，允许抛出受检异常
 */
@FunctionalInterface
public interface RetryableCall<T, E extends Exception> {
    T call() throws E;
}
