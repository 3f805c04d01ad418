package com.shelf.assistant.core.retry;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.core.functions.CheckedSupplier;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Predicate;

/**
 * 重试策略（基于 Resilience4j Retry，指数退避 + 抖动）
 * <p>
 * 第 n 次失败后的等待时间: min(maxDelay, baseDelay * multiplier^(n-1) * [1-jitter, 1+jitter])。
 * 测试中使用 {@link #noDelay(int)} 避免真实等待。
 */
public class RetryPolicy {
    private static final Logger logger = LoggerFactory.getLogger(RetryPolicy.class);

    private final String name;
    private final int maxAttempts;
    private final long baseDelayMs;
    private final double multiplier;
    private final long maxDelayMs;
    private final double jitter;
    private final IntervalFunction intervalFunction;

    public RetryPolicy(String name, int maxAttempts, long baseDelayMs, double multiplier, long maxDelayMs, double jitter) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        if (baseDelayMs < 0 || maxDelayMs < 0) {
            throw new IllegalArgumentException("Delays must not be negative");
        }
        if (jitter < 0 || jitter >= 1) {
            throw new IllegalArgumentException("jitter must be within [0, 1), got " + jitter);
        }
        this.name = name;
        this.maxAttempts = maxAttempts;
        this.baseDelayMs = baseDelayMs;
        this.multiplier = multiplier < 1 ? 1 : multiplier;
        this.maxDelayMs = Math.max(baseDelayMs, maxDelayMs);
        this.jitter = jitter;
        this.intervalFunction = backoff(this.baseDelayMs, this.multiplier, this.maxDelayMs, this.jitter);
    }

    public static RetryPolicy of(String name, int maxAttempts, long baseDelayMs, long maxDelayMs, double jitter) {
        return new RetryPolicy(name, maxAttempts, baseDelayMs, 2.0, maxDelayMs, jitter);
    }

    public static RetryPolicy noDelay(int maxAttempts) {
        return new RetryPolicy("no-delay", maxAttempts, 0, 1.0, 0, 0);
    }

    /**
     * 指数退避的间隔函数，结果不超过 maxDelayMs；baseDelayMs 为 0 时不等待
     */
    public static IntervalFunction backoff(long baseDelayMs, double multiplier, long maxDelayMs, double jitter) {
        if (baseDelayMs <= 0) {
            return attempt -> 0L;
        }
        long cap = Math.max(baseDelayMs, maxDelayMs);
        IntervalFunction raw = jitter > 0
                ? IntervalFunction.ofExponentialRandomBackoff(baseDelayMs, multiplier, jitter, cap)
                : IntervalFunction.ofExponentialBackoff(baseDelayMs, multiplier, cap);
        return attempt -> Math.min(raw.apply(attempt), cap);
    }

    /**
     * 执行调用，对满足 retryable 的异常进行重试
     *
     * @param failureType 调用可能抛出的异常类型
     * @param call        实际调用
     * @param retryable   判断异常是否值得重试
     * @return 调用结果
     * @throws E 不可重试的异常，或最后一次尝试的异常
     */
    public <T, E extends Exception> T execute(Class<E> failureType, RetryableCall<T, E> call,
                                              Predicate<? super E> retryable) throws E {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(intervalFunction)
                .retryOnException(t -> failureType.isInstance(t) && retryable.test(failureType.cast(t)))
                .build();
        Retry retry = Retry.of(name, config);
        retry.getEventPublisher().onRetry(event -> logger.warn("{}: attempt {}/{} failed ({}), retrying in {} ms",
                name, event.getNumberOfRetryAttempts(), maxAttempts,
                event.getLastThrowable() == null ? "unknown" : event.getLastThrowable().getMessage(),
                event.getWaitInterval().toMillis()));

        CheckedSupplier<T> decorated = Retry.decorateCheckedSupplier(retry, call::call);
        try {
            return decorated.get();
        } catch (Throwable t) {
            if (failureType.isInstance(t)) {
                throw failureType.cast(t);
            }
            if (t instanceof RuntimeException) {
                throw (RuntimeException) t;
            }
            if (t instanceof Error) {
                throw (Error) t;
            }
            throw new IllegalStateException("Unexpected checked exception", t);
        }
    }

    /**
     * 第 attempt 次尝试前的等待时间（attempt 从 2 开始才有等待）
     */
    public long delayBeforeAttempt(int attempt) {
        if (attempt <= 1) {
            return 0;
        }
        return intervalFunction.apply(attempt - 1);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    @Override
    public String toString() {
        return "RetryPolicy{name=" + name + ", maxAttempts=" + maxAttempts + ", baseDelayMs=" + baseDelayMs
                + ", multiplier=" + multiplier + ", maxDelayMs=" + maxDelayMs + ", jitter=" + jitter + '}';
    }
}
