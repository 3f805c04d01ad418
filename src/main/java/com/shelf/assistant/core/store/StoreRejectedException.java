package com.shelf.assistant.core.store;

/**
 * 后端拒绝请求（4xx 或响应无法解析），对该次调用是致命的
 */
public class StoreRejectedException extends StoreException {
    private final int statusCode;

    public StoreRejectedException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public StoreRejectedException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public int getStatusCode() {
        return statusCode;
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
