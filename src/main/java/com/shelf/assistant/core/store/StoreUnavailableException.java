package com.shelf.assistant.core.store;

/**
 * 后端暂不可用（网络错误、超时、5xx），可重试
 */
public class StoreUnavailableException extends StoreException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
