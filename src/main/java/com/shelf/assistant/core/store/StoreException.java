package com.shelf.assistant.core.store;

public abstract class StoreException extends Exception {

    protected StoreException(String message) {
        super(message);
    }

    protected StoreException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * 调用方是否可以稍后重试
     */
    public abstract boolean isRetryable();
}
