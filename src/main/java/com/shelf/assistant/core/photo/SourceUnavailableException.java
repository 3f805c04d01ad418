package com.shelf.assistant.core.photo;

import java.io.IOException;

/**
 * 照片来源（监听目录）不可用，调用方应退避后重试
 */
public class SourceUnavailableException extends IOException {

    public SourceUnavailableException(String message) {
        super(message);
    }

    public SourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
