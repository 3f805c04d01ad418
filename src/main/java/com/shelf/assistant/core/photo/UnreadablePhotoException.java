package com.shelf.assistant.core.photo;

import java.io.IOException;

/**
 * 照片无法读取或解码（空文件、损坏的 JPEG 等）
 */
public class UnreadablePhotoException extends IOException {

    public UnreadablePhotoException(String message) {
        super(message);
    }

    public UnreadablePhotoException(String message, Throwable cause) {
        super(message, cause);
    }
}
