package com.shelf.assistant.core.vision;

/**
 * 模型输出无法解析。同一张照片重试无济于事，需要用户重新拍摄。
 */
public class VisionParseException extends VisionException {

    public VisionParseException(String message) {
        super(message);
    }

    public VisionParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
