package com.shelf.assistant.core.vision;

public abstract class VisionException extends Exception {

    protected VisionException(String message) {
        super(message);
    }

    protected VisionException(String message, Throwable cause) {
        super(message, cause);
    }
}
