package com.shelf.assistant.core.vision;

/**
 * 视觉服务暂不可用（超时、网络错误、限流、5xx）
 * <p>
 * transientFailure 为 false 时（如凭证无效）重试没有意义。
 */
public class VisionUnavailableException extends VisionException {
    private final boolean transientFailure;

    public VisionUnavailableException(String message, boolean transientFailure) {
        super(message);
        this.transientFailure = transientFailure;
    }

    public VisionUnavailableException(String message, Throwable cause) {
        super(message, cause);
        this.transientFailure = true;
    }

    public boolean isTransientFailure() {
        return transientFailure;
    }
}
