package com.shelf.assistant.core.audio;

/**
 * 语音反馈输出
 * <p>
 * speak 不抛出异常：语音失败只记录日志，不影响会话状态。
 */
public interface AudioFeedbackEmitter {

    void speak(String phrase);
}
