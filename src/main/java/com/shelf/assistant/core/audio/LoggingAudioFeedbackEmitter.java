package com.shelf.assistant.core.audio;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 只写日志的语音输出（默认，开发与测试用）
 */
public class LoggingAudioFeedbackEmitter implements AudioFeedbackEmitter {
    private static final Logger logger = LoggerFactory.getLogger(LoggingAudioFeedbackEmitter.class);

    @Override
    public void speak(String phrase) {
        logger.info("[SPEAK] {}", phrase);
    }
}
