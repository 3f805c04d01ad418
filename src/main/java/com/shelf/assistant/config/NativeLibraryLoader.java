package com.shelf.assistant.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Native Library Loader
 * 负责加载 OpenCV 的 JNI 库（照片解码、缩放、重新编码）
 * <p>
 * 加载失败时照片按原始字节发送给视觉模型，不影响主流程。
 */
public class NativeLibraryLoader {

    private static final Logger logger = LoggerFactory.getLogger(NativeLibraryLoader.class);

    private static volatile boolean attempted = false;
    private static volatile boolean openCvLoaded = false;

    /**
     * 预加载 OpenCV，必须在任何使用 OpenCV 的代码之前调用
     */
    public static synchronized void loadNativeLibraries() {
        if (attempted) {
            return;
        }
        attempted = true;

        logger.info("Loading OpenCV native library via openpnp...");
        try {
            nu.pattern.OpenCV.loadLocally();
            openCvLoaded = true;
            logger.info("OpenCV {} loaded successfully", org.opencv.core.Core.VERSION);
        } catch (Throwable e) {
            // UnsatisfiedLinkError 等也在这里处理
            logger.warn("Failed to load OpenCV via openpnp, photos will be sent unprocessed: {}", e.getMessage());
        }
    }

    public static boolean isOpenCvLoaded() {
        return openCvLoaded;
    }
}
