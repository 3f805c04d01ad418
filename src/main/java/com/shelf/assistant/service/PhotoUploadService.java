package com.shelf.assistant.service;

import com.shelf.assistant.config.YamlConfig;
import com.shelf.assistant.core.photo.CaptureFlag;
import com.shelf.assistant.core.photo.PhotoClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;

/**
 * 接收手机端上传的照片，按命名约定写入监听目录，由照片监听线程处理
 */
@Service
public class PhotoUploadService {
    private static final Logger logger = LoggerFactory.getLogger(PhotoUploadService.class);

    private static final String UPLOAD_PREFIX = "upload";

    private final PhotoClassifier classifier;
    private final Path watchDir;
    private final Clock clock;

    @Autowired
    public PhotoUploadService(PhotoClassifier classifier, YamlConfig config, Clock clock) {
        this(classifier, Paths.get(config.getPhotos().getWatchDir()), clock);
    }

    PhotoUploadService(PhotoClassifier classifier, Path watchDir, Clock clock) {
        this.classifier = classifier;
        this.watchDir = watchDir;
        this.clock = clock;
    }

    /**
     * 保存照片
     * @param data 图像内容
     * @param flag low / high
     * @param originalFilename 原始文件名，用于确定扩展名
     * @return 写入监听目录的文件名
     */
    public synchronized String store(byte[] data, String flag, String originalFilename) throws IOException {
        CaptureFlag captureFlag = CaptureFlag.fromMarker(flag == null ? "" : flag.trim());
        if (captureFlag == null) {
            throw new IllegalArgumentException("flag must be 'low' or 'high'");
        }
        if (data == null || data.length == 0) {
            throw new IllegalArgumentException("Photo is empty");
        }
        String extension = extensionOf(originalFilename);
        Instant capturedAt = clock.instant();

        Files.createDirectories(watchDir);
        // 同一毫秒内的多次上传用 upload-2、upload-3 区分，不覆盖已有文件
        String filename = classifier.buildFilename(UPLOAD_PREFIX, capturedAt, captureFlag, extension);
        for (int sequence = 2; Files.exists(watchDir.resolve(filename)); sequence++) {
            filename = classifier.buildFilename(UPLOAD_PREFIX + "-" + sequence, capturedAt, captureFlag, extension);
        }

        Path temp = Files.createTempFile("shelf-upload-", "." + extension);
        Files.write(temp, data);
        Path target = watchDir.resolve(filename);
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target);
        }
        logger.info("Stored uploaded {} photo as {} ({} bytes)", captureFlag, filename, data.length);
        return filename;
    }

    private static String extensionOf(String originalFilename) {
        if (originalFilename == null) {
            return "jpg";
        }
        int dot = originalFilename.lastIndexOf('.');
        if (dot < 0) {
            return "jpg";
        }
        String extension = originalFilename.substring(dot + 1).toLowerCase(Locale.ROOT);
        if (!PhotoClassifier.SUPPORTED_EXTENSIONS.contains(extension)) {
            throw new IllegalArgumentException("Unsupported photo type: " + extension);
        }
        return extension;
    }
}
