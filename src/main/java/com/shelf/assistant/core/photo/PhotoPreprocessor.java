package com.shelf.assistant.core.photo;

import com.shelf.assistant.config.NativeLibraryLoader;
import org.opencv.core.Mat;
import org.opencv.core.MatOfByte;
import org.opencv.core.MatOfInt;
import org.opencv.core.Size;
import org.opencv.imgcodecs.Imgcodecs;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Locale;

/**
 * 照片预处理
 * <p>
 * OpenCV 可用时：解码校验 → 最长边缩放到 maxEdgePixels → 以 JPEG 重新编码，减少视觉模型上传带宽。
 * OpenCV 不可用时原样返回文件字节。
 */
public class PhotoPreprocessor {
    private static final Logger logger = LoggerFactory.getLogger(PhotoPreprocessor.class);

    private final int maxEdgePixels;
    private final int jpegQuality;
    private final boolean useOpenCv;

    public PhotoPreprocessor(int maxEdgePixels, int jpegQuality, boolean useOpenCv) {
        this.maxEdgePixels = maxEdgePixels;
        this.jpegQuality = Math.max(1, Math.min(100, jpegQuality));
        this.useOpenCv = useOpenCv;
    }

    public static PhotoPreprocessor withOpenCvIfLoaded(int maxEdgePixels, int jpegQuality) {
        return new PhotoPreprocessor(maxEdgePixels, jpegQuality, NativeLibraryLoader.isOpenCvLoaded());
    }

    public PreparedPhoto prepare(Path path) throws IOException {
        byte[] raw;
        try {
            raw = Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            throw new UnreadablePhotoException("Photo no longer exists: " + path.getFileName(), e);
        }
        if (raw.length == 0) {
            throw new UnreadablePhotoException("Photo is empty: " + path.getFileName());
        }
        if (!useOpenCv) {
            return new PreparedPhoto(raw, mimeTypeOf(path));
        }
        return reencode(raw, path);
    }

    private PreparedPhoto reencode(byte[] raw, Path path) throws UnreadablePhotoException {
        MatOfByte input = new MatOfByte(raw);
        Mat image = Imgcodecs.imdecode(input, Imgcodecs.IMREAD_COLOR);
        Mat resized = null;
        MatOfByte output = new MatOfByte();
        try {
            if (image.empty()) {
                throw new UnreadablePhotoException("Photo could not be decoded: " + path.getFileName());
            }

            Mat toEncode = image;
            int longest = Math.max(image.cols(), image.rows());
            if (maxEdgePixels > 0 && longest > maxEdgePixels) {
                double scale = (double) maxEdgePixels / longest;
                resized = new Mat();
                Imgproc.resize(image, resized,
                        new Size(Math.round(image.cols() * scale), Math.round(image.rows() * scale)),
                        0, 0, Imgproc.INTER_AREA);
                toEncode = resized;
                logger.debug("Resized {} from {}x{} to {}x{}", path.getFileName(),
                        image.cols(), image.rows(), resized.cols(), resized.rows());
            }

            MatOfInt params = new MatOfInt(Imgcodecs.IMWRITE_JPEG_QUALITY, jpegQuality);
            Imgcodecs.imencode(".jpg", toEncode, output, params);
            params.release();
            return new PreparedPhoto(output.toArray(), "image/jpeg");
        } finally {
            input.release();
            image.release();
            if (resized != null) {
                resized.release();
            }
            output.release();
        }
    }

    static String mimeTypeOf(Path path) {
        return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".png") ? "image/png" : "image/jpeg";
    }

    /**
     * 预处理后的照片
     */
    public static final class PreparedPhoto {
        private final byte[] data;
        private final String mimeType;

        public PreparedPhoto(byte[] data, String mimeType) {
            this.data = data;
            this.mimeType = mimeType;
        }

        public byte[] getData() { return data; }
        public String getMimeType() { return mimeType; }
    }
}
