package com.shelf.assistant.core.photo;

import java.nio.file.Path;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 照片文件名分类器
 * <p>
 * 命名约定: prefix_&lt;ISO8601 时间戳，':' 替换为 '-'&gt;_&lt;low|high&gt;.&lt;jpg|jpeg|png&gt;
 * <pre>
 *   photo_2025-01-18T14-30-00Z_low.jpg   -> POSITIONING
 *   photo_2025-01-18T14-30-05Z_high.jpg  -> IDENTIFICATION
 * </pre>
 * 纯函数，无副作用。
 */
public class PhotoClassifier {

    public static final Set<String> SUPPORTED_EXTENSIONS = Set.of("jpg", "jpeg", "png");

    private static final Pattern TIMESTAMP = Pattern.compile(
            "(\\d{4}-\\d{2}-\\d{2})T(\\d{2})-(\\d{2})-(\\d{2})(\\.\\d{1,9})?(Z|[+-]\\d{2}(?:-?\\d{2})?)?",
            Pattern.CASE_INSENSITIVE);

    public PhotoEvent classify(Path path) throws PhotoClassificationException {
        String filename = path.getFileName().toString();

        int dot = filename.lastIndexOf('.');
        if (dot <= 0 || dot == filename.length() - 1) {
            throw new PhotoClassificationException(filename, "Missing file extension");
        }
        String extension = filename.substring(dot + 1).toLowerCase(Locale.ROOT);
        if (!SUPPORTED_EXTENSIONS.contains(extension)) {
            throw new PhotoClassificationException(filename, "Unsupported extension '" + extension + "'");
        }

        String[] segments = filename.substring(0, dot).split("_");
        int markerCount = 0;
        for (String segment : segments) {
            if (CaptureFlag.fromMarker(segment) != null) {
                markerCount++;
            }
        }
        if (markerCount == 0) {
            throw new PhotoClassificationException(filename, "No capture flag (low/high) in filename");
        }
        if (markerCount > 1) {
            throw new PhotoClassificationException(filename, "Conflicting capture flags in filename");
        }
        if (segments.length < 3) {
            throw new PhotoClassificationException(filename, "Expected prefix_timestamp_flag");
        }

        CaptureFlag flag = CaptureFlag.fromMarker(segments[segments.length - 1]);
        if (flag == null) {
            throw new PhotoClassificationException(filename, "Capture flag must be the last segment");
        }

        Instant observedAt = parseTimestamp(segments[segments.length - 2], filename);
        return new PhotoEvent(path, flag, observedAt);
    }

    /**
     * 按命名约定生成文件名（上传接口使用）
     */
    public String buildFilename(String prefix, Instant timestamp, CaptureFlag flag, String extension) {
        String safePrefix = prefix == null || prefix.isBlank() ? "photo" : prefix.replace('_', '-');
        String stamp = timestamp.truncatedTo(ChronoUnit.MILLIS).toString().replace(':', '-');
        return safePrefix + "_" + stamp + "_" + flag.getMarker() + "." + extension.toLowerCase(Locale.ROOT);
    }

    private Instant parseTimestamp(String raw, String filename) throws PhotoClassificationException {
        Matcher m = TIMESTAMP.matcher(raw);
        if (!m.matches()) {
            throw new PhotoClassificationException(filename, "Unparsable timestamp '" + raw + "'");
        }
        StringBuilder iso = new StringBuilder()
                .append(m.group(1)).append('T')
                .append(m.group(2)).append(':')
                .append(m.group(3)).append(':')
                .append(m.group(4));
        if (m.group(5) != null) {
            iso.append(m.group(5));
        }
        iso.append(zone(m.group(6)));
        try {
            return OffsetDateTime.parse(iso).toInstant();
        } catch (DateTimeParseException e) {
            throw new PhotoClassificationException(filename, "Invalid timestamp '" + raw + "'");
        }
    }

    // 没有时区时按 UTC
    private static String zone(String raw) {
        if (raw == null || raw.equalsIgnoreCase("Z")) {
            return "Z";
        }
        String sign = raw.substring(0, 1);
        String digits = raw.substring(1).replace("-", "");
        if (digits.length() == 2) {
            return sign + digits + ":00";
        }
        return sign + digits.substring(0, 2) + ":" + digits.substring(2);
    }
}
