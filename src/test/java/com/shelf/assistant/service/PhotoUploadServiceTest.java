package com.shelf.assistant.service;

import com.shelf.assistant.core.photo.CaptureFlag;
import com.shelf.assistant.core.photo.PhotoClassifier;
import com.shelf.assistant.core.photo.PhotoEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PhotoUploadService Tests")
class PhotoUploadServiceTest {

    private static final Instant NOW = Instant.parse("2025-01-15T10:30:00.250Z");

    @TempDir
    Path watchDir;

    private final PhotoClassifier classifier = new PhotoClassifier();
    private PhotoUploadService service;

    @BeforeEach
    void setUp() {
        service = new PhotoUploadService(classifier, watchDir.resolve("inbox"), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Should write the photo under a name the watcher can classify")
    void shouldStoreClassifiablePhoto() throws Exception {
        byte[] data = {(byte) 0xFF, (byte) 0xD8, 42};

        String filename = service.store(data, "HIGH", "IMG_0001.PNG");

        Path stored = watchDir.resolve("inbox").resolve(filename);
        assertThat(stored).exists();
        assertThat(Files.readAllBytes(stored)).isEqualTo(data);
        PhotoEvent event = classifier.classify(stored);
        assertThat(event.getFlag()).isEqualTo(CaptureFlag.IDENTIFICATION);
        assertThat(event.getObservedAt()).isEqualTo(NOW);
        assertThat(filename).endsWith("_high.png");
    }

    @Test
    @DisplayName("Should default to jpg when the original name has no extension")
    void shouldDefaultToJpg() throws Exception {
        assertThat(service.store(new byte[]{1}, "low", null)).endsWith("_low.jpg");
        assertThat(service.store(new byte[]{1}, "low", "camera")).endsWith("_low.jpg");
    }

    @Test
    @DisplayName("Should keep both photos when two uploads land in the same millisecond")
    void shouldNotOverwriteSameInstantUploads() throws Exception {
        String first = service.store(new byte[]{1}, "low", "a.jpg");
        String second = service.store(new byte[]{2}, "low", "b.jpg");
        String third = service.store(new byte[]{3}, "low", "c.jpg");

        assertThat(first).startsWith("upload_");
        assertThat(second).startsWith("upload-2_");
        assertThat(third).startsWith("upload-3_");
        Path inbox = watchDir.resolve("inbox");
        assertThat(Files.readAllBytes(inbox.resolve(first))).containsExactly(1);
        assertThat(Files.readAllBytes(inbox.resolve(second))).containsExactly(2);
        assertThat(Files.readAllBytes(inbox.resolve(third))).containsExactly(3);
        assertThat(classifier.classify(inbox.resolve(second)).getObservedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("Should reject bad flags, empty photos and unsupported types")
    void shouldValidateInput() {
        assertThatThrownBy(() -> service.store(new byte[]{1}, "medium", "a.jpg"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.store(new byte[0], "low", "a.jpg"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.store(new byte[]{1}, "low", "a.gif"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
