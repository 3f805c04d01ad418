package com.shelf.assistant.service;

import com.shelf.assistant.core.audio.JournalingAudioFeedbackEmitter;
import com.shelf.assistant.core.phase.PhaseStateMachine;
import com.shelf.assistant.core.photo.CaptureFlag;
import com.shelf.assistant.core.photo.PhotoEvent;
import com.shelf.assistant.core.photo.PhotoEventQueue;
import com.shelf.assistant.core.photo.PhotoWatcher;
import com.shelf.assistant.event.CatalogUploadEvent;
import com.shelf.assistant.model.CatalogRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Paths;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("AssistantService Tests")
class AssistantServiceTest {

    private static final Instant VERSION = Instant.parse("2025-01-15T10:30:00Z");

    @Mock
    private PhaseStateMachine stateMachine;

    @Mock
    private PhotoWatcher photoWatcher;

    @Mock
    private JournalingAudioFeedbackEmitter journal;

    private PhotoEventQueue queue;
    private AssistantService service;

    @BeforeEach
    void setUp() {
        queue = new PhotoEventQueue(4);
        service = new AssistantService(stateMachine, photoWatcher, queue, journal);
    }

    private static PhotoEvent event(int second) {
        return new PhotoEvent(Paths.get("photo_" + second + "_low.jpg"), CaptureFlag.POSITIONING,
                VERSION.plusSeconds(second));
    }

    private static CatalogRecord record() {
        CatalogRecord record = new CatalogRecord();
        record.setVersion(VERSION);
        record.setRemoteId("c-42");
        return record;
    }

    @Test
    @DisplayName("Should forward published catalogs to the state machine")
    void shouldForwardPublished() {
        service.onApplicationEvent(new CatalogUploadEvent(this, record(), CatalogUploadEvent.Outcome.PUBLISHED));

        verify(stateMachine).onCatalogPublished(VERSION, "c-42");
        verify(stateMachine, never()).onCatalogRejected(any());
    }

    @Test
    @DisplayName("Should forward rejected catalogs to the state machine")
    void shouldForwardRejected() {
        service.onApplicationEvent(new CatalogUploadEvent(this, record(), CatalogUploadEvent.Outcome.REJECTED));

        verify(stateMachine).onCatalogRejected(VERSION);
    }

    @Test
    @DisplayName("Should drop queued photos when the session is reset")
    void shouldClearQueueOnReset() {
        queue.offer(event(1));
        queue.offer(event(2));

        service.reset("user stop");

        assertThat(service.getQueueDepth()).isZero();
        verify(stateMachine).reset("user stop");
    }

    @Test
    @DisplayName("Should hand queued photos to the state machine until shut down")
    void shouldConsumeQueuedPhotos() {
        service.start();
        try {
            queue.offer(event(1));
            queue.offer(event(2));

            verify(stateMachine, timeout(2000)).onPhoto(event(1));
            verify(stateMachine, timeout(2000)).onPhoto(event(2));
        } finally {
            service.shutdown();
        }
        verify(photoWatcher).stop();
        verify(stateMachine).stop();
    }
}
