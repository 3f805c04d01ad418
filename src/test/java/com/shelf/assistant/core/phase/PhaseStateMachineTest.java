package com.shelf.assistant.core.phase;

import com.shelf.assistant.config.YamlConfig;
import com.shelf.assistant.core.audio.JournalingAudioFeedbackEmitter;
import com.shelf.assistant.core.audio.LoggingAudioFeedbackEmitter;
import com.shelf.assistant.core.audio.SpokenPhrase;
import com.shelf.assistant.core.catalog.ProductCatalog;
import com.shelf.assistant.core.catalog.ProductRecord;
import com.shelf.assistant.core.guidance.DistanceHint;
import com.shelf.assistant.core.guidance.GuidanceTranslator;
import com.shelf.assistant.core.guidance.Offset;
import com.shelf.assistant.core.photo.CaptureFlag;
import com.shelf.assistant.core.photo.PhotoEvent;
import com.shelf.assistant.core.photo.PhotoPreprocessor;
import com.shelf.assistant.core.retry.RetryPolicy;
import com.shelf.assistant.core.store.BackendStoreClient;
import com.shelf.assistant.core.store.StoreRejectedException;
import com.shelf.assistant.core.store.StoreUnavailableException;
import com.shelf.assistant.core.vision.AnalysisMode;
import com.shelf.assistant.core.vision.FramingVerdict;
import com.shelf.assistant.core.vision.GuidanceResult;
import com.shelf.assistant.core.vision.IdentificationResult;
import com.shelf.assistant.core.vision.VisionClient;
import com.shelf.assistant.core.vision.VisionParseException;
import com.shelf.assistant.core.vision.VisionRequest;
import com.shelf.assistant.core.vision.VisionUnavailableException;
import com.shelf.assistant.model.UserChoice;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("PhaseStateMachine Tests")
class PhaseStateMachineTest {

    private static final Instant NOW = Instant.parse("2025-01-15T10:30:00Z");
    private static final UUID CHOICE_ID = UUID.fromString("3f2504e0-4f89-11d3-9a0c-0305e82c3301");

    @TempDir
    Path photoDir;

    @Mock
    private VisionClient visionClient;

    @Mock
    private BackendStoreClient storeClient;

    @Mock
    private CatalogSink catalogSink;

    @Mock
    private ScheduledExecutorService scheduler;

    @Mock
    private ScheduledFuture<?> pollFuture;

    private JournalingAudioFeedbackEmitter audio;
    private YamlConfig.SessionConfig settings;
    private PhaseStateMachine machine;
    private int photoCounter;

    @BeforeEach
    void setUp() {
        audio = new JournalingAudioFeedbackEmitter(new LoggingAudioFeedbackEmitter(), 100);
        settings = new YamlConfig.SessionConfig();
        lenient().doReturn(pollFuture).when(scheduler)
                .scheduleWithFixedDelay(any(Runnable.class), anyLong(), anyLong(), any(TimeUnit.class));
        machine = newMachine();
    }

    private PhaseStateMachine newMachine() {
        return new PhaseStateMachine(visionClient, new PhotoPreprocessor(0, 85, false), storeClient, catalogSink,
                new GuidanceTranslator(), audio, RetryPolicy.noDelay(3), scheduler, settings,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private PhotoEvent photo(CaptureFlag flag) throws IOException {
        photoCounter++;
        String name = String.format("photo_2025-01-15T10-30-%02dZ_%s.jpg", photoCounter, flag.getMarker());
        Path path = Files.write(photoDir.resolve(name), new byte[]{(byte) 0xFF, (byte) 0xD8, (byte) photoCounter});
        return new PhotoEvent(path, flag, NOW.plusSeconds(photoCounter));
    }

    private List<String> spoken() {
        List<String> phrases = new ArrayList<>();
        for (SpokenPhrase phrase : audio.recent(0)) {
            phrases.add(phrase.getText());
        }
        Collections.reverse(phrases);
        return phrases;
    }

    private static FramingVerdict framed(boolean framed, double confidence, String instruction) {
        return new FramingVerdict(framed, confidence, instruction, "{}");
    }

    private static IdentificationResult shelf() {
        return new IdentificationResult(List.of(
                new ProductRecord(1, "Cola", "Coca-Cola", "top shelf left", new BigDecimal("1.99")),
                new ProductRecord(2, "Chips", "Lay's", "middle shelf", null)), "csv");
    }

    private static GuidanceResult guidance(double angle, DistanceHint distance) {
        return new GuidanceResult(new Offset(angle, distance), true, null, "{}");
    }

    private static UserChoice choice(String itemName) {
        return new UserChoice(CHOICE_ID, itemName, null, false);
    }

    private void driveToAwaitingSelection() throws Exception {
        when(visionClient.analyze(any(VisionRequest.class))).thenReturn(framed(true, 0.9, "ok"), shelf());
        machine.onPhoto(photo(CaptureFlag.POSITIONING));
        machine.onPhoto(photo(CaptureFlag.IDENTIFICATION));
        assertThat(machine.getPhase()).isEqualTo(Phase.AWAITING_SELECTION);
    }

    private void driveToGuiding() throws Exception {
        driveToAwaitingSelection();
        when(storeClient.pollLatestChoice()).thenReturn(Optional.of(choice("cola")));
        machine.onPollTick();
        assertThat(machine.getPhase()).isEqualTo(Phase.GUIDING);
    }

    @Nested
    @DisplayName("Full session")
    class FullSessionTests {

        @Test
        @DisplayName("Should walk from positioning to a reached item and start over")
        void shouldCompleteHappyPath() throws Exception {
            settings.setReachedConsecutiveCycles(2);
            machine = newMachine();
            when(visionClient.analyze(any(VisionRequest.class))).thenReturn(
                    framed(true, 0.9, "Shelf visible"),
                    shelf(),
                    guidance(90, DistanceHint.FAR),
                    guidance(5, DistanceHint.NEAR),
                    guidance(355, DistanceHint.NEAR));

            machine.onPhoto(photo(CaptureFlag.POSITIONING));
            assertThat(machine.getPhase()).isEqualTo(Phase.IDENTIFYING);

            machine.onPhoto(photo(CaptureFlag.IDENTIFICATION));
            assertThat(machine.getPhase()).isEqualTo(Phase.AWAITING_SELECTION);
            ArgumentCaptor<ProductCatalog> catalog = ArgumentCaptor.forClass(ProductCatalog.class);
            verify(catalogSink).submit(catalog.capture());
            assertThat(catalog.getValue().getVersion()).isEqualTo(NOW);
            assertThat(catalog.getValue().getProducts()).extracting(ProductRecord::getName)
                    .containsExactly("Cola", "Chips");
            verify(scheduler).scheduleWithFixedDelay(any(Runnable.class), eq(2000L), eq(2000L),
                    eq(TimeUnit.MILLISECONDS));
            assertThat(machine.isPollTimerActive()).isTrue();

            machine.onCatalogPublished(NOW, "c-1");
            assertThat(machine.getSnapshot().isCatalogPublished()).isTrue();

            when(storeClient.pollLatestChoice()).thenReturn(Optional.of(choice("  COLA ")));
            machine.onPollTick();
            assertThat(machine.getPhase()).isEqualTo(Phase.GUIDING);
            assertThat(machine.getSnapshot().getSelectedItem().getName()).isEqualTo("Cola");
            assertThat(machine.isPollTimerActive()).isFalse();
            verify(pollFuture).cancel(false);

            machine.onPhoto(photo(CaptureFlag.POSITIONING));
            assertThat(machine.getSnapshot().getLastGuidanceOffset().getAngleDegrees()).isEqualTo(90.0);
            machine.onPhoto(photo(CaptureFlag.POSITIONING));
            assertThat(machine.getSnapshot().getConsecutiveReachedCycles()).isEqualTo(1);
            machine.onPhoto(photo(CaptureFlag.POSITIONING));

            verify(storeClient).acknowledgeChoice(CHOICE_ID);
            assertThat(machine.getPhase()).isEqualTo(Phase.POSITIONING);
            assertThat(machine.getSnapshot().getActiveCatalog()).isNull();
            assertThat(spoken()).containsExactly(
                    Phrases.READY_FOR_SHELF,
                    "Here's what I found: 1, Cola by Coca-Cola, 1.99; 2, Chips by Lay's. Which item would you like?",
                    "Okay, let's find Cola. It should be top shelf left. Raise your hand and take a photo.",
                    "Move your hand toward 3 o'clock, a bit further.",
                    Phrases.HOLD_STEADY,
                    "Got it! Your hand is on Cola.");
        }

        @Test
        @DisplayName("Should guide to a single Cola and finish on the first reached cycle")
        void shouldCompleteSingleItemSession() throws Exception {
            GuidanceTranslator translator = new GuidanceTranslator();
            when(visionClient.analyze(any(VisionRequest.class))).thenReturn(
                    framed(true, 0.9, null),
                    new IdentificationResult(List.of(
                            new ProductRecord(1, "Cola", "Coca-Cola", "top shelf", new BigDecimal("1.99"))), "csv"),
                    guidance(90, DistanceHint.FAR),
                    guidance(30, DistanceHint.NEAR),
                    guidance(0, DistanceHint.NEAR));

            machine.onPhoto(photo(CaptureFlag.POSITIONING));
            machine.onPhoto(photo(CaptureFlag.IDENTIFICATION));
            machine.onCatalogPublished(NOW, "c-1");
            when(storeClient.pollLatestChoice()).thenReturn(Optional.of(choice("Cola")));
            machine.onPollTick();
            assertThat(machine.getPhase()).isEqualTo(Phase.GUIDING);

            machine.onPhoto(photo(CaptureFlag.POSITIONING));
            machine.onPhoto(photo(CaptureFlag.POSITIONING));
            assertThat(machine.getPhase()).isEqualTo(Phase.GUIDING);
            machine.onPhoto(photo(CaptureFlag.POSITIONING));

            verify(storeClient).acknowledgeChoice(CHOICE_ID);
            assertThat(machine.getPhase()).isEqualTo(Phase.POSITIONING);
            assertThat(spoken()).containsExactly(
                    Phrases.READY_FOR_SHELF,
                    "Here's what I found: 1, Cola by Coca-Cola, 1.99. Which item would you like?",
                    "Okay, let's find Cola. It should be top shelf. Raise your hand and take a photo.",
                    translator.translate(new Offset(90, DistanceHint.FAR)),
                    translator.translate(new Offset(30, DistanceHint.NEAR)),
                    "Got it! Your hand is on Cola.");
        }

        @Test
        @DisplayName("Should ask again when the chosen item is not in the catalog")
        void shouldRejectUnknownChoice() throws Exception {
            driveToAwaitingSelection();
            when(storeClient.pollLatestChoice()).thenReturn(Optional.of(choice("Sprite")));

            machine.onPollTick();

            assertThat(machine.getPhase()).isEqualTo(Phase.AWAITING_SELECTION);
            assertThat(spoken()).last().isEqualTo("Sorry, item not recognized: Sprite. Please repeat your choice.");
            verify(storeClient).acknowledgeChoice(CHOICE_ID);
            assertThat(machine.isPollTimerActive()).isTrue();
        }

        @Test
        @DisplayName("Should go back to positioning when no products are identified")
        void shouldHandleEmptyShelf() throws Exception {
            when(visionClient.analyze(any(VisionRequest.class))).thenReturn(
                    framed(true, 0.95, null), new IdentificationResult(List.of(), "header only"));

            machine.onPhoto(photo(CaptureFlag.POSITIONING));
            machine.onPhoto(photo(CaptureFlag.IDENTIFICATION));

            assertThat(machine.getPhase()).isEqualTo(Phase.POSITIONING);
            assertThat(spoken()).last().isEqualTo(Phrases.NO_PRODUCTS);
            verify(catalogSink, never()).submit(any());
        }
    }

    @Nested
    @DisplayName("Photo routing")
    class PhotoRoutingTests {

        @Test
        @DisplayName("Should ignore photos that do not belong to the current phase")
        void shouldIgnoreOutOfPhasePhotos() throws Exception {
            machine.onPhoto(photo(CaptureFlag.IDENTIFICATION));

            assertThat(machine.getPhase()).isEqualTo(Phase.POSITIONING);
            verify(visionClient, never()).analyze(any());
            assertThat(spoken()).isEmpty();
        }

        @Test
        @DisplayName("Should stay in positioning while framing is uncertain")
        void shouldRequireConfidentFraming() throws Exception {
            when(visionClient.analyze(any(VisionRequest.class))).thenReturn(
                    framed(true, 0.5, "Step back a little"), framed(false, 0.9, null));

            machine.onPhoto(photo(CaptureFlag.POSITIONING));
            machine.onPhoto(photo(CaptureFlag.POSITIONING));

            assertThat(machine.getPhase()).isEqualTo(Phase.POSITIONING);
            assertThat(spoken()).containsExactly("Step back a little", Phrases.ADJUST_CAMERA);
        }

        @Test
        @DisplayName("Should send positioning photos in positioning mode")
        void shouldUseMatchingAnalysisMode() throws Exception {
            when(visionClient.analyze(any(VisionRequest.class))).thenReturn(framed(false, 0.1, null));

            machine.onPhoto(photo(CaptureFlag.POSITIONING));

            ArgumentCaptor<VisionRequest> request = ArgumentCaptor.forClass(VisionRequest.class);
            verify(visionClient).analyze(request.capture());
            assertThat(request.getValue().getMode()).isEqualTo(AnalysisMode.POSITIONING);
        }

        @Test
        @DisplayName("Should ask the user to show the hand when it is not visible")
        void shouldPromptForHiddenHand() throws Exception {
            driveToGuiding();
            when(visionClient.analyze(any(VisionRequest.class)))
                    .thenReturn(new GuidanceResult(null, false, null, "{}"));

            machine.onPhoto(photo(CaptureFlag.POSITIONING));

            assertThat(machine.getPhase()).isEqualTo(Phase.GUIDING);
            assertThat(spoken()).last().isEqualTo(Phrases.HAND_NOT_VISIBLE);
        }

        @Test
        @DisplayName("Should ask for another photo when the file vanished")
        void shouldHandleUnreadablePhoto() throws Exception {
            PhotoEvent event = photo(CaptureFlag.POSITIONING);
            Files.delete(event.getPath());

            machine.onPhoto(event);

            verify(visionClient, never()).analyze(any());
            assertThat(spoken()).containsExactly(Phrases.PHOTO_RETRY);
        }
    }

    @Nested
    @DisplayName("Vision failures")
    class VisionFailureTests {

        @Test
        @DisplayName("Should retry transient failures and then tell the user")
        void shouldRetryTimeouts() throws Exception {
            when(visionClient.analyze(any(VisionRequest.class)))
                    .thenThrow(new VisionUnavailableException("Vision call timed out", true));

            machine.onPhoto(photo(CaptureFlag.POSITIONING));

            verify(visionClient, times(3)).analyze(any());
            assertThat(machine.getPhase()).isEqualTo(Phase.POSITIONING);
            assertThat(spoken()).containsExactly(Phrases.VISION_UNAVAILABLE);
        }

        @Test
        @DisplayName("Should apologise after repeated timeouts while identifying and carry on with the next photo")
        void shouldRecoverFromIdentificationTimeouts() throws Exception {
            VisionUnavailableException timeout = new VisionUnavailableException("Vision call timed out", true);
            when(visionClient.analyze(any(VisionRequest.class)))
                    .thenReturn(framed(true, 0.9, null))
                    .thenThrow(timeout, timeout, timeout)
                    .thenReturn(shelf());

            machine.onPhoto(photo(CaptureFlag.POSITIONING));
            machine.onPhoto(photo(CaptureFlag.IDENTIFICATION));

            verify(visionClient, times(4)).analyze(any());
            assertThat(machine.getPhase()).isEqualTo(Phase.IDENTIFYING);
            assertThat(spoken()).containsExactly(Phrases.READY_FOR_SHELF, Phrases.VISION_UNAVAILABLE);
            verify(catalogSink, never()).submit(any());

            machine.onPhoto(photo(CaptureFlag.IDENTIFICATION));

            verify(visionClient, times(5)).analyze(any());
            assertThat(machine.getPhase()).isEqualTo(Phase.AWAITING_SELECTION);
            verify(catalogSink).submit(any(ProductCatalog.class));
        }

        @Test
        @DisplayName("Should not retry unparsable answers")
        void shouldNotRetryParseFailures() throws Exception {
            when(visionClient.analyze(any(VisionRequest.class)))
                    .thenThrow(new VisionParseException("no JSON"));

            machine.onPhoto(photo(CaptureFlag.POSITIONING));

            verify(visionClient, times(1)).analyze(any());
            assertThat(spoken()).containsExactly(Phrases.PHOTO_RETRY);
        }

        @Test
        @DisplayName("Should reject a result of the wrong kind")
        void shouldRejectMismatchedResult() throws Exception {
            when(visionClient.analyze(any(VisionRequest.class))).thenReturn(shelf());

            machine.onPhoto(photo(CaptureFlag.POSITIONING));

            assertThat(machine.getPhase()).isEqualTo(Phase.POSITIONING);
            assertThat(spoken()).containsExactly(Phrases.PHOTO_RETRY);
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class ConcurrencyTests {

        @Test
        @DisplayName("Should never run two vision calls at once")
        void shouldSerializeVisionCalls() throws Exception {
            AtomicInteger inFlight = new AtomicInteger();
            AtomicInteger maxInFlight = new AtomicInteger();
            when(visionClient.analyze(any(VisionRequest.class))).thenAnswer(invocation -> {
                maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
                Thread.sleep(30);
                inFlight.decrementAndGet();
                return framed(false, 0.2, "Move left");
            });
            List<PhotoEvent> events = new ArrayList<>();
            for (int i = 0; i < 6; i++) {
                events.add(photo(CaptureFlag.POSITIONING));
            }

            List<Thread> threads = new ArrayList<>();
            for (PhotoEvent event : events) {
                Thread t = new Thread(() -> machine.onPhoto(event));
                threads.add(t);
                t.start();
            }
            for (Thread t : threads) {
                t.join(5000);
            }

            verify(visionClient, times(6)).analyze(any());
            assertThat(maxInFlight).hasValue(1);
        }

        @Test
        @DisplayName("Should reset at once while a vision call is in flight and discard its result")
        void shouldResetWithoutWaitingForVision() throws Exception {
            CountDownLatch entered = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            when(visionClient.analyze(any(VisionRequest.class))).thenAnswer(invocation -> {
                entered.countDown();
                release.await(5, TimeUnit.SECONDS);
                return framed(true, 0.99, "Looks good");
            });
            PhotoEvent event = photo(CaptureFlag.POSITIONING);

            Thread analyzing = new Thread(() -> machine.onPhoto(event));
            analyzing.start();
            assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

            long start = System.nanoTime();
            machine.reset("user stop");
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;

            assertThat(elapsedMs).isLessThan(1000);
            assertThat(analyzing.isAlive()).isTrue();
            assertThat(machine.getPhase()).isEqualTo(Phase.POSITIONING);
            assertThat(spoken()).containsExactly(Phrases.SESSION_RESET);

            release.countDown();
            analyzing.join(5000);

            assertThat(machine.getPhase()).isEqualTo(Phase.POSITIONING);
            assertThat(machine.getSnapshot().getGeneration()).isEqualTo(1);
            assertThat(spoken()).containsExactly(Phrases.SESSION_RESET);
        }
    }

    @Nested
    @DisplayName("Backend interaction")
    class BackendTests {

        @Test
        @DisplayName("Should give up the session after repeated backend outages")
        void shouldResetAfterFailureCeiling() throws Exception {
            driveToAwaitingSelection();
            when(storeClient.pollLatestChoice()).thenThrow(new StoreUnavailableException("connection refused"));

            for (int i = 0; i < 4; i++) {
                machine.onPollTick();
            }
            assertThat(machine.getPhase()).isEqualTo(Phase.AWAITING_SELECTION);
            assertThat(machine.getSnapshot().getConsecutiveStoreFailures()).isEqualTo(4);

            machine.onPollTick();

            assertThat(machine.getPhase()).isEqualTo(Phase.POSITIONING);
            assertThat(machine.isPollTimerActive()).isFalse();
            assertThat(spoken()).last().isEqualTo(Phrases.STORE_UNAVAILABLE);
        }

        @Test
        @DisplayName("Should reset the outage count after a successful poll")
        void shouldResetFailureCountOnSuccess() throws Exception {
            driveToAwaitingSelection();
            when(storeClient.pollLatestChoice())
                    .thenThrow(new StoreUnavailableException("down"))
                    .thenThrow(new StoreUnavailableException("down"))
                    .thenReturn(Optional.empty());

            machine.onPollTick();
            machine.onPollTick();
            machine.onPollTick();

            assertThat(machine.getSnapshot().getConsecutiveStoreFailures()).isZero();
        }

        @Test
        @DisplayName("Should not count rejected polls as outages")
        void shouldIgnoreRejectedPolls() throws Exception {
            driveToAwaitingSelection();
            when(storeClient.pollLatestChoice()).thenThrow(new StoreRejectedException("bad payload", 422));

            for (int i = 0; i < 6; i++) {
                machine.onPollTick();
            }

            assertThat(machine.getPhase()).isEqualTo(Phase.AWAITING_SELECTION);
            assertThat(machine.getSnapshot().getConsecutiveStoreFailures()).isZero();
        }

        @Test
        @DisplayName("Should keep failed acknowledgements pending and not act on the same choice twice")
        void shouldRetryPendingAcknowledgements() throws Exception {
            driveToAwaitingSelection();
            when(storeClient.pollLatestChoice())
                    .thenReturn(Optional.of(choice("Sprite")), Optional.of(choice("Sprite")), Optional.empty());
            doThrow(new StoreUnavailableException("down"))
                    .doThrow(new StoreUnavailableException("down"))
                    .doNothing()
                    .when(storeClient).acknowledgeChoice(CHOICE_ID);

            machine.onPollTick();
            assertThat(machine.getPendingAcknowledgements()).containsExactly(CHOICE_ID);

            machine.onPollTick();
            assertThat(machine.getPendingAcknowledgements()).containsExactly(CHOICE_ID);
            assertThat(machine.getSnapshot().getPendingAcknowledgements()).isEqualTo(1);

            machine.onPollTick();
            assertThat(machine.getPendingAcknowledgements()).isEmpty();
            verify(storeClient, times(3)).acknowledgeChoice(CHOICE_ID);
            assertThat(spoken()).filteredOn(p -> p.startsWith("Sorry, item not recognized")).hasSize(1);
        }

        @Test
        @DisplayName("Should drop an acknowledgement the backend rejects")
        void shouldDropRejectedAcknowledgement() throws Exception {
            driveToAwaitingSelection();
            when(storeClient.pollLatestChoice()).thenReturn(Optional.of(choice("Sprite")));
            doThrow(new StoreRejectedException("not found", 404)).when(storeClient).acknowledgeChoice(CHOICE_ID);

            machine.onPollTick();

            assertThat(machine.getPendingAcknowledgements()).isEmpty();
        }

        @Test
        @DisplayName("Should ignore poll ticks outside of awaiting selection")
        void shouldIgnoreStrayTicks() throws Exception {
            machine.onPollTick();

            verify(storeClient, never()).pollLatestChoice();
        }
    }

    @Nested
    @DisplayName("Catalog publication")
    class CatalogPublicationTests {

        @Test
        @DisplayName("Should return to identifying when the backend rejects the catalog")
        void shouldHandleRejectedCatalog() throws Exception {
            driveToAwaitingSelection();

            machine.onCatalogRejected(NOW);

            assertThat(machine.getPhase()).isEqualTo(Phase.IDENTIFYING);
            assertThat(machine.getSnapshot().getActiveCatalog()).isNull();
            assertThat(machine.isPollTimerActive()).isFalse();
            assertThat(spoken()).last().isEqualTo(Phrases.CATALOG_REJECTED);
        }

        @Test
        @DisplayName("Should stay in identifying and tell the user when the catalog cannot be saved")
        void shouldRecoverWhenCatalogCannotBeSaved() throws Exception {
            when(visionClient.analyze(any(VisionRequest.class))).thenReturn(framed(true, 0.9, null), shelf());
            doThrow(new UncheckedIOException(new IOException("disk full"))).when(catalogSink).submit(any());

            machine.onPhoto(photo(CaptureFlag.POSITIONING));
            machine.onPhoto(photo(CaptureFlag.IDENTIFICATION));

            assertThat(machine.getPhase()).isEqualTo(Phase.IDENTIFYING);
            assertThat(machine.getSnapshot().getActiveCatalog()).isNull();
            assertThat(machine.isPollTimerActive()).isFalse();
            assertThat(spoken()).containsExactly(Phrases.READY_FOR_SHELF, Phrases.CATALOG_REJECTED);
        }

        @Test
        @DisplayName("Should ignore outcomes for catalogs that are no longer active")
        void shouldIgnoreStaleCatalogOutcomes() throws Exception {
            driveToAwaitingSelection();
            int before = spoken().size();

            machine.onCatalogRejected(NOW.minusSeconds(60));
            machine.onCatalogPublished(NOW.minusSeconds(60), "old");

            assertThat(machine.getPhase()).isEqualTo(Phase.AWAITING_SELECTION);
            assertThat(machine.getSnapshot().isCatalogPublished()).isFalse();
            assertThat(spoken()).hasSize(before);
        }

        @Test
        @DisplayName("Should mark the catalog published without speaking once guiding has started")
        void shouldNotAnnounceLatePublication() throws Exception {
            driveToGuiding();
            int before = spoken().size();

            machine.onCatalogPublished(NOW, "c-1");

            assertThat(machine.getSnapshot().isCatalogPublished()).isTrue();
            assertThat(spoken()).hasSize(before);
        }
    }

    @Test
    @DisplayName("Should reset from any phase and cancel the poll timer")
    void shouldResetSession() throws Exception {
        driveToAwaitingSelection();

        machine.reset("user stop");

        assertThat(machine.getPhase()).isEqualTo(Phase.POSITIONING);
        assertThat(machine.isPollTimerActive()).isFalse();
        assertThat(machine.getSnapshot().getGeneration()).isEqualTo(1);
        assertThat(spoken()).last().isEqualTo(Phrases.SESSION_RESET);
    }
}
