package me.golemcore.voice.adapter.inbound.web.controller;

import me.golemcore.voice.adapter.inbound.web.dto.EchoPhraseRequest;
import me.golemcore.voice.adapter.inbound.web.dto.TranscriptRequest;
import me.golemcore.voice.domain.model.EchoStatus;
import me.golemcore.voice.domain.service.EchoSuppressor;
import me.golemcore.voice.domain.service.TranscriptService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class TranscriptControllerTest {

    private TranscriptService transcriptService;
    private EchoSuppressor echoSuppressor;
    private TranscriptController controller;

    @BeforeEach
    void setUp() {
        transcriptService = mock(TranscriptService.class);
        echoSuppressor = mock(EchoSuppressor.class);
        when(echoSuppressor.getStatus()).thenReturn(EchoStatus.builder()
                .speaking(false)
                .timeRemaining(Duration.ZERO)
                .blacklistCount(1)
                .build());
        controller = new TranscriptController(transcriptService, echoSuppressor);
    }

    @Test
    void shouldIngestWithFullConfidenceByDefault() {
        when(transcriptService.onTranscript("what time is it", 1.0)).thenReturn(true);

        StepVerifier.create(controller.ingest(TranscriptRequest.builder().text("what time is it").build()))
                .assertNext(response -> assertTrue(response.getBody().isAccepted()))
                .verifyComplete();
    }

    @Test
    void shouldReportRejectedTranscript() {
        when(transcriptService.onTranscript("hello", 0.4)).thenReturn(false);

        StepVerifier.create(controller.ingest(TranscriptRequest.builder().text("hello").confidence(0.4).build()))
                .assertNext(response -> assertFalse(response.getBody().isAccepted()))
                .verifyComplete();
    }

    @Test
    void shouldRejectConfidenceOutOfRange() {
        TranscriptRequest request = TranscriptRequest.builder().text("hello").confidence(1.5).build();

        assertThrows(IllegalArgumentException.class, () -> controller.ingest(request));
        verifyNoInteractions(transcriptService);
    }

    @Test
    void shouldRequireText() {
        assertThrows(IllegalArgumentException.class, () -> controller.ingest(new TranscriptRequest()));
    }

    @Test
    void shouldLearnEchoPhrase() {
        StepVerifier.create(controller.markEcho(EchoPhraseRequest.builder().text("okay so").build()))
                .assertNext(response -> assertEquals(1, response.getBody().getBlacklistCount()))
                .verifyComplete();

        verify(echoSuppressor).markAsEcho("okay so");
    }

    @Test
    void shouldReturnEchoStatus() {
        StepVerifier.create(controller.getEchoStatus())
                .assertNext(response -> assertFalse(response.getBody().isSpeaking()))
                .verifyComplete();
    }
}
