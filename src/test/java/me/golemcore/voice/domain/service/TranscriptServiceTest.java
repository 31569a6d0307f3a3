package me.golemcore.voice.domain.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TranscriptServiceTest {

    private EchoSuppressor echoSuppressor;
    private TranscriptService service;
    private List<String> received;

    @BeforeEach
    void setUp() {
        echoSuppressor = mock(EchoSuppressor.class);
        service = new TranscriptService(echoSuppressor);
        received = new ArrayList<>();
        service.registerListener(received::add);
    }

    @Test
    void shouldForwardAcceptedTranscripts() {
        when(echoSuppressor.shouldProcess("what's the weather", 0.9)).thenReturn(true);

        assertTrue(service.onTranscript("what's the weather", 0.9));

        assertEquals(List.of("what's the weather"), received);
    }

    @Test
    void shouldNotForwardEchoes() {
        when(echoSuppressor.shouldProcess(anyString(), anyDouble())).thenReturn(false);

        assertFalse(service.onTranscript("my own voice", 0.9));

        assertTrue(received.isEmpty());
    }

    @Test
    void shouldIgnoreBlankTranscripts() {
        assertFalse(service.onTranscript("  ", 1.0));

        verify(echoSuppressor, never()).shouldProcess(anyString(), anyDouble());
    }

    @Test
    void shouldKeepDeliveringWhenListenerFails() {
        when(echoSuppressor.shouldProcess(anyString(), anyDouble())).thenReturn(true);
        Consumer<String> failing = text -> {
            throw new IllegalStateException("listener broke");
        };
        service.registerListener(failing);
        List<String> second = new ArrayList<>();
        service.registerListener(second::add);

        assertTrue(service.onTranscript("hello", 1.0));

        assertEquals(List.of("hello"), second);
    }

    @Test
    void shouldStopDeliveringAfterUnregister() {
        when(echoSuppressor.shouldProcess(anyString(), anyDouble())).thenReturn(true);
        Consumer<String> listener = received::add;
        service.registerListener(listener);
        service.unregisterListener(listener);

        service.onTranscript("hello", 1.0);

        assertEquals(List.of("hello"), received);
        assertEquals(1, service.listenerCount());
    }
}
