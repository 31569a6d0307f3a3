package me.golemcore.voice.domain.service;

import me.golemcore.voice.infrastructure.config.VoiceProperties;
import me.golemcore.voice.port.outbound.PresencePort;
import me.golemcore.voice.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PresenceGateTest {

    private MutableClock clock;
    private PresencePort presencePort;
    private ObjectProvider<PresencePort> provider;
    private VoiceProperties properties;
    private PresenceGate gate;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));
        presencePort = mock(PresencePort.class);
        provider = mock(ObjectProvider.class);
        when(provider.getIfAvailable()).thenReturn(presencePort);
        properties = new VoiceProperties();
        properties.getPresence().setEnabled(true);
        gate = new PresenceGate(clock, provider, properties);
    }

    @Test
    void shouldAssumePresentWhenDisabled() {
        properties.getPresence().setEnabled(false);
        when(presencePort.isUserPresent()).thenReturn(false);

        assertTrue(gate.isUserPresent());
        verify(presencePort, never()).isUserPresent();
    }

    @Test
    void shouldAssumePresentWithoutDetector() {
        when(provider.getIfAvailable()).thenReturn(null);

        assertTrue(gate.isUserPresent());
    }

    @Test
    void shouldCacheDetectorAnswerForTtl() {
        when(presencePort.isUserPresent()).thenReturn(false);

        assertFalse(gate.isUserPresent());
        clock.advance(Duration.ofSeconds(4));
        assertFalse(gate.isUserPresent());
        verify(presencePort, times(1)).isUserPresent();

        when(presencePort.isUserPresent()).thenReturn(true);
        clock.advance(Duration.ofSeconds(1));
        assertTrue(gate.isUserPresent());
        verify(presencePort, times(2)).isUserPresent();
    }

    @Test
    void shouldAssumePresentWhenDetectorFails() {
        when(presencePort.isUserPresent()).thenThrow(new IllegalStateException("camera busy"));

        assertTrue(gate.isUserPresent());
    }

    @Test
    void shouldQueryAgainAfterInvalidate() {
        when(presencePort.isUserPresent()).thenReturn(true);
        gate.isUserPresent();

        gate.invalidate();
        gate.isUserPresent();

        verify(presencePort, times(2)).isUserPresent();
    }
}
