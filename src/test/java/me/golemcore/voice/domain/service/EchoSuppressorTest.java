package me.golemcore.voice.domain.service;

import me.golemcore.voice.domain.model.EchoStatus;
import me.golemcore.voice.infrastructure.config.VoiceProperties;
import me.golemcore.voice.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EchoSuppressorTest {

    private static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");

    private MutableClock clock;
    private VoiceProperties properties;
    private EchoSuppressor suppressor;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        properties = new VoiceProperties();
        suppressor = new EchoSuppressor(clock, properties);
    }

    @Test
    void shouldRejectEverythingWhileSpeakingAndAcceptAfterGrace() {
        suppressor.startSpeaking(Duration.ofSeconds(2), "the weather is sunny");

        assertFalse(suppressor.shouldProcess("turn on the lights", 0.95));

        clock.advance(Duration.ofMillis(2400));
        assertFalse(suppressor.shouldProcess("turn on the lights", 0.95));

        clock.advance(Duration.ofMillis(100));
        assertTrue(suppressor.shouldProcess("turn on the lights", 0.95));
    }

    @Test
    void shouldRejectOwnTextAfterWindowExpires() {
        suppressor.startSpeaking(Duration.ofSeconds(1), "The weather is sunny");
        clock.advance(Duration.ofSeconds(5));

        assertFalse(suppressor.shouldProcess("the weather is sunny", 0.95));
        assertFalse(suppressor.shouldProcess("weather is sunny", 0.95));
        assertFalse(suppressor.shouldProcess("the weather is sunny today I think", 0.95));
    }

    @Test
    void shouldRejectFragmentsOfOlderUtterances() {
        suppressor.startSpeaking(Duration.ofSeconds(1), "first reminder about the meeting");
        suppressor.startSpeaking(Duration.ofSeconds(1), "second thing entirely");
        clock.advance(Duration.ofSeconds(5));

        assertFalse(suppressor.shouldProcess("reminder about the meeting", 0.95));
    }

    @Test
    void shouldRejectTranscriptWrappingAnOlderUtterance() {
        suppressor.startSpeaking(Duration.ofSeconds(1), "set a timer");
        suppressor.startSpeaking(Duration.ofSeconds(1), "done, ten minutes");
        clock.advance(Duration.ofSeconds(5));

        assertFalse(suppressor.shouldProcess("hey set a timer please", 1.0));
    }

    @Test
    void shouldRejectFragmentOfBlacklistedPhrase() {
        suppressor.addBlacklistPhrase("cora is online and ready");

        assertFalse(suppressor.shouldProcess("cora is online", 1.0));
        assertTrue(suppressor.shouldProcess("turn off the lights", 1.0));
    }

    @Test
    void shouldRejectLowConfidence() {
        assertFalse(suppressor.shouldProcess("hello", 0.5));
        assertTrue(suppressor.shouldProcess("hello", 0.7));
    }

    @Test
    void shouldTreatEmptyTextAsNotEcho() {
        suppressor.startSpeaking(Duration.ofSeconds(1), "anything");
        clock.advance(Duration.ofSeconds(5));

        assertTrue(suppressor.shouldProcess("", 0.9));
    }

    @Test
    void shouldEstimateDurationFromWordCount() {
        assertEquals(Duration.ofSeconds(4), suppressor.estimateDuration("one two three four five six seven eight nine ten"));
        assertEquals(Duration.ofSeconds(1), suppressor.estimateDuration("hi"));
        assertEquals(Duration.ofSeconds(15), suppressor.estimateDuration("word ".repeat(60)));
    }

    @Test
    void shouldUseAdaptiveEstimateWhenDurationMissing() {
        suppressor.startSpeaking(null, "one two three four five six seven eight nine ten");

        assertEquals(Duration.ofMillis(4500), suppressor.timeUntilClear());
    }

    @Test
    void shouldUseDefaultFilterDurationWhenNotAdaptive() {
        properties.getEcho().setAdaptive(false);
        suppressor.startSpeaking(null, "one two three four five six seven eight nine ten");

        assertEquals(Duration.ofMillis(3500), suppressor.timeUntilClear());
    }

    @Test
    void shouldClearWindowOnStopSpeaking() {
        suppressor.startSpeaking(Duration.ofSeconds(10), "long answer");
        assertTrue(suppressor.isSpeaking());

        suppressor.stopSpeaking();

        assertFalse(suppressor.isSpeaking());
        assertEquals(Duration.ZERO, suppressor.timeUntilClear());
        assertTrue(suppressor.shouldProcess("what time is it", 0.9));
    }

    @Test
    void shouldLearnConfirmedEchoes() {
        suppressor.markAsEcho("Beep Boop");

        assertFalse(suppressor.shouldProcess("oh beep boop again", 0.9));
        assertEquals(1, suppressor.getStatus().getBlacklistCount());
    }

    @Test
    void shouldIgnoreMarkAsEchoWhenLearningDisabled() {
        properties.getEcho().setLearnEchoes(false);

        suppressor.markAsEcho("beep boop");

        assertTrue(suppressor.shouldProcess("beep boop", 0.9));
    }

    @Test
    void shouldDeduplicateBlacklistCaseInsensitively() {
        suppressor.addBlacklistPhrase("Okay Cora");
        suppressor.addBlacklistPhrase("okay cora ");

        assertEquals(1, suppressor.getStatus().getBlacklistCount());
        assertFalse(suppressor.shouldProcess("hey okay cora do it", 0.9));
    }

    @Test
    void shouldLoadBlacklistFromConfiguration() {
        properties.getEcho().setBlacklistPhrases(List.of("as an assistant"));
        EchoSuppressor configured = new EchoSuppressor(clock, properties);

        assertFalse(configured.shouldProcess("well as an assistant I", 0.9));
    }

    @Test
    void shouldForgetSpokenTextOnClearHistory() {
        suppressor.startSpeaking(Duration.ofSeconds(1), "tell me a joke");
        clock.advance(Duration.ofSeconds(5));
        suppressor.clearHistory();

        assertTrue(suppressor.shouldProcess("tell me a joke", 0.9));
    }

    @Test
    void shouldBoundHistory() {
        properties.getEcho().setHistorySize(2);
        suppressor.startSpeaking(Duration.ofSeconds(1), "alpha");
        suppressor.startSpeaking(Duration.ofSeconds(1), "bravo");
        suppressor.startSpeaking(Duration.ofSeconds(1), "charlie");
        clock.advance(Duration.ofSeconds(5));

        EchoStatus status = suppressor.getStatus();
        assertEquals(2, status.getHistoryCount());
        assertEquals("charlie", status.getLastSpoken());
        assertTrue(suppressor.shouldProcess("alpha", 0.9));
        assertFalse(suppressor.shouldProcess("bravo", 0.9));
    }
}
