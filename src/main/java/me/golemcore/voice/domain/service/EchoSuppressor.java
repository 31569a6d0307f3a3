package me.golemcore.voice.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.voice.domain.model.EchoStatus;
import me.golemcore.voice.infrastructure.config.VoiceProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Rejects microphone transcripts that are the assistant's own voice.
 *
 * <p>
 * Two signals are combined:
 * <ul>
 * <li><b>Time window</b> - while the assistant is speaking, plus a grace
 * period, nothing is accepted</li>
 * <li><b>Text match</b> - transcripts equal to, contained in or containing
 * recently spoken text or a blacklisted phrase are rejected</li>
 * </ul>
 *
 * <p>
 * The window is armed by the speech queue worker before playback starts and
 * normally left to expire on its own. In adaptive mode the speaking duration is
 * estimated from the word count when the caller does not know it, and confirmed
 * echoes can be learned into the blacklist.
 *
 * <p>
 * Shared by the queue worker and the STT pipeline; all state is guarded by an
 * internal lock.
 */
@Service
@Slf4j
public class EchoSuppressor {

    private final Clock clock;
    private final VoiceProperties.EchoProperties config;
    private final ReentrantLock lock = new ReentrantLock();

    private final Deque<String> spokenHistory = new ArrayDeque<>();
    private final List<String> blacklistPhrases = new ArrayList<>();
    private final List<String> confirmedEchoes = new ArrayList<>();

    private Instant expiresAt = Instant.EPOCH;
    private String lastSpokenText;

    public EchoSuppressor(Clock clock, VoiceProperties properties) {
        this.clock = clock;
        this.config = properties.getEcho();
        for (String phrase : config.getBlacklistPhrases()) {
            addBlacklistPhrase(phrase);
        }
    }

    /**
     * Arm the echo window.
     *
     * @param duration
     *            expected speech duration, null to estimate it (adaptive mode)
     *            or use the default filter duration
     * @param text
     *            text being spoken, may be null
     */
    public void startSpeaking(Duration duration, String text) {
        Duration effective = resolveDuration(duration, text);
        lock.lock();
        try {
            expiresAt = clock.instant().plus(effective).plus(config.getGracePeriod());
            if (text != null && !text.isBlank()) {
                lastSpokenText = normalize(text);
                spokenHistory.addLast(lastSpokenText);
                while (spokenHistory.size() > config.getHistorySize()) {
                    spokenHistory.removeFirst();
                }
            }
        } finally {
            lock.unlock();
        }
        log.debug("[Echo] Window armed for {}ms", effective.plus(config.getGracePeriod()).toMillis());
    }

    /**
     * Clear the time window immediately. Text history is kept.
     */
    public void stopSpeaking() {
        lock.lock();
        try {
            expiresAt = clock.instant();
        } finally {
            lock.unlock();
        }
    }

    public boolean isSpeaking() {
        lock.lock();
        try {
            return clock.instant().isBefore(expiresAt);
        } finally {
            lock.unlock();
        }
    }

    public Duration timeUntilClear() {
        lock.lock();
        try {
            Duration remaining = Duration.between(clock.instant(), expiresAt);
            return remaining.isNegative() ? Duration.ZERO : remaining;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Whether a recognized transcript should be treated as genuine user input.
     *
     * @param text
     *            recognized text
     * @param confidence
     *            recognition confidence between 0.0 and 1.0
     * @return false for likely echoes and low-confidence recognitions
     */
    public boolean shouldProcess(String text, double confidence) {
        lock.lock();
        try {
            if (clock.instant().isBefore(expiresAt)) {
                log.debug("[Echo] Rejected while speaking: {}", text);
                return false;
            }
            if (confidence < config.getMinConfidence()) {
                log.debug("[Echo] Rejected low confidence {}: {}", confidence, text);
                return false;
            }
            if (isEchoText(text)) {
                log.debug("[Echo] Rejected echo text: {}", text);
                return false;
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Learn a confirmed echo. It is rejected from then on, regardless of the time
     * window.
     */
    public void markAsEcho(String text) {
        if (!config.isLearnEchoes() || text == null || text.isBlank()) {
            return;
        }
        String normalized = normalize(text);
        lock.lock();
        try {
            if (!confirmedEchoes.contains(normalized)) {
                confirmedEchoes.add(normalized);
                addBlacklistPhraseLocked(normalized);
                log.info("[Echo] Learned echo phrase: {}", normalized);
            }
        } finally {
            lock.unlock();
        }
    }

    public void addBlacklistPhrase(String phrase) {
        if (phrase == null || phrase.isBlank()) {
            return;
        }
        lock.lock();
        try {
            addBlacklistPhraseLocked(normalize(phrase));
        } finally {
            lock.unlock();
        }
    }

    public void clearHistory() {
        lock.lock();
        try {
            spokenHistory.clear();
            lastSpokenText = null;
        } finally {
            lock.unlock();
        }
    }

    public EchoStatus getStatus() {
        lock.lock();
        try {
            Instant now = clock.instant();
            Duration remaining = Duration.between(now, expiresAt);
            return EchoStatus.builder()
                    .speaking(now.isBefore(expiresAt))
                    .timeRemaining(remaining.isNegative() ? Duration.ZERO : remaining)
                    .lastSpoken(lastSpokenText)
                    .historyCount(spokenHistory.size())
                    .blacklistCount(blacklistPhrases.size())
                    .build();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Speaking duration used when the caller does not supply one.
     */
    Duration estimateDuration(String text) {
        int words = text.trim().split("\\s+").length;
        long estimatedMillis = Math.round(words * config.getSecondsPerWord() * 1000);
        Duration estimated = Duration.ofMillis(estimatedMillis);
        if (estimated.compareTo(config.getMinEstimate()) < 0) {
            estimated = config.getMinEstimate();
        }
        if (estimated.compareTo(config.getMaxEstimate()) > 0) {
            estimated = config.getMaxEstimate();
        }
        return estimated;
    }

    private Duration resolveDuration(Duration duration, String text) {
        if (duration != null && !duration.isNegative() && !duration.isZero()) {
            return duration;
        }
        if (config.isAdaptive() && text != null && !text.isBlank()) {
            return estimateDuration(text);
        }
        return config.getFilterDuration();
    }

    private boolean isEchoText(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        String candidate = normalize(text);

        if (overlaps(candidate, lastSpokenText)) {
            return true;
        }
        for (String spoken : spokenHistory) {
            if (overlaps(candidate, spoken)) {
                return true;
            }
        }
        for (String phrase : blacklistPhrases) {
            if (overlaps(candidate, phrase)) {
                return true;
            }
        }
        return false;
    }

    private void addBlacklistPhraseLocked(String normalized) {
        if (!blacklistPhrases.contains(normalized)) {
            blacklistPhrases.add(normalized);
        }
    }

    /**
     * Equal, contained in, or containing the reference text.
     */
    private static boolean overlaps(String candidate, String reference) {
        return reference != null && (reference.contains(candidate) || candidate.contains(reference));
    }

    private static String normalize(String text) {
        return text.toLowerCase(Locale.ROOT).trim();
    }
}
