package me.golemcore.voice.domain.model;

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

import lombok.Getter;
import lombok.Setter;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Fused audio, camera and screen context of the ambient scheduler.
 *
 * <p>
 * Not thread-safe. The owning scheduler mutates it from its single worker
 * thread only, and clears it whenever it stops or starts.
 */
@Getter
@Setter
public class SensorContext {

    public static final String UNKNOWN = "unknown";
    public static final String NEUTRAL = "neutral";

    private final int transcriptLimit;
    private final Deque<String> recentTranscripts = new ArrayDeque<>();

    private String lastVisualSummary = "";
    private String lastScreenSummary = "";
    private String userActivity = UNKNOWN;
    private String userExpression = NEUTRAL;
    private String speechSentiment = NEUTRAL;
    private boolean userSeemsBusy;
    private boolean userSeemsStressed;
    private Duration silenceDuration = Duration.ZERO;
    private Instant lastInteractionTime;
    private Instant lastInterjectionTime;

    public SensorContext(int transcriptLimit) {
        if (transcriptLimit < 1) {
            throw new IllegalArgumentException("transcriptLimit must be positive");
        }
        this.transcriptLimit = transcriptLimit;
    }

    /**
     * Appends a transcript, evicting the oldest one beyond capacity.
     */
    public void addTranscript(String transcript) {
        recentTranscripts.addLast(transcript);
        while (recentTranscripts.size() > transcriptLimit) {
            recentTranscripts.removeFirst();
        }
    }

    public List<String> getRecentTranscripts() {
        return List.copyOf(recentTranscripts);
    }

    public void addSilence(Duration elapsed) {
        silenceDuration = silenceDuration.plus(elapsed);
    }

    public void resetSilence() {
        silenceDuration = Duration.ZERO;
    }

    /**
     * Forgets everything observed so far.
     */
    public void clear() {
        recentTranscripts.clear();
        lastVisualSummary = "";
        lastScreenSummary = "";
        userActivity = UNKNOWN;
        userExpression = NEUTRAL;
        speechSentiment = NEUTRAL;
        userSeemsBusy = false;
        userSeemsStressed = false;
        silenceDuration = Duration.ZERO;
        lastInteractionTime = null;
        lastInterjectionTime = null;
    }
}
