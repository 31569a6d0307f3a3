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

import java.util.Locale;
import java.util.Optional;

/**
 * Events that shift the assistant's mood. Each event carries fixed
 * per-component deltas that are scaled by the event intensity.
 */
public enum MoodEvent {

    TASK_COMPLETED,
    ERROR,
    GREETING,
    FRUSTRATION,
    COMPLIMENT,
    INSULT,
    BUSY,
    IDLE,
    HELP_GIVEN,
    REPETITIVE;

    /**
     * Per-component change at intensity 1.0.
     */
    public MoodDelta delta() {
        return switch (this) {
        case TASK_COMPLETED -> new MoodDelta(0.3, 0.1, 0.0, 0.2);
        case ERROR -> new MoodDelta(-0.2, 0.0, -0.1, 0.0);
        case GREETING -> new MoodDelta(0.2, 0.0, 0.0, 0.3);
        case FRUSTRATION -> new MoodDelta(-0.1, 0.0, -0.3, 0.0);
        case COMPLIMENT -> new MoodDelta(0.4, 0.0, 0.0, 0.2);
        case INSULT -> new MoodDelta(-0.3, 0.0, -0.2, 0.0);
        case BUSY -> new MoodDelta(0.0, -0.2, -0.1, 0.0);
        case IDLE -> new MoodDelta(0.0, -0.1, 0.1, 0.0);
        case HELP_GIVEN -> new MoodDelta(0.2, 0.0, 0.0, 0.1);
        case REPETITIVE -> new MoodDelta(0.0, 0.0, -0.2, -0.1);
        };
    }

    /**
     * Tone of the short spoken reaction to this event.
     */
    public ReactionTone reactionTone() {
        return switch (this) {
        case TASK_COMPLETED -> ReactionTone.EXCITED;
        case ERROR, REPETITIVE, INSULT -> ReactionTone.ANNOYED;
        case GREETING, HELP_GIVEN -> ReactionTone.CARING;
        case COMPLIMENT -> ReactionTone.SARCASTIC;
        case FRUSTRATION -> ReactionTone.FRUSTRATED;
        case BUSY, IDLE -> ReactionTone.NEUTRAL;
        };
    }

    public String getTag() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses tags such as {@code task_completed} or {@code TASK_COMPLETED}.
     */
    public static Optional<MoodEvent> fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            return Optional.empty();
        }
        String normalized = tag.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (MoodEvent event : values()) {
            if (event.name().equals(normalized)) {
                return Optional.of(event);
            }
        }
        return Optional.empty();
    }

    /**
     * Mood component deltas.
     */
    public record MoodDelta(double happiness, double energy, double patience, double engagement) {
    }

    public enum ReactionTone {
        EXCITED, ANNOYED, CARING, SARCASTIC, FRUSTRATED, NEUTRAL
    }
}
