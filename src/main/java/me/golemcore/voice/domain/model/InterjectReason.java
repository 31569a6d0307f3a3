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

/**
 * Why the assistant decided to speak unprompted.
 */
public enum InterjectReason {

    /** Can add useful info to the conversation. */
    HELPFUL_INFO,
    /** Good moment for humor. */
    JOKE,
    /** Checking whether the user needs anything. */
    CHECK_IN,
    /** Natural comment on what is happening. */
    COMMENT,
    /** Curious about something. */
    QUESTION,
    /** Something important noticed. */
    ALERT,
    /** Just being present. */
    VIBE;

    public String getTag() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Emotion the spoken interjection should carry.
     */
    public SpeechEmotion speechEmotion() {
        return switch (this) {
        case HELPFUL_INFO, QUESTION -> SpeechEmotion.QUESTIONING;
        case JOKE -> SpeechEmotion.PLAYFUL;
        case CHECK_IN -> SpeechEmotion.CARING;
        case COMMENT, VIBE -> SpeechEmotion.WARM;
        case ALERT -> SpeechEmotion.URGENT;
        };
    }
}
