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
 * Discrete mood derived from the mood vector.
 */
public enum MoodLabel {

    EXCITED, HAPPY, ANNOYED, FRUSTRATED, TIRED, ENGAGED, BORED, NEUTRAL;

    /**
     * Response generation modifiers for this mood.
     */
    public ResponseModifier responseModifier() {
        return switch (this) {
        case EXCITED -> new ResponseModifier(0.8, "enthusiastic", true);
        case HAPPY -> new ResponseModifier(0.7, "warm", false);
        case ANNOYED -> new ResponseModifier(0.6, "curt", false);
        case FRUSTRATED -> new ResponseModifier(0.5, "blunt", false);
        case TIRED -> new ResponseModifier(0.6, "brief", false);
        case ENGAGED -> new ResponseModifier(0.7, "detailed", false);
        case BORED -> new ResponseModifier(0.6, "minimal", false);
        case NEUTRAL -> new ResponseModifier(0.7, "normal", false);
        };
    }

    public String getTag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
