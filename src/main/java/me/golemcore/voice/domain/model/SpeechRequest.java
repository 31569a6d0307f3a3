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

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Comparator;

/**
 * One utterance waiting in the speech queue.
 *
 * <p>
 * Requests are ordered by {@code priority} (1 is highest, 10 lowest) and then by
 * {@code sequence}, a per-queue submission counter. {@code enqueuedAt} is kept
 * for diagnostics only because two requests may share the same instant.
 */
@Value
@Builder
public class SpeechRequest {

    public static final int HIGHEST_PRIORITY = 1;
    public static final int LOWEST_PRIORITY = 10;

    public static final Comparator<SpeechRequest> QUEUE_ORDER = Comparator
            .comparingInt(SpeechRequest::getPriority)
            .thenComparingLong(SpeechRequest::getSequence);

    String text;

    @Builder.Default
    SpeechEmotion emotion = SpeechEmotion.NEUTRAL;

    int priority;

    Instant enqueuedAt;

    long sequence;

    @Builder.Default
    boolean skipPresenceCheck = false;

    public static int clampPriority(int priority) {
        return Math.max(HIGHEST_PRIORITY, Math.min(LOWEST_PRIORITY, priority));
    }
}
