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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.voice.domain.model.InterjectionEvent;
import me.golemcore.voice.infrastructure.config.VoiceProperties;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Default interjection handler: turns an {@link InterjectionEvent} into a short
 * line, flavors it with the current mood and queues it for speech below normal
 * priority.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InterjectionResponder implements InterjectionCallback {

    private static final String MENTION_PREFIX = "heard mention of '";
    private static final String SCREEN_PREFIX = "noticed on screen";
    private static final String QUESTION_PREFIX = "heard a question";

    private final SpeechRequestQueue speechQueue;
    private final MoodState moodState;
    private final VoiceProperties properties;

    @Override
    public void onInterjection(InterjectionEvent event) {
        String line = moodState.flavor(compose(event));
        log.debug("[Ambient] Speaking interjection: {}", line);
        speechQueue.enqueue(line, event.getReason().speechEmotion(),
                properties.getQueue().getInterjectionPriority());
    }

    String compose(InterjectionEvent event) {
        String hint = event.getHint() != null ? event.getHint() : "";
        Optional<String> topic = mentionedTopic(hint);
        return switch (event.getReason()) {
        case HELPFUL_INFO -> {
            if (hint.startsWith(SCREEN_PREFIX)) {
                yield "Looks like you might be stuck. Want a hand?";
            }
            if (hint.startsWith(QUESTION_PREFIX)) {
                yield "I might know the answer to that. Want me to look it up?";
            }
            yield topic.map(t -> "Did I hear something about " + t + "? I can help with that.")
                    .orElse("Want me to help with that?");
        }
        case JOKE -> "Okay, I have a terrible joke ready whenever you want it.";
        case CHECK_IN -> hint.contains("quiet")
                ? "It's been quiet for a while. Everything good?"
                : "Hey, you doing alright? Want to take a break?";
        case COMMENT -> topic.map(t -> "Ooh, " + t + "? Now we're talking.")
                .orElse("That sounds fun.");
        case QUESTION -> "Can I ask you something?";
        case ALERT -> "Heads up, something needs your attention.";
        case VIBE -> "Just hanging out with you. This is nice.";
        };
    }

    private static Optional<String> mentionedTopic(String hint) {
        if (!hint.startsWith(MENTION_PREFIX)) {
            return Optional.empty();
        }
        int end = hint.indexOf('\'', MENTION_PREFIX.length());
        if (end < 0) {
            return Optional.empty();
        }
        return Optional.of(hint.substring(MENTION_PREFIX.length(), end));
    }
}
