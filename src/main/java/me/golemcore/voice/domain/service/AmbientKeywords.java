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

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Keyword vocabularies used to read transcripts and vision descriptions.
 * Matching is plain substring search on lower-cased text.
 */
final class AmbientKeywords {

    static final List<String> HELPFUL_TOPICS = List.of(
            "weather", "time", "reminder", "schedule", "meeting", "email", "message", "call",
            "todo", "task", "deadline", "code", "error", "bug", "fix", "help", "how to",
            "what is", "recipe", "directions", "address", "phone number");

    static final List<String> FUN_TOPICS = List.of(
            "music", "movie", "game", "food", "drink", "party", "weekend", "vacation",
            "funny", "crazy", "awesome", "weed", "smoke", "blunt", "high", "chill", "relax");

    static final List<String> STRESS_INDICATORS = List.of(
            "frustrated", "angry", "stressed", "tired", "exhausted", "hate", "stupid",
            "broken", "not working", "fuck", "shit", "damn", "ugh", "why", "come on");

    static final List<String> POSITIVE_WORDS = List.of("happy", "great", "awesome", "nice", "good", "love");

    static final List<String> QUESTION_STARTS = List.of("what", "how", "why", "where", "when", "who", "can");

    static final List<String> ACTIVITY_WORKING = List.of("typing", "keyboard", "working", "computer");
    static final List<String> ACTIVITY_TALKING = List.of("phone", "talking", "speaking");
    static final List<String> ACTIVITY_RELAXING = List.of("relaxing", "sitting", "couch", "leaning back");
    static final List<String> ACTIVITY_CHILLING = List.of("smoking", "blunt", "joint", "vape");
    static final List<String> ACTIVITY_AWAY = List.of("not visible", "empty", "no one");

    static final List<String> EXPRESSION_HAPPY = List.of("smiling", "happy", "laughing");
    static final List<String> EXPRESSION_FOCUSED = List.of("focused", "concentrating", "serious");
    static final List<String> EXPRESSION_STRESSED = List.of("stressed", "frustrated", "frowning", "tired");

    static final List<String> SCREEN_NEEDS_HELP = List.of("error", "stuck", "searching", "looking for");
    static final List<String> CAMERA_VIBE = List.of("smoking", "blunt", "relaxing", "drink");
    static final List<String> CAMERA_STRESSED = List.of("stressed", "frustrated", "tired", "head in hands");

    private AmbientKeywords() {
    }

    static String lower(String text) {
        return text == null ? "" : text.toLowerCase(Locale.ROOT);
    }

    static boolean containsAny(String lowerText, List<String> keywords) {
        return firstMatch(lowerText, keywords).isPresent();
    }

    static Optional<String> firstMatch(String lowerText, List<String> keywords) {
        for (String keyword : keywords) {
            if (lowerText.contains(keyword)) {
                return Optional.of(keyword);
            }
        }
        return Optional.empty();
    }

    static boolean isQuestion(String transcript) {
        if (transcript.contains("?")) {
            return true;
        }
        String lowerText = lower(transcript).stripLeading();
        for (String start : QUESTION_STARTS) {
            if (lowerText.startsWith(start)) {
                return true;
            }
        }
        return false;
    }

    static String truncate(String text, int maxLength) {
        return text.length() <= maxLength ? text : text.substring(0, maxLength);
    }
}
