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

import java.util.List;
import java.util.Locale;

/**
 * Emotion tag attached to a speech request. Drives delivery (speaking rate and
 * the instruction handed to the synthesis engine).
 *
 * <p>
 * Detection walks the constants in declaration order and returns the first one
 * whose keyword occurs in the text, so the order of the constants is part of
 * the contract. {@link #CARING} and {@link #SARCASTIC} carry no keywords and
 * are only ever selected explicitly.
 */
public enum SpeechEmotion {

    EXCITED(List.of("!", "great", "awesome", "excellent", "amazing", "congrats",
            "fantastic", "wonderful", "perfect", "brilliant", "yay", "woohoo"),
            "speak enthusiastically with energy", 1.15f),
    CONCERNED(List.of("sorry", "unfortunately", "failed", "error", "problem", "issue",
            "wrong", "broken", "warning", "careful", "danger", "bad"),
            "speak with concern and care", 0.95f),
    SATISFIED(List.of("done", "complete", "finished", "success", "nice", "good",
            "accomplished", "achieved", "completed", "saved"),
            "speak with contentment", 1.0f),
    URGENT(List.of("remember", "don't forget", "deadline", "overdue", "urgent",
            "immediately", "now", "asap", "critical", "important"),
            "speak with urgency and emphasis", 1.2f),
    QUESTIONING(List.of("?", "what", "how", "why", "when", "where", "which"),
            "speak with curiosity, rising intonation", 1.0f),
    WARM(List.of("hello", "hi", "hey", "welcome", "greetings", "morning", "evening"),
            "speak warmly and friendly", 0.95f),
    GENTLE(List.of("goodbye", "bye", "see you", "later", "goodnight", "farewell"),
            "speak softly and gently", 0.85f),
    ANNOYED(List.of("ugh", "again", "really", "seriously", "whatever", "fine"),
            "speak with slight exasperation", 1.05f),
    PLAYFUL(List.of("haha", "lol", "hehe", "joke", "funny", "kidding", "tease"),
            "speak playfully with humor", 1.1f),
    CARING(List.of(), "speak softly and reassuringly", 0.9f),
    SARCASTIC(List.of(), "speak with dry sarcasm", 0.95f),
    NEUTRAL(List.of(), "speak normally", 1.0f);

    private final List<String> keywords;
    private final String instruction;
    private final float rateModifier;

    SpeechEmotion(List<String> keywords, String instruction, float rateModifier) {
        this.keywords = keywords;
        this.instruction = instruction;
        this.rateModifier = rateModifier;
    }

    public String getInstruction() {
        return instruction;
    }

    public float getRateModifier() {
        return rateModifier;
    }

    public String getTag() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Detects the primary emotion of a text by keyword match.
     *
     * @param text
     *            text to analyze, may be null
     * @return detected emotion, {@link #NEUTRAL} when nothing matches
     */
    public static SpeechEmotion detect(String text) {
        if (text == null || text.isBlank()) {
            return NEUTRAL;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (SpeechEmotion emotion : values()) {
            for (String keyword : emotion.keywords) {
                if (lower.contains(keyword)) {
                    return emotion;
                }
            }
        }
        return NEUTRAL;
    }

    /**
     * Lenient tag parsing. Unknown or blank tags resolve to {@link #NEUTRAL}.
     */
    public static SpeechEmotion fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            return NEUTRAL;
        }
        String normalized = tag.trim().toUpperCase(Locale.ROOT);
        for (SpeechEmotion emotion : values()) {
            if (emotion.name().equals(normalized)) {
                return emotion;
            }
        }
        return NEUTRAL;
    }
}
