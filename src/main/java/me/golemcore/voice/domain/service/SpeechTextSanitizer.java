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

import java.util.regex.Pattern;

/**
 * Removes stage directions that should never be read aloud.
 *
 * <p>
 * {@code *sighs*} style actions and {@code _aside_} markers are dropped and
 * whitespace is collapsed.
 */
public final class SpeechTextSanitizer {

    private static final Pattern ACTION = Pattern.compile("\\*[^*]*\\*");
    private static final Pattern ASIDE = Pattern.compile("\\b_[^_]+_\\b");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private SpeechTextSanitizer() {
    }

    public static String sanitize(String text) {
        if (text == null) {
            return "";
        }
        String cleaned = ACTION.matcher(text).replaceAll(" ");
        cleaned = ASIDE.matcher(cleaned).replaceAll(" ");
        return WHITESPACE.matcher(cleaned).replaceAll(" ").trim();
    }
}
