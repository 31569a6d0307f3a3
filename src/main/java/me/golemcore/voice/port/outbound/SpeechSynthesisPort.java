package me.golemcore.voice.port.outbound;

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

import me.golemcore.voice.domain.model.SpeechEmotion;

/**
 * Text-to-speech engine that synthesizes and plays an utterance on the local
 * audio device.
 */
public interface SpeechSynthesisPort {

    /**
     * Synthesize and play {@code text}. Blocks until playback finishes. There is
     * no cancellation contract.
     *
     * @throws SpeechSynthesisException
     *             when synthesis or playback fails
     */
    void synthesizeAndPlay(String text, SpeechEmotion emotion);

    /**
     * Whether the engine is configured and usable.
     */
    boolean isAvailable();

    /**
     * Failure of the external synthesis or playback call.
     */
    class SpeechSynthesisException extends RuntimeException {

        private static final long serialVersionUID = 1L;

        public SpeechSynthesisException(String message) {
            super(message);
        }

        public SpeechSynthesisException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
