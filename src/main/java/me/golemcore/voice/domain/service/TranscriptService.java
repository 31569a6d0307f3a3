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

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Entry point for speech-to-text output.
 *
 * <p>
 * Every recognized utterance passes through the {@link EchoSuppressor}. Only
 * accepted transcripts are pushed to registered listeners, so the ambient
 * scheduler never reacts to the assistant's own voice.
 */
@Service
@Slf4j
public class TranscriptService {

    private final EchoSuppressor echoSuppressor;
    private final List<Consumer<String>> listeners = new CopyOnWriteArrayList<>();

    public TranscriptService(EchoSuppressor echoSuppressor) {
        this.echoSuppressor = echoSuppressor;
    }

    /**
     * Handle one recognized utterance.
     *
     * @return true when the transcript was accepted as user speech
     */
    public boolean onTranscript(String text, double confidence) {
        if (text == null || text.isBlank()) {
            return false;
        }
        if (!echoSuppressor.shouldProcess(text, confidence)) {
            return false;
        }
        for (Consumer<String> listener : listeners) {
            try {
                listener.accept(text);
            } catch (RuntimeException e) {
                log.warn("[Transcript] Listener failed: {}", e.getMessage(), e);
            }
        }
        return true;
    }

    public void registerListener(Consumer<String> listener) {
        listeners.add(listener);
    }

    public void unregisterListener(Consumer<String> listener) {
        listeners.remove(listener);
    }

    int listenerCount() {
        return listeners.size();
    }
}
