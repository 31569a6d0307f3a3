package me.golemcore.voice.infrastructure.config;

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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.voice.domain.service.InterjectionResponder;
import me.golemcore.voice.domain.service.InterjectionScheduler;
import me.golemcore.voice.domain.service.SpeechRequestQueue;
import org.springframework.stereotype.Component;

/**
 * Starts the speech queue worker and the ambient scheduler once the context is
 * ready, and stops them on shutdown. Controlled by
 * {@code voice.queue.auto-start}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SpeechEngineLifecycle {

    private final VoiceProperties properties;
    private final SpeechRequestQueue speechQueue;
    private final InterjectionScheduler interjectionScheduler;
    private final InterjectionResponder interjectionResponder;

    @PostConstruct
    public void start() {
        if (!properties.getQueue().isAutoStart()) {
            log.info("Speech engine auto-start disabled");
            return;
        }
        boolean queueStarted = speechQueue.start();
        boolean ambientStarted = interjectionScheduler.start(interjectionResponder,
                properties.getAmbient().getFriendThreshold());
        log.info("Speech engine started: queue={}, ambient={}", queueStarted, ambientStarted);
    }

    @PreDestroy
    public void stop() {
        interjectionScheduler.stop();
        speechQueue.stop();
        log.info("Speech engine stopped");
    }
}
