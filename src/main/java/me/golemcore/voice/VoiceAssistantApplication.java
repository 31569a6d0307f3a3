package me.golemcore.voice;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the GolemCore voice engine.
 *
 * <p>
 * The voice engine decides whether, when and how the assistant may emit audio.
 * It serializes every utterance through one priority queue, guards the shared
 * audio device with a cross-process lock, suppresses the assistant's own voice
 * re-entering the microphone, and lets an ambient scheduler decide when to
 * speak unprompted.
 *
 * <h2>Key Components</h2>
 * <ul>
 * <li><b>Speech queue</b> - priority + FIFO ordering, single worker per
 * process</li>
 * <li><b>Speech lock</b> - file lock with JSON sidecar and TTL-based
 * reclaim</li>
 * <li><b>Echo suppressor</b> - time and text window over recent speech</li>
 * <li><b>Mood state</b> - decaying emotional vector flavoring responses</li>
 * <li><b>Ambient awareness</b> - rule table over audio, camera and screen
 * context</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * Input Layer        → REST controllers, transcript ingress
 * Domain Layer       → Queue, Echo, Mood, Interjection services
 * Infrastructure     → Lock/Synthesis/Playback adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under {@code voice.*}
 * prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class VoiceAssistantApplication {

    public static void main(String[] args) {
        SpringApplication.run(VoiceAssistantApplication.class, args);
    }

}
