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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties for the voice engine, bound from
 * application.properties.
 *
 * <p>
 * All configuration is organized under the {@code voice.*} prefix:
 * <ul>
 * <li>{@link QueueProperties} - speech queue worker</li>
 * <li>{@link LockProperties} - cross-process speech lock</li>
 * <li>{@link EchoProperties} - echo suppression window</li>
 * <li>{@link MoodProperties} - mood decay</li>
 * <li>{@link AmbientProperties} - ambient interjection scheduler</li>
 * <li>{@link PresenceProperties} - user presence gate</li>
 * <li>{@link TtsProperties} - speech synthesis provider</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "voice")
@Data
public class VoiceProperties {

    private QueueProperties queue = new QueueProperties();
    private LockProperties lock = new LockProperties();
    private EchoProperties echo = new EchoProperties();
    private MoodProperties mood = new MoodProperties();
    private AmbientProperties ambient = new AmbientProperties();
    private PresenceProperties presence = new PresenceProperties();
    private TtsProperties tts = new TtsProperties();
    private HttpProperties http = new HttpProperties();

    @Data
    public static class QueueProperties {
        private boolean autoStart = true;
        private Duration pollInterval = Duration.ofMillis(500);
        private Duration lockTimeout = Duration.ofSeconds(10);
        private int defaultPriority = 5;
        private int interjectionPriority = 7;
    }

    @Data
    public static class LockProperties {
        private String directory = "${java.io.tmpdir}/golemcore-voice";
        private String caller = "golemcore-voice";
        private Duration ttl = Duration.ofSeconds(30);
        private Duration acquireTimeout = Duration.ofSeconds(30);
        private Duration retryInterval = Duration.ofMillis(100);
    }

    @Data
    public static class EchoProperties {
        private Duration filterDuration = Duration.ofSeconds(3);
        private Duration gracePeriod = Duration.ofMillis(500);
        private double minConfidence = 0.7;
        private int historySize = 10;
        private boolean adaptive = true;
        private boolean learnEchoes = true;
        private double secondsPerWord = 0.4;
        private Duration minEstimate = Duration.ofSeconds(1);
        private Duration maxEstimate = Duration.ofSeconds(15);
        private List<String> blacklistPhrases = new ArrayList<>();
    }

    @Data
    public static class MoodProperties {
        private double decayRate = 0.01;
        private double defaultIntensity = 0.3;
        private int historyLimit = 100;
        private int historyRetain = 50;
    }

    @Data
    public static class AmbientProperties {
        private boolean enabled = true;
        private double friendThreshold = 0.5;
        private Duration tickInterval = Duration.ofSeconds(1);
        private Duration minInterjectionInterval = Duration.ofSeconds(30);
        private Duration busyInterjectionInterval = Duration.ofMinutes(5);
        private double baseProbability = 0.3;
        private double busyDampening = 0.3;
        private int recentTranscriptLimit = 10;
        private Duration screenshotInterval = Duration.ofSeconds(60);
        private double screenshotMinThreshold = 0.3;
        private Duration cameraInterval = Duration.ofSeconds(45);
        private double cameraMinThreshold = 0.4;
        private Duration silenceCheckIn = Duration.ofMinutes(5);
        private double silenceMinThreshold = 0.6;
        private double silenceCheckInChance = 0.1;
    }

    @Data
    public static class PresenceProperties {
        private boolean enabled = false;
        private Duration cacheTtl = Duration.ofSeconds(5);
    }

    @Data
    public static class TtsProperties {
        private boolean enabled = true;
        private String apiKey;
        private String voiceId = "21m00Tcm4TlvDq8EAjQg";
        private String modelId = "eleven_flash_v2_5";
        private float speed = 1.0f;
        private int sampleRate = 22050;
    }

    @Data
    public static class HttpProperties {
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(60);
        private Duration callTimeout = Duration.ofSeconds(90);
    }
}
