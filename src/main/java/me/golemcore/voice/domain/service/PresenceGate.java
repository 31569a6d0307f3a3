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
import me.golemcore.voice.infrastructure.config.VoiceProperties;
import me.golemcore.voice.port.outbound.PresencePort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Cached view of the user presence detector.
 *
 * <p>
 * The user is assumed present when no detector is installed, when presence
 * gating is disabled and when the detector fails. A detector answer is reused
 * for {@code voice.presence.cache-ttl}.
 */
@Service
@Slf4j
public class PresenceGate {

    private final Clock clock;
    private final ObjectProvider<PresencePort> presencePortProvider;
    private final VoiceProperties.PresenceProperties config;

    private Boolean cachedPresent;
    private Instant cachedAt;

    public PresenceGate(Clock clock, ObjectProvider<PresencePort> presencePortProvider,
            VoiceProperties properties) {
        this.clock = clock;
        this.presencePortProvider = presencePortProvider;
        this.config = properties.getPresence();
    }

    public synchronized boolean isUserPresent() {
        if (!config.isEnabled()) {
            return true;
        }
        PresencePort port = presencePortProvider.getIfAvailable();
        if (port == null) {
            return true;
        }

        Instant now = clock.instant();
        if (cachedPresent != null && Duration.between(cachedAt, now).compareTo(config.getCacheTtl()) < 0) {
            return cachedPresent;
        }

        boolean present;
        try {
            present = port.isUserPresent();
        } catch (RuntimeException e) { // NOSONAR - failure counts as present
            log.warn("[Presence] Detector failed, assuming present: {}", e.getMessage());
            present = true;
        }
        cachedPresent = present;
        cachedAt = now;
        return present;
    }

    public synchronized void invalidate() {
        cachedPresent = null;
        cachedAt = null;
    }
}
