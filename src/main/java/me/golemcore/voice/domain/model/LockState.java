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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * Content of the speech lock sidecar file shared by every process that talks
 * through the same audio device.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class LockState {

    public static final String STATUS_ACQUIRED = "acquired";
    public static final String STATUS_RELEASED = "released";

    private String status;

    /** Human-readable name of the holder, reported by who-holds diagnostics. */
    private String caller;

    /** Unique token of the holding lock instance. */
    private String owner;

    @JsonProperty("acquired_at")
    private Instant acquiredAt;

    @JsonProperty("released_at")
    private Instant releasedAt;

    public static LockState acquired(String caller, String owner, Instant now) {
        return LockState.builder()
                .status(STATUS_ACQUIRED)
                .caller(caller)
                .owner(owner)
                .acquiredAt(now)
                .build();
    }

    public static LockState released(String caller, String owner, Instant now) {
        return LockState.builder()
                .status(STATUS_RELEASED)
                .caller(caller)
                .owner(owner)
                .releasedAt(now)
                .build();
    }

    @JsonIgnore
    public boolean isAcquired() {
        return STATUS_ACQUIRED.equals(status);
    }

    /**
     * A held lock is stale once it is older than the TTL. A missing acquisition
     * timestamp is treated as stale.
     */
    @JsonIgnore
    public boolean isStale(Instant now, Duration ttl) {
        if (acquiredAt == null) {
            return true;
        }
        return Duration.between(acquiredAt, now).compareTo(ttl) > 0;
    }

    @JsonIgnore
    public boolean isHeld(Instant now, Duration ttl) {
        return isAcquired() && !isStale(now, ttl);
    }
}
