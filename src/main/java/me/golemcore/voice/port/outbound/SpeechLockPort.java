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

import java.time.Duration;
import java.util.Optional;

/**
 * Mutual exclusion over the physical audio device, shared by every process
 * that speaks through it.
 *
 * <p>
 * State machine: {@code Free -> Held(owner, since) -> Free}. Waiting is the
 * caller blocking inside {@link #acquire(Duration)}; it is never persisted. A
 * holder that dies without releasing must not block others forever, so
 * implementations treat a lock older than its TTL as abandoned.
 *
 * <p>
 * The file based implementation is the default; platform named mutexes or
 * semaphores can be substituted behind this port.
 */
public interface SpeechLockPort {

    /**
     * Try to take the lock, waiting at most {@code timeout}.
     *
     * @return true if this instance now holds the lock, false on timeout or
     *         error
     */
    boolean acquire(Duration timeout);

    /**
     * Release the lock if this instance holds it. Idempotent.
     */
    void release();

    /**
     * Whether any live holder (this or another process) has the lock.
     */
    boolean isLocked();

    /**
     * Caller name of the live holder, if any.
     */
    Optional<String> whoHolds();

    /**
     * Unique token identifying this lock instance as an owner.
     */
    String getOwner();
}
