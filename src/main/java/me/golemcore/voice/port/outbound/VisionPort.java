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

import me.golemcore.voice.domain.model.VisionSource;

import java.util.Optional;

/**
 * Captures a frame from the camera or the screen and returns a short natural
 * language description of it.
 */
public interface VisionPort {

    /**
     * @return description of what is visible, empty when nothing could be
     *         captured
     */
    Optional<String> captureDescription(VisionSource source);
}
