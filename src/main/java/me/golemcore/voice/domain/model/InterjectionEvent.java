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

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Context handed to the interjection callback when the ambient scheduler
 * decides to speak. Not retained after the callback returns.
 */
@Value
@Builder
public class InterjectionEvent {

    InterjectReason reason;

    /** Short explanation such as {@code heard mention of 'weather'}. */
    String hint;

    /** Transcript or probe description that triggered the decision. */
    String evidence;

    Instant timestamp;

    @JsonProperty("user_activity")
    String userActivity;

    @JsonProperty("user_mood")
    String userMood;

    @JsonProperty("user_busy")
    boolean userBusy;
}
