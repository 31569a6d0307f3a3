package me.golemcore.voice.infrastructure.http;

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

import me.golemcore.voice.infrastructure.config.VoiceProperties;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * HTTP client for the text-to-speech backend.
 *
 * <p>
 * One synthesis request is one POST whose body is the whole audio clip, so the
 * read timeout bounds a stalled stream and the call timeout bounds the complete
 * exchange. Retries are done by the adapter with its own backoff.
 *
 * @since 1.0
 */
@Configuration
public class OkHttpConfig {

    @Bean
    public OkHttpClient okHttpClient(VoiceProperties properties) {
        VoiceProperties.HttpProperties http = properties.getHttp();
        return new OkHttpClient.Builder()
                .connectTimeout(http.getConnectTimeout())
                .readTimeout(http.getReadTimeout())
                .callTimeout(http.getCallTimeout())
                .build();
    }
}
