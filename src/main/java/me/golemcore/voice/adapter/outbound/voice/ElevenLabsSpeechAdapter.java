package me.golemcore.voice.adapter.outbound.voice;

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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.voice.domain.model.SpeechEmotion;
import me.golemcore.voice.infrastructure.config.VoiceProperties;
import me.golemcore.voice.port.outbound.AudioPlaybackPort;
import me.golemcore.voice.port.outbound.SpeechSynthesisPort;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * ElevenLabs text-to-speech adapter that plays the result on the local device.
 *
 * <p>
 * Audio is requested as raw PCM at {@code voice.tts.sample-rate} so it can be
 * written straight to the output line. The emotion's rate modifier scales the
 * configured speaking speed, clamped to the range the API accepts.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ElevenLabsSpeechAdapter implements SpeechSynthesisPort {

    private static final String DEFAULT_TTS_URL_TEMPLATE = "https://api.elevenlabs.io/v1/text-to-speech/%s";
    private static final float MIN_SPEED = 0.7f;
    private static final float MAX_SPEED = 1.2f;
    private static final int MAX_RETRIES = 3;

    private final OkHttpClient okHttpClient;
    private final VoiceProperties properties;
    private final ObjectMapper objectMapper;
    private final AudioPlaybackPort audioPlayback;

    @PostConstruct
    void init() {
        VoiceProperties.TtsProperties tts = properties.getTts();
        boolean hasApiKey = tts.getApiKey() != null && !tts.getApiKey().isBlank();
        if (tts.isEnabled() && !hasApiKey) {
            log.warn("[ElevenLabs] TTS is ENABLED but API key is NOT configured. "
                    + "Set ELEVENLABS_API_KEY env var.");
        }
        log.info("[ElevenLabs] Adapter initialized: enabled={}, apiKeyConfigured={}, voiceId={}, model={}",
                tts.isEnabled(), hasApiKey, tts.getVoiceId(), tts.getModelId());
    }

    @Override
    public void synthesizeAndPlay(String text, SpeechEmotion emotion) {
        byte[] pcm = synthesize(text, emotion != null ? emotion : SpeechEmotion.NEUTRAL);
        try {
            audioPlayback.playPcm(pcm, properties.getTts().getSampleRate());
        } catch (SpeechSynthesisException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SpeechSynthesisException("Playback failed: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean isAvailable() {
        VoiceProperties.TtsProperties tts = properties.getTts();
        String apiKey = tts.getApiKey();
        return tts.isEnabled() && apiKey != null && !apiKey.isBlank();
    }

    @SuppressWarnings("PMD.CloseResource") // ResponseBody is closed when Response is closed in try-with-resources
    byte[] synthesize(String text, SpeechEmotion emotion) {
        try {
            VoiceProperties.TtsProperties tts = properties.getTts();
            String apiKey = requireApiKey(tts);
            float speed = effectiveSpeed(tts.getSpeed(), emotion);

            log.info("[ElevenLabs] TTS request: {} chars, voice={}, model={}, emotion={}, speed={}",
                    text.length(), tts.getVoiceId(), tts.getModelId(), emotion.getTag(), speed);

            String url = getTtsUrl(tts.getVoiceId()) + "?output_format=pcm_" + tts.getSampleRate();
            String jsonBody = objectMapper.writeValueAsString(
                    new TtsRequest(text, tts.getModelId(), new VoiceSettings(speed)));

            Request request = new Request.Builder()
                    .url(url)
                    .header("xi-api-key", apiKey)
                    .header("Accept", "audio/pcm")
                    .post(RequestBody.create(jsonBody, MediaType.parse("application/json")))
                    .build();

            long startTime = System.currentTimeMillis();
            int attempt = 0;
            while (attempt < MAX_RETRIES) {
                try (Response response = okHttpClient.newCall(request).execute()) {
                    long elapsed = System.currentTimeMillis() - startTime;
                    ResponseBody body = response.body();

                    if (!response.isSuccessful()) {
                        if (isRetryableError(response.code()) && attempt < MAX_RETRIES - 1) {
                            attempt++;
                            long backoffMs = (long) Math.pow(2, attempt) * 1000;
                            log.info("[ElevenLabs] TTS retrying after {} (attempt {}/{}), backoff={}ms",
                                    response.code(), attempt, MAX_RETRIES, backoffMs);
                            sleepBeforeRetry(backoffMs);
                            continue;
                        }
                        handleErrorResponse(response, body, elapsed);
                    }

                    if (body == null) {
                        throw new SpeechSynthesisException("ElevenLabs TTS returned empty body");
                    }
                    byte[] pcm = body.bytes();
                    log.info("[ElevenLabs] TTS success: {} chars -> {} bytes PCM, {}ms",
                            text.length(), pcm.length, elapsed);
                    return pcm;
                }
            }
            throw new SpeechSynthesisException("ElevenLabs TTS failed after " + MAX_RETRIES + " attempts");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SpeechSynthesisException("ElevenLabs TTS interrupted", e);
        } catch (IOException e) {
            log.error("[ElevenLabs] TTS network error: {}", e.getMessage(), e);
            throw new SpeechSynthesisException("Synthesis failed: " + e.getMessage(), e);
        }
    }

    static float effectiveSpeed(float configuredSpeed, SpeechEmotion emotion) {
        float speed = configuredSpeed * emotion.getRateModifier();
        return Math.max(MIN_SPEED, Math.min(MAX_SPEED, speed));
    }

    protected String getTtsUrl(String voiceId) {
        return String.format(DEFAULT_TTS_URL_TEMPLATE, voiceId);
    }

    protected void sleepBeforeRetry(long backoffMs) throws InterruptedException {
        Thread.sleep(backoffMs);
    }

    private String requireApiKey(VoiceProperties.TtsProperties tts) {
        String apiKey = tts.getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("[ElevenLabs] Request rejected: API key not configured");
            throw new SpeechSynthesisException("ElevenLabs API key not configured");
        }
        return apiKey;
    }

    private boolean isRetryableError(int code) {
        return code == 429 || code == 500 || code == 503 || code == 504;
    }

    private void handleErrorResponse(Response response, ResponseBody body, long elapsed) throws IOException {
        int code = response.code();
        String errorBody = body != null ? body.string() : "";
        ErrorResponse errorResponse = parseErrorResponse(errorBody);
        String errorMessage = extractErrorMessage(errorResponse);
        String context = getErrorContext(code);

        log.warn("[ElevenLabs] TTS failed: HTTP {} in {}ms, {} ({})", code, elapsed, errorMessage, context);

        if (code == 402) {
            throw new QuotaExceededException(
                    String.format("ElevenLabs quota exceeded: %s. %s", errorMessage, context));
        }
        throw new SpeechSynthesisException(
                String.format("ElevenLabs TTS error (HTTP %d): %s. %s", code, errorMessage, context));
    }

    private ErrorResponse parseErrorResponse(String errorBody) {
        try {
            return objectMapper.readValue(errorBody, ErrorResponse.class);
        } catch (IOException e) {
            log.debug("[ElevenLabs] Could not parse error response: {}", errorBody);
            ErrorResponse fallback = new ErrorResponse();
            fallback.setMessage(errorBody);
            return fallback;
        }
    }

    private String extractErrorMessage(ErrorResponse errorResponse) {
        if (errorResponse.getDetail() != null && errorResponse.getDetail().getMessage() != null) {
            return errorResponse.getDetail().getMessage();
        }
        if (errorResponse.getMessage() != null && !errorResponse.getMessage().isBlank()) {
            return errorResponse.getMessage();
        }
        return "Unknown error";
    }

    private String getErrorContext(int code) {
        return switch (code) {
        case 400 -> "Bad request. Check text length limits";
        case 401 -> "Authentication failed. Check your ElevenLabs API key";
        case 402 -> "Quota exceeded. Enable usage-based billing or upgrade your plan";
        case 422 -> "Invalid request format. Check voice and model ids";
        case 429 -> "Rate limit exceeded";
        case 500, 503 -> "ElevenLabs service temporarily unavailable";
        case 504 -> "Request timeout";
        default -> "Service error";
        };
    }

    record TtsRequest(
            String text,
            @JsonProperty("model_id") String modelId,
            @JsonProperty("voice_settings") VoiceSettings voiceSettings) {
    }

    record VoiceSettings(float speed) {
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ErrorResponse {
        private ErrorDetail detail;
        private String message;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ErrorDetail {
        private String status;
        private String message;
    }

    /**
     * Quota or billing problem; retrying will not help.
     */
    public static class QuotaExceededException extends SpeechSynthesisException {

        private static final long serialVersionUID = 1L;

        public QuotaExceededException(String message) {
            super(message);
        }
    }
}
