package me.golemcore.voice.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.voice.adapter.inbound.web.dto.SpeakRequest;
import me.golemcore.voice.domain.model.SpeechEmotion;
import me.golemcore.voice.domain.model.SpeechQueueStatus;
import me.golemcore.voice.domain.service.SpeechRequestQueue;
import me.golemcore.voice.infrastructure.config.VoiceProperties;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Queue utterances for the local speech worker.
 */
@RestController
@RequestMapping("/api/speech")
@RequiredArgsConstructor
public class SpeechController {

    private final SpeechRequestQueue speechQueue;
    private final VoiceProperties properties;

    @PostMapping
    public Mono<ResponseEntity<SpeechQueueStatus>> enqueue(@RequestBody SpeakRequest request) {
        String text = requireText(request);
        int priority = request.getPriority() != null
                ? request.getPriority()
                : properties.getQueue().getDefaultPriority();
        speechQueue.enqueue(text, parseEmotion(request.getEmotion()), priority, request.isSkipPresenceCheck());
        return Mono.just(ResponseEntity.accepted().body(speechQueue.getStatus()));
    }

    @PostMapping("/now")
    public Mono<ResponseEntity<SpeechQueueStatus>> speakNow(@RequestBody SpeakRequest request) {
        String text = requireText(request);
        speechQueue.speakNow(text, parseEmotion(request.getEmotion()));
        return Mono.just(ResponseEntity.accepted().body(speechQueue.getStatus()));
    }

    @DeleteMapping("/queue")
    public Mono<ResponseEntity<SpeechQueueStatus>> clear() {
        speechQueue.clear();
        return Mono.just(ResponseEntity.ok(speechQueue.getStatus()));
    }

    @GetMapping("/status")
    public Mono<ResponseEntity<SpeechQueueStatus>> getStatus() {
        return Mono.just(ResponseEntity.ok(speechQueue.getStatus()));
    }

    private static String requireText(SpeakRequest request) {
        if (request == null || request.getText() == null || request.getText().isBlank()) {
            throw new IllegalArgumentException("text is required");
        }
        return request.getText();
    }

    private static SpeechEmotion parseEmotion(String emotion) {
        if (emotion == null || emotion.isBlank()) {
            return null;
        }
        return SpeechEmotion.fromTag(emotion);
    }
}
