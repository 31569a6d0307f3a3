package me.golemcore.voice.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.voice.adapter.inbound.web.dto.MoodEventRequest;
import me.golemcore.voice.domain.model.MoodEvent;
import me.golemcore.voice.domain.model.MoodHistoryEntry;
import me.golemcore.voice.domain.model.MoodSnapshot;
import me.golemcore.voice.domain.service.MoodState;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Read and nudge the assistant's mood.
 */
@RestController
@RequestMapping("/api/mood")
@RequiredArgsConstructor
public class MoodController {

    private final MoodState moodState;

    @GetMapping
    public Mono<ResponseEntity<MoodSnapshot>> getMood() {
        return Mono.just(ResponseEntity.ok(moodState.getSnapshot()));
    }

    @PostMapping("/events")
    public Mono<ResponseEntity<MoodSnapshot>> applyEvent(@RequestBody MoodEventRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("event is required");
        }
        MoodEvent event = MoodEvent.fromTag(request.getEvent())
                .orElseThrow(() -> new IllegalArgumentException("Unknown mood event: " + request.getEvent()));
        if (request.getIntensity() != null) {
            moodState.applyEvent(event, request.getIntensity());
        } else {
            moodState.applyEvent(event);
        }
        return Mono.just(ResponseEntity.ok(moodState.getSnapshot()));
    }

    @GetMapping("/history")
    public Mono<ResponseEntity<List<MoodHistoryEntry>>> getHistory() {
        return Mono.just(ResponseEntity.ok(moodState.getHistory()));
    }

    @DeleteMapping
    public Mono<ResponseEntity<MoodSnapshot>> reset() {
        moodState.reset();
        return Mono.just(ResponseEntity.ok(moodState.getSnapshot()));
    }
}
