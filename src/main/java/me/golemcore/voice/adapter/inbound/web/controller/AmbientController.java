package me.golemcore.voice.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.voice.adapter.inbound.web.dto.FriendThresholdRequest;
import me.golemcore.voice.adapter.inbound.web.dto.VisualContextRequest;
import me.golemcore.voice.domain.model.AmbientStatus;
import me.golemcore.voice.domain.service.InterjectionResponder;
import me.golemcore.voice.domain.service.InterjectionScheduler;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Control and observe ambient interjections.
 */
@RestController
@RequestMapping("/api/ambient")
@RequiredArgsConstructor
public class AmbientController {

    private final InterjectionScheduler interjectionScheduler;
    private final InterjectionResponder interjectionResponder;

    @GetMapping
    public Mono<ResponseEntity<AmbientStatus>> getStatus() {
        return Mono.just(ResponseEntity.ok(interjectionScheduler.getStatus()));
    }

    @PutMapping("/threshold")
    public Mono<ResponseEntity<AmbientStatus>> setThreshold(@RequestBody FriendThresholdRequest request) {
        if (request == null || request.getThreshold() == null) {
            throw new IllegalArgumentException("threshold is required");
        }
        interjectionScheduler.setFriendThreshold(request.getThreshold());
        return Mono.just(ResponseEntity.ok(interjectionScheduler.getStatus()));
    }

    @PostMapping("/start")
    public Mono<ResponseEntity<AmbientStatus>> start() {
        boolean started = interjectionScheduler.start(interjectionResponder,
                interjectionScheduler.getFriendThreshold());
        if (!started) {
            throw new IllegalStateException("Ambient awareness is disabled");
        }
        return Mono.just(ResponseEntity.ok(interjectionScheduler.getStatus()));
    }

    @PostMapping("/stop")
    public Mono<ResponseEntity<AmbientStatus>> stop() {
        interjectionScheduler.stop();
        return Mono.just(ResponseEntity.ok(interjectionScheduler.getStatus()));
    }

    @PostMapping("/visual")
    public Mono<ResponseEntity<Void>> updateVisualContext(@RequestBody VisualContextRequest request) {
        if (request == null || (isBlank(request.getCamera()) && isBlank(request.getScreen()))) {
            throw new IllegalArgumentException("camera or screen description is required");
        }
        if (!interjectionScheduler.isRunning()) {
            throw new IllegalStateException("Ambient awareness is not running");
        }
        interjectionScheduler.updateVisualContext(request.getCamera(), request.getScreen());
        return Mono.just(ResponseEntity.accepted().build());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
