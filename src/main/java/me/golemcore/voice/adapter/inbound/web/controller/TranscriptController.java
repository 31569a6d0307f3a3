package me.golemcore.voice.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.voice.adapter.inbound.web.dto.EchoPhraseRequest;
import me.golemcore.voice.adapter.inbound.web.dto.TranscriptRequest;
import me.golemcore.voice.adapter.inbound.web.dto.TranscriptResponse;
import me.golemcore.voice.domain.model.EchoStatus;
import me.golemcore.voice.domain.service.EchoSuppressor;
import me.golemcore.voice.domain.service.TranscriptService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Ingest speech-to-text output and inspect the echo filter.
 */
@RestController
@RequestMapping("/api/transcripts")
@RequiredArgsConstructor
public class TranscriptController {

    private static final double DEFAULT_CONFIDENCE = 1.0;

    private final TranscriptService transcriptService;
    private final EchoSuppressor echoSuppressor;

    @PostMapping
    public Mono<ResponseEntity<TranscriptResponse>> ingest(@RequestBody TranscriptRequest request) {
        if (request == null || request.getText() == null) {
            throw new IllegalArgumentException("text is required");
        }
        double confidence = request.getConfidence() != null ? request.getConfidence() : DEFAULT_CONFIDENCE;
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be between 0 and 1");
        }
        boolean accepted = transcriptService.onTranscript(request.getText(), confidence);
        return Mono.just(ResponseEntity.ok(new TranscriptResponse(accepted)));
    }

    @GetMapping("/echo")
    public Mono<ResponseEntity<EchoStatus>> getEchoStatus() {
        return Mono.just(ResponseEntity.ok(echoSuppressor.getStatus()));
    }

    @PostMapping("/echo")
    public Mono<ResponseEntity<EchoStatus>> markEcho(@RequestBody EchoPhraseRequest request) {
        if (request == null || request.getText() == null || request.getText().isBlank()) {
            throw new IllegalArgumentException("text is required");
        }
        echoSuppressor.markAsEcho(request.getText());
        return Mono.just(ResponseEntity.ok(echoSuppressor.getStatus()));
    }
}
