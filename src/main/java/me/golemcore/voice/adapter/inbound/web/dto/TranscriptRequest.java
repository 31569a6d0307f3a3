package me.golemcore.voice.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Recognized utterance from the speech-to-text pipeline.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TranscriptRequest {
    private String text;
    private Double confidence;
}
