package me.golemcore.voice.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SpeakRequest {
    private String text;
    private String emotion;
    private Integer priority;
    private boolean skipPresenceCheck;
}
