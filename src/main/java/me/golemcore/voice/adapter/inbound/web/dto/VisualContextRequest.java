package me.golemcore.voice.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Vision descriptions; either field may be omitted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VisualContextRequest {
    private String camera;
    private String screen;
}
