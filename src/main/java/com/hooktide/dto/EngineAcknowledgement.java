package com.hooktide.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.*;

/**
 * Execution engine's answer to a submission: {"ack": "run-7f3c"}.
 * The token is opaque to the router.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class EngineAcknowledgement {
    private String ack;
}
