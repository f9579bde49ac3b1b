package com.hooktide.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.*;

/**
 * Resource registry answer for one repository key.
 *
 * Example JSON:
 * {
 *   "resourceId": "svc-a",
 *   "targets": {"build": "svc-a-build-42", "review": "svc-a-review-7"}
 * }
 *
 * Either target may be absent.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class RegistryResource {

    private String resourceId;
    private Targets targets;

    @Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Targets {
        private String build;
        private String review;
    }
}
