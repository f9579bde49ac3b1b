package com.hooktide.dto;

import jakarta.validation.constraints.NotNull;
import lombok.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Replacement rules for one provider. Maps are ordered: rule name → expression.
 *
 * {
 *   "build":  {"merged-pull-request": "header.X-GitHub-Event == 'pull_request' && ..."},
 *   "review": {"pull-request-updated": "..."}
 * }
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor
public class FilterRulesRequest {

    @NotNull(message = "build rules are required (may be empty)")
    private Map<String, String> build = new LinkedHashMap<>();

    @NotNull(message = "review rules are required (may be empty)")
    private Map<String, String> review = new LinkedHashMap<>();
}
