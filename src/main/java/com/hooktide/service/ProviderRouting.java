package com.hooktide.service;

import com.hooktide.model.Provider;

import java.util.List;
import java.util.Map;

/**
 * Immutable routing configuration of one provider: whether it is enabled, its
 * shared secret, and its compiled build and review rules in evaluation order.
 */
public record ProviderRouting(Provider provider,
                              boolean enabled,
                              String secret,
                              Map<String, String> variables,
                              List<NamedCondition> buildRules,
                              List<NamedCondition> reviewRules) {

    public ProviderRouting {
        variables = Map.copyOf(variables);
        buildRules = List.copyOf(buildRules);
        reviewRules = List.copyOf(reviewRules);
    }

    public boolean hasSecret() {
        return secret != null && !secret.isBlank();
    }

    @Override
    public String toString() {
        return "ProviderRouting{provider=" + provider + ", enabled=" + enabled
                + ", secret=" + (hasSecret() ? "****" : "<none>")
                + ", build=" + buildRules.size() + ", review=" + reviewRules.size() + "}";
    }
}
