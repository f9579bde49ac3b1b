package com.hooktide.service;

import com.hooktide.config.DefaultFilters;
import com.hooktide.config.HooktideProperties;
import com.hooktide.dto.FilterRulesRequest;
import com.hooktide.dto.ProviderRoutingResponse;
import com.hooktide.exception.InvalidConditionException;
import com.hooktide.model.EventCategory;
import com.hooktide.model.Provider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Owns the routing table every request reads from.
 *
 * HOW IT WORKS:
 *   1. At startup, provider settings are compiled into a {@link RoutingSnapshot}
 *      (invalid expressions fail the startup)
 *   2. Requests call {@link #current()} once and use that snapshot for the whole chain
 *   3. Changes (filter replacement, reload) compile first, then swap the reference,
 *      so a request sees either the old table or the new one, never a mix
 */
@Service
@Slf4j
public class RoutingConfigService {

    static final String TRACKED_BRANCHES = "trackedBranches";
    static final String RECHECK_PATTERN = "recheckPattern";

    private final HooktideProperties properties;
    private final ConditionEvaluator conditionEvaluator;
    private final AtomicReference<RoutingSnapshot> current = new AtomicReference<>();

    public RoutingConfigService(HooktideProperties properties, ConditionEvaluator conditionEvaluator) {
        this.properties = properties;
        this.conditionEvaluator = conditionEvaluator;
        current.set(buildFromProperties(1));
        log.info("Routing snapshot loaded: {}", current.get().providers().values());
    }

    public RoutingSnapshot current() {
        return current.get();
    }

    /**
     * Rebuild the whole table from bound properties. Filters replaced at runtime are lost.
     */
    public RoutingSnapshot reload() {
        RoutingSnapshot fresh = buildFromProperties(current.get().version() + 1);
        current.set(fresh);
        log.info("Routing snapshot reloaded: version={}", fresh.version());
        return fresh;
    }

    /**
     * Replace a provider's build and review rules.
     *
     * @throws InvalidConditionException if any expression does not compile; nothing is swapped
     */
    public ProviderRoutingResponse replaceFilters(Provider provider, FilterRulesRequest request) {
        ProviderRouting existing = current.get().forProvider(provider);
        ProviderRouting replacement = new ProviderRouting(
                provider,
                existing.enabled(),
                existing.secret(),
                existing.variables(),
                compileRules(provider, EventCategory.BUILD, request.getBuild(), existing.variables()),
                compileRules(provider, EventCategory.REVIEW, request.getReview(), existing.variables()));

        RoutingSnapshot swapped = current.updateAndGet(snapshot -> snapshot.with(replacement));
        log.info("Filters replaced: provider={}, build={}, review={}, version={}",
                provider, replacement.buildRules().size(), replacement.reviewRules().size(), swapped.version());
        return toResponse(replacement, swapped.version());
    }

    public List<ProviderRoutingResponse> listAll() {
        RoutingSnapshot snapshot = current.get();
        return snapshot.providers().values().stream()
                .map(routing -> toResponse(routing, snapshot.version()))
                .collect(Collectors.toList());
    }

    public ProviderRoutingResponse getByProvider(Provider provider) {
        RoutingSnapshot snapshot = current.get();
        return toResponse(snapshot.forProvider(provider), snapshot.version());
    }

    // --- Snapshot building ---

    private RoutingSnapshot buildFromProperties(long version) {
        Map<Provider, ProviderRouting> routings = new EnumMap<>(Provider.class);
        for (Provider provider : Provider.values()) {
            HooktideProperties.ProviderSettings settings = properties.getProviders()
                    .getOrDefault(provider, new HooktideProperties.ProviderSettings());
            routings.put(provider, compile(provider, settings));
        }
        return new RoutingSnapshot(routings, version);
    }

    private ProviderRouting compile(Provider provider, HooktideProperties.ProviderSettings settings) {
        Map<String, String> variables = new LinkedHashMap<>();
        variables.put(TRACKED_BRANCHES, settings.getTrackedBranches());
        variables.put(RECHECK_PATTERN, settings.getRecheckPattern());

        Map<String, String> build = settings.getFilters().getBuild();
        Map<String, String> review = settings.getFilters().getReview();
        if (build.isEmpty() && review.isEmpty()) {
            build = DefaultFilters.forProvider(provider, EventCategory.BUILD);
            review = DefaultFilters.forProvider(provider, EventCategory.REVIEW);
        }

        return new ProviderRouting(
                provider,
                settings.isEnabled(),
                settings.getSecret(),
                variables,
                compileRules(provider, EventCategory.BUILD, build, variables),
                compileRules(provider, EventCategory.REVIEW, review, variables));
    }

    private List<NamedCondition> compileRules(Provider provider, EventCategory category,
                                              Map<String, String> rules, Map<String, String> variables) {
        List<NamedCondition> compiled = new ArrayList<>();
        if (rules == null) {
            return compiled;
        }
        for (Map.Entry<String, String> rule : rules.entrySet()) {
            if (rule.getValue() == null || rule.getValue().isBlank()) {
                // A blank rule would match everything
                throw new InvalidConditionException("Rule " + ruleId(provider, category, rule.getKey())
                        + " has an empty expression");
            }
            try {
                compiled.add(new NamedCondition(rule.getKey(),
                        conditionEvaluator.compile(rule.getValue(), variables)));
            } catch (InvalidConditionException e) {
                throw new InvalidConditionException("Rule " + ruleId(provider, category, rule.getKey())
                        + " is invalid: " + e.getMessage(), e);
            }
        }
        return compiled;
    }

    static String ruleId(Provider provider, EventCategory category, String name) {
        return provider.pathSegment() + "/" + category.key() + "/" + name;
    }

    // --- Mapping helpers ---

    private ProviderRoutingResponse toResponse(ProviderRouting routing, long version) {
        return ProviderRoutingResponse.builder()
                .provider(routing.provider())
                .enabled(routing.enabled())
                .signatureScheme(routing.provider().signatureScheme())
                .commentTrigger(routing.provider().supportsCommentTrigger())
                .secretConfigured(routing.hasSecret())
                .variables(routing.variables())
                .buildRules(toExpressions(routing.buildRules()))
                .reviewRules(toExpressions(routing.reviewRules()))
                .snapshotVersion(version)
                .build();
    }

    private Map<String, String> toExpressions(List<NamedCondition> rules) {
        Map<String, String> expressions = new LinkedHashMap<>();
        rules.forEach(rule -> expressions.put(rule.name(), rule.condition().expression()));
        return expressions;
    }

    public static List<String> providerNames() {
        return Arrays.stream(Provider.values()).map(Provider::pathSegment).collect(Collectors.toList());
    }
}
