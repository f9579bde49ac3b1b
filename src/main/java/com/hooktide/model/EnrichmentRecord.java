package com.hooktide.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * What the resource registry knows about the repository behind an event.
 *
 * targets may lack an entry for a category; that is reported later as
 * "no target configured", never here.
 */
public record EnrichmentRecord(String resourceId, Map<EventCategory, String> targets, long lookupLatencyMs) {

    public EnrichmentRecord {
        EnumMap<EventCategory, String> copy = new EnumMap<>(EventCategory.class);
        if (targets != null) {
            targets.forEach((category, target) -> {
                if (target != null && !target.isBlank()) {
                    copy.put(category, target);
                }
            });
        }
        targets = Collections.unmodifiableMap(copy);
    }

    public Optional<String> target(EventCategory category) {
        return Optional.ofNullable(targets.get(category));
    }
}
