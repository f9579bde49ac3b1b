package com.hooktide.model;

/**
 * Outcome of classification.
 * BUILD   → a merge into a tracked branch
 * REVIEW  → a change request opened/updated, or a recheck comment on an open one
 * DISCARD → nothing to do, acknowledged as a no-op
 */
public enum EventCategory {
    BUILD,
    REVIEW,
    DISCARD;

    /** Lower-case form used in parameter names, labels and rule identifiers. */
    public String key() {
        return name().toLowerCase();
    }
}
