package com.hooktide.model;

import java.util.Map;

/**
 * The fully resolved request handed to the execution engine, exactly once.
 *
 *   target     → taken from the registry's targets for the event category
 *   parameters → flattened body.* and extensions.* parameters
 *   labels     → resourceId, category, branch (for downstream correlation)
 */
public record DispatchRequest(String target, Map<String, String> parameters, Map<String, String> labels) {

    public static final String LABEL_RESOURCE_ID = "resourceId";
    public static final String LABEL_CATEGORY = "category";
    public static final String LABEL_BRANCH = "branch";

    public DispatchRequest {
        parameters = Map.copyOf(parameters);
        labels = Map.copyOf(labels);
    }
}
