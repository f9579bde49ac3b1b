package com.hooktide.service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fields pulled out of a provider payload, provider differences already resolved.
 * changeNumber and actor may be null; repositoryUrl and revision are required for binding.
 */
public record PayloadFields(String repositoryUrl,
                            String revision,
                            String branch,
                            String targetBranch,
                            String changeNumber,
                            String actor,
                            String eventType) {

    /** Values keyed by field name, in binding order; absent fields map to null. */
    public Map<String, String> byName() {
        Map<String, String> values = new LinkedHashMap<>();
        values.put(BindingResolver.REPOSITORY_URL, repositoryUrl);
        values.put(BindingResolver.REVISION, revision);
        values.put(BindingResolver.BRANCH, branch);
        values.put(BindingResolver.TARGET_BRANCH, targetBranch);
        values.put(BindingResolver.CHANGE_NUMBER, changeNumber);
        values.put(BindingResolver.ACTOR, actor);
        values.put(BindingResolver.EVENT_TYPE, eventType);
        return values;
    }
}
