package com.hooktide.service;

import com.hooktide.exception.ResolutionException;
import com.hooktide.model.ClassificationResult;
import com.hooktide.model.DispatchRequest;
import com.hooktide.model.EventCategory;
import com.hooktide.model.ParameterSet;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns bound parameters into a {@link DispatchRequest}.
 *
 * The target is read from "extensions.targets.<category>" and nowhere else.
 * There is no default and no fallback: a missing target fails the event with
 * NO_TARGET_CONFIGURED, so an event can never be routed to a stale or guessed target.
 */
@Component
public class DispatchTemplateResolver {

    public static final String TARGET = "target";

    public DispatchRequest resolve(ParameterSet parameters, ClassificationResult classification) {
        EventCategory category = classification.category();
        if (category == EventCategory.DISCARD) {
            throw new IllegalArgumentException("Discarded events are never resolved");
        }

        String target = parameters.extension(BindingResolver.TARGETS_PREFIX + category.key())
                .filter(name -> !name.isBlank())
                .orElseThrow(() -> new ResolutionException(ResolutionException.Kind.NO_TARGET_CONFIGURED,
                        "No " + category.key() + " target configured for resource "
                                + parameters.extension(BindingResolver.RESOURCE_ID).orElse("<unknown>")));

        ParameterSet finalized = parameters.withExtension(TARGET, target);

        Map<String, String> labels = new LinkedHashMap<>();
        labels.put(DispatchRequest.LABEL_RESOURCE_ID, parameters.extension(BindingResolver.RESOURCE_ID).orElse(""));
        labels.put(DispatchRequest.LABEL_CATEGORY, category.key());
        labels.put(DispatchRequest.LABEL_BRANCH, parameters.body(BindingResolver.BRANCH)
                .or(() -> parameters.body(BindingResolver.TARGET_BRANCH))
                .orElse(""));

        return new DispatchRequest(target, finalized.flatten(), labels);
    }
}
