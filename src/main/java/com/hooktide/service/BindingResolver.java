package com.hooktide.service;

import com.hooktide.exception.MalformedPayloadException;
import com.hooktide.model.ClassificationResult;
import com.hooktide.model.EnrichmentRecord;
import com.hooktide.model.EventCategory;
import com.hooktide.model.ParameterSet;
import com.hooktide.model.Stage;
import com.hooktide.model.WebhookEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Merges payload fields and enrichment into one {@link ParameterSet}.
 *
 *   body.repositoryUrl, body.revision, body.branch, body.targetBranch,
 *   body.changeNumber, body.actor, body.eventType          ← payload
 *   extensions.resourceId, extensions.targets.build, extensions.targets.review,
 *   extensions.lookupLatencyMs, extensions.category, extensions.matchedRule,
 *   extensions.provider, extensions.deliveryId             ← enrichment and chain
 *
 * Only the fields the provider's payload shape carries are bound, and absent ones
 * are skipped, except repositoryUrl and revision, without which nothing can be dispatched.
 */
@Component
@RequiredArgsConstructor
public class BindingResolver {

    public static final String REPOSITORY_URL = "repositoryUrl";
    public static final String REVISION = "revision";
    public static final String BRANCH = "branch";
    public static final String TARGET_BRANCH = "targetBranch";
    public static final String CHANGE_NUMBER = "changeNumber";
    public static final String ACTOR = "actor";
    public static final String EVENT_TYPE = "eventType";

    public static final String RESOURCE_ID = "resourceId";
    public static final String TARGETS_PREFIX = "targets.";
    public static final String LOOKUP_LATENCY_MS = "lookupLatencyMs";
    public static final String CATEGORY = "category";
    public static final String MATCHED_RULE = "matchedRule";
    public static final String PROVIDER = "provider";
    public static final String DELIVERY_ID = "deliveryId";

    private final PayloadFieldExtractor fieldExtractor;

    public ParameterSet bind(WebhookEvent event, EnrichmentRecord enrichment, ClassificationResult classification) {
        if (classification.category() == EventCategory.DISCARD) {
            throw new IllegalArgumentException("Discarded events are never bound");
        }
        PayloadFields fields = fieldExtractor.extract(event, classification.category());
        if (fields.repositoryUrl() == null) {
            throw new MalformedPayloadException(Stage.BIND, "Payload has no repository URL");
        }
        if (fields.revision() == null) {
            throw new MalformedPayloadException(Stage.BIND, "Payload has no commit or revision");
        }

        ParameterSet.Builder parameters = ParameterSet.builder();
        Map<String, String> values = fields.byName();
        for (String name : fieldExtractor.fieldsFor(event.getProvider(), event.eventType())) {
            parameters.body(name, values.get(name));
        }

        parameters.extension(RESOURCE_ID, enrichment.resourceId());
        enrichment.targets().forEach((category, target) ->
                parameters.extension(TARGETS_PREFIX + category.key(), target));
        parameters.extension(LOOKUP_LATENCY_MS, Long.toString(enrichment.lookupLatencyMs()))
                .extension(CATEGORY, classification.category().key())
                .extension(MATCHED_RULE, classification.matchedRule())
                .extension(PROVIDER, event.getProvider().pathSegment())
                .extension(DELIVERY_ID, event.getDeliveryId());

        return parameters.build();
    }
}
