package com.hooktide.service;

import com.hooktide.model.ClassificationResult;
import com.hooktide.model.EventCategory;
import com.hooktide.model.Provider;
import com.hooktide.model.WebhookEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Decides whether a webhook is a BUILD event, a REVIEW event, or noise.
 *
 * FLOW:
 *   1. Comment event on a provider without comment-trigger support → DISCARD
 *   2. Try the provider's build rules in order → first match is BUILD
 *   3. Try the provider's review rules in order → first match is REVIEW
 *   4. Nothing matched → DISCARD
 *
 * Pure: only the payload, the headers and the current routing snapshot are read.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EventClassifier {

    private final RoutingConfigService routingConfigService;

    public ClassificationResult classify(WebhookEvent event, Provider provider) {
        return classify(event, provider, routingConfigService.current());
    }

    ClassificationResult classify(WebhookEvent event, Provider provider, RoutingSnapshot snapshot) {
        String eventType = event.eventType();
        if (eventType == null) {
            return ClassificationResult.discard(provider, "missing-event-type");
        }
        if (provider.isCommentEvent(eventType) && !provider.supportsCommentTrigger()) {
            return ClassificationResult.discard(provider, "comment-trigger-unsupported");
        }

        ProviderRouting routing = snapshot.forProvider(provider);
        Map<String, Object> body = event.payload();
        Map<String, String> headers = event.getHeaders();

        ClassificationResult build = firstMatch(provider, EventCategory.BUILD, routing.buildRules(), body, headers);
        if (build != null) {
            return build;
        }
        ClassificationResult review = firstMatch(provider, EventCategory.REVIEW, routing.reviewRules(), body, headers);
        if (review != null) {
            return review;
        }

        log.debug("No rule matched: provider={}, eventType={}", provider, eventType);
        return ClassificationResult.discard(provider, "no-rule-matched");
    }

    private ClassificationResult firstMatch(Provider provider, EventCategory category, List<NamedCondition> rules,
                                            Map<String, Object> body, Map<String, String> headers) {
        for (NamedCondition rule : rules) {
            if (rule.condition().matches(body, headers)) {
                return new ClassificationResult(category,
                        RoutingConfigService.ruleId(provider, category, rule.name()));
            }
        }
        return null;
    }
}
