package com.hooktide.model;

/**
 * Output of the classifier.
 *
 * matchedRule is "provider/category/rule-name" when a filter matched, or a
 * "provider/discard/reason" identifier otherwise. Only used for diagnostics.
 */
public record ClassificationResult(EventCategory category, String matchedRule) {

    public static ClassificationResult discard(Provider provider, String reason) {
        return new ClassificationResult(EventCategory.DISCARD,
                provider.pathSegment() + "/discard/" + reason);
    }

    public boolean isDiscard() {
        return category == EventCategory.DISCARD;
    }
}
