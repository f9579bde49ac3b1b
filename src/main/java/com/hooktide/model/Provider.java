package com.hooktide.model;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;

/**
 * The closed set of VCS providers the router accepts webhooks from.
 *
 * Each constant carries its capability table instead of a subclass per provider:
 *   - which header names the event type
 *   - how deliveries are authenticated (HMAC or plain token)
 *   - whether a comment can re-trigger a review ("/recheck")
 *   - which event type is the comment event
 *   - which header carries the provider's delivery id
 *
 * Bitbucket is the one provider without comment-trigger support; GitLab is the one
 * without native signing (it echoes a configured token instead).
 */
public enum Provider {

    GITHUB("github", "X-GitHub-Event", SignatureScheme.HMAC_SHA256,
            "X-Hub-Signature-256", "sha256=", true, "issue_comment", "X-GitHub-Delivery"),

    GITLAB("gitlab", "X-Gitlab-Event", SignatureScheme.TOKEN,
            "X-Gitlab-Token", "", true, "Note Hook", "X-Gitlab-Event-UUID"),

    BITBUCKET("bitbucket", "X-Event-Key", SignatureScheme.HMAC_SHA256,
            "X-Hub-Signature", "sha256=", false, "pullrequest:comment_created", "X-Request-UUID"),

    GITEA("gitea", "X-Gitea-Event", SignatureScheme.HMAC_SHA256,
            "X-Gitea-Signature", "", true, "issue_comment", "X-Gitea-Delivery");

    // Gitea also sends X-GitHub-Event, so it has to be detected before GitHub.
    private static final Provider[] DETECTION_ORDER = {GITEA, GITHUB, GITLAB, BITBUCKET};

    private final String pathSegment;
    private final String eventHeader;
    private final SignatureScheme signatureScheme;
    private final String signatureHeader;
    private final String signaturePrefix;
    private final boolean commentTrigger;
    private final String commentEventType;
    private final String deliveryHeader;

    Provider(String pathSegment, String eventHeader, SignatureScheme signatureScheme,
             String signatureHeader, String signaturePrefix, boolean commentTrigger,
             String commentEventType, String deliveryHeader) {
        this.pathSegment = pathSegment;
        this.eventHeader = eventHeader;
        this.signatureScheme = signatureScheme;
        this.signatureHeader = signatureHeader;
        this.signaturePrefix = signaturePrefix;
        this.commentTrigger = commentTrigger;
        this.commentEventType = commentEventType;
        this.deliveryHeader = deliveryHeader;
    }

    public String pathSegment() {
        return pathSegment;
    }

    public String eventHeader() {
        return eventHeader;
    }

    public SignatureScheme signatureScheme() {
        return signatureScheme;
    }

    public String signatureHeader() {
        return signatureHeader;
    }

    public String signaturePrefix() {
        return signaturePrefix;
    }

    public boolean supportsSignature() {
        return signatureScheme == SignatureScheme.HMAC_SHA256;
    }

    public boolean supportsCommentTrigger() {
        return commentTrigger;
    }

    public String commentEventType() {
        return commentEventType;
    }

    public String deliveryHeader() {
        return deliveryHeader;
    }

    public boolean isCommentEvent(String eventType) {
        return commentEventType.equals(eventType);
    }

    /**
     * Resolves the provider from the URL path segment ("github", "gitlab", ...).
     */
    public static Optional<Provider> fromPathSegment(String segment) {
        if (segment == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(p -> p.pathSegment.equalsIgnoreCase(segment.trim()))
                .findFirst();
    }

    /**
     * Detects the provider from the request headers. The map must be case-insensitive.
     */
    public static Optional<Provider> detect(Map<String, String> headers) {
        for (Provider provider : DETECTION_ORDER) {
            if (headers.containsKey(provider.eventHeader)) {
                return Optional.of(provider);
            }
        }
        return Optional.empty();
    }
}
