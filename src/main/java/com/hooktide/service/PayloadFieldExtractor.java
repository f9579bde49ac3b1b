package com.hooktide.service;

import com.hooktide.model.EventCategory;
import com.hooktide.model.Provider;
import com.hooktide.model.WebhookEvent;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Reads the fixed set of dispatch-relevant fields out of each provider's payload shape.
 *
 * Fields (same names for every provider; {@link #fieldsFor(Provider, String)} lists
 * the ones a given payload shape carries):
 *   repositoryUrl → clone URL of the repository
 *   revision      → merge commit for BUILD, head commit for REVIEW
 *   branch        → target branch for BUILD, source branch for REVIEW
 *   targetBranch  → branch the change request merges into
 *   changeNumber  → pull/merge request number
 *   actor         → user who triggered the event
 *   eventType     → provider event header value
 *
 * GitHub and Gitea comment payloads carry no head commit or branch; the revision is
 * then the pull request ref "refs/pull/<n>/head", which both providers serve.
 */
@Component
public class PayloadFieldExtractor {

    private static final List<String> CHANGE_REQUEST_FIELDS = List.of(
            BindingResolver.REPOSITORY_URL, BindingResolver.REVISION, BindingResolver.BRANCH,
            BindingResolver.TARGET_BRANCH, BindingResolver.CHANGE_NUMBER, BindingResolver.ACTOR,
            BindingResolver.EVENT_TYPE);

    private static final List<String> ISSUE_COMMENT_FIELDS = List.of(
            BindingResolver.REPOSITORY_URL, BindingResolver.REVISION, BindingResolver.CHANGE_NUMBER,
            BindingResolver.ACTOR, BindingResolver.EVENT_TYPE);

    /**
     * Names of the fields this provider's payload carries for the given event type.
     * Only these are ever bound; GitHub and Gitea comment payloads have no branches.
     */
    public List<String> fieldsFor(Provider provider, String eventType) {
        return switch (provider) {
            case GITHUB, GITEA -> provider.isCommentEvent(eventType) ? ISSUE_COMMENT_FIELDS : CHANGE_REQUEST_FIELDS;
            case GITLAB, BITBUCKET -> CHANGE_REQUEST_FIELDS;
        };
    }

    public String repositoryUrl(WebhookEvent event) {
        Map<String, Object> body = event.payload();
        return switch (event.getProvider()) {
            case GITHUB, GITEA -> first(body, "repository.clone_url", "repository.html_url");
            case GITLAB -> first(body, "project.git_http_url", "project.web_url", "repository.homepage");
            case BITBUCKET -> first(body, "repository.links.html.href");
        };
    }

    public PayloadFields extract(WebhookEvent event, EventCategory category) {
        Map<String, Object> body = event.payload();
        boolean build = category == EventCategory.BUILD;
        String eventType = event.eventType();
        String repositoryUrl = repositoryUrl(event);

        return switch (event.getProvider()) {
            case GITHUB, GITEA -> event.getProvider().isCommentEvent(eventType)
                    ? pullRequestComment(body, repositoryUrl, eventType)
                    : pullRequest(body, build, repositoryUrl, eventType);
            case GITLAB -> event.getProvider().isCommentEvent(eventType)
                    ? gitlabNote(body, repositoryUrl, eventType)
                    : gitlabMergeRequest(body, build, repositoryUrl, eventType);
            case BITBUCKET -> bitbucketPullRequest(body, build, repositoryUrl, eventType);
        };
    }

    // --- GitHub / Gitea ---

    private PayloadFields pullRequest(Map<String, Object> body, boolean build, String repositoryUrl, String eventType) {
        String baseRef = text(body, "pull_request.base.ref");
        return new PayloadFields(
                repositoryUrl,
                build ? first(body, "pull_request.merge_commit_sha", "pull_request.head.sha")
                        : text(body, "pull_request.head.sha"),
                build ? baseRef : text(body, "pull_request.head.ref"),
                baseRef,
                first(body, "pull_request.number", "number"),
                first(body, "sender.login", "pull_request.user.login"),
                eventType);
    }

    private PayloadFields pullRequestComment(Map<String, Object> body, String repositoryUrl, String eventType) {
        String number = text(body, "issue.number");
        return new PayloadFields(
                repositoryUrl,
                number == null ? null : "refs/pull/" + number + "/head",
                null,
                null,
                number,
                first(body, "comment.user.login", "sender.login"),
                eventType);
    }

    // --- GitLab ---

    private PayloadFields gitlabMergeRequest(Map<String, Object> body, boolean build, String repositoryUrl, String eventType) {
        String targetBranch = text(body, "object_attributes.target_branch");
        return new PayloadFields(
                repositoryUrl,
                build ? first(body, "object_attributes.merge_commit_sha", "object_attributes.last_commit.id")
                        : text(body, "object_attributes.last_commit.id"),
                build ? targetBranch : text(body, "object_attributes.source_branch"),
                targetBranch,
                text(body, "object_attributes.iid"),
                text(body, "user.username"),
                eventType);
    }

    private PayloadFields gitlabNote(Map<String, Object> body, String repositoryUrl, String eventType) {
        return new PayloadFields(
                repositoryUrl,
                text(body, "merge_request.last_commit.id"),
                text(body, "merge_request.source_branch"),
                text(body, "merge_request.target_branch"),
                text(body, "merge_request.iid"),
                text(body, "user.username"),
                eventType);
    }

    // --- Bitbucket ---

    private PayloadFields bitbucketPullRequest(Map<String, Object> body, boolean build, String repositoryUrl, String eventType) {
        String destination = text(body, "pullrequest.destination.branch.name");
        return new PayloadFields(
                repositoryUrl,
                build ? first(body, "pullrequest.merge_commit.hash", "pullrequest.destination.commit.hash")
                        : text(body, "pullrequest.source.commit.hash"),
                build ? destination : text(body, "pullrequest.source.branch.name"),
                destination,
                text(body, "pullrequest.id"),
                first(body, "actor.nickname", "actor.display_name"),
                eventType);
    }

    // --- Path helpers ---

    private static String first(Map<String, Object> body, String... paths) {
        for (String path : paths) {
            String value = text(body, path);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    static String text(Map<String, Object> body, String path) {
        Object current = body;
        for (String key : path.split("\\.")) {
            if (current instanceof Map<?, ?> map) {
                current = map.get(key);
            } else {
                return null;
            }
        }
        if (current == null || current instanceof Map || current instanceof List) {
            return null;
        }
        String value = current.toString();
        return value.isBlank() ? null : value;
    }
}
