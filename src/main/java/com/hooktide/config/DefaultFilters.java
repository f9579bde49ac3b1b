package com.hooktide.config;

import com.hooktide.model.EventCategory;
import com.hooktide.model.Provider;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Built-in filter rules per provider, used when configuration defines none.
 *
 * Build → a merged change request into a tracked branch.
 * Review → a change request opened/updated/reopened, or a recheck comment on an
 * open change request (not for Bitbucket, which has no comment trigger).
 *
 * Rules reference two per-provider variables: $trackedBranches and $recheckPattern.
 */
public final class DefaultFilters {

    private DefaultFilters() {
    }

    public static Map<String, String> forProvider(Provider provider, EventCategory category) {
        Map<String, String> rules = new LinkedHashMap<>();
        switch (provider) {
            case GITHUB -> {
                if (category == EventCategory.BUILD) {
                    rules.put("merged-pull-request",
                            "header.X-GitHub-Event == 'pull_request' && body.action == 'closed'"
                                    + " && body.pull_request.merged == true"
                                    + " && body.pull_request.base.ref =~ $trackedBranches");
                } else if (category == EventCategory.REVIEW) {
                    rules.put("pull-request-updated",
                            "header.X-GitHub-Event == 'pull_request'"
                                    + " && body.action in ['opened', 'synchronize', 'reopened']");
                    rules.put("recheck-comment",
                            "header.X-GitHub-Event == 'issue_comment' && body.action == 'created'"
                                    + " && body.issue.pull_request && body.issue.state == 'open'"
                                    + " && body.comment.body =~ $recheckPattern");
                }
            }
            case GITLAB -> {
                if (category == EventCategory.BUILD) {
                    rules.put("merged-merge-request",
                            "header.X-Gitlab-Event == 'Merge Request Hook'"
                                    + " && body.object_attributes.action == 'merge'"
                                    + " && body.object_attributes.target_branch =~ $trackedBranches");
                } else if (category == EventCategory.REVIEW) {
                    rules.put("merge-request-updated",
                            "header.X-Gitlab-Event == 'Merge Request Hook'"
                                    + " && body.object_attributes.action in ['open', 'update', 'reopen']");
                    rules.put("recheck-comment",
                            "header.X-Gitlab-Event == 'Note Hook'"
                                    + " && body.object_attributes.noteable_type == 'MergeRequest'"
                                    + " && body.merge_request.state == 'opened'"
                                    + " && body.object_attributes.note =~ $recheckPattern");
                }
            }
            case BITBUCKET -> {
                if (category == EventCategory.BUILD) {
                    rules.put("fulfilled-pull-request",
                            "header.X-Event-Key == 'pullrequest:fulfilled'"
                                    + " && body.pullrequest.destination.branch.name =~ $trackedBranches");
                } else if (category == EventCategory.REVIEW) {
                    rules.put("pull-request-updated",
                            "header.X-Event-Key in ['pullrequest:created', 'pullrequest:updated']");
                }
            }
            case GITEA -> {
                if (category == EventCategory.BUILD) {
                    rules.put("merged-pull-request",
                            "header.X-Gitea-Event == 'pull_request' && body.action == 'closed'"
                                    + " && body.pull_request.merged == true"
                                    + " && body.pull_request.base.ref =~ $trackedBranches");
                } else if (category == EventCategory.REVIEW) {
                    rules.put("pull-request-updated",
                            "header.X-Gitea-Event == 'pull_request'"
                                    + " && body.action in ['opened', 'synchronized', 'reopened']");
                    rules.put("recheck-comment",
                            "header.X-Gitea-Event == 'issue_comment' && body.action == 'created'"
                                    + " && body.is_pull == true && body.issue.state == 'open'"
                                    + " && body.comment.body =~ $recheckPattern");
                }
            }
        }
        return Collections.unmodifiableMap(rules);
    }
}
