package com.hooktide.service;

import com.hooktide.TestEvents;
import com.hooktide.exception.MalformedPayloadException;
import com.hooktide.model.ClassificationResult;
import com.hooktide.model.EnrichmentRecord;
import com.hooktide.model.EventCategory;
import com.hooktide.model.ParameterSet;
import com.hooktide.model.Provider;
import com.hooktide.model.Stage;
import com.hooktide.model.WebhookEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class BindingResolverTest {

    private static final EnrichmentRecord SVC_A = new EnrichmentRecord("svc-a",
            Map.of(EventCategory.BUILD, "svc-a-build-42", EventCategory.REVIEW, "svc-a-review-7"), 12);

    private BindingResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new BindingResolver(new PayloadFieldExtractor());
    }

    private static ClassificationResult build(Provider provider) {
        return new ClassificationResult(EventCategory.BUILD, provider.pathSegment() + "/build/rule");
    }

    private static ClassificationResult review(Provider provider) {
        return new ClassificationResult(EventCategory.REVIEW, provider.pathSegment() + "/review/rule");
    }

    @Nested
    @DisplayName("Payload fields per provider")
    class PayloadFieldTests {

        @Test
        @DisplayName("GitHub merge binds the merge commit and target branch")
        void githubMerge() {
            WebhookEvent event = TestEvents.signed(Provider.GITHUB, "pull_request", "github-pr-merged.json");
            ParameterSet params = resolver.bind(event, SVC_A, build(Provider.GITHUB));

            assertEquals(Optional.of("https://github.com/Acme/svc-a.git"), params.body(BindingResolver.REPOSITORY_URL));
            assertEquals(Optional.of("9f1c2e7a4b8d6f0e3c5a7b9d1e2f4a6c8b0d2e4f"), params.body(BindingResolver.REVISION));
            assertEquals(Optional.of("main"), params.body(BindingResolver.BRANCH));
            assertEquals(Optional.of("42"), params.body(BindingResolver.CHANGE_NUMBER));
            assertEquals(Optional.of("octo-maintainer"), params.body(BindingResolver.ACTOR));
            assertEquals(Optional.of("pull_request"), params.body(BindingResolver.EVENT_TYPE));
        }

        @Test
        @DisplayName("GitHub opened pull request binds the head commit and source branch")
        void githubReview() {
            WebhookEvent event = TestEvents.signed(Provider.GITHUB, "pull_request", "github-pr-opened.json");
            ParameterSet params = resolver.bind(event, SVC_A, review(Provider.GITHUB));

            assertEquals(Optional.of("abcdefabcdefabcdefabcdefabcdefabcdefabcd"), params.body(BindingResolver.REVISION));
            assertEquals(Optional.of("feature/search"), params.body(BindingResolver.BRANCH));
            assertEquals(Optional.of("main"), params.body(BindingResolver.TARGET_BRANCH));
        }

        @Test
        @DisplayName("GitHub recheck comment binds the pull request ref and no branch")
        void githubComment() {
            WebhookEvent event = TestEvents.signed(Provider.GITHUB, "issue_comment", "github-issue-comment-recheck.json");
            ParameterSet params = resolver.bind(event, SVC_A, review(Provider.GITHUB));

            assertEquals(Optional.of("refs/pull/7/head"), params.body(BindingResolver.REVISION));
            assertTrue(params.body(BindingResolver.BRANCH).isEmpty());
            assertEquals(Optional.of("octo-reviewer"), params.body(BindingResolver.ACTOR));
        }

        @Test
        @DisplayName("GitLab merge and note bind from their own payload shapes")
        void gitlab() {
            ParameterSet merged = resolver.bind(
                    TestEvents.signed(Provider.GITLAB, "Merge Request Hook", "gitlab-mr-merged.json"),
                    SVC_A, build(Provider.GITLAB));
            assertEquals(Optional.of("aaaabbbbccccddddeeeeffff0000111122223333"), merged.body(BindingResolver.REVISION));
            assertEquals(Optional.of("master"), merged.body(BindingResolver.BRANCH));
            assertEquals(Optional.of("12"), merged.body(BindingResolver.CHANGE_NUMBER));

            ParameterSet note = resolver.bind(
                    TestEvents.signed(Provider.GITLAB, "Note Hook", "gitlab-note-recheck.json"),
                    SVC_A, review(Provider.GITLAB));
            assertEquals(Optional.of("1234512345123451234512345123451234512345"), note.body(BindingResolver.REVISION));
            assertEquals(Optional.of("feature/metrics"), note.body(BindingResolver.BRANCH));
            assertEquals(Optional.of("gl-reviewer"), note.body(BindingResolver.ACTOR));
        }

        @Test
        @DisplayName("Bitbucket fulfilled pull request binds the merge commit")
        void bitbucket() {
            ParameterSet params = resolver.bind(
                    TestEvents.signed(Provider.BITBUCKET, "pullrequest:fulfilled", "bitbucket-pr-fulfilled.json"),
                    SVC_A, build(Provider.BITBUCKET));
            assertEquals(Optional.of("m3m3m3m3m3m3"), params.body(BindingResolver.REVISION));
            assertEquals(Optional.of("https://bitbucket.org/acme/svc-c"), params.body(BindingResolver.REPOSITORY_URL));
            assertEquals(Optional.of("bb-maintainer"), params.body(BindingResolver.ACTOR));
        }
    }

    @Nested
    @DisplayName("Field set per payload shape")
    class FieldSetTests {

        private final PayloadFieldExtractor extractor = new PayloadFieldExtractor();

        @ParameterizedTest(name = "{0} {1} {2}")
        @CsvSource({
                "GITHUB,    pull_request,          github-pr-merged.json,             BUILD",
                "GITHUB,    pull_request,          github-pr-opened.json,             REVIEW",
                "GITHUB,    issue_comment,         github-issue-comment-recheck.json, REVIEW",
                "GITLAB,    Merge Request Hook,    gitlab-mr-merged.json,             BUILD",
                "GITLAB,    Merge Request Hook,    gitlab-mr-opened.json,             REVIEW",
                "GITLAB,    Note Hook,             gitlab-note-recheck.json,          REVIEW",
                "BITBUCKET, pullrequest:fulfilled, bitbucket-pr-fulfilled.json,       BUILD",
                "BITBUCKET, pullrequest:created,   bitbucket-pr-created.json,         REVIEW",
                "GITEA,     pull_request,          gitea-pr-merged.json,              BUILD",
                "GITEA,     pull_request,          gitea-pr-opened.json,              REVIEW",
                "GITEA,     issue_comment,         gitea-issue-comment-recheck.json,  REVIEW"
        })
        @DisplayName("bound body fields are exactly the fields the payload shape declares")
        void boundFields_matchDeclaredFields(Provider provider, String eventType, String payload,
                                             EventCategory category) {
            WebhookEvent event = TestEvents.signed(provider, eventType, payload);
            ParameterSet params = resolver.bind(event, SVC_A,
                    new ClassificationResult(category, provider.pathSegment() + "/" + category.key() + "/rule"));

            assertEquals(new HashSet<>(extractor.fieldsFor(provider, eventType)), params.bodyFields().keySet());
        }

        @Test
        @DisplayName("comment events on GitHub and Gitea declare no branches")
        void commentEvents_declareNoBranches() {
            for (Provider provider : List.of(Provider.GITHUB, Provider.GITEA)) {
                List<String> fields = extractor.fieldsFor(provider, "issue_comment");
                assertFalse(fields.contains(BindingResolver.BRANCH), provider + " comment declares a branch");
                assertFalse(fields.contains(BindingResolver.TARGET_BRANCH));
                assertTrue(fields.contains(BindingResolver.REVISION));
            }
            assertTrue(extractor.fieldsFor(Provider.GITLAB, "Note Hook").contains(BindingResolver.BRANCH));
            assertTrue(extractor.fieldsFor(Provider.GITHUB, "pull_request").contains(BindingResolver.TARGET_BRANCH));
        }
    }

    @Nested
    @DisplayName("Namespaces")
    class NamespaceTests {

        @Test
        @DisplayName("enrichment lands under extensions and never replaces a payload field")
        void payloadAndEnrichment_doNotCollide() {
            // A payload that carries its own "resourceId" must not leak into the enrichment namespace
            String json = "{\"resourceId\":\"from-payload\",\"action\":\"opened\","
                    + "\"pull_request\":{\"number\":1,\"head\":{\"sha\":\"abc\",\"ref\":\"f\"},\"base\":{\"ref\":\"main\"}},"
                    + "\"repository\":{\"clone_url\":\"https://github.com/acme/svc-a.git\"}}";
            WebhookEvent event = TestEvents.signed(Provider.GITHUB, "pull_request", json.getBytes(StandardCharsets.UTF_8));

            ParameterSet params = resolver.bind(event, SVC_A, review(Provider.GITHUB));

            assertEquals(Optional.of("svc-a"), params.extension(BindingResolver.RESOURCE_ID));
            assertEquals(Optional.of("svc-a-build-42"), params.extension("targets.build"));
            assertEquals(Optional.of("svc-a-review-7"), params.extension("targets.review"));
            assertEquals(Optional.of("12"), params.extension(BindingResolver.LOOKUP_LATENCY_MS));
            assertEquals(Optional.of("review"), params.extension(BindingResolver.CATEGORY));
            assertEquals(Optional.of("github"), params.extension(BindingResolver.PROVIDER));
            assertEquals(Optional.of("delivery-github"), params.extension(BindingResolver.DELIVERY_ID));
            assertTrue(params.body(BindingResolver.RESOURCE_ID).isEmpty());
            assertEquals("abc", params.flatten().get("body.revision"));
            assertEquals("svc-a", params.flatten().get("extensions.resourceId"));
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("missing revision fails binding")
        void missingRevision_shouldThrow() {
            String json = "{\"action\":\"opened\",\"pull_request\":{\"number\":1},"
                    + "\"repository\":{\"clone_url\":\"https://github.com/acme/svc-a.git\"}}";
            WebhookEvent event = TestEvents.signed(Provider.GITHUB, "pull_request", json.getBytes(StandardCharsets.UTF_8));

            MalformedPayloadException ex = assertThrows(MalformedPayloadException.class,
                    () -> resolver.bind(event, SVC_A, review(Provider.GITHUB)));
            assertEquals(Stage.BIND, ex.getStage());
        }

        @Test
        @DisplayName("discarded events cannot be bound")
        void discard_shouldThrow() {
            WebhookEvent event = TestEvents.signed(Provider.GITHUB, "pull_request", "github-pr-opened.json");
            assertThrows(IllegalArgumentException.class,
                    () -> resolver.bind(event, SVC_A, ClassificationResult.discard(Provider.GITHUB, "x")));
        }
    }
}
