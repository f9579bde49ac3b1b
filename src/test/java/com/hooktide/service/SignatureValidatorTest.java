package com.hooktide.service;

import com.hooktide.TestEvents;
import com.hooktide.config.HooktideProperties;
import com.hooktide.exception.AuthException;
import com.hooktide.model.Provider;
import com.hooktide.model.WebhookEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SignatureValidatorTest {

    private HooktideProperties properties;
    private SignatureValidator validator;

    @BeforeEach
    void setUp() {
        properties = TestEvents.propertiesWithSecrets();
        validator = new SignatureValidator(TestEvents.routing(properties));
    }

    private static AuthException.Reason reasonOf(Runnable call) {
        AuthException ex = assertThrows(AuthException.class, call::run);
        return ex.getReason();
    }

    @Nested
    @DisplayName("Valid deliveries")
    class ValidTests {

        @ParameterizedTest
        @EnumSource(Provider.class)
        @DisplayName("correctly signed delivery passes for every provider")
        void signedDelivery_shouldPass(Provider provider) {
            WebhookEvent event = TestEvents.signed(provider, "push", "{\"a\":1}".getBytes(StandardCharsets.UTF_8));
            assertDoesNotThrow(() -> validator.validate(event));
        }

        @Test
        @DisplayName("signature prefix and hex digits are matched case-insensitively")
        void upperCaseSignature_shouldPass() {
            byte[] body = TestEvents.payload("github-pr-merged.json");
            Map<String, String> headers = TestEvents.baseHeaders(Provider.GITHUB, "pull_request");
            headers.put("X-Hub-Signature-256", "SHA256=" + TestEvents.hmacHex(body, TestEvents.SECRET).toUpperCase());
            assertDoesNotThrow(() -> validator.validate(WebhookEvent.of(Provider.GITHUB, headers, body, TestEvents.JSON)));
        }

        @Test
        @DisplayName("signature header name is matched case-insensitively")
        void lowerCaseHeaderName_shouldPass() {
            byte[] body = TestEvents.payload("gitea-pr-opened.json");
            Map<String, String> headers = TestEvents.baseHeaders(Provider.GITEA, "pull_request");
            headers.put("x-gitea-signature", TestEvents.hmacHex(body, TestEvents.SECRET));
            assertDoesNotThrow(() -> validator.validate(WebhookEvent.of(Provider.GITEA, headers, body, TestEvents.JSON)));
        }
    }

    @Nested
    @DisplayName("Rejected deliveries")
    class RejectedTests {

        @Test
        @DisplayName("GitHub delivery with a forged signature is rejected")
        void forgedSignature_shouldBeRejected() {
            byte[] body = TestEvents.payload("github-pr-merged.json");
            Map<String, String> headers = TestEvents.baseHeaders(Provider.GITHUB, "pull_request");
            headers.put("X-Hub-Signature-256", "sha256=" + TestEvents.hmacHex(body, "not-the-secret"));

            assertEquals(AuthException.Reason.INVALID_SIGNATURE,
                    reasonOf(() -> validator.validate(WebhookEvent.of(Provider.GITHUB, headers, body, TestEvents.JSON))));
        }

        @Test
        @DisplayName("a body modified after signing is rejected")
        void tamperedBody_shouldBeRejected() {
            byte[] body = TestEvents.payload("github-pr-merged.json");
            Map<String, String> headers = TestEvents.baseHeaders(Provider.GITHUB, "pull_request");
            headers.put("X-Hub-Signature-256", TestEvents.signatureFor(Provider.GITHUB, body, TestEvents.SECRET));
            byte[] tampered = new String(body, StandardCharsets.UTF_8)
                    .replace("main", "evil").getBytes(StandardCharsets.UTF_8);

            assertEquals(AuthException.Reason.INVALID_SIGNATURE,
                    reasonOf(() -> validator.validate(WebhookEvent.of(Provider.GITHUB, headers, tampered, TestEvents.JSON))));
        }

        @Test
        @DisplayName("missing signature header is rejected")
        void missingSignature_shouldBeRejected() {
            WebhookEvent event = TestEvents.unsigned(Provider.BITBUCKET, "pullrequest:fulfilled",
                    TestEvents.payload("bitbucket-pr-fulfilled.json"));
            assertEquals(AuthException.Reason.MISSING_SIGNATURE, reasonOf(() -> validator.validate(event)));
        }

        @Test
        @DisplayName("signature without the sha256= prefix is rejected for GitHub")
        void missingPrefix_shouldBeRejected() {
            byte[] body = TestEvents.payload("github-pr-opened.json");
            Map<String, String> headers = TestEvents.baseHeaders(Provider.GITHUB, "pull_request");
            headers.put("X-Hub-Signature-256", TestEvents.hmacHex(body, TestEvents.SECRET));
            assertEquals(AuthException.Reason.INVALID_SIGNATURE,
                    reasonOf(() -> validator.validate(WebhookEvent.of(Provider.GITHUB, headers, body, TestEvents.JSON))));
        }

        @Test
        @DisplayName("wrong GitLab token is rejected")
        void wrongToken_shouldBeRejected() {
            byte[] body = TestEvents.payload("gitlab-mr-merged.json");
            Map<String, String> headers = TestEvents.baseHeaders(Provider.GITLAB, "Merge Request Hook");
            headers.put("X-Gitlab-Token", "guess");
            assertEquals(AuthException.Reason.INVALID_SIGNATURE,
                    reasonOf(() -> validator.validate(WebhookEvent.of(Provider.GITLAB, headers, body, TestEvents.JSON))));
        }

        @Test
        @DisplayName("provider without a configured secret refuses everything")
        void noSecret_shouldBeRejected() {
            properties.getProviders().get(Provider.GITHUB).setSecret("");
            SignatureValidator unconfigured = new SignatureValidator(TestEvents.routing(properties));
            WebhookEvent event = TestEvents.signed(Provider.GITHUB, "pull_request", "github-pr-merged.json");

            assertEquals(AuthException.Reason.SECRET_NOT_CONFIGURED, reasonOf(() -> unconfigured.validate(event)));
        }

        @Test
        @DisplayName("disabled provider refuses everything")
        void disabledProvider_shouldBeRejected() {
            properties.getProviders().get(Provider.GITEA).setEnabled(false);
            SignatureValidator restricted = new SignatureValidator(TestEvents.routing(properties));
            WebhookEvent event = TestEvents.signed(Provider.GITEA, "pull_request", "gitea-pr-opened.json");

            assertEquals(AuthException.Reason.PROVIDER_DISABLED, reasonOf(() -> restricted.validate(event)));
        }
    }

    @Test
    @DisplayName("computeHmac matches a known HMAC-SHA256 vector")
    void computeHmac_knownVector() {
        // RFC 4231 test case 2
        String hex = SignatureValidator.computeHmac(
                "what do ya want for nothing?".getBytes(StandardCharsets.UTF_8), "Jefe");
        assertEquals("5bdcc146bf60754e6a042426089575c75a003f089d2739839dec58b964ec3843", hex);
    }
}
