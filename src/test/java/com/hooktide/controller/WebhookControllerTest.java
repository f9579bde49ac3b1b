package com.hooktide.controller;

import com.hooktide.TestEvents;
import com.hooktide.config.HooktideProperties;
import com.hooktide.dto.WebhookResponse;
import com.hooktide.exception.AuthException;
import com.hooktide.exception.ChainCancelledException;
import com.hooktide.exception.DeliveryInProgressException;
import com.hooktide.exception.DispatchException;
import com.hooktide.exception.EnrichmentException;
import com.hooktide.exception.MalformedPayloadException;
import com.hooktide.exception.ResolutionException;
import com.hooktide.model.CancellationToken;
import com.hooktide.model.ClassificationResult;
import com.hooktide.model.DispatchAck;
import com.hooktide.model.DispatchRequest;
import com.hooktide.model.EventCategory;
import com.hooktide.model.Provider;
import com.hooktide.model.RoutingOutcome;
import com.hooktide.model.Stage;
import com.hooktide.model.WebhookEvent;
import com.hooktide.service.WebhookRouter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.context.request.async.DeferredResult;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class WebhookControllerTest {

    @Mock
    private WebhookRouter router;

    private WebhookController controller;

    @BeforeEach
    void setUp() {
        controller = new WebhookController(router, Runnable::run, new HooktideProperties(), TestEvents.JSON);
    }

    private static HttpHeaders headers(Provider provider, String eventType) {
        HttpHeaders headers = new HttpHeaders();
        TestEvents.baseHeaders(provider, eventType).forEach(headers::add);
        return headers;
    }

    @SuppressWarnings("unchecked")
    private static ResponseEntity<WebhookResponse> resultOf(DeferredResult<ResponseEntity<WebhookResponse>> result) {
        assertTrue(result.hasResult());
        return (ResponseEntity<WebhookResponse>) result.getResult();
    }

    @Nested
    @DisplayName("Receiving webhooks")
    class ReceiveTests {

        @Test
        @DisplayName("dispatched event answers 200 with target and ack")
        void dispatched_shouldReturn200() {
            when(router.route(any(WebhookEvent.class), any(CancellationToken.class))).thenAnswer(invocation -> {
                WebhookEvent event = invocation.getArgument(0);
                return RoutingOutcome.dispatched(event,
                        new ClassificationResult(EventCategory.BUILD, "github/build/merged-pull-request"),
                        new DispatchRequest("svc-a-build-42", Map.of(), Map.of()),
                        new DispatchAck("run-1001", Instant.now()));
            });

            ResponseEntity<WebhookResponse> response = resultOf(controller.receive("github",
                    headers(Provider.GITHUB, "pull_request"), TestEvents.payload("github-pr-merged.json")));

            assertEquals(HttpStatus.OK, response.getStatusCode());
            assertEquals(WebhookResponse.DISPATCHED, response.getBody().getStatus());
            assertEquals("svc-a-build-42", response.getBody().getTarget());
            assertEquals("run-1001", response.getBody().getAck());
            assertEquals("build", response.getBody().getCategory());
            assertEquals("delivery-github", response.getBody().getDeliveryId());
        }

        @Test
        @DisplayName("discarded event answers 200 without a target")
        void discarded_shouldReturn200() {
            when(router.route(any(WebhookEvent.class), any(CancellationToken.class))).thenAnswer(invocation ->
                    RoutingOutcome.discarded(invocation.getArgument(0),
                            ClassificationResult.discard(Provider.GITLAB, "no-rule-matched")));

            ResponseEntity<WebhookResponse> response = resultOf(controller.receive("gitlab",
                    headers(Provider.GITLAB, "Push Hook"), "{}".getBytes()));

            assertEquals(HttpStatus.OK, response.getStatusCode());
            assertEquals(WebhookResponse.DISCARDED, response.getBody().getStatus());
            assertNull(response.getBody().getTarget());
        }

        @Test
        @DisplayName("unknown provider answers 404 without routing")
        void unknownProvider_shouldReturn404() {
            ResponseEntity<WebhookResponse> response = resultOf(controller.receive("svn",
                    new HttpHeaders(), "{}".getBytes()));

            assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
            assertEquals("UNKNOWN_PROVIDER", response.getBody().getErrorKind());
            verifyNoInteractions(router);
        }

        @Test
        @DisplayName("provider is detected from headers on the generic endpoint")
        void detectProvider_shouldPreferGitea() {
            when(router.route(any(WebhookEvent.class), any(CancellationToken.class))).thenAnswer(invocation ->
                    RoutingOutcome.duplicateOf(invocation.getArgument(0)));
            HttpHeaders headers = headers(Provider.GITEA, "pull_request");
            headers.add("X-GitHub-Event", "pull_request");

            ResponseEntity<WebhookResponse> response = resultOf(controller.receiveDetected(headers, "{}".getBytes()));

            ArgumentCaptor<WebhookEvent> captor = ArgumentCaptor.forClass(WebhookEvent.class);
            verify(router).route(captor.capture(), any(CancellationToken.class));
            assertEquals(Provider.GITEA, captor.getValue().getProvider());
            assertEquals(WebhookResponse.DUPLICATE, response.getBody().getStatus());
        }

        @Test
        @DisplayName("delivery that waited past the start budget is refused without routing")
        void queuedTooLong_shouldReturn503WithoutRouting() {
            HooktideProperties tight = new HooktideProperties();
            tight.getRegistry().setTimeout(Duration.ofMillis(100));
            tight.getEngine().setTimeout(Duration.ofMillis(100));
            tight.getExecutor().setRequestTimeout(Duration.ofMillis(300));
            WebhookController slowQueue = new WebhookController(router, task -> {
                try {
                    Thread.sleep(250);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException(e);
                }
                task.run();
            }, tight, TestEvents.JSON);

            ResponseEntity<WebhookResponse> response = resultOf(slowQueue.receive("github",
                    headers(Provider.GITHUB, "pull_request"), "{}".getBytes()));

            assertEquals(HttpStatus.SERVICE_UNAVAILABLE, response.getStatusCode());
            assertEquals("OVERLOADED", response.getBody().getErrorKind());
            verifyNoInteractions(router);
        }

        @Test
        @DisplayName("saturated executor answers 503")
        void saturatedExecutor_shouldReturn503() {
            WebhookController saturated = new WebhookController(router, task -> {
                throw new RejectedExecutionException("queue full");
            }, new HooktideProperties(), TestEvents.JSON);

            ResponseEntity<WebhookResponse> response = resultOf(saturated.receive("github",
                    headers(Provider.GITHUB, "pull_request"), "{}".getBytes()));

            assertEquals(HttpStatus.SERVICE_UNAVAILABLE, response.getStatusCode());
            assertEquals("OVERLOADED", response.getBody().getErrorKind());
        }
    }

    @Nested
    @DisplayName("Failure status codes")
    class StatusTests {

        @Test
        @DisplayName("router failures carry stage and error kind")
        void failure_shouldCarryStage() {
            WebhookEvent event = TestEvents.signed(Provider.GITHUB, "pull_request", "github-pr-merged.json");
            when(router.route(any(WebhookEvent.class), any(CancellationToken.class)))
                    .thenThrow(new EnrichmentException(EnrichmentException.Kind.TIMEOUT, "slow"));

            ResponseEntity<WebhookResponse> response = controller.process(event, new CancellationToken());

            assertEquals(HttpStatus.GATEWAY_TIMEOUT, response.getStatusCode());
            assertEquals("ENRICH", response.getBody().getStage());
            assertEquals("TIMEOUT", response.getBody().getErrorKind());
            assertEquals(WebhookResponse.FAILED, response.getBody().getStatus());
        }

        @Test
        @DisplayName("each failure kind maps to its status")
        void statusFor_mapping() {
            assertEquals(HttpStatus.UNAUTHORIZED, WebhookController.statusFor(
                    new AuthException(AuthException.Reason.INVALID_SIGNATURE, "x")));
            assertEquals(HttpStatus.UNAUTHORIZED, WebhookController.statusFor(
                    new AuthException(AuthException.Reason.MISSING_SIGNATURE, "x")));
            assertEquals(HttpStatus.FORBIDDEN, WebhookController.statusFor(
                    new AuthException(AuthException.Reason.SECRET_NOT_CONFIGURED, "x")));
            assertEquals(HttpStatus.BAD_REQUEST, WebhookController.statusFor(new MalformedPayloadException("x")));
            assertEquals(HttpStatus.NOT_FOUND, WebhookController.statusFor(
                    new EnrichmentException(EnrichmentException.Kind.NOT_FOUND, "x")));
            assertEquals(HttpStatus.BAD_GATEWAY, WebhookController.statusFor(
                    new EnrichmentException(EnrichmentException.Kind.TRANSPORT_FAILURE, "x")));
            assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, WebhookController.statusFor(
                    new ResolutionException(ResolutionException.Kind.NO_TARGET_CONFIGURED, "x")));
            assertEquals(HttpStatus.BAD_GATEWAY, WebhookController.statusFor(
                    new DispatchException(DispatchException.Kind.REJECTED, "x", null)));
            assertEquals(HttpStatus.SERVICE_UNAVAILABLE, WebhookController.statusFor(
                    new ChainCancelledException(Stage.DISPATCH, "gone")));
            assertEquals(HttpStatus.CONFLICT, WebhookController.statusFor(
                    new DeliveryInProgressException("delivery-github")));
        }

        @Test
        @DisplayName("delivery still being routed answers 409 so the provider retries it")
        void inFlightDelivery_shouldReturn409() {
            when(router.route(any(WebhookEvent.class), any(CancellationToken.class)))
                    .thenThrow(new DeliveryInProgressException("delivery-github"));

            ResponseEntity<WebhookResponse> response = resultOf(controller.receive("github",
                    headers(Provider.GITHUB, "pull_request"), "{}".getBytes()));

            assertEquals(HttpStatus.CONFLICT, response.getStatusCode());
            assertEquals("IN_PROGRESS", response.getBody().getErrorKind());
            assertEquals("DEDUPLICATE", response.getBody().getStage());
        }

        @Test
        @DisplayName("unexpected exception answers 500 without leaking details")
        void unexpected_shouldReturn500() {
            WebhookEvent event = TestEvents.signed(Provider.GITHUB, "pull_request", "github-pr-merged.json");
            when(router.route(any(WebhookEvent.class), any(CancellationToken.class)))
                    .thenThrow(new IllegalStateException("secret internals"));

            ResponseEntity<WebhookResponse> response = controller.process(event, new CancellationToken());

            assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
            assertEquals("Internal routing error", response.getBody().getMessage());
        }
    }
}
