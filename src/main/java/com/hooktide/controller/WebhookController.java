package com.hooktide.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hooktide.config.HooktideProperties;
import com.hooktide.dto.WebhookResponse;
import com.hooktide.exception.AuthException;
import com.hooktide.exception.ChainCancelledException;
import com.hooktide.exception.DeliveryInProgressException;
import com.hooktide.exception.DispatchException;
import com.hooktide.exception.EnrichmentException;
import com.hooktide.exception.MalformedPayloadException;
import com.hooktide.exception.ResolutionException;
import com.hooktide.exception.RouterException;
import com.hooktide.model.CancellationToken;
import com.hooktide.model.Provider;
import com.hooktide.model.RoutingOutcome;
import com.hooktide.model.WebhookEvent;
import com.hooktide.service.RoutingConfigService;
import com.hooktide.service.WebhookRouter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.context.request.async.DeferredResult;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Ingestion endpoint for VCS webhooks.
 *
 * POST /api/webhooks/{provider}   provider = github | gitlab | bitbucket | gitea
 * POST /api/webhooks              provider detected from the event header
 *
 * The chain runs on the webhook executor; the servlet thread only waits on a
 * DeferredResult. If the provider disconnects or the request times out, the run
 * is cancelled and stops at its next stage boundary without dispatching. A run
 * that waited in the queue past {@link HooktideProperties#startBudget()} is refused
 * outright, since it could still be dispatching when the request times out.
 *
 * Status codes:
 *   200 dispatched / discarded / duplicate
 *   400 malformed payload       401 bad or missing signature
 *   403 provider disabled or no secret configured
 *   404 unknown provider, or repository not in the registry
 *   409 same delivery still being routed
 *   500 no target configured    502 registry or engine failure
 *   503 overloaded or cancelled 504 registry timeout
 */
@RestController
@RequestMapping("/api/webhooks")
@Slf4j
public class WebhookController {

    private final WebhookRouter router;
    private final Executor webhookExecutor;
    private final HooktideProperties properties;
    private final ObjectMapper objectMapper;

    public WebhookController(WebhookRouter router,
                             @Qualifier("webhookExecutor") Executor webhookExecutor,
                             HooktideProperties properties,
                             ObjectMapper objectMapper) {
        this.router = router;
        this.webhookExecutor = webhookExecutor;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @PostMapping("/{provider}")
    public DeferredResult<ResponseEntity<WebhookResponse>> receive(
            @PathVariable("provider") String provider,
            @RequestHeader HttpHeaders headers,
            @RequestBody(required = false) byte[] body) {
        return handle(Provider.fromPathSegment(provider), provider, headers, body);
    }

    @PostMapping
    public DeferredResult<ResponseEntity<WebhookResponse>> receiveDetected(
            @RequestHeader HttpHeaders headers,
            @RequestBody(required = false) byte[] body) {
        Map<String, String> single = caseInsensitive(headers);
        return handle(Provider.detect(single), "<undetected>", headers, body);
    }

    private DeferredResult<ResponseEntity<WebhookResponse>> handle(Optional<Provider> provider, String requested,
                                                                   HttpHeaders headers, byte[] body) {
        DeferredResult<ResponseEntity<WebhookResponse>> result =
                new DeferredResult<>(properties.getExecutor().getRequestTimeout().toMillis());

        if (provider.isEmpty()) {
            result.setResult(ResponseEntity.status(HttpStatus.NOT_FOUND).body(WebhookResponse.builder()
                    .status(WebhookResponse.FAILED)
                    .errorKind("UNKNOWN_PROVIDER")
                    .message("Unknown provider '" + requested + "', expected one of "
                            + RoutingConfigService.providerNames())
                    .build()));
            return result;
        }

        WebhookEvent event = WebhookEvent.of(provider.get(), caseInsensitive(headers), body, objectMapper);
        CancellationToken cancellation = new CancellationToken();

        result.onTimeout(() -> {
            cancellation.cancel("request timed out");
            result.setErrorResult(failure(HttpStatus.SERVICE_UNAVAILABLE, event, null, "TIMEOUT",
                    "Routing did not finish in time"));
        });
        result.onError(error -> cancellation.cancel("client disconnected"));

        long queuedAt = System.nanoTime();
        long startBudgetNanos = properties.startBudget().toNanos();
        try {
            webhookExecutor.execute(() -> {
                if (System.nanoTime() - queuedAt > startBudgetNanos) {
                    log.warn("Delivery {} waited too long in the queue, refusing it", event.getDeliveryId());
                    cancellation.cancel("queued past start budget");
                    result.setResult(failure(HttpStatus.SERVICE_UNAVAILABLE, event, null, "OVERLOADED",
                            "Router is at capacity, retry later"));
                    return;
                }
                result.setResult(process(event, cancellation));
            });
        } catch (RejectedExecutionException e) {
            log.warn("Webhook executor saturated, refusing delivery {}", event.getDeliveryId());
            result.setResult(failure(HttpStatus.SERVICE_UNAVAILABLE, event, null, "OVERLOADED",
                    "Router is at capacity, retry later"));
        }
        return result;
    }

    ResponseEntity<WebhookResponse> process(WebhookEvent event, CancellationToken cancellation) {
        try {
            return ResponseEntity.ok(toResponse(router.route(event, cancellation)));
        } catch (RouterException e) {
            return failure(statusFor(e), event, e.getStage().name(), e.getErrorKind(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unhandled routing failure for delivery {}: {}", event.getDeliveryId(), e.getMessage(), e);
            return failure(HttpStatus.INTERNAL_SERVER_ERROR, event, null, "INTERNAL", "Internal routing error");
        }
    }

    static HttpStatus statusFor(RouterException e) {
        if (e instanceof AuthException auth) {
            return switch (auth.getReason()) {
                case MISSING_SIGNATURE, INVALID_SIGNATURE -> HttpStatus.UNAUTHORIZED;
                case SECRET_NOT_CONFIGURED, PROVIDER_DISABLED -> HttpStatus.FORBIDDEN;
            };
        }
        if (e instanceof MalformedPayloadException) {
            return HttpStatus.BAD_REQUEST;
        }
        if (e instanceof EnrichmentException enrichment) {
            return switch (enrichment.getKind()) {
                case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
                case TRANSPORT_FAILURE -> HttpStatus.BAD_GATEWAY;
                case NOT_FOUND -> HttpStatus.NOT_FOUND;
            };
        }
        if (e instanceof ResolutionException) {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
        if (e instanceof DispatchException) {
            return HttpStatus.BAD_GATEWAY;
        }
        if (e instanceof DeliveryInProgressException) {
            return HttpStatus.CONFLICT;
        }
        if (e instanceof ChainCancelledException) {
            return HttpStatus.SERVICE_UNAVAILABLE;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    // --- Mapping helpers ---

    private WebhookResponse toResponse(RoutingOutcome outcome) {
        WebhookResponse.WebhookResponseBuilder response = WebhookResponse.builder()
                .deliveryId(outcome.deliveryId())
                .provider(outcome.provider().pathSegment());
        if (outcome.duplicate()) {
            return response.status(WebhookResponse.DUPLICATE).build();
        }
        response.category(outcome.classification().category().key())
                .matchedRule(outcome.classification().matchedRule());
        if (!outcome.isDispatched()) {
            return response.status(WebhookResponse.DISCARDED).build();
        }
        return response.status(WebhookResponse.DISPATCHED)
                .target(outcome.request().target())
                .ack(outcome.ack().token())
                .build();
    }

    private ResponseEntity<WebhookResponse> failure(HttpStatus status, WebhookEvent event, String stage,
                                                    String errorKind, String message) {
        return ResponseEntity.status(status).body(WebhookResponse.builder()
                .status(WebhookResponse.FAILED)
                .deliveryId(event.getDeliveryId())
                .provider(event.getProvider().pathSegment())
                .stage(stage)
                .errorKind(errorKind)
                .message(message)
                .build());
    }

    private static Map<String, String> caseInsensitive(HttpHeaders headers) {
        Map<String, String> single = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        single.putAll(headers.toSingleValueMap());
        return single;
    }
}
