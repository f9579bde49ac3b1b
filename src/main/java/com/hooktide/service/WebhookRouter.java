package com.hooktide.service;

import com.hooktide.exception.DeliveryInProgressException;
import com.hooktide.exception.RouterException;
import com.hooktide.model.CancellationToken;
import com.hooktide.model.ClassificationResult;
import com.hooktide.model.DispatchAck;
import com.hooktide.model.DispatchRequest;
import com.hooktide.model.EnrichmentRecord;
import com.hooktide.model.ParameterSet;
import com.hooktide.model.RoutingOutcome;
import com.hooktide.model.Stage;
import com.hooktide.model.WebhookEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

/**
 * The interceptor chain.
 *
 * FLOW:
 *   1. Validate the signature (nothing else runs on failure)
 *   2. Drop redeliveries of an already-routed delivery; refuse (409) one whose
 *      first run is still in flight, so the provider retries it later
 *   3. Classify: BUILD, REVIEW, or DISCARD (a DISCARD ends here with a no-op)
 *   4. Enrich from the resource registry (bounded, fail-closed)
 *   5. Bind payload and enrichment fields into parameters
 *   6. Resolve the dispatch target from the enrichment data
 *   7. Dispatch to the execution engine
 *
 * Stages run strictly in order. Any exception ends the run: nothing is retried
 * and nothing is partially dispatched. The cancellation token is checked before
 * every stage, so a run abandoned by its caller never reaches the engine.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WebhookRouter {

    private final SignatureValidator signatureValidator;
    private final DeliveryDeduplicator deduplicator;
    private final EventClassifier classifier;
    private final Enricher enricher;
    private final BindingResolver bindingResolver;
    private final DispatchTemplateResolver templateResolver;
    private final Dispatcher dispatcher;

    public RoutingOutcome route(WebhookEvent event, CancellationToken cancellation) {
        MDC.put("deliveryId", event.getDeliveryId());
        MDC.put("provider", event.getProvider().pathSegment());
        try {
            return runChain(event, cancellation);
        } finally {
            MDC.remove("deliveryId");
            MDC.remove("provider");
        }
    }

    private RoutingOutcome runChain(WebhookEvent event, CancellationToken cancellation) {
        log.info("Processing webhook: provider={}, eventType={}, deliveryId={}",
                event.getProvider(), event.eventType(), event.getDeliveryId());

        // Step 1: Authenticity
        cancellation.throwIfCancelled(Stage.VALIDATE);
        try {
            signatureValidator.validate(event);
        } catch (RouterException e) {
            logFailure(event, null, e);
            throw e;
        }

        // Step 2: Redelivery of something we already routed
        switch (deduplicator.claim(event)) {
            case DONE -> {
                log.info("Skipping duplicate delivery: {}", event.getDeliveryId());
                return RoutingOutcome.duplicateOf(event);
            }
            case IN_PROGRESS -> {
                DeliveryInProgressException inFlight = new DeliveryInProgressException(event.getDeliveryId());
                logFailure(event, null, inFlight);
                throw inFlight;
            }
            case NEW -> {
            }
        }

        ClassificationResult classification = null;
        try {
            // Step 3: Classify
            cancellation.throwIfCancelled(Stage.CLASSIFY);
            classification = classifier.classify(event, event.getProvider());
            if (classification.isDiscard()) {
                log.info("Discarded: stage={}, provider={}, rule={}",
                        Stage.CLASSIFY, event.getProvider(), classification.matchedRule());
                deduplicator.complete(event);
                return RoutingOutcome.discarded(event, classification);
            }
            log.info("Classified: stage={}, provider={}, category={}, rule={}",
                    Stage.CLASSIFY, event.getProvider(), classification.category(), classification.matchedRule());

            // Step 4: Enrich
            cancellation.throwIfCancelled(Stage.ENRICH);
            EnrichmentRecord enrichment = enricher.enrich(event, classification, cancellation);

            // Step 5: Bind
            cancellation.throwIfCancelled(Stage.BIND);
            ParameterSet parameters = bindingResolver.bind(event, enrichment, classification);

            // Step 6: Resolve
            cancellation.throwIfCancelled(Stage.RESOLVE);
            DispatchRequest request = templateResolver.resolve(parameters, classification);

            // Step 7: Dispatch
            cancellation.throwIfCancelled(Stage.DISPATCH);
            DispatchAck ack = dispatcher.dispatch(request);
            deduplicator.complete(event);

            return RoutingOutcome.dispatched(event, classification, request, ack);
        } catch (RouterException e) {
            logFailure(event, classification, e);
            deduplicator.release(event);
            throw e;
        } catch (RuntimeException e) {
            log.error("Unexpected failure: provider={}, deliveryId={}, error={}",
                    event.getProvider(), event.getDeliveryId(), e.getMessage(), e);
            deduplicator.release(event);
            throw e;
        }
    }

    private void logFailure(WebhookEvent event, ClassificationResult classification, RouterException e) {
        log.warn("Chain failed: stage={}, provider={}, category={}, errorKind={}, error={}",
                e.getStage(), event.getProvider(),
                classification == null ? "-" : classification.category(),
                e.getErrorKind(), e.getMessage());
    }
}
