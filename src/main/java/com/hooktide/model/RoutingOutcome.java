package com.hooktide.model;

/**
 * Result of a chain run that did not fail.
 * request and ack are null for discarded and duplicate deliveries.
 */
public record RoutingOutcome(String deliveryId,
                             Provider provider,
                             ClassificationResult classification,
                             DispatchRequest request,
                             DispatchAck ack,
                             boolean duplicate) {

    public static RoutingOutcome discarded(WebhookEvent event, ClassificationResult classification) {
        return new RoutingOutcome(event.getDeliveryId(), event.getProvider(), classification, null, null, false);
    }

    public static RoutingOutcome duplicateOf(WebhookEvent event) {
        return new RoutingOutcome(event.getDeliveryId(), event.getProvider(), null, null, null, true);
    }

    public static RoutingOutcome dispatched(WebhookEvent event, ClassificationResult classification,
                                            DispatchRequest request, DispatchAck ack) {
        return new RoutingOutcome(event.getDeliveryId(), event.getProvider(), classification, request, ack, false);
    }

    public boolean isDispatched() {
        return ack != null;
    }
}
