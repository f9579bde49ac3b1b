package com.hooktide.exception;

import com.hooktide.model.Stage;

/**
 * The same delivery is still being routed by another run. Answered with a non-2xx
 * status so the provider keeps the delivery and retries it later.
 */
public class DeliveryInProgressException extends RouterException {

    public DeliveryInProgressException(String deliveryId) {
        super(Stage.DEDUPLICATE, "Delivery " + deliveryId + " is still being routed, retry later");
    }

    @Override
    public String getErrorKind() {
        return "IN_PROGRESS";
    }
}
