package com.hooktide.service;

import com.hooktide.client.ExecutionEngineClient;
import com.hooktide.exception.DispatchException;
import com.hooktide.model.DispatchAck;
import com.hooktide.model.DispatchRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Last stage: hands a resolved request to the execution engine, once.
 *
 * No retries here. A failure goes back to the VCS provider as a failed delivery,
 * and the provider's redelivery is the retry.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Dispatcher {

    private final ExecutionEngineClient engineClient;

    public DispatchAck dispatch(DispatchRequest request) {
        try {
            DispatchAck ack = engineClient.submit(request);
            log.info("Dispatched → target={}, labels={}, ack={}", request.target(), request.labels(), ack.token());
            return ack;
        } catch (DispatchException e) {
            log.error("Dispatch failed: target={}, kind={}, error={}", request.target(), e.getKind(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("Dispatch failed: target={}, error={}", request.target(), e.getMessage(), e);
            throw new DispatchException(DispatchException.Kind.UNREACHABLE,
                    "Engine submission failed: " + e.getMessage(), e);
        }
    }
}
