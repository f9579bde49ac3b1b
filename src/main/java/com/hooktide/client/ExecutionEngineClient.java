package com.hooktide.client;

import com.hooktide.exception.DispatchException;
import com.hooktide.model.DispatchAck;
import com.hooktide.model.DispatchRequest;

/**
 * Submission side of the execution engine. Returns on acceptance, not completion.
 */
public interface ExecutionEngineClient {

    /**
     * @throws DispatchException REJECTED if the engine refused the request,
     *                           UNREACHABLE if it could not be reached
     */
    DispatchAck submit(DispatchRequest request);
}
