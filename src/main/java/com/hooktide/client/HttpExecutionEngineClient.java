package com.hooktide.client;

import com.hooktide.config.HooktideProperties;
import com.hooktide.dto.EngineAcknowledgement;
import com.hooktide.exception.DispatchException;
import com.hooktide.model.DispatchAck;
import com.hooktide.model.DispatchRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;

/**
 * Submits dispatch requests over HTTP.
 *
 *   POST {engine.url}/api/v1/dispatches
 *   {"target": "...", "parameters": {...}, "labels": {...}}
 *   2xx → {"ack": "<token>"}
 *   4xx → REJECTED, anything else → UNREACHABLE
 */
@Component
@ConditionalOnProperty(prefix = "hooktide.engine", name = "transport", havingValue = "http", matchIfMissing = true)
@Slf4j
public class HttpExecutionEngineClient implements ExecutionEngineClient {

    static final String SUBMIT_PATH = "/api/v1/dispatches";

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public HttpExecutionEngineClient(@Qualifier("engineRestTemplate") RestTemplate restTemplate,
                                     HooktideProperties properties) {
        this.restTemplate = restTemplate;
        String url = properties.getEngine().getUrl();
        this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    @Override
    public DispatchAck submit(DispatchRequest request) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<DispatchRequest> entity = new HttpEntity<>(request, headers);

        try {
            ResponseEntity<EngineAcknowledgement> response = restTemplate.postForEntity(
                    baseUrl + SUBMIT_PATH, entity, EngineAcknowledgement.class);
            EngineAcknowledgement body = response.getBody();
            String token = body == null || body.getAck() == null ? "" : body.getAck();
            log.debug("Engine accepted: target={}, status={}, ack={}", request.target(), response.getStatusCode(), token);
            return new DispatchAck(token, Instant.now());
        } catch (HttpClientErrorException e) {
            throw new DispatchException(DispatchException.Kind.REJECTED,
                    "Engine rejected target " + request.target() + ": " + e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            throw new DispatchException(DispatchException.Kind.UNREACHABLE,
                    "Engine unreachable: " + e.getMessage(), e);
        }
    }
}
