package com.hooktide.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hooktide.exception.MalformedPayloadException;

import java.io.IOException;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * One inbound webhook delivery, exactly as received.
 *
 * Created once per HTTP request and discarded when the chain completes.
 * The raw body is kept byte-for-byte because signatures are computed over it;
 * the JSON tree is only parsed on first access to {@link #payload()}, which
 * happens after the signature has been checked.
 */
public final class WebhookEvent {

    private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {};

    private final Provider provider;
    private final Map<String, String> headers;
    private final byte[] rawBody;
    private final String deliveryId;
    private final Instant receivedAt;
    private final ObjectMapper objectMapper;

    private volatile Map<String, Object> payload;

    private WebhookEvent(Provider provider, Map<String, String> headers, byte[] rawBody, Instant receivedAt,
                         ObjectMapper objectMapper) {
        this.provider = provider;
        TreeMap<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        copy.putAll(headers);
        this.headers = Collections.unmodifiableMap(copy);
        this.rawBody = rawBody == null ? new byte[0] : rawBody.clone();
        String delivery = copy.get(provider.deliveryHeader());
        this.deliveryId = delivery == null || delivery.isBlank() ? UUID.randomUUID().toString() : delivery;
        this.receivedAt = receivedAt;
        this.objectMapper = objectMapper;
    }

    /**
     * @param objectMapper the application's mapper, used when the payload is first read
     */
    public static WebhookEvent of(Provider provider, Map<String, String> headers, byte[] rawBody,
                                  ObjectMapper objectMapper) {
        return new WebhookEvent(provider, headers, rawBody, Instant.now(), objectMapper);
    }

    public Provider getProvider() {
        return provider;
    }

    /** Case-insensitive, read-only view of the request headers. */
    public Map<String, String> getHeaders() {
        return headers;
    }

    public String header(String name) {
        return headers.get(name);
    }

    public byte[] getRawBody() {
        return rawBody.clone();
    }

    public String getDeliveryId() {
        return deliveryId;
    }

    public Instant getReceivedAt() {
        return receivedAt;
    }

    /** Value of the provider's event-type header, e.g. "pull_request" or "Merge Request Hook". */
    public String eventType() {
        return headers.get(provider.eventHeader());
    }

    /**
     * The body parsed as a JSON object. Parsed once, then reused by every stage.
     *
     * @throws MalformedPayloadException if the body is not a JSON object
     */
    public Map<String, Object> payload() {
        Map<String, Object> parsed = payload;
        if (parsed == null) {
            parsed = parse();
            payload = parsed;
        }
        return parsed;
    }

    private Map<String, Object> parse() {
        if (rawBody.length == 0) {
            throw new MalformedPayloadException("Empty webhook body");
        }
        try {
            Map<String, Object> tree = objectMapper.readValue(rawBody, JSON_OBJECT);
            if (tree == null) {
                throw new MalformedPayloadException("Webhook body is not a JSON object");
            }
            return Collections.unmodifiableMap(tree);
        } catch (JsonProcessingException e) {
            throw new MalformedPayloadException("Webhook body is not valid JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new MalformedPayloadException("Webhook body could not be read: " + e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        return "WebhookEvent{provider=" + provider + ", eventType=" + eventType()
                + ", deliveryId=" + deliveryId + ", bytes=" + rawBody.length + "}";
    }
}
