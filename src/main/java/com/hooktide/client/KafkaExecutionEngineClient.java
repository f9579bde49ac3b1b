package com.hooktide.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hooktide.config.HooktideProperties;
import com.hooktide.exception.DispatchException;
import com.hooktide.model.DispatchAck;
import com.hooktide.model.DispatchRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Submits dispatch requests by publishing them to a Kafka topic the engine consumes.
 *
 * The message key is the resource id, so dispatches of one resource stay in one
 * partition. The send is awaited (engine.timeout): the broker's ack is the
 * acceptance, and its coordinates "topic-partition@offset" are the token.
 */
@Component
@ConditionalOnProperty(prefix = "hooktide.engine", name = "transport", havingValue = "kafka")
@RequiredArgsConstructor
@Slf4j
public class KafkaExecutionEngineClient implements ExecutionEngineClient {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final HooktideProperties properties;

    @Override
    public DispatchAck submit(DispatchRequest request) {
        String topic = properties.getEngine().getTopic();
        String key = request.labels().get(DispatchRequest.LABEL_RESOURCE_ID);

        String message;
        try {
            message = objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new DispatchException(DispatchException.Kind.REJECTED, "Dispatch request not serializable", e);
        }

        try {
            SendResult<String, String> result = kafkaTemplate.send(topic, key, message)
                    .get(properties.getEngine().getTimeout().toMillis(), TimeUnit.MILLISECONDS);
            RecordMetadata metadata = result.getRecordMetadata();
            String token = metadata.topic() + "-" + metadata.partition() + "@" + metadata.offset();
            log.debug("Published dispatch: topic={}, key={}, token={}", topic, key, token);
            return new DispatchAck(token, Instant.now());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DispatchException(DispatchException.Kind.UNREACHABLE, "Interrupted while publishing dispatch", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new DispatchException(DispatchException.Kind.UNREACHABLE,
                    "Kafka publish to " + topic + " failed: " + e.getMessage(), e);
        }
    }
}
