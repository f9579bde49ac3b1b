package com.hooktide.service;

import com.hooktide.config.HooktideProperties;
import com.hooktide.model.WebhookEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Stops a redelivered webhook from being dispatched twice, using Redis.
 *
 * HOW IT WORKS:
 *   1. After the signature check, call claim(event)
 *   2. This SETs "hooktide:delivery:{provider}:{deliveryId}" = "in-progress" with NX
 *      and the short in-progress TTL
 *   3. SET succeeded → first time this delivery is seen (NEW)
 *   4. SET failed    → read the key: "done" means it was routed (DONE), anything
 *      else means another run still owns it (IN_PROGRESS)
 *   5. When the chain finishes, complete(event) rewrites the key as "done" with the full TTL
 *   6. If the chain fails, release(event) removes the key so the provider's
 *      redelivery is processed normally
 *
 * Disabled unless hooktide.dedup.enabled=true. If Redis is unavailable the
 * delivery is treated as new: dedup never blocks routing.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DeliveryDeduplicator {

    private static final String KEY_PREFIX = "hooktide:delivery:";
    static final String IN_PROGRESS = "in-progress";
    static final String DONE = "done";

    public enum DeliveryState {
        /** Not seen before; the caller now owns the delivery. */
        NEW,
        /** Another run is routing it right now. */
        IN_PROGRESS,
        /** Already routed to completion. */
        DONE
    }

    private final StringRedisTemplate redisTemplate;
    private final HooktideProperties properties;

    public DeliveryState claim(WebhookEvent event) {
        if (!properties.getDedup().isEnabled()) {
            return DeliveryState.NEW;
        }
        String key = key(event);
        try {
            Boolean wasSet = redisTemplate.opsForValue()
                    .setIfAbsent(key, IN_PROGRESS, properties.getDedup().getInProgressTtl());
            if (!Boolean.FALSE.equals(wasSet)) {
                return DeliveryState.NEW;
            }
            String marker = redisTemplate.opsForValue().get(key);
            DeliveryState state = DONE.equals(marker) ? DeliveryState.DONE : DeliveryState.IN_PROGRESS;
            log.warn("Duplicate delivery detected: provider={}, deliveryId={}, state={}",
                    event.getProvider(), event.getDeliveryId(), state);
            return state;
        } catch (DataAccessException e) {
            log.warn("Dedup check unavailable, processing delivery {}: {}", event.getDeliveryId(), e.getMessage());
            return DeliveryState.NEW;
        }
    }

    /**
     * Record that the delivery was routed, so later redeliveries are acknowledged as duplicates.
     */
    public void complete(WebhookEvent event) {
        if (!properties.getDedup().isEnabled()) {
            return;
        }
        try {
            redisTemplate.opsForValue().set(key(event), DONE, properties.getDedup().getTtl());
        } catch (DataAccessException e) {
            log.warn("Could not mark delivery {} as routed: {}", event.getDeliveryId(), e.getMessage());
        }
    }

    /**
     * Forget a delivery so that a redelivery of it is routed again.
     */
    public void release(WebhookEvent event) {
        if (!properties.getDedup().isEnabled()) {
            return;
        }
        try {
            redisTemplate.delete(key(event));
            log.info("Cleared dedup key for redelivery: deliveryId={}", event.getDeliveryId());
        } catch (DataAccessException e) {
            log.warn("Could not clear dedup key for {}: {}", event.getDeliveryId(), e.getMessage());
        }
    }

    private static String key(WebhookEvent event) {
        return KEY_PREFIX + event.getProvider().pathSegment() + ":" + event.getDeliveryId();
    }
}
