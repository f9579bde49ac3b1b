package com.hooktide.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.hooktide.client.RegistryClient;
import com.hooktide.config.HooktideProperties;
import com.hooktide.dto.RegistryResource;
import com.hooktide.exception.EnrichmentException;
import com.hooktide.exception.MalformedPayloadException;
import com.hooktide.model.CancellationToken;
import com.hooktide.model.ClassificationResult;
import com.hooktide.model.Deadline;
import com.hooktide.model.EnrichmentRecord;
import com.hooktide.model.EventCategory;
import com.hooktide.model.Stage;
import com.hooktide.model.WebhookEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Resolves the repository behind an event to its owning resource and dispatch targets.
 *
 * HOW IT WORKS:
 *   1. Take the repository URL from the payload and normalize it into a registry key
 *   2. Serve from the cache if a previous lookup for that key succeeded
 *   3. Otherwise call the registry once, bounded by a {@link Deadline} (3000 ms by default)
 *   4. A result that arrives after the deadline is thrown away: TIMEOUT, never a guess
 *
 * Only successful lookups are cached; NOT_FOUND and failures are retried on the next event.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Enricher {

    private final RegistryClient registryClient;
    private final PayloadFieldExtractor fieldExtractor;
    private final HooktideProperties properties;
    private final Cache<String, EnrichmentRecord> enrichmentCache;

    public EnrichmentRecord enrich(WebhookEvent event, ClassificationResult classification) {
        return enrich(event, classification, CancellationToken.none());
    }

    /**
     * @throws EnrichmentException TIMEOUT, NOT_FOUND or TRANSPORT_FAILURE
     */
    public EnrichmentRecord enrich(WebhookEvent event, ClassificationResult classification,
                                   CancellationToken cancellation) {
        String repositoryUrl = fieldExtractor.repositoryUrl(event);
        if (repositoryUrl == null) {
            throw new MalformedPayloadException(Stage.ENRICH,
                    "Payload has no repository URL (provider=" + event.getProvider() + ")");
        }
        String key = RepositoryKeys.normalize(repositoryUrl);
        boolean caching = properties.getRegistry().getCache().isEnabled();

        if (caching) {
            EnrichmentRecord cached = enrichmentCache.getIfPresent(key);
            if (cached != null) {
                log.debug("Enrichment cache hit: key={}, resourceId={}", key, cached.resourceId());
                return cached;
            }
        }

        Deadline deadline = Deadline.after(properties.getRegistry().getTimeout(), cancellation);
        long start = System.nanoTime();
        Optional<RegistryResource> resource = registryClient.lookup(key, deadline);
        long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        cancellation.throwIfCancelled(Stage.ENRICH);
        if (deadline.isExpired()) {
            throw new EnrichmentException(EnrichmentException.Kind.TIMEOUT,
                    "Registry lookup for " + key + " took " + latencyMs + "ms, limit is "
                            + deadline.budget().toMillis() + "ms");
        }
        if (resource.isEmpty()) {
            throw new EnrichmentException(EnrichmentException.Kind.NOT_FOUND,
                    "No registered resource for repository " + key);
        }

        EnrichmentRecord record = toRecord(resource.get(), latencyMs);
        if (caching) {
            enrichmentCache.put(key, record);
        }
        log.info("Enriched: key={}, resourceId={}, targets={}, category={}, latencyMs={}",
                key, record.resourceId(), record.targets().keySet(), classification.category(), latencyMs);
        return record;
    }

    private EnrichmentRecord toRecord(RegistryResource resource, long latencyMs) {
        Map<EventCategory, String> targets = new EnumMap<>(EventCategory.class);
        RegistryResource.Targets configured = resource.getTargets();
        if (configured != null) {
            targets.put(EventCategory.BUILD, configured.getBuild());
            targets.put(EventCategory.REVIEW, configured.getReview());
        }
        return new EnrichmentRecord(resource.getResourceId(), targets, latencyMs);
    }
}
