package com.hooktide.client;

import com.hooktide.config.HooktideProperties;
import com.hooktide.dto.RegistryResource;
import com.hooktide.exception.EnrichmentException;
import com.hooktide.model.Deadline;
import com.hooktide.model.Stage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.InterruptedIOException;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Registry client over HTTP.
 *
 *   GET {registry.url}/api/v1/resources?repository={key}
 *   200 → {"resourceId": "...", "targets": {"build": "...", "review": "..."}}
 *   404 → no resource for this repository
 *
 * The exchange runs on the registry executor and the caller waits for it at most
 * {@link Deadline#remaining()}, body included. When the wait runs out the call is
 * abandoned and reported as TIMEOUT; the pooled connection is then released by the
 * HTTP client's own socket timeout.
 */
@Component
@ConditionalOnProperty(prefix = "hooktide.registry", name = "mode", havingValue = "http", matchIfMissing = true)
@Slf4j
public class HttpRegistryClient implements RegistryClient {

    static final String LOOKUP_PATH = "/api/v1/resources?repository={repository}";

    private final RestTemplate restTemplate;
    private final AsyncTaskExecutor registryExecutor;
    private final String baseUrl;

    public HttpRegistryClient(@Qualifier("registryRestTemplate") RestTemplate restTemplate,
                              @Qualifier("registryExecutor") AsyncTaskExecutor registryExecutor,
                              HooktideProperties properties) {
        this.restTemplate = restTemplate;
        this.registryExecutor = registryExecutor;
        String url = properties.getRegistry().getUrl();
        this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    @Override
    public Optional<RegistryResource> lookup(String repositoryKey, Deadline deadline) {
        deadline.cancellation().throwIfCancelled(Stage.ENRICH);
        if (deadline.isExpired()) {
            throw new EnrichmentException(EnrichmentException.Kind.TIMEOUT,
                    "Registry deadline expired before lookup of " + repositoryKey);
        }

        Future<Optional<RegistryResource>> call;
        try {
            call = registryExecutor.submit(() -> fetch(repositoryKey));
        } catch (TaskRejectedException e) {
            throw new EnrichmentException(EnrichmentException.Kind.TRANSPORT_FAILURE,
                    "Registry lookups saturated, refused " + repositoryKey, e);
        }

        try {
            return call.get(deadline.remaining().toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            log.warn("Registry lookup abandoned: key={}, budgetMs={}", repositoryKey, deadline.budget().toMillis());
            throw new EnrichmentException(EnrichmentException.Kind.TIMEOUT,
                    "Registry lookup timed out after " + deadline.budget().toMillis() + "ms", e);
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new EnrichmentException(EnrichmentException.Kind.TRANSPORT_FAILURE,
                    "Interrupted while waiting for the registry", e);
        } catch (ExecutionException e) {
            throw translate(e.getCause(), repositoryKey, deadline);
        }
    }

    private Optional<RegistryResource> fetch(String repositoryKey) {
        try {
            ResponseEntity<RegistryResource> response = restTemplate.getForEntity(
                    baseUrl + LOOKUP_PATH, RegistryResource.class, repositoryKey);
            RegistryResource resource = response.getBody();
            if (resource == null || resource.getResourceId() == null || resource.getResourceId().isBlank()) {
                return Optional.empty();
            }
            return Optional.of(resource);
        } catch (HttpClientErrorException.NotFound e) {
            return Optional.empty();
        }
    }

    private static RuntimeException translate(Throwable failure, String repositoryKey, Deadline deadline) {
        if (failure instanceof HttpStatusCodeException e) {
            return new EnrichmentException(EnrichmentException.Kind.TRANSPORT_FAILURE,
                    "Registry answered " + e.getStatusCode().value() + " for " + repositoryKey, e);
        }
        if (failure instanceof RestClientException e && isTimeout(e)) {
            return new EnrichmentException(EnrichmentException.Kind.TIMEOUT,
                    "Registry lookup timed out after " + deadline.budget().toMillis() + "ms", e);
        }
        if (failure instanceof ResourceAccessException e) {
            return new EnrichmentException(EnrichmentException.Kind.TRANSPORT_FAILURE,
                    "Registry unreachable: " + e.getMessage(), e);
        }
        if (failure instanceof RestClientException e) {
            return new EnrichmentException(EnrichmentException.Kind.TRANSPORT_FAILURE,
                    "Registry response unusable: " + e.getMessage(), e);
        }
        if (failure instanceof RuntimeException e) {
            return e;
        }
        return new EnrichmentException(EnrichmentException.Kind.TRANSPORT_FAILURE,
                "Registry lookup failed: " + failure, failure);
    }

    /**
     * Socket, connect and pool-lease timeouts all surface as {@link InterruptedIOException},
     * either under a ResourceAccessException or, mid-body, under the converter's RestClientException.
     */
    private static boolean isTimeout(Throwable e) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof InterruptedIOException) {
                return true;
            }
        }
        return false;
    }
}
