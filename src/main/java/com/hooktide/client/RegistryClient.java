package com.hooktide.client;

import com.hooktide.dto.RegistryResource;
import com.hooktide.exception.EnrichmentException;
import com.hooktide.model.Deadline;

import java.util.Optional;

/**
 * Lookup side of the resource registry.
 */
public interface RegistryClient {

    /**
     * Find the resource owning a repository.
     *
     * @param repositoryKey normalized key, see {@code RepositoryKeys}
     * @param deadline      bound for the call; implementations must not wait past it
     * @return the resource, or empty if the registry has none for this key
     * @throws EnrichmentException with kind TIMEOUT or TRANSPORT_FAILURE
     */
    Optional<RegistryResource> lookup(String repositoryKey, Deadline deadline);
}
