package com.hooktide.client;

import com.hooktide.config.HooktideProperties;
import com.hooktide.dto.RegistryResource;
import com.hooktide.model.Deadline;
import com.hooktide.model.Stage;
import com.hooktide.service.RepositoryKeys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry backed by the "hooktide.registry.resources" list, for local setups
 * where no registry service runs.
 */
@Component
@ConditionalOnProperty(prefix = "hooktide.registry", name = "mode", havingValue = "static")
@Slf4j
public class StaticRegistryClient implements RegistryClient {

    private final Map<String, RegistryResource> resources = new HashMap<>();

    public StaticRegistryClient(HooktideProperties properties) {
        for (HooktideProperties.StaticResource resource : properties.getRegistry().getResources()) {
            String key = RepositoryKeys.normalize(resource.getRepository());
            resources.put(key, RegistryResource.builder()
                    .resourceId(resource.getResourceId())
                    .targets(new RegistryResource.Targets(resource.getBuild(), resource.getReview()))
                    .build());
        }
        log.info("Static registry loaded with {} resources", resources.size());
    }

    @Override
    public Optional<RegistryResource> lookup(String repositoryKey, Deadline deadline) {
        deadline.cancellation().throwIfCancelled(Stage.ENRICH);
        return Optional.ofNullable(resources.get(repositoryKey));
    }
}
