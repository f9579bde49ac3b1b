package com.hooktide.service;

import com.hooktide.model.Provider;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * One consistent version of the routing table. Never mutated; a change produces
 * a new snapshot that replaces the old one in a single reference swap.
 */
public final class RoutingSnapshot {

    private final Map<Provider, ProviderRouting> providers;
    private final long version;

    RoutingSnapshot(Map<Provider, ProviderRouting> providers, long version) {
        EnumMap<Provider, ProviderRouting> copy = new EnumMap<>(Provider.class);
        copy.putAll(providers);
        this.providers = Collections.unmodifiableMap(copy);
        this.version = version;
    }

    public ProviderRouting forProvider(Provider provider) {
        ProviderRouting routing = providers.get(provider);
        if (routing == null) {
            throw new IllegalStateException("No routing for provider " + provider);
        }
        return routing;
    }

    public Map<Provider, ProviderRouting> providers() {
        return providers;
    }

    public long version() {
        return version;
    }

    RoutingSnapshot with(ProviderRouting routing) {
        EnumMap<Provider, ProviderRouting> copy = new EnumMap<>(Provider.class);
        copy.putAll(providers);
        copy.put(routing.provider(), routing);
        return new RoutingSnapshot(copy, version + 1);
    }
}
