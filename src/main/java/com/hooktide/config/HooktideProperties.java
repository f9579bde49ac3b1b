package com.hooktide.config;

import com.hooktide.model.Provider;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything the router reads from configuration.
 *
 * Bound from application.yml under "hooktide" prefix:
 *   hooktide:
 *     providers:
 *       github:
 *         secret: ${GITHUB_WEBHOOK_SECRET}
 *         tracked-branches: ^(main|master)$
 *         filters:
 *           build:
 *             merged-pull-request: "header.X-GitHub-Event == 'pull_request' && ..."
 *     registry:
 *       url: http://registry:8080
 *       timeout: 3000ms
 *     engine:
 *       transport: http
 *       url: http://engine:8080
 *
 * Empty filter maps fall back to {@link DefaultFilters}. These beans are only read
 * when a routing snapshot is built; requests never see this object directly.
 */
@Component
@ConfigurationProperties(prefix = "hooktide")
@Validated
@Getter
@Setter
public class HooktideProperties {

    private Map<Provider, ProviderSettings> providers = new LinkedHashMap<>();

    @Valid
    private Registry registry = new Registry();

    @Valid
    private Engine engine = new Engine();

    private Dedup dedup = new Dedup();

    @Valid
    private Executor executor = new Executor();

    /**
     * Longest a delivery may wait in the executor queue and still be routed: a run
     * that starts later could outlive the request with its dispatch in flight.
     */
    public Duration startBudget() {
        return executor.getRequestTimeout().minus(registry.getTimeout()).minus(engine.getTimeout());
    }

    @AssertTrue(message = "hooktide.executor.request-timeout must exceed hooktide.registry.timeout"
            + " plus hooktide.engine.timeout")
    public boolean isRequestTimeoutAboveCallTimeouts() {
        if (executor.getRequestTimeout() == null || registry.getTimeout() == null || engine.getTimeout() == null) {
            return true;
        }
        return startBudget().compareTo(Duration.ZERO) > 0;
    }

    @Getter
    @Setter
    public static class ProviderSettings {
        private boolean enabled = true;
        /** HMAC secret, or the expected token for providers without signing. */
        private String secret;
        private String trackedBranches = "^(main|master)$";
        private String recheckPattern = "^/(recheck|ok-to-test)\\s*$";
        private Filters filters = new Filters();
    }

    @Getter
    @Setter
    public static class Filters {
        private Map<String, String> build = new LinkedHashMap<>();
        private Map<String, String> review = new LinkedHashMap<>();
    }

    public enum RegistryMode {
        HTTP,
        STATIC
    }

    @Getter
    @Setter
    public static class Registry {
        private RegistryMode mode = RegistryMode.HTTP;
        private String url = "http://localhost:8081";
        @NotNull
        private Duration timeout = Duration.ofMillis(3000);
        private Cache cache = new Cache();
        /** Used when mode is STATIC. */
        private List<StaticResource> resources = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class Cache {
        private boolean enabled = true;
        private Duration ttl = Duration.ofMinutes(5);
        private long maxSize = 10_000;
    }

    @Getter
    @Setter
    public static class StaticResource {
        private String repository;
        private String resourceId;
        private String build;
        private String review;
    }

    public enum EngineTransport {
        HTTP,
        KAFKA
    }

    @Getter
    @Setter
    public static class Engine {
        private EngineTransport transport = EngineTransport.HTTP;
        private String url = "http://localhost:8082";
        @NotNull
        private Duration timeout = Duration.ofSeconds(5);
        private String topic = "hooktide.dispatches";
    }

    @Getter
    @Setter
    public static class Dedup {
        private boolean enabled = false;
        /** How long a routed delivery is remembered. */
        private Duration ttl = Duration.ofHours(24);
        /** How long a claim survives if its run never finishes, e.g. the instance died mid-chain. */
        private Duration inProgressTtl = Duration.ofMinutes(5);
    }

    @Getter
    @Setter
    public static class Executor {
        @Min(1)
        private int corePoolSize = 8;
        @Min(1)
        private int maxPoolSize = 32;
        @Min(0)
        private int queueCapacity = 200;
        /** How long the servlet waits for a chain run before answering 503. */
        private Duration requestTimeout = Duration.ofSeconds(30);
    }
}
