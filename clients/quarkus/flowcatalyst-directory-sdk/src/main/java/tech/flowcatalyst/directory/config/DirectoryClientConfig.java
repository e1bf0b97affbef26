package tech.flowcatalyst.directory.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.util.Optional;

/**
 * Configuration for the directory client.
 *
 * <p>Configure in application.properties:
 * <pre>
 * directory.tenant-id=00000000-0000-0000-0000-000000000000
 * directory.client-id=your_client_id
 * directory.client-secret=your_client_secret
 * directory.api-version=v1.0
 * </pre>
 */
@ConfigMapping(prefix = "directory")
public interface DirectoryClientConfig {

    /**
     * Base URL of the directory service, without the API version segment.
     */
    @WithName("base-url")
    @WithDefault("https://graph.microsoft.com")
    String baseUrl();

    /**
     * API version path segment, e.g. {@code beta} or {@code v1.0}.
     */
    @WithName("api-version")
    @WithDefault("beta")
    String apiVersion();

    /**
     * Tenant the client authenticates against.
     */
    @WithName("tenant-id")
    Optional<String> tenantId();

    /**
     * OAuth2 client ID for authentication.
     */
    @WithName("client-id")
    Optional<String> clientId();

    /**
     * OAuth2 client secret for authentication.
     */
    @WithName("client-secret")
    Optional<String> clientSecret();

    /**
     * OAuth2 token endpoint. Defaults to the identity platform endpoint of the tenant.
     */
    @WithName("token-url")
    Optional<String> tokenUrl();

    /**
     * Scope requested for client credential tokens.
     */
    @WithDefault("https://graph.microsoft.com/.default")
    String scope();

    /**
     * HTTP client configuration.
     */
    HttpConfig http();

    /**
     * Bounds of the read-after-write consistency retry loop.
     */
    ConsistencyConfig consistency();

    interface HttpConfig {
        /**
         * Request timeout in seconds.
         */
        @WithDefault("30")
        int timeout();

        /**
         * Number of attempts for throttled (429) or unavailable (503, 504) responses.
         */
        @WithName("retry-attempts")
        @WithDefault("3")
        int retryAttempts();

        /**
         * Delay between throttling retries in milliseconds, when no Retry-After is sent.
         */
        @WithName("retry-delay")
        @WithDefault("500")
        int retryDelay();
    }

    interface ConsistencyConfig {
        /**
         * Maximum attempts while the directory reports a consistency failure.
         */
        @WithName("max-attempts")
        @WithDefault("8")
        int maxAttempts();

        /**
         * First backoff delay in milliseconds; doubled on each attempt.
         */
        @WithName("initial-delay")
        @WithDefault("1000")
        long initialDelay();

        /**
         * Upper bound for a single backoff delay in milliseconds.
         */
        @WithName("max-delay")
        @WithDefault("16000")
        long maxDelay();

        /**
         * Overall time budget for one call, in seconds, across all consistency retries.
         */
        @WithDefault("300")
        int timeout();
    }
}
