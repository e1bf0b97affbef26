package tech.flowcatalyst.directory.client.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.flowcatalyst.directory.config.DirectoryClientConfig;
import tech.flowcatalyst.directory.exception.AuthenticationException;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Manages OAuth2 client credentials tokens for directory API authentication.
 */
@ApplicationScoped
public class ClientCredentialsTokenProvider implements TokenProvider {

    private static final Logger LOG = Logger.getLogger(ClientCredentialsTokenProvider.class);

    private static final String AUTHORITY = "https://login.microsoftonline.com/%s/oauth2/v2.0/token";

    private final DirectoryClientConfig config;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private String accessToken;
    private Instant expiresAt;

    @Inject
    public ClientCredentialsTokenProvider(DirectoryClientConfig config) {
        this(config, Clock.systemUTC());
    }

    ClientCredentialsTokenProvider(DirectoryClientConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public String getAccessToken() {
        lock.lock();
        try {
            if (isTokenValid()) {
                return accessToken;
            }
            return fetchNewToken();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String refreshToken() {
        lock.lock();
        try {
            return fetchNewToken();
        } finally {
            lock.unlock();
        }
    }

    private boolean isTokenValid() {
        return accessToken != null
            && expiresAt != null
            && clock.instant().plusSeconds(60).isBefore(expiresAt);
    }

    String tokenUrl() {
        return config.tokenUrl().orElseGet(() -> String.format(AUTHORITY,
            config.tenantId().orElseThrow(AuthenticationException::missingTenant)));
    }

    private String fetchNewToken() {
        String clientId = config.clientId()
            .orElseThrow(AuthenticationException::missingCredentials);
        String clientSecret = config.clientSecret()
            .orElseThrow(AuthenticationException::missingCredentials);

        String body = "grant_type=client_credentials"
            + "&client_id=" + encode(clientId)
            + "&client_secret=" + encode(clientSecret)
            + "&scope=" + encode(config.scope());

        try {
            HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(tokenUrl()))
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .timeout(Duration.ofSeconds(config.http().timeout()))
                .build();

            HttpResponse<String> response = httpClient.send(
                request, HttpResponse.BodyHandlers.ofString()
            );

            if (response.statusCode() != 200) {
                LOG.warnf("Token request for client %s failed with status %d", clientId, response.statusCode());
                throw AuthenticationException.invalidCredentials(response.statusCode());
            }

            JsonNode json = objectMapper.readTree(response.body());
            JsonNode token = json.get("access_token");
            if (token == null || token.asText().isEmpty()) {
                throw new AuthenticationException("Token response did not contain an access_token");
            }

            this.accessToken = token.asText();
            this.expiresAt = clock.instant().plusSeconds(json.path("expires_in").asLong(3600));
            LOG.debugf("Acquired access token for client %s, expires at %s", clientId, expiresAt);

            return this.accessToken;
        } catch (AuthenticationException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AuthenticationException("Interrupted while fetching access token", e);
        } catch (Exception e) {
            throw new AuthenticationException("Failed to fetch access token", e);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
