package tech.flowcatalyst.directory.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.flowcatalyst.directory.client.auth.TokenProvider;
import tech.flowcatalyst.directory.config.DirectoryClientConfig;
import tech.flowcatalyst.directory.consistency.RetryBackoff;
import tech.flowcatalyst.directory.exception.RemoteRejectionException;
import tech.flowcatalyst.directory.exception.RequestCancelledException;
import tech.flowcatalyst.directory.exception.TransportException;
import tech.flowcatalyst.directory.odata.ODataError;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Transport for directory calls.
 *
 * <p>Each call runs a retry loop around a single logical request:
 * <ol>
 *   <li>a status in the request's valid set is returned as is;</li>
 *   <li>otherwise the structured error is decoded and the outcome classifier may accept it;</li>
 *   <li>401 triggers one token refresh, 429/503/504 are retried up to {@code http.retry-attempts};</li>
 *   <li>the consistency policy may ask for a retry, bounded by {@link RetryBackoff};</li>
 *   <li>anything else, or an exhausted retry budget, is thrown as
 *       {@link RemoteRejectionException} carrying the last status and error.</li>
 * </ol>
 *
 * <p>The client holds no per-call state and can be shared between threads. An interrupt
 * during a retry aborts the call with {@link RequestCancelledException}.
 */
@ApplicationScoped
public class DirectoryHttpClient {

    private static final Logger LOG = Logger.getLogger(DirectoryHttpClient.class);

    private static final Set<Integer> THROTTLED = Set.of(429, 503, 504);
    private static final int UNAUTHORIZED = 401;
    private static final long MAX_RETRY_AFTER_SECONDS = 300;

    private final DirectoryClientConfig config;
    private final TokenProvider tokenProvider;
    private final HttpClient httpClient;
    private final DirectoryCodec codec;
    private final RetryBackoff backoff;
    private final String apiRoot;

    @Inject
    public DirectoryHttpClient(DirectoryClientConfig config, TokenProvider tokenProvider) {
        this.config = config;
        this.tokenProvider = tokenProvider;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(config.http().timeout()))
            .build();
        this.codec = new DirectoryCodec();
        this.backoff = RetryBackoff.from(config.consistency());
        this.apiRoot = config.baseUrl().replaceAll("/$", "") + "/" + config.apiVersion();
    }

    /**
     * Execute a request, following list pages when the request asks for it.
     */
    public DirectoryResponse execute(DirectoryRequest request) {
        URI uri = buildUri(request);
        if (!request.followsPages()) {
            return executeWithRetry(request, uri);
        }
        return executePaged(request, uri);
    }

    /**
     * Canonical reference URI for a directory object, used in {@code $ref} bodies.
     */
    public String directoryObjectUri(String id) {
        return apiRoot + "/directoryObjects/" + id;
    }

    public DirectoryCodec getCodec() {
        return codec;
    }

    private DirectoryResponse executePaged(DirectoryRequest request, URI firstPage) {
        ArrayNode values = codec.newArray();
        URI next = firstPage;
        DirectoryResponse page = null;
        int pages = 0;

        while (next != null) {
            page = executeWithRetry(request, next);
            pages++;
            if (!page.hasBody()) {
                break;
            }
            ObjectNode envelope = codec.readPage(page.body(), page.status());
            if (envelope == null || !envelope.path(DirectoryCodec.VALUE).isArray()) {
                return page;
            }
            values.addAll((ArrayNode) envelope.get(DirectoryCodec.VALUE));
            JsonNode link = envelope.get(DirectoryCodec.NEXT_LINK);
            next = link != null && link.isTextual() ? URI.create(link.asText()) : null;
        }

        if (pages > 1) {
            LOG.debugf("%s %s: merged %d pages (%d items)", request.method(), request.path(), pages, values.size());
        }
        return DirectoryResponse.of(page.status(), codec.writePages(values));
    }

    private DirectoryResponse executeWithRetry(DirectoryRequest request, URI uri) {
        Instant deadline = Instant.now().plus(backoff.timeout());
        int attempt = 0;
        int consistencyRetries = 0;
        int throttleRetries = 0;
        boolean tokenRefreshed = false;
        boolean refreshNext = false;

        while (true) {
            if (Thread.currentThread().isInterrupted()) {
                throw RequestCancelledException.interrupted(request.method(), request.path(), 0,
                    new InterruptedException("interrupted before attempt " + (attempt + 1)));
            }
            attempt++;

            HttpResponse<String> response = send(request, uri, refreshNext);
            refreshNext = false;
            int status = response.statusCode();

            if (request.validStatusCodes().contains(status)) {
                if (attempt > 1) {
                    LOG.debugf("%s %s succeeded with status %d after %d attempts",
                        request.method(), request.path(), status, attempt);
                }
                return DirectoryResponse.of(status, response.body());
            }

            ODataError error = codec.decodeError(response.body());

            if (request.outcomeClassifier().test(status, error)) {
                LOG.debugf("%s %s: status %d accepted as already satisfied (%s)",
                    request.method(), request.path(), status, error);
                return DirectoryResponse.classified(status, response.body(), error);
            }

            if (status == UNAUTHORIZED && !tokenRefreshed) {
                LOG.debugf("%s %s: status 401, refreshing token", request.method(), request.path());
                tokenRefreshed = true;
                refreshNext = true;
                continue;
            }

            if (THROTTLED.contains(status) && throttleRetries + 1 < config.http().retryAttempts()) {
                throttleRetries++;
                long delay = Math.max(0, retryAfter(response).orElse((long) config.http().retryDelay() * throttleRetries));
                LOG.warnf("%s %s: status %d, retrying in %dms (%d/%d)", request.method(), request.path(),
                    status, delay, throttleRetries, config.http().retryAttempts() - 1);
                sleep(request, delay, status);
                continue;
            }

            if (request.consistencyPolicy().test(status, error)) {
                consistencyRetries++;
                if (consistencyRetries >= backoff.maxAttempts()) {
                    LOG.warnf("%s %s: still failing with status %d after %d consistency retries",
                        request.method(), request.path(), status, consistencyRetries - 1);
                    throw new RemoteRejectionException(request.method(), request.path(), status, error);
                }
                long delay = backoff.delayFor(consistencyRetries);
                if (Instant.now().plusMillis(delay).isAfter(deadline)) {
                    throw RequestCancelledException.deadlineExceeded(request.method(), request.path(), status);
                }
                LOG.debugf("%s %s: status %d looks like replication lag, retrying in %dms",
                    request.method(), request.path(), status, delay);
                sleep(request, delay, status);
                continue;
            }

            throw new RemoteRejectionException(request.method(), request.path(), status, error);
        }
    }

    private HttpResponse<String> send(DirectoryRequest request, URI uri, boolean refreshToken) {
        String token = refreshToken ? tokenProvider.refreshToken() : tokenProvider.getAccessToken();

        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(uri)
            .header("Authorization", "Bearer " + token)
            .timeout(Duration.ofSeconds(config.http().timeout()));

        Map<String, String> queryHeaders = request.query().headers();
        builder.header("Accept", queryHeaders.getOrDefault("Accept", DirectoryRequest.JSON));
        queryHeaders.forEach((name, value) -> {
            if (!"Accept".equals(name)) {
                builder.header(name, value);
            }
        });

        if (request.body() != null) {
            builder.header("Content-Type", request.contentType());
            builder.method(request.method(), HttpRequest.BodyPublishers.ofByteArray(request.body()));
        } else {
            builder.method(request.method(), HttpRequest.BodyPublishers.noBody());
        }

        try {
            return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new TransportException(request.method() + " " + request.path() + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw RequestCancelledException.interrupted(request.method(), request.path(), 0, e);
        }
    }

    private void sleep(DirectoryRequest request, long millis, int lastStatus) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw RequestCancelledException.interrupted(request.method(), request.path(), lastStatus, e);
        }
    }

    /**
     * Retry-After in milliseconds, capped at {@value #MAX_RETRY_AFTER_SECONDS} seconds.
     * Negative or unparseable values are treated as absent.
     */
    private Optional<Long> retryAfter(HttpResponse<String> response) {
        return response.headers()
            .firstValue("Retry-After")
            .flatMap(value -> {
                try {
                    long seconds = Long.parseLong(value.trim());
                    if (seconds < 0) {
                        LOG.debugf("Ignoring negative Retry-After header '%s', using default", value);
                        return Optional.empty();
                    }
                    return Optional.of(Math.min(seconds, MAX_RETRY_AFTER_SECONDS) * 1000);
                } catch (NumberFormatException e) {
                    LOG.debugf("Retry-After header '%s' is not in delta-seconds format, using default", value);
                    return Optional.empty();
                }
            });
    }

    URI buildUri(DirectoryRequest request) {
        Map<String, String> params = request.query().parameters();
        String url = apiRoot + request.path();
        if (!params.isEmpty()) {
            url += "?" + params.entrySet().stream()
                .map(e -> e.getKey() + "=" + encode(e.getValue()))
                .collect(Collectors.joining("&"));
        }
        return URI.create(url);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
