package tech.flowcatalyst.directory.client;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.stubbing.Scenario;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tech.flowcatalyst.directory.client.auth.TokenProvider;
import tech.flowcatalyst.directory.consistency.ConsistencyRetryPolicies;
import tech.flowcatalyst.directory.consistency.OutcomeClassifiers;
import tech.flowcatalyst.directory.exception.RemoteRejectionException;
import tech.flowcatalyst.directory.exception.RequestCancelledException;
import tech.flowcatalyst.directory.exception.TransportException;
import tech.flowcatalyst.directory.odata.ODataQuery;
import tech.flowcatalyst.directory.test.TestConfigs;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests for the DirectoryHttpClient retry loop against a WireMock server.
 */
class DirectoryHttpClientTest {

    private static final String APP_PATH = "/v1.0/applications/app-1";

    private static final String NOT_FOUND_BODY = "{\"error\":{\"code\":\"Request_ResourceNotFound\","
        + "\"message\":\"Resource 'app-1' does not exist or one of its queried reference-property objects are not present.\","
        + "\"innerError\":{\"request-id\":\"req-404\"}}}";

    private static final String ALREADY_EXISTS_BODY = "{\"error\":{\"code\":\"Request_BadRequest\","
        + "\"message\":\"One or more added object references already exist for the following modified properties: 'owners'.\"}}";

    private WireMockServer wireMockServer;
    private DirectoryHttpClient client;

    @BeforeEach
    void setUp() {
        wireMockServer = new WireMockServer(options().dynamicPort());
        wireMockServer.start();
        client = new DirectoryHttpClient(TestConfigs.forServer(wireMockServer.baseUrl()), () -> "test-token");
    }

    @AfterEach
    void tearDown() {
        if (wireMockServer.isRunning()) {
            wireMockServer.stop();
        }
    }

    private DirectoryResponse getApplication() {
        return client.execute(DirectoryRequest.get("/applications/app-1")
            .validStatus(200)
            .consistencyPolicy(ConsistencyRetryPolicies.RETRY_ON_NOT_FOUND)
            .build());
    }

    @Test
    void shouldRetryNotFoundUntilObjectReplicates() {
        // Given - first read hits a replica that has not seen the object yet
        wireMockServer.stubFor(get(urlPathEqualTo(APP_PATH))
            .inScenario("replication")
            .whenScenarioStateIs(Scenario.STARTED)
            .willReturn(aResponse().withStatus(404).withBody(NOT_FOUND_BODY))
            .willSetStateTo("replicated"));
        wireMockServer.stubFor(get(urlPathEqualTo(APP_PATH))
            .inScenario("replication")
            .whenScenarioStateIs("replicated")
            .willReturn(okJson("{\"id\":\"app-1\"}")));

        // When
        DirectoryResponse response = getApplication();

        // Then
        assertEquals(200, response.status());
        assertFalse(response.classified());
        wireMockServer.verify(2, getRequestedFor(urlPathEqualTo(APP_PATH))
            .withHeader("Authorization", equalTo("Bearer test-token")));
    }

    @Test
    void shouldFailWithLastStatusWhenRetriesAreExhausted() {
        // Given
        wireMockServer.stubFor(get(urlPathEqualTo(APP_PATH))
            .willReturn(aResponse().withStatus(404).withBody(NOT_FOUND_BODY)));

        // When
        RemoteRejectionException e = assertThrows(RemoteRejectionException.class, this::getApplication);

        // Then - max-attempts is 4 in the test configuration
        assertEquals(404, e.getStatusCode());
        assertEquals("Request_ResourceNotFound", e.getError().orElseThrow().code());
        assertEquals("req-404", e.getError().orElseThrow().innerError().requestId());
        assertEquals("GET", e.getMethod());
        wireMockServer.verify(4, getRequestedFor(urlPathEqualTo(APP_PATH)));
    }

    @Test
    void shouldNotRetryWhenPolicyIsNever() {
        // Given
        wireMockServer.stubFor(get(urlPathEqualTo(APP_PATH))
            .willReturn(aResponse().withStatus(404).withBody(NOT_FOUND_BODY)));

        // When
        RemoteRejectionException e = assertThrows(RemoteRejectionException.class,
            () -> client.execute(DirectoryRequest.get("/applications/app-1").validStatus(200).build()));

        // Then
        assertEquals(404, e.getStatusCode());
        wireMockServer.verify(1, getRequestedFor(urlPathEqualTo(APP_PATH)));
    }

    @Test
    void shouldFailImmediatelyOnStatusOutsidePolicy() {
        // Given
        wireMockServer.stubFor(get(urlPathEqualTo(APP_PATH))
            .willReturn(aResponse().withStatus(403)
                .withBody("{\"error\":{\"code\":\"Authorization_RequestDenied\",\"message\":\"Insufficient privileges.\"}}")));

        // When
        RemoteRejectionException e = assertThrows(RemoteRejectionException.class, this::getApplication);

        // Then
        assertEquals(403, e.getStatusCode());
        assertTrue(e.getMessage().contains("Authorization_RequestDenied"));
        wireMockServer.verify(1, getRequestedFor(urlPathEqualTo(APP_PATH)));
    }

    @Test
    void shouldAcceptClassifiedResponseWithoutRetry() {
        // Given
        wireMockServer.stubFor(post(urlPathEqualTo(APP_PATH + "/owners/$ref"))
            .willReturn(aResponse().withStatus(400).withBody(ALREADY_EXISTS_BODY)));

        // When
        DirectoryResponse response = client.execute(DirectoryRequest.post("/applications/app-1/owners/$ref")
            .body("{\"@odata.id\":\"x\"}".getBytes(StandardCharsets.UTF_8))
            .validStatus(204)
            .consistencyPolicy(ConsistencyRetryPolicies.RETRY_ON_NOT_FOUND)
            .outcomeClassifier(OutcomeClassifiers.REFERENCE_ALREADY_EXISTS)
            .build());

        // Then
        assertTrue(response.classified());
        assertEquals(400, response.status());
        assertNotNull(response.error());
        wireMockServer.verify(1, postRequestedFor(urlPathEqualTo(APP_PATH + "/owners/$ref"))
            .withHeader("Content-Type", equalTo("application/json")));
    }

    @Test
    void shouldCancelWhenConsistencyDeadlineIsExceeded() {
        // Given - a zero overall budget leaves no room for the first backoff
        client = new DirectoryHttpClient(
            TestConfigs.forServer(wireMockServer.baseUrl(), Map.of("directory.consistency.timeout", "0")),
            () -> "test-token");
        wireMockServer.stubFor(get(urlPathEqualTo(APP_PATH))
            .willReturn(aResponse().withStatus(404).withBody(NOT_FOUND_BODY)));

        // When
        RequestCancelledException e = assertThrows(RequestCancelledException.class, this::getApplication);

        // Then
        assertEquals(404, e.getStatusCode());
        wireMockServer.verify(1, getRequestedFor(urlPathEqualTo(APP_PATH)));
    }

    @Test
    void shouldCancelWithoutRequestWhenThreadIsInterrupted() {
        // Given
        wireMockServer.stubFor(get(urlPathEqualTo(APP_PATH)).willReturn(okJson("{\"id\":\"app-1\"}")));
        Thread.currentThread().interrupt();

        // When
        try {
            assertThrows(RequestCancelledException.class, this::getApplication);
        } finally {
            Thread.interrupted();
        }

        // Then
        wireMockServer.verify(0, getRequestedFor(urlPathEqualTo(APP_PATH)));
    }

    @Test
    void shouldRetryThrottledResponsesHonouringRetryAfter() {
        // Given
        wireMockServer.stubFor(get(urlPathEqualTo(APP_PATH))
            .inScenario("throttling")
            .whenScenarioStateIs(Scenario.STARTED)
            .willReturn(aResponse().withStatus(429).withHeader("Retry-After", "0"))
            .willSetStateTo("open"));
        wireMockServer.stubFor(get(urlPathEqualTo(APP_PATH))
            .inScenario("throttling")
            .whenScenarioStateIs("open")
            .willReturn(okJson("{\"id\":\"app-1\"}")));

        // When
        DirectoryResponse response = getApplication();

        // Then
        assertEquals(200, response.status());
        wireMockServer.verify(2, getRequestedFor(urlPathEqualTo(APP_PATH)));
    }

    @Test
    void shouldFallBackToRetryDelayWhenRetryAfterIsNegative() {
        // Given
        wireMockServer.stubFor(get(urlPathEqualTo(APP_PATH))
            .inScenario("negative-retry-after")
            .whenScenarioStateIs(Scenario.STARTED)
            .willReturn(aResponse().withStatus(429).withHeader("Retry-After", "-1"))
            .willSetStateTo("open"));
        wireMockServer.stubFor(get(urlPathEqualTo(APP_PATH))
            .inScenario("negative-retry-after")
            .whenScenarioStateIs("open")
            .willReturn(okJson("{\"id\":\"app-1\"}")));

        // When
        DirectoryResponse response = getApplication();

        // Then
        assertEquals(200, response.status());
        wireMockServer.verify(2, getRequestedFor(urlPathEqualTo(APP_PATH)));
    }

    @Test
    void shouldStopRetryingThrottledResponsesAfterRetryAttempts() {
        // Given
        wireMockServer.stubFor(get(urlPathEqualTo(APP_PATH))
            .willReturn(aResponse().withStatus(503)));

        // When
        RemoteRejectionException e = assertThrows(RemoteRejectionException.class, this::getApplication);

        // Then - retry-attempts defaults to 3
        assertEquals(503, e.getStatusCode());
        assertTrue(e.getError().isEmpty());
        wireMockServer.verify(3, getRequestedFor(urlPathEqualTo(APP_PATH)));
    }

    @Test
    void shouldRefreshTokenOnceAfterUnauthorized() {
        // Given
        TokenProvider tokens = mock(TokenProvider.class);
        when(tokens.getAccessToken()).thenReturn("stale");
        when(tokens.refreshToken()).thenReturn("fresh");
        client = new DirectoryHttpClient(TestConfigs.forServer(wireMockServer.baseUrl()), tokens);

        wireMockServer.stubFor(get(urlPathEqualTo(APP_PATH))
            .withHeader("Authorization", equalTo("Bearer stale"))
            .willReturn(aResponse().withStatus(401)));
        wireMockServer.stubFor(get(urlPathEqualTo(APP_PATH))
            .withHeader("Authorization", equalTo("Bearer fresh"))
            .willReturn(okJson("{\"id\":\"app-1\"}")));

        // When
        DirectoryResponse response = getApplication();

        // Then
        assertEquals(200, response.status());
        verify(tokens, times(1)).refreshToken();
    }

    @Test
    void shouldFailWhenUnauthorizedPersistsAfterRefresh() {
        // Given
        wireMockServer.stubFor(get(urlPathEqualTo(APP_PATH)).willReturn(aResponse().withStatus(401)));

        // When
        RemoteRejectionException e = assertThrows(RemoteRejectionException.class, this::getApplication);

        // Then
        assertEquals(401, e.getStatusCode());
        wireMockServer.verify(2, getRequestedFor(urlPathEqualTo(APP_PATH)));
    }

    @Test
    void shouldFollowNextLinksAndMergePages() {
        // Given
        String nextLink = wireMockServer.baseUrl() + "/v1.0/applications?$skiptoken=page2";
        wireMockServer.stubFor(get(urlPathEqualTo("/v1.0/applications"))
            .withQueryParam("$skiptoken", absent())
            .willReturn(okJson("{\"value\":[{\"id\":\"a\"}],\"@odata.nextLink\":\"" + nextLink + "\"}")));
        wireMockServer.stubFor(get(urlPathEqualTo("/v1.0/applications"))
            .withQueryParam("$skiptoken", equalTo("page2"))
            .willReturn(okJson("{\"value\":[{\"id\":\"b\"},{\"id\":\"c\"}]}")));

        // When
        DirectoryResponse response = client.execute(DirectoryRequest.get("/applications")
            .validStatus(200)
            .paged()
            .build());

        // Then
        var ids = client.getCodec().decodeList(response, Map.class).stream().map(m -> m.get("id")).toList();
        assertEquals(List.of("a", "b", "c"), ids);
        wireMockServer.verify(2, getRequestedFor(urlPathEqualTo("/v1.0/applications")));
    }

    @Test
    void shouldNotFollowNextLinkWhenTopIsSet() {
        // Given
        wireMockServer.stubFor(get(urlPathEqualTo("/v1.0/applications"))
            .willReturn(okJson("{\"value\":[{\"id\":\"a\"}],\"@odata.nextLink\":\"" + wireMockServer.baseUrl()
                + "/v1.0/applications?$skiptoken=page2\"}")));

        // When
        DirectoryResponse response = client.execute(DirectoryRequest.get("/applications")
            .query(ODataQuery.builder().top(1).build())
            .validStatus(200)
            .paged()
            .build());

        // Then
        assertEquals(1, client.getCodec().decodeList(response, Map.class).size());
        wireMockServer.verify(1, getRequestedFor(urlPathEqualTo("/v1.0/applications")));
    }

    @Test
    void shouldSendQueryParametersAndHeaders() {
        // Given
        wireMockServer.stubFor(get(urlPathEqualTo("/v1.0/applications"))
            .willReturn(okJson("{\"value\":[]}")));

        // When
        client.execute(DirectoryRequest.get("/applications")
            .query(ODataQuery.builder()
                .filter("displayName eq 'billing app'")
                .select("id")
                .count(true)
                .consistencyLevel(ODataQuery.ConsistencyLevel.EVENTUAL)
                .build())
            .validStatus(200)
            .build());

        // Then
        wireMockServer.verify(getRequestedFor(urlPathEqualTo("/v1.0/applications"))
            .withQueryParam("$filter", equalTo("displayName eq 'billing app'"))
            .withQueryParam("$select", equalTo("id"))
            .withQueryParam("$count", equalTo("true"))
            .withHeader("ConsistencyLevel", equalTo("eventual"))
            .withHeader("Accept", equalTo("application/json")));
    }

    @Test
    void shouldWrapConnectionFailureAsTransportException() {
        // Given
        String baseUrl = wireMockServer.baseUrl();
        wireMockServer.stop();
        client = new DirectoryHttpClient(TestConfigs.forServer(baseUrl), () -> "test-token");

        // Then
        TransportException e = assertThrows(TransportException.class, this::getApplication);
        assertEquals(0, e.getStatusCode());
    }

    @Test
    void directoryObjectUri_isRootedAtApiVersion() {
        assertEquals(wireMockServer.baseUrl() + "/v1.0/directoryObjects/u-1", client.directoryObjectUri("u-1"));
    }
}
