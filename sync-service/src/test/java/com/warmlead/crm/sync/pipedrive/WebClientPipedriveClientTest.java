package com.warmlead.crm.sync.pipedrive;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.warmlead.crm.common.error.ErrorKind;
import com.warmlead.crm.common.remote.RemoteCallResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class WebClientPipedriveClientTest {

    private final ConcurrentLinkedQueue<StubResponse> responses = new ConcurrentLinkedQueue<>();
    private final BlockingQueue<RecordedCall> requests = new LinkedBlockingQueue<>();

    private HttpServer server;
    private ExecutorService serverExecutor;
    private String baseUrl;
    private WebClientPipedriveClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/", this::handle);
        serverExecutor = Executors.newCachedThreadPool();
        server.setExecutor(serverExecutor);
        server.start();
        baseUrl = "http://localhost:" + server.getAddress().getPort() + "/v1";
        client = new WebClientPipedriveClient(WebClient.builder().baseUrl(baseUrl).build(),
            "secret-token", Duration.ofSeconds(2));
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
        serverExecutor.shutdownNow();
    }

    @Test
    void testTestConnection_ReturnsUserAndSendsTokenHeader() throws InterruptedException {
        enqueueJson("{\"success\":true,\"data\":{\"id\":7,\"name\":\"Owner\",\"email\":\"owner@example.com\"}}");

        RemoteCallResult<PipedriveUser> result = client.testConnection();

        assertTrue(result.success());
        assertEquals(7, result.data().id());
        assertEquals("Owner", result.data().name());
        assertEquals("owner@example.com", result.data().email());
        RecordedCall request = takeRequest();
        assertEquals("/v1/users/me", request.path());
        assertEquals("secret-token", request.apiToken());
    }

    @Test
    void testGetPersonsPage_MapsPersonsAndNextStart() throws InterruptedException {
        enqueueJson("""
            {"success":true,
             "data":[
               {"id":1,"name":"Alice","email":[{"value":"alice@example.com","primary":true}],
                "org_id":{"value":6,"name":"Shared Organization","address":"1 Main St"},
                "update_time":"2025-07-10 09:00:00"},
               {"id":2,"name":"Bob","email":[],"org_id":6,"update_time":"2025-07-10 09:00:00"}
             ],
             "additional_data":{"pagination":{"start":0,"limit":2,"more_items_in_collection":true,"next_start":2}}}
            """);

        RemoteCallResult<PersonPage> result = client.getPersonsPage(null, 0, 2);

        assertTrue(result.success());
        PersonPage page = result.data();
        assertEquals(2, page.persons().size());
        assertEquals(2, page.nextStart());
        assertTrue(page.hasMore());
        PipedrivePerson alice = page.persons().get(0);
        assertEquals("alice@example.com", alice.primaryEmail());
        assertEquals(6L, alice.orgId().id());
        assertEquals("Shared Organization", alice.organizationName());
        assertEquals(6L, page.persons().get(1).orgId().id());
        assertNull(page.persons().get(1).primaryEmail());
        RecordedCall request = takeRequest();
        assertTrue(request.path().startsWith("/v1/persons?"));
        assertTrue(request.path().contains("start=0"));
        assertTrue(request.path().contains("limit=2"));
        assertFalse(request.path().contains("secret-token"));
    }

    @Test
    void testGetPersonsPage_LastPage_HasNoNextStart() {
        enqueueJson("{\"success\":true,\"data\":[{\"id\":1,\"name\":\"Alice\"}],"
            + "\"additional_data\":{\"pagination\":{\"start\":0,\"limit\":100,\"more_items_in_collection\":false}}}");

        PersonPage page = client.getPersonsPage(null, 0, 100).data();

        assertFalse(page.hasMore());
        assertNull(page.nextStart());
    }

    @Test
    void testGetPersonsPage_NullData_IsEmptyPage() {
        enqueueJson("{\"success\":true,\"data\":null}");

        PersonPage page = client.getPersonsPage(null, 0, 100).data();

        assertTrue(page.persons().isEmpty());
        assertFalse(page.hasMore());
    }

    @Test
    void testGetPersonsPage_Since_KeepsOnlyPersonsUpdatedAtOrAfter() {
        enqueueJson("""
            {"success":true,
             "data":[
               {"id":1,"name":"Old","update_time":"2025-07-01 09:00:00"},
               {"id":2,"name":"Same","update_time":"2025-07-10 09:00:00"},
               {"id":3,"name":"New","update_time":"2025-07-12 09:00:00"}
             ],
             "additional_data":{"pagination":{"start":0,"limit":3,"more_items_in_collection":true}}}
            """);

        PersonPage page = client.getPersonsPage(LocalDateTime.of(2025, 7, 10, 9, 0), 0, 3).data();

        assertEquals(List.of(2L, 3L), page.persons().stream().map(PipedrivePerson::id).toList());
        assertEquals(3, page.fetched());
        assertEquals(3, page.nextStart());
    }

    @Test
    void testGetPersonsPage_Unauthorized_IsAuthenticationFailure() {
        enqueueStatus(401);

        RemoteCallResult<PersonPage> result = client.getPersonsPage(null, 0, 100);

        assertFalse(result.success());
        assertEquals(ErrorKind.AUTHENTICATION, result.errorKind());
        assertEquals("Unauthorized: Pipedrive rejected the API token (HTTP 401)", result.error());
    }

    @Test
    void testGetPersonsPage_TooManyRequests_IsRateLimit() {
        enqueueStatus(429);

        RemoteCallResult<PersonPage> result = client.getPersonsPage(null, 0, 100);

        assertEquals(ErrorKind.RATE_LIMIT, result.errorKind());
        assertTrue(result.error().contains("rate limit"));
    }

    @Test
    void testGetPersonsPage_ServerError_IsExternalApiFailure() {
        enqueueStatus(500);

        RemoteCallResult<PersonPage> result = client.getPersonsPage(null, 0, 100);

        assertEquals(ErrorKind.EXTERNAL_API, result.errorKind());
        assertEquals("Pipedrive API error: HTTP 500 (/persons)", result.error());
    }

    @Test
    void testGetPersonsPage_EnvelopeFailure_IsExternalApiFailure() {
        enqueueJson("{\"success\":false,\"error\":\"Scope and URL mismatch\"}");

        RemoteCallResult<PersonPage> result = client.getPersonsPage(null, 0, 100);

        assertEquals(ErrorKind.EXTERNAL_API, result.errorKind());
        assertEquals("Pipedrive API error: Scope and URL mismatch", result.error());
    }

    @Test
    void testGetPersonsPage_SlowResponse_IsNetworkTimeout() {
        WebClientPipedriveClient impatient = new WebClientPipedriveClient(
            WebClient.builder().baseUrl(baseUrl).build(), "secret-token", Duration.ofMillis(100));
        responses.add(new StubResponse(200, "{\"success\":true,\"data\":[]}", 2000));

        RemoteCallResult<PersonPage> result = impatient.getPersonsPage(null, 0, 100);

        assertEquals(ErrorKind.NETWORK, result.errorKind());
        assertEquals("Pipedrive request timeout after 100ms (/persons)", result.error());
    }

    @Test
    void testGetOrganizationDetails_NotFound_IsExternalApiFailure() {
        enqueueStatus(404);

        RemoteCallResult<PipedriveOrganization> result = client.getOrganizationDetails(99);

        assertFalse(result.success());
        assertEquals(ErrorKind.EXTERNAL_API, result.errorKind());
        assertEquals("Pipedrive API error: HTTP 404 (/organizations/{id})", result.error());
    }

    @Test
    void testGetOrganizations_FollowsPagination() throws InterruptedException {
        enqueueJson("{\"success\":true,\"data\":[{\"id\":1,\"name\":\"Acme\"}],"
            + "\"additional_data\":{\"pagination\":{\"start\":0,\"limit\":500,\"more_items_in_collection\":true,\"next_start\":1}}}");
        enqueueJson("{\"success\":true,\"data\":[{\"id\":2,\"name\":\"Globex\"}],"
            + "\"additional_data\":{\"pagination\":{\"start\":1,\"limit\":500,\"more_items_in_collection\":false}}}");

        RemoteCallResult<List<PipedriveOrganization>> result = client.getOrganizations();

        assertEquals(List.of("Acme", "Globex"), result.data().stream().map(PipedriveOrganization::name).toList());
        takeRequest();
        assertTrue(takeRequest().path().contains("start=1"));
    }

    @Test
    void testGetOrganizationDetails_MapsFields() throws InterruptedException {
        enqueueJson("{\"success\":true,\"data\":{\"id\":6,\"name\":\"Shared Organization\","
            + "\"address_locality\":\"Berlin\",\"address_country\":\"Germany\",\"employee_count\":40}}");

        RemoteCallResult<PipedriveOrganization> result = client.getOrganizationDetails(6);

        assertTrue(result.success());
        PipedriveOrganization organization = result.data();
        assertEquals(6, organization.id());
        assertEquals("Shared Organization", organization.name());
        assertEquals("Germany", organization.addressCountry());
        assertEquals("Berlin", organization.addressLocality());
        assertEquals(40, organization.employeeCount());
        assertEquals("/v1/organizations/6", takeRequest().path());
    }

    @Test
    void testSearchPersons_MapsSearchItems() throws InterruptedException {
        enqueueJson("""
            {"success":true,
             "data":{"items":[
               {"result_score":0.9,"item":{"id":11,"name":"Alice","emails":["alice@example.com","a@example.org"],
                "phones":[],"organization":{"id":6,"name":"Shared Organization"}}}
             ]}}
            """);

        List<PipedrivePerson> persons = client.searchPersons("alice").data();

        assertEquals(1, persons.size());
        assertEquals(11, persons.get(0).id());
        assertEquals("alice@example.com", persons.get(0).primaryEmail());
        assertEquals("Shared Organization", persons.get(0).organizationName());
        assertTrue(takeRequest().path().contains("term=alice"));
    }

    @Test
    void testClassifyStatus_MapsStatusCodes() {
        assertEquals(ErrorKind.RATE_LIMIT, WebClientPipedriveClient.classifyStatus(HttpStatusCode.valueOf(429)));
        assertEquals(ErrorKind.AUTHENTICATION, WebClientPipedriveClient.classifyStatus(HttpStatusCode.valueOf(403)));
        assertEquals(ErrorKind.VALIDATION, WebClientPipedriveClient.classifyStatus(HttpStatusCode.valueOf(422)));
        assertEquals(ErrorKind.EXTERNAL_API, WebClientPipedriveClient.classifyStatus(HttpStatusCode.valueOf(503)));
    }

    private void enqueueJson(String body) {
        responses.add(new StubResponse(200, body, 0));
    }

    private void enqueueStatus(int status) {
        responses.add(new StubResponse(status, null, 0));
    }

    private RecordedCall takeRequest() throws InterruptedException {
        RecordedCall call = requests.poll(1, TimeUnit.SECONDS);
        assertNotNull(call, "Expected a request to reach the stub server");
        return call;
    }

    private void handle(HttpExchange exchange) throws IOException {
        requests.add(new RecordedCall(exchange.getRequestURI().toString(),
            exchange.getRequestHeaders().getFirst("x-api-token")));
        StubResponse response = responses.poll();
        if (response == null) {
            exchange.sendResponseHeaders(404, -1);
            exchange.close();
            return;
        }
        if (response.delayMs() > 0) {
            try {
                Thread.sleep(response.delayMs());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                exchange.close();
                return;
            }
        }
        if (response.body() == null) {
            exchange.sendResponseHeaders(response.status(), -1);
            exchange.close();
            return;
        }
        byte[] bytes = response.body().getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(response.status(), bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private record StubResponse(int status, String body, long delayMs) {
    }

    private record RecordedCall(String path, String apiToken) {
    }
}
