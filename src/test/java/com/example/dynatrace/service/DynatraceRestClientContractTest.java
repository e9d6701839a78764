package com.example.dynatrace.service;

import com.example.dynatrace.api.Api;
import com.example.dynatrace.api.ConfigApi;
import com.example.dynatrace.dto.DynatraceEntity;
import com.example.dynatrace.dto.ExistsResult;
import com.example.dynatrace.test.FakeConfigApiDispatcher;
import com.example.dynatrace.test.TestUtils;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Name-based upsert/read/delete against a stateful fake config collection.
 */
class DynatraceRestClientContractTest {

    private static final String PATH = "/api/config/v1/managementZones";

    private MockWebServer mockWebServer;
    private FakeConfigApiDispatcher dispatcher;
    private DynatraceRestClient client;
    private final Api api = new ConfigApi("management-zone", PATH);

    @BeforeEach
    void setUp() throws IOException {
        dispatcher = new FakeConfigApiDispatcher(PATH);
        mockWebServer = new MockWebServer();
        mockWebServer.setDispatcher(dispatcher);
        mockWebServer.start();

        DynatraceTransport transport = new DynatraceTransport(WebClient.builder(), TestUtils.configFor(mockWebServer));
        client = new DynatraceRestClient(transport, new ObjectMapper());
    }

    @AfterEach
    void tearDown() throws IOException {
        mockWebServer.shutdown();
    }

    @Test
    @DisplayName("An upserted config is found by name under the returned id")
    void testUpsertThenExists() {
        DynatraceEntity entity = client.upsertByName(api, "Production", "{\"name\":\"Production\",\"rules\":[]}");

        ExistsResult result = client.existsByName(api, "Production");

        assertTrue(result.isExists());
        assertEquals(entity.getId(), result.getId());
    }

    @Test
    @DisplayName("Upserting the same name twice updates in place")
    void testUpsertTwiceKeepsSingleObject() throws Exception {
        DynatraceEntity first = client.upsertByName(api, "Production", "{\"name\":\"Production\",\"description\":\"A\"}");
        DynatraceEntity second = client.upsertByName(api, "Production", "{\"name\":\"Production\",\"description\":\"B\"}");

        assertEquals(first.getId(), second.getId());
        Map<String, ObjectNode> objects = dispatcher.getObjects();
        assertEquals(1, objects.size());
        assertEquals("B", objects.get(first.getId()).path("description").asText());

        String stored = client.readByName(api, "Production");
        assertEquals("B", new ObjectMapper().readTree(stored).path("description").asText());
    }

    @Test
    @DisplayName("Delete after upsert leaves the name absent")
    void testUpsertThenDelete() {
        client.upsertByName(api, "Staging", "{\"name\":\"Staging\"}");
        client.upsertByName(api, "Production", "{\"name\":\"Production\"}");

        client.deleteByName(api, "Staging");

        assertFalse(client.existsByName(api, "Staging").isExists());
        assertTrue(client.existsByName(api, "Production").isExists());
        assertEquals(1, dispatcher.getObjects().size());
    }

    @Test
    void testDeleteIsIdempotent() {
        client.upsertByName(api, "Staging", "{\"name\":\"Staging\"}");

        client.deleteByName(api, "Staging");
        assertDoesNotThrow(() -> client.deleteByName(api, "Staging"));

        assertTrue(dispatcher.getObjects().isEmpty());
    }
}
