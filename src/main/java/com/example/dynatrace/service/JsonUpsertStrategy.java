package com.example.dynatrace.service;

import com.example.dynatrace.api.Api;
import com.example.dynatrace.dto.DynatraceEntity;
import com.example.dynatrace.exception.DynatraceApiException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;

import java.net.URI;
import java.util.Optional;

/**
 * Upsert for the families that take a plain JSON body.
 * The object is looked up by name first; absent objects are created with
 * {@code POST <collection>}, existing ones replaced with {@code PUT <collection>/<id>}.
 * Not atomic: a concurrent create of the same name between lookup and write yields a duplicate.
 */
public class JsonUpsertStrategy implements UpsertStrategy {

    private static final Logger log = LoggerFactory.getLogger(JsonUpsertStrategy.class);

    private final DynatraceTransport transport;
    private final NameResolver nameResolver;
    private final ObjectMapper objectMapper;

    public JsonUpsertStrategy(DynatraceTransport transport, NameResolver nameResolver, ObjectMapper objectMapper) {
        this.transport = transport;
        this.nameResolver = nameResolver;
        this.objectMapper = objectMapper;
    }

    @Override
    public DynatraceEntity upsert(Api api, String name, String payload) {
        String url = api.getUrlFromEnvironmentUrl(transport.getEnvironmentUrl());
        Optional<String> existingId = nameResolver.resolve(api, name);

        if (existingId.isEmpty()) {
            ResponseEntity<String> response = transport.post(url, payload);
            DynatraceEntity entity = parseEntity(api, response.getBody());
            if (entity.getId() == null) {
                entity.setId(idOfCreated(api, name, response));
            }
            if (entity.getName() == null) {
                entity.setName(name);
            }
            log.info("Created {} config '{}' with id {}", api.getId(), name, entity.getId());
            return entity;
        }

        String id = existingId.get();
        String response = transport.put(url, id, payload);
        DynatraceEntity entity = parseEntity(api, response);
        // PUT usually answers 204 without a body
        if (entity.getId() == null) {
            entity.setId(id);
        }
        if (entity.getName() == null) {
            entity.setName(name);
        }
        log.info("Updated {} config '{}' with id {}", api.getId(), name, id);
        return entity;
    }

    /**
     * Id of an object created without a response body: the last segment of the
     * {@code Location} header, otherwise a fresh lookup by name.
     */
    private String idOfCreated(Api api, String name, ResponseEntity<String> response) {
        URI location = response.getHeaders().getLocation();
        if (location != null && location.getPath() != null) {
            String path = location.getPath();
            while (path.endsWith("/")) {
                path = path.substring(0, path.length() - 1);
            }
            String id = path.substring(path.lastIndexOf('/') + 1);
            if (!id.isEmpty()) {
                log.debug("Took id {} of created {} config '{}' from Location header", id, api.getId(), name);
                return id;
            }
        }

        log.debug("Create of {} config '{}' returned no id, looking it up by name", api.getId(), name);
        return nameResolver.resolve(api, name)
                .orElseThrow(() -> new DynatraceApiException("Creating " + api.getId() + " config '" + name
                        + "' returned no id and it could not be found by name: " + response.getBody()));
    }

    private DynatraceEntity parseEntity(Api api, String response) {
        if (response == null || response.isBlank()) {
            return new DynatraceEntity();
        }
        try {
            JsonNode node = objectMapper.readTree(response);
            return DynatraceEntity.builder()
                    .id(ValueListParser.idOf(node))
                    .name(node.hasNonNull("name") ? node.get("name").asText() : null)
                    .description(node.hasNonNull("description") ? node.get("description").asText() : null)
                    .build();
        } catch (JsonProcessingException e) {
            throw new DynatraceApiException("Failed to parse response of api " + api.getId() + ": " + response, e);
        }
    }
}
