package com.example.dynatrace.service;

import com.example.dynatrace.dto.Value;
import com.example.dynatrace.exception.DynatraceApiException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the (id, name) summaries out of a list response.
 * The config APIs disagree on the shape: most wrap the entries in {@code values}, others use
 * a family specific key ({@code slo} for the v2 SLO API) or return a bare array, and the synthetic APIs call the id {@code entityId}.
 */
public class ValueListParser {

    private static final List<String> CONTAINER_KEYS = List.of("values", "dashboards", "monitors", "locations", "extensions", "slo");

    private final ObjectMapper objectMapper;

    public ValueListParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<Value> parse(String apiId, String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new DynatraceApiException("Failed to parse list response of api " + apiId, e);
        }

        JsonNode items = findItems(root);
        if (items == null) {
            throw new DynatraceApiException("List response of api " + apiId + " contains no list of values");
        }

        List<Value> values = new ArrayList<>();
        for (JsonNode item : items) {
            String id = idOf(item);
            if (id == null) {
                continue;
            }
            values.add(new Value(id, item.path("name").asText("")));
        }
        return values;
    }

    /**
     * Id of a single object, {@code id} taking precedence over {@code entityId}.
     */
    static String idOf(JsonNode node) {
        if (node.hasNonNull("id")) {
            return node.get("id").asText();
        }
        if (node.hasNonNull("entityId")) {
            return node.get("entityId").asText();
        }
        return null;
    }

    private JsonNode findItems(JsonNode root) {
        if (root == null) {
            return null;
        }
        if (root.isArray()) {
            return root;
        }
        for (String key : CONTAINER_KEYS) {
            JsonNode candidate = root.get(key);
            if (candidate != null && candidate.isArray()) {
                return candidate;
            }
        }
        return null;
    }
}
