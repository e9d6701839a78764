package com.example.dynatrace.service;

import com.example.dynatrace.api.Api;
import com.example.dynatrace.dto.DynatraceEntity;
import com.example.dynatrace.dto.ExistsResult;
import com.example.dynatrace.dto.Value;
import com.example.dynatrace.enums.UploadKind;
import com.example.dynatrace.exception.ConfigNotFoundException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link DynatraceClient} on top of the Dynatrace REST configuration APIs.
 * Holds no state between calls: every name is resolved against a fresh listing.
 */
@Service
public class DynatraceRestClient implements DynatraceClient {

    private static final Logger log = LoggerFactory.getLogger(DynatraceRestClient.class);

    private final DynatraceTransport transport;
    private final ValueListParser valueListParser;
    private final NameResolver nameResolver;
    private final Map<UploadKind, UpsertStrategy> upsertStrategies = new EnumMap<>(UploadKind.class);

    @Autowired
    public DynatraceRestClient(DynatraceTransport transport, ObjectMapper objectMapper) {
        this.transport = transport;
        this.valueListParser = new ValueListParser(objectMapper);
        this.nameResolver = new ListingNameResolver(this::list);
        upsertStrategies.put(UploadKind.STANDARD_JSON, new JsonUpsertStrategy(transport, nameResolver, objectMapper));
        upsertStrategies.put(UploadKind.EXTENSION_UPLOAD, new ExtensionUploadStrategy(transport, objectMapper));
    }

    /**
     * Client for one environment outside of a Spring context.
     */
    public static DynatraceRestClient create(String environmentUrl, String apiToken) {
        DynatraceTransport transport = new DynatraceTransport(WebClient.builder(), environmentUrl, apiToken);
        return new DynatraceRestClient(transport, new ObjectMapper());
    }

    @Override
    public List<Value> list(Api api) {
        String response = transport.get(collectionUrl(api));
        List<Value> values = valueListParser.parse(api.getId(), response);
        log.debug("Listed {} {} configs", values.size(), api.getId());
        return values;
    }

    @Override
    public String readByName(Api api, String name) {
        String id = nameResolver.resolve(api, name)
                .orElseThrow(() -> new ConfigNotFoundException(api.getId(), name));
        return readById(api, id);
    }

    @Override
    public String readById(Api api, String id) {
        return transport.getById(collectionUrl(api), id);
    }

    @Override
    public DynatraceEntity upsertByName(Api api, String name, String payload) {
        UpsertStrategy strategy = upsertStrategies.get(api.getUploadKind());
        if (strategy == null) {
            throw new IllegalStateException("No upsert strategy for upload kind " + api.getUploadKind());
        }
        return strategy.upsert(api, name, payload);
    }

    @Override
    public void deleteByName(Api api, String name) {
        Optional<String> id = nameResolver.resolve(api, name);
        if (id.isEmpty()) {
            log.debug("No {} config named '{}' to delete", api.getId(), name);
            return;
        }
        transport.delete(collectionUrl(api), id.get());
        log.info("Deleted {} config '{}' with id {}", api.getId(), name, id.get());
    }

    @Override
    public ExistsResult existsByName(Api api, String name) {
        return nameResolver.resolve(api, name)
                .map(ExistsResult::found)
                .orElseGet(ExistsResult::notFound);
    }

    private String collectionUrl(Api api) {
        return api.getUrlFromEnvironmentUrl(transport.getEnvironmentUrl());
    }
}
