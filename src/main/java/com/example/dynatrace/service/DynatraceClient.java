package com.example.dynatrace.service;

import com.example.dynatrace.api.Api;
import com.example.dynatrace.dto.DynatraceEntity;
import com.example.dynatrace.dto.ExistsResult;
import com.example.dynatrace.dto.Value;

import java.util.List;

/**
 * Basic CRUD operations on any supported Dynatrace configuration API, addressed by name.
 * The configuration-specific inconsistencies of individual APIs are handled here, so callers
 * never need to know the Dynatrace id of an object or how a family encodes its payload.
 * All calls are blocking; failed HTTP calls surface as
 * {@link com.example.dynatrace.exception.DynatraceApiException}.
 */
public interface DynatraceClient {

    /**
     * Lists the available configs for an API.
     * For alerting profiles this calls {@code GET <environment-url>/api/config/v1/alertingProfiles}.
     */
    List<Value> list(Api api);

    /**
     * Reads a config identified by name.
     * Calls the list endpoint to find the id, then {@code GET <collection>/<id>}.
     *
     * @throws com.example.dynatrace.exception.ConfigNotFoundException if no config has that name
     */
    String readByName(Api api, String name);

    /**
     * Reads a config identified by id with {@code GET <collection>/<id>}.
     */
    String readById(Api api, String id);

    /**
     * Creates the config if no config with that name exists, replaces it in place otherwise.
     * For JSON families this lists the collection, then either {@code POST <collection>} or
     * {@code PUT <collection>/<id>}. Extensions are uploaded as a zip instead.
     */
    DynatraceEntity upsertByName(Api api, String name, String payload);

    /**
     * Deletes the config with the given name via {@code DELETE <collection>/<id>}.
     * Does nothing if no config has that name.
     */
    void deleteByName(Api api, String name);

    /**
     * Checks if a config with the given name exists. A missing config is not an error.
     */
    ExistsResult existsByName(Api api, String name);
}
