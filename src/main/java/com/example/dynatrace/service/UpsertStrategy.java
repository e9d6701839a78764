package com.example.dynatrace.service;

import com.example.dynatrace.api.Api;
import com.example.dynatrace.dto.DynatraceEntity;

/**
 * Create-or-update of one named configuration object, in the encoding a family requires.
 */
public interface UpsertStrategy {

    DynatraceEntity upsert(Api api, String name, String payload);
}
