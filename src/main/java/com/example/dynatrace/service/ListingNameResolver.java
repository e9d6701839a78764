package com.example.dynatrace.service;

import com.example.dynatrace.api.Api;
import com.example.dynatrace.dto.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Resolves names by listing the whole family and scanning it linearly.
 * The Dynatrace config APIs offer no server-side name filter, so every resolution
 * re-reads the list; nothing is cached between calls.
 * Names are compared exactly. If the list holds the same name twice, the first entry wins.
 */
public class ListingNameResolver implements NameResolver {

    private static final Logger log = LoggerFactory.getLogger(ListingNameResolver.class);

    private final Function<Api, List<Value>> lister;

    public ListingNameResolver(Function<Api, List<Value>> lister) {
        this.lister = lister;
    }

    @Override
    public Optional<String> resolve(Api api, String name) {
        List<Value> values = lister.apply(api);

        Value match = null;
        for (Value value : values) {
            if (name.equals(value.getName())) {
                if (match == null) {
                    match = value;
                } else {
                    log.warn("Found more than one {} config named '{}' (ids {} and {}), using {}",
                            api.getId(), name, match.getId(), value.getId(), match.getId());
                }
            }
        }

        if (match == null) {
            log.debug("No {} config named '{}' among {} values", api.getId(), name, values.size());
            return Optional.empty();
        }
        log.debug("Resolved {} config '{}' to id {}", api.getId(), name, match.getId());
        return Optional.of(match.getId());
    }
}
