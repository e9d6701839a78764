package com.example.dynatrace.service;

import com.example.dynatrace.api.Api;

import java.util.Optional;

/**
 * Maps the name of a configuration object to the Dynatrace id currently backing it.
 */
@FunctionalInterface
public interface NameResolver {

    /**
     * @return the id of the object named {@code name}, or empty if the family holds none
     */
    Optional<String> resolve(Api api, String name);
}
