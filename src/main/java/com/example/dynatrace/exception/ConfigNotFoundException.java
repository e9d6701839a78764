package com.example.dynatrace.exception;

/**
 * No configuration object with the requested name exists in the given family.
 */
public class ConfigNotFoundException extends RuntimeException {

    private final String apiId;
    private final String name;

    public ConfigNotFoundException(String apiId, String name) {
        super("404 - no config found with name " + name + " for api " + apiId);
        this.apiId = apiId;
        this.name = name;
    }

    public String getApiId() {
        return apiId;
    }

    public String getName() {
        return name;
    }
}
