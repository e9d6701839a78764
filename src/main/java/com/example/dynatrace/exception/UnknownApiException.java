package com.example.dynatrace.exception;

public class UnknownApiException extends RuntimeException {

    private final String apiId;

    public UnknownApiException(String apiId) {
        super("Unknown configuration api: " + apiId);
        this.apiId = apiId;
    }

    public String getApiId() {
        return apiId;
    }
}
