package com.example.dynatrace.api;

import com.example.dynatrace.enums.UploadKind;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Immutable {@link Api} backed by a fixed path below the environment URL.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class ConfigApi implements Api {

    public static final String EXTENSION_ID = "extension";

    private final String id;
    private final String apiPath;
    private final UploadKind uploadKind;

    public ConfigApi(String id, String apiPath) {
        this(id, apiPath, EXTENSION_ID.equals(id) ? UploadKind.EXTENSION_UPLOAD : UploadKind.STANDARD_JSON);
    }

    public ConfigApi(String id, String apiPath, UploadKind uploadKind) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Api id must not be empty");
        }
        if (apiPath == null || !apiPath.startsWith("/")) {
            throw new IllegalArgumentException("Api path must start with '/', got: " + apiPath);
        }
        this.id = id;
        this.apiPath = apiPath;
        this.uploadKind = uploadKind == null ? UploadKind.STANDARD_JSON : uploadKind;
    }

    @Override
    public String getUrlFromEnvironmentUrl(String environmentUrl) {
        String base = environmentUrl;
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + apiPath;
    }
}
