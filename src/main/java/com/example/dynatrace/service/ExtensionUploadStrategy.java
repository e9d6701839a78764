package com.example.dynatrace.service;

import com.example.dynatrace.api.Api;
import com.example.dynatrace.dto.DynatraceEntity;
import com.example.dynatrace.exception.DynatraceApiException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Upsert for extensions. The extension API takes no JSON body: the plugin.json is zipped
 * and uploaded as multipart/form-data. Extensions are identified by their name, and an
 * upload is skipped when the environment already runs the same version.
 */
public class ExtensionUploadStrategy implements UpsertStrategy {

    private static final Logger log = LoggerFactory.getLogger(ExtensionUploadStrategy.class);

    enum DeployState {
        NEEDS_UPLOAD,
        UP_TO_DATE
    }

    private final DynatraceTransport transport;
    private final ObjectMapper objectMapper;

    public ExtensionUploadStrategy(DynatraceTransport transport, ObjectMapper objectMapper) {
        this.transport = transport;
        this.objectMapper = objectMapper;
    }

    @Override
    public DynatraceEntity upsert(Api api, String name, String payload) {
        String url = api.getUrlFromEnvironmentUrl(transport.getEnvironmentUrl());

        if (checkDeployState(url, name, payload) == DeployState.UP_TO_DATE) {
            return DynatraceEntity.builder().id(name).name(name).build();
        }

        MultiValueMap<String, Object> body = new LinkedMultiValueMap<>();
        body.add("file", new ByteArrayResource(zip(name, payload)) {
            @Override
            public String getFilename() {
                return name + ".zip";
            }
        });

        String response = transport.postMultipart(url, body);
        log.info("Uploaded extension '{}'", name);
        return toEntity(name, response);
    }

    DeployState checkDeployState(String url, String name, String payload) {
        Optional<String> deployed = transport.getIfExists(url, name);
        if (deployed.isEmpty()) {
            log.debug("Extension '{}' is not deployed yet", name);
            return DeployState.NEEDS_UPLOAD;
        }

        String deployedVersion = readVersion(deployed.get());
        String newVersion = readVersion(payload);
        if (deployedVersion == null || newVersion == null) {
            return DeployState.NEEDS_UPLOAD;
        }

        int comparison = compareVersions(deployedVersion, newVersion);
        if (comparison == 0) {
            log.warn("Extension '{}' is already deployed in version {}, skipping upload", name, deployedVersion);
            return DeployState.UP_TO_DATE;
        }
        if (comparison > 0) {
            throw new DynatraceApiException("Extension '" + name + "' is deployed in version " + deployedVersion
                    + " which is newer than version " + newVersion + " to be uploaded",
                    409, "EXTENSION_VERSION_CONFLICT");
        }
        return DeployState.NEEDS_UPLOAD;
    }

    /**
     * Compare dot separated versions part by part, numerically where both parts are numbers.
     * Missing parts count as 0, so {@code 1.0} equals {@code 1.0.0}.
     */
    static int compareVersions(String left, String right) {
        String[] leftParts = left.trim().split("\\.");
        String[] rightParts = right.trim().split("\\.");
        int length = Math.max(leftParts.length, rightParts.length);

        for (int i = 0; i < length; i++) {
            String l = i < leftParts.length ? leftParts[i] : "0";
            String r = i < rightParts.length ? rightParts[i] : "0";
            int result;
            if (l.matches("\\d+") && r.matches("\\d+")) {
                result = Long.compare(Long.parseLong(l), Long.parseLong(r));
            } else {
                result = l.compareTo(r);
            }
            if (result != 0) {
                return result;
            }
        }
        return 0;
    }

    /**
     * Zip archive holding {@code <name>/plugin.json}.
     */
    static byte[] zip(String name, String payload) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(out)) {
            zip.putNextEntry(new ZipEntry(name + "/plugin.json"));
            zip.write(payload.getBytes(StandardCharsets.UTF_8));
            zip.closeEntry();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to zip extension " + name, e);
        }
        return out.toByteArray();
    }

    private String readVersion(String json) {
        try {
            JsonNode version = objectMapper.readTree(json).get("version");
            return version == null || version.isNull() ? null : version.asText();
        } catch (JsonProcessingException e) {
            log.warn("Could not read extension version from '{}': {}", json, e.getMessage());
            return null;
        }
    }

    private DynatraceEntity toEntity(String name, String response) {
        DynatraceEntity entity = DynatraceEntity.builder().id(name).name(name).build();
        if (response == null || response.isBlank()) {
            return entity;
        }
        try {
            JsonNode node = objectMapper.readTree(response);
            String id = ValueListParser.idOf(node);
            if (id != null) {
                entity.setId(id);
            }
            if (node.hasNonNull("description")) {
                entity.setDescription(node.get("description").asText());
            }
        } catch (JsonProcessingException e) {
            throw new DynatraceApiException("Failed to parse upload response of extension '" + name + "': " + response, e);
        }
        return entity;
    }
}
