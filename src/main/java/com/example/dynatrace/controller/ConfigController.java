package com.example.dynatrace.controller;

import com.example.dynatrace.api.Api;
import com.example.dynatrace.api.ApiCatalog;
import com.example.dynatrace.dto.ApiInfo;
import com.example.dynatrace.dto.DynatraceEntity;
import com.example.dynatrace.dto.ExistsResult;
import com.example.dynatrace.dto.Value;
import com.example.dynatrace.service.DynatraceClient;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Controller for name-addressed operations on Dynatrace configuration objects.
 */
@RestController
@RequestMapping("/api/configs")
@Tag(name = "Configs", description = "Read, upsert and delete Dynatrace configs by name")
public class ConfigController {

    private final DynatraceClient dynatraceClient;
    private final ApiCatalog apiCatalog;

    public ConfigController(DynatraceClient dynatraceClient, ApiCatalog apiCatalog) {
        this.dynatraceClient = dynatraceClient;
        this.apiCatalog = apiCatalog;
    }

    @Operation(
        summary = "List apis",
        description = "List the configuration families that can be synchronized"
    )
    @GetMapping
    public ResponseEntity<List<ApiInfo>> listApis() {
        List<ApiInfo> apis = apiCatalog.getAll().stream()
                .map(api -> ApiInfo.builder()
                        .id(api.getId())
                        .path(api.getUrlFromEnvironmentUrl(""))
                        .uploadKind(api.getUploadKind())
                        .build())
                .toList();
        return ResponseEntity.ok(apis);
    }

    @Operation(
        summary = "List configs",
        description = "List the id and name of every config of the given api"
    )
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Configs of the api"),
        @ApiResponse(responseCode = "400", description = "Unknown api")
    })
    @GetMapping("/{apiId}")
    public ResponseEntity<List<Value>> list(
            @Parameter(description = "Api id, e.g. alerting-profile") @PathVariable String apiId) {
        return ResponseEntity.ok(dynatraceClient.list(apiCatalog.get(apiId)));
    }

    @Operation(summary = "Read a config by name")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Config JSON as stored in Dynatrace"),
        @ApiResponse(responseCode = "404", description = "No config with that name")
    })
    @GetMapping(value = "/{apiId}/{name}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> readByName(@PathVariable String apiId, @PathVariable String name) {
        return ResponseEntity.ok(dynatraceClient.readByName(apiCatalog.get(apiId), name));
    }

    @Operation(summary = "Check whether a config with the given name exists")
    @GetMapping("/{apiId}/{name}/exists")
    public ResponseEntity<ExistsResult> existsByName(@PathVariable String apiId, @PathVariable String name) {
        return ResponseEntity.ok(dynatraceClient.existsByName(apiCatalog.get(apiId), name));
    }

    @Operation(summary = "Read a config by its Dynatrace id")
    @GetMapping(value = "/{apiId}/id/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> readById(@PathVariable String apiId, @PathVariable String id) {
        return ResponseEntity.ok(dynatraceClient.readById(apiCatalog.get(apiId), id));
    }

    @Operation(
        summary = "Create or update a config by name",
        description = "Creates the config if no config with that name exists, replaces it in place otherwise. " +
            "For the extension api the body is the plugin.json, which is uploaded as a zip."
    )
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Created or updated config",
            content = @Content(schema = @Schema(implementation = DynatraceEntity.class)))
    })
    @PutMapping(value = "/{apiId}/{name}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<DynatraceEntity> upsertByName(@PathVariable String apiId,
                                                        @PathVariable String name,
                                                        @RequestBody String payload) {
        return ResponseEntity.ok(dynatraceClient.upsertByName(apiCatalog.get(apiId), name, payload));
    }

    @Operation(summary = "Delete a config by name", description = "Succeeds as well if no config has that name")
    @DeleteMapping("/{apiId}/{name}")
    public ResponseEntity<Void> deleteByName(@PathVariable String apiId, @PathVariable String name) {
        dynatraceClient.deleteByName(apiCatalog.get(apiId), name);
        return ResponseEntity.noContent().build();
    }
}
