package com.example.dynatrace.controller;

import com.example.dynatrace.api.Api;
import com.example.dynatrace.api.ApiCatalog;
import com.example.dynatrace.dto.DynatraceEntity;
import com.example.dynatrace.dto.ExistsResult;
import com.example.dynatrace.dto.Value;
import com.example.dynatrace.exception.ConfigNotFoundException;
import com.example.dynatrace.exception.DynatraceApiException;
import com.example.dynatrace.exception.GlobalExceptionHandler;
import com.example.dynatrace.service.DynatraceClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Unit tests for ConfigController and the error mapping of GlobalExceptionHandler.
 */
@ExtendWith(MockitoExtension.class)
class ConfigControllerTest {

    @Mock
    private DynatraceClient dynatraceClient;

    private final ApiCatalog apiCatalog = new ApiCatalog();
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new ConfigController(dynatraceClient, apiCatalog))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void testListApis() throws Exception {
        mockMvc.perform(get("/api/configs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(apiCatalog.getAll().size()))
                .andExpect(jsonPath("$[?(@.id == 'extension')].uploadKind").value("EXTENSION_UPLOAD"))
                .andExpect(jsonPath("$[?(@.id == 'alerting-profile')].path").value("/api/config/v1/alertingProfiles"));

        verifyNoInteractions(dynatraceClient);
    }

    @Test
    void testList() throws Exception {
        Api api = apiCatalog.get("auto-tag");
        when(dynatraceClient.list(api)).thenReturn(List.of(new Value("1", "Env")));

        mockMvc.perform(get("/api/configs/auto-tag"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("1"))
                .andExpect(jsonPath("$[0].name").value("Env"));
    }

    @Test
    void testExists() throws Exception {
        when(dynatraceClient.existsByName(any(), eq("Missing"))).thenReturn(ExistsResult.notFound());

        mockMvc.perform(get("/api/configs/auto-tag/Missing/exists"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.exists").value(false))
                .andExpect(jsonPath("$.id").value(""));
    }

    @Test
    void testUpsert() throws Exception {
        Api api = apiCatalog.get("alerting-profile");
        String payload = "{\"name\":\"Ops\"}";
        when(dynatraceClient.upsertByName(api, "Ops", payload))
                .thenReturn(DynatraceEntity.builder().id("42").name("Ops").build());

        mockMvc.perform(put("/api/configs/alerting-profile/Ops")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(payload))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("42"))
                .andExpect(jsonPath("$.description").doesNotExist());
    }

    @Test
    void testDelete() throws Exception {
        mockMvc.perform(delete("/api/configs/alerting-profile/Ops"))
                .andExpect(status().isNoContent());

        verify(dynatraceClient).deleteByName(apiCatalog.get("alerting-profile"), "Ops");
    }

    @Test
    void testReadByName_NotFound() throws Exception {
        when(dynatraceClient.readByName(any(), eq("Ops")))
                .thenThrow(new ConfigNotFoundException("alerting-profile", "Ops"));

        mockMvc.perform(get("/api/configs/alerting-profile/Ops"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.name").value("Ops"));
    }

    @Test
    void testUpstreamFailure() throws Exception {
        when(dynatraceClient.readById(any(), eq("x")))
                .thenThrow(new DynatraceApiException("GET failed", 503, "HTTP_503"));

        mockMvc.perform(get("/api/configs/alerting-profile/id/x"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.upstreamStatus").value(503))
                .andExpect(jsonPath("$.errorCode").value("HTTP_503"));
    }

    @Test
    void testUnknownApi() throws Exception {
        mockMvc.perform(get("/api/configs/no-such-api"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(dynatraceClient);
    }
}
