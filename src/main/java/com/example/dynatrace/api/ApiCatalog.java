package com.example.dynatrace.api;

import com.example.dynatrace.exception.UnknownApiException;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of the configuration families that can be synchronized.
 */
@Component
public class ApiCatalog {

    private final Map<String, Api> apis = new LinkedHashMap<>();

    public ApiCatalog() {
        register(new ConfigApi("alerting-profile", "/api/config/v1/alertingProfiles"));
        register(new ConfigApi("management-zone", "/api/config/v1/managementZones"));
        register(new ConfigApi("auto-tag", "/api/config/v1/autoTags"));
        register(new ConfigApi("dashboard", "/api/config/v1/dashboards"));
        register(new ConfigApi("notification", "/api/config/v1/notifications"));
        register(new ConfigApi(ConfigApi.EXTENSION_ID, "/api/config/v1/extensions"));
        register(new ConfigApi("custom-service-java", "/api/config/v1/service/customServices/java"));
        register(new ConfigApi("custom-service-dotnet", "/api/config/v1/service/customServices/dotNet"));
        register(new ConfigApi("custom-service-go", "/api/config/v1/service/customServices/go"));
        register(new ConfigApi("custom-service-nodejs", "/api/config/v1/service/customServices/nodeJS"));
        register(new ConfigApi("custom-service-php", "/api/config/v1/service/customServices/php"));
        register(new ConfigApi("anomaly-detection-metrics", "/api/config/v1/anomalyDetection/metricEvents"));
        register(new ConfigApi("synthetic-location", "/api/v1/synthetic/locations"));
        register(new ConfigApi("synthetic-monitor", "/api/v1/synthetic/monitors"));
        register(new ConfigApi("application-web", "/api/config/v1/applications/web"));
        register(new ConfigApi("application-mobile", "/api/config/v1/applications/mobile"));
        register(new ConfigApi("app-detection-rule", "/api/config/v1/applicationDetectionRules"));
        register(new ConfigApi("aws-credentials", "/api/config/v1/aws/credentials"));
        register(new ConfigApi("azure-credentials", "/api/config/v1/azure/credentials"));
        register(new ConfigApi("kubernetes-credentials", "/api/config/v1/kubernetes/credentials"));
        register(new ConfigApi("request-attributes", "/api/config/v1/service/requestAttributes"));
        register(new ConfigApi("request-naming-service", "/api/config/v1/service/requestNaming"));
        register(new ConfigApi("calculated-metrics-service", "/api/config/v1/calculatedMetrics/service"));
        register(new ConfigApi("calculated-metrics-log", "/api/config/v1/calculatedMetrics/log"));
        register(new ConfigApi("conditional-naming-processgroup", "/api/config/v1/conditionalNaming/processGroup"));
        register(new ConfigApi("conditional-naming-host", "/api/config/v1/conditionalNaming/host"));
        register(new ConfigApi("conditional-naming-service", "/api/config/v1/conditionalNaming/service"));
        register(new ConfigApi("maintenance-window", "/api/config/v1/maintenanceWindows"));
        register(new ConfigApi("slo", "/api/v2/slo"));
    }

    private void register(Api api) {
        apis.put(api.getId(), api);
    }

    Optional<Api> find(String apiId) {
        return Optional.ofNullable(apis.get(apiId));
    }

    /**
     * Look up a family by id.
     *
     * @throws UnknownApiException if no family with that id is registered
     */
    public Api get(String apiId) {
        return find(apiId).orElseThrow(() -> new UnknownApiException(apiId));
    }

    public Collection<Api> getAll() {
        return Collections.unmodifiableCollection(apis.values());
    }
}
