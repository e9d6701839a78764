package com.example.dynatrace.api;

import com.example.dynatrace.enums.UploadKind;

/**
 * Describes one family of Dynatrace configuration objects, e.g. alerting profiles.
 */
public interface Api {

    /**
     * Stable identifier of the family, e.g. {@code alerting-profile} or {@code extension}.
     */
    String getId();

    /**
     * Resolve the collection endpoint of this family for the given environment.
     * For alerting profiles this is {@code <environment-url>/api/config/v1/alertingProfiles}.
     */
    String getUrlFromEnvironmentUrl(String environmentUrl);

    /**
     * Transport encoding used for create/update requests.
     */
    UploadKind getUploadKind();
}
