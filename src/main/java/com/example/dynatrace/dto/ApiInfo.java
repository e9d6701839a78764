package com.example.dynatrace.dto;

import com.example.dynatrace.enums.UploadKind;
import lombok.*;

/**
 * DTO describing one configuration family that can be synchronized.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApiInfo {

    private String id;

    /**
     * Collection path below the environment URL, e.g. {@code /api/config/v1/alertingProfiles}.
     */
    private String path;

    private UploadKind uploadKind;
}
