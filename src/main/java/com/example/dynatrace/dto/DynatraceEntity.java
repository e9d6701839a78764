package com.example.dynatrace.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

/**
 * DTO representing a configuration object created or updated in Dynatrace.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DynatraceEntity {

    /**
     * Identifier assigned or confirmed by Dynatrace.
     */
    private String id;

    private String name;

    private String description;
}
