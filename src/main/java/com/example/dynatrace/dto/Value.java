package com.example.dynatrace.dto;

import lombok.*;

/**
 * Summary of one remote configuration object as returned by a list call.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Value {

    /**
     * Identifier assigned by Dynatrace.
     */
    private String id;

    /**
     * Human-readable name, the caller-facing identity.
     */
    private String name;
}
