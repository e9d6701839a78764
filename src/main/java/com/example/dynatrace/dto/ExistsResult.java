package com.example.dynatrace.dto;

import lombok.*;

/**
 * Outcome of a name lookup. A missing object is not an error: {@code exists} is false
 * and {@code id} is the empty string.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExistsResult {

    private boolean exists;

    private String id;

    public static ExistsResult found(String id) {
        return new ExistsResult(true, id);
    }

    public static ExistsResult notFound() {
        return new ExistsResult(false, "");
    }
}
