package com.example.dynatrace.enums;

/**
 * How a configuration family expects create/update payloads to be transported.
 */
public enum UploadKind {
    /**
     * Plain JSON body, POST to the collection endpoint or PUT to {@code <collection>/<id>}
     */
    STANDARD_JSON,

    /**
     * Zipped plugin.json sent as multipart/form-data to the collection endpoint
     */
    EXTENSION_UPLOAD
}
