package org.otelbuffer.datapipeline.api.ingest;

import java.util.Locale;

/**
 * How an ingestion job resolves a malformed unit (one JSON line, or one whole document).
 */
public enum OnErrorMode {
    /**
     * Abort the whole job on the first parse error. Rows committed before the error remain.
     */
    FAIL,

    /**
     * Discard the failing unit and continue.
     */
    SKIP,

    /**
     * Emit one all-null row for the failing unit so row positions stay aligned.
     */
    NULLIFY;

    /**
     * Parses a configuration value such as {@code "fail"} or {@code "NULLIFY"}.
     *
     * @param value the mode name, case-insensitive
     * @return the mode
     * @throws IllegalArgumentException for unknown names
     */
    public static OnErrorMode parse(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid on_error value '" + value + "', expected fail, skip or nullify", e);
        }
    }
}
