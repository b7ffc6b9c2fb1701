package org.otelbuffer.datapipeline.flatten;

import com.google.protobuf.ByteString;

import java.util.HexFormat;

/**
 * Canonical string renderings of OTLP enumerated and identifier fields.
 */
public final class OtlpEnumNames {

    private static final String[] SPAN_KINDS = {
            "UNSPECIFIED", "INTERNAL", "SERVER", "CLIENT", "PRODUCER", "CONSUMER"
    };
    private static final String[] STATUS_CODES = {"UNSET", "OK", "ERROR"};
    private static final HexFormat HEX = HexFormat.of();

    private OtlpEnumNames() {
    }

    /**
     * Maps a wire span kind to its canonical name.
     *
     * @param kind wire value
     * @return the name, "UNSPECIFIED" for unknown values
     */
    public static String spanKind(int kind) {
        return kind >= 0 && kind < SPAN_KINDS.length ? SPAN_KINDS[kind] : SPAN_KINDS[0];
    }

    /**
     * Maps a wire status code to its canonical name.
     *
     * @param code wire value
     * @return the name, "UNSET" for unknown values
     */
    public static String statusCode(int code) {
        return code >= 0 && code < STATUS_CODES.length ? STATUS_CODES[code] : STATUS_CODES[0];
    }

    /**
     * Renders an identifier as lowercase hex; empty ids render as "".
     *
     * @param id trace or span id bytes
     * @return lowercase hex string
     */
    public static String hexId(ByteString id) {
        return id.isEmpty() ? "" : HEX.formatHex(id.toByteArray());
    }
}
