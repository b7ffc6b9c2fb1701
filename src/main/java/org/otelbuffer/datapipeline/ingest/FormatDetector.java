package org.otelbuffer.datapipeline.ingest;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.protobuf.CodedInputStream;
import com.google.protobuf.WireFormat;
import org.otelbuffer.datapipeline.api.ingest.OtlpFormat;
import org.otelbuffer.datapipeline.api.ingest.SignalType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Sniffs the encoding of an OTLP source from a bounded prefix of its bytes.
 * <p>
 * <strong>Format:</strong> leading whitespace is skipped. A first byte of {@code '{'} or
 * {@code '['} followed by text (no control bytes besides whitespace) means JSON. Otherwise the prefix must start like an OTLP protobuf message: the
 * first byte is {@code 0x0A} or {@code 0x12} (field 1 or 2, length-delimited) or another
 * control byte, and it must decode as a valid field tag. Anything else is
 * {@link OtlpFormat#UNKNOWN}; detection never guesses.
 * <p>
 * <strong>JSON mode:</strong> a source is JSON Lines if its name ends in {@code .jsonl} or
 * {@code .ndjson}, or if at least two complete lines of the prefix independently parse as OTLP
 * JSON objects (objects carrying {@code resourceSpans}, {@code resourceLogs} or
 * {@code resourceMetrics}).
 * <p>
 * <strong>Thread Safety:</strong> Stateless; safe for concurrent use.
 */
public final class FormatDetector {

    private static final Logger log = LoggerFactory.getLogger(FormatDetector.class);

    private static final int MIN_JSON_LINES = 2;
    // A protobuf message whose length byte happens to be '{' is rejected as JSON within this window.
    private static final int TEXT_PROBE_BYTES = 256;

    private FormatDetector() {
    }

    /**
     * Detects the format of a prefix.
     *
     * @param prefix leading bytes of the source
     * @param length number of valid bytes in {@code prefix}
     * @return JSON, PROTOBUF or UNKNOWN (also for empty or all-whitespace input)
     */
    public static OtlpFormat detect(byte[] prefix, int length) {
        int pos = 0;
        while (pos < length && isJsonWhitespace(prefix[pos])) {
            pos++;
        }
        if (pos == length) {
            return OtlpFormat.UNKNOWN;
        }
        int first = prefix[pos] & 0xFF;
        if ((first == '{' || first == '[') && isText(prefix, pos, Math.min(length, pos + TEXT_PROBE_BYTES))) {
            return OtlpFormat.JSON;
        }
        // Protobuf is detected from the very first byte; whitespace bytes are valid tag bytes there.
        first = prefix[0] & 0xFF;
        if ((first == 0x0A || first == 0x12 || (first < 0x20 && !isJsonWhitespace(prefix[0])))
                && hasValidLeadingTag(prefix, length)) {
            return OtlpFormat.PROTOBUF;
        }
        return OtlpFormat.UNKNOWN;
    }

    /**
     * Decides whether a JSON source is newline-delimited.
     *
     * @param sourceName source name, checked for a {@code .jsonl}/{@code .ndjson} extension
     * @param prefix     leading bytes of the source
     * @param length     number of valid bytes in {@code prefix}
     * @param complete   true if the prefix holds the whole source, so its last line is complete
     * @return true for JSON Lines
     */
    public static boolean isJsonLines(String sourceName, byte[] prefix, int length, boolean complete) {
        String lower = sourceName.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".jsonl") || lower.endsWith(".ndjson")) {
            return true;
        }
        String text = new String(prefix, 0, length, StandardCharsets.UTF_8);
        String[] lines = text.split("\n", -1);
        int usable = complete ? lines.length : lines.length - 1;
        int otlpLines = 0;
        for (int i = 0; i < usable && otlpLines < MIN_JSON_LINES; i++) {
            String line = lines[i].trim();
            if (!line.isEmpty() && (line.charAt(0) == '{' || line.charAt(0) == '[') && isOtlpJson(line)) {
                otlpLines++;
            }
        }
        log.debug("Source '{}': {} OTLP JSON line(s) in {}-byte prefix", sourceName, otlpLines, length);
        return otlpLines >= MIN_JSON_LINES;
    }

    /**
     * @return true if the line is a JSON object with a known OTLP root key
     */
    static boolean isOtlpJson(String line) {
        JsonElement element;
        try {
            element = JsonParser.parseString(line);
        } catch (JsonParseException e) {
            return false;
        }
        if (!element.isJsonObject()) {
            return false;
        }
        JsonObject object = element.getAsJsonObject();
        for (SignalType signal : SignalType.values()) {
            if (object.has(signal.getJsonRootKey())) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasValidLeadingTag(byte[] prefix, int length) {
        try {
            CodedInputStream in = CodedInputStream.newInstance(prefix, 0, length);
            int tag = in.readTag();
            int wireType = WireFormat.getTagWireType(tag);
            return WireFormat.getTagFieldNumber(tag) >= 1
                    && (wireType == WireFormat.WIRETYPE_VARINT
                    || wireType == WireFormat.WIRETYPE_FIXED64
                    || wireType == WireFormat.WIRETYPE_LENGTH_DELIMITED
                    || wireType == WireFormat.WIRETYPE_FIXED32);
        } catch (IOException e) {
            log.debug("Leading bytes are not a protobuf tag: {}", e.getMessage());
            return false;
        }
    }

    private static boolean isText(byte[] bytes, int from, int to) {
        for (int i = from; i < to; i++) {
            int b = bytes[i] & 0xFF;
            if (b < 0x20 && !isJsonWhitespace(bytes[i])) {
                return false;
            }
        }
        return true;
    }

    private static boolean isJsonWhitespace(byte b) {
        return b == ' ' || b == '\t' || b == '\n' || b == '\r';
    }
}
