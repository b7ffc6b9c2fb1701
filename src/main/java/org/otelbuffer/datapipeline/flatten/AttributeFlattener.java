package org.otelbuffer.datapipeline.flatten;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import io.opentelemetry.proto.common.v1.AnyValue;
import io.opentelemetry.proto.common.v1.KeyValue;
import io.opentelemetry.proto.resource.v1.Resource;

import java.math.BigDecimal;
import java.util.Base64;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flattens OTLP key/value attribute lists into string-to-string maps.
 * <p>
 * Scalars stringify directly: strings as-is, integers in decimal, doubles in plain decimal
 * notation, booleans as {@code true}/{@code false}, bytes as base64. Arrays and key/value lists
 * are rendered as compact JSON so no structure is lost; scalars inside them become JSON strings
 * and nested containers nest. An unset value renders as the empty string.
 * <p>
 * <strong>Thread Safety:</strong> Stateless; safe for concurrent use.
 */
public final class AttributeFlattener {

    /** Resource attribute holding the service name. */
    public static final String SERVICE_NAME_KEY = "service.name";
    /** Service name used when the resource has no {@code service.name} attribute. */
    public static final String UNKNOWN_SERVICE = "unknown_service";

    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

    private AttributeFlattener() {
    }

    /**
     * Flattens an attribute list. Later duplicates of a key replace earlier values.
     *
     * @param attributes OTLP attributes
     * @return an unmodifiable, insertion-ordered map
     */
    public static Map<String, String> flatten(List<KeyValue> attributes) {
        if (attributes.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, String> result = new LinkedHashMap<>(attributes.size() * 2);
        for (KeyValue kv : attributes) {
            result.put(kv.getKey(), stringify(kv.getValue()));
        }
        return Collections.unmodifiableMap(result);
    }

    /**
     * Extracts {@code service.name} from a resource.
     *
     * @param resource the resource
     * @return the service name, or {@value #UNKNOWN_SERVICE}
     */
    public static String serviceName(Resource resource) {
        for (KeyValue kv : resource.getAttributesList()) {
            if (SERVICE_NAME_KEY.equals(kv.getKey())) {
                return stringify(kv.getValue());
            }
        }
        return UNKNOWN_SERVICE;
    }

    /**
     * Stringifies one attribute value.
     *
     * @param value the value
     * @return the string form
     */
    public static String stringify(AnyValue value) {
        return switch (value.getValueCase()) {
            case STRING_VALUE -> value.getStringValue();
            case BOOL_VALUE -> Boolean.toString(value.getBoolValue());
            case INT_VALUE -> Long.toString(value.getIntValue());
            case DOUBLE_VALUE -> formatDouble(value.getDoubleValue());
            case BYTES_VALUE -> Base64.getEncoder().encodeToString(value.getBytesValue().toByteArray());
            case ARRAY_VALUE, KVLIST_VALUE -> GSON.toJson(toJson(value));
            default -> "";
        };
    }

    /**
     * Formats a double in plain decimal notation ({@code 1.5}, {@code 1.0}, {@code 10000000000.0}).
     * Non-finite values use Java's rendering.
     *
     * @param value the double
     * @return decimal string
     */
    public static String formatDouble(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        String plain = BigDecimal.valueOf(value).toPlainString();
        return plain.indexOf('.') < 0 ? plain + ".0" : plain;
    }

    private static JsonElement toJson(AnyValue value) {
        switch (value.getValueCase()) {
            case ARRAY_VALUE: {
                JsonArray array = new JsonArray();
                for (AnyValue element : value.getArrayValue().getValuesList()) {
                    array.add(toJson(element));
                }
                return array;
            }
            case KVLIST_VALUE: {
                JsonObject object = new JsonObject();
                for (KeyValue kv : value.getKvlistValue().getValuesList()) {
                    object.add(kv.getKey(), toJson(kv.getValue()));
                }
                return object;
            }
            default:
                return new JsonPrimitive(stringify(value));
        }
    }
}
