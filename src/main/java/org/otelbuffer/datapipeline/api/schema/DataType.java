package org.otelbuffer.datapipeline.api.schema;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A column's full semantic type: a {@link ColumnType} plus, for lists, the element type.
 * <p>
 * Java cell representations:
 * <ul>
 *   <li>{@code TIMESTAMP_NS}, {@code BIGINT}, {@code UBIGINT}, {@code UINTEGER}: {@link Long}</li>
 *   <li>{@code INTEGER}: {@link Integer}</li>
 *   <li>{@code DOUBLE}: {@link Double}</li>
 *   <li>{@code BOOLEAN}: {@link Boolean}</li>
 *   <li>{@code VARCHAR}: {@link String}</li>
 *   <li>{@code LIST}: {@link List} of the element representation (elements may be null)</li>
 *   <li>{@code MAP}: {@link Map} of String to String</li>
 * </ul>
 *
 * @param id          the column type
 * @param elementType the element type for {@link ColumnType#LIST}, null otherwise
 */
public record DataType(ColumnType id, DataType elementType) {

    public static final DataType TIMESTAMP_NS = new DataType(ColumnType.TIMESTAMP_NS, null);
    public static final DataType BIGINT = new DataType(ColumnType.BIGINT, null);
    public static final DataType UBIGINT = new DataType(ColumnType.UBIGINT, null);
    public static final DataType INTEGER = new DataType(ColumnType.INTEGER, null);
    public static final DataType UINTEGER = new DataType(ColumnType.UINTEGER, null);
    public static final DataType DOUBLE = new DataType(ColumnType.DOUBLE, null);
    public static final DataType BOOLEAN = new DataType(ColumnType.BOOLEAN, null);
    public static final DataType VARCHAR = new DataType(ColumnType.VARCHAR, null);
    public static final DataType MAP = new DataType(ColumnType.MAP, null);

    public DataType {
        Objects.requireNonNull(id, "id cannot be null");
        if (id == ColumnType.LIST && elementType == null) {
            throw new IllegalArgumentException("LIST type requires an element type");
        }
        if (id != ColumnType.LIST && elementType != null) {
            throw new IllegalArgumentException(id + " cannot have an element type");
        }
    }

    /**
     * Creates a list type.
     *
     * @param elementType the element type
     * @return the list type
     */
    public static DataType listOf(DataType elementType) {
        return new DataType(ColumnType.LIST, Objects.requireNonNull(elementType, "elementType cannot be null"));
    }

    /**
     * Returns the SQL rendering, e.g. {@code VARCHAR[]} for a list of strings.
     *
     * @return the SQL type string
     */
    public String getSqlType() {
        return id == ColumnType.LIST ? elementType.getSqlType() + "[]" : id.getSqlType();
    }

    /**
     * Checks whether a non-null Java value is a valid cell of this type.
     *
     * @param value the value to check, must not be null
     * @return true if the value type-matches
     */
    public boolean accepts(Object value) {
        switch (id) {
            case TIMESTAMP_NS:
            case BIGINT:
            case UBIGINT:
                return value instanceof Long;
            case UINTEGER:
                return value instanceof Long && ((Long) value) >= 0 && ((Long) value) <= 0xFFFF_FFFFL;
            case INTEGER:
                return value instanceof Integer;
            case DOUBLE:
                return value instanceof Double;
            case BOOLEAN:
                return value instanceof Boolean;
            case VARCHAR:
                return value instanceof String;
            case LIST:
                if (!(value instanceof List<?> list)) {
                    return false;
                }
                for (Object element : list) {
                    if (element != null && !elementType.accepts(element)) {
                        return false;
                    }
                }
                return true;
            case MAP:
                if (!(value instanceof Map<?, ?> map)) {
                    return false;
                }
                for (Map.Entry<?, ?> entry : map.entrySet()) {
                    if (!(entry.getKey() instanceof String) || !(entry.getValue() instanceof String)) {
                        return false;
                    }
                }
                return true;
            default:
                throw new IllegalStateException("Unhandled column type: " + id);
        }
    }

    /**
     * Compares two non-null values of this type.
     * <p>
     * {@code UBIGINT} compares unsigned. Only valid for {@linkplain ColumnType#isOrderable() orderable} types.
     *
     * @param left  left value
     * @param right right value
     * @return negative, zero or positive as with {@link Comparable#compareTo}
     * @throws IllegalStateException if the type has no order
     */
    public int compare(Object left, Object right) {
        return switch (id) {
            case UBIGINT -> Long.compareUnsigned((Long) left, (Long) right);
            case TIMESTAMP_NS, BIGINT, UINTEGER -> Long.compare((Long) left, (Long) right);
            case INTEGER -> Integer.compare((Integer) left, (Integer) right);
            case DOUBLE -> Double.compare((Double) left, (Double) right);
            case BOOLEAN -> Boolean.compare((Boolean) left, (Boolean) right);
            case VARCHAR -> ((String) left).compareTo((String) right);
            case LIST, MAP -> throw new IllegalStateException(getSqlType() + " values have no order");
        };
    }

    @Override
    public String toString() {
        return getSqlType();
    }
}
