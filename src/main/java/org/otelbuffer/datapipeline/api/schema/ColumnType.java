package org.otelbuffer.datapipeline.api.schema;

/**
 * Semantic column types supported by the columnar buffers.
 * <p>
 * Each type names the SQL type the column is exposed as and the storage family used by the
 * column vectors. List columns additionally carry an element type, see {@link DataType}.
 */
public enum ColumnType {
    /**
     * Nanosecond epoch timestamp. Stored as a 64-bit signed integer.
     */
    TIMESTAMP_NS("TIMESTAMP_NS", StorageFamily.LONG),

    /**
     * 64-bit signed integer. Use for durations.
     */
    BIGINT("BIGINT", StorageFamily.LONG),

    /**
     * 64-bit unsigned integer held in a Java {@code long}. Use for counts.
     */
    UBIGINT("UBIGINT", StorageFamily.LONG),

    /**
     * 32-bit signed integer.
     */
    INTEGER("INTEGER", StorageFamily.INT),

    /**
     * 32-bit unsigned integer, widened to a Java {@code long} in {@code [0, 2^32)}.
     */
    UINTEGER("UINTEGER", StorageFamily.LONG),

    /**
     * 64-bit floating point.
     */
    DOUBLE("DOUBLE", StorageFamily.DOUBLE),

    /**
     * Boolean (true/false).
     */
    BOOLEAN("BOOLEAN", StorageFamily.BOOLEAN),

    /**
     * Variable-length UTF-8 string.
     */
    VARCHAR("VARCHAR", StorageFamily.OBJECT),

    /**
     * Ordered list of an element type.
     */
    LIST("LIST", StorageFamily.OBJECT),

    /**
     * String-to-string mapping with unique keys in insertion order.
     */
    MAP("MAP(VARCHAR, VARCHAR)", StorageFamily.OBJECT);

    /**
     * Physical representation of a column vector.
     */
    public enum StorageFamily {
        LONG,
        INT,
        DOUBLE,
        BOOLEAN,
        OBJECT
    }

    private final String sqlType;
    private final StorageFamily storageFamily;

    ColumnType(String sqlType, StorageFamily storageFamily) {
        this.sqlType = sqlType;
        this.storageFamily = storageFamily;
    }

    /**
     * Returns the SQL type name.
     *
     * @return SQL type string (e.g., "BIGINT", "VARCHAR")
     */
    public String getSqlType() {
        return sqlType;
    }

    /**
     * Returns the physical storage family of vectors holding this type.
     *
     * @return the storage family
     */
    public StorageFamily getStorageFamily() {
        return storageFamily;
    }

    /**
     * Whether values of this type have a total order usable by range predicates.
     *
     * @return false for list and map columns
     */
    public boolean isOrderable() {
        return this != LIST && this != MAP;
    }
}
