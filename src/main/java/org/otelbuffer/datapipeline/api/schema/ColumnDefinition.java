package org.otelbuffer.datapipeline.api.schema;

import java.util.Objects;

/**
 * A named, typed column of a {@link TableSchema}.
 *
 * @param name column name, unique within its schema
 * @param type semantic type
 */
public record ColumnDefinition(String name, DataType type) {

    public ColumnDefinition {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(type, "type cannot be null");
    }

    @Override
    public String toString() {
        return name + " " + type.getSqlType();
    }
}
