package org.otelbuffer.datapipeline.api.schema;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered list of typed columns describing one table's row layout.
 * <p>
 * Column 0 is always the designated timestamp column used for chunk time-range statistics.
 * Up to two further columns are designated dimensions (service name, metric name); chunks keep
 * a uniform/mixed summary for them so equality filters can prune whole chunks.
 * <p>
 * <strong>Thread Safety:</strong> Immutable after construction.
 */
public final class TableSchema {

    /** Index value meaning "no such column". */
    public static final int NO_COLUMN = -1;

    private final String name;
    private final List<ColumnDefinition> columns;
    private final Object2IntMap<String> indexByName;
    private final int serviceColumn;
    private final int metricNameColumn;

    private TableSchema(String name, List<ColumnDefinition> columns, String serviceColumnName, String metricColumnName) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("Schema '" + name + "' must have at least one column");
        }
        if (columns.get(0).type().id() != ColumnType.TIMESTAMP_NS) {
            throw new IllegalArgumentException("Column 0 of schema '" + name + "' must be TIMESTAMP_NS");
        }
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        Object2IntOpenHashMap<String> index = new Object2IntOpenHashMap<>(columns.size());
        index.defaultReturnValue(NO_COLUMN);
        for (int i = 0; i < columns.size(); i++) {
            if (index.put(columns.get(i).name(), i) != NO_COLUMN) {
                throw new IllegalArgumentException("Duplicate column '" + columns.get(i).name() + "' in schema '" + name + "'");
            }
        }
        this.indexByName = index;
        this.serviceColumn = resolveDimension(serviceColumnName);
        this.metricNameColumn = resolveDimension(metricColumnName);
    }

    private int resolveDimension(String columnName) {
        if (columnName == null) {
            return NO_COLUMN;
        }
        int idx = indexByName.getInt(columnName);
        if (idx == NO_COLUMN || columns.get(idx).type().id() != ColumnType.VARCHAR) {
            throw new IllegalArgumentException("Dimension column '" + columnName + "' must be a VARCHAR column of schema '" + name + "'");
        }
        return idx;
    }

    /**
     * Starts a schema definition.
     *
     * @param name the table name
     * @return a new builder
     */
    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public List<ColumnDefinition> getColumns() {
        return columns;
    }

    public int arity() {
        return columns.size();
    }

    public ColumnDefinition column(int index) {
        return columns.get(index);
    }

    public DataType typeOf(int index) {
        return columns.get(index).type();
    }

    /**
     * Looks up a column index by name.
     *
     * @param columnName the column name
     * @return the index, or {@link #NO_COLUMN}
     */
    public int indexOf(String columnName) {
        return indexByName.getInt(columnName);
    }

    /**
     * Like {@link #indexOf(String)} but fails for unknown names.
     *
     * @param columnName the column name
     * @return the index
     * @throws IllegalArgumentException if the column does not exist
     */
    public int requireIndex(String columnName) {
        int idx = indexByName.getInt(columnName);
        if (idx == NO_COLUMN) {
            throw new IllegalArgumentException("Unknown column '" + columnName + "' in schema '" + name + "'");
        }
        return idx;
    }

    public int getTimestampColumn() {
        return 0;
    }

    /**
     * @return index of the service-name dimension column, or {@link #NO_COLUMN}
     */
    public int getServiceColumn() {
        return serviceColumn;
    }

    /**
     * @return index of the metric-name dimension column, or {@link #NO_COLUMN}
     */
    public int getMetricNameColumn() {
        return metricNameColumn;
    }

    /**
     * Validates arity and cell types of a row.
     *
     * @param row the row to check
     * @throws SchemaViolationException if the arity differs or a non-null cell has the wrong type
     */
    public void validate(Row row) {
        if (row.arity() != columns.size()) {
            throw new SchemaViolationException("Row arity " + row.arity() + " does not match schema '"
                    + name + "' with " + columns.size() + " columns");
        }
        for (int i = 0; i < columns.size(); i++) {
            Object cell = row.get(i);
            if (cell != null && !columns.get(i).type().accepts(cell)) {
                throw new SchemaViolationException("Column '" + columns.get(i).name() + "' of schema '" + name
                        + "' expects " + columns.get(i).type() + " but got " + cell.getClass().getSimpleName());
            }
        }
    }

    @Override
    public String toString() {
        return name + columns;
    }

    /**
     * Fluent builder for {@link TableSchema}.
     */
    public static final class Builder {
        private final String name;
        private final List<ColumnDefinition> columns = new ArrayList<>();
        private String serviceColumn;
        private String metricColumn;

        private Builder(String name) {
            this.name = name;
        }

        public Builder column(String columnName, DataType type) {
            columns.add(new ColumnDefinition(columnName, type));
            return this;
        }

        public Builder columns(List<ColumnDefinition> definitions) {
            columns.addAll(definitions);
            return this;
        }

        public Builder serviceDimension(String columnName) {
            this.serviceColumn = columnName;
            return this;
        }

        public Builder metricDimension(String columnName) {
            this.metricColumn = columnName;
            return this;
        }

        public TableSchema build() {
            return new TableSchema(name, columns, serviceColumn, metricColumn);
        }
    }
}
