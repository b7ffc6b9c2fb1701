package org.otelbuffer.datapipeline.api.schema;

import java.util.Arrays;

/**
 * An immutable, ordered sequence of cells matching some {@link TableSchema}.
 * <p>
 * Cells are plain Java values (see {@link DataType}) and any cell may be null. A row does not
 * know its schema; {@link TableSchema#validate(Row)} checks arity and cell types.
 */
public final class Row {

    private final Object[] cells;

    private Row(Object[] cells) {
        this.cells = cells;
    }

    /**
     * Creates a row from the given cells. The array is copied.
     *
     * @param cells cell values in column order
     * @return the row
     */
    public static Row of(Object... cells) {
        return new Row(cells.clone());
    }

    /**
     * Creates a row whose every cell is null.
     *
     * @param arity number of columns
     * @return the all-null row
     */
    public static Row allNull(int arity) {
        return new Row(new Object[arity]);
    }

    /**
     * Wraps an array the caller will no longer modify.
     */
    static Row wrap(Object[] cells) {
        return new Row(cells);
    }

    public int arity() {
        return cells.length;
    }

    public Object get(int column) {
        return cells[column];
    }

    public boolean isNull(int column) {
        return cells[column] == null;
    }

    /**
     * @return true if every cell is null
     */
    public boolean isAllNull() {
        for (Object cell : cells) {
            if (cell != null) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns a copy of the cells.
     *
     * @return cell array copy
     */
    public Object[] toArray() {
        return cells.clone();
    }

    /**
     * Typed accessor for convenience in tests and consumers.
     *
     * @param column column index
     * @param type   expected Java type
     * @param <T>    value type
     * @return the cell cast to {@code type}, or null
     */
    public <T> T get(int column, Class<T> type) {
        return type.cast(cells[column]);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Row)) {
            return false;
        }
        return Arrays.equals(cells, ((Row) o).cells);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(cells);
    }

    @Override
    public String toString() {
        return "Row" + Arrays.toString(cells);
    }

    /**
     * Mutable builder, used by the flattener to fill cells by column index.
     */
    public static final class Builder {
        private final Object[] cells;

        public Builder(int arity) {
            this.cells = new Object[arity];
        }

        public Builder set(int column, Object value) {
            cells[column] = value;
            return this;
        }

        public Row build() {
            return Row.wrap(cells.clone());
        }
    }
}
