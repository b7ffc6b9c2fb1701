package org.otelbuffer.datapipeline.scan;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.otelbuffer.datapipeline.api.resources.buffer.ColumnReader;
import org.otelbuffer.datapipeline.api.resources.buffer.ColumnarChunk;
import org.otelbuffer.datapipeline.api.schema.ColumnType;

import java.util.Objects;

/**
 * Row-level predicate evaluation over a chunk's column readers.
 * <p>
 * <strong>Null semantics:</strong> a null cell fails every comparison. {@code = null} matches
 * exactly the null cells and {@code <> null} exactly the non-null cells; ordering against a null
 * constant matches nothing. {@code UBIGINT} compares unsigned. Doubles use the primitive
 * operators, so {@code -0.0 = 0.0} holds and a NaN cell satisfies only {@code <>}.
 * <p>
 * <strong>Thread Safety:</strong> Stateless; safe for concurrent use.
 */
public class RowMatcher {

    /**
     * Evaluates all predicates of a scan against one row.
     *
     * @param chunk the chunk
     * @param row   row index within the chunk
     * @param scan  the bound scan
     * @return true if every predicate holds
     */
    public boolean matches(ColumnarChunk chunk, int row, BoundScan scan) {
        for (ColumnPredicate predicate : scan.getPredicates()) {
            if (!test(chunk.column(predicate.column()), row, predicate)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Collects the rows of a chunk that satisfy the scan's predicates.
     *
     * @param chunk the chunk
     * @param scan  the bound scan
     * @return matching row indices in ascending order
     */
    public IntArrayList select(ColumnarChunk chunk, BoundScan scan) {
        int size = chunk.size();
        IntArrayList selection = new IntArrayList(scan.getPredicates().isEmpty() ? size : Math.min(size, 64));
        for (int row = 0; row < size; row++) {
            if (matches(chunk, row, scan)) {
                selection.add(row);
            }
        }
        return selection;
    }

    static boolean test(ColumnReader column, int row, ColumnPredicate predicate) {
        ComparisonOperator operator = predicate.operator();
        boolean isNull = column.isNull(row);
        if (operator == ComparisonOperator.IS_NULL) {
            return isNull;
        }
        if (operator == ComparisonOperator.IS_NOT_NULL) {
            return !isNull;
        }
        Object constant = predicate.constant();
        if (constant == null) {
            return switch (operator) {
                case EQUAL -> isNull;
                case NOT_EQUAL -> !isNull;
                default -> false;
            };
        }
        if (isNull) {
            return false;
        }
        if (column.type().id().getStorageFamily() == ColumnType.StorageFamily.DOUBLE) {
            return testDouble(column.getDouble(row), (Double) constant, operator);
        }
        return operator.accepts(compare(column, row, constant));
    }

    // Primitive operators: -0.0 equals 0.0, and NaN is unequal and unordered to everything.
    private static boolean testDouble(double value, double constant, ComparisonOperator operator) {
        return switch (operator) {
            case EQUAL -> value == constant;
            case NOT_EQUAL -> value != constant;
            case LESS_THAN -> value < constant;
            case LESS_THAN_OR_EQUAL -> value <= constant;
            case GREATER_THAN -> value > constant;
            case GREATER_THAN_OR_EQUAL -> value >= constant;
            case IS_NULL, IS_NOT_NULL -> throw new IllegalStateException(operator.getSymbol() + " is not a comparison");
        };
    }

    private static int compare(ColumnReader column, int row, Object constant) {
        ColumnType type = column.type().id();
        return switch (type.getStorageFamily()) {
            case LONG -> type == ColumnType.UBIGINT
                    ? Long.compareUnsigned(column.getLong(row), (Long) constant)
                    : Long.compare(column.getLong(row), (Long) constant);
            case INT -> Integer.compare(column.getInt(row), (Integer) constant);
            case DOUBLE -> throw new IllegalStateException("doubles are compared by testDouble");
            case BOOLEAN -> Boolean.compare(column.getBoolean(row), (Boolean) constant);
            case OBJECT -> type == ColumnType.VARCHAR
                    ? ((String) column.getValue(row)).compareTo((String) constant)
                    : equalityOnly(column.getValue(row), constant);
        };
    }

    // Lists and maps only support = and <>, which binding enforces.
    private static int equalityOnly(Object value, Object constant) {
        return Objects.equals(value, constant) ? 0 : 1;
    }
}
