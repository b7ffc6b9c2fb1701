package org.otelbuffer.datapipeline.scan;

import java.util.Objects;

/**
 * A condition on one column: {@code column <op> constant}.
 * <p>
 * The constant must be a cell value of the column's type (see
 * {@link org.otelbuffer.datapipeline.api.schema.DataType#accepts(Object)}); integral and
 * floating constants are widened where this loses nothing. A null constant is allowed for
 * EQUAL (matches null cells) and NOT_EQUAL (matches non-null cells); ordering against null
 * matches nothing. IS_NULL and IS_NOT_NULL take no constant.
 *
 * @param column   schema column index
 * @param operator the operator
 * @param constant the constant, or null
 */
public record ColumnPredicate(int column, ComparisonOperator operator, Object constant) {

    public ColumnPredicate {
        Objects.requireNonNull(operator, "operator cannot be null");
    }

    public static ColumnPredicate of(int column, ComparisonOperator operator, Object constant) {
        return new ColumnPredicate(column, operator, constant);
    }

    public static ColumnPredicate equal(int column, Object constant) {
        return new ColumnPredicate(column, ComparisonOperator.EQUAL, constant);
    }

    public static ColumnPredicate isNull(int column) {
        return new ColumnPredicate(column, ComparisonOperator.IS_NULL, null);
    }

    public static ColumnPredicate isNotNull(int column) {
        return new ColumnPredicate(column, ComparisonOperator.IS_NOT_NULL, null);
    }

    @Override
    public String toString() {
        return "#" + column + " " + operator.getSymbol() + (operator.isNullCheck() ? "" : " " + constant);
    }
}
