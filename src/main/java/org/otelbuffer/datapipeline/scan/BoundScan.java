package org.otelbuffer.datapipeline.scan;

import org.otelbuffer.datapipeline.api.schema.ColumnType;
import org.otelbuffer.datapipeline.api.schema.DataType;
import org.otelbuffer.datapipeline.api.schema.TableSchema;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A {@link ScanRequest} checked against a schema.
 * <p>
 * Binding resolves an empty projection to every column and normalizes predicate constants to
 * the exact Java type of their column, so scan workers never re-check types.
 * <p>
 * <strong>Thread Safety:</strong> Immutable.
 */
public final class BoundScan {

    private final TableSchema schema;
    private final int[] projection;
    private final List<ColumnPredicate> predicates;

    private BoundScan(TableSchema schema, int[] projection, List<ColumnPredicate> predicates) {
        this.schema = schema;
        this.projection = projection;
        this.predicates = List.copyOf(predicates);
    }

    /**
     * Binds a request.
     *
     * @param schema  the schema of the buffer to scan
     * @param request the request
     * @return the bound scan
     * @throws ScanBindException if the request does not fit the schema
     */
    static BoundScan bind(TableSchema schema, ScanRequest request) {
        int[] requested = request.getProjection();
        int[] projection;
        if (requested.length == 0) {
            projection = new int[schema.arity()];
            for (int i = 0; i < projection.length; i++) {
                projection[i] = i;
            }
        } else {
            for (int column : requested) {
                checkColumn(schema, column, "Projected");
            }
            projection = requested;
        }

        List<ColumnPredicate> bound = new ArrayList<>(request.getPredicates().size());
        for (ColumnPredicate predicate : request.getPredicates()) {
            bound.add(bindPredicate(schema, predicate));
        }
        return new BoundScan(schema, projection, bound);
    }

    private static ColumnPredicate bindPredicate(TableSchema schema, ColumnPredicate predicate) {
        checkColumn(schema, predicate.column(), "Predicate");
        ComparisonOperator operator = predicate.operator();
        DataType type = schema.typeOf(predicate.column());
        String columnName = schema.column(predicate.column()).name();
        if (operator.isNullCheck()) {
            if (predicate.constant() != null) {
                throw new ScanBindException(operator.getSymbol() + " on '" + columnName + "' takes no constant");
            }
            return predicate;
        }
        if (operator.isOrdering() && !type.id().isOrderable()) {
            throw new ScanBindException("Operator " + operator.getSymbol() + " is not defined for "
                    + type.getSqlType() + " column '" + columnName + "'");
        }
        if (predicate.constant() == null) {
            return predicate;
        }
        Object constant = coerce(type, predicate.constant());
        if (!type.accepts(constant)) {
            throw new ScanBindException("Constant " + predicate.constant() + " ("
                    + predicate.constant().getClass().getSimpleName() + ") does not match "
                    + type.getSqlType() + " column '" + columnName + "'");
        }
        return new ColumnPredicate(predicate.column(), operator, constant);
    }

    // Widens numeric constants where no information is lost; everything else is left to accepts().
    private static Object coerce(DataType type, Object constant) {
        ColumnType id = type.id();
        if (id.getStorageFamily() == ColumnType.StorageFamily.LONG
                && (constant instanceof Integer || constant instanceof Short || constant instanceof Byte)) {
            return ((Number) constant).longValue();
        }
        if (id == ColumnType.INTEGER && constant instanceof Long value
                && value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
            return value.intValue();
        }
        if (id == ColumnType.DOUBLE && (constant instanceof Float || constant instanceof Integer)) {
            return ((Number) constant).doubleValue();
        }
        return constant;
    }

    private static void checkColumn(TableSchema schema, int column, String role) {
        if (column < 0 || column >= schema.arity()) {
            throw new ScanBindException(role + " column index " + column + " out of range for "
                    + schema.getName() + " with " + schema.arity() + " columns");
        }
    }

    public TableSchema getSchema() {
        return schema;
    }

    /**
     * @return projected column indices in output order, never empty for a non-empty schema
     */
    public int[] getProjection() {
        return projection.clone();
    }

    int projectedColumn(int outputIndex) {
        return projection[outputIndex];
    }

    int projectionWidth() {
        return projection.length;
    }

    public List<ColumnPredicate> getPredicates() {
        return predicates;
    }

    @Override
    public String toString() {
        return "BoundScan{" + schema.getName() + ", projection=" + Arrays.toString(projection)
                + ", where=" + predicates + "}";
    }
}
