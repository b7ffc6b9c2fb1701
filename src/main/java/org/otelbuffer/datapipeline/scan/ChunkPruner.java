package org.otelbuffer.datapipeline.scan;

import org.otelbuffer.datapipeline.api.resources.buffer.ColumnarChunk;
import org.otelbuffer.datapipeline.api.resources.buffer.DimensionSummary;
import org.otelbuffer.datapipeline.api.schema.TableSchema;

/**
 * Decides from chunk statistics alone whether a chunk can hold a matching row.
 * <p>
 * Pruning is sound, never exact: a chunk is skipped only if no row in it can satisfy some
 * predicate. Predicates are ANDed, so one refuting predicate is enough.
 * <ul>
 *   <li><strong>Timestamp column:</strong> a comparison with a non-null constant is checked
 *       against {@code [tsMin, tsMax]} in microseconds. A chunk whose timestamps are all null
 *       fails every such comparison.</li>
 *   <li><strong>Dimension columns:</strong> a {@code uniform(v)} summary refutes
 *       {@code = c} for {@code c != v} and {@code <> c} for {@code c = v}. {@code absent} and
 *       {@code mixed} summaries never prune.</li>
 * </ul>
 * <p>
 * <strong>Thread Safety:</strong> Stateless; safe for concurrent use.
 */
public class ChunkPruner {

    /**
     * @param chunk the chunk
     * @param scan  the bound scan
     * @return true if no row of the chunk can match
     */
    public boolean canPrune(ColumnarChunk chunk, BoundScan scan) {
        if (chunk.size() == 0) {
            return true;
        }
        TableSchema schema = scan.getSchema();
        for (ColumnPredicate predicate : scan.getPredicates()) {
            if (predicate.column() == schema.getTimestampColumn()) {
                if (refutesTimestamp(chunk, predicate)) {
                    return true;
                }
            } else if (refutesDimension(chunk.summaryFor(predicate.column()), predicate)) {
                return true;
            }
        }
        return false;
    }

    private static boolean refutesTimestamp(ColumnarChunk chunk, ColumnPredicate predicate) {
        ComparisonOperator operator = predicate.operator();
        if (operator.isNullCheck()) {
            return operator == ComparisonOperator.IS_NOT_NULL && !chunk.hasTimestampRange();
        }
        if (!(predicate.constant() instanceof Long constantNanos)) {
            return false;
        }
        if (!chunk.hasTimestampRange()) {
            return true;
        }
        // floorDiv is monotone, so ns < c implies floor(ns) <= floor(c), and likewise for the other operators.
        long micros = Math.floorDiv(constantNanos, 1000L);
        long min = chunk.getTsMinMicros();
        long max = chunk.getTsMaxMicros();
        return switch (operator) {
            case EQUAL -> micros < min || micros > max;
            case LESS_THAN, LESS_THAN_OR_EQUAL -> min > micros;
            case GREATER_THAN, GREATER_THAN_OR_EQUAL -> max < micros;
            default -> false;
        };
    }

    private static boolean refutesDimension(DimensionSummary summary, ColumnPredicate predicate) {
        if (!summary.isUniform() || !(predicate.constant() instanceof String constant)) {
            return false;
        }
        return switch (predicate.operator()) {
            case EQUAL -> !summary.value().equals(constant);
            case NOT_EQUAL -> summary.value().equals(constant);
            default -> false;
        };
    }
}
