package org.otelbuffer.datapipeline.scan;

import it.unimi.dsi.fastutil.ints.IntArrayList;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Unbound column projection plus conjunctive predicates.
 * <p>
 * An empty projection means every column. Predicates are ANDed.
 */
public final class ScanRequest {

    private static final ScanRequest ALL = new Builder().build();

    private final int[] projection;
    private final List<ColumnPredicate> predicates;

    private ScanRequest(Builder builder) {
        this.projection = builder.projection.toIntArray();
        this.predicates = List.copyOf(builder.predicates);
    }

    /**
     * @return a request for all columns and all rows
     */
    public static ScanRequest all() {
        return ALL;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return projected column indices in output order; empty for all columns
     */
    public int[] getProjection() {
        return projection.clone();
    }

    public List<ColumnPredicate> getPredicates() {
        return predicates;
    }

    @Override
    public String toString() {
        return "ScanRequest{projection=" + Arrays.toString(projection) + ", where=" + predicates + "}";
    }

    public static final class Builder {
        private final IntArrayList projection = new IntArrayList();
        private final List<ColumnPredicate> predicates = new ArrayList<>();

        private Builder() {
        }

        /**
         * Appends columns to the projection.
         *
         * @param columns schema column indices
         * @return this builder
         */
        public Builder project(int... columns) {
            projection.addElements(projection.size(), columns);
            return this;
        }

        public Builder where(ColumnPredicate predicate) {
            predicates.add(predicate);
            return this;
        }

        public Builder where(int column, ComparisonOperator operator, Object constant) {
            return where(new ColumnPredicate(column, operator, constant));
        }

        public ScanRequest build() {
            return new ScanRequest(this);
        }
    }
}
