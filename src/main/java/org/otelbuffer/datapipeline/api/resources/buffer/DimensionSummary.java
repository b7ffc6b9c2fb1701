package org.otelbuffer.datapipeline.api.resources.buffer;

import java.util.Locale;
import java.util.Objects;

/**
 * Chunk-level summary of a dimension column (service name, metric name).
 * <p>
 * <ul>
 *   <li>{@link Kind#ABSENT}: the column is not tracked for this schema, or the chunk holds no
 *       non-null value in it. Never used for pruning.</li>
 *   <li>{@link Kind#UNIFORM}: every non-null value in the chunk equals {@link #value()}.</li>
 *   <li>{@link Kind#MIXED}: at least two distinct non-null values were seen.</li>
 * </ul>
 *
 * @param kind  the summary state
 * @param value the shared value when {@code kind == UNIFORM}, null otherwise
 */
public record DimensionSummary(Kind kind, String value) {

    public enum Kind {
        ABSENT,
        UNIFORM,
        MIXED
    }

    private static final DimensionSummary ABSENT = new DimensionSummary(Kind.ABSENT, null);
    private static final DimensionSummary MIXED = new DimensionSummary(Kind.MIXED, null);

    public DimensionSummary {
        Objects.requireNonNull(kind, "kind cannot be null");
        if ((kind == Kind.UNIFORM) != (value != null)) {
            throw new IllegalArgumentException("A value is required for UNIFORM and forbidden otherwise");
        }
    }

    public static DimensionSummary absent() {
        return ABSENT;
    }

    public static DimensionSummary mixed() {
        return MIXED;
    }

    public static DimensionSummary uniform(String value) {
        return new DimensionSummary(Kind.UNIFORM, value);
    }

    public boolean isUniform() {
        return kind == Kind.UNIFORM;
    }

    @Override
    public String toString() {
        return kind == Kind.UNIFORM ? "uniform(" + value + ")" : kind.name().toLowerCase(Locale.ROOT);
    }
}
