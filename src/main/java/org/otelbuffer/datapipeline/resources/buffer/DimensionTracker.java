package org.otelbuffer.datapipeline.resources.buffer;

import org.otelbuffer.datapipeline.api.resources.buffer.DimensionSummary;

/**
 * Running uniform/mixed state of one dimension column while a chunk is built.
 * Null values are ignored.
 */
final class DimensionTracker {

    private final boolean tracked;
    private String value;
    private boolean mixed;

    DimensionTracker(boolean tracked) {
        this.tracked = tracked;
    }

    void observe(String candidate) {
        if (!tracked || mixed || candidate == null) {
            return;
        }
        if (value == null) {
            value = candidate;
        } else if (!value.equals(candidate)) {
            mixed = true;
            value = null;
        }
    }

    DimensionSummary freeze() {
        if (mixed) {
            return DimensionSummary.mixed();
        }
        return value == null ? DimensionSummary.absent() : DimensionSummary.uniform(value);
    }
}
