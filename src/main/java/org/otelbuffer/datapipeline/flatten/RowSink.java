package org.otelbuffer.datapipeline.flatten;

import org.otelbuffer.datapipeline.api.schema.Row;
import org.otelbuffer.datapipeline.api.schema.TableKind;

/**
 * Receives flattened rows together with the table they belong to.
 */
@FunctionalInterface
public interface RowSink {

    void accept(TableKind table, Row row);
}
