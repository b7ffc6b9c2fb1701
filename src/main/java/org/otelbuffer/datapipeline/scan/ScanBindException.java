package org.otelbuffer.datapipeline.scan;

/**
 * A scan request does not fit the schema it is bound to: a column index is out of range, a
 * constant has the wrong type, or an operator does not apply to the column.
 * <p>
 * Raised by {@link ScanEngine#bind} before any chunk is read.
 */
public class ScanBindException extends IllegalArgumentException {

    public ScanBindException(String message) {
        super(message);
    }

    public ScanBindException(String message, Throwable cause) {
        super(message, cause);
    }
}
