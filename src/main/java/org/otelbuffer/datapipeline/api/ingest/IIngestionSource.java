package org.otelbuffer.datapipeline.api.ingest;

import java.io.IOException;
import java.io.InputStream;

/**
 * A sequential byte stream holding OTLP data: a file, an object, an attached stream.
 * <p>
 * {@link #open()} may be called once per ingestion; the pipeline buffers the stream itself
 * for format sniffing, so sources need not support seeking.
 */
public interface IIngestionSource {

    /**
     * @return a human-readable identifier used in diagnostics and error messages
     */
    String getName();

    /**
     * Opens the stream. The caller closes it.
     *
     * @return a new input stream positioned at the first byte
     * @throws IOException if the source cannot be read
     */
    InputStream open() throws IOException;
}
