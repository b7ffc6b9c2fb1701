package org.otelbuffer.datapipeline.ingest;

import org.otelbuffer.datapipeline.api.ingest.IIngestionSource;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * OTLP bytes already in memory, such as the payload of an attached stream.
 */
public final class ByteArrayIngestionSource implements IIngestionSource {

    private final String name;
    private final byte[] bytes;

    /**
     * @param name  identifier for diagnostics; a {@code .jsonl} or {@code .ndjson} suffix forces
     *              JSON Lines mode like a file extension would
     * @param bytes the content; not copied
     */
    public ByteArrayIngestionSource(String name, byte[] bytes) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.bytes = Objects.requireNonNull(bytes, "bytes cannot be null");
    }

    /**
     * @return a source holding the UTF-8 encoding of {@code text}
     */
    public static ByteArrayIngestionSource ofString(String name, String text) {
        return new ByteArrayIngestionSource(name, text.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public InputStream open() {
        return new ByteArrayInputStream(bytes);
    }
}
