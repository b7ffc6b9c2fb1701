package org.otelbuffer.datapipeline.ingest;

import org.otelbuffer.datapipeline.api.ingest.DocumentSizeLimitException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Reads UTF-8 lines from a stream while holding at most one line in memory.
 * <p>
 * Lines end at {@code \n}; a trailing {@code \r} is dropped. A line longer than the limit
 * fails with {@link DocumentSizeLimitException} as soon as the limit is crossed, without
 * buffering the rest of it.
 * <p>
 * <strong>Thread Safety:</strong> Not thread-safe.
 */
final class BoundedLineReader {

    private static final int READ_CHUNK = 8192;

    private final InputStream in;
    private final String sourceName;
    private final long maxLineBytes;
    private final byte[] readBuffer = new byte[READ_CHUNK];
    private int readPos;
    private int readLimit;
    private byte[] line = new byte[256];
    private int lineLength;
    private long lineNumber;
    private boolean eof;

    BoundedLineReader(InputStream in, String sourceName, long maxLineBytes) {
        this.in = in;
        this.sourceName = sourceName;
        this.maxLineBytes = maxLineBytes;
    }

    /**
     * @return the next line without its terminator, or null at end of stream
     * @throws DocumentSizeLimitException if the line exceeds the limit
     * @throws IOException                on read failure
     */
    String readLine() throws IOException, DocumentSizeLimitException {
        if (eof) {
            return null;
        }
        lineLength = 0;
        while (true) {
            if (readPos == readLimit) {
                readLimit = in.read(readBuffer, 0, READ_CHUNK);
                readPos = 0;
                if (readLimit <= 0) {
                    readLimit = 0;
                    eof = true;
                    if (lineLength == 0) {
                        return null;
                    }
                    return finishLine();
                }
            }
            int start = readPos;
            while (readPos < readLimit && readBuffer[readPos] != '\n') {
                readPos++;
            }
            append(start, readPos - start);
            if (readPos < readLimit) {
                readPos++;
                return finishLine();
            }
        }
    }

    /**
     * @return 1-based number of the line most recently returned
     */
    long getLineNumber() {
        return lineNumber;
    }

    private void append(int from, int count) throws DocumentSizeLimitException {
        if ((long) lineLength + count > maxLineBytes) {
            throw new DocumentSizeLimitException(sourceName, maxLineBytes);
        }
        if (lineLength + count > line.length) {
            line = Arrays.copyOf(line, Math.max(line.length * 2, lineLength + count));
        }
        System.arraycopy(readBuffer, from, line, lineLength, count);
        lineLength += count;
    }

    private String finishLine() {
        lineNumber++;
        int length = lineLength;
        if (length > 0 && line[length - 1] == '\r') {
            length--;
        }
        return new String(line, 0, length, StandardCharsets.UTF_8);
    }
}
