package org.otelbuffer.datapipeline.ingest;

import org.otelbuffer.datapipeline.api.ingest.IIngestionSource;
import org.otelbuffer.datapipeline.api.ingest.IngestionException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A local OTLP file.
 */
public final class FileIngestionSource implements IIngestionSource {

    private final Path path;

    public FileIngestionSource(Path path) {
        this.path = Objects.requireNonNull(path, "path cannot be null");
    }

    /**
     * Expands a glob pattern inside one directory, e.g. {@code glob(dir, "*.jsonl")}.
     *
     * @param directory the directory to search
     * @param pattern   a {@link java.nio.file.FileSystem#getPathMatcher glob} matched against file names
     * @return one source per regular file, sorted by file name
     * @throws IngestionException if nothing matches or the directory cannot be listed
     */
    public static List<FileIngestionSource> glob(Path directory, String pattern) throws IngestionException {
        String name = directory.resolve(pattern).toString();
        List<Path> matches = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, pattern)) {
            for (Path path : stream) {
                if (Files.isRegularFile(path)) {
                    matches.add(path);
                }
            }
        } catch (IOException e) {
            throw new IngestionException(name, "Failed to list files matching '" + name + "': " + e.getMessage(), e);
        }
        if (matches.isEmpty()) {
            throw new IngestionException(name, "No files found matching '" + name + "'");
        }
        Collections.sort(matches);
        List<FileIngestionSource> sources = new ArrayList<>(matches.size());
        for (Path path : matches) {
            sources.add(new FileIngestionSource(path));
        }
        return sources;
    }

    public Path getPath() {
        return path;
    }

    @Override
    public String getName() {
        return path.toString();
    }

    @Override
    public InputStream open() throws IOException {
        return Files.newInputStream(path);
    }

    @Override
    public String toString() {
        return "FileIngestionSource{" + path + "}";
    }
}
