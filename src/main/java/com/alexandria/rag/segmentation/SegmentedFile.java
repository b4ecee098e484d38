package com.alexandria.rag.segmentation;

import com.alexandria.rag.model.FileSegment;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Stream;

/**
 * Owns the temp directory holding the segments of one source file. Closing it removes every
 * segment file and the directory itself; segments must not be read afterwards.
 */
@Slf4j
public final class SegmentedFile implements AutoCloseable {

    private final Path source;
    private final Path directory;
    private final List<FileSegment> segments = new ArrayList<>();
    private boolean closed;

    SegmentedFile(Path source, Path directory) {
        this.source = source;
        this.directory = directory;
    }

    public Path directory() {
        return directory;
    }

    public List<FileSegment> segments() {
        if (closed) {
            throw new IllegalStateException("Segments of " + source + " were already released");
        }
        return Collections.unmodifiableList(segments);
    }

    public boolean isEmpty() {
        return segments.isEmpty();
    }

    Path nextSegmentPath() {
        return directory.resolve(String.format("segment_%05d.part", segments.size()));
    }

    void add(FileSegment segment) {
        segments.add(segment);
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;

        try (Stream<Path> files = Files.list(directory)) {
            files.forEach(SegmentedFile::delete);
        } catch (IOException e) {
            log.warn("Could not list segment directory {}", directory, e);
        }
        delete(directory);
        log.debug("Released {} segments of {}", segments.size(), source);
    }

    private static void delete(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Could not delete {}", path, e);
        }
    }
}
