package com.alexandria.rag.segmentation;

import com.alexandria.rag.config.SegmentationProperties;
import com.alexandria.rag.exception.SegmentationException;
import com.alexandria.rag.model.FileSegment;
import com.alexandria.rag.model.SourceDocument;
import com.alexandria.rag.segmentation.ByteLineReader.Line;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Pre-splits oversized text files into line-aligned segments so extraction and chunking work on
 * a bounded span at a time.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FileSegmenter {

    public static final String META_STRATEGY = "segment_strategy";
    public static final String META_SECTION_TITLE = "section_title";
    public static final String META_HEADER_LEVEL = "header_level";
    public static final String META_SUB_CHUNK = "sub_chunk";
    public static final String META_SUB_INDEX = "sub_index";

    private static final Set<String> SEGMENTABLE_EXTENSIONS = Set.of(".txt", ".md", ".markdown", ".rst", ".log");
    private static final Set<String> MARKDOWN_EXTENSIONS = Set.of(".md", ".markdown");
    private static final Pattern MARKDOWN_HEADER = Pattern.compile("^(#{1,6})\\s+(.+)$");
    private static final int MIN_AVERAGE_LINE_LENGTH = 50;
    private static final int DEFAULT_AVERAGE_LINE_LENGTH = 100;

    private final SegmentationProperties properties;

    public boolean shouldSegment(SourceDocument document) {
        return properties.enabled()
            && SEGMENTABLE_EXTENSIONS.contains(document.extension().toLowerCase(Locale.ROOT))
            && document.fileSize() > properties.maxFileSize().toBytes();
    }

    /**
     * Splits {@code file} into segments inside a fresh temp directory. The caller owns the
     * returned scope and must close it.
     *
     * @throws SegmentationException if the file cannot be read or the segments cannot be written;
     *                               anything created so far is removed first
     */
    public SegmentedFile segment(Path file) {
        Path directory;
        try {
            Path root = Files.createDirectories(properties.resolvedTempDir());
            directory = Files.createTempDirectory(root, "segments_");
        } catch (IOException e) {
            throw new SegmentationException(file, e);
        }

        SegmentedFile scope = new SegmentedFile(file, directory);
        try {
            long size = Files.size(file);
            if (size > 0) {
                if (isMarkdown(file) || properties.strategy() == SegmentationProperties.Strategy.MARKDOWN_SECTION) {
                    segmentMarkdown(file, scope);
                } else if (properties.strategy() == SegmentationProperties.Strategy.LINE_BASED) {
                    segmentByLines(file, scope);
                } else {
                    segmentBySize(file, size, scope);
                }
            }
            log.info("Split {} ({} bytes) into {} segments", file, size, scope.segments().size());
            return scope;
        } catch (IOException | RuntimeException e) {
            scope.close();
            throw e instanceof SegmentationException se ? se : new SegmentationException(file, e);
        }
    }

    private void segmentBySize(Path file, long fileSize, SegmentedFile scope) throws IOException {
        long preferred = properties.preferredSegmentSize().toBytes();
        long overlap = properties.sizeOverlapBytes();

        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
            long start = 0;
            while (start < fileSize) {
                long end = Math.min(fileSize, start + preferred);
                if (end < fileSize) {
                    end = snapToLineStart(channel, end, fileSize);
                }

                Path target = scope.nextSegmentPath();
                copyRange(channel, start, end, target);
                scope.add(FileSegment.of(scope.segments().size(), file, target, start, end, null, null,
                    Map.of(META_STRATEGY, "size_based")));

                if (end >= fileSize) {
                    break;
                }
                start = overlap > 0
                    ? snapToLineStart(channel, Math.max(start + 1, end - overlap), end)
                    : end;
            }
        }
    }

    private void segmentByLines(Path file, SegmentedFile scope) throws IOException {
        int linesPerSegment = (int) Math.max(properties.minLinesPerSegment(),
            properties.preferredSegmentSize().toBytes() / averageLineLength(file));
        int overlap = Math.min(properties.overlapLines(), linesPerSegment - 1);
        Map<String, Object> metadata = Map.of(META_STRATEGY, "line_based");

        try (ByteLineReader reader = ByteLineReader.open(file);
             SegmentWriter writer = new SegmentWriter(scope, file, overlap, Long.MAX_VALUE)) {
            Line line;
            while ((line = reader.next()) != null) {
                writer.write(line);
                if (writer.lines() >= linesPerSegment) {
                    writer.rollOver(metadata);
                }
            }
            writer.finish(metadata, true);
        }
    }

    /**
     * One segment per header section. A section growing past the preferred size is cut into
     * numbered sub-segments as it is read, so memory holds at most the overlap lines.
     */
    private void segmentMarkdown(Path file, SegmentedFile scope) throws IOException {
        if (!hasHeaders(file)) {
            log.debug("No markdown headers in {}, segmenting by lines", file);
            segmentByLines(file, scope);
            return;
        }

        long preferred = properties.preferredSegmentSize().toBytes();
        try (ByteLineReader reader = ByteLineReader.open(file);
             SegmentWriter writer = new SegmentWriter(scope, file, properties.overlapLines(), preferred / 2)) {
            Map<String, Object> section = sectionMetadata(null, 0);
            String title = null;
            int subIndex = 0;
            Line line;
            while ((line = reader.next()) != null) {
                var header = MARKDOWN_HEADER.matcher(line.text());
                if (header.matches()) {
                    finishSection(writer, section, title, subIndex);
                    title = header.group(2).strip();
                    section = sectionMetadata(title, header.group(1).length());
                    subIndex = 0;
                } else if (writer.bytes() >= preferred && writer.freshLines() > 0) {
                    writer.rollOver(subSegmentMetadata(section, subIndex++));
                }
                writer.write(line);
            }
            finishSection(writer, section, title, subIndex);
        }
    }

    private void finishSection(SegmentWriter writer, Map<String, Object> section, String title, int subIndex)
        throws IOException {
        if (subIndex == 0) {
            // whitespace between sections is not worth a segment
            writer.finish(section, writer.hasText());
        } else {
            writer.finish(subSegmentMetadata(section, subIndex), true);
            log.debug("Section '{}' split into {} sub-segments", title, subIndex + 1);
        }
        writer.clearOverlap();
    }

    private static Map<String, Object> sectionMetadata(String title, int level) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(META_STRATEGY, "markdown_section");
        if (title != null) {
            metadata.put(META_SECTION_TITLE, title);
            metadata.put(META_HEADER_LEVEL, level);
        }
        return metadata;
    }

    private static Map<String, Object> subSegmentMetadata(Map<String, Object> section, int subIndex) {
        Map<String, Object> metadata = new LinkedHashMap<>(section);
        metadata.put(META_SUB_CHUNK, true);
        metadata.put(META_SUB_INDEX, subIndex);
        return metadata;
    }

    private long averageLineLength(Path file) throws IOException {
        long total = 0;
        int count = 0;
        try (ByteLineReader reader = ByteLineReader.open(file)) {
            Line line;
            while (count < properties.lineSampleSize() && (line = reader.next()) != null) {
                total += line.bytes().length;
                count++;
            }
        }
        if (count == 0) {
            return DEFAULT_AVERAGE_LINE_LENGTH;
        }
        return Math.max(MIN_AVERAGE_LINE_LENGTH, total / count);
    }

    private boolean hasHeaders(Path file) throws IOException {
        try (ByteLineReader reader = ByteLineReader.open(file)) {
            Line line;
            while ((line = reader.next()) != null) {
                if (MARKDOWN_HEADER.matcher(line.text()).matches()) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Moves {@code position} forward to just after the next line break within the lookahead
     * window. A position already at a line start, or one with no break in reach, is kept.
     */
    private long snapToLineStart(FileChannel channel, long position, long limit) throws IOException {
        if (position <= 0 || position >= limit) {
            return position;
        }
        ByteBuffer previous = ByteBuffer.allocate(1);
        if (channel.read(previous, position - 1) == 1 && previous.get(0) == '\n') {
            return position;
        }

        int window = (int) Math.min(properties.lookaheadBytes(), limit - position);
        ByteBuffer lookahead = ByteBuffer.allocate(window);
        int read = channel.read(lookahead, position);
        for (int i = 0; i < read; i++) {
            if (lookahead.get(i) == '\n') {
                return position + i + 1;
            }
        }
        return position;
    }

    private static void copyRange(FileChannel source, long start, long end, Path target) throws IOException {
        try (FileChannel out = FileChannel.open(target, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
            long position = start;
            while (position < end) {
                long transferred = source.transferTo(position, end - position, out);
                if (transferred <= 0) {
                    throw new IOException("Unexpected end of file at byte " + position);
                }
                position += transferred;
            }
        }
    }

    private static boolean isMarkdown(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return MARKDOWN_EXTENSIONS.stream().anyMatch(name::endsWith);
    }

    /**
     * Streams consecutive lines into segment files. The segment file is opened on the first line
     * and registered with the scope when finished.
     */
    private static final class SegmentWriter implements Closeable {

        private final SegmentedFile scope;
        private final Path file;
        private final int overlapLines;
        private final long maxOverlapBytes;
        private final Deque<Line> tail = new ArrayDeque<>();

        private OutputStream out;
        private Path target;
        private Line first;
        private Line last;
        private long bytes;
        private int lines;
        private int freshLines;
        private boolean hasText;

        SegmentWriter(SegmentedFile scope, Path file, int overlapLines, long maxOverlapBytes) {
            this.scope = scope;
            this.file = file;
            this.overlapLines = Math.max(0, overlapLines);
            this.maxOverlapBytes = maxOverlapBytes;
        }

        void write(Line line) throws IOException {
            append(line);
            freshLines++;
            if (overlapLines > 0) {
                tail.addLast(line);
                if (tail.size() > overlapLines) {
                    tail.removeFirst();
                }
            }
        }

        /**
         * Finishes the current segment and opens the next one with the overlap lines repeated.
         */
        void rollOver(Map<String, Object> metadata) throws IOException {
            List<Line> carried = overlap();
            finish(metadata, true);
            tail.clear();
            for (Line line : carried) {
                append(line);
                tail.addLast(line);
            }
        }

        /**
         * Closes the current segment file. It is kept when {@code keep} is set and it holds at
         * least one line not repeated from the previous segment, otherwise it is deleted.
         */
        void finish(Map<String, Object> metadata, boolean keep) throws IOException {
            if (out != null) {
                out.close();
                out = null;
                if (keep && freshLines > 0) {
                    scope.add(FileSegment.of(scope.segments().size(), file, target, first.offset(), last.end(),
                        first.number(), last.number(), metadata));
                } else {
                    Files.delete(target);
                }
            }
            target = null;
            first = null;
            last = null;
            bytes = 0;
            lines = 0;
            freshLines = 0;
            hasText = false;
        }

        void clearOverlap() {
            tail.clear();
        }

        long bytes() {
            return bytes;
        }

        int lines() {
            return lines;
        }

        int freshLines() {
            return freshLines;
        }

        boolean hasText() {
            return hasText;
        }

        private void append(Line line) throws IOException {
            if (out == null) {
                target = scope.nextSegmentPath();
                out = new BufferedOutputStream(Files.newOutputStream(target));
                first = line;
            }
            out.write(line.bytes());
            last = line;
            bytes += line.bytes().length;
            lines++;
            hasText |= !line.text().isBlank();
        }

        private List<Line> overlap() {
            List<Line> carried = new ArrayList<>();
            long carriedBytes = 0;
            Iterator<Line> newestFirst = tail.descendingIterator();
            while (newestFirst.hasNext()) {
                Line line = newestFirst.next();
                carriedBytes += line.bytes().length;
                if (carriedBytes > maxOverlapBytes) {
                    break;
                }
                carried.add(0, line);
            }
            return carried;
        }

        @Override
        public void close() throws IOException {
            if (out != null) {
                out.close();
                out = null;
            }
        }
    }
}
