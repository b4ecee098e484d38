package com.alexandria.rag.segmentation;

import com.alexandria.rag.config.SegmentationProperties;
import com.alexandria.rag.config.SegmentationProperties.Strategy;
import com.alexandria.rag.model.ContentType;
import com.alexandria.rag.model.FileSegment;
import com.alexandria.rag.model.SourceDocument;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.util.unit.DataSize;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileSegmenterTest {

    @TempDir
    Path workDir;

    private SegmentationProperties properties(Strategy strategy, DataSize preferred, int overlapLines, int minLines) {
        return new SegmentationProperties(true, DataSize.ofMegabytes(100), preferred, overlapLines, strategy,
            1000, minLines, 0, 4096, workDir.resolve("segments"), true);
    }

    /**
     * Lines of exactly 100 bytes including the terminator.
     */
    private static String lines(int count) {
        return IntStream.rangeClosed(1, count)
            .mapToObj(i -> String.format("%-98d|", i))
            .collect(Collectors.joining("\n", "", "\n"));
    }

    private Path write(String name, String content) throws IOException {
        return Files.writeString(workDir.resolve(name), content, StandardCharsets.UTF_8);
    }

    private static void assertContiguous(List<FileSegment> segments, long fileSize) {
        assertThat(segments.get(0).startByte()).isZero();
        for (int i = 1; i < segments.size(); i++) {
            assertThat(segments.get(i).startByte()).isEqualTo(segments.get(i - 1).endByte());
        }
        assertThat(segments.get(segments.size() - 1).endByte()).isEqualTo(fileSize);
    }

    @Test
    @DisplayName("Size based segments are line aligned and cover the file without gaps")
    void shouldSplitBySize() throws IOException {
        Path file = write("big.txt", lines(3072));
        FileSegmenter segmenter = new FileSegmenter(properties(Strategy.SIZE_BASED, DataSize.ofKilobytes(50), 50, 1000));

        try (SegmentedFile segmented = segmenter.segment(file)) {
            List<FileSegment> segments = segmented.segments();

            assertThat(segments).hasSize(6);
            assertContiguous(segments, Files.size(file));
            for (FileSegment segment : segments) {
                byte[] bytes = Files.readAllBytes(segment.tempFile());
                assertThat((long) bytes.length).isEqualTo(segment.sizeBytes());
                assertThat(bytes[bytes.length - 1]).isEqualTo((byte) '\n');
                assertThat(segment.metadata()).containsEntry(FileSegmenter.META_STRATEGY, "size_based");
                assertThat(segment.sourcePath()).isEqualTo(file);
            }
            assertThat(segments).extracting(FileSegment::index).containsExactly(0, 1, 2, 3, 4, 5);
        }
    }

    @Test
    @DisplayName("A segment boundary inside a line moves to the next line start")
    void shouldSnapToLineStart() throws IOException {
        Path file = write("uneven.txt", "x".repeat(150) + "\n" + "y".repeat(150) + "\n" + "z".repeat(150) + "\n");
        FileSegmenter segmenter = new FileSegmenter(properties(Strategy.SIZE_BASED, DataSize.ofBytes(100), 0, 1));

        try (SegmentedFile segmented = segmenter.segment(file)) {
            assertThat(segmented.segments()).extracting(FileSegment::endByte).containsExactly(151L, 302L, 453L);
        }
    }

    @Test
    @DisplayName("Line based segments repeat the overlap lines")
    void shouldSplitByLines() throws IOException {
        Path file = write("log.txt", lines(250));
        FileSegmenter segmenter = new FileSegmenter(properties(Strategy.LINE_BASED, DataSize.ofBytes(5000), 10, 100));

        try (SegmentedFile segmented = segmenter.segment(file)) {
            List<FileSegment> segments = segmented.segments();

            assertThat(segments).extracting(FileSegment::lineStart).containsExactly(1, 91, 181);
            assertThat(segments).extracting(FileSegment::lineEnd).containsExactly(100, 190, 250);
            assertThat(segments.get(0).metadata()).containsEntry(FileSegmenter.META_STRATEGY, "line_based");
            assertThat(segments.get(2).endByte()).isEqualTo(Files.size(file));
        }
    }

    @Nested
    @DisplayName("Markdown sections")
    class MarkdownSections {

        @Test
        @DisplayName("Each header starts a segment with its title and level")
        void shouldSplitAtHeaders() throws IOException {
            Path file = write("guide.md", """
                Preamble before any header.
                # Install
                Run the installer.
                ## Configure
                Edit the settings file.
                """);
            FileSegmenter segmenter = new FileSegmenter(properties(Strategy.SIZE_BASED, DataSize.ofKilobytes(50), 0, 1));

            try (SegmentedFile segmented = segmenter.segment(file)) {
                List<FileSegment> segments = segmented.segments();

                assertThat(segments).hasSize(3);
                assertThat(segments.get(0).metadata()).doesNotContainKey(FileSegmenter.META_SECTION_TITLE);
                assertThat(segments.get(1).metadata())
                    .containsEntry(FileSegmenter.META_SECTION_TITLE, "Install")
                    .containsEntry(FileSegmenter.META_HEADER_LEVEL, 1);
                assertThat(segments.get(2).metadata())
                    .containsEntry(FileSegmenter.META_SECTION_TITLE, "Configure")
                    .containsEntry(FileSegmenter.META_HEADER_LEVEL, 2);
                assertContiguous(segments, Files.size(file));
            }
        }

        @Test
        @DisplayName("An oversized section is cut into overlapping sub segments")
        void shouldSubSplitLargeSection() throws IOException {
            // a 100 byte header line followed by 800 lines of 100 bytes
            String header = String.format("%-99s", "# Big") + "\n";
            Path file = write("large.md", header + lines(800));
            FileSegmenter segmenter = new FileSegmenter(properties(Strategy.SIZE_BASED, DataSize.ofKilobytes(50), 50, 1000));

            try (SegmentedFile segmented = segmenter.segment(file)) {
                List<FileSegment> segments = segmented.segments();

                assertThat(segments).hasSize(2);
                assertThat(segments).extracting(FileSegment::lineStart).containsExactly(1, 463);
                assertThat(segments).extracting(FileSegment::lineEnd).containsExactly(512, 801);
                for (int i = 0; i < segments.size(); i++) {
                    assertThat(segments.get(i).metadata())
                        .containsEntry(FileSegmenter.META_SECTION_TITLE, "Big")
                        .containsEntry(FileSegmenter.META_SUB_CHUNK, true)
                        .containsEntry(FileSegmenter.META_SUB_INDEX, i);
                }
            }
        }

        @Test
        @DisplayName("A section several times the preferred size rolls over into bounded sub segments")
        void shouldRollOverLongSection() throws IOException {
            String header = String.format("%-99s", "# Log") + "\n";
            Path file = write("log.md", header + lines(300));
            FileSegmenter segmenter = new FileSegmenter(properties(Strategy.SIZE_BASED, DataSize.ofKilobytes(10), 5, 1000));

            try (SegmentedFile segmented = segmenter.segment(file)) {
                List<FileSegment> segments = segmented.segments();

                assertThat(segments).hasSize(4);
                assertThat(segments).extracting(FileSegment::lineStart).containsExactly(1, 99, 197, 295);
                assertThat(segments).extracting(FileSegment::lineEnd).containsExactly(103, 201, 299, 301);
                for (int i = 0; i < segments.size(); i++) {
                    FileSegment segment = segments.get(i);
                    assertThat(segment.endByte() - segment.startByte()).isLessThanOrEqualTo(10 * 1024 + 100);
                    assertThat(Files.size(segment.tempFile())).isEqualTo(segment.endByte() - segment.startByte());
                    assertThat(segment.metadata()).containsEntry(FileSegmenter.META_SUB_INDEX, i);
                }
            }
        }

        @Test
        @DisplayName("Whitespace between sections does not become a segment")
        void shouldSkipBlankPreamble() throws IOException {
            Path file = write("spaced.md", "\n\n# Install\nRun the installer.\n");
            FileSegmenter segmenter = new FileSegmenter(properties(Strategy.SIZE_BASED, DataSize.ofKilobytes(50), 0, 1));

            try (SegmentedFile segmented = segmenter.segment(file)) {
                assertThat(segmented.segments()).singleElement()
                    .satisfies(segment -> assertThat(segment.lineStart()).isEqualTo(3));
                assertThat(segmented.directory().toFile().list()).hasSize(1);
            }
        }

        @Test
        @DisplayName("The markdown section strategy also applies to other text files")
        void shouldUseSectionsForTextFilesWhenConfigured() throws IOException {
            Path file = write("manual.txt", """
                # Install
                Run the installer.
                # Configure
                Edit the settings file.
                """);
            FileSegmenter segmenter = new FileSegmenter(properties(Strategy.MARKDOWN_SECTION, DataSize.ofKilobytes(50), 0, 1));

            try (SegmentedFile segmented = segmenter.segment(file)) {
                assertThat(segmented.segments())
                    .extracting(segment -> segment.metadata().get(FileSegmenter.META_SECTION_TITLE))
                    .containsExactly("Install", "Configure");
            }
        }

        @Test
        @DisplayName("Markdown without headers falls back to line segments")
        void shouldFallBackWithoutHeaders() throws IOException {
            Path file = write("plain.md", lines(20));
            FileSegmenter segmenter = new FileSegmenter(properties(Strategy.SIZE_BASED, DataSize.ofKilobytes(50), 0, 1));

            try (SegmentedFile segmented = segmenter.segment(file)) {
                assertThat(segmented.segments()).hasSize(1);
                assertThat(segmented.segments().get(0).metadata())
                    .containsEntry(FileSegmenter.META_STRATEGY, "line_based");
            }
        }
    }

    @Test
    @DisplayName("An empty file produces no segments")
    void shouldHandleEmptyFile() throws IOException {
        Path file = write("empty.txt", "");
        FileSegmenter segmenter = new FileSegmenter(properties(Strategy.SIZE_BASED, DataSize.ofKilobytes(50), 0, 1));

        try (SegmentedFile segmented = segmenter.segment(file)) {
            assertThat(segmented.isEmpty()).isTrue();
        }
    }

    @Test
    @DisplayName("Closing the scope removes the temp directory and its segments")
    void shouldCleanUpOnClose() throws IOException {
        Path file = write("big.txt", lines(100));
        FileSegmenter segmenter = new FileSegmenter(properties(Strategy.SIZE_BASED, DataSize.ofBytes(1000), 0, 1));

        SegmentedFile segmented = segmenter.segment(file);
        Path directory = segmented.directory();
        List<Path> parts = segmented.segments().stream().map(FileSegment::tempFile).toList();
        assertThat(parts).hasSize(10).allMatch(Files::exists);

        segmented.close();
        segmented.close();

        assertThat(directory).doesNotExist();
        assertThat(parts).noneMatch(Files::exists);
        assertThatThrownBy(segmented::segments).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Only large text files are segmented")
    void shouldDecideWhenToSegment() {
        SegmentationProperties enabled = new SegmentationProperties(true, DataSize.ofBytes(1000),
            DataSize.ofBytes(500), 0, Strategy.SIZE_BASED, 1000, 1, 0, 4096, workDir, true);
        SegmentationProperties disabled = new SegmentationProperties(false, DataSize.ofBytes(1000),
            DataSize.ofBytes(500), 0, Strategy.SIZE_BASED, 1000, 1, 0, 4096, workDir, true);

        assertThat(new FileSegmenter(enabled).shouldSegment(source(".txt", 2000))).isTrue();
        assertThat(new FileSegmenter(enabled).shouldSegment(source(".log", 1000))).isFalse();
        assertThat(new FileSegmenter(enabled).shouldSegment(source(".pdf", 2000))).isFalse();
        assertThat(new FileSegmenter(disabled).shouldSegment(source(".txt", 2000))).isFalse();
    }

    private SourceDocument source(String extension, long size) {
        Path path = workDir.resolve("file" + extension);
        return new SourceDocument(path, path.getFileName().toString(), path.toString(), "hash", size,
            "text/plain", ContentType.fromExtension(extension), extension, OffsetDateTime.now());
    }
}
