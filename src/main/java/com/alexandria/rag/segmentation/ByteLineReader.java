package com.alexandria.rag.segmentation;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a file as raw byte lines (terminator included) so segment boundaries map exactly onto
 * byte offsets of the source, whatever its encoding.
 */
final class ByteLineReader implements Closeable {

    record Line(int number, long offset, byte[] bytes) {

        long end() {
            return offset + bytes.length;
        }

        String text() {
            return new String(bytes, StandardCharsets.UTF_8).stripTrailing();
        }
    }

    private final InputStream in;
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream(256);
    private long offset;
    private int lineNumber;

    private ByteLineReader(InputStream in) {
        this.in = in;
    }

    static ByteLineReader open(Path file) throws IOException {
        return new ByteLineReader(new BufferedInputStream(Files.newInputStream(file), 64 * 1024));
    }

    /**
     * @return the next line, or {@code null} at end of file
     */
    Line next() throws IOException {
        buffer.reset();
        int b;
        while ((b = in.read()) != -1) {
            buffer.write(b);
            if (b == '\n') {
                break;
            }
        }
        if (buffer.size() == 0) {
            return null;
        }
        Line line = new Line(++lineNumber, offset, buffer.toByteArray());
        offset += line.bytes().length;
        return line;
    }

    @Override
    public void close() throws IOException {
        in.close();
    }
}
