package com.alexandria.rag.service;

import com.alexandria.rag.exception.ExtractionException;
import com.alexandria.rag.infra.Digests;
import com.alexandria.rag.model.ContentType;
import com.alexandria.rag.model.SourceDocument;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.Tika;
import org.apache.tika.exception.TikaException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Stream;

/**
 * File level concerns of ingestion: identity, classification, text extraction and directory
 * discovery.
 */
@Slf4j
@Component
public class DocumentProcessor {

    public static final List<String> SUPPORTED_EXTENSIONS = List.of(
        ".txt", ".md", ".markdown", ".rst",
        ".py", ".js", ".ts", ".java", ".cpp", ".c", ".h", ".hpp",
        ".css", ".html", ".xml", ".json", ".yaml", ".yml",
        ".ini", ".cfg", ".conf", ".log", ".csv",
        ".pdf", ".docx", ".doc", ".rtf", ".odt"
    );

    private static final String DEFAULT_MIME_TYPE = "application/octet-stream";
    private static final Charset WINDOWS_1252 = Charset.forName("windows-1252");

    private final Tika tika;

    public DocumentProcessor() {
        this.tika = new Tika();
        this.tika.setMaxStringLength(-1);
    }

    public List<String> supportedExtensions() {
        return SUPPORTED_EXTENSIONS;
    }

    public boolean isSupported(Path file) {
        return SUPPORTED_EXTENSIONS.contains(extensionOf(file));
    }

    public SourceDocument describe(Path file) {
        Path absolute = file.toAbsolutePath().normalize();
        try {
            String extension = extensionOf(absolute);
            // timestamptz keeps microseconds, so compare at that precision
            OffsetDateTime lastModified = Files.getLastModifiedTime(absolute).toInstant()
                .atOffset(ZoneOffset.UTC)
                .truncatedTo(ChronoUnit.MICROS);

            return new SourceDocument(
                absolute,
                absolute.getFileName().toString(),
                absolute.toString(),
                hash(absolute),
                Files.size(absolute),
                detectMimeType(absolute),
                ContentType.fromExtension(extension),
                extension,
                lastModified
            );
        } catch (IOException e) {
            throw new ExtractionException(absolute, "Cannot read " + absolute + ": " + e.getMessage(), e);
        }
    }

    public Map<String, Object> documentMetadata(SourceDocument source) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("extension", source.extension());
        metadata.put("mime_type", source.mimeType());
        metadata.put("content_type", source.contentType().value());
        metadata.put("file_size", source.fileSize());
        return metadata;
    }

    /**
     * Text of the whole document. Binary formats go through Tika; everything else is decoded
     * with the encoding fallback chain.
     */
    public String extractText(SourceDocument source) {
        if (source.contentType().isBinary()) {
            try {
                return tika.parseToString(source.path());
            } catch (IOException | TikaException e) {
                throw new ExtractionException(source.path(),
                    "Cannot extract text from " + source.filename() + ": " + e.getMessage(), e);
            }
        }
        return readText(source.path());
    }

    /**
     * Decodes a text file with the first charset that accepts it: UTF-16 if the file starts with
     * a byte order mark, then UTF-8 and windows-1252. ISO-8859-1 maps every byte, so it comes last.
     */
    public String readText(Path file) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new ExtractionException(file, "Cannot read " + file + ": " + e.getMessage(), e);
        }

        for (Charset charset : candidateCharsets(bytes)) {
            try {
                String text = charset.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
                if (charset != StandardCharsets.UTF_8) {
                    log.debug("Decoded {} as {}", file, charset.name());
                }
                return !text.isEmpty() && text.charAt(0) == '\uFEFF' ? text.substring(1) : text;
            } catch (CharacterCodingException e) {
                log.trace("{} is not valid {}", file, charset.name());
            }
        }
        throw new ExtractionException(file, "Cannot decode " + file + " with any supported encoding");
    }

    /**
     * Supported regular files under {@code directory}, in path order.
     */
    public List<Path> scanDirectory(Path directory, boolean recursive) {
        int depth = recursive ? Integer.MAX_VALUE : 1;
        try (Stream<Path> paths = Files.walk(directory, depth)) {
            return paths
                .filter(Files::isRegularFile)
                .filter(this::isSupported)
                .sorted()
                .toList();
        } catch (IOException e) {
            throw new ExtractionException(directory, "Cannot list " + directory + ": " + e.getMessage(), e);
        }
    }

    public static String extensionOf(Path file) {
        String name = file.getFileName() == null ? "" : file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot <= 0 ? "" : name.substring(dot).toLowerCase(Locale.ROOT);
    }

    private String detectMimeType(Path file) {
        try {
            return tika.detect(file);
        } catch (IOException e) {
            log.warn("MIME detection failed for {}: {}", file, e.getMessage());
            return DEFAULT_MIME_TYPE;
        }
    }

    private static String hash(Path file) throws IOException {
        MessageDigest digest = Digests.sha256();
        byte[] buffer = new byte[64 * 1024];
        try (InputStream in = Files.newInputStream(file)) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                digest.update(buffer, 0, read);
            }
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    private static List<Charset> candidateCharsets(byte[] bytes) {
        boolean utf16Bom = bytes.length >= 2
            && ((bytes[0] == (byte) 0xFE && bytes[1] == (byte) 0xFF) || (bytes[0] == (byte) 0xFF && bytes[1] == (byte) 0xFE));
        return utf16Bom
            ? List.of(StandardCharsets.UTF_16, StandardCharsets.UTF_8, WINDOWS_1252, StandardCharsets.ISO_8859_1)
            : List.of(StandardCharsets.UTF_8, WINDOWS_1252, StandardCharsets.ISO_8859_1);
    }
}
