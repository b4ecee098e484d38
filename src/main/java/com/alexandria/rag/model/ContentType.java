package com.alexandria.rag.model;

import java.util.Locale;
import java.util.Set;

/**
 * Coarse classification of a source file, derived from its extension.
 * Drives both the text chunking strategy and search filters.
 */
public enum ContentType {
    MARKDOWN("markdown", Set.of(".md", ".markdown")),
    CODE("code", Set.of(".py", ".js", ".ts", ".java", ".cpp", ".c", ".h", ".hpp")),
    MARKUP("markup", Set.of(".html", ".xml")),
    STRUCTURED_DATA("structured_data", Set.of(".json", ".yaml", ".yml")),
    PDF("pdf", Set.of(".pdf")),
    DOCUMENT("document", Set.of(".docx", ".doc", ".rtf", ".odt")),
    CSV("csv", Set.of(".csv")),
    TEXT("text", Set.of());

    private final String value;
    private final Set<String> extensions;

    ContentType(String value, Set<String> extensions) {
        this.value = value;
        this.extensions = extensions;
    }

    public String value() {
        return value;
    }

    public boolean isBinary() {
        return this == PDF || this == DOCUMENT;
    }

    public static ContentType fromExtension(String extension) {
        String normalized = extension == null ? "" : extension.toLowerCase(Locale.ROOT);
        for (ContentType type : values()) {
            if (type.extensions.contains(normalized)) {
                return type;
            }
        }
        return TEXT;
    }

    public static ContentType fromValue(String value) {
        for (ContentType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown content type: " + value);
    }
}
