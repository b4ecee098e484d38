package com.alexandria.rag.chunking;

import com.alexandria.rag.config.ChunkingProperties;
import com.alexandria.rag.exception.ChunkingException;
import com.alexandria.rag.model.ChunkStrategy;
import com.alexandria.rag.model.ContentType;
import com.alexandria.rag.model.TextChunk;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits extracted text into ordered chunks that respect the configured character and token
 * budgets.
 *
 * <p>Every strategy produces raw chunks first; a common post-pass then re-splits anything over
 * budget with {@link FixedSizeSplitter}, applies the oversize policy to pieces that cannot be
 * reduced further and numbers the survivors contiguously from the requested start index.
 */
@Slf4j
@Component
public class TextChunker {

    private static final Pattern SENTENCE_SPLIT = Pattern.compile("(?<=[.!?])\\s+");
    private static final Pattern PARAGRAPH_SPLIT = Pattern.compile("\\n\\s*\\n");
    private static final Pattern DEFINITION = Pattern.compile(
        "(?:def|function|class|interface|public|private|protected|static)\\s+\\w+",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern MARKDOWN_HEADER = Pattern.compile("^(#{1,6})\\s+(.+)$");

    private final TokenCounter tokenCounter;
    private final ChunkingProperties defaults;
    private final FixedSizeSplitter splitter;

    public TextChunker(TokenCounter tokenCounter, ChunkingProperties defaults) {
        this.tokenCounter = tokenCounter;
        this.defaults = defaults;
        this.splitter = new FixedSizeSplitter(this::countTokens);
    }

    public ChunkingProperties defaults() {
        return defaults;
    }

    /**
     * An explicit override wins; otherwise code and markdown get their structural strategies and
     * everything else uses the configured one.
     */
    public ChunkStrategy resolveStrategy(ContentType contentType, ChunkingProperties config,
                                         Optional<ChunkStrategy> override) {
        if (override.isPresent()) {
            return override.get();
        }
        return switch (contentType) {
            case CODE -> ChunkStrategy.CODE_BASED;
            case MARKDOWN -> ChunkStrategy.MARKDOWN_BASED;
            default -> config.strategy();
        };
    }

    public List<TextChunk> chunk(String text, ContentType contentType) {
        return chunk(text, resolveStrategy(contentType, defaults, Optional.empty()), defaults, 0);
    }

    public List<TextChunk> chunk(String text, ChunkStrategy strategy, ChunkingProperties config, int startIndex) {
        if (text == null || text.isBlank()) {
            return List.of();
        }

        List<RawChunk> raw = switch (strategy) {
            case FIXED_SIZE -> splitter.split(text, config.maxChunkSize(), config.minChunkSize(),
                    config.overlapSize(), config.maxTokens(), config.charsPerToken())
                .stream()
                .map(RawChunk::plain)
                .toList();
            case SENTENCE_BASED -> chunkByUnits(text, SENTENCE_SPLIT, " ", config);
            case PARAGRAPH_BASED -> chunkByUnits(text, PARAGRAPH_SPLIT, "\n\n", config);
            case CODE_BASED -> chunkCode(text, config);
            case MARKDOWN_BASED -> chunkMarkdown(text, config);
        };

        List<TextChunk> chunks = enforceBudget(raw, strategy, config, startIndex);
        log.debug("Chunked {} chars into {} chunks with strategy {}", text.length(), chunks.size(), strategy);
        return chunks;
    }

    private List<RawChunk> chunkByUnits(String text, Pattern unitPattern, String joiner, ChunkingProperties config) {
        List<RawChunk> chunks = new ArrayList<>();
        String current = "";

        for (String unit : unitPattern.split(text.strip())) {
            String trimmed = unit.strip();
            if (trimmed.isEmpty()) {
                continue;
            }
            String candidate = current.isEmpty() ? trimmed : current + joiner + trimmed;
            if (candidate.length() <= config.maxChunkSize()) {
                current = candidate;
                continue;
            }

            if (current.length() >= config.minChunkSize()) {
                chunks.add(RawChunk.plain(current));
            } else if (!current.isEmpty()) {
                log.debug("Dropping {} char chunk below minimum size {}", current.length(), config.minChunkSize());
            }
            current = config.overlapSize() > 0 && !current.isEmpty()
                ? tail(current, config.overlapSize()) + joiner + trimmed
                : trimmed;
        }

        if (!current.isBlank()) {
            chunks.add(RawChunk.plain(current));
        }
        return chunks;
    }

    private List<RawChunk> chunkCode(String text, ChunkingProperties config) {
        List<RawChunk> chunks = new ArrayList<>();
        List<String> current = new ArrayList<>();
        int currentSize = 0;

        for (String line : text.split("\n", -1)) {
            String stripped = line.strip();
            boolean boundary = !stripped.isEmpty()
                && (indentation(line) == 0 || DEFINITION.matcher(stripped).lookingAt());

            if (boundary && currentSize > config.maxChunkSize() && !current.isEmpty()) {
                chunks.add(RawChunk.plain(String.join("\n", current)));
                current = overlapLines(current, config.overlapSize());
                currentSize = current.stream().mapToInt(l -> l.length() + 1).sum();
            }
            current.add(line);
            currentSize += line.length() + 1;
        }

        String last = String.join("\n", current);
        if (!last.isBlank()) {
            chunks.add(RawChunk.plain(last));
        }
        return chunks;
    }

    private List<RawChunk> chunkMarkdown(String text, ChunkingProperties config) {
        if (!config.preserveHeaders()) {
            return chunkByUnits(text, PARAGRAPH_SPLIT, "\n\n", config);
        }

        List<RawChunk> chunks = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        String headerLine = null;
        String headerTitle = null;
        Integer headerLevel = null;

        for (String line : text.split("\n", -1)) {
            Matcher header = MARKDOWN_HEADER.matcher(line);
            if (header.matches()) {
                if (current.toString().strip().length() >= config.minChunkSize()) {
                    chunks.add(new RawChunk(current.toString(), headerTitle, headerLevel));
                    current.setLength(0);
                }
                // a short section is carried into the next one instead of being lost
                if (current.toString().isBlank()) {
                    current.setLength(0);
                    headerTitle = header.group(2).strip();
                    headerLevel = header.group(1).length();
                }
                headerLine = line;
                current.append(line).append('\n');
                continue;
            }

            // blank lines never start a chunk, so a re-prepended header always has body text after it
            if (line.isBlank()
                || current.length() + line.length() + 1 <= config.maxChunkSize()
                || current.toString().strip().length() < config.minChunkSize()) {
                current.append(line).append('\n');
                continue;
            }

            chunks.add(new RawChunk(current.toString(), headerTitle, headerLevel));
            String overlap = config.overlapSize() > 0 ? tail(current.toString(), config.overlapSize()) : "";
            current.setLength(0);
            if (headerLine != null && !overlap.contains(headerLine)) {
                current.append(headerLine).append('\n');
            }
            current.append(overlap).append(line).append('\n');
        }

        String last = current.toString().strip();
        boolean headerOnly = headerLine != null && last.equals(headerLine.strip());
        if (headerOnly && !chunks.isEmpty()) {
            log.debug("Dropping trailing header '{}' without body text", last);
        } else if (!last.isEmpty()) {
            chunks.add(new RawChunk(current.toString(), headerTitle, headerLevel));
        }
        return chunks;
    }

    private List<TextChunk> enforceBudget(List<RawChunk> raw, ChunkStrategy strategy,
                                          ChunkingProperties config, int startIndex) {
        List<TextChunk> result = new ArrayList<>();
        for (RawChunk chunk : raw) {
            String content = chunk.content().strip();
            if (content.isEmpty()) {
                continue;
            }
            for (String piece : fitToBudget(content, config)) {
                int tokens = countTokens(piece);
                if (tokens > config.maxTokens() && !acceptOversized(piece, tokens, config)) {
                    continue;
                }
                result.add(TextChunk.of(startIndex + result.size(), piece, tokens, strategy,
                    chunk.headerTitle(), chunk.headerLevel()));
            }
        }
        return result;
    }

    private List<String> fitToBudget(String content, ChunkingProperties config) {
        List<String> pieces = splitToBudget(content, config, 0);
        return pieces.size() < 2 || config.minChunkSize() == 0 ? pieces : rebalance(content, pieces, config);
    }

    private List<String> splitToBudget(String content, ChunkingProperties config, int depth) {
        if (fits(content, config)) {
            return List.of(content);
        }
        if (depth >= config.maxSplitDepth()) {
            return List.of(content);
        }

        List<String> pieces = splitter.split(content, config.maxChunkSize(), config.minChunkSize(), 0,
            config.maxTokens(), config.charsPerToken());
        if (pieces.size() == 1 && pieces.get(0).equals(content)) {
            // indivisible
            return pieces;
        }

        List<String> fitted = new ArrayList<>();
        for (String piece : pieces) {
            fitted.addAll(splitToBudget(piece, config, depth + 1));
        }
        return fitted;
    }

    /**
     * Splitting leaves a remainder after the last full window. A piece under the minimum size is
     * merged into its predecessor when the pair fits, otherwise the pair is cut again near its
     * middle. Pairs that cannot be fixed either way are left as they are.
     */
    private List<String> rebalance(String content, List<String> pieces, ChunkingProperties config) {
        List<Span> spans = new ArrayList<>();
        int cursor = 0;
        for (String piece : pieces) {
            int start = content.indexOf(piece, cursor);
            if (start < 0) {
                throw new IllegalStateException("Split piece is not part of its source text");
            }
            Span span = new Span(start, start + piece.length());
            cursor = span.end();

            if (!spans.isEmpty()) {
                Span previous = spans.get(spans.size() - 1);
                if (previous.length() < config.minChunkSize() || span.length() < config.minChunkSize()) {
                    Optional<List<Span>> rejoined = rejoin(content, previous, span, config);
                    if (rejoined.isPresent()) {
                        spans.remove(spans.size() - 1);
                        spans.addAll(rejoined.get());
                        continue;
                    }
                }
            }
            spans.add(span);
        }
        return spans.stream().map(span -> content.substring(span.start(), span.end())).toList();
    }

    private Optional<List<Span>> rejoin(String content, Span previous, Span next, ChunkingProperties config) {
        Span merged = Span.trimmed(content, previous.start(), next.end());
        if (fits(merged.of(content), config)) {
            return Optional.of(List.of(merged));
        }

        int cut = whitespaceNearMiddle(content, merged);
        if (cut < 0) {
            return Optional.empty();
        }
        Span left = Span.trimmed(content, merged.start(), cut);
        Span right = Span.trimmed(content, cut, merged.end());
        boolean balanced = left.length() >= config.minChunkSize() && right.length() >= config.minChunkSize()
            && fits(left.of(content), config) && fits(right.of(content), config);
        return balanced ? Optional.of(List.of(left, right)) : Optional.empty();
    }

    private boolean fits(String text, ChunkingProperties config) {
        return text.length() <= config.maxChunkSize() && countTokens(text) <= config.maxTokens();
    }

    private static int whitespaceNearMiddle(String content, Span span) {
        int middle = span.start() + span.length() / 2;
        for (int distance = 0; distance < span.length() / 2; distance++) {
            if (Character.isWhitespace(content.charAt(middle - distance))) {
                return middle - distance;
            }
            if (middle + distance < span.end() && Character.isWhitespace(content.charAt(middle + distance))) {
                return middle + distance;
            }
        }
        return -1;
    }

    private boolean acceptOversized(String piece, int tokens, ChunkingProperties config) {
        switch (config.oversizePolicy()) {
            case DROP:
                log.warn("Dropping {} char piece with {} tokens over budget {}", piece.length(), tokens, config.maxTokens());
                return false;
            case FAIL:
                throw new ChunkingException(
                    "Piece of " + piece.length() + " chars has " + tokens + " tokens, budget is " + config.maxTokens());
            default:
                log.warn("Emitting {} char piece with {} tokens over budget {}", piece.length(), tokens, config.maxTokens());
                return true;
        }
    }

    private int countTokens(String text) {
        try {
            return tokenCounter.count(text);
        } catch (RuntimeException e) {
            throw new ChunkingException("Token counting failed", e);
        }
    }

    private static List<String> overlapLines(List<String> lines, int overlapSize) {
        List<String> kept = new ArrayList<>();
        int size = 0;
        for (int i = lines.size() - 1; i >= 0; i--) {
            int lineSize = lines.get(i).length() + 1;
            if (size + lineSize > overlapSize) {
                break;
            }
            kept.add(0, lines.get(i));
            size += lineSize;
        }
        return kept;
    }

    private static int indentation(String line) {
        int i = 0;
        while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t')) {
            i++;
        }
        return i;
    }

    private static String tail(String text, int size) {
        return text.substring(Math.max(0, text.length() - size));
    }

    private record Span(int start, int end) {

        static Span trimmed(String text, int start, int end) {
            int from = start;
            int to = end;
            while (from < to && Character.isWhitespace(text.charAt(from))) {
                from++;
            }
            while (to > from && Character.isWhitespace(text.charAt(to - 1))) {
                to--;
            }
            return new Span(from, to);
        }

        int length() {
            return end - start;
        }

        String of(String text) {
            return text.substring(start, end);
        }
    }

    private record RawChunk(String content, String headerTitle, Integer headerLevel) {

        static RawChunk plain(String content) {
            return new RawChunk(content, null, null);
        }
    }
}
