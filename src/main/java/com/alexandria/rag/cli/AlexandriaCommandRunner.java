package com.alexandria.rag.cli;

import com.alexandria.rag.config.SearchProperties;
import com.alexandria.rag.model.ChunkStrategy;
import com.alexandria.rag.model.ContentType;
import com.alexandria.rag.model.ContextualMatch;
import com.alexandria.rag.model.DocumentMatch;
import com.alexandria.rag.model.IngestionOptions;
import com.alexandria.rag.model.IngestionResult;
import com.alexandria.rag.model.IngestionStats;
import com.alexandria.rag.model.SearchResult;
import com.alexandria.rag.service.IngestionService;
import com.alexandria.rag.service.RetrievalService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Command line surface, active with {@code app.cli.enabled=true}. The first non-option argument
 * names the command; options use the {@code --name=value} form.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.cli.enabled", havingValue = "true")
public class AlexandriaCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    static final String USAGE = """
        Usage: <command> [arguments] [--option=value ...]
          ingest-file <path>      [--chunk-strategy=S] [--chunk-size=N] [--min-chunk-size=N]
                                  [--overlap-size=N] [--force] [--update-existing]
          ingest-dir <path>       [--no-recursive] plus the ingest-file options
          stats
          supported-types
          delete <hash>
          search <query>          [--max-results=N]
          search-docs <query>     [--document-ids=ID,ID] [--max-results=N]
          search-type <query>     --content-types=T,T [--max-results=N]
          search-recent <query>   [--days-back=N] [--max-results=N]
          get-content <doc-id>    [--max-chunks=N]
          find-related <chunk-id> [--max-results=N]
          search-context <query>  [--context-size=N] [--max-results=N]
          best-matches <query>    [--top-n=N]
        """;

    private static final int SNIPPET_LENGTH = 200;

    private final IngestionService ingestionService;
    private final RetrievalService retrievalService;
    private final SearchProperties searchProperties;
    private final PrintStream out;

    private int exitCode;

    @Autowired
    public AlexandriaCommandRunner(IngestionService ingestionService, RetrievalService retrievalService,
                                   SearchProperties searchProperties) {
        this(ingestionService, retrievalService, searchProperties, System.out);
    }

    AlexandriaCommandRunner(IngestionService ingestionService, RetrievalService retrievalService,
                            SearchProperties searchProperties, PrintStream out) {
        this.ingestionService = ingestionService;
        this.retrievalService = retrievalService;
        this.searchProperties = searchProperties;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> positional = args.getNonOptionArgs();
        if (positional.isEmpty()) {
            out.println(USAGE);
            exitCode = 1;
            return;
        }

        String command = positional.get(0);
        try {
            exitCode = execute(command, positional.subList(1, positional.size()), args) ? 0 : 1;
        } catch (RuntimeException e) {
            log.error("Command '{}' failed", command, e);
            out.println("Error: " + e.getMessage());
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private boolean execute(String command, List<String> params, ApplicationArguments args) {
        switch (command) {
            case "ingest-file": {
                IngestionResult result = ingestionService.ingestFile(Path.of(required(params, 0, "path")), options(args));
                printIngestion(result);
                return result.isSuccessful();
            }
            case "ingest-dir": {
                boolean recursive = !args.containsOption("no-recursive");
                IngestionResult result = ingestionService.ingestDirectory(
                    Path.of(required(params, 0, "path")), recursive, options(args));
                printIngestion(result);
                return true;
            }
            case "stats":
                printStats(ingestionService.getStats());
                return true;
            case "supported-types":
                ingestionService.supportedExtensions().forEach(out::println);
                return true;
            case "delete": {
                String hash = required(params, 0, "hash");
                boolean deleted = ingestionService.deleteDocument(hash);
                out.println(deleted ? "Deleted " + hash : "No document with hash " + hash);
                return deleted;
            }
            case "search":
                printResult(retrievalService.searchDocuments(query(params), maxResults(args)));
                return true;
            case "search-docs": {
                List<UUID> ids = listOption(args, "document-ids").stream().map(UUID::fromString).toList();
                SearchResult result = ids.isEmpty()
                    ? retrievalService.searchDocuments(query(params), maxResults(args))
                    : retrievalService.searchInDocuments(query(params), ids, maxResults(args));
                printResult(result);
                return true;
            }
            case "search-type": {
                List<ContentType> types = listOption(args, "content-types").stream().map(ContentType::fromValue).toList();
                if (types.isEmpty()) {
                    throw new IllegalArgumentException("--content-types is required");
                }
                printResult(retrievalService.searchByContentType(query(params), types, maxResults(args)));
                return true;
            }
            case "search-recent":
                printResult(retrievalService.searchRecent(query(params), intOption(args, "days-back", 7), maxResults(args)));
                return true;
            case "get-content": {
                UUID documentId = UUID.fromString(required(params, 0, "document id"));
                List<DocumentMatch> chunks = retrievalService.getDocumentChunks(documentId, intOption(args, "max-chunks", 100));
                chunks.forEach(chunk -> out.printf("[%d] %s%n%n", chunk.chunkIndex(), chunk.content()));
                return true;
            }
            case "find-related": {
                UUID chunkId = UUID.fromString(required(params, 0, "chunk id"));
                printMatches(retrievalService.findSimilar(chunkId, maxResults(args)));
                return true;
            }
            case "search-context": {
                int contextSize = intOption(args, "context-size", searchProperties.contextSize());
                printContext(retrievalService.searchWithContext(query(params), contextSize, maxResults(args)));
                return true;
            }
            case "best-matches":
                printMatches(retrievalService.bestMatches(query(params), intOption(args, "top-n", 3)));
                return true;
            default:
                out.println("Unknown command: " + command);
                out.println(USAGE);
                return false;
        }
    }

    private IngestionOptions options(ApplicationArguments args) {
        IngestionOptions defaults = ingestionService.defaultOptions();
        IngestionOptions options = new IngestionOptions(
            stringOption(args, "chunk-strategy").map(ChunkStrategy::fromValue),
            stringOption(args, "chunk-size").map(Integer::valueOf),
            stringOption(args, "min-chunk-size").map(Integer::valueOf),
            stringOption(args, "overlap-size").map(Integer::valueOf),
            defaults.skipExisting(),
            args.containsOption("update-existing") || defaults.updateExisting()
        );
        return args.containsOption("force") ? options.forced() : options;
    }

    private void printIngestion(IngestionResult result) {
        out.printf("Files: %d, processed: %d, skipped: %d, failed: %d, chunks: %d%n",
            result.totalFiles(), result.processedFiles(), result.skippedFiles(), result.failedFiles(), result.totalChunks());
        result.errors().forEach(error -> out.println("  error: " + error));
    }

    private void printStats(IngestionStats stats) {
        out.println("Documents by status:");
        stats.documentsByStatus().forEach((status, count) -> out.printf("  %-12s %d%n", status, count));
        out.println("Documents by content type:");
        stats.documentsByContentType().forEach((type, count) -> out.printf("  %-16s %d%n", type.value(), count));
        out.println("Total chunks: " + stats.totalChunks());
    }

    private void printResult(SearchResult result) {
        if (!result.hasResults()) {
            out.println("No relevant results for: " + result.query());
            return;
        }
        out.printf("%d matches in %.1f ms%n", result.totalMatches(), result.searchTimeMs());
        printMatches(result.matches());
    }

    private void printMatches(List<DocumentMatch> matches) {
        for (int i = 0; i < matches.size(); i++) {
            DocumentMatch match = matches.get(i);
            out.printf("%d. %s #%d (score %.4f)%n   %s%n", i + 1, match.filename(), match.chunkIndex(),
                match.similarityScore(), snippet(match.content()));
        }
    }

    private void printContext(List<ContextualMatch> matches) {
        if (matches.isEmpty()) {
            out.println("No relevant results");
            return;
        }
        for (ContextualMatch match : matches) {
            DocumentMatch main = match.mainMatch();
            out.printf("%s #%d of %d (score %.4f)%n", main.filename(), main.chunkIndex(),
                match.totalChunksInDocument(), main.similarityScore());
            match.contextChunks().forEach(chunk -> out.printf("   [%d] %s%n", chunk.chunkIndex(), snippet(chunk.content())));
            out.printf(" > [%d] %s%n", main.chunkIndex(), snippet(main.content()));
        }
    }

    private int maxResults(ApplicationArguments args) {
        return intOption(args, "max-results", searchProperties.maxResults());
    }

    private static String query(List<String> params) {
        if (params.isEmpty()) {
            throw new IllegalArgumentException("Missing query");
        }
        return String.join(" ", params);
    }

    private static String required(List<String> params, int index, String name) {
        if (params.size() <= index) {
            throw new IllegalArgumentException("Missing " + name);
        }
        return params.get(index);
    }

    private static Optional<String> stringOption(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? Optional.empty() : Optional.of(values.get(values.size() - 1));
    }

    private static int intOption(ApplicationArguments args, String name, int defaultValue) {
        return stringOption(args, name).map(Integer::parseInt).orElse(defaultValue);
    }

    private static List<String> listOption(ApplicationArguments args, String name) {
        return stringOption(args, name)
            .map(value -> Arrays.stream(value.split(",")).map(String::strip).filter(s -> !s.isEmpty()).toList())
            .orElse(List.of());
    }

    private static String snippet(String content) {
        String flat = content.replaceAll("\\s+", " ").strip();
        return flat.length() <= SNIPPET_LENGTH ? flat : flat.substring(0, SNIPPET_LENGTH) + "...";
    }
}
