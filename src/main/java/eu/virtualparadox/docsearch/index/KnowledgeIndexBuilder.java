package eu.virtualparadox.docsearch.index;

import eu.virtualparadox.docsearch.ingest.chunker.Chunker;
import eu.virtualparadox.docsearch.ingest.cleaner.TextCleaner;
import eu.virtualparadox.docsearch.ingest.model.Chunk;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Builds a tenant's {@link KnowledgeIndex} from a folder of plain-text documents:
 * <ol>
 *     <li>List the {@code .txt} files (case-insensitive) directly inside the folder, sorted by name</li>
 *     <li>Read each file as UTF-8 and clean it via {@link TextCleaner}</li>
 *     <li>Chunk it via {@link Chunker}</li>
 *     <li>Concatenate every chunk, keeping file and passage order</li>
 * </ol>
 * <p>
 * Sub-folders are not scanned. Any directory or file read failure aborts the whole build;
 * there is no partial index.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class KnowledgeIndexBuilder {

    private static final String DOCUMENT_EXTENSION = ".txt";

    private final Chunker chunker;
    private final TextCleaner textCleaner;

    /**
     * Builds a fresh index for a tenant.
     *
     * @param tenantId tenant identifier (non-blank)
     * @param folder   directory holding the tenant's documents
     * @return the assembled index
     * @throws IOException if the folder cannot be listed or a document cannot be read
     */
    public KnowledgeIndex buildIndex(final String tenantId, final Path folder) throws IOException {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be blank");
        }
        if (folder == null) {
            throw new IllegalArgumentException("folder must not be null");
        }

        final List<Path> documents = listDocuments(folder);
        log.info("Indexing {} documents for tenant {} from {}", documents.size(), tenantId, folder);

        final List<Chunk> chunks = new ArrayList<>();
        for (final Path document : documents) {
            log.info("Processing file: {}", document.getFileName());
            final String raw = new String(Files.readAllBytes(document), StandardCharsets.UTF_8);
            final List<Chunk> documentChunks = chunker.chunk(tenantId, document.toString(), textCleaner.cleanDocument(raw));
            printDebugChunks(documentChunks);
            chunks.addAll(documentChunks);
        }

        final KnowledgeIndex index = new KnowledgeIndex(tenantId, chunks, Instant.now());
        log.info("Built index for tenant {}: {} chunks from {} documents", tenantId, index.size(), index.documentCount());
        return index;
    }

    private List<Path> listDocuments(final Path folder) throws IOException {
        try (Stream<Path> entries = Files.list(folder)) {
            return entries
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(DOCUMENT_EXTENSION))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .toList();
        }
    }

    private void printDebugChunks(final List<Chunk> chunks) {
        if (!log.isDebugEnabled()) {
            return;
        }
        final StringBuilder sb = new StringBuilder();
        for (final Chunk c : chunks) {
            sb.append(" - ").append("[").append(c.chunkId()).append("] ").append(c.text()).append("\n");
        }
        log.debug("Chunks:\n{}", sb);
    }
}
