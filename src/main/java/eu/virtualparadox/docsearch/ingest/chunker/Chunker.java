package eu.virtualparadox.docsearch.ingest.chunker;

import eu.virtualparadox.docsearch.ingest.model.Chunk;
import eu.virtualparadox.docsearch.ingest.normalizer.SearchNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns one plain-text document into self-contained, retrievable {@link Chunk}s.
 *
 * <h2>Overview</h2>
 * <ul>
 *   <li><strong>Title:</strong> the first non-blank line (trimmed); the file name if every line is blank.
 *       Everything after the title line is the body.</li>
 *   <li><strong>Shape:</strong> the body is classified as a whole by {@link EDocumentShape#detect(List)}
 *       and handed to the {@link PassageFormatter} registered for that shape.</li>
 *   <li><strong>Length limit:</strong> passages longer than {@code maxChunkChars} are re-packed from their
 *       sentences (a sentence ends at {@code .}, {@code !} or {@code ?} followed by whitespace). Sentences are
 *       added greedily while the joined text stays within the limit. A single sentence longer than the
 *       limit is kept whole; there is no character-level cut.</li>
 *   <li><strong>Identity:</strong> {@code chunkId = docHash + "#" + seq} where {@code docHash} is the first
 *       16 hex digits of SHA-1 over {@code tenantId|sourceFile|title} and {@code seq} the zero-based passage
 *       position; {@code docId = tenantId + ":" + fileName}.</li>
 * </ul>
 *
 * <h2>Failure semantics</h2>
 * Malformed content never raises: a missing title, missing columns or degenerate rows only produce
 * fewer or shorter passages. Passages whose trimmed text is empty are dropped.
 *
 * <h2>Determinism &amp; Thread-safety</h2>
 * Stateless after construction and thus thread-safe. Output is deterministic for a given input.
 *
 * @implNote The sentence boundary rule is a plain heuristic: abbreviations ({@code Dr. Smith}) and
 *           decimals followed by a space are split as well.
 */
@Slf4j
@Component
public class Chunker {

    public static final int DEFAULT_MAX_CHUNK_CHARS = 1800;

    private static final int DOC_HASH_LENGTH = 16;
    private static final String HASH_ALGORITHM = "SHA-1";

    private static final Pattern SENTENCE_BOUNDARY = Pattern.compile(
            "(?<=[.!?])\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    /**
     * Upper bound on passage length, except for single over-long sentences.
     */
    private final int maxChunkChars;

    private final SearchNormalizer normalizer;

    private final Map<EDocumentShape, PassageFormatter> formatters;

    /**
     * Constructs a {@code Chunker}.
     *
     * @param maxChunkChars maximum passage length (must be {@code > 0})
     * @param normalizer    produces the scoring tokens of each passage
     * @param formatters    exactly one formatter per {@link EDocumentShape}
     * @throws IllegalArgumentException if constraints are violated
     */
    public Chunker(@Value("${docsearch.chunker.max-chunk-chars:" + DEFAULT_MAX_CHUNK_CHARS + "}") final int maxChunkChars,
                   final SearchNormalizer normalizer,
                   final List<PassageFormatter> formatters) {
        if (maxChunkChars <= 0) {
            throw new IllegalArgumentException("maxChunkChars must be positive");
        }
        this.maxChunkChars = maxChunkChars;
        this.normalizer = normalizer;
        this.formatters = indexByShape(formatters);
    }

    /**
     * Chunks a document.
     *
     * @param tenantId   owning tenant (non-blank)
     * @param sourceFile path of the document as it was read; only its file name is kept on the chunks (non-blank)
     * @param text       raw document text (non-null, may be blank)
     * @return ordered chunks; empty if the document has no body
     * @throws IllegalArgumentException if inputs are invalid
     */
    public List<Chunk> chunk(final String tenantId, final String sourceFile, final String text) {
        validateInputs(tenantId, sourceFile, text);

        final String fileName = baseFileName(sourceFile);
        final List<String> lines = Arrays.asList(text.replace("\r\n", "\n").split("\n", -1));

        String title = null;
        int bodyStart = lines.size();
        for (int i = 0; i < lines.size(); i++) {
            final String line = UnicodeWhitespace.trim(lines.get(i));
            if (!line.isEmpty()) {
                title = line;
                bodyStart = i + 1;
                break;
            }
        }
        if (title == null) {
            title = fileName;
        }

        final List<String> bodyLines = lines.subList(bodyStart, lines.size());
        final String body = UnicodeWhitespace.trim(String.join("\n", bodyLines));
        final EDocumentShape shape = EDocumentShape.detect(bodyLines);

        final List<String> passages = new ArrayList<>();
        for (final String passage : formatters.get(shape).format(body)) {
            passages.addAll(enforceMaxLength(passage));
        }

        final String docId = tenantId + ":" + fileName;
        final String docHash = stableHash(tenantId, sourceFile, title);

        final List<Chunk> chunks = new ArrayList<>(passages.size());
        for (int seq = 0; seq < passages.size(); seq++) {
            final String chunkText = UnicodeWhitespace.trim(passages.get(seq));
            if (chunkText.isEmpty()) {
                continue;
            }
            chunks.add(new Chunk(
                    tenantId,
                    docId,
                    docHash + "#" + seq,
                    fileName,
                    title,
                    chunkText,
                    normalizer.tokenize(chunkText)));
        }

        log.debug("Chunked {} ({}) into {} chunks", fileName, shape, chunks.size());
        return chunks;
    }

    /**
     * Re-packs an over-long passage from its sentences.
     * <p>
     * A sentence is appended to the buffer while {@code buffer + " " + sentence} fits into
     * {@code maxChunkChars}; otherwise the buffer is emitted and the sentence starts a new one.
     * A lone sentence above the limit is therefore emitted unsplit.
     */
    private List<String> enforceMaxLength(final String passage) {
        if (passage.length() <= maxChunkChars) {
            return List.of(passage);
        }

        final List<String> result = new ArrayList<>();
        final StringBuilder buffer = new StringBuilder();
        for (final SentenceSpan sentence : splitSentences(passage)) {
            final int projectedLen = buffer.isEmpty() ? sentence.length() : buffer.length() + 1 + sentence.length();
            if (projectedLen <= maxChunkChars) {
                if (!buffer.isEmpty()) {
                    buffer.append(' ');
                }
                buffer.append(passage, sentence.start, sentence.end);
            } else {
                if (!buffer.isEmpty()) {
                    result.add(UnicodeWhitespace.trim(buffer.toString()));
                }
                buffer.setLength(0);
                buffer.append(passage, sentence.start, sentence.end);
            }
        }
        if (!buffer.isEmpty()) {
            result.add(UnicodeWhitespace.trim(buffer.toString()));
        }
        return result;
    }

    /**
     * Splits {@code text} at every whitespace run that follows {@code .}, {@code !} or {@code ?}.
     *
     * @param text passage text
     * @return ordered half-open spans, whitespace between sentences excluded
     */
    private static List<SentenceSpan> splitSentences(final String text) {
        final List<SentenceSpan> sentences = new ArrayList<>();
        final Matcher matcher = SENTENCE_BOUNDARY.matcher(text);

        int lastEnd = 0;
        while (matcher.find()) {
            final int splitPoint = matcher.start();
            if (splitPoint > lastEnd) {
                sentences.add(new SentenceSpan(lastEnd, splitPoint));
            }
            lastEnd = matcher.end();
        }
        if (lastEnd < text.length()) {
            sentences.add(new SentenceSpan(lastEnd, text.length()));
        }
        return sentences;
    }

    private void validateInputs(final String tenantId, final String sourceFile, final String text) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId cannot be null or blank");
        }
        if (sourceFile == null || sourceFile.isBlank()) {
            throw new IllegalArgumentException("sourceFile cannot be null or blank");
        }
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
    }

    private static Map<EDocumentShape, PassageFormatter> indexByShape(final List<PassageFormatter> formatters) {
        final Map<EDocumentShape, PassageFormatter> byShape = new EnumMap<>(EDocumentShape.class);
        for (final PassageFormatter formatter : formatters) {
            if (byShape.put(formatter.shape(), formatter) != null) {
                throw new IllegalArgumentException("Duplicate passage formatter for shape " + formatter.shape());
            }
        }
        for (final EDocumentShape shape : EDocumentShape.values()) {
            if (!byShape.containsKey(shape)) {
                throw new IllegalArgumentException("No passage formatter registered for shape " + shape);
            }
        }
        return byShape;
    }

    /**
     * File name part of a path, accepting both {@code /} and {@code \} separators.
     */
    static String baseFileName(final String sourceFile) {
        final int separator = Math.max(sourceFile.lastIndexOf('/'), sourceFile.lastIndexOf('\\'));
        return separator < 0 ? sourceFile : sourceFile.substring(separator + 1);
    }

    /**
     * Builds the per-document hash that prefixes every chunk id:
     * <pre>
     *   hex(sha1(tenantId + "|" + sourceFile + "|" + title))[0..16)
     * </pre>
     */
    static String stableHash(final String... parts) {
        try {
            final MessageDigest digest = MessageDigest.getInstance(HASH_ALGORITHM);
            final byte[] hash = digest.digest(String.join("|", parts).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, DOC_HASH_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(HASH_ALGORITHM + " algorithm not available", e);
        }
    }
}
