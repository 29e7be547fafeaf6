package eu.virtualparadox.docsearch.search.service;

import eu.virtualparadox.docsearch.index.KnowledgeIndex;
import eu.virtualparadox.docsearch.ingest.chunker.Chunker;
import eu.virtualparadox.docsearch.ingest.chunker.NarrativePassageFormatter;
import eu.virtualparadox.docsearch.ingest.chunker.TabularPassageFormatter;
import eu.virtualparadox.docsearch.ingest.model.Chunk;
import eu.virtualparadox.docsearch.ingest.normalizer.SearchNormalizer;
import eu.virtualparadox.docsearch.search.model.SearchResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KeywordSearchServiceTest {

    private static final String TENANT = "autolife";

    private final SearchNormalizer normalizer = new SearchNormalizer();
    private final Chunker chunker = new Chunker(Chunker.DEFAULT_MAX_CHUNK_CHARS, normalizer,
            List.of(new TabularPassageFormatter(), new NarrativePassageFormatter()));
    private final KeywordSearchService searchService = new KeywordSearchService(normalizer);

    private KnowledgeIndex index(String... fileAndContent) {
        final List<Chunk> chunks = new ArrayList<>();
        for (int i = 0; i < fileAndContent.length; i += 2) {
            chunks.addAll(chunker.chunk(TENANT, fileAndContent[i], fileAndContent[i + 1]));
        }
        return new KnowledgeIndex(TENANT, chunks, Instant.now());
    }

    private KnowledgeIndex pricing() {
        return index("pricing.txt", "Autolife Price List\nOil change|$40|synthetic\nBrake pads|$80|front only");
    }

    @Test
    @DisplayName("Brake pads chunk ranks first for 'brake pads price'")
    void pricingExample() {
        final List<SearchResult> results = searchService.search(pricing(), "brake pads price", 3);

        assertThat(results).hasSize(2);
        assertThat(results.get(0).text()).isEqualTo("Service: Brake pads. Price: $80. Notes: front only.");
        // brake, pads, price overlap (3 x 2) + "price" in title (1)
        assertThat(results.get(0).score()).isEqualTo(7);
        // price overlap (2) + title (1)
        assertThat(results.get(1).score()).isEqualTo(3);
        assertThat(results.get(0).title()).isEqualTo("Autolife Price List");
        assertThat(results.get(0).sourceFile()).isEqualTo("pricing.txt");
        assertThat(results.get(0).chunkId()).endsWith("#1");
    }

    @Test
    @DisplayName("A query equal to the chunk text outranks a two-token overlap thanks to the substring boost")
    void substringBoost() {
        final KnowledgeIndex index = pricing();
        final String fullText = "Service: Brake pads. Price: $80. Notes: front only.";

        final int exact = searchService.search(index, fullText, 1).get(0).score();
        final int partial = searchService.search(index, "brake pads", 1).get(0).score();

        assertThat(exact).isGreaterThan(partial);
        // 8 shared tokens x 2 + "price" in title + substring boost
        assertThat(exact).isEqualTo(8 * 2 + 1 + 4);
        // two overlaps + substring "brake pads"
        assertThat(partial).isEqualTo(2 * 2 + 4);
    }

    @Test
    @DisplayName("Substring boost works across punctuation and case")
    void substringBoost_normalized() {
        final KnowledgeIndex index = index("about.txt", "About\n\nPhone: +1 555 0142.\n\nEmail: office@autolife.example.");

        final List<SearchResult> results = searchService.search(index, "555-0142", 3);

        assertThat(results).hasSize(1);
        assertThat(results.get(0).text()).isEqualTo("Phone: +1 555 0142.");
        assertThat(results.get(0).score()).isEqualTo(2 * 2 + 4);
    }

    @Test
    @DisplayName("Empty, blank and punctuation-only queries return nothing")
    void emptyQuery() {
        assertThat(searchService.search(pricing(), "", 3)).isEmpty();
        assertThat(searchService.search(pricing(), "   \t ", 3)).isEmpty();
        assertThat(searchService.search(pricing(), "?! a", 3)).isEmpty();
    }

    @Test
    @DisplayName("No positive score returns nothing")
    void noMatch() {
        assertThat(searchService.search(pricing(), "opening hours", 3)).isEmpty();
    }

    @Test
    @DisplayName("Results are sorted by non-increasing positive score and capped at topK")
    void orderingAndLimit() {
        final KnowledgeIndex index = index(
                "pricing.txt", "Price List\nOil change|$40|synthetic oil\nBrake pads|$80|front only\nOil filter|$15|with oil change",
                "about.txt", "About\n\nWe change oil every day.\n\nBrakes are checked for free.");

        for (int topK = 1; topK <= 6; topK++) {
            final List<SearchResult> results = searchService.search(index, "oil change brake price", topK);
            assertThat(results.size()).isLessThanOrEqualTo(topK);
            assertThat(results).allSatisfy(r -> assertThat(r.score()).isPositive());
            for (int i = 1; i < results.size(); i++) {
                assertThat(results.get(i - 1).score()).isGreaterThanOrEqualTo(results.get(i).score());
            }
        }
    }

    @Test
    @DisplayName("Equal scores keep index order")
    void tiesKeepIndexOrder() {
        final KnowledgeIndex index = index("list.txt", "List\nWash A|$10|\nWash B|$10|\nWash C|$10|");

        final List<SearchResult> results = searchService.search(index, "wash", 3);

        assertThat(results).extracting(SearchResult::text).containsExactly(
                "Service: Wash A. Price: $10.",
                "Service: Wash B. Price: $10.",
                "Service: Wash C. Price: $10.");
        assertThat(results).extracting(SearchResult::score).containsOnly(2 + 4);
    }

    @Test
    @DisplayName("A repeated query token counts once")
    void repeatedQueryTokens() {
        final int once = searchService.search(pricing(), "oil", 1).get(0).score();
        final int repeated = searchService.search(pricing(), "oil oil OIL", 1).get(0).score();

        // "oil oil oil" is not a substring of the chunk text, so only the overlap remains
        assertThat(once).isEqualTo(2 + 4);
        assertThat(repeated).isEqualTo(2);
    }

    @Test
    @DisplayName("Title tokens add one point each")
    void titleBoost() {
        final KnowledgeIndex index = index("a.txt", "Winter Tyres\n\nWe fit and store them.");

        final List<SearchResult> results = searchService.search(index, "winter storage", 3);

        assertThat(results).hasSize(1);
        assertThat(results.get(0).score()).isEqualTo(1);
    }

    @Test
    @DisplayName("Search does not touch the index")
    void indexUnchanged() {
        final KnowledgeIndex index = pricing();
        final List<Chunk> before = List.copyOf(index.chunks());

        searchService.search(index, "brake pads price", 3);

        assertThat(index.chunks()).containsExactlyElementsOf(before);
    }

    @Test
    void invalidArguments() {
        assertThatThrownBy(() -> searchService.search(pricing(), "oil", 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> searchService.search(null, "oil", 3)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> searchService.search(pricing(), null, 3)).isInstanceOf(NullPointerException.class);
    }
}
