package eu.virtualparadox.asciimatch.index;

import eu.virtualparadox.asciimatch.catalog.model.AsciiArt;
import eu.virtualparadox.asciimatch.catalog.model.IndexableDocument;
import eu.virtualparadox.asciimatch.index.model.PostingList;
import eu.virtualparadox.asciimatch.ingest.analyzer.Analyzer;
import eu.virtualparadox.asciimatch.ingest.analyzer.FieldAnalyzers;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static eu.virtualparadox.asciimatch.util.FieldNames.*;
import static org.junit.jupiter.api.Assertions.*;

class InvertedIndexBuilderTest {

    private static final String[] WORDS = {"cat", "dog", "happy", "sad", "fish", "bird", "tree", "42", "zebra"};

    private final Analyzer analyzer = Analyzer.shingles(Map.of("#", " "), 2);
    private final FieldAnalyzers analyzers = FieldAnalyzers.of(Map.of(
            BLOB, analyzer,
            TAGS, analyzer,
            MATCH_ALL, analyzer));

    private static List<AsciiArt> randomCorpus(int size, long seed) {
        final Random rnd = new Random(seed);
        final List<AsciiArt> corpus = new ArrayList<>();
        for (int id = 0; id < size; id++) {
            final StringBuilder blob = new StringBuilder();
            final int words = rnd.nextInt(12);
            for (int w = 0; w < words; w++) {
                blob.append(WORDS[rnd.nextInt(WORDS.length)]).append(rnd.nextBoolean() ? " " : "\n");
            }
            corpus.add(new AsciiArt(id, blob.toString(), List.of(WORDS[rnd.nextInt(WORDS.length)] + ".txt")));
        }
        return corpus;
    }

    @Test
    @DisplayName("Every index-time term of every document can be found in its field")
    void indexCompleteness() {
        final List<AsciiArt> corpus = randomCorpus(200, 11);
        final InvertedIndex index = new InvertedIndexBuilder(analyzers).build(corpus);

        assertEquals(200, index.size());
        for (final IndexableDocument doc : corpus) {
            for (final Map.Entry<String, List<String>> field : doc.indexableFields().entrySet()) {
                for (final String raw : field.getValue()) {
                    for (final String term : analyzer.analyzeForIndex(raw)) {
                        assertTrue(index.postings(field.getKey(), term).contains(doc.id()),
                                "doc " + doc.id() + " missing under " + field.getKey() + ":" + term);
                    }
                }
            }
        }
    }

    @Test
    @DisplayName("Postings are sorted, in range, and carry term frequencies")
    void postingsAreSortedWithFrequencies() {
        final List<AsciiArt> corpus = List.of(
                new AsciiArt(0, "cat cat dog", List.of("a.txt")),
                new AsciiArt(1, "dog", List.of("b.txt")),
                new AsciiArt(2, "cat", List.of("c.txt")));
        final InvertedIndex index = new InvertedIndexBuilder(analyzers).build(corpus);

        final PostingList cat = index.postings(BLOB, "cat");
        assertEquals(2, cat.size());
        assertEquals(0, cat.docId(0));
        assertEquals(2, cat.frequency(0));
        assertEquals(2, cat.docId(1));
        assertEquals(1, index.postings(BLOB, "cat cat").frequencyOf(0));
        assertEquals(3, index.postings(MATCH_ALL, MATCH_ALL_VALUE).size());
    }

    @Test
    @DisplayName("Documents may arrive in any order as long as ids are 0..n-1")
    void unorderedInput() {
        final List<AsciiArt> corpus = List.of(
                new AsciiArt(1, "dog", List.of("b.txt")),
                new AsciiArt(0, "dog", List.of("a.txt")));
        final InvertedIndex index = new InvertedIndexBuilder(analyzers).build(corpus);

        assertEquals(0, index.postings(BLOB, "dog").docId(0));
        assertEquals(0, index.document(0).id());
        assertEquals(1, index.document(1).id());
    }

    @Test
    @DisplayName("Duplicate or out-of-range ids are contract violations")
    void invalidIds() {
        final InvertedIndexBuilder builder = new InvertedIndexBuilder(analyzers);
        assertThrows(IllegalArgumentException.class, () -> builder.build(List.of(
                new AsciiArt(0, "a", List.of()),
                new AsciiArt(0, "b", List.of()))));
        assertThrows(IllegalArgumentException.class, () -> builder.build(List.of(
                new AsciiArt(0, "a", List.of()),
                new AsciiArt(2, "b", List.of()))));
    }

    @Test
    @DisplayName("Empty fields and fields without an analyzer contribute no postings")
    void emptyAndUnconfiguredFields() {
        final FieldAnalyzers blobOnly = FieldAnalyzers.of(Map.of(BLOB, analyzer));
        final InvertedIndex index = new InvertedIndexBuilder(blobOnly).build(List.of(
                new AsciiArt(0, "", List.of("cat.txt")),
                new AsciiArt(1, "#!?", List.of())));

        assertEquals(2, index.size());
        assertEquals(0, index.termCount(BLOB));
        assertEquals(0, index.termCount(TAGS));
        assertFalse(index.fields().contains(TAGS));
        assertTrue(index.postings(TAGS, "cattxt").isEmpty());
        assertTrue(index.postings("nope", "cat").isEmpty());
    }

    @Test
    @DisplayName("Empty corpus builds an empty index")
    void emptyCorpus() {
        final InvertedIndex index = new InvertedIndexBuilder(analyzers).build(List.of());
        assertEquals(0, index.size());
        assertEquals(0, index.postingCount());
        assertTrue(index.findDocument(0).isEmpty());
    }

    @Test
    @DisplayName("Parallel build produces the same postings as a sequential build")
    void parallelBuildMatchesSequential() {
        final List<AsciiArt> corpus = randomCorpus(500, 99);
        final InvertedIndex sequential = new InvertedIndexBuilder(analyzers).build(corpus);

        final ExecutorService pool = Executors.newFixedThreadPool(4);
        final InvertedIndex parallel;
        try {
            parallel = new InvertedIndexBuilder(analyzers).build(corpus, pool);
        } finally {
            pool.shutdownNow();
        }

        assertEquals(sequential.fields(), parallel.fields());
        assertEquals(sequential.postingCount(), parallel.postingCount());
        for (final String field : sequential.fields()) {
            assertEquals(sequential.termCount(field), parallel.termCount(field));
        }
        for (final AsciiArt doc : corpus) {
            for (final String term : analyzer.analyzeForIndex(doc.blob())) {
                final PostingList a = sequential.postings(BLOB, term);
                final PostingList b = parallel.postings(BLOB, term);
                assertEquals(a.size(), b.size(), term);
                for (int i = 0; i < a.size(); i++) {
                    assertEquals(a.docId(i), b.docId(i));
                    assertEquals(a.frequency(i), b.frequency(i));
                }
            }
        }
    }
}
