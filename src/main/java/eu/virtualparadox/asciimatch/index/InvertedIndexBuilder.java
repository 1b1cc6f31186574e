package eu.virtualparadox.asciimatch.index;

import eu.virtualparadox.asciimatch.catalog.model.IndexableDocument;
import eu.virtualparadox.asciimatch.ingest.analyzer.Analyzer;
import eu.virtualparadox.asciimatch.ingest.analyzer.FieldAnalyzers;
import eu.virtualparadox.asciimatch.index.model.PostingList;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Builds an {@link InvertedIndex} from the full corpus in one pass.
 * <p>
 * Steps:
 * <ol>
 *   <li>Place every document at the slot of its id, rejecting duplicates and gaps</li>
 *   <li>Analyze each document independently: for every field that has an analyzer, run the index-time
 *       analysis over every raw value and count term frequencies. This step may run on an executor.</li>
 *   <li>Merge the per-document counts into posting lists on the calling thread, in ascending id order,
 *       so postings are appended without locking and stay sorted</li>
 * </ol>
 * Cost is linear in the total number of tokens.
 */
@Slf4j
public final class InvertedIndexBuilder {

    private final FieldAnalyzers analyzers;

    public InvertedIndexBuilder(final FieldAnalyzers analyzers) {
        this.analyzers = Objects.requireNonNull(analyzers, "analyzers");
    }

    /**
     * Builds the index on the calling thread.
     */
    public InvertedIndex build(final List<? extends IndexableDocument> documents) {
        return build(documents, Runnable::run);
    }

    /**
     * Builds the index, analyzing documents on {@code executor}.
     *
     * @param documents the whole corpus; ids must be exactly {@code 0..n-1}, in any order
     * @param executor  executor for the per-document analysis
     * @return the populated, immutable index
     * @throws IllegalArgumentException on a duplicate or out-of-range document id
     */
    public InvertedIndex build(final List<? extends IndexableDocument> documents, final Executor executor) {
        Objects.requireNonNull(documents, "documents");
        Objects.requireNonNull(executor, "executor");
        final long started = System.nanoTime();

        final List<IndexableDocument> byId = orderById(documents);

        // 1. analyze, possibly in parallel
        final List<CompletableFuture<Map<String, Map<String, Integer>>>> analyses = new ArrayList<>(byId.size());
        for (final IndexableDocument doc : byId) {
            analyses.add(CompletableFuture.supplyAsync(() -> analyze(doc), executor));
        }

        // 2. merge in id order
        final Map<String, Map<String, PostingList.Builder>> builders = new HashMap<>();
        for (int id = 0; id < analyses.size(); id++) {
            final Map<String, Map<String, Integer>> perField = analyses.get(id).join();
            for (final Map.Entry<String, Map<String, Integer>> field : perField.entrySet()) {
                final Map<String, PostingList.Builder> terms =
                        builders.computeIfAbsent(field.getKey(), k -> new HashMap<>());
                for (final Map.Entry<String, Integer> term : field.getValue().entrySet()) {
                    terms.computeIfAbsent(term.getKey(), k -> new PostingList.Builder())
                            .add(id, term.getValue());
                }
            }
        }

        final Map<String, Map<String, PostingList>> fields = new HashMap<>();
        builders.forEach((field, terms) -> {
            final Map<String, PostingList> lists = new HashMap<>(terms.size() * 2);
            terms.forEach((term, builder) -> lists.put(term, builder.build()));
            fields.put(field, Map.copyOf(lists));
        });

        final InvertedIndex index = new InvertedIndex(byId, Map.copyOf(fields));
        log.info("Indexed {} documents: {} fields, {} postings in {} ms",
                index.size(), index.fields().size(), index.postingCount(),
                (System.nanoTime() - started) / 1_000_000);
        return index;
    }

    /**
     * Counts term frequencies per field for a single document.
     */
    private Map<String, Map<String, Integer>> analyze(final IndexableDocument doc) {
        final Map<String, List<String>> values = doc.indexableFields();
        if (values == null || values.isEmpty()) {
            return Map.of();
        }

        final Map<String, Map<String, Integer>> perField = new LinkedHashMap<>();
        for (final Map.Entry<String, List<String>> field : values.entrySet()) {
            final Optional<Analyzer> analyzer = analyzers.forField(field.getKey());
            if (analyzer.isEmpty() || field.getValue() == null) {
                continue;
            }
            final Map<String, Integer> counts = new HashMap<>();
            for (final String raw : field.getValue()) {
                for (final String term : analyzer.get().analyzeForIndex(raw)) {
                    counts.merge(term, 1, Integer::sum);
                }
            }
            if (!counts.isEmpty()) {
                perField.put(field.getKey(), counts);
            }
        }
        return perField;
    }

    private static List<IndexableDocument> orderById(final List<? extends IndexableDocument> documents) {
        final IndexableDocument[] slots = new IndexableDocument[documents.size()];
        for (final IndexableDocument doc : documents) {
            Objects.requireNonNull(doc, "document");
            final int id = doc.id();
            if (id < 0 || id >= slots.length) {
                throw new IllegalArgumentException(
                        "document id " + id + " outside [0, " + slots.length + "): ids must be sequential");
            }
            if (slots[id] != null) {
                throw new IllegalArgumentException("duplicate document id " + id);
            }
            slots[id] = doc;
        }
        return List.of(slots);
    }
}
