package eu.virtualparadox.asciimatch.index;

import eu.virtualparadox.asciimatch.catalog.model.IndexableDocument;
import eu.virtualparadox.asciimatch.index.model.PostingList;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only, in-memory inverted index.
 * <p>
 * For every indexed field it maps a term to the {@link PostingList} of documents containing it.
 * The index also keeps a reference to every document, addressable by id.
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>every id in any posting list is {@code < size()} and resolves to exactly one document</li>
 *   <li>posting lists are sorted by ascending document id</li>
 *   <li>a document with an empty field contributes no postings for that field</li>
 * </ul>
 *
 * <h2>Thread-safety</h2>
 * Instances are built once by {@link InvertedIndexBuilder} and never mutated afterwards, so any number
 * of threads may read concurrently without synchronization.
 */
public final class InvertedIndex {

    private final List<IndexableDocument> documents;
    private final Map<String, Map<String, PostingList>> fields;

    InvertedIndex(final List<IndexableDocument> documents,
                  final Map<String, Map<String, PostingList>> fields) {
        this.documents = List.copyOf(documents);
        this.fields = fields;
    }

    /**
     * Looks up the postings of {@code term} in {@code field}.
     *
     * @return the posting list, {@link PostingList#EMPTY} for unknown fields or terms
     */
    public PostingList postings(final String field, final String term) {
        final Map<String, PostingList> terms = fields.get(field);
        if (terms == null || term == null) {
            return PostingList.EMPTY;
        }
        return terms.getOrDefault(term, PostingList.EMPTY);
    }

    public IndexableDocument document(final int id) {
        if (id < 0 || id >= documents.size()) {
            throw new IndexOutOfBoundsException("no document with id " + id + " (size " + documents.size() + ")");
        }
        return documents.get(id);
    }

    public Optional<IndexableDocument> findDocument(final int id) {
        if (id < 0 || id >= documents.size()) {
            return Optional.empty();
        }
        return Optional.of(documents.get(id));
    }

    public int size() {
        return documents.size();
    }

    public Set<String> fields() {
        return fields.keySet();
    }

    public int termCount(final String field) {
        final Map<String, PostingList> terms = fields.get(field);
        return terms == null ? 0 : terms.size();
    }

    public long postingCount() {
        long total = 0;
        for (final Map<String, PostingList> terms : fields.values()) {
            for (final PostingList list : terms.values()) {
                total += list.size();
            }
        }
        return total;
    }
}
