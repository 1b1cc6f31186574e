package eu.virtualparadox.asciimatch.index.model;

import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Immutable list of postings for one (field, term) key, sorted by strictly ascending document id.
 * <p>Document ids and frequencies are kept in two parallel primitive arrays.</p>
 */
public final class PostingList implements Iterable<Posting> {

    public static final PostingList EMPTY = new PostingList(new int[0], new int[0], 0);

    private final int[] docIds;
    private final int[] frequencies;
    private final int size;

    private PostingList(final int[] docIds, final int[] frequencies, final int size) {
        this.docIds = docIds;
        this.frequencies = frequencies;
        this.size = size;
    }

    /**
     * Creates a posting list from copies of the given arrays.
     *
     * @throws IllegalArgumentException if the arrays differ in length, ids are not strictly ascending,
     *                                  an id is negative or a frequency is {@code < 1}
     */
    public static PostingList of(final int[] docIds, final int[] frequencies) {
        if (docIds.length != frequencies.length) {
            throw new IllegalArgumentException(
                    "docIds.length != frequencies.length: " + docIds.length + " vs " + frequencies.length);
        }
        validate(docIds, frequencies, docIds.length);
        return new PostingList(docIds.clone(), frequencies.clone(), docIds.length);
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public int docId(final int index) {
        checkIndex(index);
        return docIds[index];
    }

    public int frequency(final int index) {
        checkIndex(index);
        return frequencies[index];
    }

    /**
     * @return the frequency of the term in {@code docId}, or {@code 0} if the document is not listed
     */
    public int frequencyOf(final int docId) {
        final int pos = Arrays.binarySearch(docIds, 0, size, docId);
        return pos < 0 ? 0 : frequencies[pos];
    }

    public boolean contains(final int docId) {
        return Arrays.binarySearch(docIds, 0, size, docId) >= 0;
    }

    @Override
    public Iterator<Posting> iterator() {
        return new Iterator<>() {
            private int next = 0;

            @Override
            public boolean hasNext() {
                return next < size;
            }

            @Override
            public Posting next() {
                if (next >= size) {
                    throw new NoSuchElementException();
                }
                final Posting p = new Posting(docIds[next], frequencies[next]);
                next++;
                return p;
            }
        };
    }

    @Override
    public String toString() {
        return "PostingList{size=" + size + "}";
    }

    private void checkIndex(final int index) {
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("index " + index + " out of bounds for size " + size);
        }
    }

    private static void validate(final int[] docIds, final int[] frequencies, final int size) {
        for (int i = 0; i < size; i++) {
            if (docIds[i] < 0) {
                throw new IllegalArgumentException("negative docId at " + i + ": " + docIds[i]);
            }
            if (frequencies[i] < 1) {
                throw new IllegalArgumentException("frequency must be >= 1 at " + i + ": " + frequencies[i]);
            }
            if (i > 0 && docIds[i] <= docIds[i - 1]) {
                throw new IllegalArgumentException(
                        "docIds must be strictly ascending at " + i + ": " + docIds[i - 1] + " -> " + docIds[i]);
            }
        }
    }

    /**
     * Append-only builder used while the index is being built.
     * Postings must be appended in ascending document order.
     */
    public static final class Builder {

        private int[] docIds = new int[4];
        private int[] frequencies = new int[4];
        private int size = 0;

        /**
         * @throws IllegalStateException if {@code docId} is not greater than the last appended id
         */
        public Builder add(final int docId, final int frequency) {
            if (size > 0 && docId <= docIds[size - 1]) {
                throw new IllegalStateException(
                        "postings appended out of order: " + docIds[size - 1] + " -> " + docId);
            }
            if (frequency < 1) {
                throw new IllegalArgumentException("frequency must be >= 1, got " + frequency);
            }
            if (size == docIds.length) {
                docIds = Arrays.copyOf(docIds, size * 2);
                frequencies = Arrays.copyOf(frequencies, size * 2);
            }
            docIds[size] = docId;
            frequencies[size] = frequency;
            size++;
            return this;
        }

        public PostingList build() {
            if (size == 0) {
                return EMPTY;
            }
            return new PostingList(Arrays.copyOf(docIds, size), Arrays.copyOf(frequencies, size), size);
        }
    }
}
