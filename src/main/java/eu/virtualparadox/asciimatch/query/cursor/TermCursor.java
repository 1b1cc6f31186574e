package eu.virtualparadox.asciimatch.query.cursor;

import eu.virtualparadox.asciimatch.index.model.PostingList;

/**
 * Walks one posting list; the score of a document is the term frequency.
 */
public final class TermCursor implements MatchCursor {

    private final PostingList postings;
    private int position = -1;
    private int doc = -1;

    public TermCursor(final PostingList postings) {
        this.postings = postings;
    }

    @Override
    public int docId() {
        return doc;
    }

    @Override
    public int nextDoc() {
        position++;
        doc = position < postings.size() ? postings.docId(position) : NO_MORE_DOCS;
        return doc;
    }

    @Override
    public float score() {
        return postings.frequency(position);
    }
}
