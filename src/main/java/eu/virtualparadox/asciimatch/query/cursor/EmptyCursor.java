package eu.virtualparadox.asciimatch.query.cursor;

/**
 * Cursor that matches nothing.
 */
public final class EmptyCursor implements MatchCursor {

    private int doc = -1;

    @Override
    public int docId() {
        return doc;
    }

    @Override
    public int nextDoc() {
        doc = NO_MORE_DOCS;
        return doc;
    }

    @Override
    public float score() {
        return 0f;
    }
}
