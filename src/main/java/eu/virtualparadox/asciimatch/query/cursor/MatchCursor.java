package eu.virtualparadox.asciimatch.query.cursor;

/**
 * Forward-only iterator over matching documents in ascending id order.
 * <p>
 * A new cursor is unpositioned ({@link #docId()} returns {@code -1}). Each call to {@link #nextDoc()}
 * moves to the next match and returns its id, or {@link #NO_MORE_DOCS} once exhausted.
 * {@link #score()} is only defined while positioned on a match.
 */
public interface MatchCursor {

    int NO_MORE_DOCS = Integer.MAX_VALUE;

    int docId();

    int nextDoc();

    float score();

}
