package eu.virtualparadox.asciimatch.select;

import eu.virtualparadox.asciimatch.catalog.model.IndexableDocument;
import eu.virtualparadox.asciimatch.query.model.MatchResult;

import java.util.Optional;
import java.util.function.Consumer;

/**
 * Picks at most one document out of a stream of matches, in a single pass and constant memory.
 * <p>A selector holds per-query state: create one per evaluation and never share it between threads.</p>
 */
public interface Selector extends Consumer<MatchResult> {

    /**
     * @return the selected document, or empty if no match was seen
     */
    Optional<IndexableDocument> result();

    /**
     * Feeds every match of {@code matches} to this selector and returns the selection.
     */
    default Optional<IndexableDocument> selectOne(final Iterable<MatchResult> matches) {
        for (final MatchResult match : matches) {
            accept(match);
        }
        return result();
    }
}
