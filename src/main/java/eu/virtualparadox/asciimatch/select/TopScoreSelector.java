package eu.virtualparadox.asciimatch.select;

import eu.virtualparadox.asciimatch.catalog.model.IndexableDocument;
import eu.virtualparadox.asciimatch.query.model.MatchResult;

import java.util.Optional;

/**
 * Deterministic top-1 ranking: keeps the match with the highest relevance score.
 * On equal scores the first match seen (the lowest id, given ascending evaluation order) wins.
 */
public final class TopScoreSelector implements Selector {

    private IndexableDocument best;
    private float bestScore = Float.NEGATIVE_INFINITY;

    @Override
    public void accept(final MatchResult match) {
        if (best == null || match.score() > bestScore) {
            best = match.document();
            bestScore = match.score();
        }
    }

    @Override
    public Optional<IndexableDocument> result() {
        return Optional.ofNullable(best);
    }
}
