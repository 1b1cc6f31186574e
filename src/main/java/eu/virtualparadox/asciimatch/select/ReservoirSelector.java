package eu.virtualparadox.asciimatch.select;

import eu.virtualparadox.asciimatch.catalog.model.IndexableDocument;
import eu.virtualparadox.asciimatch.query.model.MatchResult;

import java.util.Objects;
import java.util.Optional;
import java.util.random.RandomGenerator;

/**
 * Reservoir sampling of size one.
 * <p>
 * Every incoming match draws an independent, uniformly distributed 64-bit key and the match holding the
 * largest key so far is kept. Since all keys are i.i.d., each match is equally likely to hold the maximum,
 * whatever the arrival order and however long the stream is. The relevance score is ignored: it only
 * decides which documents are candidates, not which one wins.
 */
public final class ReservoirSelector implements Selector {

    private final RandomGenerator random;
    private IndexableDocument best;
    private long bestKey = Long.MIN_VALUE;
    private long seen;

    public ReservoirSelector(final RandomGenerator random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    @Override
    public void accept(final MatchResult match) {
        final long key = random.nextLong();
        seen++;
        if (best == null || key > bestKey) {
            best = match.document();
            bestKey = key;
        }
    }

    @Override
    public Optional<IndexableDocument> result() {
        return Optional.ofNullable(best);
    }

    public long seen() {
        return seen;
    }
}
