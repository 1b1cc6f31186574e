package eu.virtualparadox.asciimatch.select;

import java.util.concurrent.ThreadLocalRandom;

/**
 * How the single result is chosen from the matching documents.
 */
public enum SelectionMode {

    /** Uniformly random among all matches, favouring variety. */
    RANDOM,

    /** The highest-scoring match. */
    TOP_SCORE;

    /**
     * Creates a fresh selector for one query. Random selectors draw from the calling thread's
     * {@link ThreadLocalRandom}, so the selector must be used on the thread that created it.
     */
    public Selector newSelector() {
        return switch (this) {
            case RANDOM -> new ReservoirSelector(ThreadLocalRandom.current());
            case TOP_SCORE -> new TopScoreSelector();
        };
    }
}
