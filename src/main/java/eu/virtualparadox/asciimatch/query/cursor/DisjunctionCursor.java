package eu.virtualparadox.asciimatch.query.cursor;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Merges child cursors into their union, in ascending document order.
 * <p>
 * Children are kept in a min-heap keyed by their current document. On every step all children
 * positioned on the smallest document are taken off the heap, their scores are combined, and they are
 * advanced and pushed back on the following step. Memory is proportional to the number of children,
 * never to the number of matches.
 */
public final class DisjunctionCursor implements MatchCursor {

    /**
     * How the scores of the children matching the same document are combined.
     */
    public interface ScoreCombiner {
        float combine(float sum, float max);
    }

    /** Plain sum of the matching child scores. */
    public static final ScoreCombiner SUM = (sum, max) -> sum;

    private final PriorityQueue<MatchCursor> queue;
    private final List<MatchCursor> current;
    private final ScoreCombiner combiner;
    private int doc = -1;
    private float score;

    public DisjunctionCursor(final List<MatchCursor> children, final ScoreCombiner combiner) {
        this.combiner = combiner;
        this.queue = new PriorityQueue<>(Math.max(1, children.size()), Comparator.comparingInt(MatchCursor::docId));
        this.current = new ArrayList<>(children.size());
        for (final MatchCursor child : children) {
            if (child.nextDoc() != NO_MORE_DOCS) {
                queue.add(child);
            }
        }
    }

    /**
     * Disjunction-max combination: {@code max + tieBreaker * (sum - max)}.
     */
    public static ScoreCombiner disMax(final float tieBreaker) {
        return (sum, max) -> max + tieBreaker * (sum - max);
    }

    @Override
    public int docId() {
        return doc;
    }

    @Override
    public int nextDoc() {
        if (doc == NO_MORE_DOCS) {
            return doc;
        }
        for (final MatchCursor child : current) {
            if (child.nextDoc() != NO_MORE_DOCS) {
                queue.add(child);
            }
        }
        current.clear();

        if (queue.isEmpty()) {
            doc = NO_MORE_DOCS;
            return doc;
        }

        doc = queue.peek().docId();
        float sum = 0f;
        float max = Float.NEGATIVE_INFINITY;
        while (!queue.isEmpty() && queue.peek().docId() == doc) {
            final MatchCursor child = queue.poll();
            final float s = child.score();
            sum += s;
            max = Math.max(max, s);
            current.add(child);
        }
        score = combiner.combine(sum, max);
        return doc;
    }

    @Override
    public float score() {
        return score;
    }
}
