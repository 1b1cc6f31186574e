package eu.virtualparadox.asciimatch.query;

import eu.virtualparadox.asciimatch.index.InvertedIndex;
import eu.virtualparadox.asciimatch.query.cursor.DisjunctionCursor;
import eu.virtualparadox.asciimatch.query.cursor.EmptyCursor;
import eu.virtualparadox.asciimatch.query.cursor.MatchCursor;
import eu.virtualparadox.asciimatch.query.cursor.TermCursor;
import eu.virtualparadox.asciimatch.query.model.MatchResult;
import eu.virtualparadox.asciimatch.query.model.Query;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Evaluates a {@link Query} against an {@link InvertedIndex} and streams every match to a consumer.
 *
 * <h2>Scoring</h2>
 * <ul>
 *   <li>{@link Query.TermSet}: sum of the frequencies of the matched terms</li>
 *   <li>{@link Query.Or}: sum of the matched child scores</li>
 *   <li>{@link Query.DisMax}: best child score plus {@code tieBreaker} times the other matched child scores</li>
 * </ul>
 *
 * <h2>Streaming</h2>
 * Matches are emitted in ascending document id order while the posting lists are merged; the candidate
 * set is never materialized. The evaluator holds no state between calls and only reads the index, so
 * concurrent evaluations need no locking. A caller may stop consuming at any point without side effects.
 */
@Component
public class QueryEvaluator {

    /**
     * Streams all matches of {@code query} to {@code consumer}. Never fails for degenerate queries:
     * empty term sets, unknown fields and childless disjunctions simply match nothing.
     */
    public void evaluate(final InvertedIndex index, final Query query, final Consumer<MatchResult> consumer) {
        Objects.requireNonNull(index, "index");
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(consumer, "consumer");

        final MatchCursor cursor = cursor(index, query);
        for (int doc = cursor.nextDoc(); doc != MatchCursor.NO_MORE_DOCS; doc = cursor.nextDoc()) {
            consumer.accept(new MatchResult(doc, cursor.score(), index.document(doc)));
        }
    }

    /**
     * Counts the matches of {@code query} without keeping them.
     */
    public long count(final InvertedIndex index, final Query query) {
        final long[] count = {0};
        evaluate(index, query, match -> count[0]++);
        return count[0];
    }

    private MatchCursor cursor(final InvertedIndex index, final Query query) {
        if (query instanceof Query.TermSet termSet) {
            final List<MatchCursor> terms = new ArrayList<>(termSet.terms().size());
            for (final String term : termSet.terms()) {
                terms.add(new TermCursor(index.postings(termSet.field(), term)));
            }
            return disjunction(terms, DisjunctionCursor.SUM);
        }
        if (query instanceof Query.Or or) {
            return disjunction(children(index, or.children()), DisjunctionCursor.SUM);
        }
        if (query instanceof Query.DisMax disMax) {
            return disjunction(children(index, disMax.children()), DisjunctionCursor.disMax(disMax.tieBreaker()));
        }
        throw new IllegalArgumentException("Unsupported query type: " + query.getClass().getName());
    }

    private List<MatchCursor> children(final InvertedIndex index, final List<Query> queries) {
        final List<MatchCursor> cursors = new ArrayList<>(queries.size());
        for (final Query child : queries) {
            cursors.add(cursor(index, child));
        }
        return cursors;
    }

    private static MatchCursor disjunction(final List<MatchCursor> children, final DisjunctionCursor.ScoreCombiner combiner) {
        if (children.isEmpty()) {
            return new EmptyCursor();
        }
        return new DisjunctionCursor(children, combiner);
    }
}
