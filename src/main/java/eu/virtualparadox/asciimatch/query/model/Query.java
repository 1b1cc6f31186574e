package eu.virtualparadox.asciimatch.query.model;

import java.util.List;
import java.util.Objects;

/**
 * Composable query tree, built per request and evaluated by
 * {@link eu.virtualparadox.asciimatch.query.QueryEvaluator}.
 */
public sealed interface Query permits Query.TermSet, Query.Or, Query.DisMax {

    /**
     * Disjunction of already analyzed terms within one field.
     * A document scores the sum of the frequencies of the terms it contains.
     */
    record TermSet(String field, List<String> terms) implements Query {
        public TermSet {
            Objects.requireNonNull(field, "field");
            terms = List.copyOf(terms);
        }

        public static TermSet empty(final String field) {
            return new TermSet(field, List.of());
        }
    }

    /**
     * Union of the children; a document scores the sum of the child scores it matches.
     */
    record Or(List<Query> children) implements Query {
        public Or {
            children = List.copyOf(children);
        }
    }

    /**
     * Disjunction-max: a document scores its best child score plus {@code tieBreaker} times the
     * scores of every other child it matches.
     */
    record DisMax(float tieBreaker, List<Query> children) implements Query {
        public DisMax {
            if (Float.isNaN(tieBreaker) || tieBreaker < 0f || tieBreaker > 1f) {
                throw new IllegalArgumentException("tieBreaker must be in [0, 1], got " + tieBreaker);
            }
            children = List.copyOf(children);
        }
    }
}
