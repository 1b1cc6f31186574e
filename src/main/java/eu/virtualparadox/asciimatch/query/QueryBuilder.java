package eu.virtualparadox.asciimatch.query;

import eu.virtualparadox.asciimatch.ingest.analyzer.FieldAnalyzers;
import eu.virtualparadox.asciimatch.query.model.Query;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;

import static eu.virtualparadox.asciimatch.util.FieldNames.MATCH_ALL;
import static eu.virtualparadox.asciimatch.util.FieldNames.MATCH_ALL_VALUE;

/**
 * Builds {@link Query} trees from free-text input.
 * <p>Building never fails on user input: text that analyzes to nothing yields an empty term set,
 * which matches no document.</p>
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class QueryBuilder {

    private final FieldAnalyzers analyzers;

    /**
     * Analyzes {@code queryString} with the search-time analyzer of {@code field}.
     * Duplicate terms are collapsed, first occurrence wins.
     *
     * @param field       field to search
     * @param queryString raw user input, may be {@code null}
     * @return a term set, empty for unknown fields or when no term survives analysis
     */
    public Query.TermSet terms(final String field, final String queryString) {
        final List<String> terms = analyzers.forField(field)
                .map(a -> a.analyzeForSearch(queryString))
                .orElse(List.of());
        if (terms.isEmpty()) {
            return Query.TermSet.empty(field);
        }
        final List<String> distinct = new ArrayList<>(new LinkedHashSet<>(terms));
        log.debug("Query '{}' on field {} -> terms {}", queryString, field, distinct);
        return new Query.TermSet(field, distinct);
    }

    /**
     * Matches every indexed document through the constant {@code match_all} field.
     */
    public Query.TermSet matchAll() {
        return new Query.TermSet(MATCH_ALL, List.of(MATCH_ALL_VALUE));
    }

    public Query.Or or(final Query... children) {
        return new Query.Or(Arrays.asList(children));
    }

    /**
     * @throws IllegalArgumentException if {@code tieBreaker} is outside {@code [0, 1]}
     */
    public Query.DisMax disMax(final float tieBreaker, final Query... children) {
        return new Query.DisMax(tieBreaker, Arrays.asList(children));
    }
}
