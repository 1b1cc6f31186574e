package eu.virtualparadox.asciimatch.search;

import eu.virtualparadox.asciimatch.application.config.ApplicationConfig;
import eu.virtualparadox.asciimatch.catalog.model.AsciiArt;
import eu.virtualparadox.asciimatch.index.InvertedIndex;
import eu.virtualparadox.asciimatch.query.QueryBuilder;
import eu.virtualparadox.asciimatch.query.QueryEvaluator;
import eu.virtualparadox.asciimatch.query.model.Query;
import eu.virtualparadox.asciimatch.select.ReservoirSelector;
import eu.virtualparadox.asciimatch.select.Selector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

import static eu.virtualparadox.asciimatch.util.FieldNames.BLOB;
import static eu.virtualparadox.asciimatch.util.FieldNames.TAGS;

/**
 * Finds one piece of art for a free-text query.
 * <p>
 * The query searches the tags and the blob as a disjunction-max of two term disjunctions, so a strong
 * tag match is not diluted by a weak body match. Matches are streamed into a fresh {@link Selector}
 * of the configured {@link eu.virtualparadox.asciimatch.select.SelectionMode}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ArtSearchService {

    private final InvertedIndex index;
    private final QueryBuilder queryBuilder;
    private final QueryEvaluator evaluator;
    private final ApplicationConfig props;

    /**
     * @param queryString raw user input
     * @return the selected art, or empty when nothing matches
     */
    public Optional<AsciiArt> search(final String queryString) {
        return search(queryString, props.getSelectionMode().newSelector());
    }

    /**
     * Same as {@link #search(String)} with a caller-supplied selector.
     */
    public Optional<AsciiArt> search(final String queryString, final Selector selector) {
        final Query query = buildQuery(queryString);
        evaluator.evaluate(index, query, selector);
        final Optional<AsciiArt> result = selector.result().map(AsciiArt.class::cast);
        log.debug("Query '{}' selected {}", queryString, result.map(AsciiArt::id).orElse(null));
        return result;
    }

    /**
     * @return any item, uniformly at random, or empty for an empty corpus
     */
    public Optional<AsciiArt> random() {
        final Selector selector = new ReservoirSelector(ThreadLocalRandom.current());
        evaluator.evaluate(index, queryBuilder.matchAll(), selector);
        return selector.result().map(AsciiArt.class::cast);
    }

    public Optional<AsciiArt> findById(final int id) {
        return index.findDocument(id).map(AsciiArt.class::cast);
    }

    /**
     * Number of items matching {@code queryString}.
     */
    public long countMatches(final String queryString) {
        return evaluator.count(index, buildQuery(queryString));
    }

    private Query buildQuery(final String queryString) {
        return queryBuilder.disMax(props.getTieBreaker(),
                queryBuilder.or(queryBuilder.terms(TAGS, queryString)),
                queryBuilder.or(queryBuilder.terms(BLOB, queryString)));
    }
}
