package eu.virtualparadox.asciimatch.query;

import eu.virtualparadox.asciimatch.catalog.model.AsciiArt;
import eu.virtualparadox.asciimatch.index.InvertedIndex;
import eu.virtualparadox.asciimatch.index.InvertedIndexBuilder;
import eu.virtualparadox.asciimatch.ingest.analyzer.Analyzer;
import eu.virtualparadox.asciimatch.ingest.analyzer.FieldAnalyzers;
import eu.virtualparadox.asciimatch.ingest.normalizer.NormalizerChain;
import eu.virtualparadox.asciimatch.ingest.tokenizer.WhitespaceTokenizer;
import eu.virtualparadox.asciimatch.query.model.MatchResult;
import eu.virtualparadox.asciimatch.query.model.Query;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static eu.virtualparadox.asciimatch.util.FieldNames.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class QueryEvaluatorTest {

    private final QueryEvaluator evaluator = new QueryEvaluator();
    private QueryBuilder builder;
    private InvertedIndex index;

    @BeforeEach
    void setUp() {
        // plain words on both sides keep frequencies easy to reason about
        final Analyzer words = new Analyzer(NormalizerChain.standard(Map.of()),
                List.of(new WhitespaceTokenizer()), List.of(new WhitespaceTokenizer()));
        final FieldAnalyzers analyzers = FieldAnalyzers.of(Map.of(BLOB, words, TAGS, words, MATCH_ALL, words));
        builder = new QueryBuilder(analyzers);
        index = new InvertedIndexBuilder(analyzers).build(List.of(
                new AsciiArt(0, "cat cat cat", List.of("cat")),
                new AsciiArt(1, "dog", List.of("cat")),
                new AsciiArt(2, "cat dog bird", List.of("bird")),
                new AsciiArt(3, "fish", List.of("fish")),
                new AsciiArt(4, "dog dog", List.of("dog"))));
    }

    private List<MatchResult> run(final Query query) {
        final List<MatchResult> out = new ArrayList<>();
        evaluator.evaluate(index, query, out::add);
        return out;
    }

    private float scoreOf(final List<MatchResult> results, final int docId) {
        return results.stream().filter(r -> r.docId() == docId).findFirst().orElseThrow().score();
    }

    @Test
    @DisplayName("Term set scores the sum of matched term frequencies")
    void termSetScoring() {
        final List<MatchResult> results = run(builder.terms(BLOB, "cat dog"));

        assertThat(results).extracting(MatchResult::docId).containsExactly(0, 1, 2, 4);
        assertThat(scoreOf(results, 0)).isEqualTo(3f);
        assertThat(scoreOf(results, 2)).isEqualTo(2f);
        assertThat(scoreOf(results, 4)).isEqualTo(2f);
        assertThat(results.get(0).document().id()).isZero();
    }

    @Test
    @DisplayName("Repeated query words count once")
    void duplicateQueryTerms() {
        assertThat(builder.terms(BLOB, "cat CAT cat").terms()).containsExactly("cat");
    }

    @Test
    @DisplayName("OR is the union of its children, summing their scores")
    void orUnion() {
        final List<MatchResult> results = run(builder.or(
                builder.terms(BLOB, "fish"),
                builder.terms(TAGS, "cat")));

        assertThat(results).extracting(MatchResult::docId).containsExactly(0, 1, 3);
        assertThat(scoreOf(results, 1)).isEqualTo(1f);
    }

    @Test
    @DisplayName("DisMax adds tieBreaker times the non-best child scores")
    void disMaxCombination() {
        final List<MatchResult> results = run(builder.disMax(0.1f,
                builder.or(builder.terms(TAGS, "cat")),
                builder.or(builder.terms(BLOB, "cat"))));

        assertThat(results).extracting(MatchResult::docId).containsExactly(0, 1, 2);
        // doc 0: tags 1, blob 3
        assertThat(scoreOf(results, 0)).isCloseTo(3f + 0.1f * 1f, within(1e-6f));
        // doc 1 matches tags only, doc 2 blob only: exactly the single child score
        assertThat(scoreOf(results, 1)).isEqualTo(1f);
        assertThat(scoreOf(results, 2)).isEqualTo(1f);
    }

    @Test
    @DisplayName("Raising the tie breaker never lowers a multi-field score")
    void disMaxMonotonicity() {
        float previous = Float.NEGATIVE_INFINITY;
        for (final float tieBreaker : new float[]{0f, 0.1f, 0.25f, 0.5f, 0.9f, 1f}) {
            final float score = scoreOf(run(builder.disMax(tieBreaker,
                    builder.terms(TAGS, "cat"),
                    builder.terms(BLOB, "cat"))), 0);
            assertThat(score).isGreaterThanOrEqualTo(previous);
            previous = score;
        }
        // tieBreaker 1 is a plain sum
        assertThat(previous).isEqualTo(4f);
    }

    @Test
    @DisplayName("Matches stream in ascending id order")
    void ascendingOrder() {
        final List<MatchResult> results = run(builder.matchAll());
        assertThat(results).extracting(MatchResult::docId).containsExactly(0, 1, 2, 3, 4);
    }

    @Test
    @DisplayName("Degenerate queries match nothing and do not fail")
    void degenerateQueries() {
        assertThat(run(builder.terms(BLOB, ""))).isEmpty();
        assertThat(run(builder.terms(BLOB, null))).isEmpty();
        assertThat(run(builder.terms(BLOB, "!!! ###"))).isEmpty();
        assertThat(run(builder.terms("unknown", "cat"))).isEmpty();
        assertThat(run(builder.terms(BLOB, "unicorn"))).isEmpty();
        assertThat(run(builder.or())).isEmpty();
        assertThat(run(builder.disMax(0.5f))).isEmpty();
        assertThat(run(builder.disMax(0.1f, builder.or(builder.terms(TAGS, "")), builder.or(builder.terms(BLOB, ""))))).isEmpty();
    }

    @Test
    @DisplayName("Nested queries evaluate like their flattened union")
    void nested() {
        final Query nested = builder.or(
                builder.disMax(0.1f, builder.terms(BLOB, "bird"), builder.terms(TAGS, "bird")),
                builder.or(builder.terms(TAGS, "dog")));
        assertThat(evaluator.count(index, nested)).isEqualTo(2);
    }

    @Test
    @DisplayName("Tie breaker outside [0, 1] is rejected")
    void invalidTieBreaker() {
        assertThatThrownBy(() -> builder.disMax(1.5f)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.disMax(-0.1f)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.disMax(Float.NaN)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Concurrent evaluations over one index each see their own complete results")
    void concurrentEvaluation() throws Exception {
        final List<Query> queries = List.of(
                builder.terms(BLOB, "cat dog"),
                builder.terms(TAGS, "cat"),
                builder.matchAll(),
                builder.disMax(0.1f, builder.or(builder.terms(TAGS, "bird fish")), builder.or(builder.terms(BLOB, "bird fish"))),
                builder.terms(BLOB, "unicorn"));
        final List<List<MatchResult>> expected = new ArrayList<>();
        for (final Query query : queries) {
            expected.add(run(query));
        }

        final ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            final List<Callable<Boolean>> tasks = new ArrayList<>();
            for (int t = 0; t < 32; t++) {
                final int which = t % queries.size();
                tasks.add(() -> {
                    for (int round = 0; round < 200; round++) {
                        final List<MatchResult> mine = new ArrayList<>();
                        evaluator.evaluate(index, queries.get(which), mine::add);
                        if (!mine.equals(expected.get(which))) {
                            return false;
                        }
                    }
                    return true;
                });
            }
            for (final Future<Boolean> result : pool.invokeAll(tasks)) {
                assertThat(result.get()).isTrue();
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
