package eu.virtualparadox.asciimatch.ingest.analyzer;

import eu.virtualparadox.asciimatch.ingest.normalizer.NormalizerChain;
import eu.virtualparadox.asciimatch.ingest.tokenizer.ShingleTokenizer;
import eu.virtualparadox.asciimatch.ingest.tokenizer.Tokenizer;
import eu.virtualparadox.asciimatch.ingest.tokenizer.WhitespaceTokenizer;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns raw text into terms.
 * <p>
 * An analyzer has two independent sides, each a {@link NormalizerChain} followed by a tokenizer chain:
 * one used while building the index and one used for queries. The sides may differ on purpose, e.g. the
 * index can store shingles for partial-phrase recall while queries are split on whitespace only, or
 * queries can apply extra substitutions. Both sides are deterministic {@code String -> List<String>}
 * functions.
 */
public final class Analyzer {

    private final NormalizerChain indexNormalizer;
    private final List<Tokenizer> indexTokenizers;
    private final NormalizerChain searchNormalizer;
    private final List<Tokenizer> searchTokenizers;

    /**
     * @throws IllegalArgumentException if either tokenizer chain is empty
     */
    public Analyzer(final NormalizerChain indexNormalizer,
                    final List<Tokenizer> indexTokenizers,
                    final NormalizerChain searchNormalizer,
                    final List<Tokenizer> searchTokenizers) {
        this.indexNormalizer = Objects.requireNonNull(indexNormalizer, "indexNormalizer");
        this.searchNormalizer = Objects.requireNonNull(searchNormalizer, "searchNormalizer");
        this.indexTokenizers = List.copyOf(Objects.requireNonNull(indexTokenizers, "indexTokenizers"));
        this.searchTokenizers = List.copyOf(Objects.requireNonNull(searchTokenizers, "searchTokenizers"));
        if (this.searchTokenizers.isEmpty() || this.indexTokenizers.isEmpty()) {
            throw new IllegalArgumentException("an analyzer needs at least one tokenizer on each side");
        }
    }

    /**
     * Both sides share {@code normalizer}.
     */
    public Analyzer(final NormalizerChain normalizer,
                    final List<Tokenizer> searchTokenizers,
                    final List<Tokenizer> indexTokenizers) {
        this(normalizer, indexTokenizers, normalizer, searchTokenizers);
    }

    /**
     * Standard normalization, whitespace + shingles (with single words) at index time and plain
     * whitespace splitting at query time.
     *
     * @param substitutions custom character substitutions of the normalizer chain
     * @param shingleWidth  shingle width, must be {@code >= 1}
     * @return a new analyzer
     */
    public static Analyzer shingles(final Map<String, String> substitutions, final int shingleWidth) {
        return new Analyzer(
                NormalizerChain.standard(substitutions),
                List.of(new WhitespaceTokenizer()),
                List.of(new WhitespaceTokenizer(), new ShingleTokenizer(shingleWidth, true))
        );
    }

    public List<String> analyzeForIndex(final String text) {
        return tokenize(indexNormalizer.normalize(text), indexTokenizers);
    }

    public List<String> analyzeForSearch(final String text) {
        return tokenize(searchNormalizer.normalize(text), searchTokenizers);
    }

    private static List<String> tokenize(final String normalized, final List<Tokenizer> chain) {
        if (normalized.isEmpty()) {
            return List.of();
        }
        List<String> tokens = List.of(normalized);
        for (final Tokenizer tokenizer : chain) {
            tokens = tokenizer.apply(tokens);
        }
        return tokens;
    }
}
