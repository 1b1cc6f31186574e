package eu.virtualparadox.asciimatch.ingest.tokenizer;

import java.util.ArrayList;
import java.util.List;

/**
 * Produces overlapping word n-grams ("shingles") from the incoming token sequence.
 *
 * <h2>Output</h2>
 * For a sequence of {@code n} tokens and a width of {@code k}:
 * <ul>
 *   <li>{@code n >= k}: exactly {@code n - k + 1} shingles, one per start position</li>
 *   <li>{@code 0 < n < k}: a single shingle made of the whole sequence</li>
 *   <li>{@code n == 0}: nothing</li>
 * </ul>
 * Tokens of a shingle are joined by a single space.
 *
 * <p>With {@code includeUnigrams} every input token is emitted as well, directly before the
 * shingle that starts at its position. A one-token sequence then yields just that token.</p>
 */
public final class ShingleTokenizer implements Tokenizer {

    private static final String SEPARATOR = " ";

    private final int width;
    private final boolean includeUnigrams;

    /**
     * @param width           shingle width, must be {@code >= 1}
     * @param includeUnigrams whether to emit the single tokens alongside the shingles
     * @throws IllegalArgumentException if {@code width < 1}
     */
    public ShingleTokenizer(final int width, final boolean includeUnigrams) {
        if (width < 1) {
            throw new IllegalArgumentException("shingle width must be >= 1, got " + width);
        }
        this.width = width;
        this.includeUnigrams = includeUnigrams;
    }

    public ShingleTokenizer(final int width) {
        this(width, false);
    }

    @Override
    public List<String> apply(final List<String> tokens) {
        final int n = tokens.size();
        if (n == 0) {
            return List.of();
        }

        final List<String> out = new ArrayList<>(includeUnigrams ? 2 * n : n);
        if (n < width) {
            if (includeUnigrams) {
                out.addAll(tokens);
                if (n > 1) {
                    out.add(String.join(SEPARATOR, tokens));
                }
            } else {
                out.add(String.join(SEPARATOR, tokens));
            }
            return out;
        }

        for (int i = 0; i < n; i++) {
            if (includeUnigrams) {
                out.add(tokens.get(i));
            }
            if (i + width <= n && !(includeUnigrams && width == 1)) {
                out.add(String.join(SEPARATOR, tokens.subList(i, i + width)));
            }
        }
        return out;
    }

    public int getWidth() {
        return width;
    }
}
