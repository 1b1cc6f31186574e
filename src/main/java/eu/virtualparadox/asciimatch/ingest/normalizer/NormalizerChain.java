package eu.virtualparadox.asciimatch.ingest.normalizer;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Applies an ordered list of {@link Normalizer}s one after the other.
 * <p>
 * The chain is stateless after construction and can be shared between threads.
 * Individual normalizers are idempotent, the chain as a whole is not guaranteed to be.
 */
public final class NormalizerChain {

    private final List<Normalizer> normalizers;

    public NormalizerChain(final List<Normalizer> normalizers) {
        Objects.requireNonNull(normalizers, "normalizers");
        this.normalizers = List.copyOf(normalizers);
    }

    /**
     * Builds the standard chain: unaccent, lower case, space between digits, custom substitutions,
     * remove non-alphanumeric, trim.
     *
     * @param substitutions literal replacements applied in step four
     * @return the default chain
     */
    public static NormalizerChain standard(final Map<String, String> substitutions) {
        return new NormalizerChain(List.of(
                Normalizers.unaccent(),
                Normalizers.lowerCase(),
                Normalizers.spaceBetweenDigits(),
                Normalizers.substitute(substitutions),
                Normalizers.removeNonAlphanumeric(),
                Normalizers.trim()
        ));
    }

    /**
     * Normalizes the given text.
     *
     * @param input raw text, {@code null} is treated as empty
     * @return normalized text, never {@code null}
     */
    public String normalize(final String input) {
        if (input == null || input.isEmpty()) {
            return "";
        }
        String text = input;
        for (final Normalizer normalizer : normalizers) {
            text = normalizer.apply(text);
        }
        return text;
    }

    public int size() {
        return normalizers.size();
    }
}
