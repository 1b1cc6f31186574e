package eu.virtualparadox.asciimatch.ingest.normalizer;

import org.apache.lucene.analysis.miscellaneous.ASCIIFoldingFilter;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Factory for the normalizers used by the default analysis chain.
 * <p>
 * The default chain applies, in order:
 * <ol>
 *   <li>{@link #unaccent()}</li>
 *   <li>{@link #lowerCase()}</li>
 *   <li>{@link #spaceBetweenDigits()}</li>
 *   <li>{@link #substitute(Map)}</li>
 *   <li>{@link #removeNonAlphanumeric()}</li>
 *   <li>{@link #trim()}</li>
 * </ol>
 */
public final class Normalizers {

    private Normalizers() {
        // prevent instantiation
    }

    /**
     * Folds accented and other non-ASCII Latin characters to their ASCII equivalents
     * ({@code é -> e}, {@code ø -> o}) using Lucene's folding table.
     * Characters without an equivalent are passed through unchanged.
     */
    public static Normalizer unaccent() {
        return text -> {
            if (text.isEmpty()) {
                return text;
            }
            final char[] input = text.toCharArray();
            // a single char folds to at most 4 chars
            final char[] output = new char[input.length * 4];
            final int length = ASCIIFoldingFilter.foldToASCII(input, 0, output, 0, input.length);
            return new String(output, 0, length);
        };
    }

    /**
     * Locale-independent lower casing.
     */
    public static Normalizer lowerCase() {
        return text -> text.toLowerCase(Locale.ROOT);
    }

    /**
     * Inserts a space at every boundary between a letter and a digit, in both directions,
     * so that {@code "abc123def"} becomes {@code "abc 123 def"}.
     */
    public static Normalizer spaceBetweenDigits() {
        return text -> {
            final StringBuilder sb = new StringBuilder(text.length() + 8);
            int previous = -1;
            int i = 0;
            while (i < text.length()) {
                final int cp = text.codePointAt(i);
                if (previous != -1 && isLetterDigitBoundary(previous, cp)) {
                    sb.append(' ');
                }
                sb.appendCodePoint(cp);
                previous = cp;
                i += Character.charCount(cp);
            }
            return sb.toString();
        };
    }

    /**
     * Replaces every occurrence of each key with its value, in the iteration order of the map.
     *
     * @param substitutions literal replacements, e.g. {@code "#" -> " "}
     */
    public static Normalizer substitute(final Map<String, String> substitutions) {
        Objects.requireNonNull(substitutions, "substitutions");
        final Map<String, String> copy = new LinkedHashMap<>(substitutions);
        copy.forEach((from, to) -> {
            if (from == null || from.isEmpty()) {
                throw new IllegalArgumentException("substitution key must not be empty");
            }
            if (to == null) {
                throw new IllegalArgumentException("substitution value for '" + from + "' must not be null");
            }
        });
        return text -> {
            String result = text;
            for (final Map.Entry<String, String> e : copy.entrySet()) {
                result = result.replace(e.getKey(), e.getValue());
            }
            return result;
        };
    }

    /**
     * Drops every character that is not a letter, a digit or whitespace.
     * Each run of whitespace is collapsed into a single space.
     */
    public static Normalizer removeNonAlphanumeric() {
        return text -> {
            final StringBuilder sb = new StringBuilder(text.length());
            boolean pendingSpace = false;
            int i = 0;
            while (i < text.length()) {
                final int cp = text.codePointAt(i);
                i += Character.charCount(cp);

                if (Character.isWhitespace(cp) || Character.isSpaceChar(cp)) {
                    pendingSpace = true;
                } else if (Character.isLetter(cp) || Character.isDigit(cp)) {
                    if (pendingSpace && sb.length() > 0) {
                        sb.append(' ');
                    }
                    pendingSpace = false;
                    sb.appendCodePoint(cp);
                }
            }
            if (pendingSpace && sb.length() > 0) {
                sb.append(' ');
            }
            return sb.toString();
        };
    }

    /**
     * Removes leading and trailing spaces.
     */
    public static Normalizer trim() {
        return String::strip;
    }

    private static boolean isLetterDigitBoundary(final int previous, final int current) {
        return (Character.isLetter(previous) && Character.isDigit(current))
                || (Character.isDigit(previous) && Character.isLetter(current));
    }
}
