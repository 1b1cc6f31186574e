package eu.virtualparadox.asciimatch.ingest.tokenizer;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits every incoming token on whitespace; each maximal non-whitespace run becomes a token.
 */
public final class WhitespaceTokenizer implements Tokenizer {

    @Override
    public List<String> apply(final List<String> tokens) {
        final List<String> out = new ArrayList<>();
        for (final String token : tokens) {
            split(token, out);
        }
        return out;
    }

    private static void split(final String text, final List<String> out) {
        int start = -1;
        for (int i = 0; i < text.length(); i++) {
            if (Character.isWhitespace(text.charAt(i))) {
                if (start >= 0) {
                    out.add(text.substring(start, i));
                    start = -1;
                }
            } else if (start < 0) {
                start = i;
            }
        }
        if (start >= 0) {
            out.add(text.substring(start));
        }
    }
}
