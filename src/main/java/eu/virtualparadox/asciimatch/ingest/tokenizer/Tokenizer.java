package eu.virtualparadox.asciimatch.ingest.tokenizer;

import java.util.List;

/**
 * One stage of a tokenization chain.
 * <p>
 * A stage receives the ordered tokens produced by the previous stage (the first stage receives the
 * normalized text as a single token) and returns a new ordered list. Implementations are stateless,
 * deterministic and never return {@code null}.
 */
public interface Tokenizer {

    List<String> apply(final List<String> tokens);

}
