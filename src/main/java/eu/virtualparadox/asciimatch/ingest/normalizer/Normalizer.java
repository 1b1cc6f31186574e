package eu.virtualparadox.asciimatch.ingest.normalizer;

/**
 * A single text-to-text transform of the normalization pipeline.
 * <p>Implementations must be pure, deterministic and total: every input (including the empty
 * string) yields an output and no exception is thrown.</p>
 */
@FunctionalInterface
public interface Normalizer {

    String apply(final String text);

}
