package eu.virtualparadox.asciimatch.ingest.analyzer;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable mapping from field name to the {@link Analyzer} used for that field.
 * Fields without an analyzer are neither indexed nor searchable.
 */
public final class FieldAnalyzers {

    private final Map<String, Analyzer> analyzers;

    private FieldAnalyzers(final Map<String, Analyzer> analyzers) {
        this.analyzers = Map.copyOf(analyzers);
    }

    public static FieldAnalyzers of(final Map<String, Analyzer> analyzers) {
        Objects.requireNonNull(analyzers, "analyzers");
        return new FieldAnalyzers(analyzers);
    }

    public Optional<Analyzer> forField(final String field) {
        return Optional.ofNullable(analyzers.get(field));
    }

    public Set<String> fields() {
        return analyzers.keySet();
    }
}
