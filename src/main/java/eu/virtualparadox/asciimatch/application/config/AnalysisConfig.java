package eu.virtualparadox.asciimatch.application.config;

import eu.virtualparadox.asciimatch.ingest.analyzer.Analyzer;
import eu.virtualparadox.asciimatch.ingest.analyzer.FieldAnalyzers;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

import static eu.virtualparadox.asciimatch.util.FieldNames.*;

/**
 * Text analysis beans. All searchable fields share one shingles analyzer.
 */
@Configuration
public class AnalysisConfig {

    /**
     * @param props application properties (substitutions, shingle width)
     * @return the shared analyzer
     */
    @Bean
    public Analyzer shinglesAnalyzer(final ApplicationConfig props) {
        return Analyzer.shingles(props.getSubstitutions(), props.getShingleWidth());
    }

    @Bean
    public FieldAnalyzers fieldAnalyzers(final Analyzer shinglesAnalyzer) {
        return FieldAnalyzers.of(Map.of(
                BLOB, shinglesAnalyzer,
                TAGS, shinglesAnalyzer,
                MATCH_ALL, shinglesAnalyzer));
    }
}
