package eu.virtualparadox.asciimatch.application.config;

import eu.virtualparadox.asciimatch.application.executor.IndexingExecutor;
import eu.virtualparadox.asciimatch.catalog.model.AsciiArt;
import eu.virtualparadox.asciimatch.catalog.service.CorpusLoader;
import eu.virtualparadox.asciimatch.index.InvertedIndex;
import eu.virtualparadox.asciimatch.index.InvertedIndexBuilder;
import eu.virtualparadox.asciimatch.ingest.analyzer.FieldAnalyzers;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Loads the corpus and builds the {@link InvertedIndex} once at startup.
 * <p>The index is rebuilt from scratch on every start; nothing is persisted.</p>
 */
@Configuration
@Slf4j
public class IndexConfig {

    /**
     * @param loader    corpus loader
     * @param analyzers per-field analyzers
     * @param executor  pool for per-document analysis
     * @param props     application properties
     * @return the immutable index shared by all requests
     */
    @Bean
    public InvertedIndex invertedIndex(final CorpusLoader loader,
                                       final FieldAnalyzers analyzers,
                                       final IndexingExecutor executor,
                                       final ApplicationConfig props) {
        final List<AsciiArt> corpus = loader.load(props.getRoot());
        final InvertedIndex index = new InvertedIndexBuilder(analyzers).build(corpus, executor);
        log.info("Index ready: {} items from {}, selection mode {}",
                index.size(), props.getRoot(), props.getSelectionMode());
        return index;
    }
}
