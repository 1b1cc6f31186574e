package eu.virtualparadox.asciimatch.application.config;

import eu.virtualparadox.asciimatch.application.executor.IndexingExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ExecutorConfig {

    @Bean
    public IndexingExecutor indexingExecutor(final ApplicationConfig props) {
        final int threads = props.effectiveIndexThreads();
        IndexingExecutor executor = new IndexingExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(Integer.MAX_VALUE); // one task per document
        executor.setThreadNamePrefix("index-");
        executor.setAllowCoreThreadTimeOut(true); // idle after startup
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
