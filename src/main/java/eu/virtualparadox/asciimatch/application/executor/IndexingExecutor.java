package eu.virtualparadox.asciimatch.application.executor;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Dedicated pool for the startup index build, kept apart from the web request threads.
 */
public class IndexingExecutor extends ThreadPoolTaskExecutor {
}
