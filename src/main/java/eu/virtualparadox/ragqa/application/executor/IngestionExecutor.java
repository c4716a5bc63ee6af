package eu.virtualparadox.ragqa.application.executor;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Worker pool for asynchronous document ingestion. */
public class IngestionExecutor extends ThreadPoolTaskExecutor {
}
