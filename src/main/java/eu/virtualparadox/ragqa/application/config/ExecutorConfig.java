package eu.virtualparadox.ragqa.application.config;

import eu.virtualparadox.ragqa.application.executor.GatewayExecutor;
import eu.virtualparadox.ragqa.application.executor.IngestionExecutor;
import eu.virtualparadox.ragqa.application.executor.QuestionExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ExecutorConfig {

    @Bean
    public IngestionExecutor ingestionExecutor(final ApplicationConfig config) {
        final int threads = config.getExecutors().getIngestionThreads();
        IngestionExecutor executor = new IngestionExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(Integer.MAX_VALUE); // unlimited queue
        executor.setThreadNamePrefix("ingest-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }

    @Bean
    public QuestionExecutor questionExecutor(final ApplicationConfig config) {
        final int threads = config.getExecutors().getQuestionThreads();
        QuestionExecutor executor = new QuestionExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("question-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }

    /**
     * Pool for embedding, index and chat model calls, apart from the workers that wait on them.
     */
    @Bean
    public GatewayExecutor gatewayExecutor(final ApplicationConfig config) {
        final int threads = config.getExecutors().getGatewayThreads();
        GatewayExecutor executor = new GatewayExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("gateway-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
