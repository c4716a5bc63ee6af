package eu.virtualparadox.ragqa.application.executor;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Worker pool for asynchronously submitted questions, one task per question. */
public class QuestionExecutor extends ThreadPoolTaskExecutor {
}
