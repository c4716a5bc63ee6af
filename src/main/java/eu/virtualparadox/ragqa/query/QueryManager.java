package eu.virtualparadox.ragqa.query;

import eu.virtualparadox.ragqa.application.config.ApplicationConfig;
import eu.virtualparadox.ragqa.application.executor.GatewayExecutor;
import eu.virtualparadox.ragqa.application.executor.QuestionExecutor;
import eu.virtualparadox.ragqa.exception.EmbeddingUnavailableException;
import eu.virtualparadox.ragqa.exception.EmptyContextException;
import eu.virtualparadox.ragqa.exception.GenerationUnavailableException;
import eu.virtualparadox.ragqa.exception.PipelineException;
import eu.virtualparadox.ragqa.exception.RetrievalUnavailableException;
import eu.virtualparadox.ragqa.query.question.QuestionJob;
import eu.virtualparadox.ragqa.query.question.QuestionRegistry;
import eu.virtualparadox.ragqa.rag.answer.AnswerGenerator;
import eu.virtualparadox.ragqa.rag.context.AssembledContext;
import eu.virtualparadox.ragqa.rag.context.ContextAssembler;
import eu.virtualparadox.ragqa.rag.context.EEmptyContextPolicy;
import eu.virtualparadox.ragqa.rag.embed.EmbeddingService;
import eu.virtualparadox.ragqa.rag.retriever.model.RetrievedMatch;
import eu.virtualparadox.ragqa.rag.retriever.service.RetrieverService;
import eu.virtualparadox.ragqa.util.DurationUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StopWatch;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

import static eu.virtualparadox.ragqa.query.question.EQuestionStatus.*;

/**
 * Answers questions: embed the question, retrieve similar chunks, assemble the context, generate.
 * <p>
 * Every external call runs on the {@link GatewayExecutor} with its configured timeout. A failure
 * stops the query in the phase it happened, is logged once here and surfaces as the phase's
 * {@link PipelineException}; for asynchronous questions it is recorded on the {@link QuestionJob}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public final class QueryManager {

    private static final long UNTRACKED_JOB_ID = 0L;

    private final EmbeddingService embeddingService;
    private final RetrieverService retrieverService;
    private final ContextAssembler contextAssembler;
    private final AnswerGenerator answerGenerator;
    private final QuestionRegistry registry;
    private final QuestionExecutor questionExecutor;
    private final GatewayExecutor gatewayExecutor;
    private final ApplicationConfig config;

    /**
     * Answers a question with the configured retrieval defaults.
     */
    public QueryResult ask(final String question) {
        return ask(QueryRequest.of(question, config));
    }

    /**
     * Answers a question on the calling thread.
     *
     * @throws PipelineException if a phase fails or times out
     */
    public QueryResult ask(final QueryRequest request) {
        return process(new QuestionJob(UNTRACKED_JOB_ID, request));
    }

    /**
     * Queues a question on the question executor.
     *
     * @return the registered job, to be polled with {@link #getJob(long)}
     */
    public QuestionJob submitQuery(final QueryRequest request) {
        final QuestionJob job = registry.createJob(request);
        questionExecutor.execute(() -> {
            try {
                process(job);
            } catch (CancellationException | PipelineException e) {
                // already logged and recorded on the job
                log.debug("Question {} ended early: {}", job.getId(), e.getMessage());
            } catch (RuntimeException e) {
                log.error("Question {} failed unexpectedly", job.getId(), e);
            }
        });
        return job;
    }

    public Optional<QuestionJob> getJob(final long jobId) {
        return registry.getJob(jobId);
    }

    /**
     * Releases a finished question from the registry.
     *
     * @return {@code true} if the job existed and had finished
     */
    public boolean forget(final long jobId) {
        return registry.remove(jobId);
    }

    /**
     * Cancels a running question. Whatever the running phase produces afterwards is dropped.
     *
     * @return {@code true} if the job existed and was still running
     */
    public boolean cancel(final long jobId) {
        final boolean cancelled = registry.getJob(jobId).map(QuestionJob::cancel).orElse(false);
        if (cancelled) {
            log.info("Question {} cancelled", jobId);
        }
        return cancelled;
    }

    private QueryResult process(final QuestionJob job) {
        final long started = System.nanoTime();
        final QueryRequest request = job.getRequest();
        final StopWatch stopWatch = new StopWatch("question-" + job.getId());
        try {
            job.advance(EMBEDDING);
            stopWatch.start("embedding");
            final Duration embeddingTimeout = config.getTimeouts().getEmbedding();
            final float[] queryVector = gatewayExecutor.callWithin(embeddingTimeout,
                    () -> embeddingService.embedQuery(request.question()),
                    e -> new EmbeddingUnavailableException(describe("Embedding the question", embeddingTimeout, e), e));
            stopWatch.stop();
            final double embeddingMs = DurationUtils.toMillis(stopWatch.lastTaskInfo().getTimeNanos());

            job.advance(RETRIEVING);
            stopWatch.start("retrieval");
            final Duration retrievalTimeout = config.getTimeouts().getRetrieval();
            final List<RetrievedMatch> matches = gatewayExecutor.callWithin(retrievalTimeout,
                    () -> retrieverService.retrieve(queryVector, request.topK(), request.scoreThreshold()),
                    e -> new RetrievalUnavailableException(describe("Retrieval", retrievalTimeout, e), e));
            stopWatch.stop();
            final double retrievalMs = DurationUtils.toMillis(stopWatch.lastTaskInfo().getTimeNanos());

            job.advance(ASSEMBLING);
            AssembledContext context;
            try {
                context = contextAssembler.assemble(matches);
            } catch (EmptyContextException e) {
                if (config.getContext().getEmptyPolicy() == EEmptyContextPolicy.ANSWER_DIRECTLY) {
                    log.info("Question {}: no chunk reached score {}, answering without generation",
                            job.getId(), request.scoreThreshold());
                    return finish(job, config.getContext().getNoInformationAnswer(), List.of(),
                            new QueryTiming(embeddingMs, retrievalMs, 0.0, DurationUtils.toMillis(System.nanoTime() - started)));
                }
                log.info("Question {}: no chunk reached score {}, generating without context",
                        job.getId(), request.scoreThreshold());
                context = AssembledContext.empty();
            }

            job.advance(GENERATING);
            stopWatch.start("generation");
            final Duration generationTimeout = config.getTimeouts().getGeneration();
            final String contextText = context.text();
            final String answer = gatewayExecutor.callWithin(generationTimeout,
                    () -> answerGenerator.generate(request.question(), contextText),
                    e -> new GenerationUnavailableException(describe("Generation", generationTimeout, e), e));
            stopWatch.stop();
            final double generationMs = DurationUtils.toMillis(stopWatch.lastTaskInfo().getTimeNanos());

            final QueryTiming timing = new QueryTiming(embeddingMs, retrievalMs, generationMs,
                    DurationUtils.toMillis(System.nanoTime() - started));
            log.debug("Question {} timings:\n{}", job.getId(), stopWatch.prettyPrint());
            return finish(job, answer, context.sources(), timing);
        } catch (CancellationException e) {
            log.info("Question {} stopped after cancellation", job.getId());
            throw e;
        } catch (PipelineException e) {
            log.error("Question {} failed in phase {}: {}", job.getId(), e.getPhase(), e.getMessage(), e);
            job.fail(e.getPhase(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("Question {} failed", job.getId(), e);
            job.fail(null, e.getMessage());
            throw e;
        }
    }

    private QueryResult finish(final QuestionJob job,
                               final String answer,
                               final List<RetrievedMatch> sources,
                               final QueryTiming timing) {
        final QueryResult result = new QueryResult(answer, sources, timing);
        if (!job.complete(result)) {
            log.info("Question {} was cancelled, dropping its result", job.getId());
            throw new CancellationException("Question " + job.getId() + " was cancelled");
        }
        log.info("Question {} answered from {} chunks in {} ms", job.getId(), sources.size(), timing.totalMs());
        return result;
    }

    private static String describe(final String call, final Duration timeout, final Exception e) {
        if (e instanceof TimeoutException) {
            return call + " timed out after " + timeout.toMillis() + " ms";
        }
        return call + " failed: " + e.getMessage();
    }
}
