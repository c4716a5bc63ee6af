package eu.virtualparadox.ragqa.query.question;

import eu.virtualparadox.ragqa.exception.EPipelinePhase;
import eu.virtualparadox.ragqa.query.QueryRequest;
import eu.virtualparadox.ragqa.query.QueryResult;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CancellationException;

/**
 * State of one question as it moves through the query pipeline.
 * <p>Status only moves forward; a terminal status is final. A cancelled job
 * rejects every further transition and drops a late result.</p>
 */
public class QuestionJob {

    private final long id;
    private final QueryRequest request;
    private final Instant createdAt;

    private volatile EQuestionStatus status;
    private volatile QueryResult result;
    private volatile EPipelinePhase failedPhase;
    private volatile String failureMessage;

    public QuestionJob(final long id, final QueryRequest request) {
        this.id = id;
        this.request = request;
        this.createdAt = Instant.now();
        this.status = EQuestionStatus.RECEIVED;
    }

    public long getId() {
        return id;
    }

    public QueryRequest getRequest() {
        return request;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public EQuestionStatus getStatus() {
        return status;
    }

    public Optional<QueryResult> getResult() {
        return Optional.ofNullable(result);
    }

    public Optional<EPipelinePhase> getFailedPhase() {
        return Optional.ofNullable(failedPhase);
    }

    public Optional<String> getFailureMessage() {
        return Optional.ofNullable(failureMessage);
    }

    public boolean isCancelled() {
        return status == EQuestionStatus.CANCELLED;
    }

    /**
     * Moves the job to a later, non-terminal phase.
     *
     * @throws CancellationException if the job was cancelled
     * @throws IllegalStateException if {@code next} is not after the current status
     */
    public synchronized void advance(final EQuestionStatus next) {
        if (next.isTerminal()) {
            throw new IllegalArgumentException("Use complete, fail or cancel to end a job: " + next);
        }
        moveTo(next);
    }

    /**
     * Stores the result and marks the job COMPLETE.
     *
     * @return {@code false} if the job was cancelled and the result was dropped
     */
    public synchronized boolean complete(final QueryResult queryResult) {
        if (isCancelled()) {
            return false;
        }
        moveTo(EQuestionStatus.COMPLETE);
        this.result = queryResult;
        return true;
    }

    /**
     * Marks the job FAILED. Ignored once the job was cancelled.
     */
    public synchronized void fail(final EPipelinePhase phase, final String message) {
        if (isCancelled()) {
            return;
        }
        moveTo(EQuestionStatus.FAILED);
        this.failedPhase = phase;
        this.failureMessage = message;
    }

    /**
     * @return {@code true} if the job was still running and is now CANCELLED
     */
    public synchronized boolean cancel() {
        if (status.isTerminal()) {
            return false;
        }
        status = EQuestionStatus.CANCELLED;
        return true;
    }

    private void moveTo(final EQuestionStatus next) {
        if (isCancelled()) {
            throw new CancellationException("Question " + id + " was cancelled");
        }
        if (status.isTerminal() || next.ordinal() <= status.ordinal()) {
            throw new IllegalStateException("Question " + id + " cannot move from " + status + " to " + next);
        }
        status = next;
    }
}
