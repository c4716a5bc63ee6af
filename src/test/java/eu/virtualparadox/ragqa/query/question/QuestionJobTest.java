package eu.virtualparadox.ragqa.query.question;

import eu.virtualparadox.ragqa.exception.EPipelinePhase;
import eu.virtualparadox.ragqa.query.QueryRequest;
import eu.virtualparadox.ragqa.query.QueryResult;
import eu.virtualparadox.ragqa.query.QueryTiming;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.*;

class QuestionJobTest {

    private static final QueryResult RESULT = new QueryResult("answer", List.of(), new QueryTiming(1, 2, 3, 6));

    private static QuestionJob newJob() {
        return new QuestionJob(1, new QueryRequest("question?", 5, 0.5));
    }

    @Test
    @DisplayName("A job walks through every phase to COMPLETE")
    void forwardTransitions() {
        QuestionJob job = newJob();
        assertEquals(EQuestionStatus.RECEIVED, job.getStatus());

        job.advance(EQuestionStatus.EMBEDDING);
        job.advance(EQuestionStatus.RETRIEVING);
        job.advance(EQuestionStatus.ASSEMBLING);
        job.advance(EQuestionStatus.GENERATING);
        assertTrue(job.complete(RESULT));

        assertEquals(EQuestionStatus.COMPLETE, job.getStatus());
        assertSame(RESULT, job.getResult().orElseThrow());
    }

    @Test
    @DisplayName("Re-entering or going back to a phase is rejected")
    void noBackwardTransitions() {
        QuestionJob job = newJob();
        job.advance(EQuestionStatus.RETRIEVING);

        assertThrows(IllegalStateException.class, () -> job.advance(EQuestionStatus.RETRIEVING));
        assertThrows(IllegalStateException.class, () -> job.advance(EQuestionStatus.EMBEDDING));
        assertThrows(IllegalArgumentException.class, () -> job.advance(EQuestionStatus.COMPLETE));
    }

    @Test
    @DisplayName("FAILED is reachable from any running phase and is final")
    void failIsTerminal() {
        QuestionJob job = newJob();
        job.advance(EQuestionStatus.EMBEDDING);
        job.fail(EPipelinePhase.EMBEDDING, "model crashed");

        assertEquals(EQuestionStatus.FAILED, job.getStatus());
        assertEquals(EPipelinePhase.EMBEDDING, job.getFailedPhase().orElseThrow());
        assertEquals("model crashed", job.getFailureMessage().orElseThrow());
        assertThrows(IllegalStateException.class, () -> job.advance(EQuestionStatus.RETRIEVING));
        assertThrows(IllegalStateException.class, () -> job.complete(RESULT));
    }

    @Test
    @DisplayName("A cancelled job drops late results and refuses further phases")
    void cancel() {
        QuestionJob job = newJob();
        job.advance(EQuestionStatus.GENERATING);

        assertTrue(job.cancel());
        assertFalse(job.cancel());
        assertFalse(job.complete(RESULT));
        job.fail(EPipelinePhase.GENERATING, "ignored");

        assertEquals(EQuestionStatus.CANCELLED, job.getStatus());
        assertTrue(job.getResult().isEmpty());
        assertTrue(job.getFailedPhase().isEmpty());
        assertThrows(CancellationException.class, () -> job.advance(EQuestionStatus.GENERATING));
    }

    @Test
    @DisplayName("Finished jobs can be removed from the registry, running ones cannot")
    void registryRemove() {
        QuestionRegistry registry = new QuestionRegistry();
        QuestionJob running = registry.createJob(new QueryRequest("first?", 5, 0.5));
        QuestionJob done = registry.createJob(new QueryRequest("second?", 5, 0.5));
        done.complete(RESULT);

        assertNotEquals(running.getId(), done.getId());
        assertFalse(registry.remove(running.getId()));
        assertTrue(registry.remove(done.getId()));
        assertTrue(registry.getJob(done.getId()).isEmpty());
        assertTrue(registry.getJob(running.getId()).isPresent());
    }
}
