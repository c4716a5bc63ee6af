package eu.virtualparadox.ragqa.application.executor;

import eu.virtualparadox.ragqa.exception.EmptyContextException;
import eu.virtualparadox.ragqa.exception.RetrievalUnavailableException;
import eu.virtualparadox.ragqa.testsupport.TestExecutors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class GatewayExecutorTest {

    private final GatewayExecutor executor = TestExecutors.gateway();

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    @DisplayName("Returns the result of a call that finishes in time")
    void resultInTime() {
        String result = executor.callWithin(Duration.ofSeconds(5), () -> "ok",
                e -> new RetrievalUnavailableException("unexpected", e));
        assertEquals("ok", result);
    }

    @Test
    @DisplayName("An overrunning call is interrupted and mapped to the phase exception")
    void timeout() throws InterruptedException {
        CountDownLatch interrupted = new CountDownLatch(1);

        RetrievalUnavailableException e = assertThrows(RetrievalUnavailableException.class,
                () -> executor.callWithin(Duration.ofMillis(100), () -> {
                    try {
                        Thread.sleep(5_000);
                    } catch (InterruptedException ie) {
                        interrupted.countDown();
                    }
                    return "late";
                }, ex -> new RetrievalUnavailableException("timed out", ex)));

        assertInstanceOf(TimeoutException.class, e.getCause());
        assertTrue(interrupted.await(2, TimeUnit.SECONDS), "the call should be interrupted");
    }

    @Test
    @DisplayName("Other failures are mapped, pipeline exceptions pass through unchanged")
    void failures() {
        RetrievalUnavailableException mapped = assertThrows(RetrievalUnavailableException.class,
                () -> executor.callWithin(Duration.ofSeconds(5), () -> {
                    throw new IllegalStateException("boom");
                }, ex -> new RetrievalUnavailableException("failed", ex)));
        assertInstanceOf(IllegalStateException.class, mapped.getCause());

        assertThrows(EmptyContextException.class,
                () -> executor.callWithin(Duration.ofSeconds(5), () -> {
                    throw new EmptyContextException("nothing");
                }, ex -> new RetrievalUnavailableException("failed", ex)));
    }
}
