package eu.virtualparadox.ragqa.application.executor;

import eu.virtualparadox.ragqa.exception.PipelineException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Pool on which calls to the embedding model, the similarity index and the generative model run.
 * <p>The calling worker waits for at most the given timeout. A call that overruns is cancelled
 * and surfaces as the phase-specific {@link PipelineException} produced by {@code onFailure};
 * whatever it returns later is dropped.</p>
 */
public class GatewayExecutor extends ThreadPoolTaskExecutor {

    /**
     * Runs {@code call} on this pool and waits for its result.
     *
     * @param timeout   maximum wait
     * @param call      the external call
     * @param onFailure maps a timeout, interruption or call failure to the phase exception
     * @param <T>       result type
     * @return the call's result
     * @throws PipelineException when the call fails, is rejected or does not finish in time
     */
    public <T> T callWithin(final Duration timeout,
                            final Callable<T> call,
                            final Function<Exception, ? extends PipelineException> onFailure) {
        final Future<T> future;
        try {
            future = submit(call);
        } catch (final RejectedExecutionException e) {
            throw onFailure.apply(e);
        }

        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (final TimeoutException e) {
            future.cancel(true);
            throw onFailure.apply(e);
        } catch (final InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw onFailure.apply(e);
        } catch (final ExecutionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof PipelineException pipelineException) {
                throw pipelineException;
            }
            throw onFailure.apply(cause instanceof Exception ex ? ex : e);
        }
    }
}
