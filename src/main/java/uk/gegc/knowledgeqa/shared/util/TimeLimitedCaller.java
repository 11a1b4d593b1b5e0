package uk.gegc.knowledgeqa.shared.util;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;
import uk.gegc.knowledgeqa.shared.exception.CallTimeoutException;
import uk.gegc.knowledgeqa.shared.exception.ModelUnavailableException;
import uk.gegc.knowledgeqa.shared.exception.PipelineCancelledException;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a blocking call on the AI call executor and waits for it with a timeout.
 *
 * A timeout cancels the underlying call and surfaces as {@link CallTimeoutException}.
 * Interrupting the waiting thread cancels the call and surfaces as
 * {@link PipelineCancelledException}. A saturated executor rejects the call with
 * {@link ModelUnavailableException}, which the pipelines retry. Runtime exceptions thrown by
 * the call are rethrown as-is.
 */
@Component
@Slf4j
public class TimeLimitedCaller {

    private final AsyncTaskExecutor executor;

    public TimeLimitedCaller(@Qualifier("aiCallExecutor") AsyncTaskExecutor executor) {
        this.executor = executor;
    }

    public <T> T call(String operation, Duration timeout, Callable<T> task) {
        if (Thread.currentThread().isInterrupted()) {
            throw new PipelineCancelledException(operation + " cancelled before it started");
        }

        Future<T> future;
        try {
            future = executor.submit(task);
        } catch (TaskRejectedException e) {
            log.warn("{} rejected: AI call executor is saturated", operation);
            throw new ModelUnavailableException(operation + " rejected: AI call executor is saturated", e);
        }
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("{} exceeded timeout of {} ms", operation, timeout.toMillis());
            throw new CallTimeoutException(operation, timeout);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new PipelineCancelledException(operation + " cancelled", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException(operation + " failed", cause);
        }
    }
}
