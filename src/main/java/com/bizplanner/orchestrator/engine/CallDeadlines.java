package com.bizplanner.orchestrator.engine;

import com.bizplanner.orchestrator.exception.DeadlineExceededException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs one blocking call on the call pool and stops waiting at its deadline.
 *
 * <p>An overrun raises {@link DeadlineExceededException} and interrupts the
 * worker running the call.
 * Runtime exceptions thrown by the call reach the caller unchanged.
 */
@Slf4j
@Component
public class CallDeadlines {

    private final Executor callExecutor;

    public CallDeadlines(@Qualifier("callExecutor") Executor callExecutor) {
        this.callExecutor = callExecutor;
    }

    public <T> T call(String operation, Duration deadline, Supplier<T> call) {
        FutureTask<T> future = new FutureTask<>(call::get);
        callExecutor.execute(future);
        try {
            return future.get(deadline.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("{} exceeded its deadline of {}ms", operation, deadline.toMillis());
            throw new DeadlineExceededException(operation, deadline);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException(operation + " failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new IllegalStateException(operation + " interrupted", e);
        }
    }
}
