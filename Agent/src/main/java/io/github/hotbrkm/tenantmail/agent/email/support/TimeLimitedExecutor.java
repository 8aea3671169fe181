package io.github.hotbrkm.tenantmail.agent.email.support;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a blocking call on a helper thread and waits at most the given timeout for it.
 * The caller's thread is the one that gives up; the helper is interrupted on timeout.
 */
@Slf4j
public class TimeLimitedExecutor implements AutoCloseable {

    private final ExecutorService executor;

    public TimeLimitedExecutor(String threadNamePrefix) {
        this.executor = Executors.newCachedThreadPool(new NamedThreadFactory(threadNamePrefix));
    }

    public <T> T call(String operation, Callable<T> task, Duration timeout) {
        Future<T> future = executor.submit(task);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Bounded call timed out. operation={}, timeoutMs={}", operation, timeout.toMillis());
            throw new CallTimeoutException(operation, timeout);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new CompletionException(operation + " failed", cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for " + operation, e);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
