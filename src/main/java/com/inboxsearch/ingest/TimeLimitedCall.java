package com.inboxsearch.ingest;

import java.io.IOException;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a blocking provider call under a deadline. Timeouts and I/O failures surface as
 * {@link TransientProviderException}; unchecked failures from the call propagate unchanged.
 */
public final class TimeLimitedCall {
    private TimeLimitedCall() {
    }

    public static ExecutorService daemonExecutor(String threadName) {
        return Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, threadName);
            thread.setDaemon(true);
            return thread;
        });
    }

    public static <T> T call(ExecutorService executor, long timeoutMs, String operation, Callable<T> task) {
        if (executor == null || timeoutMs <= 0) {
            return callDirect(operation, task);
        }
        Future<T> future = executor.submit(task);
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TransientProviderException(operation + " timed out after " + timeoutMs + " ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ProviderUnavailableException(operation + " interrupted", e);
        } catch (ExecutionException e) {
            throw translate(operation, e.getCause());
        }
    }

    private static <T> T callDirect(String operation, Callable<T> task) {
        try {
            return task.call();
        } catch (Exception e) {
            throw translate(operation, e);
        }
    }

    private static RuntimeException translate(String operation, Throwable cause) {
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        if (cause instanceof IOException) {
            return new TransientProviderException(operation + " failed: " + cause.getMessage(), cause);
        }
        return new IllegalStateException(operation + " failed", cause);
    }
}
