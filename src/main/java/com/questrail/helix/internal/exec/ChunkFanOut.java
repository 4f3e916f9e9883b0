package com.questrail.helix.internal.exec;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;

/**
 * ChunkFanOut
 * =============================================================================
 * Runs an independent task per chunk on an {@link Executor} and joins the
 * results in input order.
 *
 * <h2>Ordering</h2>
 * <p>Result {@code i} always corresponds to input {@code i}, regardless of the
 * order in which workers complete. The join is the only synchronization point;
 * workers share no mutable state.</p>
 *
 * <h2>Executor Ownership</h2>
 * <p>This class does <strong>not</strong> own or manage the lifecycle of the
 * provided executor. Callers are responsible for shutdown.</p>
 *
 * <h2>Failure and Cancellation</h2>
 * <ul>
 *   <li>Per-chunk failures that the caller wants collected must be captured by
 *       the task itself and returned as values.</li>
 *   <li>Anything a task throws is unexpected and is rethrown on the joining
 *       thread once all earlier results have been joined.</li>
 *   <li>If the joining thread is interrupted, outstanding tasks are cancelled,
 *       the interrupt flag is restored and {@link CancellationException} is
 *       thrown. Tasks are pure, so abandoning them leaves nothing behind.</li>
 * </ul>
 */
public final class ChunkFanOut
{
    /** Runs every task on the calling thread. */
    public static final Executor CALLER_THREAD = Runnable::run;

    private final Executor executor;

    public ChunkFanOut(Executor executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Task applied to one input, given its position.
     */
    @FunctionalInterface
    public interface ChunkTask<T, R> {
        R apply(int position, T input);
    }

    /**
     * Applies {@code task} to every input and returns the results in input order.
     */
    public <T, R> List<R> map(List<T> inputs, ChunkTask<? super T, ? extends R> task) {
        Objects.requireNonNull(inputs, "inputs");
        Objects.requireNonNull(task, "task");

        final List<CompletableFuture<R>> futures = new ArrayList<>(inputs.size());
        for (int i = 0; i < inputs.size(); i++) {
            final int position = i;
            final T input = inputs.get(i);
            futures.add(CompletableFuture.supplyAsync(() -> task.apply(position, input), executor));
        }

        final List<R> results = new ArrayList<>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            try {
                results.add(futures.get(i).get());
            }
            catch (InterruptedException e) {
                cancelFrom(futures, i);
                Thread.currentThread().interrupt();
                final CancellationException cancelled =
                        new CancellationException("Interrupted while joining chunk " + i + " of " + futures.size());
                cancelled.initCause(e);
                throw cancelled;
            }
            catch (ExecutionException e) {
                cancelFrom(futures, i + 1);
                throw rethrow(e.getCause());
            }
        }
        return results;
    }

    private static void cancelFrom(List<? extends CompletableFuture<?>> futures, int from) {
        for (int i = from; i < futures.size(); i++) {
            futures.get(i).cancel(false);
        }
    }

    private static RuntimeException rethrow(Throwable cause) {
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new IllegalStateException("Chunk task failed", cause);
    }
}
