package com.keypoints.SIFT;

import com.keypoints.imageOperation.ChunkBoundary;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Runs independent tasks on a pool and waits for all of them before returning.
 * Results come back in submission order, so merging is deterministic.
 */
public class TileExecutor {
    private final ExecutorService service;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /**
     * @param service pool to run on, or null to run every task on the calling thread.
     */
    public TileExecutor(ExecutorService service) {
        this.service = service;
    }

    public static TileExecutor inline() {
        return new TileExecutor(null);
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public <T> List<T> invokeAll(List<Callable<T>> tasks) {
        List<Callable<T>> guarded = new ArrayList<>(tasks.size());
        for (Callable<T> task : tasks) {
            guarded.add(() -> {
                checkCancelled();
                return task.call();
            });
        }

        List<T> results = new ArrayList<>(tasks.size());
        if (service == null) {
            for (Callable<T> task : guarded) {
                try {
                    results.add(task.call());
                } catch (RuntimeException | Error e) {
                    throw e;
                } catch (Exception e) {
                    throw new IllegalStateException("Task failed", e);
                }
            }
            return results;
        }

        try {
            // invokeAll() returns when all tasks are complete
            for (Future<T> future : service.invokeAll(guarded)) {
                results.add(future.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for tiles");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            if (cause instanceof Error) throw (Error) cause;
            throw new IllegalStateException("Task failed", cause);
        }
        return results;
    }

    /** Applies {@code work} to every chunk, returns once all chunks are written. */
    public void forEachChunk(List<ChunkBoundary> chunks, Consumer<ChunkBoundary> work) {
        List<Callable<Void>> tasks = new ArrayList<>(chunks.size());
        for (ChunkBoundary chunk : chunks) {
            tasks.add(() -> {
                work.accept(chunk);
                return null;
            });
        }
        invokeAll(tasks);
    }

    private void checkCancelled() {
        if (cancelled.get() || Thread.currentThread().isInterrupted()) {
            throw new CancellationException("SIFT pipeline cancelled");
        }
    }
}
