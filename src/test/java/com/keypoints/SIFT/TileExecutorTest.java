package com.keypoints.SIFT;

import com.keypoints.imageOperation.ChunkBoundary;
import com.keypoints.imageOperation.PixelBuffers;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TileExecutorTest {

    private final ExecutorService pool = Executors.newFixedThreadPool(4);

    @AfterEach
    void shutdown() {
        pool.shutdownNow();
    }

    @Test
    void resultsKeepSubmissionOrder() {
        List<Callable<Integer>> tasks = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            int value = i;
            tasks.add(() -> {
                Thread.sleep((50 - value) % 3);
                return value;
            });
        }

        List<Integer> results = new TileExecutor(pool).invokeAll(tasks);
        for (int i = 0; i < 50; i++) {
            assertThat(results.get(i)).isEqualTo(i);
        }
    }

    @Test
    void inlineRunsOnCallingThread() {
        Thread caller = Thread.currentThread();
        List<Callable<Thread>> tasks = List.of(Thread::currentThread, Thread::currentThread);
        assertThat(TileExecutor.inline().invokeAll(tasks)).containsOnly(caller);
    }

    @Test
    void taskExceptionIsRethrownUnwrapped() {
        List<Callable<Integer>> tasks = List.of(() -> 1, () -> {
            throw new IllegalStateException("tile failed");
        });

        assertThatThrownBy(() -> new TileExecutor(pool).invokeAll(tasks))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("tile failed");
    }

    @Test
    void cancelledExecutorRunsNothing() {
        TileExecutor tiles = new TileExecutor(pool);
        tiles.cancel();
        AtomicInteger ran = new AtomicInteger();

        List<ChunkBoundary> chunks = PixelBuffers.chunkBoundaries(16, 16, 4);
        assertThatThrownBy(() -> tiles.forEachChunk(chunks, chunk -> ran.incrementAndGet()))
                .isInstanceOf(CancellationException.class);
        assertThat(ran).hasValue(0);
        assertThat(tiles.isCancelled()).isTrue();
    }

    @Test
    void forEachChunkVisitsEveryChunk() {
        AtomicInteger area = new AtomicInteger();
        List<ChunkBoundary> chunks = PixelBuffers.chunkBoundaries(10, 7, 3);
        new TileExecutor(pool).forEachChunk(chunks, chunk -> area.addAndGet(chunk.area()));
        assertThat(area).hasValue(70);
    }
}
