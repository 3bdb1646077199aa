package com.slotmonitor.sync;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * A long-running loop submitted to an executor. {@link #completion()} settles when the loop returns or throws;
 * {@link #cancel()} interrupts the thread running it.
 */
final class LoopHandle {

    private final String name;
    private final CompletableFuture<Void> completion;
    private final Future<?> future;

    private LoopHandle(String name, CompletableFuture<Void> completion, Future<?> future) {
        this.name = name;
        this.completion = completion;
        this.future = future;
    }

    static LoopHandle start(String name, Runnable loop, ExecutorService executor) {
        CompletableFuture<Void> completion = new CompletableFuture<>();
        Future<?> future = executor.submit(() -> {
            try {
                loop.run();
                completion.complete(null);
            } catch (Throwable t) {
                completion.completeExceptionally(t);
            }
        });
        return new LoopHandle(name, completion, future);
    }

    String name() {
        return name;
    }

    CompletableFuture<Void> completion() {
        return completion;
    }

    void cancel() {
        future.cancel(true);
    }
}
