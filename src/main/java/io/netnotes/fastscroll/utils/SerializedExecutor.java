package io.netnotes.fastscroll.utils;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * An executor that guarantees serial execution semantics on a single
 * daemon thread. Tasks are executed one at a time in submission order,
 * with each task completing before the next begins.
 */
public final class SerializedExecutor {

    private static final class Task {
        final Runnable runnable;
        final CompletableFuture<Void> future;

        Task(Runnable runnable, CompletableFuture<Void> future) {
            this.runnable = runnable;
            this.future = future;
        }
    }

    private final BlockingQueue<Task> queue = new LinkedBlockingQueue<>();

    public SerializedExecutor(String name) {
        Thread dispatcher = new Thread(this::dispatchLoop, name);
        dispatcher.setDaemon(true);
        dispatcher.start();
    }

    private void dispatchLoop() {
        try {
            while (!Thread.currentThread().isInterrupted()) {
                runTask(queue.take());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void runTask(Task task) {
        if (task.future.isCancelled()) {
            return;
        }
        try {
            task.runnable.run();
            task.future.complete(null);
        } catch (Throwable t) {
            task.future.completeExceptionally(t);
        }
    }

    /**
     * @return a future completed when the task has run, or completed
     *         exceptionally with whatever the task threw
     */
    public CompletableFuture<Void> execute(Runnable runnable) {
        CompletableFuture<Void> future = new CompletableFuture<>();
        queue.add(new Task(runnable, future));
        return future;
    }
}
