package com.ttennebkram.imageeditor.engine;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single-flight runner: at most one operation is in progress at a time.
 *
 * Architecture:
 * - submit() runs a task on one daemon worker thread; a second submit while BUSY is
 *   rejected immediately, never queued
 * - the guard returns to IDLE and completes the returned future on the completion
 *   executor (the UI thread in the application), so results arrive in submission order
 * - runExclusive() runs short work on the caller's thread under the same rule
 *
 * There is no cancellation or timeout: an accepted task always runs to completion or failure.
 */
public class ExecutionGuard implements AutoCloseable {

    public enum State {
        IDLE,
        BUSY
    }

    private static final Logger LOG = Logger.getLogger(ExecutionGuard.class.getName());

    private final AtomicReference<State> state = new AtomicReference<>(State.IDLE);
    private final ExecutorService worker;
    private final Executor completionExecutor;
    private volatile String activeLabel;
    private volatile Consumer<Boolean> onBusyChanged;

    /**
     * @param completionExecutor Where completions are delivered, e.g. {@code Platform::runLater}
     */
    public ExecutionGuard(Executor completionExecutor) {
        this.completionExecutor = completionExecutor;
        this.worker = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "Transform-worker");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Called with true when a submitted task starts and false when its completion is delivered.
     * Not called for runExclusive().
     */
    public void setOnBusyChanged(Consumer<Boolean> callback) {
        this.onBusyChanged = callback;
    }

    public State getState() {
        return state.get();
    }

    public boolean isBusy() {
        return state.get() == State.BUSY;
    }

    /**
     * Label of the running operation, or null when idle.
     */
    public String getActiveLabel() {
        return activeLabel;
    }

    /**
     * Run a task on the worker thread.
     *
     * @param label Operation name for logging and rejection messages
     * @param task The work; its exception completes the future exceptionally
     * @return Future completed on the completion executor after the guard is IDLE again
     * @throws BusyRejectedException if another operation is in progress
     */
    public <T> CompletableFuture<T> submit(String label, Callable<T> task) throws BusyRejectedException {
        acquire(label);
        notifyBusy(true);

        CompletableFuture<T> future = new CompletableFuture<>();
        try {
            worker.execute(() -> {
                T result = null;
                Throwable failure = null;
                try {
                    result = task.call();
                } catch (Exception | Error e) {
                    failure = e;
                }
                deliver(label, future, result, failure);
            });
        } catch (RejectedExecutionException e) {
            release();
            notifyBusy(false);
            throw new IllegalStateException("Execution guard is closed", e);
        }
        return future;
    }

    /**
     * Run short work on the calling thread, rejected like submit() while BUSY.
     */
    public <T> T runExclusive(String label, Supplier<T> work) throws BusyRejectedException {
        acquire(label);
        try {
            return work.get();
        } finally {
            release();
        }
    }

    private void acquire(String label) throws BusyRejectedException {
        if (!state.compareAndSet(State.IDLE, State.BUSY)) {
            String running = activeLabel;
            LOG.fine("Rejected " + label + " while " + running + " is running");
            throw new BusyRejectedException(label, running == null ? "another operation" : running);
        }
        activeLabel = label;
    }

    private void release() {
        activeLabel = null;
        state.set(State.IDLE);
    }

    private <T> void deliver(String label, CompletableFuture<T> future, T result, Throwable failure) {
        Runnable completion = () -> {
            release();
            notifyBusy(false);
            if (failure != null) {
                future.completeExceptionally(failure);
            } else {
                future.complete(result);
            }
        };
        try {
            completionExecutor.execute(completion);
        } catch (RuntimeException e) {
            // UI executor gone (toolkit shut down)
            LOG.log(Level.WARNING, "Completion executor rejected " + label + "; completing on worker thread", e);
            completion.run();
        }
    }

    private void notifyBusy(boolean busy) {
        Consumer<Boolean> callback = onBusyChanged;
        if (callback != null) {
            callback.accept(busy);
        }
    }

    /**
     * Stop the worker. A running task is allowed to finish.
     */
    @Override
    public void close() {
        worker.shutdown();
    }
}
