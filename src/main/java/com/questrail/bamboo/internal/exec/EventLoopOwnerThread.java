package com.questrail.bamboo.internal.exec;

import com.questrail.bamboo.internal.time.SystemWallClock;
import com.questrail.bamboo.observability.BridgeErrorEvent;
import com.questrail.bamboo.observability.BridgeObservabilitySink;
import com.questrail.bamboo.observability.NullObservabilitySink;

import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * EventLoopOwnerThread
 * =============================================================================
 * Serialized task loop used as the UI / owner thread.
 *
 * <h2>Threading Model</h2>
 * All tasks are submitted to a queue and executed sequentially by one thread.
 * This gives:
 * <ul>
 *   <li>No concurrent modification of bridge or style state</li>
 *   <li>FIFO ordering of everything posted from a given thread</li>
 *   <li>Atomic handling of each inbound message relative to the others</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   loop.start()                → starts a dedicated "bamboo-ui" thread
 *   loop.runOnCurrentThread()   → or: adopt the calling thread until stop()
 *   loop.post(...)              → enqueue a task (allowed before start)
 *   loop.stop()                 → stop the loop; queued tasks are discarded
 * </pre>
 *
 * <p>A task that throws is reported to the observability sink and the loop
 * keeps running.</p>
 */
public final class EventLoopOwnerThread implements OwnerThread {

    private static final Runnable WAKE = () -> { };

    private final String threadName;
    private final BridgeObservabilitySink observabilitySink;

    private final BlockingQueue<Runnable> taskQueue = new LinkedBlockingQueue<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private volatile Thread ownerThread;
    private volatile boolean dedicated;

    public EventLoopOwnerThread(String threadName, BridgeObservabilitySink observabilitySink)
    {
        this.threadName = Objects.requireNonNull(threadName, "threadName");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    public EventLoopOwnerThread()
    {
        this("bamboo-ui", null);
    }

    /**
     * Starts the loop on a dedicated thread.
     * Idempotent: calling start() multiple times has no effect after the first call.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            Thread t = new Thread(this::runEventLoop, threadName);
            dedicated = true;
            ownerThread = t;
            t.start();
        }
    }

    /**
     * Runs the loop on the calling thread until {@link #stop()} is called.
     *
     * @throws IllegalStateException if the loop is already running
     */
    public void runOnCurrentThread() {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("event loop already running");
        }
        dedicated = false;
        ownerThread = Thread.currentThread();
        runEventLoop();
    }

    /**
     * Stops the loop. When called from a foreign thread and the loop runs on
     * its own dedicated thread, blocks until that thread terminates.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        if (running.compareAndSet(true, false)) {
            taskQueue.offer(WAKE);

            Thread t = ownerThread;
            if (dedicated && t != null && t != Thread.currentThread()) {
                try {
                    t.join(5000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        }
        taskQueue.clear();
    }

    /**
     * Runs {@code task} on the calling thread as if it were the owner. Work the
     * task hands to {@link #execute} runs inline. Used for teardown after the
     * loop has exited or before it ever started.
     *
     * @throws IllegalStateException if the loop is running
     */
    public void runAsOwner(Runnable task) {
        Objects.requireNonNull(task, "task");
        if (running.get()) {
            throw new IllegalStateException("event loop is running");
        }
        Thread previous = ownerThread;
        ownerThread = Thread.currentThread();
        try {
            task.run();
        } finally {
            ownerThread = previous;
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void post(Runnable task) {
        Objects.requireNonNull(task, "task");
        if (!stopped.get()) {
            taskQueue.offer(task);
        }
    }

    @Override
    public boolean isOwnerThread() {
        return Thread.currentThread() == ownerThread;
    }

    private void runEventLoop() {
        while (running.get()) {
            try {
                Runnable task = taskQueue.take();
                if (running.get()) {
                    task.run();
                }
            } catch (InterruptedException e) {
                // Interrupting the owner ends the loop.
                running.set(false);
                Thread.currentThread().interrupt();
                return;
            } catch (Exception e) {
                observabilitySink.onError(new BridgeErrorEvent(
                    SystemWallClock.INSTANCE.now(),
                    "UI task failed",
                    e
                ));
            }
        }
    }
}
