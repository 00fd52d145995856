package com.questrail.bamboo.internal.exec;

/**
 * OwnerThread
 * =============================================================================
 * The single logical thread that owns a window's bridge state.
 *
 * <p>The bridge channel, pending-call table, RPC registry and style model are
 * touched only from this thread. Anything arriving from elsewhere (the script
 * engine's thread, a transport I/O thread, a timer) is posted here first.
 * There are no locks around that state; confinement is the discipline.</p>
 */
public interface OwnerThread
{
    /**
     * Enqueue a task for execution on the owner thread. Tasks run one at a
     * time in submission order.
     */
    void post(Runnable task);

    /**
     * @return {@code true} when the calling thread is the owner thread
     */
    boolean isOwnerThread();

    /**
     * Run the task now if already on the owner thread, otherwise post it.
     */
    default void execute(Runnable task)
    {
        if (isOwnerThread()) {
            task.run();
        }
        else {
            post(task);
        }
    }
}
