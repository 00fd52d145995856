package com.questrail.bamboo.exec;

import com.questrail.bamboo.internal.exec.OwnerThread;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Owner thread for single-threaded tests: every caller counts as the owner,
 * so {@code execute} runs inline. Anything explicitly {@link #post posted} is
 * queued until {@link #runPending()}.
 */
public final class InlineOwnerThread implements OwnerThread {

    private final Deque<Runnable> posted = new ArrayDeque<>();

    @Override
    public void post(Runnable task) {
        posted.add(task);
    }

    @Override
    public boolean isOwnerThread() {
        return true;
    }

    public void runPending() {
        Runnable task;
        while ((task = posted.poll()) != null) {
            task.run();
        }
    }

    public int pendingTasks() {
        return posted.size();
    }
}
