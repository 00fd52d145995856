package com.questrail.bamboo.bridge.pending;

import com.questrail.bamboo.api.ScriptValue;
import com.questrail.bamboo.internal.time.Cancellable;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * One outstanding native-initiated call awaiting its reply.
 *
 * <p>The continuation is a {@link CompletableFuture}; the entry also holds the
 * handle of its armed timeout so that whichever of reply or timeout wins can
 * disarm the other.</p>
 */
public final class PendingCall
{
    private final String id;
    private final String description;
    private final long deadlineNanos;
    private final CompletableFuture<ScriptValue> future;
    private Cancellable timeout = () -> false;

    PendingCall(String id, String description, long deadlineNanos, CompletableFuture<ScriptValue> future) {
        this.id = Objects.requireNonNull(id, "id");
        this.description = Objects.requireNonNull(description, "description");
        this.deadlineNanos = deadlineNanos;
        this.future = Objects.requireNonNull(future, "future");
    }

    public String id() {
        return id;
    }

    /** Human-readable name of the call, used in timeout messages. */
    public String description() {
        return description;
    }

    public long deadlineNanos() {
        return deadlineNanos;
    }

    public CompletableFuture<ScriptValue> future() {
        return future;
    }

    void armTimeout(Cancellable timeout) {
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    void disarm() {
        timeout.cancel();
    }

    @Override
    public String toString() {
        return "PendingCall[" + id + ", " + description + "]";
    }
}
