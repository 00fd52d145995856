package com.questrail.bamboo.bridge.pending;

import com.questrail.bamboo.api.ScriptValue;
import com.questrail.bamboo.internal.time.Cancellable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * PendingCallTable
 * =============================================================================
 * Outstanding native-initiated calls keyed by id.
 *
 * <h2>At-most-once resolution</h2>
 * An entry is removed by the first of {@link #complete}, {@link #fail} or
 * {@link #rejectAll} to reach it. Every later {@code complete} or {@code fail}
 * for the same id finds nothing and returns an empty {@link Optional}, so the
 * continuation runs exactly once.
 *
 * <h2>Threading</h2>
 * Confined to the owner thread. There is no locking; callers marshal onto the
 * owner thread before touching the table.
 */
public final class PendingCallTable
{
    private final Map<String, PendingCall> entries = new LinkedHashMap<>();

    /**
     * Register a new entry.
     *
     * @throws IllegalStateException if {@code id} is already pending
     */
    public PendingCall register(String id,
                                String description,
                                long deadlineNanos,
                                CompletableFuture<ScriptValue> continuation) {
        Objects.requireNonNull(id, "id");
        if (entries.containsKey(id)) {
            throw new IllegalStateException("Call id already pending: " + id);
        }
        PendingCall call = new PendingCall(id, description, deadlineNanos, continuation);
        entries.put(id, call);
        return call;
    }

    /**
     * Attach the timeout handle for a registered entry. If the entry has
     * already been settled the handle is cancelled immediately.
     */
    public void armTimeout(String id, Cancellable timeout) {
        PendingCall call = entries.get(id);
        if (call == null) {
            timeout.cancel();
            return;
        }
        call.armTimeout(timeout);
    }

    /**
     * @return the settled entry, or empty if {@code id} was not pending
     */
    public Optional<PendingCall> complete(String id, ScriptValue value) {
        Objects.requireNonNull(value, "value");
        Optional<PendingCall> call = take(id);
        call.ifPresent(c -> c.future().complete(value));
        return call;
    }

    /**
     * @param failure builds the exception from the entry being failed
     * @return the settled entry, or empty if {@code id} was not pending
     */
    public Optional<PendingCall> fail(String id, Function<PendingCall, ? extends Throwable> failure) {
        Objects.requireNonNull(failure, "failure");
        Optional<PendingCall> call = take(id);
        call.ifPresent(c -> c.future().completeExceptionally(failure.apply(c)));
        return call;
    }

    /**
     * Fail every outstanding entry and empty the table.
     *
     * @return the ids that were rejected, in registration order
     */
    public List<String> rejectAll(Function<PendingCall, ? extends Throwable> failure) {
        List<PendingCall> all = new ArrayList<>(entries.values());
        entries.clear();

        List<String> ids = new ArrayList<>(all.size());
        for (PendingCall c : all) {
            c.disarm();
            c.future().completeExceptionally(failure.apply(c));
            ids.add(c.id());
        }
        return ids;
    }

    public boolean contains(String id) {
        return entries.containsKey(id);
    }

    public int size() {
        return entries.size();
    }

    private Optional<PendingCall> take(String id) {
        PendingCall call = entries.remove(id);
        if (call == null) {
            return Optional.empty();
        }
        call.disarm();
        return Optional.of(call);
    }
}
