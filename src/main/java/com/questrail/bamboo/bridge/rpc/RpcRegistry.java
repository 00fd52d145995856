package com.questrail.bamboo.bridge.rpc;

import com.questrail.bamboo.api.NativeFunction;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Named native functions callable from page script.
 *
 * <p>Binding a name that is already bound replaces the earlier function.
 * Confined to the owner thread.</p>
 */
public final class RpcRegistry
{
    private final Map<String, NativeFunction> functions = new LinkedHashMap<>();

    /**
     * @return the function previously bound under {@code name}, if any
     */
    public Optional<NativeFunction> bind(String name, NativeFunction function) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(function, "function");
        if (name.isBlank()) {
            throw new IllegalArgumentException("function name must not be blank");
        }
        return Optional.ofNullable(functions.put(name, function));
    }

    public boolean unbind(String name) {
        return functions.remove(name) != null;
    }

    public Optional<NativeFunction> lookup(String name) {
        return Optional.ofNullable(functions.get(name));
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(functions.keySet());
    }

    public void clear() {
        functions.clear();
    }
}
