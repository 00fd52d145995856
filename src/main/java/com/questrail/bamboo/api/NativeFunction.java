package com.questrail.bamboo.api;

import java.util.List;

/**
 * A native function callable from the page via {@code bamboo.call(name, ...args)}.
 *
 * <p>Handlers run on the window's owner thread and must return quickly. A
 * thrown exception becomes an error reply to that one caller.</p>
 */
@FunctionalInterface
public interface NativeFunction
{
    ScriptValue invoke(List<ScriptValue> args) throws Exception;
}
