package com.questrail.bamboo.script;

import com.questrail.bamboo.api.ScriptValue;

/**
 * Evaluates script text sent by the native side with {@code evalRemote}.
 */
@FunctionalInterface
public interface ScriptEvaluator
{
    /**
     * @throws Exception if the script throws; the message becomes the error reply
     */
    ScriptValue evaluate(String script) throws Exception;
}
