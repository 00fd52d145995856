package com.questrail.bamboo.bridge.model;

import com.questrail.bamboo.api.ScriptValue;

import java.util.Objects;

/**
 * Either the value or the error of a call reply. Never both.
 */
public sealed interface CallOutcome
{
    record Success(ScriptValue value) implements CallOutcome
    {
        public Success {
            Objects.requireNonNull(value, "value");
        }
    }

    record Failure(String message) implements CallOutcome
    {
        public Failure {
            Objects.requireNonNull(message, "message");
        }
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }
}
