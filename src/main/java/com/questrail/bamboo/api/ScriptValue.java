package com.questrail.bamboo.api;

import java.util.Objects;
import java.util.Optional;

/**
 * ScriptValue
 * =============================================================================
 * A value crossing the script/native boundary.
 *
 * <p>Only scalars cross: absent (null/undefined), boolean, number and text.
 * Structured data travels as a JSON string inside {@link Text}.</p>
 */
public sealed interface ScriptValue
        permits ScriptValue.Absent, ScriptValue.Bool, ScriptValue.Num, ScriptValue.Text
{
    ScriptValue ABSENT = new Absent();

    record Absent() implements ScriptValue {}

    record Bool(boolean value) implements ScriptValue {}

    record Num(double value) implements ScriptValue {}

    record Text(String value) implements ScriptValue
    {
        public Text {
            Objects.requireNonNull(value, "value");
        }
    }

    static ScriptValue absent() {
        return ABSENT;
    }

    static ScriptValue of(boolean value) {
        return new Bool(value);
    }

    static ScriptValue of(double value) {
        return new Num(value);
    }

    /**
     * @return a {@link Text} value, or {@link #ABSENT} for {@code null}
     */
    static ScriptValue of(String value) {
        return value == null ? ABSENT : new Text(value);
    }

    default boolean isAbsent() {
        return this instanceof Absent;
    }

    default Optional<Boolean> asBoolean() {
        return this instanceof Bool b ? Optional.of(b.value()) : Optional.empty();
    }

    default Optional<Double> asNumber() {
        return this instanceof Num n ? Optional.of(n.value()) : Optional.empty();
    }

    default Optional<String> asText() {
        return this instanceof Text t ? Optional.of(t.value()) : Optional.empty();
    }
}
