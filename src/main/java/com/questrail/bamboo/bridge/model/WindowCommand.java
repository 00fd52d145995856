package com.questrail.bamboo.bridge.model;

import com.questrail.bamboo.api.ScriptValue;

import java.util.Optional;

/**
 * The fixed window-command vocabulary accepted from page script.
 */
public enum WindowCommand
{
    MINIMIZE("minimize", ValueKind.NONE),
    MAXIMIZE("maximize", ValueKind.NONE),
    RESTORE("restore", ValueKind.NONE),
    CLOSE("close", ValueKind.NONE),
    SET_TITLE("setTitle", ValueKind.TEXT),
    ALWAYS_ON_TOP("alwaysOnTop", ValueKind.BOOLEAN),
    FULLSCREEN("fullscreen", ValueKind.BOOLEAN),
    ZOOM("zoom", ValueKind.NUMBER),
    /** Value is the docked flag. */
    DEV_TOOLS("devTools", ValueKind.BOOLEAN),
    PRINT("print", ValueKind.NONE);

    public enum ValueKind
    {
        NONE, TEXT, BOOLEAN, NUMBER;

        /**
         * @return whether {@code value} can carry this kind; anything is
         *         accepted by {@link #NONE}
         */
        public boolean accepts(ScriptValue value) {
            return switch (this) {
                case NONE -> true;
                case TEXT -> value instanceof ScriptValue.Text;
                case BOOLEAN -> value instanceof ScriptValue.Bool;
                case NUMBER -> value instanceof ScriptValue.Num;
            };
        }
    }

    private final String wireName;
    private final ValueKind valueKind;

    WindowCommand(String wireName, ValueKind valueKind) {
        this.wireName = wireName;
        this.valueKind = valueKind;
    }

    public String wireName() {
        return wireName;
    }

    public ValueKind valueKind() {
        return valueKind;
    }

    public static Optional<WindowCommand> fromWire(String op) {
        for (WindowCommand c : values()) {
            if (c.wireName.equals(op)) {
                return Optional.of(c);
            }
        }
        return Optional.empty();
    }
}
