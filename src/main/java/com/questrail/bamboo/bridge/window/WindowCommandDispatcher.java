package com.questrail.bamboo.bridge.window;

import com.questrail.bamboo.api.ScriptValue;
import com.questrail.bamboo.bridge.model.BridgeMessage;
import com.questrail.bamboo.bridge.model.WindowCommand;

import java.util.Objects;
import java.util.Optional;

/**
 * WindowCommandDispatcher
 * =============================================================================
 * Maps a {@link BridgeMessage.WindowOp} onto {@link WindowControl}.
 *
 * <p>The dispatcher holds no state. A command whose value does not match its
 * {@link WindowCommand#valueKind()} does nothing.</p>
 */
public final class WindowCommandDispatcher
{
    private final WindowControl control;

    public WindowCommandDispatcher(WindowControl control) {
        this.control = Objects.requireNonNull(control, "control");
    }

    /**
     * @return {@code true} if the op named a known command and it was invoked
     */
    public boolean dispatch(BridgeMessage.WindowOp op) {
        Objects.requireNonNull(op, "op");
        Optional<WindowCommand> command = op.command();
        if (command.isEmpty()) {
            return false;
        }
        return dispatch(command.get(), op.value());
    }

    public boolean dispatch(WindowCommand command, ScriptValue value) {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(value, "value");

        if (!command.valueKind().accepts(value)) {
            return false;
        }

        switch (command) {
            case MINIMIZE -> control.minimize();
            case MAXIMIZE -> control.maximize();
            case RESTORE -> control.restore();
            case CLOSE -> control.close();
            case PRINT -> control.print();
            case SET_TITLE -> control.setTitle(value.asText().orElseThrow());
            case ALWAYS_ON_TOP -> control.setAlwaysOnTop(value.asBoolean().orElseThrow());
            case FULLSCREEN -> control.setFullscreen(value.asBoolean().orElseThrow());
            case ZOOM -> control.setZoom(value.asNumber().orElseThrow());
            case DEV_TOOLS -> control.openDevTools(value.asBoolean().orElseThrow());
        }
        return true;
    }
}
