package com.questrail.bamboo.bridge.model;

import java.util.Set;

/**
 * Event and function names the bridge routes internally.
 *
 * <p>An inbound {@code message} whose event is one of {@link #INBOUND} is
 * never forwarded to the host's message callback.</p>
 */
public final class ReservedNames
{
    private ReservedNames() {}

    /** Reply to a native-initiated evaluation or call. */
    public static final String EVAL_RESULT = "__evalResult";

    /** Script invoking a bound native function. */
    public static final String CALL = "__call";

    /** Script requesting a style change. */
    public static final String SET_STYLE = "__setStyle";

    /** Script replacing the drag regions. */
    public static final String SET_DRAG_REGIONS = "__setDragRegions";

    /** Script issuing a window command. */
    public static final String WINDOW_OP = "__windowOp";

    /** Native to script: a context menu was requested under the CUSTOM policy. */
    public static final String CONTEXT_MENU = "__contextMenu";

    /** Function name the page uses for {@code captureScreenshot()}. */
    public static final String CAPTURE_SCREENSHOT = "__captureScreenshot";

    /** Native to script: the full style model after a change. */
    public static final String STYLE_CHANGED = "styleChanged";

    public static final Set<String> INBOUND = Set.of(EVAL_RESULT, CALL, SET_STYLE, SET_DRAG_REGIONS, WINDOW_OP);

    public static boolean isReserved(String eventName) {
        return INBOUND.contains(eventName);
    }
}
