package com.questrail.bamboo.runtime;

import com.questrail.bamboo.style.ScrollbarStyle;
import com.questrail.bamboo.style.WindowStyle;

/**
 * Page-level parts of the style model, rendered as CSS.
 *
 * <p>Scrollbar appearance and text selection cannot be set on the native
 * window, so they are injected into the page as a {@code <style>} element with
 * id {@value #ELEMENT_ID}. Re-injection replaces the element's text.</p>
 */
public final class BridgeStyleSheet
{
    public static final String ELEMENT_ID = "__bamboo_s";

    private static final String HIDDEN_SCROLLBARS =
            "::-webkit-scrollbar{display:none}*{-ms-overflow-style:none;scrollbar-width:none}";
    private static final String OVERLAY_SCROLLBARS =
            "::-webkit-scrollbar{width:8px;height:8px}"
            + "::-webkit-scrollbar-track{background:transparent}"
            + "::-webkit-scrollbar-thumb{background:rgba(0,0,0,.3);border-radius:4px}";
    private static final String NO_SELECTION = "*{user-select:none;-webkit-user-select:none}";

    private BridgeStyleSheet() {}

    public static String css(WindowStyle style) {
        StringBuilder css = new StringBuilder();
        if (style.scrollbar() == ScrollbarStyle.HIDDEN) {
            css.append(HIDDEN_SCROLLBARS);
        } else if (style.scrollbar() == ScrollbarStyle.OVERLAY) {
            css.append(OVERLAY_SCROLLBARS);
        }
        if (!style.allowTextSelection()) {
            css.append(NO_SELECTION);
        }
        return css.toString();
    }

    /**
     * Script that creates or updates the style element with the given CSS.
     */
    public static String injectionScript(String css) {
        return "(function(){var id='" + ELEMENT_ID + "',el=document.getElementById(id);"
                + "if(!el){el=document.createElement('style');el.id=id;document.head.appendChild(el)}"
                + "el.textContent=`" + escapeTemplateLiteral(css) + "`;})();";
    }

    static String escapeTemplateLiteral(String s) {
        return s.replace("\\", "\\\\").replace("`", "\\`").replace("${", "\\${");
    }
}
