package com.questrail.bamboo.runtime;

import com.questrail.bamboo.style.ScrollbarStyle;
import com.questrail.bamboo.style.WindowStyle;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class BridgeStyleSheetTest
{
    @Test
    void defaultStyleNeedsNoCss() {
        assertEquals("", BridgeStyleSheet.css(WindowStyle.defaults()));
    }

    @Test
    void scrollbarAndSelectionRules() {
        WindowStyle style = WindowStyle.builder()
                .withScrollbar(ScrollbarStyle.OVERLAY)
                .withAllowTextSelection(false)
                .build();

        String css = BridgeStyleSheet.css(style);

        assertTrue(css.startsWith("::-webkit-scrollbar{width:8px"));
        assertTrue(css.endsWith("*{user-select:none;-webkit-user-select:none}"));
    }

    @Test
    void injectionReusesOneStyleElement() {
        String script = BridgeStyleSheet.injectionScript("body{}");

        assertTrue(script.contains("'" + BridgeStyleSheet.ELEMENT_ID + "'"));
        assertTrue(script.contains("el.textContent=`body{}`"));
    }

    @Test
    void templateLiteralMetacharactersAreEscaped() {
        assertEquals("a\\`b\\${c}\\\\", BridgeStyleSheet.escapeTemplateLiteral("a`b${c}\\"));
    }
}
