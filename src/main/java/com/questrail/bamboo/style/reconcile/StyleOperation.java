package com.questrail.bamboo.style.reconcile;

import com.questrail.bamboo.platform.PlatformCapabilityProvider;
import com.questrail.bamboo.style.WindowStyle;

import java.util.List;

/**
 * StyleOperation
 * =============================================================================
 * The platform operations the reconciler issues, in the order it issues them.
 *
 * <h2>Ordering</h2>
 * Declaration order is execution order. The structural chrome-mode change
 * comes first because the window's style bits determine how later
 * operations (corner radius on a borderless window, resize handles, window
 * buttons) take effect.
 *
 * <h2>Keys</h2>
 * Each operation projects the fields it reads into a key. The reconciler
 * skips an operation whose key equals the one it last applied, which is what
 * makes repeated application of an identical style free. Operations marked
 * {@link #dependsOnFrame()} are re-issued whenever the chrome-mode operation
 * actually ran in the same pass, because a frame change can reset the bits
 * they set.
 */
public enum StyleOperation
{
    CHROME_MODE(false) {
        @Override
        Object key(WindowStyle s) {
            return List.of(s.chromeMode(), s.titlebar(), s.resizable());
        }

        @Override
        void invoke(PlatformCapabilityProvider p, WindowStyle s) {
            p.setChromeMode(s.chromeMode(), s.titlebar(), s.resizable());
        }
    },

    TITLEBAR_BUTTONS(true) {
        @Override
        Object key(WindowStyle s) {
            return s.titlebar().buttonPosition();
        }

        @Override
        void invoke(PlatformCapabilityProvider p, WindowStyle s) {
            s.titlebar().buttonPosition().ifPresent(p::setTitlebarButtonPosition);
        }
    },

    TRANSPARENCY(false) {
        @Override
        Object key(WindowStyle s) {
            return List.of(s.transparent(), s.backgroundOpacity());
        }

        @Override
        void invoke(PlatformCapabilityProvider p, WindowStyle s) {
            p.setTransparent(s.transparent(), s.backgroundOpacity());
        }
    },

    BACKGROUND_COLOR(false) {
        @Override
        Object key(WindowStyle s) {
            return s.backgroundColor();
        }

        @Override
        void invoke(PlatformCapabilityProvider p, WindowStyle s) {
            p.setBackgroundColor(s.backgroundColor());
        }
    },

    MACOS_VIBRANCY(false) {
        @Override
        Object key(WindowStyle s) {
            return s.macosVibrancy();
        }

        @Override
        void invoke(PlatformCapabilityProvider p, WindowStyle s) {
            p.setMacOSVibrancy(s.macosVibrancy());
        }
    },

    WINDOWS_MATERIAL(false) {
        @Override
        Object key(WindowStyle s) {
            return s.windowsMaterial();
        }

        @Override
        void invoke(PlatformCapabilityProvider p, WindowStyle s) {
            p.setWindowsMaterial(s.windowsMaterial());
        }
    },

    SHADOW(false) {
        @Override
        Object key(WindowStyle s) {
            return s.shadow();
        }

        @Override
        void invoke(PlatformCapabilityProvider p, WindowStyle s) {
            p.setShadow(s.shadow());
        }
    },

    CORNER_RADIUS(true) {
        @Override
        Object key(WindowStyle s) {
            return s.cornerRadius();
        }

        @Override
        void invoke(PlatformCapabilityProvider p, WindowStyle s) {
            p.setCornerRadius(s.cornerRadius());
        }
    },

    RESIZABLE(true) {
        @Override
        Object key(WindowStyle s) {
            return s.resizable();
        }

        @Override
        void invoke(PlatformCapabilityProvider p, WindowStyle s) {
            p.setResizable(s.resizable());
        }
    },

    WINDOW_BUTTONS(true) {
        @Override
        Object key(WindowStyle s) {
            return List.of(s.minimizable(), s.maximizable());
        }

        @Override
        void invoke(PlatformCapabilityProvider p, WindowStyle s) {
            p.setWindowButtons(s.minimizable(), s.maximizable());
        }
    },

    ALWAYS_ON_TOP(false) {
        @Override
        Object key(WindowStyle s) {
            return s.alwaysOnTop();
        }

        @Override
        void invoke(PlatformCapabilityProvider p, WindowStyle s) {
            p.setAlwaysOnTop(s.alwaysOnTop());
        }
    },

    SKIP_TASKBAR(false) {
        @Override
        Object key(WindowStyle s) {
            return s.skipTaskbar();
        }

        @Override
        void invoke(PlatformCapabilityProvider p, WindowStyle s) {
            p.setSkipTaskbar(s.skipTaskbar());
        }
    },

    DRAG_REGIONS(false) {
        @Override
        Object key(WindowStyle s) {
            return s.dragRegions();
        }

        @Override
        void invoke(PlatformCapabilityProvider p, WindowStyle s) {
            p.setDragRegions(s.dragRegions());
        }
    };

    private final boolean dependsOnFrame;

    StyleOperation(boolean dependsOnFrame) {
        this.dependsOnFrame = dependsOnFrame;
    }

    /**
     * @return {@code true} if a chrome-mode change can invalidate this operation's effect
     */
    public boolean dependsOnFrame() {
        return dependsOnFrame;
    }

    /** Projection of the fields this operation reads. */
    abstract Object key(WindowStyle style);

    abstract void invoke(PlatformCapabilityProvider provider, WindowStyle style);
}
