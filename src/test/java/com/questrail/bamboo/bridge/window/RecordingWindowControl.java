package com.questrail.bamboo.bridge.window;

import java.util.ArrayList;
import java.util.List;

/**
 * Window control that records each command as a string.
 */
public final class RecordingWindowControl implements WindowControl {

    private final List<String> commands = new ArrayList<>();

    public List<String> commands() {
        return List.copyOf(commands);
    }

    @Override
    public void minimize() {
        commands.add("minimize");
    }

    @Override
    public void maximize() {
        commands.add("maximize");
    }

    @Override
    public void restore() {
        commands.add("restore");
    }

    @Override
    public void close() {
        commands.add("close");
    }

    @Override
    public void setTitle(String title) {
        commands.add("setTitle " + title);
    }

    @Override
    public void setAlwaysOnTop(boolean alwaysOnTop) {
        commands.add("setAlwaysOnTop " + alwaysOnTop);
    }

    @Override
    public void setFullscreen(boolean fullscreen) {
        commands.add("setFullscreen " + fullscreen);
    }

    @Override
    public void setZoom(double factor) {
        commands.add("setZoom " + factor);
    }

    @Override
    public void openDevTools(boolean docked) {
        commands.add("openDevTools " + docked);
    }

    @Override
    public void print() {
        commands.add("print");
    }
}
