package com.questrail.bamboo.style;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A rectangle of page content that moves the window when dragged.
 *
 * @param draggable {@code false} marks a no-drag hole inside a drag rectangle
 */
public record DragRegion(
        int x,
        int y,
        int width,
        int height,
        @JsonProperty("isDraggable") boolean draggable)
{
    public DragRegion {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("width and height must be >= 0");
        }
    }

    public static DragRegion draggable(int x, int y, int width, int height) {
        return new DragRegion(x, y, width, height, true);
    }

    public static DragRegion hole(int x, int y, int width, int height) {
        return new DragRegion(x, y, width, height, false);
    }

    /**
     * Regions are draggable unless the page says otherwise.
     */
    @JsonCreator
    static DragRegion fromJson(@JsonProperty("x") int x,
                               @JsonProperty("y") int y,
                               @JsonProperty("width") int width,
                               @JsonProperty("height") int height,
                               @JsonProperty("isDraggable") Boolean draggable)
    {
        return new DragRegion(x, y, width, height, draggable == null || draggable);
    }
}
