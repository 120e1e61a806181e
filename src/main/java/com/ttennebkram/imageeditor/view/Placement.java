package com.ttennebkram.imageeditor.view;

/**
 * Where a scaled bitmap goes on the canvas, and how much area the scrollbars cover.
 */
public final class Placement {

    public enum Mode {
        /** Smaller than the viewport on both axes: centered, nothing to scroll. */
        CENTERED,
        /** Too large on at least one axis: pinned to the origin and scrollable. */
        ANCHORED
    }

    private final Mode mode;
    private final double x;
    private final double y;
    private final int scrollWidth;
    private final int scrollHeight;

    public Placement(Mode mode, double x, double y, int scrollWidth, int scrollHeight) {
        this.mode = mode;
        this.x = x;
        this.y = y;
        this.scrollWidth = scrollWidth;
        this.scrollHeight = scrollHeight;
    }

    /**
     * Centered if the scaled image is strictly smaller than the viewport on both axes,
     * otherwise anchored at (0, 0). The scroll region is always the full scaled extent.
     */
    public static Placement compute(int scaledWidth, int scaledHeight, double viewportWidth, double viewportHeight) {
        if (scaledWidth < viewportWidth && scaledHeight < viewportHeight) {
            return new Placement(Mode.CENTERED,
                    (viewportWidth - scaledWidth) / 2.0,
                    (viewportHeight - scaledHeight) / 2.0,
                    scaledWidth, scaledHeight);
        }
        return new Placement(Mode.ANCHORED, 0, 0, scaledWidth, scaledHeight);
    }

    public Mode getMode() {
        return mode;
    }

    public boolean isCentered() {
        return mode == Mode.CENTERED;
    }

    /**
     * Left edge of the image in canvas coordinates.
     */
    public double getX() {
        return x;
    }

    /**
     * Top edge of the image in canvas coordinates.
     */
    public double getY() {
        return y;
    }

    /**
     * Scroll region is (0, 0, scrollWidth, scrollHeight).
     */
    public int getScrollWidth() {
        return scrollWidth;
    }

    public int getScrollHeight() {
        return scrollHeight;
    }

    @Override
    public String toString() {
        return mode + " at (" + x + ", " + y + "), scroll " + scrollWidth + "x" + scrollHeight;
    }
}
