package com.ttennebkram.imageeditor.view;

/**
 * Current zoom of the canvas. 1.0 is 100%.
 * No lower or upper bound is enforced; each step multiplies or divides by the zoom step.
 */
public class ViewportState {

    public static final double DEFAULT_ZOOM_STEP = 1.1;

    private final double zoomStep;
    private volatile double zoomScale = 1.0;

    public ViewportState() {
        this(DEFAULT_ZOOM_STEP);
    }

    public ViewportState(double zoomStep) {
        if (!(zoomStep > 1.0)) {
            throw new IllegalArgumentException("zoomStep must be greater than 1: " + zoomStep);
        }
        this.zoomStep = zoomStep;
    }

    public double getZoomScale() {
        return zoomScale;
    }

    public double getZoomStep() {
        return zoomStep;
    }

    public void zoomIn() {
        zoomScale *= zoomStep;
    }

    public void zoomOut() {
        zoomScale /= zoomStep;
    }

    public void resetZoom() {
        zoomScale = 1.0;
    }

    /**
     * Zoom as a whole percentage, truncated (110.0000001% shows as 110).
     */
    public int getZoomPercent() {
        return (int) (zoomScale * 100 + 1e-9);
    }
}
