package com.ttennebkram.imageeditor.view;

import org.opencv.core.Mat;

/**
 * A scaled bitmap ready for the canvas plus its placement.
 * The receiver owns {@code image} and must release it.
 */
public final class RenderFrame {

    private final Mat image;
    private final Placement placement;
    private final double zoomScale;
    private final boolean original;

    public RenderFrame(Mat image, Placement placement, double zoomScale, boolean original) {
        this.image = image;
        this.placement = placement;
        this.zoomScale = zoomScale;
        this.original = original;
    }

    public Mat getImage() {
        return image;
    }

    public Placement getPlacement() {
        return placement;
    }

    public double getZoomScale() {
        return zoomScale;
    }

    /**
     * True when this frame shows the original (peek) rather than the working bitmap.
     */
    public boolean isOriginal() {
        return original;
    }

    public void release() {
        image.release();
    }
}
