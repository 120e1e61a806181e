package com.ttennebkram.imageeditor.view;

import com.ttennebkram.imageeditor.engine.EditorEngine;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

/**
 * Turns bitmaps into canvas frames: scales by the current zoom, decides centered vs.
 * scrollable placement, and handles the press-and-hold comparison with the original.
 *
 * Rendering never changes the engine's state. Peeking only swaps what is drawn.
 */
public class ViewCompositor {

    // Below this the canvas hasn't been laid out yet
    private static final double MIN_VIEWPORT = 10;

    private final ViewportState viewport;
    private final double fallbackWidth;
    private final double fallbackHeight;
    private boolean peeking;

    public ViewCompositor(ViewportState viewport, double fallbackWidth, double fallbackHeight) {
        this.viewport = viewport;
        this.fallbackWidth = fallbackWidth;
        this.fallbackHeight = fallbackHeight;
    }

    public ViewportState getViewport() {
        return viewport;
    }

    /**
     * Scale a bitmap by the current zoom and place it in the viewport.
     *
     * @param bitmap Source (not modified or released)
     * @return Frame owning a new scaled Mat, or null for a null/empty bitmap
     */
    public RenderFrame render(Mat bitmap, double viewportWidth, double viewportHeight) {
        return render(bitmap, viewportWidth, viewportHeight, false);
    }

    private RenderFrame render(Mat bitmap, double viewportWidth, double viewportHeight, boolean original) {
        if (bitmap == null || bitmap.empty()) {
            return null;
        }
        if (viewportWidth < MIN_VIEWPORT) {
            viewportWidth = fallbackWidth;
            viewportHeight = fallbackHeight;
        }

        double zoom = viewport.getZoomScale();
        int scaledWidth = scaledExtent(bitmap.cols(), zoom);
        int scaledHeight = scaledExtent(bitmap.rows(), zoom);

        Mat scaled = new Mat();
        if (scaledWidth == bitmap.cols() && scaledHeight == bitmap.rows()) {
            bitmap.copyTo(scaled);
        } else {
            Imgproc.resize(bitmap, scaled, new Size(scaledWidth, scaledHeight), 0, 0, Imgproc.INTER_LANCZOS4);
        }

        Placement placement = Placement.compute(scaledWidth, scaledHeight, viewportWidth, viewportHeight);
        return new RenderFrame(scaled, placement, zoom, original);
    }

    /**
     * Truncated scaled size, never below one pixel.
     */
    static int scaledExtent(int extent, double zoom) {
        long scaled = (long) (extent * zoom);
        return (int) Math.max(1, Math.min(Integer.MAX_VALUE, scaled));
    }

    /**
     * Render the engine's working bitmap.
     */
    public RenderFrame renderWorking(EditorEngine engine, double viewportWidth, double viewportHeight) {
        Mat working = engine.copyWorking();
        if (working == null) {
            return null;
        }
        try {
            return render(working, viewportWidth, viewportHeight, false);
        } finally {
            working.release();
        }
    }

    /**
     * Render the original while the compare button is held.
     */
    public RenderFrame beginPeek(EditorEngine engine, double viewportWidth, double viewportHeight) {
        Mat original = engine.copyOriginal();
        if (original == null) {
            return null;
        }
        peeking = true;
        try {
            return render(original, viewportWidth, viewportHeight, true);
        } finally {
            original.release();
        }
    }

    /**
     * Stop peeking and render the working bitmap again.
     */
    public RenderFrame endPeek(EditorEngine engine, double viewportWidth, double viewportHeight) {
        peeking = false;
        return renderWorking(engine, viewportWidth, viewportHeight);
    }

    public boolean isPeeking() {
        return peeking;
    }

    /**
     * Render whatever should be on screen now: the original while peeking, otherwise the working bitmap.
     */
    public RenderFrame renderCurrent(EditorEngine engine, double viewportWidth, double viewportHeight) {
        if (peeking) {
            Mat original = engine.copyOriginal();
            if (original != null) {
                try {
                    return render(original, viewportWidth, viewportHeight, true);
                } finally {
                    original.release();
                }
            }
        }
        return renderWorking(engine, viewportWidth, viewportHeight);
    }

    public RenderFrame zoomIn(EditorEngine engine, double viewportWidth, double viewportHeight) {
        viewport.zoomIn();
        return renderCurrent(engine, viewportWidth, viewportHeight);
    }

    public RenderFrame zoomOut(EditorEngine engine, double viewportWidth, double viewportHeight) {
        viewport.zoomOut();
        return renderCurrent(engine, viewportWidth, viewportHeight);
    }

    public void resetZoom() {
        viewport.resetZoom();
    }

    public int getZoomPercent() {
        return viewport.getZoomPercent();
    }
}
