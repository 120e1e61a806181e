package com.ttennebkram.imageeditor.model;

import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

/**
 * The original bitmap as loaded plus the current working bitmap.
 *
 * Both are always CV_8UC3 in BGR order. The working bitmap is replaced wholesale by
 * every edit, never modified in place, so snapshots handed to the history stay valid.
 * Not thread-safe: EditorEngine guards it together with the HistoryStack.
 */
public class RasterBuffer {

    public static final int CANONICAL_TYPE = CvType.CV_8UC3;

    private Mat original;
    private Mat working;

    /**
     * Install a freshly loaded bitmap as both original and working copy.
     * The caller keeps ownership of {@code pixels}.
     */
    public void load(Mat pixels) {
        requireCanonical(pixels);
        release();
        original = pixels.clone();
        working = pixels.clone();
    }

    public boolean isLoaded() {
        return working != null;
    }

    /**
     * Live working bitmap. Callers must not modify or release it.
     */
    public Mat getWorking() {
        return working;
    }

    /**
     * Original bitmap as loaded. Callers must not modify or release it.
     */
    public Mat getOriginal() {
        return original;
    }

    /**
     * Replace the working bitmap, taking ownership of {@code next}.
     */
    public void replaceWorking(Mat next) {
        requireCanonical(next);
        Mat previous = working;
        working = next;
        if (previous != null && previous != next) {
            previous.release();
        }
    }

    /**
     * Set the working bitmap back to a copy of the original.
     */
    public void restoreOriginal() {
        replaceWorking(original.clone());
    }

    public Mat copyWorking() {
        return working == null ? null : working.clone();
    }

    public Mat copyOriginal() {
        return original == null ? null : original.clone();
    }

    public void release() {
        if (original != null) {
            original.release();
            original = null;
        }
        if (working != null) {
            working.release();
            working = null;
        }
    }

    public static boolean isCanonical(Mat mat) {
        return mat != null && !mat.empty() && mat.type() == CANONICAL_TYPE;
    }

    private static void requireCanonical(Mat mat) {
        if (!isCanonical(mat)) {
            throw new IllegalArgumentException("Expected a non-empty CV_8UC3 bitmap, got "
                    + (mat == null ? "null" : mat.empty() ? "empty" : CvType.typeToString(mat.type())));
        }
    }

    /**
     * Convert a bitmap to the canonical 3-channel 8-bit BGR layout.
     * Always returns a new Mat; the input is left untouched.
     *
     * @throws IllegalArgumentException for empty input or a channel count with no BGR equivalent
     */
    public static Mat toCanonical(Mat input) {
        if (input == null || input.empty()) {
            throw new IllegalArgumentException("Bitmap is empty");
        }

        Mat eightBit = input;
        if (input.depth() != CvType.CV_8U) {
            eightBit = new Mat();
            if (input.depth() == CvType.CV_16U) {
                input.convertTo(eightBit, CvType.CV_8U, 1.0 / 257.0);
            } else if (input.depth() == CvType.CV_32F || input.depth() == CvType.CV_64F) {
                // Float data is assumed to be normalised to [0, 1] only if it stays below 1.
                double max = Core.minMaxLoc(input.reshape(1)).maxVal;
                input.convertTo(eightBit, CvType.CV_8U, max <= 1.0 ? 255.0 : 1.0);
            } else {
                input.convertTo(eightBit, CvType.CV_8U);
            }
        }

        Mat output = new Mat();
        try {
            switch (eightBit.channels()) {
                case 1:
                    Imgproc.cvtColor(eightBit, output, Imgproc.COLOR_GRAY2BGR);
                    break;
                case 3:
                    eightBit.copyTo(output);
                    break;
                case 4:
                    Imgproc.cvtColor(eightBit, output, Imgproc.COLOR_BGRA2BGR);
                    break;
                default:
                    output.release();
                    throw new IllegalArgumentException("Unsupported channel count: " + eightBit.channels());
            }
        } finally {
            if (eightBit != input) {
                eightBit.release();
            }
        }
        return output;
    }
}
