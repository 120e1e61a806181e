package com.ttennebkram.imageeditor.transforms;

import com.google.gson.JsonObject;
import org.opencv.core.Mat;
import org.opencv.core.Rect;

/**
 * Crop processor.
 * Removes the given margins: the kept box is (left, top) to (width - right, height - bottom).
 * A box that is empty or reaches outside the image is rejected as an invalid parameter.
 */
@TransformInfo(
    operation = OperationKind.CROP,
    description = "Crop margins (T, L, B, R)\nsrc.submat(new Rect(x, y, w, h)).clone()"
)
public class CropProcessor extends TransformProcessorBase {

    private int top;
    private int left;
    private int bottom;
    private int right;

    @Override
    public void configure(JsonObject params) throws InvalidParameterException {
        top = requireInt(params, "top");
        left = requireInt(params, "left");
        bottom = requireInt(params, "bottom");
        right = requireInt(params, "right");
        if (top < 0 || left < 0 || bottom < 0 || right < 0) {
            throw new InvalidParameterException("crop", "Crop margins must not be negative");
        }
    }

    /**
     * The kept region for an image of the given size, or null when the margins leave nothing.
     */
    public Rect cropBox(int width, int height) {
        int rightEdge = width - right;
        int bottomEdge = height - bottom;
        if (rightEdge <= left || bottomEdge <= top) {
            return null;
        }
        return new Rect(left, top, rightEdge - left, bottomEdge - top);
    }

    @Override
    public Mat process(Mat input) {
        Rect roi = cropBox(input.cols(), input.rows());
        if (roi == null) {
            throw new IllegalStateException("Crop box is empty; validate() must reject it first");
        }
        Mat region = input.submat(roi);
        Mat output = region.clone();
        region.release();
        return output;
    }

    @Override
    public void validate(Mat input) throws InvalidParameterException {
        if (cropBox(input.cols(), input.rows()) == null) {
            throw new InvalidParameterException("crop", "Crop box (" + left + ", " + top + ", "
                    + (input.cols() - right) + ", " + (input.rows() - bottom) + ") is empty");
        }
    }

    @Override
    public void describeParameters(JsonObject json) {
        json.addProperty("top", top);
        json.addProperty("left", left);
        json.addProperty("bottom", bottom);
        json.addProperty("right", right);
    }
}
