package com.ttennebkram.imageeditor.transforms;

import com.google.gson.JsonObject;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

/**
 * Rotate processor.
 * Rotates counter-clockwise by the angle in degrees and grows the canvas to the rotated
 * bounding box so nothing is clipped. Uncovered corners are black.
 */
@TransformInfo(
    operation = OperationKind.ROTATE,
    description = "Rotate (expand canvas)\nImgproc.getRotationMatrix2D(center, angle, 1)\nImgproc.warpAffine(src, dst, M, boundingSize)"
)
public class RotateProcessor extends TransformProcessorBase {

    // Absorbs floating point error so a 90 degree turn of 4x2 is 2x4, not 3x5
    private static final double EXTENT_EPSILON = 1e-6;

    private double angle;

    @Override
    public void configure(JsonObject params) throws InvalidParameterException {
        angle = requireDouble(params, "angle");
    }

    @Override
    public Mat process(Mat input) {
        int width = input.cols();
        int height = input.rows();

        double radians = Math.toRadians(angle);
        double cos = Math.abs(Math.cos(radians));
        double sin = Math.abs(Math.sin(radians));
        int newWidth = Math.max(1, (int) Math.ceil(width * cos + height * sin - EXTENT_EPSILON));
        int newHeight = Math.max(1, (int) Math.ceil(width * sin + height * cos - EXTENT_EPSILON));

        // Rotate about the pixel-grid center, then move that center to the new canvas center
        Point center = new Point((width - 1) / 2.0, (height - 1) / 2.0);
        Mat M = Imgproc.getRotationMatrix2D(center, angle, 1.0);
        double[] row0 = M.get(0, 2);
        double[] row1 = M.get(1, 2);
        M.put(0, 2, row0[0] + (newWidth - 1) / 2.0 - center.x);
        M.put(1, 2, row1[0] + (newHeight - 1) / 2.0 - center.y);

        Mat output = new Mat();
        Imgproc.warpAffine(input, output, M, new Size(newWidth, newHeight), Imgproc.INTER_NEAREST,
                Core.BORDER_CONSTANT, new Scalar(0, 0, 0));
        M.release();

        return output;
    }

    @Override
    public void describeParameters(JsonObject json) {
        json.addProperty("angle", angle);
    }
}
