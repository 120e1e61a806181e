package com.ttennebkram.imageeditor.transforms;

import com.google.gson.JsonObject;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

/**
 * Highpass processor.
 * Fixed 3x3 kernel, scale 1, offset 0, OpenCV's default border (reflect 101).
 * Results are saturated to 0-255, so flat regions go black.
 */
@TransformInfo(
    operation = OperationKind.HIGHPASS,
    description = "Highpass 3x3\nImgproc.filter2D(src, dst, -1, [-1 -1 -1; -1 8 -1; -1 -1 -1])"
)
public class HighpassProcessor extends TransformProcessorBase {

    private static final float[] KERNEL = {
            -1, -1, -1,
            -1,  8, -1,
            -1, -1, -1
    };

    @Override
    public void configure(JsonObject params) {
        // Fixed kernel
    }

    @Override
    public Mat process(Mat input) {
        Mat kernel = new Mat(3, 3, CvType.CV_32F);
        kernel.put(0, 0, KERNEL);

        Mat output = new Mat();
        Imgproc.filter2D(input, output, -1, kernel);
        kernel.release();

        return output;
    }

    @Override
    public void describeParameters(JsonObject json) {
        // No parameters
    }
}
