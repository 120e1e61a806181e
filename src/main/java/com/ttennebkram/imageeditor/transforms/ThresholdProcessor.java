package com.ttennebkram.imageeditor.transforms;

import com.google.gson.JsonObject;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

/**
 * Threshold processor.
 * Binarizes the luma with a strict comparison: v > threshold ? 255 : 0,
 * so a pixel equal to the threshold turns black.
 */
@TransformInfo(
    operation = OperationKind.THRESHOLD,
    description = "Binary Threshold\nImgproc.threshold(src, dst, thresh, 255, THRESH_BINARY)"
)
public class ThresholdProcessor extends TransformProcessorBase {

    private double threshold = 128;

    @Override
    public void configure(JsonObject params) throws InvalidParameterException {
        threshold = requireDouble(params, "threshold");
    }

    @Override
    public Mat process(Mat input) {
        Mat gray = GrayscaleProcessor.toGray(input);

        // THRESH_BINARY is dst = src > thresh ? maxval : 0
        Mat thresholded = new Mat();
        Imgproc.threshold(gray, thresholded, threshold, 255, Imgproc.THRESH_BINARY);
        gray.release();

        // Convert back to BGR
        Mat output = new Mat();
        Imgproc.cvtColor(thresholded, output, Imgproc.COLOR_GRAY2BGR);
        thresholded.release();

        return output;
    }

    @Override
    public void describeParameters(JsonObject json) {
        json.addProperty("threshold", threshold);
    }
}
