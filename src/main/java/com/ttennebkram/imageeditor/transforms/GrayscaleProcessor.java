package com.ttennebkram.imageeditor.transforms;

import com.google.gson.JsonObject;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

/**
 * Grayscale processor.
 * Luma conversion, expanded back to three identical channels.
 */
@TransformInfo(
    operation = OperationKind.GRAYSCALE,
    description = "Grayscale\nImgproc.cvtColor(src, dst, COLOR_BGR2GRAY)"
)
public class GrayscaleProcessor extends TransformProcessorBase {

    @Override
    public void configure(JsonObject params) {
        // No parameters
    }

    @Override
    public Mat process(Mat input) {
        Mat gray = toGray(input);
        Mat output = new Mat();
        Imgproc.cvtColor(gray, output, Imgproc.COLOR_GRAY2BGR);
        gray.release();
        return output;
    }

    /**
     * Single-channel luma (0.299 R + 0.587 G + 0.114 B) of a BGR image. Caller releases.
     */
    static Mat toGray(Mat input) {
        Mat gray = new Mat();
        if (input.channels() == 3) {
            Imgproc.cvtColor(input, gray, Imgproc.COLOR_BGR2GRAY);
        } else {
            input.copyTo(gray);
        }
        return gray;
    }

    @Override
    public void describeParameters(JsonObject json) {
        // No parameters
    }
}
