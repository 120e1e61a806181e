package com.ttennebkram.imageeditor.transforms;

import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

/**
 * Saturation processor.
 * Interpolates against the image's own grayscale version.
 */
@TransformInfo(
    operation = OperationKind.SATURATION,
    description = "Saturation\nCore.addWeighted(src, factor, gray, 1 - factor, 0, dst)"
)
public class SaturationProcessor extends EnhanceProcessorBase {

    @Override
    protected Mat createDegenerate(Mat input) {
        Mat gray = GrayscaleProcessor.toGray(input);
        Mat grayBgr = new Mat();
        Imgproc.cvtColor(gray, grayBgr, Imgproc.COLOR_GRAY2BGR);
        gray.release();
        return grayBgr;
    }
}
