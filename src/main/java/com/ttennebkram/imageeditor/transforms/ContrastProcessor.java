package com.ttennebkram.imageeditor.transforms;

import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;

/**
 * Contrast processor.
 * Interpolates against a flat gray at the image's mean luma.
 */
@TransformInfo(
    operation = OperationKind.CONTRAST,
    description = "Contrast\nCore.addWeighted(src, factor, meanGray, 1 - factor, 0, dst)"
)
public class ContrastProcessor extends EnhanceProcessorBase {

    @Override
    protected Mat createDegenerate(Mat input) {
        Mat gray = GrayscaleProcessor.toGray(input);
        int mean = (int) (Core.mean(gray).val[0] + 0.5);
        gray.release();
        return new Mat(input.size(), input.type(), new Scalar(mean, mean, mean));
    }
}
