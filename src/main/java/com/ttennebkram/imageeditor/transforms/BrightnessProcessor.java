package com.ttennebkram.imageeditor.transforms;

import org.opencv.core.Mat;

/**
 * Brightness processor.
 * Interpolates against black, i.e. scales every channel by the factor.
 */
@TransformInfo(
    operation = OperationKind.BRIGHTNESS,
    description = "Brightness\nCore.addWeighted(src, factor, black, 1 - factor, 0, dst)"
)
public class BrightnessProcessor extends EnhanceProcessorBase {

    @Override
    protected Mat createDegenerate(Mat input) {
        return Mat.zeros(input.size(), input.type());
    }
}
