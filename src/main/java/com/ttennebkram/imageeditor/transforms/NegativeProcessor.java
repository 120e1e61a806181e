package com.ttennebkram.imageeditor.transforms;

import com.google.gson.JsonObject;
import org.opencv.core.Core;
import org.opencv.core.Mat;

/**
 * Negative processor.
 * Inverts every channel: 255 - v.
 */
@TransformInfo(
    operation = OperationKind.NEGATIVE,
    description = "Invert (Negate)\nCore.bitwise_not(src, dst)"
)
public class NegativeProcessor extends TransformProcessorBase {

    @Override
    public void configure(JsonObject params) {
        // No parameters
    }

    @Override
    public Mat process(Mat input) {
        Mat output = new Mat();
        Core.bitwise_not(input, output);
        return output;
    }

    @Override
    public void describeParameters(JsonObject json) {
        // No parameters
    }
}
