package com.ttennebkram.imageeditor.transforms;

import com.google.gson.JsonObject;
import org.opencv.core.Core;
import org.opencv.core.Mat;

/**
 * Boolean NOT.
 * Full per-channel invert; the boolean color is ignored.
 */
@TransformInfo(
    operation = OperationKind.BOOL_NOT,
    description = "NOT (Invert)\nCore.bitwise_not(src, dst)"
)
public class BooleanNotProcessor extends TransformProcessorBase {

    @Override
    public void configure(JsonObject params) {
        // The boolean color is not used by NOT
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
