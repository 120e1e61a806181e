package com.ttennebkram.imageeditor.transforms;

import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;

/**
 * Multiply with clamp: v * value, saturated to 0-255.
 */
@TransformInfo(
    operation = OperationKind.MULTIPLY,
    description = "Multiply by scalar with saturation\nCore.multiply(src, scalar, dst)"
)
public class MultiplyScalarProcessor extends ScalarArithmeticBase {

    @Override
    protected void apply(Mat input, Scalar operand, Mat output) {
        Core.multiply(input, operand, output);
    }
}
