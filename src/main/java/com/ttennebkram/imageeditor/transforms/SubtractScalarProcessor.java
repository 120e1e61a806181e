package com.ttennebkram.imageeditor.transforms;

import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;

/**
 * Subtract with clamp: v - value, saturated to 0-255.
 */
@TransformInfo(
    operation = OperationKind.SUBTRACT,
    description = "Subtract scalar with saturation\nCore.subtract(src, scalar, dst)"
)
public class SubtractScalarProcessor extends ScalarArithmeticBase {

    @Override
    protected void apply(Mat input, Scalar operand, Mat output) {
        Core.subtract(input, operand, output);
    }
}
