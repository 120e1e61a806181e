package com.ttennebkram.imageeditor.transforms;

import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;

/**
 * Add with clamp: v + value, saturated to 0-255.
 */
@TransformInfo(
    operation = OperationKind.ADD,
    description = "Add scalar with saturation\nCore.add(src, scalar, dst)"
)
public class AddScalarProcessor extends ScalarArithmeticBase {

    @Override
    protected void apply(Mat input, Scalar operand, Mat output) {
        Core.add(input, operand, output);
    }
}
