package com.ttennebkram.imageeditor.transforms;

import com.google.gson.JsonObject;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;

/**
 * Divide with clamp: v / value, saturated to 0-255.
 * A zero divisor is rejected as an invalid parameter.
 */
@TransformInfo(
    operation = OperationKind.DIVIDE,
    description = "Divide by scalar with saturation\nCore.divide(src, scalar, dst)"
)
public class DivideScalarProcessor extends ScalarArithmeticBase {

    @Override
    public void configure(JsonObject params) throws InvalidParameterException {
        super.configure(params);
        if (value == 0) {
            throw new InvalidParameterException("value", "Division by zero");
        }
    }

    @Override
    protected void apply(Mat input, Scalar operand, Mat output) {
        Core.divide(input, operand, output);
    }
}
