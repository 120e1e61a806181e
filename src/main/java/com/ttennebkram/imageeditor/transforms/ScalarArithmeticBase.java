package com.ttennebkram.imageeditor.transforms;

import com.google.gson.JsonObject;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;

/**
 * Base class for pointwise arithmetic with a user-supplied scalar.
 * The same scalar is applied to every channel and results saturate to 0-255.
 */
public abstract class ScalarArithmeticBase extends TransformProcessorBase {

    protected double value;

    /**
     * Apply the operation with saturation. Must not modify {@code input}.
     */
    protected abstract void apply(Mat input, Scalar operand, Mat output);

    @Override
    public void configure(JsonObject params) throws InvalidParameterException {
        value = requireDouble(params, "value");
    }

    @Override
    public Mat process(Mat input) {
        Mat output = new Mat();
        apply(input, new Scalar(value, value, value), output);
        return output;
    }

    @Override
    public void describeParameters(JsonObject json) {
        json.addProperty("value", value);
    }
}
