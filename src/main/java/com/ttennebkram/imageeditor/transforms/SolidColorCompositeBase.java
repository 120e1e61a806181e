package com.ttennebkram.imageeditor.transforms;

import com.google.gson.JsonObject;
import com.ttennebkram.imageeditor.model.BooleanColor;
import org.opencv.core.Mat;

/**
 * Base class for the two-operand boolean composites.
 * The second operand is a solid image of the configured color at the input's exact size.
 */
public abstract class SolidColorCompositeBase extends TransformProcessorBase {

    protected BooleanColor color = BooleanColor.RED;

    /**
     * Blend the input against the solid operand.
     * Both inputs are CV_8UC3 of the same size; neither may be modified.
     *
     * @return A new output Mat (caller will release)
     */
    protected abstract Mat composite(Mat input, Mat solid);

    @Override
    public void configure(JsonObject params) throws InvalidParameterException {
        if (!params.has("color")) {
            color = BooleanColor.RED;
            return;
        }
        try {
            color = BooleanColor.fromJson(params.get("color"));
        } catch (IllegalArgumentException e) {
            throw new InvalidParameterException("color", e.getMessage(), e);
        }
    }

    @Override
    public Mat process(Mat input) {
        Mat solid = createSolid(input);
        try {
            return composite(input, solid);
        } finally {
            solid.release();
        }
    }

    /**
     * Solid operand matching input's dimensions and type.
     */
    protected Mat createSolid(Mat input) {
        return new Mat(input.size(), input.type(), color.toScalar());
    }

    @Override
    public void describeParameters(JsonObject json) {
        json.add("color", color.toJson());
    }
}
