package com.ttennebkram.imageeditor.transforms;

import com.google.gson.JsonObject;
import org.opencv.core.Core;
import org.opencv.core.Mat;

/**
 * Base class for the factor-driven enhancements (brightness, saturation, contrast, sharpness).
 *
 * Each one interpolates between a "degenerate" image and the input:
 * output = degenerate + factor * (input - degenerate), saturated to 0-255.
 * Factor 1 returns the input, factor 0 returns the degenerate image, and any finite
 * factor is accepted: values below 0 or above 1 extrapolate and clamp.
 */
public abstract class EnhanceProcessorBase extends TransformProcessorBase {

    protected double factor = 1.0;

    /**
     * Build the image that factor 0 produces, same size and type as the input.
     * Caller will release.
     */
    protected abstract Mat createDegenerate(Mat input);

    @Override
    public void configure(JsonObject params) throws InvalidParameterException {
        factor = requireDouble(params, "factor");
    }

    @Override
    public Mat process(Mat input) {
        Mat degenerate = createDegenerate(input);
        Mat output = new Mat();
        Core.addWeighted(input, factor, degenerate, 1.0 - factor, 0.0, output);
        degenerate.release();
        return output;
    }

    @Override
    public void describeParameters(JsonObject json) {
        json.addProperty("factor", factor);
    }
}
