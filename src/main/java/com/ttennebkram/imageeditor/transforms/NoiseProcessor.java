package com.ttennebkram.imageeditor.transforms;

import com.google.gson.JsonObject;
import org.opencv.core.Core;
import org.opencv.core.CvException;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

/**
 * Gaussian noise processor.
 * Generates a gray noise layer centered on 128 with the given strength (standard deviation)
 * and blends it over the input: (1 - mix) * input + mix * noise.
 * With a seed the result is reproducible.
 */
@TransformInfo(
    operation = OperationKind.NOISE,
    description = "Gaussian Noise\nCore.randn(noise, 128, strength)\nCore.addWeighted(src, 1 - mix, noise, mix, 0, dst)"
)
public class NoiseProcessor extends TransformProcessorBase {

    public static final double DEFAULT_STRENGTH = 50.0;
    public static final double DEFAULT_MIX = 0.15;

    private double strength = DEFAULT_STRENGTH;
    private double mix = DEFAULT_MIX;
    private Long seed;

    @Override
    public void configure(JsonObject params) throws InvalidParameterException {
        strength = getDouble(params, "strength", DEFAULT_STRENGTH);
        if (strength < 0) {
            throw new InvalidParameterException("strength", "Noise strength must not be negative: " + strength);
        }
        mix = getDouble(params, "mix", DEFAULT_MIX);
        if (mix < 0 || mix > 1) {
            throw new InvalidParameterException("mix", "Noise mix must be within [0, 1]: " + mix);
        }
        seed = getLong(params, "seed");
    }

    @Override
    public Mat process(Mat input) throws UnsupportedFeatureException {
        Mat noise = new Mat(input.size(), CvType.CV_8UC1);
        try {
            if (seed != null) {
                // OpenCV's default RNG is per thread
                Core.setRNGSeed((int) (seed ^ (seed >>> 32)));
            }
            Core.randn(noise, 128, strength);
        } catch (CvException e) {
            noise.release();
            throw new UnsupportedFeatureException("Noise generation is not supported by this OpenCV build: "
                    + e.getMessage(), e);
        }

        Mat noiseBgr = new Mat();
        Imgproc.cvtColor(noise, noiseBgr, Imgproc.COLOR_GRAY2BGR);
        noise.release();

        Mat output = new Mat();
        Core.addWeighted(input, 1.0 - mix, noiseBgr, mix, 0.0, output);
        noiseBgr.release();
        return output;
    }

    @Override
    public void describeParameters(JsonObject json) {
        json.addProperty("strength", strength);
        json.addProperty("mix", mix);
        if (seed != null) {
            json.addProperty("seed", seed);
        }
    }
}
