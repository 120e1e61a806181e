package com.ttennebkram.imageeditor.transforms;

import com.google.gson.JsonObject;
import org.opencv.core.Core;
import org.opencv.core.Mat;

import java.util.Locale;

/**
 * Flip processor.
 * Mirrors horizontally (axis "H") or vertically (axis "V").
 */
@TransformInfo(
    operation = OperationKind.FLIP,
    description = "Flip\nCore.flip(src, dst, flipCode)"
)
public class FlipProcessor extends TransformProcessorBase {

    public enum Axis {
        HORIZONTAL(1),
        VERTICAL(0);

        private final int flipCode;

        Axis(int flipCode) {
            this.flipCode = flipCode;
        }

        public int getFlipCode() {
            return flipCode;
        }

        public String getCode() {
            return this == HORIZONTAL ? "H" : "V";
        }
    }

    private Axis axis = Axis.HORIZONTAL;

    @Override
    public void configure(JsonObject params) throws InvalidParameterException {
        String value = requireString(params, "axis").toUpperCase(Locale.ROOT);
        switch (value) {
            case "H":
            case "HORIZONTAL":
                axis = Axis.HORIZONTAL;
                break;
            case "V":
            case "VERTICAL":
                axis = Axis.VERTICAL;
                break;
            default:
                throw new InvalidParameterException("axis", "Unknown flip axis: " + value);
        }
    }

    @Override
    public Mat process(Mat input) {
        Mat output = new Mat();
        Core.flip(input, output, axis.getFlipCode());
        return output;
    }

    @Override
    public void describeParameters(JsonObject json) {
        json.addProperty("axis", axis.getCode());
    }
}
