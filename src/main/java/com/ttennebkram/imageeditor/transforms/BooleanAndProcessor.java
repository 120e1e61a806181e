package com.ttennebkram.imageeditor.transforms;

import org.opencv.core.Core;
import org.opencv.core.Mat;

/**
 * Boolean AND as a multiply blend: a * b / 255, rounded to the nearest integer
 * (200 against 200 gives 157, not the truncated 156).
 * White is the identity, black yields black.
 */
@TransformInfo(
    operation = OperationKind.BOOL_AND,
    description = "AND (Multiply)\nCore.multiply(src, solid, dst, 1.0 / 255)"
)
public class BooleanAndProcessor extends SolidColorCompositeBase {

    @Override
    protected Mat composite(Mat input, Mat solid) {
        Mat output = new Mat();
        Core.multiply(input, solid, output, 1.0 / 255.0);
        return output;
    }
}
