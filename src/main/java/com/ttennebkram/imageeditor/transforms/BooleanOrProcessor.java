package com.ttennebkram.imageeditor.transforms;

import org.opencv.core.Core;
import org.opencv.core.Mat;

/**
 * Boolean OR as a screen blend: 255 - (255 - a) * (255 - b) / 255, with the product
 * rounded to the nearest integer (200 against 200 gives 243).
 * Black is the identity, white yields white.
 */
@TransformInfo(
    operation = OperationKind.BOOL_OR,
    description = "OR (Screen)\n~(Core.multiply(~src, ~solid, dst, 1.0 / 255))"
)
public class BooleanOrProcessor extends SolidColorCompositeBase {

    @Override
    protected Mat composite(Mat input, Mat solid) {
        Mat invertedInput = new Mat();
        Mat invertedSolid = new Mat();
        Core.bitwise_not(input, invertedInput);
        Core.bitwise_not(solid, invertedSolid);

        Mat product = new Mat();
        Core.multiply(invertedInput, invertedSolid, product, 1.0 / 255.0);
        invertedInput.release();
        invertedSolid.release();

        Mat output = new Mat();
        Core.bitwise_not(product, output);
        product.release();
        return output;
    }
}
