package com.ttennebkram.imageeditor.transforms;

import org.opencv.core.Core;
import org.opencv.core.Mat;

/**
 * Boolean XOR as an absolute difference: |a - b|.
 * Black is the identity.
 */
@TransformInfo(
    operation = OperationKind.BOOL_XOR,
    description = "XOR (Difference)\nCore.absdiff(src, solid, dst)"
)
public class BooleanXorProcessor extends SolidColorCompositeBase {

    @Override
    protected Mat composite(Mat input, Mat solid) {
        Mat output = new Mat();
        Core.absdiff(input, solid, output);
        return output;
    }
}
