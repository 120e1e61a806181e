package com.ttennebkram.imageeditor.transforms;

import com.google.gson.JsonObject;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;

/**
 * Translate processor.
 * Moves the content by (tx, ty) pixels; positive values move right and down.
 * Output keeps the input size and vacated pixels are black.
 */
@TransformInfo(
    operation = OperationKind.TRANSLATE,
    description = "Translate\nImgproc.warpAffine(src, dst, [1 0 tx; 0 1 ty], dsize)"
)
public class TranslateProcessor extends TransformProcessorBase {

    private int translateX;
    private int translateY;

    @Override
    public void configure(JsonObject params) throws InvalidParameterException {
        translateX = requireInt(params, "tx");
        translateY = requireInt(params, "ty");
    }

    @Override
    public Mat process(Mat input) {
        Mat M = new Mat(2, 3, CvType.CV_64F);
        M.put(0, 0, 1, 0, translateX, 0, 1, translateY);

        // Nearest neighbour keeps integer shifts exact
        Mat output = new Mat();
        Imgproc.warpAffine(input, output, M, input.size(), Imgproc.INTER_NEAREST,
                Core.BORDER_CONSTANT, new Scalar(0, 0, 0));
        M.release();

        return output;
    }

    @Override
    public void describeParameters(JsonObject json) {
        json.addProperty("tx", translateX);
        json.addProperty("ty", translateY);
    }
}
