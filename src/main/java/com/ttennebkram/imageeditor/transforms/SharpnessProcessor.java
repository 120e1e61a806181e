package com.ttennebkram.imageeditor.transforms;

import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

/**
 * Sharpness processor.
 * Interpolates against a smoothed copy (3x3 kernel, center weight 5, total 13).
 * The outermost pixel ring of the smoothed copy keeps the source values,
 * so factor changes never touch the image border.
 */
@TransformInfo(
    operation = OperationKind.SHARPNESS,
    description = "Sharpness\nImgproc.filter2D(src, smooth, -1, [1 1 1; 1 5 1; 1 1 1] / 13)"
)
public class SharpnessProcessor extends EnhanceProcessorBase {

    private static final float[] SMOOTH_KERNEL = {
            1, 1, 1,
            1, 5, 1,
            1, 1, 1
    };
    private static final float SMOOTH_SCALE = 13f;

    @Override
    protected Mat createDegenerate(Mat input) {
        Mat degenerate = input.clone();
        if (input.rows() < 3 || input.cols() < 3) {
            return degenerate;
        }

        Mat kernel = new Mat(3, 3, CvType.CV_32F);
        float[] scaled = new float[SMOOTH_KERNEL.length];
        for (int i = 0; i < SMOOTH_KERNEL.length; i++) {
            scaled[i] = SMOOTH_KERNEL[i] / SMOOTH_SCALE;
        }
        kernel.put(0, 0, scaled);

        Mat smoothed = new Mat();
        Imgproc.filter2D(input, smoothed, -1, kernel, new org.opencv.core.Point(-1, -1), 0, Core.BORDER_REPLICATE);
        kernel.release();

        // Copy only the interior; the border ring stays as in the source
        Mat interior = smoothed.submat(1, input.rows() - 1, 1, input.cols() - 1);
        Mat target = degenerate.submat(1, input.rows() - 1, 1, input.cols() - 1);
        interior.copyTo(target);
        interior.release();
        target.release();
        smoothed.release();

        return degenerate;
    }
}
