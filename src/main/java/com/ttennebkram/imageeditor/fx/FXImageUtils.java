package com.ttennebkram.imageeditor.fx;

import com.ttennebkram.imageeditor.model.BooleanColor;
import javafx.scene.image.Image;
import javafx.scene.image.PixelFormat;
import javafx.scene.image.PixelWriter;
import javafx.scene.image.WritableImage;
import javafx.scene.paint.Color;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Utility methods for converting between OpenCV Mat and JavaFX types.
 */
public class FXImageUtils {

    private static final Logger LOG = Logger.getLogger(FXImageUtils.class.getName());

    /**
     * Convert a BGR, BGRA or grayscale Mat to a JavaFX Image.
     *
     * @param mat The OpenCV Mat to convert (not released)
     * @return A JavaFX Image, or null if conversion fails
     */
    public static Image matToImage(Mat mat) {
        if (mat == null || mat.empty()) {
            return null;
        }

        Mat rgbMat = new Mat();
        try {
            int channels = mat.channels();
            if (channels == 3) {
                Imgproc.cvtColor(mat, rgbMat, Imgproc.COLOR_BGR2RGB);
            } else if (channels == 4) {
                Imgproc.cvtColor(mat, rgbMat, Imgproc.COLOR_BGRA2RGB);
            } else if (channels == 1) {
                Imgproc.cvtColor(mat, rgbMat, Imgproc.COLOR_GRAY2RGB);
            } else {
                LOG.warning("Unsupported channel count: " + channels);
                return null;
            }

            int width = rgbMat.width();
            int height = rgbMat.height();
            byte[] buffer = new byte[width * height * 3];
            rgbMat.get(0, 0, buffer);

            WritableImage image = new WritableImage(width, height);
            PixelWriter pw = image.getPixelWriter();
            pw.setPixels(0, 0, width, height, PixelFormat.getByteRgbInstance(), buffer, 0, width * 3);
            return image;
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "matToImage failed", e);
            return null;
        } finally {
            rgbMat.release();
        }
    }

    public static Color toFxColor(BooleanColor color) {
        return Color.rgb(color.getRed(), color.getGreen(), color.getBlue());
    }

    public static BooleanColor fromFxColor(Color color) {
        return new BooleanColor(
                (int) Math.round(color.getRed() * 255),
                (int) Math.round(color.getGreen() * 255),
                (int) Math.round(color.getBlue() * 255));
    }
}
