package com.ttennebkram.imageeditor.model;

import com.ttennebkram.imageeditor.TestImages;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;

import static org.junit.jupiter.api.Assertions.*;

class RasterBufferTest {

    @BeforeAll
    static void loadOpenCV() {
        nu.pattern.OpenCV.loadLocally();
    }

    @Test
    @DisplayName("A new buffer has no image")
    void testEmptyBuffer() {
        RasterBuffer buffer = new RasterBuffer();
        assertFalse(buffer.isLoaded());
        assertNull(buffer.copyWorking());
        assertNull(buffer.copyOriginal());
    }

    @Test
    @DisplayName("Load sets original and working to independent copies")
    void testLoad() {
        RasterBuffer buffer = new RasterBuffer();
        Mat source = TestImages.gradient(5, 4);
        buffer.load(source);

        assertTrue(buffer.isLoaded());
        assertTrue(TestImages.sameContent(source, buffer.getOriginal()));
        assertTrue(TestImages.sameContent(source, buffer.getWorking()));
        assertNotSame(buffer.getOriginal(), buffer.getWorking());

        source.setTo(new Scalar(0, 0, 0));
        assertFalse(TestImages.sameContent(source, buffer.getWorking()));
        source.release();
        buffer.release();
    }

    @Test
    @DisplayName("Replacing the working bitmap leaves the original alone")
    void testReplaceWorking() {
        RasterBuffer buffer = new RasterBuffer();
        Mat source = TestImages.solid(3, 3, 10, 20, 30);
        buffer.load(source);

        buffer.replaceWorking(TestImages.solid(6, 2, 200, 200, 200));

        assertEquals(6, buffer.getWorking().cols());
        assertTrue(TestImages.sameContent(source, buffer.getOriginal()));

        buffer.restoreOriginal();
        assertTrue(TestImages.sameContent(source, buffer.getWorking()));
        source.release();
        buffer.release();
    }

    @Test
    @DisplayName("Non-canonical bitmaps are refused")
    void testRejectsNonCanonical() {
        RasterBuffer buffer = new RasterBuffer();
        Mat gray = new Mat(2, 2, CvType.CV_8UC1, new Scalar(5));
        assertThrows(IllegalArgumentException.class, () -> buffer.load(gray));
        assertThrows(IllegalArgumentException.class, () -> buffer.load(new Mat()));
        gray.release();
    }

    @Test
    @DisplayName("Grayscale converts to three equal channels")
    void testToCanonicalGray() {
        Mat gray = new Mat(2, 3, CvType.CV_8UC1, new Scalar(77));
        Mat canonical = RasterBuffer.toCanonical(gray);

        assertEquals(CvType.CV_8UC3, canonical.type());
        assertArrayEquals(new int[]{77, 77, 77}, TestImages.bgr(canonical, 2, 1));
        gray.release();
        canonical.release();
    }

    @Test
    @DisplayName("Alpha channel is dropped")
    void testToCanonicalBgra() {
        Mat bgra = new Mat(2, 2, CvType.CV_8UC4, new Scalar(1, 2, 3, 128));
        Mat canonical = RasterBuffer.toCanonical(bgra);

        assertEquals(CvType.CV_8UC3, canonical.type());
        assertArrayEquals(new int[]{1, 2, 3}, TestImages.bgr(canonical, 0, 0));
        bgra.release();
        canonical.release();
    }

    @Test
    @DisplayName("16-bit images are scaled down to 8 bits")
    void testToCanonical16Bit() {
        Mat deep = new Mat(1, 1, CvType.CV_16UC3, new Scalar(65535, 0, 257 * 100));
        Mat canonical = RasterBuffer.toCanonical(deep);

        assertArrayEquals(new int[]{255, 0, 100}, TestImages.bgr(canonical, 0, 0));
        deep.release();
        canonical.release();
    }

    @Test
    @DisplayName("Unsupported channel counts are refused")
    void testToCanonicalTwoChannels() {
        Mat twoChannel = new Mat(1, 1, CvType.CV_8UC2, new Scalar(1, 2));
        assertThrows(IllegalArgumentException.class, () -> RasterBuffer.toCanonical(twoChannel));
        twoChannel.release();
    }
}
