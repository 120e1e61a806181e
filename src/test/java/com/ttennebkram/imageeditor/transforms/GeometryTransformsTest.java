package com.ttennebkram.imageeditor.transforms;

import com.ttennebkram.imageeditor.TestImages;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.opencv.core.Mat;
import org.opencv.core.Rect;

import static org.junit.jupiter.api.Assertions.*;

class GeometryTransformsTest {

    private static TransformCatalog catalog;

    @BeforeAll
    static void setUp() {
        nu.pattern.OpenCV.loadLocally();
        catalog = new TransformCatalog();
    }

    // ==================== Translate ====================

    @Test
    @DisplayName("Translate moves content by (+tx, +ty) and fills with black")
    void testTranslate() throws Exception {
        Mat input = TestImages.gradient(10, 8);
        Mat output = catalog.apply(OperationKind.TRANSLATE, input, TransformParams.of("tx", 3, "ty", 2));

        assertEquals(10, output.cols());
        assertEquals(8, output.rows());
        assertArrayEquals(TestImages.bgr(input, 0, 0), TestImages.bgr(output, 3, 2));
        assertArrayEquals(TestImages.bgr(input, 6, 5), TestImages.bgr(output, 9, 7));
        assertArrayEquals(new int[]{0, 0, 0}, TestImages.bgr(output, 0, 0));
        assertArrayEquals(new int[]{0, 0, 0}, TestImages.bgr(output, 2, 7));
        input.release();
        output.release();
    }

    @Test
    @DisplayName("Translate accepts negative offsets typed as text")
    void testTranslateNegativeText() throws Exception {
        Mat input = TestImages.gradient(6, 6);
        Mat output = catalog.apply(OperationKind.TRANSLATE, input, TransformParams.of("tx", "-2", "ty", "0"));

        assertArrayEquals(TestImages.bgr(input, 2, 3), TestImages.bgr(output, 0, 3));
        assertArrayEquals(new int[]{0, 0, 0}, TestImages.bgr(output, 5, 3));
        input.release();
        output.release();
    }

    @ParameterizedTest
    @ValueSource(strings = {"abc", "1.5", ""})
    @DisplayName("Non-integer translation is an invalid parameter")
    void testTranslateInvalid(String tx) {
        Mat input = TestImages.gradient(4, 4);
        InvalidParameterException e = assertThrows(InvalidParameterException.class,
                () -> catalog.apply(OperationKind.TRANSLATE, input, TransformParams.of("tx", tx, "ty", "0")));
        assertEquals("tx", e.getParameter());
        input.release();
    }

    // ==================== Rotate ====================

    @Test
    @DisplayName("Rotate 0 is the identity")
    void testRotateZero() throws Exception {
        Mat input = TestImages.gradient(7, 5);
        Mat output = catalog.apply(OperationKind.ROTATE, input, TransformParams.of("angle", 0));

        assertTrue(TestImages.sameContent(input, output));
        input.release();
        output.release();
    }

    @ParameterizedTest
    @CsvSource({
            "90, 4, 6",
            "180, 6, 4",
            "270, 4, 6",
            "360, 6, 4",
            "45, 8, 8"
    })
    @DisplayName("Rotate expands the canvas to the rotated bounding box")
    void testRotateSize(double angle, int expectedWidth, int expectedHeight) throws Exception {
        Mat input = TestImages.gradient(6, 4);
        Mat output = catalog.apply(OperationKind.ROTATE, input, TransformParams.of("angle", angle));

        assertEquals(expectedWidth, output.cols());
        assertEquals(expectedHeight, output.rows());
        input.release();
        output.release();
    }

    @Test
    @DisplayName("Rotate 90 turns counter-clockwise")
    void testRotateCounterClockwise() throws Exception {
        Mat input = TestImages.gradient(6, 4);
        Mat output = catalog.apply(OperationKind.ROTATE, input, TransformParams.of("angle", 90));

        // Top-left goes to bottom-left, top-right goes to top-left
        assertArrayEquals(TestImages.bgr(input, 0, 0), TestImages.bgr(output, 0, 5));
        assertArrayEquals(TestImages.bgr(input, 5, 0), TestImages.bgr(output, 0, 0));
        assertArrayEquals(TestImages.bgr(input, 5, 3), TestImages.bgr(output, 3, 0));
        input.release();
        output.release();
    }

    @Test
    @DisplayName("Rotate 45 leaves black corners")
    void testRotateCornersBlack() throws Exception {
        Mat input = TestImages.solid(6, 4, 200, 200, 200);
        Mat output = catalog.apply(OperationKind.ROTATE, input, TransformParams.of("angle", 45));

        assertArrayEquals(new int[]{0, 0, 0}, TestImages.bgr(output, 0, 0));
        assertArrayEquals(new int[]{0, 0, 0}, TestImages.bgr(output, output.cols() - 1, output.rows() - 1));
        input.release();
        output.release();
    }

    // ==================== Flip ====================

    @Test
    @DisplayName("Horizontal flip mirrors left and right")
    void testFlipHorizontal() throws Exception {
        Mat input = TestImages.gradient(5, 3);
        Mat output = catalog.apply(OperationKind.FLIP, input, TransformParams.of("axis", "H"));

        assertArrayEquals(TestImages.bgr(input, 0, 1), TestImages.bgr(output, 4, 1));
        assertArrayEquals(TestImages.bgr(input, 1, 2), TestImages.bgr(output, 3, 2));
        input.release();
        output.release();
    }

    @Test
    @DisplayName("Vertical flip mirrors top and bottom")
    void testFlipVertical() throws Exception {
        Mat input = TestImages.gradient(5, 3);
        Mat output = catalog.apply(OperationKind.FLIP, input, TransformParams.of("axis", "vertical"));

        assertArrayEquals(TestImages.bgr(input, 2, 0), TestImages.bgr(output, 2, 2));
        input.release();
        output.release();
    }

    @ParameterizedTest
    @ValueSource(strings = {"X", "", "diagonal"})
    @DisplayName("Unknown flip axis is an invalid parameter")
    void testFlipInvalid(String axis) {
        Mat input = TestImages.gradient(3, 3);
        assertThrows(InvalidParameterException.class,
                () -> catalog.apply(OperationKind.FLIP, input, TransformParams.of("axis", axis)));
        input.release();
    }

    // ==================== Crop ====================

    @Test
    @DisplayName("Crop keeps the box (left, top, width-right, height-bottom)")
    void testCrop() throws Exception {
        Mat input = TestImages.gradient(10, 8);
        Mat output = catalog.apply(OperationKind.CROP, input, TransformParams.builder()
                .put("top", 1).put("left", 2).put("bottom", 3).put("right", 4).build());

        assertEquals(4, output.cols());
        assertEquals(4, output.rows());
        assertArrayEquals(TestImages.bgr(input, 2, 1), TestImages.bgr(output, 0, 0));
        assertArrayEquals(TestImages.bgr(input, 5, 4), TestImages.bgr(output, 3, 3));
        input.release();
        output.release();
    }

    @Test
    @DisplayName("Zero margins keep the whole image")
    void testCropZero() throws Exception {
        Mat input = TestImages.gradient(5, 5);
        Mat output = catalog.apply(OperationKind.CROP, input,
                TransformParams.of("top", "0", "left", "0", "bottom", "0", "right", "0"));

        assertTrue(TestImages.sameContent(input, output));
        input.release();
        output.release();
    }

    @ParameterizedTest
    @CsvSource({
            "0, 5, 0, 5",
            "0, 6, 0, 4",
            "4, 0, 6, 0",
            "0, 0, 8, 0",
            "0, 0, 0, 10"
    })
    @DisplayName("Crop leaving no pixels is rejected")
    void testCropEmptyBox(int top, int left, int bottom, int right) {
        Mat input = TestImages.gradient(10, 8);
        assertThrows(InvalidParameterException.class, () -> catalog.apply(OperationKind.CROP, input,
                TransformParams.of("top", top, "left", left, "bottom", bottom, "right", right)));
        input.release();
    }

    @Test
    @DisplayName("Negative crop margins are rejected")
    void testCropNegative() {
        Mat input = TestImages.gradient(10, 8);
        assertThrows(InvalidParameterException.class, () -> catalog.apply(OperationKind.CROP, input,
                TransformParams.of("top", -1, "left", 0, "bottom", 0, "right", 0)));
        input.release();
    }

    @Test
    @DisplayName("cropBox computes the kept rectangle or null")
    void testCropBox() throws Exception {
        CropProcessor processor = new CropProcessor();
        processor.configure(TransformParams.of("top", 1, "left", 2, "bottom", 1, "right", 2));

        assertEquals(new Rect(2, 1, 6, 6), processor.cropBox(10, 8));
        assertNull(processor.cropBox(4, 8));
    }
}
