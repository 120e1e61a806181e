package com.ttennebkram.imageeditor.transforms;

import com.ttennebkram.imageeditor.TestImages;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.opencv.core.Mat;

import static org.junit.jupiter.api.Assertions.*;

class ArithmeticTransformsTest {

    private static TransformCatalog catalog;

    @BeforeAll
    static void setUp() {
        nu.pattern.OpenCV.loadLocally();
        catalog = new TransformCatalog();
    }

    @ParameterizedTest
    @CsvSource({
            "ADD, 100, 50, 150",
            "ADD, 100, 200, 255",
            "SUBTRACT, 100, 50, 50",
            "SUBTRACT, 100, 150, 0",
            "MULTIPLY, 100, 2, 200",
            "MULTIPLY, 100, 3, 255",
            "DIVIDE, 100, 4, 25",
            "DIVIDE, 100, 0.5, 200",
            "ADD, 100, -30, 70"
    })
    @DisplayName("Scalar arithmetic saturates to 0-255")
    void testSaturatingArithmetic(String operation, int pixel, double value, int expected) throws Exception {
        Mat input = TestImages.solid(3, 2, pixel, pixel, pixel);
        Mat output = catalog.apply(OperationKind.valueOf(operation), input, TransformParams.of("value", value));

        assertTrue(TestImages.allEqual(output, expected));
        input.release();
        output.release();
    }

    @Test
    @DisplayName("Add then subtract restores pixels that did not clamp")
    void testAddSubtractRoundTrip() throws Exception {
        // Gray values 50..200 never clamp with v = 50
        Mat input = TestImages.solid(4, 4, 50, 125, 200);
        Mat added = catalog.apply(OperationKind.ADD, input, TransformParams.of("value", "50"));
        Mat restored = catalog.apply(OperationKind.SUBTRACT, added, TransformParams.of("value", "50"));

        assertTrue(TestImages.sameContent(input, restored));
        input.release();
        added.release();
        restored.release();
    }

    @Test
    @DisplayName("Clamped channels stay clamped under further same-direction arithmetic")
    void testClampedIdempotent() throws Exception {
        Mat input = TestImages.solid(2, 2, 250, 250, 250);
        Mat once = catalog.apply(OperationKind.ADD, input, TransformParams.of("value", 50));
        Mat twice = catalog.apply(OperationKind.ADD, once, TransformParams.of("value", 50));

        assertTrue(TestImages.allEqual(once, 255));
        assertTrue(TestImages.sameContent(once, twice));
        input.release();
        once.release();
        twice.release();
    }

    @ParameterizedTest
    @ValueSource(strings = {"0", "0.0", "-0"})
    @DisplayName("Division by zero is an invalid parameter")
    void testDivideByZero(String value) {
        Mat input = TestImages.solid(2, 2, 9, 9, 9);
        InvalidParameterException e = assertThrows(InvalidParameterException.class,
                () -> catalog.apply(OperationKind.DIVIDE, input, TransformParams.of("value", value)));
        assertEquals("value", e.getParameter());
        input.release();
    }

    @ParameterizedTest
    @ValueSource(strings = {"fifty", "", "1e999", "NaN"})
    @DisplayName("Malformed scalars are invalid parameters")
    void testMalformedScalar(String value) {
        Mat input = TestImages.solid(2, 2, 9, 9, 9);
        assertThrows(InvalidParameterException.class,
                () -> catalog.apply(OperationKind.MULTIPLY, input, TransformParams.of("value", value)));
        input.release();
    }
}
