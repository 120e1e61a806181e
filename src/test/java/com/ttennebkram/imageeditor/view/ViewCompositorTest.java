package com.ttennebkram.imageeditor.view;

import com.ttennebkram.imageeditor.TestImages;
import com.ttennebkram.imageeditor.config.EditorConfig;
import com.ttennebkram.imageeditor.engine.EditorEngine;
import com.ttennebkram.imageeditor.transforms.OperationKind;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.opencv.core.Mat;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ViewCompositorTest {

    private EditorEngine engine;
    private ViewCompositor compositor;

    @BeforeAll
    static void loadOpenCV() {
        nu.pattern.OpenCV.loadLocally();
    }

    @BeforeEach
    void setUp() {
        engine = EditorEngine.create(EditorConfig.defaults(), Runnable::run);
        compositor = new ViewCompositor(engine.getContext().getViewport(), 800, 600);
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    // ==================== Placement ====================

    @Test
    @DisplayName("Image smaller than the viewport is centered")
    void testCentered() {
        Mat bitmap = TestImages.gradient(100, 50);
        RenderFrame frame = compositor.render(bitmap, 800, 600);

        Placement placement = frame.getPlacement();
        assertTrue(placement.isCentered());
        assertEquals(350, placement.getX(), 1e-9);
        assertEquals(275, placement.getY(), 1e-9);
        assertEquals(100, placement.getScrollWidth());
        assertEquals(50, placement.getScrollHeight());
        assertTrue(TestImages.sameContent(bitmap, frame.getImage()));
        frame.release();
        bitmap.release();
    }

    @ParameterizedTest
    @CsvSource({
            "900, 100",
            "100, 700",
            "800, 100",
            "100, 600",
            "1000, 1000"
    })
    @DisplayName("Image not strictly smaller on both axes is anchored at the origin")
    void testAnchored(int width, int height) {
        Mat bitmap = TestImages.solid(width, height, 1, 2, 3);
        RenderFrame frame = compositor.render(bitmap, 800, 600);

        Placement placement = frame.getPlacement();
        assertEquals(Placement.Mode.ANCHORED, placement.getMode());
        assertEquals(0, placement.getX(), 1e-9);
        assertEquals(0, placement.getY(), 1e-9);
        assertEquals(width, placement.getScrollWidth());
        assertEquals(height, placement.getScrollHeight());
        frame.release();
        bitmap.release();
    }

    @Test
    @DisplayName("Viewport not laid out yet falls back to 800x600")
    void testFallbackViewport() {
        Mat bitmap = TestImages.solid(700, 500, 1, 2, 3);
        RenderFrame frame = compositor.render(bitmap, 1, 1);

        assertTrue(frame.getPlacement().isCentered());
        assertEquals(50, frame.getPlacement().getX(), 1e-9);
        assertEquals(50, frame.getPlacement().getY(), 1e-9);
        frame.release();
        bitmap.release();
    }

    @Test
    @DisplayName("Nothing to render gives no frame")
    void testRenderNothing() {
        assertNull(compositor.render(null, 800, 600));
        assertNull(compositor.render(new Mat(), 800, 600));
        assertNull(compositor.renderWorking(engine, 800, 600));
        assertNull(compositor.beginPeek(engine, 800, 600));
        assertFalse(compositor.isPeeking());
    }

    // ==================== Zoom ====================

    @Test
    @DisplayName("Zoom steps multiply and divide by 1.1 and truncate the scaled size")
    void testZoomSizes() throws Exception {
        Mat bitmap = TestImages.gradient(100, 50);
        engine.load(bitmap);

        RenderFrame in = compositor.zoomIn(engine, 800, 600);
        assertEquals(110, in.getImage().cols());
        assertEquals(55, in.getImage().rows());
        assertEquals(110, compositor.getZoomPercent());
        in.release();

        compositor.zoomOut(engine, 800, 600).release();
        RenderFrame out = compositor.zoomOut(engine, 800, 600);
        assertEquals(90, out.getImage().cols());
        assertEquals(45, out.getImage().rows());
        assertEquals(90, compositor.getZoomPercent());
        out.release();

        compositor.resetZoom();
        assertEquals(100, compositor.getZoomPercent());
        bitmap.release();
    }

    @Test
    @DisplayName("Two zoom-in steps show 121%")
    void testZoomPercentCompounds() {
        compositor.getViewport().zoomIn();
        compositor.getViewport().zoomIn();
        assertEquals(121, compositor.getZoomPercent());
    }

    @Test
    @DisplayName("Scaled size never drops below one pixel")
    void testMinimumSize() {
        Mat bitmap = TestImages.solid(3, 2, 9, 9, 9);
        for (int i = 0; i < 30; i++) {
            compositor.getViewport().zoomOut();
        }
        RenderFrame frame = compositor.render(bitmap, 800, 600);

        assertEquals(1, frame.getImage().cols());
        assertEquals(1, frame.getImage().rows());
        frame.release();
        bitmap.release();
    }

    @ParameterizedTest
    @CsvSource({"7, 1.1, 7", "10, 1.1, 11", "10, 0.05, 1", "1, 0.5, 1"})
    @DisplayName("Scaled extent truncates with a floor of 1")
    void testScaledExtent(int extent, double zoom, int expected) {
        assertEquals(expected, ViewCompositor.scaledExtent(extent, zoom));
    }

    // ==================== Peek ====================

    @Test
    @DisplayName("Peek shows the original and release returns to the working image")
    void testPeek() throws Exception {
        Mat bitmap = TestImages.gradient(20, 10);
        engine.load(bitmap);
        engine.submit(OperationKind.NEGATIVE, null).get(5, TimeUnit.SECONDS);

        RenderFrame peek = compositor.beginPeek(engine, 800, 600);
        assertTrue(compositor.isPeeking());
        assertTrue(peek.isOriginal());
        assertTrue(TestImages.sameContent(bitmap, peek.getImage()));
        peek.release();

        RenderFrame current = compositor.renderCurrent(engine, 800, 600);
        assertTrue(current.isOriginal());
        current.release();

        RenderFrame back = compositor.endPeek(engine, 800, 600);
        assertFalse(compositor.isPeeking());
        assertFalse(back.isOriginal());
        Mat working = engine.copyWorking();
        assertTrue(TestImages.sameContent(working, back.getImage()));
        working.release();
        back.release();

        // Rendering never touches editing state
        assertEquals(1, engine.historySize());
        bitmap.release();
    }
}
