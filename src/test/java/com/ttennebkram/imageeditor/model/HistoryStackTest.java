package com.ttennebkram.imageeditor.model;

import com.ttennebkram.imageeditor.TestImages;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.opencv.core.Mat;

import static org.junit.jupiter.api.Assertions.*;

class HistoryStackTest {

    @BeforeAll
    static void loadOpenCV() {
        nu.pattern.OpenCV.loadLocally();
    }

    @Test
    @DisplayName("Pop on an empty stack returns null")
    void testPopEmpty() {
        HistoryStack history = new HistoryStack();
        assertTrue(history.isEmpty());
        assertNull(history.pop());
    }

    @Test
    @DisplayName("Snapshots come back most recent first")
    void testLifoOrder() {
        HistoryStack history = new HistoryStack();
        for (int value = 1; value <= 3; value++) {
            Mat bitmap = TestImages.solid(2, 2, value, value, value);
            history.push(bitmap);
            bitmap.release();
        }

        for (int expected = 3; expected >= 1; expected--) {
            Mat popped = history.pop();
            assertEquals(expected, TestImages.bgr(popped, 0, 0)[0]);
            popped.release();
        }
        assertTrue(history.isEmpty());
    }

    @Test
    @DisplayName("Push stores a copy, not the caller's bitmap")
    void testPushCopies() {
        HistoryStack history = new HistoryStack();
        Mat bitmap = TestImages.solid(2, 2, 10, 10, 10);
        history.push(bitmap);
        bitmap.setTo(new org.opencv.core.Scalar(99, 99, 99));

        Mat popped = history.pop();
        assertEquals(10, TestImages.bgr(popped, 1, 1)[0]);
        popped.release();
        bitmap.release();
    }

    @Test
    @DisplayName("Size never exceeds capacity and the oldest snapshot is evicted")
    void testCapacityEvictsOldest() {
        HistoryStack history = new HistoryStack();
        for (int value = 0; value < 25; value++) {
            Mat bitmap = TestImages.solid(1, 1, value, value, value);
            history.push(bitmap);
            bitmap.release();
            assertTrue(history.size() <= HistoryStack.DEFAULT_CAPACITY);
        }
        assertEquals(20, history.size());

        // Snapshots 0-4 were evicted; the oldest remaining is 5
        Mat last = null;
        while (!history.isEmpty()) {
            if (last != null) {
                last.release();
            }
            last = history.pop();
        }
        assertEquals(5, TestImages.bgr(last, 0, 0)[0]);
        last.release();
    }

    @Test
    @DisplayName("Clear empties the stack")
    void testClear() {
        HistoryStack history = new HistoryStack(3);
        Mat bitmap = TestImages.solid(1, 1, 0, 0, 0);
        history.push(bitmap);
        history.push(bitmap);
        bitmap.release();

        history.clear();
        assertEquals(0, history.size());
        assertEquals(3, history.getCapacity());
    }

    @Test
    @DisplayName("Non-positive capacity is rejected")
    void testInvalidCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new HistoryStack(0));
    }
}
