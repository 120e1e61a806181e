package com.ttennebkram.imageeditor.model;

import org.opencv.core.Mat;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Bounded undo log of working-bitmap snapshots, oldest first.
 *
 * Pushing onto a full stack evicts (and releases) the oldest snapshot first.
 * Not thread-safe: EditorEngine guards it together with the RasterBuffer.
 */
public class HistoryStack {

    public static final int DEFAULT_CAPACITY = 20;

    private final int capacity;
    private final Deque<Mat> snapshots = new ArrayDeque<>();

    public HistoryStack() {
        this(DEFAULT_CAPACITY);
    }

    public HistoryStack(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Push a deep copy of the given bitmap. The caller keeps ownership of {@code bitmap}.
     */
    public void push(Mat bitmap) {
        if (snapshots.size() == capacity) {
            Mat evicted = snapshots.removeFirst();
            evicted.release();
        }
        snapshots.addLast(bitmap.clone());
    }

    /**
     * Remove and return the most recent snapshot, or null when empty.
     * The caller owns the returned Mat.
     */
    public Mat pop() {
        return snapshots.pollLast();
    }

    public boolean isEmpty() {
        return snapshots.isEmpty();
    }

    public int size() {
        return snapshots.size();
    }

    public int getCapacity() {
        return capacity;
    }

    /**
     * Drop all snapshots, releasing their native memory.
     */
    public void clear() {
        for (Mat snapshot : snapshots) {
            snapshot.release();
        }
        snapshots.clear();
    }
}
