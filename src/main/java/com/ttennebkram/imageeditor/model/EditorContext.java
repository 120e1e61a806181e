package com.ttennebkram.imageeditor.model;

import com.ttennebkram.imageeditor.config.EditorConfig;
import com.ttennebkram.imageeditor.view.ViewportState;

/**
 * Everything one editing session owns: the bitmaps, the undo history,
 * the boolean operand color and the viewport.
 */
public class EditorContext {

    private final RasterBuffer rasterBuffer;
    private final HistoryStack history;
    private final ViewportState viewport;
    private volatile BooleanColor booleanColor = BooleanColor.RED;

    public EditorContext(RasterBuffer rasterBuffer, HistoryStack history, ViewportState viewport) {
        this.rasterBuffer = rasterBuffer;
        this.history = history;
        this.viewport = viewport;
    }

    public static EditorContext create(EditorConfig config) {
        return new EditorContext(new RasterBuffer(),
                new HistoryStack(config.getHistoryCapacity()),
                new ViewportState(config.getZoomStep()));
    }

    public RasterBuffer getRasterBuffer() {
        return rasterBuffer;
    }

    public HistoryStack getHistory() {
        return history;
    }

    public ViewportState getViewport() {
        return viewport;
    }

    public BooleanColor getBooleanColor() {
        return booleanColor;
    }

    public void setBooleanColor(BooleanColor booleanColor) {
        if (booleanColor == null) {
            throw new IllegalArgumentException("booleanColor must not be null");
        }
        this.booleanColor = booleanColor;
    }
}
