package com.ttennebkram.imageeditor.transforms;

/**
 * Operation families, used for grouping in the control panel.
 */
public enum TransformCategory {
    COLOR("Color"),
    BOOLEAN("Boolean"),
    FILTER("Filter"),
    ARITHMETIC("Math"),
    GEOMETRY("Geometry");

    private final String displayName;

    TransformCategory(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
