package com.ttennebkram.imageeditor.transforms;

/**
 * Every operation the catalog can apply to the working bitmap.
 */
public enum OperationKind {
    GRAYSCALE("Grayscale"),
    NEGATIVE("Negative"),
    THRESHOLD("Threshold"),
    BRIGHTNESS("Brightness"),
    SATURATION("Saturation"),
    CONTRAST("Contrast"),
    SHARPNESS("Sharpness"),

    BOOL_NOT("NOT (Invert)"),
    BOOL_AND("AND (Multiply)"),
    BOOL_OR("OR (Screen)"),
    BOOL_XOR("XOR (Difference)"),

    NOISE("Gaussian Noise"),
    HIGHPASS("Highpass"),

    ADD("Add"),
    SUBTRACT("Subtract"),
    MULTIPLY("Multiply"),
    DIVIDE("Divide"),

    TRANSLATE("Translate"),
    ROTATE("Rotate"),
    FLIP("Flip"),
    CROP("Crop");

    private final String displayName;

    OperationKind(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
