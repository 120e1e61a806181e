package com.ttennebkram.imageeditor.transforms;

/**
 * The underlying OpenCV build can't perform a primitive a transform needs.
 * Reported to the user; the working bitmap stays as it was.
 */
public class UnsupportedFeatureException extends Exception {

    public UnsupportedFeatureException(String message) {
        super(message);
    }

    public UnsupportedFeatureException(String message, Throwable cause) {
        super(message, cause);
    }
}
