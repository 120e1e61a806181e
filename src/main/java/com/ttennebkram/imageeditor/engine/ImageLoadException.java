package com.ttennebkram.imageeditor.engine;

/**
 * Source bytes could not be decoded to a 3-channel 8-bit bitmap.
 * Nothing in the engine changes when this is thrown.
 */
public class ImageLoadException extends Exception {

    public ImageLoadException(String message) {
        super(message);
    }

    public ImageLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
