package com.ttennebkram.imageeditor.transforms;

import com.google.gson.JsonObject;
import org.opencv.core.Mat;

/**
 * Interface for self-contained transform processors.
 * Each processor encapsulates:
 * - Parameter parsing (JSON, treated as untrusted user input)
 * - Processing logic (OpenCV operations)
 *
 * A processor instance is configured once and then applied once; TransformCatalog
 * creates a fresh instance for every call.
 */
public interface TransformProcessor {

    /**
     * The operation this processor implements.
     */
    OperationKind getOperation();

    /**
     * Get a description of this processor for tooltips.
     * Should include the OpenCV function signature.
     */
    String getDescription();

    /**
     * Read and validate parameters.
     *
     * @param params The parameter payload (never null)
     * @throws InvalidParameterException if a value is missing, malformed or out of domain
     */
    void configure(JsonObject params) throws InvalidParameterException;

    /**
     * Check the configured parameters against the actual input, e.g. its size.
     * Called after configure() and before process().
     *
     * @throws InvalidParameterException if the parameters don't fit this input
     */
    default void validate(Mat input) throws InvalidParameterException {
        // Most parameters are independent of the input
    }

    /**
     * Process an input image and return the result.
     *
     * @param input The input Mat (do not modify or release)
     * @return A new output Mat (caller will release)
     * @throws UnsupportedFeatureException if OpenCV can't perform a required primitive
     */
    Mat process(Mat input) throws UnsupportedFeatureException;

    /**
     * Write the effective parameters, after parsing, to JSON.
     * Used for logging which operation was applied with which values.
     *
     * @param json The JSON object to add properties to
     */
    void describeParameters(JsonObject json);
}
