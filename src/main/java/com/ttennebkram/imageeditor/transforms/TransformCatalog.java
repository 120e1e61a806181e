package com.ttennebkram.imageeditor.transforms;

import com.google.gson.JsonObject;
import com.ttennebkram.imageeditor.model.RasterBuffer;
import org.opencv.core.Mat;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Registry of TransformProcessor implementations, keyed by the operation declared in
 * each class's @TransformInfo, and the single dispatch point for applying them.
 *
 * Usage:
 *   TransformCatalog catalog = new TransformCatalog();
 *   Mat output = catalog.apply(OperationKind.THRESHOLD, input, TransformParams.of("threshold", 128));
 *
 * apply() is pure: it never modifies its input and holds no state between calls.
 */
public class TransformCatalog {

    private static final Logger LOG = Logger.getLogger(TransformCatalog.class.getName());

    private static final List<Class<? extends TransformProcessor>> PROCESSOR_CLASSES = List.of(
            GrayscaleProcessor.class,
            NegativeProcessor.class,
            ThresholdProcessor.class,
            BrightnessProcessor.class,
            SaturationProcessor.class,
            ContrastProcessor.class,
            SharpnessProcessor.class,
            BooleanNotProcessor.class,
            BooleanAndProcessor.class,
            BooleanOrProcessor.class,
            BooleanXorProcessor.class,
            NoiseProcessor.class,
            HighpassProcessor.class,
            AddScalarProcessor.class,
            SubtractScalarProcessor.class,
            MultiplyScalarProcessor.class,
            DivideScalarProcessor.class,
            TranslateProcessor.class,
            RotateProcessor.class,
            FlipProcessor.class,
            CropProcessor.class
    );

    private final Map<OperationKind, Class<? extends TransformProcessor>> processorClasses =
            new EnumMap<>(OperationKind.class);

    public TransformCatalog() {
        for (Class<? extends TransformProcessor> processorClass : PROCESSOR_CLASSES) {
            register(processorClass);
        }
    }

    /**
     * Register a processor class under the operation named in its @TransformInfo.
     * A later registration for the same operation replaces the earlier one.
     */
    public final void register(Class<? extends TransformProcessor> processorClass) {
        TransformInfo info = processorClass.getAnnotation(TransformInfo.class);
        if (info == null) {
            throw new IllegalArgumentException(processorClass.getName() + " is missing @TransformInfo");
        }
        Class<? extends TransformProcessor> previous = processorClasses.put(info.operation(), processorClass);
        if (previous != null && previous != processorClass) {
            LOG.fine("Replaced " + previous.getSimpleName() + " with " + processorClass.getSimpleName()
                    + " for " + info.operation());
        }
    }

    public Set<OperationKind> getRegisteredOperations() {
        return Collections.unmodifiableSet(processorClasses.keySet());
    }

    /**
     * Create a new, unconfigured processor for the given operation.
     *
     * @throws IllegalArgumentException if no processor is registered for it
     */
    public TransformProcessor createProcessor(OperationKind operation) {
        Class<? extends TransformProcessor> processorClass = processorClasses.get(operation);
        if (processorClass == null) {
            throw new IllegalArgumentException("No processor registered for " + operation);
        }
        try {
            return processorClass.getDeclaredConstructor().newInstance();
        } catch (ReflectiveOperationException e) {
            LOG.log(Level.SEVERE, "Failed to create processor for " + operation, e);
            throw new IllegalStateException("Failed to create processor for " + operation, e);
        }
    }

    /**
     * Tooltip text for an operation.
     */
    public String getDescription(OperationKind operation) {
        return createProcessor(operation).getDescription();
    }

    /**
     * Apply one operation to a canonical bitmap.
     *
     * @param operation Which transform to run
     * @param input CV_8UC3 bitmap (not modified or released)
     * @param params Untrusted parameters; null means none
     * @return A new CV_8UC3 bitmap (caller will release)
     * @throws InvalidParameterException if the parameters are malformed or don't fit the input
     * @throws UnsupportedFeatureException if OpenCV can't perform a required primitive
     */
    public Mat apply(OperationKind operation, Mat input, JsonObject params)
            throws InvalidParameterException, UnsupportedFeatureException {
        if (!RasterBuffer.isCanonical(input)) {
            throw new IllegalArgumentException("Input must be a non-empty CV_8UC3 bitmap");
        }

        TransformProcessor processor = createProcessor(operation);
        processor.configure(params == null ? new JsonObject() : params);
        processor.validate(input);

        Mat output = processor.process(input);
        if (output == input) {
            output = input.clone();
        }
        if (RasterBuffer.isCanonical(output)) {
            return output;
        }

        // Anything that changed the channel layout goes back to 3-channel 8-bit
        Mat canonical = RasterBuffer.toCanonical(output);
        output.release();
        return canonical;
    }

    /**
     * The effective parameters a processor would use, for logging.
     */
    public JsonObject describe(OperationKind operation, JsonObject params) throws InvalidParameterException {
        TransformProcessor processor = createProcessor(operation);
        processor.configure(params == null ? new JsonObject() : params);
        JsonObject json = new JsonObject();
        processor.describeParameters(json);
        return json;
    }
}
