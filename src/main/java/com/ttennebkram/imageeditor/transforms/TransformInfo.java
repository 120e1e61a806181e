package com.ttennebkram.imageeditor.transforms;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares which operation a TransformProcessor implements.
 * TransformCatalog reads it at registration time.
 *
 * Example usage:
 * <pre>
 * {@literal @}TransformInfo(
 *     operation = OperationKind.HIGHPASS,
 *     description = "3x3 highpass kernel\nImgproc.filter2D(src, dst, -1, kernel)"
 * )
 * public class HighpassProcessor extends TransformProcessorBase { ... }
 * </pre>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface TransformInfo {

    /**
     * The operation this processor implements. One processor per operation.
     */
    OperationKind operation();

    /**
     * Description/method signature shown in tooltips.
     */
    String description() default "";
}
