package com.ttennebkram.imageeditor.transforms;

/**
 * A transform parameter was missing, malformed or outside its domain.
 * The engine treats this as a silent no-op: nothing is committed and no history entry is made.
 */
public class InvalidParameterException extends Exception {

    private final String parameter;

    public InvalidParameterException(String parameter, String message) {
        super(message);
        this.parameter = parameter;
    }

    public InvalidParameterException(String parameter, String message, Throwable cause) {
        super(message, cause);
        this.parameter = parameter;
    }

    /**
     * Name of the offending parameter.
     */
    public String getParameter() {
        return parameter;
    }
}
