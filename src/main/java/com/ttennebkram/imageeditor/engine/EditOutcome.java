package com.ttennebkram.imageeditor.engine;

/**
 * Result of one engine request, as shown to the user.
 */
public final class EditOutcome {

    public enum Status {
        /** The working bitmap changed. */
        APPLIED,
        /** Parameters were invalid; silently ignored, nothing changed. */
        NO_OP,
        /** The transform failed; nothing changed. */
        FAILED,
        /** Another operation is running; nothing changed. */
        BUSY_REJECTED,
        /** Undo with nothing to undo. */
        EMPTY_HISTORY,
        /** No image is loaded yet. */
        NO_IMAGE
    }

    public static final String BUSY_MESSAGE = "Please wait for current operation to complete.";
    public static final String EMPTY_HISTORY_MESSAGE = "No more actions to undo.";
    public static final String NO_IMAGE_MESSAGE = "No image loaded.";

    private final Status status;
    private final String operation;
    private final String message;

    private EditOutcome(Status status, String operation, String message) {
        this.status = status;
        this.operation = operation;
        this.message = message;
    }

    public static EditOutcome applied(String operation) {
        return new EditOutcome(Status.APPLIED, operation, operation + " applied");
    }

    public static EditOutcome noOp(String operation, String reason) {
        return new EditOutcome(Status.NO_OP, operation, reason);
    }

    public static EditOutcome failed(String operation, String message) {
        return new EditOutcome(Status.FAILED, operation, message);
    }

    public static EditOutcome busyRejected(String operation) {
        return new EditOutcome(Status.BUSY_REJECTED, operation, BUSY_MESSAGE);
    }

    public static EditOutcome emptyHistory() {
        return new EditOutcome(Status.EMPTY_HISTORY, "Undo", EMPTY_HISTORY_MESSAGE);
    }

    public static EditOutcome noImage(String operation) {
        return new EditOutcome(Status.NO_IMAGE, operation, NO_IMAGE_MESSAGE);
    }

    public Status getStatus() {
        return status;
    }

    public boolean isApplied() {
        return status == Status.APPLIED;
    }

    public String getOperation() {
        return operation;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return status + "[" + operation + "]: " + message;
    }
}
