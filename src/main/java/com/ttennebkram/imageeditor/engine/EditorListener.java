package com.ttennebkram.imageeditor.engine;

/**
 * Callbacks from EditorEngine. Always invoked on the engine's UI executor,
 * in the order the requests were made.
 */
public interface EditorListener {

    /**
     * A background transform started (true) or finished (false).
     */
    default void onBusyChanged(boolean busy) {
    }

    /**
     * A request finished, successfully or not.
     */
    default void onOutcome(EditOutcome outcome) {
    }
}
