package com.ttennebkram.imageeditor.engine;

/**
 * Work was submitted while another operation was still running.
 * Submissions are never queued; the caller should try again later.
 */
public class BusyRejectedException extends Exception {

    private final String rejected;
    private final String running;

    public BusyRejectedException(String rejected, String running) {
        super("Cannot start " + rejected + " while " + running + " is running");
        this.rejected = rejected;
        this.running = running;
    }

    public String getRejected() {
        return rejected;
    }

    public String getRunning() {
        return running;
    }
}
