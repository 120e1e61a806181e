package com.ttennebkram.imageeditor;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Plain main class for the shaded JAR, which can't start a JavaFX Application directly.
 * Sets up logging and the OpenCV natives before handing over to {@link ImageEditorApp}.
 */
public class ImageEditorLauncher {

    static final String LOGGING_RESOURCE = "/editor-logging.properties";

    private static final String APP_NAME = "Image Editor";

    // Held so the filtered logger isn't collected and recreated without its filter
    private static final Logger JAVAFX_LOGGER = Logger.getLogger("javafx");

    public static void main(String[] args) {
        configureLogging();

        // macOS menu bar name, read when the toolkit starts
        System.setProperty("apple.awt.application.name", APP_NAME);
        System.setProperty("com.apple.mrj.application.apple.menu.about.name", APP_NAME);

        if (!loadOpenCV()) {
            System.exit(1);
        }
        ImageEditorApp.main(args);
    }

    /**
     * Apply the bundled JUL configuration unless the user passed their own
     * with -Djava.util.logging.config.file, then mute JavaFX's classpath warning.
     *
     * @return true if the bundled configuration was applied
     */
    static boolean configureLogging() {
        boolean applied = false;
        if (System.getProperty("java.util.logging.config.file") == null) {
            try (InputStream in = ImageEditorLauncher.class.getResourceAsStream(LOGGING_RESOURCE)) {
                if (in != null) {
                    LogManager.getLogManager().readConfiguration(in);
                    applied = true;
                }
            } catch (IOException e) {
                Logger.getLogger(ImageEditorLauncher.class.getName())
                        .log(Level.WARNING, "Cannot read " + LOGGING_RESOURCE, e);
            }
        }

        // JavaFX loaded from the classpath rather than the module path logs this on every start
        JAVAFX_LOGGER.setFilter(record -> record.getMessage() == null
                || !record.getMessage().contains("Unsupported JavaFX configuration"));
        return applied;
    }

    private static boolean loadOpenCV() {
        try {
            nu.pattern.OpenCV.loadLocally();
            return true;
        } catch (UnsatisfiedLinkError | RuntimeException e) {
            Logger.getLogger(ImageEditorLauncher.class.getName())
                    .log(Level.SEVERE, "Cannot load the OpenCV native library for "
                            + System.getProperty("os.name") + "/" + System.getProperty("os.arch"), e);
            return false;
        }
    }
}
