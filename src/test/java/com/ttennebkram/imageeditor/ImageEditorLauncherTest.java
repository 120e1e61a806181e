package com.ttennebkram.imageeditor;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.logging.Filter;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class ImageEditorLauncherTest {

    @Test
    @DisplayName("Bundled logging configuration sets the editor's log level")
    void testBundledLoggingConfiguration() {
        assumeTrue(System.getProperty("java.util.logging.config.file") == null);

        assertNotNull(ImageEditorLauncher.class.getResource(ImageEditorLauncher.LOGGING_RESOURCE));
        assertTrue(ImageEditorLauncher.configureLogging());
        assertEquals(Level.INFO, Logger.getLogger("com.ttennebkram.imageeditor").getLevel());
    }

    @Test
    @DisplayName("JavaFX classpath warning is muted, other JavaFX messages pass")
    void testJavaFXWarningFiltered() {
        ImageEditorLauncher.configureLogging();
        Filter filter = Logger.getLogger("javafx").getFilter();

        assertNotNull(filter);
        assertFalse(filter.isLoggable(new LogRecord(Level.WARNING,
                "Unsupported JavaFX configuration: classes were loaded from 'unnamed module'")));
        assertTrue(filter.isLoggable(new LogRecord(Level.WARNING, "Something else")));
        assertTrue(filter.isLoggable(new LogRecord(Level.INFO, null)));
    }
}
