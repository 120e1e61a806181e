package com.ttennebkram.imageeditor.io;

import com.ttennebkram.imageeditor.engine.EditOutcome;
import com.ttennebkram.imageeditor.engine.EditorEngine;
import com.ttennebkram.imageeditor.engine.ImageLoadException;
import org.opencv.core.Mat;
import org.opencv.imgcodecs.Imgcodecs;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;

/**
 * Reads image files into the engine and writes the working image back out.
 */
public final class ImageFiles {

    private static final Logger LOG = Logger.getLogger(ImageFiles.class.getName());

    public static final List<String> OPEN_EXTENSIONS = List.of("png", "jpg", "jpeg", "bmp", "webp");
    public static final List<String> SAVE_EXTENSIONS = List.of("jpg", "png", "bmp");
    public static final String DEFAULT_SAVE_EXTENSION = "jpg";

    private ImageFiles() {
    }

    /**
     * Decode a file and install it as the engine's new image.
     *
     * @throws ImageLoadException if the file is missing, unreadable or not an image
     */
    public static EditOutcome open(EditorEngine engine, Path path) throws ImageLoadException {
        if (!Files.isRegularFile(path)) {
            throw new ImageLoadException("File not found: " + path);
        }
        Mat decoded = Imgcodecs.imread(path.toString(), Imgcodecs.IMREAD_COLOR);
        if (decoded.empty()) {
            decoded.release();
            // imread can't open some non-ASCII paths; decode the bytes instead
            return openBytes(engine, path);
        }
        try {
            EditOutcome outcome = engine.load(decoded);
            LOG.info("Opened " + path);
            return outcome;
        } finally {
            decoded.release();
        }
    }

    private static EditOutcome openBytes(EditorEngine engine, Path path) throws ImageLoadException {
        byte[] data;
        try {
            data = Files.readAllBytes(path);
        } catch (IOException e) {
            throw new ImageLoadException("Cannot read " + path + ": " + e.getMessage(), e);
        }
        EditOutcome outcome = engine.loadEncoded(data);
        LOG.info("Opened " + path);
        return outcome;
    }

    /**
     * Encode the working image by the file's extension and write it.
     * A path without a supported extension gets {@value #DEFAULT_SAVE_EXTENSION} appended.
     *
     * @return The path actually written
     */
    public static Path save(EditorEngine engine, Path path) throws IOException {
        String extension = extensionOf(path);
        Path target = path;
        if (!SAVE_EXTENSIONS.contains(extension)) {
            target = path.resolveSibling(path.getFileName() + "." + DEFAULT_SAVE_EXTENSION);
            extension = DEFAULT_SAVE_EXTENSION;
        }
        byte[] encoded = engine.encodeWorking(extension);
        Files.write(target, encoded);
        LOG.info("Saved " + target + " (" + encoded.length + " bytes)");
        return target;
    }

    /**
     * Lower-case extension without the dot, or "" if there is none.
     */
    public static String extensionOf(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return "";
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return "";
        }
        return name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    public static boolean canOpen(Path path) {
        return OPEN_EXTENSIONS.contains(extensionOf(path));
    }
}
