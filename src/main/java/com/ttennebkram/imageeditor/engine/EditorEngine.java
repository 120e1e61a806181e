package com.ttennebkram.imageeditor.engine;

import com.google.gson.JsonObject;
import com.ttennebkram.imageeditor.config.EditorConfig;
import com.ttennebkram.imageeditor.model.BooleanColor;
import com.ttennebkram.imageeditor.model.EditorContext;
import com.ttennebkram.imageeditor.model.RasterBuffer;
import com.ttennebkram.imageeditor.transforms.InvalidParameterException;
import com.ttennebkram.imageeditor.transforms.OperationKind;
import com.ttennebkram.imageeditor.transforms.TransformCatalog;
import com.ttennebkram.imageeditor.transforms.UnsupportedFeatureException;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfByte;
import org.opencv.core.Size;
import org.opencv.imgcodecs.Imgcodecs;
import org.opencv.imgproc.Imgproc;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The image-editing engine: loads bitmaps, runs transforms one at a time off the UI thread,
 * keeps the bounded undo history, and answers read requests from the view.
 *
 * Every mutation snapshots the current working bitmap first. A transform builds its result
 * completely before the snapshot and the new working bitmap are committed together under
 * the state lock, so a failed or rejected transform leaves no trace.
 *
 * Methods other than submit() are meant to be called from the UI thread.
 */
public class EditorEngine implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(EditorEngine.class.getName());

    private final EditorContext context;
    private final TransformCatalog catalog;
    private final EditorConfig config;
    private final ExecutionGuard guard;

    // Guards the RasterBuffer and HistoryStack in context
    private final ReentrantLock stateLock = new ReentrantLock();
    private final List<EditorListener> listeners = new CopyOnWriteArrayList<>();

    /**
     * @param uiExecutor Where completions and listener callbacks are delivered
     */
    public EditorEngine(EditorContext context, TransformCatalog catalog, EditorConfig config, Executor uiExecutor) {
        this.context = context;
        this.catalog = catalog;
        this.config = config;
        this.guard = new ExecutionGuard(uiExecutor);
        this.guard.setOnBusyChanged(this::notifyBusy);
    }

    public static EditorEngine create(EditorConfig config, Executor uiExecutor) {
        return new EditorEngine(EditorContext.create(config), new TransformCatalog(), config, uiExecutor);
    }

    public void addListener(EditorListener listener) {
        listeners.add(listener);
    }

    // ========================= LOADING =========================

    /**
     * Install a decoded bitmap as the new original and working image.
     * Grayscale, BGRA and 16-bit input are converted to 3-channel 8-bit.
     * Clears the history and resets the zoom. The caller keeps ownership of {@code pixels}.
     *
     * @throws ImageLoadException if the bitmap is empty or has no 3-channel equivalent
     */
    public EditOutcome load(Mat pixels) throws ImageLoadException {
        Mat canonical;
        try {
            canonical = RasterBuffer.toCanonical(pixels);
        } catch (RuntimeException e) {
            throw new ImageLoadException("Cannot decode image: " + e.getMessage(), e);
        }

        try {
            EditOutcome outcome = guard.runExclusive("Load", () -> {
                stateLock.lock();
                try {
                    context.getRasterBuffer().load(canonical);
                    context.getHistory().clear();
                } finally {
                    stateLock.unlock();
                }
                context.getViewport().resetZoom();
                return EditOutcome.applied("Load");
            });
            LOG.info("Loaded " + canonical.cols() + "x" + canonical.rows() + " image");
            return notifyOutcome(outcome);
        } catch (BusyRejectedException e) {
            return notifyOutcome(EditOutcome.busyRejected("Load"));
        } finally {
            canonical.release();
        }
    }

    /**
     * Decode an encoded image file (PNG, JPEG, BMP, WebP...) and load it.
     */
    public EditOutcome loadEncoded(byte[] encoded) throws ImageLoadException {
        if (encoded == null || encoded.length == 0) {
            throw new ImageLoadException("Cannot decode image: no data");
        }
        MatOfByte buffer = new MatOfByte(encoded);
        Mat decoded = Imgcodecs.imdecode(buffer, Imgcodecs.IMREAD_COLOR);
        buffer.release();
        try {
            if (decoded == null || decoded.empty()) {
                throw new ImageLoadException("Cannot decode image: unrecognized or corrupt data");
            }
            return load(decoded);
        } finally {
            if (decoded != null) {
                decoded.release();
            }
        }
    }

    /**
     * Load raw interleaved RGB pixels, row by row.
     */
    public EditOutcome loadPixels(byte[] rgb, int width, int height) throws ImageLoadException {
        if (width <= 0 || height <= 0) {
            throw new ImageLoadException("Invalid image size " + width + "x" + height);
        }
        long expected = (long) width * height * 3;
        if (rgb == null || rgb.length != expected) {
            throw new ImageLoadException("Expected " + expected + " RGB bytes for " + width + "x" + height
                    + ", got " + (rgb == null ? 0 : rgb.length));
        }
        Mat rgbMat = new Mat(height, width, CvType.CV_8UC3);
        rgbMat.put(0, 0, rgb);
        Mat bgr = new Mat();
        Imgproc.cvtColor(rgbMat, bgr, Imgproc.COLOR_RGB2BGR);
        rgbMat.release();
        try {
            return load(bgr);
        } finally {
            bgr.release();
        }
    }

    // ========================= TRANSFORMS =========================

    /**
     * Run a catalog operation in the background.
     *
     * @param operation Which transform
     * @param params Untrusted parameters; null means none
     * @return Future completed on the UI executor. Never completes exceptionally.
     */
    public CompletableFuture<EditOutcome> submit(OperationKind operation, JsonObject params) {
        String label = operation.getDisplayName();
        if (!hasImage()) {
            return CompletableFuture.completedFuture(notifyOutcome(EditOutcome.noImage(label)));
        }

        JsonObject effective = withEngineDefaults(operation, params);
        CompletableFuture<EditOutcome> future;
        try {
            future = guard.submit(label, () -> runTransform(operation, effective));
        } catch (BusyRejectedException e) {
            LOG.fine(e.getMessage());
            return CompletableFuture.completedFuture(notifyOutcome(EditOutcome.busyRejected(label)));
        }

        return future.handle((outcome, error) -> {
            if (error != null) {
                LOG.log(Level.SEVERE, label + " failed unexpectedly", error);
                return notifyOutcome(EditOutcome.failed(label, String.valueOf(error.getMessage())));
            }
            return notifyOutcome(outcome);
        });
    }

    /**
     * Worker-thread body of submit(): compute fully, then commit snapshot and result together.
     */
    private EditOutcome runTransform(OperationKind operation, JsonObject params) {
        String label = operation.getDisplayName();

        Mat input;
        stateLock.lock();
        try {
            input = context.getRasterBuffer().copyWorking();
        } finally {
            stateLock.unlock();
        }
        if (input == null) {
            return EditOutcome.noImage(label);
        }

        Mat result;
        try {
            result = catalog.apply(operation, input, params);
        } catch (InvalidParameterException e) {
            LOG.fine(label + " ignored, invalid " + e.getParameter() + ": " + e.getMessage());
            return EditOutcome.noOp(label, e.getMessage());
        } catch (UnsupportedFeatureException e) {
            LOG.warning(label + " unsupported: " + e.getMessage());
            return EditOutcome.failed(label, e.getMessage());
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, label + " failed", e);
            return EditOutcome.failed(label, label + " failed: " + e.getMessage());
        } finally {
            input.release();
        }

        commit(result);
        LOG.info("Applied " + label + " " + params);
        return EditOutcome.applied(label);
    }

    /**
     * Snapshot the working bitmap, then install {@code result} (ownership transfers).
     */
    private void commit(Mat result) {
        stateLock.lock();
        try {
            RasterBuffer buffer = context.getRasterBuffer();
            context.getHistory().push(buffer.getWorking());
            buffer.replaceWorking(result);
        } finally {
            stateLock.unlock();
        }
    }

    private JsonObject withEngineDefaults(OperationKind operation, JsonObject params) {
        JsonObject effective = params == null ? new JsonObject() : params.deepCopy();
        switch (operation) {
            case BOOL_AND:
            case BOOL_OR:
            case BOOL_XOR:
                if (!effective.has("color")) {
                    effective.add("color", context.getBooleanColor().toJson());
                }
                break;
            case NOISE:
                if (!effective.has("strength")) {
                    effective.addProperty("strength", config.getNoiseStrength());
                }
                if (!effective.has("mix")) {
                    effective.addProperty("mix", config.getNoiseMix());
                }
                break;
            default:
                break;
        }
        return effective;
    }

    // ========================= UNDO / RESET =========================

    /**
     * Restore the most recent snapshot. Reports EMPTY_HISTORY when there is nothing to undo.
     */
    public EditOutcome undo() {
        try {
            return notifyOutcome(guard.runExclusive("Undo", () -> {
                stateLock.lock();
                try {
                    RasterBuffer buffer = context.getRasterBuffer();
                    if (!buffer.isLoaded()) {
                        return EditOutcome.noImage("Undo");
                    }
                    Mat previous = context.getHistory().pop();
                    if (previous == null) {
                        return EditOutcome.emptyHistory();
                    }
                    buffer.replaceWorking(previous);
                    return EditOutcome.applied("Undo");
                } finally {
                    stateLock.unlock();
                }
            }));
        } catch (BusyRejectedException e) {
            return notifyOutcome(EditOutcome.busyRejected("Undo"));
        }
    }

    /**
     * Snapshot, then set the working bitmap back to the original.
     */
    public EditOutcome resetToOriginal() {
        try {
            return notifyOutcome(guard.runExclusive("Reset", () -> {
                stateLock.lock();
                try {
                    RasterBuffer buffer = context.getRasterBuffer();
                    if (!buffer.isLoaded()) {
                        return EditOutcome.noImage("Reset");
                    }
                    context.getHistory().push(buffer.getWorking());
                    buffer.restoreOriginal();
                    return EditOutcome.applied("Reset");
                } finally {
                    stateLock.unlock();
                }
            }));
        } catch (BusyRejectedException e) {
            return notifyOutcome(EditOutcome.busyRejected("Reset"));
        }
    }

    // ========================= BOOLEAN COLOR =========================

    public BooleanColor getBooleanColor() {
        return context.getBooleanColor();
    }

    /**
     * Set the solid color used by AND/OR/XOR. Takes effect for the next submission.
     */
    public void setBooleanColor(BooleanColor color) {
        context.setBooleanColor(color);
        LOG.fine("Boolean color set to " + color.toHex());
    }

    // ========================= READ ACCESS =========================

    public boolean hasImage() {
        stateLock.lock();
        try {
            return context.getRasterBuffer().isLoaded();
        } finally {
            stateLock.unlock();
        }
    }

    public boolean isBusy() {
        return guard.isBusy();
    }

    public int historySize() {
        stateLock.lock();
        try {
            return context.getHistory().size();
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Copy of the working bitmap, or null before the first load. Caller releases.
     */
    public Mat copyWorking() {
        stateLock.lock();
        try {
            return context.getRasterBuffer().copyWorking();
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Copy of the original bitmap, or null before the first load. Caller releases.
     */
    public Mat copyOriginal() {
        stateLock.lock();
        try {
            return context.getRasterBuffer().copyOriginal();
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Size of the working bitmap, or null before the first load.
     */
    public Size getWorkingSize() {
        stateLock.lock();
        try {
            Mat working = context.getRasterBuffer().getWorking();
            return working == null ? null : working.size();
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Working bitmap as interleaved RGB bytes, or null before the first load.
     */
    public byte[] exportWorkingPixels() {
        Mat working = copyWorking();
        if (working == null) {
            return null;
        }
        Mat rgb = new Mat();
        Imgproc.cvtColor(working, rgb, Imgproc.COLOR_BGR2RGB);
        working.release();
        byte[] pixels = new byte[(int) (rgb.total() * rgb.channels())];
        rgb.get(0, 0, pixels);
        rgb.release();
        return pixels;
    }

    /**
     * Encode the working bitmap for saving.
     *
     * @param extension Format extension with or without the dot, e.g. "png" or ".jpg"
     * @throws IOException if nothing is loaded or OpenCV can't encode that format
     */
    public byte[] encodeWorking(String extension) throws IOException {
        String ext = extension.startsWith(".") ? extension : "." + extension;
        Mat working = copyWorking();
        if (working == null) {
            throw new IOException("No image loaded");
        }
        MatOfByte encoded = new MatOfByte();
        try {
            if (!Imgcodecs.imencode(ext, working, encoded)) {
                throw new IOException("Cannot encode image as " + ext);
            }
            return encoded.toArray();
        } catch (RuntimeException e) {
            throw new IOException("Cannot encode image as " + ext + ": " + e.getMessage(), e);
        } finally {
            working.release();
            encoded.release();
        }
    }

    public EditorContext getContext() {
        return context;
    }

    public TransformCatalog getCatalog() {
        return catalog;
    }

    // ========================= NOTIFICATION =========================

    private EditOutcome notifyOutcome(EditOutcome outcome) {
        for (EditorListener listener : listeners) {
            listener.onOutcome(outcome);
        }
        return outcome;
    }

    private void notifyBusy(boolean busy) {
        for (EditorListener listener : listeners) {
            listener.onBusyChanged(busy);
        }
    }

    @Override
    public void close() {
        guard.close();
        stateLock.lock();
        try {
            context.getHistory().clear();
            context.getRasterBuffer().release();
        } finally {
            stateLock.unlock();
        }
    }
}
