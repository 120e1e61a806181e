package com.ttennebkram.imageeditor;

import com.google.gson.JsonObject;
import com.ttennebkram.imageeditor.config.EditorConfig;
import com.ttennebkram.imageeditor.engine.EditOutcome;
import com.ttennebkram.imageeditor.engine.EditorEngine;
import com.ttennebkram.imageeditor.engine.EditorListener;
import com.ttennebkram.imageeditor.engine.ImageLoadException;
import com.ttennebkram.imageeditor.fx.FXControlPanel;
import com.ttennebkram.imageeditor.fx.FXImageUtils;
import com.ttennebkram.imageeditor.fx.ImageInfoFormatter;
import com.ttennebkram.imageeditor.io.ImageFiles;
import com.ttennebkram.imageeditor.model.BooleanColor;
import com.ttennebkram.imageeditor.transforms.OperationKind;
import com.ttennebkram.imageeditor.view.Placement;
import com.ttennebkram.imageeditor.view.RenderFrame;
import com.ttennebkram.imageeditor.view.ViewCompositor;
import javafx.application.Application;
import javafx.application.Platform;
import javafx.scene.Scene;
import javafx.scene.control.*;
import javafx.scene.image.ImageView;
import javafx.scene.input.KeyCode;
import javafx.scene.input.KeyCodeCombination;
import javafx.scene.input.KeyCombination;
import javafx.scene.input.ScrollEvent;
import javafx.scene.layout.*;
import javafx.scene.paint.Color;
import javafx.stage.FileChooser;
import javafx.stage.Stage;
import org.opencv.core.Size;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.prefs.Preferences;

/**
 * Main JavaFX Application class for the Image Editor.
 * Owns the window; all image state lives in EditorEngine.
 */
public class ImageEditorApp extends Application {

    private static final Logger LOG = Logger.getLogger(ImageEditorApp.class.getName());

    // =========================== COLOR CONSTANTS ===========================
    private static final Color COLOR_INFO_NORMAL = Color.BLACK;
    private static final Color COLOR_INFO_PEEK = Color.BLUE;
    // ========================================================================

    private Stage primaryStage;
    private EditorConfig config;
    private EditorEngine engine;
    private ViewCompositor compositor;
    private FXControlPanel controlPanel;

    private Path currentFile;

    // Canvas
    private ScrollPane scrollPane;
    private Pane canvasPane;
    private ImageView imageView;

    // Status bar
    private Label infoLabel;
    private ProgressBar progressBar;
    private Label zoomLabel;

    // Recent files
    private static final int MAX_RECENT_FILES = 10;
    private static final String RECENT_FILES_KEY = "recentFiles";
    private static final String LAST_DIRECTORY_KEY = "lastDirectory";
    private Preferences prefs;
    private List<String> recentFiles = new ArrayList<>();
    private MenuButton openRecentButton;

    @Override
    public void start(Stage primaryStage) {
        this.primaryStage = primaryStage;

        String commandLineImage = null;
        for (String param : getParameters().getRaw()) {
            if ("-h".equals(param) || "--help".equals(param)) {
                printHelp();
                Platform.exit();
                return;
            } else if (!param.startsWith("-")) {
                commandLineImage = param;
            } else {
                System.err.println("Unknown option: " + param);
                printHelp();
                Platform.exit();
                return;
            }
        }

        try {
            config = EditorConfig.load();
        } catch (IOException | IllegalArgumentException e) {
            LOG.log(Level.WARNING, "Using built-in defaults, cannot read configuration", e);
            showError("Configuration Error", "Cannot read configuration, using defaults:\n" + e.getMessage());
            config = EditorConfig.defaults();
        }

        engine = EditorEngine.create(config, Platform::runLater);
        compositor = new ViewCompositor(engine.getContext().getViewport(),
                config.getFallbackViewportWidth(), config.getFallbackViewportHeight());
        engine.addListener(new EditorListener() {
            @Override
            public void onBusyChanged(boolean busy) {
                progressBar.setVisible(busy);
            }

            @Override
            public void onOutcome(EditOutcome outcome) {
                handleOutcome(outcome);
            }
        });

        prefs = Preferences.userNodeForPackage(ImageEditorApp.class);
        loadRecentFiles();

        controlPanel = new FXControlPanel(config, engine.getCatalog(), engine.getBooleanColor(),
                this::applyOperation, this::setBooleanColor);
        controlPanel.setOperationsDisabled(true);

        BorderPane root = new BorderPane();
        root.setTop(createToolBar());
        root.setLeft(controlPanel.getNode());
        root.setCenter(createCanvas());
        root.setBottom(createStatusBar());

        Scene scene = new Scene(root, 1280, 850);
        installShortcuts(scene);

        primaryStage.setTitle("Image Editor");
        primaryStage.setScene(scene);
        primaryStage.centerOnScreen();
        primaryStage.setOnCloseRequest(event -> engine.close());
        primaryStage.show();

        LOG.info("Image Editor started, OpenCV version: " + org.opencv.core.Core.VERSION);

        if (commandLineImage != null) {
            Path path = Path.of(commandLineImage);
            Platform.runLater(() -> openImage(path));
        }
    }

    private void printHelp() {
        System.out.println("Usage: image-editor [options] [image]");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  -h, --help    Show this help and exit");
        System.out.println();
        System.out.println("Configuration overrides are read from the file named by -D"
                + EditorConfig.CONFIG_PROPERTY + "=<path>");
    }

    public static void main(String[] args) {
        launch(args);
    }

    // ========================= LAYOUT =========================

    private ToolBar createToolBar() {
        Button openButton = new Button("Open");
        openButton.setOnAction(e -> openImage());

        openRecentButton = new MenuButton("Recent");
        updateOpenRecentMenu();

        Button saveButton = new Button("Save");
        saveButton.setOnAction(e -> saveImage());

        Button undoButton = new Button("Undo");
        undoButton.setOnAction(e -> engine.undo());

        Button resetButton = new Button("Reset");
        resetButton.setOnAction(e -> engine.resetToOriginal());

        Button peekButton = new Button("Hold to Compare");
        peekButton.setStyle("-fx-background-color: #ffeba0;");
        peekButton.setOnMousePressed(e -> beginPeek());
        peekButton.setOnMouseReleased(e -> endPeek());

        return new ToolBar(openButton, openRecentButton, saveButton, new Separator(),
                undoButton, resetButton, new Separator(), peekButton);
    }

    private ScrollPane createCanvas() {
        imageView = new ImageView();
        imageView.setPreserveRatio(true);
        canvasPane = new Pane(imageView);
        canvasPane.setStyle("-fx-background-color: #505050;");

        scrollPane = new ScrollPane(canvasPane);
        scrollPane.setStyle("-fx-background: #505050;");
        scrollPane.viewportBoundsProperty().addListener((obs, oldVal, newVal) -> {
            if (oldVal.getWidth() != newVal.getWidth() || oldVal.getHeight() != newVal.getHeight()) {
                redraw();
            }
        });
        scrollPane.addEventFilter(ScrollEvent.SCROLL, e -> {
            if (e.getDeltaY() > 0) {
                zoomIn();
            } else if (e.getDeltaY() < 0) {
                zoomOut();
            }
            e.consume();
        });
        return scrollPane;
    }

    private HBox createStatusBar() {
        infoLabel = new Label(ImageInfoFormatter.NO_IMAGE);

        progressBar = new ProgressBar(ProgressBar.INDETERMINATE_PROGRESS);
        progressBar.setPrefWidth(150);
        progressBar.setVisible(false);

        Region spacer = new Region();
        HBox.setHgrow(spacer, Priority.ALWAYS);

        Button zoomOutButton = new Button("-");
        zoomOutButton.setOnAction(e -> zoomOut());
        zoomLabel = new Label("100%");
        zoomLabel.setMinWidth(50);
        Button zoomInButton = new Button("+");
        zoomInButton.setOnAction(e -> zoomIn());

        HBox statusBar = new HBox(8, infoLabel, progressBar, spacer,
                new Label("Zoom:"), zoomOutButton, zoomLabel, zoomInButton);
        statusBar.setStyle("-fx-padding: 4 8 4 8; -fx-background-color: #dcdcdc;");
        return statusBar;
    }

    private void installShortcuts(Scene scene) {
        scene.getAccelerators().put(new KeyCodeCombination(KeyCode.O, KeyCombination.SHORTCUT_DOWN), this::openImage);
        scene.getAccelerators().put(new KeyCodeCombination(KeyCode.S, KeyCombination.SHORTCUT_DOWN), this::saveImage);
        scene.getAccelerators().put(new KeyCodeCombination(KeyCode.Z, KeyCombination.SHORTCUT_DOWN), engine::undo);
        scene.getAccelerators().put(new KeyCodeCombination(KeyCode.R, KeyCombination.SHORTCUT_DOWN),
                engine::resetToOriginal);
        // Plus shares a key with '=' on most layouts
        for (KeyCode code : new KeyCode[]{KeyCode.PLUS, KeyCode.EQUALS, KeyCode.ADD}) {
            scene.getAccelerators().put(new KeyCodeCombination(code, KeyCombination.SHORTCUT_DOWN), this::zoomIn);
        }
        for (KeyCode code : new KeyCode[]{KeyCode.MINUS, KeyCode.SUBTRACT}) {
            scene.getAccelerators().put(new KeyCodeCombination(code, KeyCombination.SHORTCUT_DOWN), this::zoomOut);
        }
    }

    // ========================= OPERATIONS =========================

    private void applyOperation(OperationKind operation, JsonObject params) {
        engine.submit(operation, params);
    }

    private void setBooleanColor(BooleanColor color) {
        engine.setBooleanColor(color);
    }

    private void handleOutcome(EditOutcome outcome) {
        switch (outcome.getStatus()) {
            case APPLIED:
                redraw();
                updateImageInfo();
                break;
            case BUSY_REJECTED:
                showAlert(Alert.AlertType.WARNING, "Busy", outcome.getMessage());
                break;
            case EMPTY_HISTORY:
                showAlert(Alert.AlertType.INFORMATION, "Undo", outcome.getMessage());
                break;
            case FAILED:
                showError(outcome.getOperation(), outcome.getMessage());
                break;
            case NO_OP:
            case NO_IMAGE:
            default:
                // Invalid input and operations without an image leave everything as it was
                break;
        }
    }

    // ========================= FILES =========================

    private void openImage() {
        FileChooser chooser = new FileChooser();
        chooser.setTitle("Open Image");
        chooser.getExtensionFilters().add(new FileChooser.ExtensionFilter("Images",
                ImageFiles.OPEN_EXTENSIONS.stream().map(ext -> "*." + ext).toArray(String[]::new)));
        File lastDirectory = getLastDirectory();
        if (lastDirectory != null) {
            chooser.setInitialDirectory(lastDirectory);
        }
        File file = chooser.showOpenDialog(primaryStage);
        if (file != null) {
            openImage(file.toPath());
        }
    }

    private void openImage(Path path) {
        try {
            EditOutcome outcome = ImageFiles.open(engine, path);
            if (!outcome.isApplied()) {
                return;
            }
        } catch (ImageLoadException e) {
            LOG.log(Level.WARNING, "Cannot open " + path, e);
            showError("Open Error", "Failed to open image:\n" + e.getMessage());
            return;
        }
        currentFile = path;
        rememberDirectory(path);
        addRecentFile(path.toAbsolutePath().toString());
        controlPanel.setOperationsDisabled(false);
        updateImageInfo();
        primaryStage.setTitle("Image Editor - " + path.getFileName());
    }

    private void saveImage() {
        if (!engine.hasImage()) {
            return;
        }
        FileChooser chooser = new FileChooser();
        chooser.setTitle("Save Image");
        chooser.getExtensionFilters().addAll(
                new FileChooser.ExtensionFilter("JPG", "*.jpg"),
                new FileChooser.ExtensionFilter("PNG", "*.png"),
                new FileChooser.ExtensionFilter("BMP", "*.bmp"));
        File lastDirectory = getLastDirectory();
        if (lastDirectory != null) {
            chooser.setInitialDirectory(lastDirectory);
        }
        File file = chooser.showSaveDialog(primaryStage);
        if (file == null) {
            return;
        }
        try {
            currentFile = ImageFiles.save(engine, file.toPath());
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Cannot save " + file, e);
            showError("Save Error", "Failed to save image:\n" + e.getMessage());
            return;
        }
        rememberDirectory(currentFile);
        updateImageInfo();
        showAlert(Alert.AlertType.INFORMATION, "Saved", "Image saved successfully!");
    }

    private File getLastDirectory() {
        String dir = prefs.get(LAST_DIRECTORY_KEY, null);
        if (dir == null) {
            return null;
        }
        File file = new File(dir);
        return file.isDirectory() ? file : null;
    }

    private void rememberDirectory(Path path) {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            prefs.put(LAST_DIRECTORY_KEY, parent.toString());
        }
    }

    // ========================= VIEW =========================

    private double viewportWidth() {
        return scrollPane.getViewportBounds().getWidth();
    }

    private double viewportHeight() {
        return scrollPane.getViewportBounds().getHeight();
    }

    private void redraw() {
        show(compositor.renderCurrent(engine, viewportWidth(), viewportHeight()));
    }

    private void show(RenderFrame frame) {
        zoomLabel.setText(compositor.getZoomPercent() + "%");
        if (frame == null) {
            imageView.setImage(null);
            return;
        }
        try {
            imageView.setImage(FXImageUtils.matToImage(frame.getImage()));
            Placement placement = frame.getPlacement();
            imageView.relocate(placement.getX(), placement.getY());
            if (placement.isCentered()) {
                canvasPane.setPrefSize(viewportWidth(), viewportHeight());
            } else {
                canvasPane.setPrefSize(placement.getScrollWidth(), placement.getScrollHeight());
            }
        } finally {
            frame.release();
        }
    }

    private void zoomIn() {
        if (engine.hasImage()) {
            show(compositor.zoomIn(engine, viewportWidth(), viewportHeight()));
        }
    }

    private void zoomOut() {
        if (engine.hasImage()) {
            show(compositor.zoomOut(engine, viewportWidth(), viewportHeight()));
        }
    }

    private void beginPeek() {
        if (!engine.hasImage()) {
            return;
        }
        show(compositor.beginPeek(engine, viewportWidth(), viewportHeight()));
        infoLabel.setText("Viewing Original Image");
        infoLabel.setTextFill(COLOR_INFO_PEEK);
    }

    private void endPeek() {
        if (!compositor.isPeeking()) {
            return;
        }
        show(compositor.endPeek(engine, viewportWidth(), viewportHeight()));
        updateImageInfo();
    }

    private void updateImageInfo() {
        infoLabel.setTextFill(COLOR_INFO_NORMAL);
        Size size = engine.getWorkingSize();
        if (size == null) {
            infoLabel.setText(ImageInfoFormatter.NO_IMAGE);
            return;
        }
        infoLabel.setText(ImageInfoFormatter.format((int) size.width, (int) size.height, currentFileSize()));
    }

    private Long currentFileSize() {
        if (currentFile == null || !Files.isRegularFile(currentFile)) {
            return null;
        }
        try {
            return Files.size(currentFile);
        } catch (IOException e) {
            LOG.log(Level.FINE, "Cannot read size of " + currentFile, e);
            return null;
        }
    }

    // ========================= RECENT FILES =========================

    private void loadRecentFiles() {
        String files = prefs.get(RECENT_FILES_KEY, "");
        recentFiles.clear();
        if (!files.isEmpty()) {
            for (String file : files.split("\n")) {
                if (!file.isEmpty() && new File(file).exists()) {
                    recentFiles.add(file);
                }
            }
        }
    }

    private void saveRecentFiles() {
        prefs.put(RECENT_FILES_KEY, String.join("\n", recentFiles));
    }

    private void addRecentFile(String path) {
        recentFiles.remove(path);
        recentFiles.add(0, path);
        while (recentFiles.size() > MAX_RECENT_FILES) {
            recentFiles.remove(recentFiles.size() - 1);
        }
        saveRecentFiles();
        updateOpenRecentMenu();
    }

    private void updateOpenRecentMenu() {
        openRecentButton.getItems().clear();
        for (String path : recentFiles) {
            MenuItem item = new MenuItem(new File(path).getName());
            item.setOnAction(e -> openImage(Path.of(path)));
            openRecentButton.getItems().add(item);
        }

        if (!recentFiles.isEmpty()) {
            openRecentButton.getItems().add(new SeparatorMenuItem());
            MenuItem clearItem = new MenuItem("Clear Recent");
            clearItem.setOnAction(e -> {
                recentFiles.clear();
                saveRecentFiles();
                updateOpenRecentMenu();
            });
            openRecentButton.getItems().add(clearItem);
        }

        openRecentButton.setDisable(recentFiles.isEmpty());
    }

    // ========================= DIALOGS =========================

    private void showError(String title, String message) {
        showAlert(Alert.AlertType.ERROR, title, message);
    }

    private void showAlert(Alert.AlertType type, String title, String message) {
        Alert alert = new Alert(type);
        alert.setTitle(title);
        alert.setHeaderText(null);
        alert.setContentText(message);
        alert.showAndWait();
    }
}
