package com.ttennebkram.imageeditor.fx;

import com.google.gson.JsonObject;
import com.ttennebkram.imageeditor.config.EditorConfig;
import com.ttennebkram.imageeditor.model.BooleanColor;
import com.ttennebkram.imageeditor.transforms.OperationKind;
import com.ttennebkram.imageeditor.transforms.TransformCatalog;
import com.ttennebkram.imageeditor.transforms.TransformCategory;
import com.ttennebkram.imageeditor.transforms.TransformParams;
import javafx.geometry.Insets;
import javafx.scene.Node;
import javafx.scene.control.*;
import javafx.scene.layout.HBox;
import javafx.scene.layout.Priority;
import javafx.scene.layout.Region;
import javafx.scene.layout.VBox;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * The left-hand control panel: one tab per transform category, with the sliders and
 * text fields each operation reads its parameters from.
 *
 * Pressing an operation button hands the operation and its parameters to the
 * onApply callback. Text fields are passed through as typed; the transforms validate them.
 */
public class FXControlPanel {

    private final TabPane tabPane = new TabPane();
    private final EditorConfig config;
    private final TransformCatalog catalog;
    private final BiConsumer<OperationKind, JsonObject> onApply;
    private final Consumer<BooleanColor> onColorChanged;
    private final Map<TransformCategory, VBox> tabContent = new EnumMap<>(TransformCategory.class);

    private ColorPicker colorPicker;

    /**
     * @param onApply Called with the operation and its parameters when a button is pressed
     * @param onColorChanged Called when the user picks a new boolean color
     */
    public FXControlPanel(EditorConfig config, TransformCatalog catalog, BooleanColor initialColor,
                          BiConsumer<OperationKind, JsonObject> onApply,
                          Consumer<BooleanColor> onColorChanged) {
        this.config = config;
        this.catalog = catalog;
        this.onApply = onApply;
        this.onColorChanged = onColorChanged;

        tabPane.setTabClosingPolicy(TabPane.TabClosingPolicy.UNAVAILABLE);
        tabPane.setPrefWidth(340);
        for (TransformCategory category : TransformCategory.values()) {
            VBox content = new VBox(6);
            content.setPadding(new Insets(10));
            tabContent.put(category, content);
            ScrollPane scroll = new ScrollPane(content);
            scroll.setFitToWidth(true);
            tabPane.getTabs().add(new Tab(category.getDisplayName(), scroll));
        }

        buildColorTab();
        buildBooleanTab(initialColor);
        buildFilterTab();
        buildMathTab();
        buildGeometryTab();
    }

    public Node getNode() {
        return tabPane;
    }

    /**
     * Enable or disable every operation button, e.g. while no image is loaded.
     */
    public void setOperationsDisabled(boolean disabled) {
        for (VBox content : tabContent.values()) {
            content.setDisable(disabled);
        }
    }

    // ========================= TABS =========================

    private void buildColorTab() {
        VBox tab = tabContent.get(TransformCategory.COLOR);

        addButton(tab, "Grayscale", OperationKind.GRAYSCALE, TransformParams::empty);
        addButton(tab, "Negative", OperationKind.NEGATIVE, TransformParams::empty);
        tab.getChildren().add(new Separator());

        addHeading(tab, "Brightness");
        Slider bright = addSlider(tab, 0.1, 3.0, config.getDefaultNumber("brightness", 1.0), "%.1f");
        addButton(tab, "Apply Brightness", OperationKind.BRIGHTNESS,
                () -> TransformParams.of("factor", tenths(bright)));

        addHeading(tab, "Saturation");
        Slider sat = addSlider(tab, 0.0, 3.0, config.getDefaultNumber("saturation", 1.0), "%.1f");
        addButton(tab, "Apply Saturation", OperationKind.SATURATION,
                () -> TransformParams.of("factor", tenths(sat)));
        tab.getChildren().add(new Separator());

        addHeading(tab, "Threshold (Binary)");
        Slider threshold = addSlider(tab, 0, 255, config.getDefaultNumber("threshold", 128), "%.0f");
        addButton(tab, "Apply Threshold", OperationKind.THRESHOLD,
                () -> TransformParams.of("threshold", Math.round(threshold.getValue())));
    }

    private void buildBooleanTab(BooleanColor initialColor) {
        VBox tab = tabContent.get(TransformCategory.BOOLEAN);

        addHeading(tab, "Boolean Logic");
        Label hint = new Label("Operations against a solid color:");
        hint.setStyle("-fx-text-fill: gray;");
        tab.getChildren().add(hint);

        colorPicker = new ColorPicker(FXImageUtils.toFxColor(initialColor));
        colorPicker.setOnAction(e -> onColorChanged.accept(FXImageUtils.fromFxColor(colorPicker.getValue())));
        HBox row = new HBox(10, new Label("Color:"), colorPicker);
        tab.getChildren().add(row);
        tab.getChildren().add(new Separator());

        addButton(tab, "NOT (Invert)", OperationKind.BOOL_NOT, TransformParams::empty);
        addButton(tab, "AND (Multiply)", OperationKind.BOOL_AND, TransformParams::empty);
        addButton(tab, "OR (Screen)", OperationKind.BOOL_OR, TransformParams::empty);
        addButton(tab, "XOR (Difference)", OperationKind.BOOL_XOR, TransformParams::empty);
    }

    private void buildFilterTab() {
        VBox tab = tabContent.get(TransformCategory.FILTER);

        addHeading(tab, "Contrast");
        Slider contrast = addSlider(tab, 0.5, 3.0, config.getDefaultNumber("contrast", 1.0), "%.1f");
        addButton(tab, "Apply Contrast", OperationKind.CONTRAST,
                () -> TransformParams.of("factor", tenths(contrast)));

        addHeading(tab, "Sharpness");
        Slider sharp = addSlider(tab, 0.0, 5.0, config.getDefaultNumber("sharpness", 1.0), "%.1f");
        addButton(tab, "Apply Sharpness", OperationKind.SHARPNESS,
                () -> TransformParams.of("factor", tenths(sharp)));
        tab.getChildren().add(new Separator());

        addHeading(tab, "Kernels & Noise");
        addButton(tab, "Add Gaussian Noise", OperationKind.NOISE, TransformParams::empty);
        addButton(tab, "Highpass Filter", OperationKind.HIGHPASS, TransformParams::empty);
    }

    private void buildMathTab() {
        VBox tab = tabContent.get(TransformCategory.ARITHMETIC);

        addHeading(tab, "Arithmetic");
        TextField scalar = addTextField(tab, "Scalar:", config.getDefaultText("mathScalar", "50"), 120);
        addButton(tab, "(+) Add", OperationKind.ADD, () -> TransformParams.of("value", scalar.getText()));
        addButton(tab, "(-) Subtract", OperationKind.SUBTRACT, () -> TransformParams.of("value", scalar.getText()));
        addButton(tab, "(*) Multiply", OperationKind.MULTIPLY, () -> TransformParams.of("value", scalar.getText()));
        addButton(tab, "(/) Divide", OperationKind.DIVIDE, () -> TransformParams.of("value", scalar.getText()));
    }

    private void buildGeometryTab() {
        VBox tab = tabContent.get(TransformCategory.GEOMETRY);

        addHeading(tab, "Translation");
        TextField tx = smallField(config.getDefaultText("translateX", "50"));
        TextField ty = smallField(config.getDefaultText("translateY", "50"));
        Button go = operationButton("Go", OperationKind.TRANSLATE,
                () -> TransformParams.of("tx", tx.getText(), "ty", ty.getText()));
        go.setMaxWidth(Region.USE_PREF_SIZE);
        tab.getChildren().add(new HBox(5, new Label("X:"), tx, new Label("Y:"), ty, go));
        tab.getChildren().add(new Separator());

        addHeading(tab, "Rotation");
        Slider rotation = addSlider(tab, 0, 360, config.getDefaultNumber("rotation", 0), "%.0f");
        addButton(tab, "Apply Rotation", OperationKind.ROTATE,
                () -> TransformParams.of("angle", Math.round(rotation.getValue())));
        tab.getChildren().add(new Separator());

        addHeading(tab, "Flip");
        Button horizontal = operationButton("Horizontal", OperationKind.FLIP, () -> TransformParams.of("axis", "H"));
        Button vertical = operationButton("Vertical", OperationKind.FLIP, () -> TransformParams.of("axis", "V"));
        HBox.setHgrow(horizontal, Priority.ALWAYS);
        HBox.setHgrow(vertical, Priority.ALWAYS);
        tab.getChildren().add(new HBox(5, horizontal, vertical));
        tab.getChildren().add(new Separator());

        addHeading(tab, "Crop (T, L, B, R)");
        TextField top = smallField(config.getDefaultText("cropTop", "0"));
        TextField left = smallField(config.getDefaultText("cropLeft", "0"));
        TextField bottom = smallField(config.getDefaultText("cropBottom", "0"));
        TextField right = smallField(config.getDefaultText("cropRight", "0"));
        tab.getChildren().add(new HBox(5, top, left, bottom, right));
        addButton(tab, "Crop", OperationKind.CROP, () -> TransformParams.builder()
                .put("top", top.getText())
                .put("left", left.getText())
                .put("bottom", bottom.getText())
                .put("right", right.getText())
                .build());
    }

    // ========================= CONTROLS =========================

    private void addHeading(VBox tab, String text) {
        Label label = new Label(text);
        label.setStyle("-fx-font-weight: bold;");
        tab.getChildren().add(label);
    }

    private Button operationButton(String text, OperationKind operation, Supplier<JsonObject> params) {
        Button button = new Button(text);
        button.setMaxWidth(Double.MAX_VALUE);
        button.setTooltip(new Tooltip(catalog.getDescription(operation)));
        button.setOnAction(e -> onApply.accept(operation, params.get()));
        return button;
    }

    private void addButton(VBox tab, String text, OperationKind operation, Supplier<JsonObject> params) {
        tab.getChildren().add(operationButton(text, operation, params));
    }

    private TextField addTextField(VBox tab, String label, String value, double width) {
        TextField field = new TextField(value);
        field.setPrefWidth(width);
        tab.getChildren().add(new HBox(10, new Label(label), field));
        return field;
    }

    private TextField smallField(String value) {
        TextField field = new TextField(value);
        field.setPrefColumnCount(3);
        return field;
    }

    // Enhancement sliders step in tenths
    private static double tenths(Slider slider) {
        return Math.round(slider.getValue() * 10) / 10.0;
    }

    private Slider addSlider(VBox tab, double min, double max, double currentValue, String formatString) {
        Slider slider = new Slider(min, max, currentValue);
        slider.setPrefWidth(220);
        slider.setShowTickMarks(true);
        slider.setShowTickLabels(true);

        double range = max - min;
        if (range <= 5) {
            slider.setMajorTickUnit(0.5);
        } else if (range <= 255) {
            slider.setMajorTickUnit(range / 5);
        } else {
            slider.setMajorTickUnit(90);
        }
        slider.setMinorTickCount(0);

        Label valueLabel = new Label(String.format(Locale.ROOT, formatString, currentValue));
        valueLabel.setMinWidth(40);
        slider.valueProperty().addListener((obs, oldVal, newVal) ->
                valueLabel.setText(String.format(Locale.ROOT, formatString, newVal.doubleValue())));

        tab.getChildren().add(new HBox(10, slider, valueLabel));
        return slider;
    }
}
