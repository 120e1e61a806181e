package com.ttennebkram.imageeditor.model;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import org.opencv.core.Scalar;

import java.util.Objects;

/**
 * Solid RGB color used as the second operand of the boolean composites.
 */
public final class BooleanColor {

    public static final BooleanColor RED = new BooleanColor(255, 0, 0);
    public static final BooleanColor BLACK = new BooleanColor(0, 0, 0);
    public static final BooleanColor WHITE = new BooleanColor(255, 255, 255);

    private final int red;
    private final int green;
    private final int blue;

    public BooleanColor(int red, int green, int blue) {
        this.red = checkChannel("red", red);
        this.green = checkChannel("green", green);
        this.blue = checkChannel("blue", blue);
    }

    private static int checkChannel(String name, int value) {
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException(name + " must be within 0-255: " + value);
        }
        return value;
    }

    /**
     * Parse a color from a JSON array {@code [r, g, b]}.
     *
     * @throws IllegalArgumentException if the element is not a three-element array of 0-255 integers
     */
    public static BooleanColor fromJson(JsonElement element) {
        if (element == null || !element.isJsonArray() || element.getAsJsonArray().size() != 3) {
            throw new IllegalArgumentException("Expected [r, g, b], got " + element);
        }
        JsonArray array = element.getAsJsonArray();
        try {
            return new BooleanColor(array.get(0).getAsInt(), array.get(1).getAsInt(), array.get(2).getAsInt());
        } catch (NumberFormatException | UnsupportedOperationException | IllegalStateException e) {
            throw new IllegalArgumentException("Expected [r, g, b], got " + element, e);
        }
    }

    public JsonArray toJson() {
        JsonArray array = new JsonArray();
        array.add(red);
        array.add(green);
        array.add(blue);
        return array;
    }

    /**
     * The color as an OpenCV scalar in BGR order.
     */
    public Scalar toScalar() {
        return new Scalar(blue, green, red);
    }

    /**
     * Web-style hex string, e.g. {@code #ff0000}.
     */
    public String toHex() {
        return String.format("#%02x%02x%02x", red, green, blue);
    }

    public int getRed() {
        return red;
    }

    public int getGreen() {
        return green;
    }

    public int getBlue() {
        return blue;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BooleanColor)) return false;
        BooleanColor that = (BooleanColor) o;
        return red == that.red && green == that.green && blue == that.blue;
    }

    @Override
    public int hashCode() {
        return Objects.hash(red, green, blue);
    }

    @Override
    public String toString() {
        return "BooleanColor(" + red + ", " + green + ", " + blue + ")";
    }
}
