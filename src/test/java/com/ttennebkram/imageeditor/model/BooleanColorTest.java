package com.ttennebkram.imageeditor.model;

import com.google.gson.JsonParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class BooleanColorTest {

    @Test
    @DisplayName("Default color is red")
    void testRed() {
        assertEquals(new BooleanColor(255, 0, 0), BooleanColor.RED);
        assertEquals("#ff0000", BooleanColor.RED.toHex());
    }

    @Test
    @DisplayName("OpenCV scalar is in BGR order")
    void testScalarOrder() {
        double[] bgr = new BooleanColor(10, 20, 30).toScalar().val;
        assertEquals(30, bgr[0]);
        assertEquals(20, bgr[1]);
        assertEquals(10, bgr[2]);
    }

    @Test
    @DisplayName("JSON array round trip")
    void testJson() {
        BooleanColor color = new BooleanColor(1, 128, 255);
        assertEquals("[1,128,255]", color.toJson().toString());
        assertEquals(color, BooleanColor.fromJson(JsonParser.parseString("[1, 128, 255]")));
    }

    @ParameterizedTest
    @ValueSource(strings = {"[1, 2]", "[1, 2, 3, 4]", "\"red\"", "[1, 2, 300]", "[-1, 0, 0]", "[\"a\", 0, 0]"})
    @DisplayName("Malformed JSON colors are rejected")
    void testInvalidJson(String json) {
        assertThrows(IllegalArgumentException.class, () -> BooleanColor.fromJson(JsonParser.parseString(json)));
    }

    @ParameterizedTest
    @CsvSource({"256, 0, 0", "0, -1, 0", "0, 0, 1000"})
    @DisplayName("Channels outside 0-255 are rejected")
    void testChannelRange(int r, int g, int b) {
        assertThrows(IllegalArgumentException.class, () -> new BooleanColor(r, g, b));
    }
}
