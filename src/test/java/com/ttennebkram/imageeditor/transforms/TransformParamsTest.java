package com.ttennebkram.imageeditor.transforms;

import com.google.gson.JsonObject;
import com.ttennebkram.imageeditor.model.BooleanColor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TransformParamsTest {

    @Test
    @DisplayName("Pairs keep their JSON types")
    void testOf() {
        JsonObject params = TransformParams.of("factor", 1.5, "axis", "H", "seed", 7L, "color", BooleanColor.RED.toJson());

        assertTrue(params.get("factor").getAsJsonPrimitive().isNumber());
        assertTrue(params.get("axis").getAsJsonPrimitive().isString());
        assertEquals(7L, params.get("seed").getAsLong());
        assertTrue(params.get("color").isJsonArray());
    }

    @Test
    @DisplayName("Odd argument count is refused")
    void testOddArguments() {
        assertThrows(IllegalArgumentException.class, () -> TransformParams.of("tx", 1, "ty"));
    }

    @Test
    @DisplayName("Null value removes the key")
    void testNullRemoves() {
        JsonObject params = TransformParams.builder().put("tx", 1).put("tx", null).build();
        assertFalse(params.has("tx"));
    }

    @Test
    @DisplayName("Built payloads are independent copies")
    void testBuildCopies() {
        TransformParams builder = TransformParams.builder().put("value", 1);
        JsonObject first = builder.build();
        builder.put("value", 2);

        assertEquals(1, first.get("value").getAsInt());
        assertEquals(2, builder.build().get("value").getAsInt());
    }
}
