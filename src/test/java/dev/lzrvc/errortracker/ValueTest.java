package dev.lzrvc.errortracker;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ValueTest {

    @Test
    void of_mapsPlainJavaValues() {
        assertInstanceOf(Value.Text.class, Value.of("s"));
        assertInstanceOf(Value.Num.class, Value.of(1L));
        assertInstanceOf(Value.Bool.class, Value.of(true));
        assertSame(Value.nullValue(), Value.of(null));
        assertInstanceOf(Value.Obj.class, Value.of(Map.of("k", 1)));
        assertInstanceOf(Value.Arr.class, Value.of(List.of(1)));
        assertInstanceOf(Value.Arr.class, Value.of(new int[] {1, 2}));
    }

    @Test
    void of_fallsBackToText() {
        assertEquals(Value.text("PT1S"), Value.of(Duration.ofSeconds(1)));
        assertEquals(Value.text("INFO"), Value.of(Severity.INFO));
        assertEquals(Value.text("x"), Value.of('x'));
    }

    @Test
    void of_primitiveAndObjectArrays() {
        assertEquals(Value.of(List.of(1L, 2L)), Value.of(new long[] {1L, 2L}));
        assertEquals(Value.of(List.of(0.5)), Value.of(new double[] {0.5}));
        assertEquals(Value.of(List.of("a", "b")), Value.of(new String[] {"a", "b"}));
    }

    @Test
    void of_selfReferencingMap_cutOffWithMarker() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("self", raw);

        Value current = assertDoesNotThrow(() -> Value.of(raw));
        int depth = 0;
        while (current instanceof Value.Obj obj) {
            current = obj.get("self");
            depth++;
        }
        assertEquals(Value.text(Sanitizer.MAX_DEPTH_MARKER), current);
        assertEquals(Sanitizer.DEFAULT_MAX_DEPTH, depth);
    }

    @Test
    void ofMap_selfReferencingList_cutOffWithMarker() {
        List<Object> loop = new ArrayList<>();
        loop.add(loop);

        Map<String, Value> out = assertDoesNotThrow(() -> Value.ofMap(Map.of("loop", loop)));
        Value current = out.get("loop");
        int depth = 1;
        while (current instanceof Value.Arr arr) {
            current = arr.items().get(0);
            depth++;
        }
        assertEquals(Value.text(Sanitizer.MAX_DEPTH_MARKER), current);
        assertEquals(Sanitizer.DEFAULT_MAX_DEPTH, depth);
    }

    @Test
    void of_returnsValuesUnchanged() {
        Value v = Value.text("same");
        assertSame(v, Value.of(v));
    }

    @Test
    void obj_isImmutableCopy() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("a", 1);
        Value.Obj obj = (Value.Obj) Value.of(raw);
        raw.put("b", 2);

        assertEquals(1, obj.entries().size());
        assertThrows(UnsupportedOperationException.class, () -> obj.entries().put("c", Value.of(3)));
    }

    @Test
    void arr_isImmutableCopy() {
        List<Object> raw = new ArrayList<>();
        raw.add("a");
        Value.Arr arr = (Value.Arr) Value.of(raw);
        raw.add("b");

        assertEquals(1, arr.items().size());
        assertThrows(UnsupportedOperationException.class, () -> arr.items().add(Value.of("c")));
    }

    @Test
    void nullEntries_becomeNullValue() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("a", null);
        assertSame(Value.nullValue(), ((Value.Obj) Value.of(raw)).get("a"));
    }

    @Test
    void unwrap_roundTripsToPlainJava() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("name", "alice");
        raw.put("tags", List.of("a", "b"));
        raw.put("age", 30);
        raw.put("admin", false);

        assertEquals(raw, Value.of(raw).unwrap());
    }

    @Test
    void toJson_keepsInsertionOrder() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("z", 1);
        raw.put("a", List.of(true, "x"));
        raw.put("n", null);

        assertEquals("{\"z\":1,\"a\":[true,\"x\"],\"n\":null}", Value.of(raw).toJson());
    }

    @Test
    void containers_reportThemselves() {
        assertTrue(Value.of(Map.of()).isContainer());
        assertTrue(Value.of(List.of()).isContainer());
        assertFalse(Value.of("x").isContainer());
        assertFalse(Value.nullValue().isContainer());
    }
}
