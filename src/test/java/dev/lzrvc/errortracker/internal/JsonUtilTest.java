package dev.lzrvc.errortracker.internal;

import dev.lzrvc.errortracker.Value;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonUtilTest {

    @Test
    void escape_handlesControlCharacters() {
        assertEquals("\"a\\\"b\\\\c\\n\\t\\u0001\"", JsonUtil.escape("a\"b\\c\n\t\u0001"));
        assertEquals("null", JsonUtil.escape(null));
    }

    @Test
    void escape_keepsUnicode() {
        assertEquals("\"café ✓\"", JsonUtil.escape("café ✓"));
    }

    @Test
    void numberToJson_writesPlainDecimals() {
        assertEquals("42", JsonUtil.numberToJson(42));
        assertEquals("1700000000.123", JsonUtil.numberToJson(1_700_000_000.123));
        assertEquals("0.5", JsonUtil.numberToJson(0.5f));
        assertEquals("123456789012345678901234567890",
                JsonUtil.numberToJson(new BigInteger("123456789012345678901234567890")));
    }

    @Test
    void numberToJson_nonFiniteBecomesNull() {
        assertEquals("null", JsonUtil.numberToJson(Double.NaN));
        assertEquals("null", JsonUtil.numberToJson(Double.POSITIVE_INFINITY));
        assertEquals("null", JsonUtil.numberToJson(null));
    }

    @Test
    void valueToJson_writesNestedTrees() {
        Value tree = Value.of(Map.of("list", List.of(1, "two", false)));
        assertEquals("{\"list\":[1,\"two\",false]}", JsonUtil.valueToJson(tree));
        assertEquals("null", JsonUtil.valueToJson(null));
    }
}
