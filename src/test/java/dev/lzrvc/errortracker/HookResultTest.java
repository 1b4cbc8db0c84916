package dev.lzrvc.errortracker;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class HookResultTest {

    @Test
    void keep_resolvesToOriginal() {
        HookResult<String> result = HookResult.keep();
        assertTrue(result.isKeep());
        assertEquals("original", result.resolve("original"));
    }

    @Test
    void replace_resolvesToReplacement() {
        HookResult<String> result = HookResult.replace("new");
        assertTrue(result.isReplace());
        assertEquals("new", result.resolve("original"));
        assertEquals("Replace(new)", result.toString());
    }

    @Test
    void replace_requiresValue() {
        assertThrows(NullPointerException.class, () -> HookResult.replace(null));
    }

    @Test
    void drop_resolvesToNull() {
        HookResult<String> result = HookResult.drop();
        assertTrue(result.isDrop());
        assertNull(result.resolve("original"));
        assertEquals("Drop", result.toString());
    }
}
