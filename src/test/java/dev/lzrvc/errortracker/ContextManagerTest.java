package dev.lzrvc.errortracker;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ContextManagerTest {

    @Test
    void setTags_mergesIntoExisting() {
        ContextManager context = new ContextManager();
        context.setTags(Map.of("a", "1"));
        context.setTags(Map.of("b", "2"));
        assertEquals(Map.of("a", "1", "b", "2"), context.getTags());
    }

    @Test
    void setTag_nullValueRemovesTag() {
        ContextManager context = new ContextManager();
        context.setTag("a", "1");
        context.setTag("a", null);
        assertTrue(context.getTags().isEmpty());
    }

    @Test
    void setExtras_mergeAndConvert() {
        ContextManager context = new ContextManager();
        context.setExtra("count", 3);
        context.setExtras(Map.of("items", List.of("x"), "count", 4));

        Map<String, Value> extras = context.getExtras();
        assertEquals(Value.of(4), extras.get("count"));
        assertEquals(Value.of(List.of("x")), extras.get("items"));
    }

    @Test
    void getters_returnCopies() {
        ContextManager context = new ContextManager();
        context.setTag("a", "1");
        context.setExtra("e", 1);
        context.setContext("os", Map.of("name", "linux"));
        context.setFingerprint(List.of("f"));

        context.getTags().put("b", "2");
        context.getExtras().clear();
        context.getContexts().clear();
        context.getFingerprint().add("g");

        assertEquals(Map.of("a", "1"), context.getTags());
        assertEquals(1, context.getExtras().size());
        assertEquals(1, context.getContexts().size());
        assertEquals(List.of("f"), context.getFingerprint());
    }

    @Test
    void setFingerprint_copiesInputAndSkipsNulls() {
        ContextManager context = new ContextManager();
        List<String> parts = new ArrayList<>();
        parts.add("a");
        parts.add(null);
        context.setFingerprint(parts);
        parts.add("late");

        assertEquals(List.of("a"), context.getFingerprint());
    }

    @Test
    void setUser_andRequest_replace() {
        ContextManager context = new ContextManager();
        context.setUser(new UserContext.Builder().id("1").build());
        context.setUser(new UserContext.Builder().id("2").build());
        context.setRequest(new RequestContext.Builder().url("/a").build());
        context.setRequest(new RequestContext.Builder().url("/b").build());

        assertEquals("2", context.getUser().getId());
        assertEquals("/b", context.getRequest().getUrl());
    }

    @Test
    void setContext_nullRemoves() {
        ContextManager context = new ContextManager();
        context.setContext("os", "linux");
        context.setContext("os", null);
        assertTrue(context.getContexts().isEmpty());
    }

    @Test
    void clear_resetsEveryField() {
        ContextManager context = new ContextManager();
        context.setUser(new UserContext.Builder().id("1").build());
        context.setTag("a", "1");
        context.setExtra("e", 1);
        context.setContext("os", "linux");
        context.setLevel(Severity.FATAL);
        context.setFingerprint(List.of("f"));
        context.setRequest(new RequestContext.Builder().url("/a").build());

        context.clear();

        assertNull(context.getUser());
        assertTrue(context.getTags().isEmpty());
        assertTrue(context.getExtras().isEmpty());
        assertTrue(context.getContexts().isEmpty());
        assertNull(context.getLevel());
        assertTrue(context.getFingerprint().isEmpty());
        assertNull(context.getRequest());
    }
}
