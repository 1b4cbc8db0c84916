package dev.lzrvc.errortracker;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ambient state attached to every event assembled afterwards.
 *
 * <p>Tags, extra and contexts merge; user, request, level and fingerprint replace. Getters return
 * copies of mutable containers. Not synchronized: {@link ErrorTrackerClient} guards each instance
 * together with its {@link BreadcrumbManager}.
 */
public final class ContextManager {

    private UserContext user;
    private final Map<String, String> tags = new LinkedHashMap<>();
    private final Map<String, Value> extra = new LinkedHashMap<>();
    private final Map<String, Value> contexts = new LinkedHashMap<>();
    private Severity level;
    private List<String> fingerprint = new ArrayList<>();
    private RequestContext request;

    public void setUser(UserContext user) { this.user = user; }
    public UserContext getUser()          { return user; }

    public void setTag(String key, String value) {
        if (key == null) return;
        if (value == null) {
            tags.remove(key);
        } else {
            tags.put(key, value);
        }
    }

    public void setTags(Map<String, String> tags) {
        if (tags != null) tags.forEach(this::setTag);
    }

    public void removeTag(String key) {
        if (key != null) tags.remove(key);
    }

    public Map<String, String> getTags() { return new LinkedHashMap<>(tags); }

    public void setExtra(String key, Object value) {
        if (key != null) extra.put(key, Value.of(value));
    }

    public void setExtras(Map<String, ?> extras) {
        if (extras != null) extra.putAll(Value.ofMap(extras));
    }

    public Map<String, Value> getExtras() { return new LinkedHashMap<>(extra); }

    /** Set a named context, e.g. {@code "runtime"} or {@code "device"}; {@code null} removes it. */
    public void setContext(String name, Object value) {
        if (name == null) return;
        if (value == null) {
            contexts.remove(name);
        } else {
            contexts.put(name, Value.of(value));
        }
    }

    public Map<String, Value> getContexts() { return new LinkedHashMap<>(contexts); }

    public void setLevel(Severity level) { this.level = level; }
    public Severity getLevel()           { return level; }

    public void setFingerprint(List<String> fingerprint) {
        List<String> copy = new ArrayList<>();
        if (fingerprint != null) {
            for (String part : fingerprint) {
                if (part != null) copy.add(part);
            }
        }
        this.fingerprint = copy;
    }

    public List<String> getFingerprint() { return new ArrayList<>(fingerprint); }

    public void setRequest(RequestContext request) { this.request = request; }
    public RequestContext getRequest()             { return request; }

    /** Reset every field to its initial empty state. */
    public void clear() {
        user = null;
        tags.clear();
        extra.clear();
        contexts.clear();
        level = null;
        fingerprint = new ArrayList<>();
        request = null;
    }
}
