package dev.lzrvc.errortracker;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

/**
 * Thread-safe bounded buffer of breadcrumbs. When full, the oldest entry is evicted.
 */
public final class BreadcrumbManager {

    private final int maxSize;
    private final ArrayDeque<Breadcrumb> buffer;

    public BreadcrumbManager(int maxSize) {
        if (maxSize < 0) throw new IllegalArgumentException("maxSize must not be negative: " + maxSize);
        this.maxSize = maxSize;
        this.buffer  = new ArrayDeque<>(Math.max(1, maxSize));
    }

    public synchronized void add(Breadcrumb entry) {
        if (entry == null) return;
        buffer.addLast(entry);
        while (buffer.size() > maxSize) {
            buffer.pollFirst();
        }
    }

    /** Snapshot of the buffer, oldest first. */
    public synchronized List<Breadcrumb> getAll() {
        return new ArrayList<>(buffer);
    }

    public synchronized void clear() {
        buffer.clear();
    }

    public synchronized int count() {
        return buffer.size();
    }

    public int getMaxSize() {
        return maxSize;
    }
}
