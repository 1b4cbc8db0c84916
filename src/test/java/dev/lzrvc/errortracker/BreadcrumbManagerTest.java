package dev.lzrvc.errortracker;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class BreadcrumbManagerTest {

    private static Breadcrumb crumb(String message) {
        return new Breadcrumb.Builder(BreadcrumbType.CUSTOM, BreadcrumbLevel.INFO).message(message).build();
    }

    private static List<String> messages(BreadcrumbManager manager) {
        List<String> out = new ArrayList<>();
        for (Breadcrumb b : manager.getAll()) out.add(b.getMessage());
        return out;
    }

    @Test
    void add_keepsInsertionOrder() {
        BreadcrumbManager manager = new BreadcrumbManager(5);
        manager.add(crumb("a"));
        manager.add(crumb("b"));
        manager.add(crumb("c"));

        assertEquals(List.of("a", "b", "c"), messages(manager));
        assertEquals(3, manager.count());
    }

    @Test
    void add_overflowEvictsOldest() {
        BreadcrumbManager manager = new BreadcrumbManager(3);
        for (int i = 0; i < 10; i++) {
            manager.add(crumb("m" + i));
        }

        assertEquals(List.of("m7", "m8", "m9"), messages(manager));
        assertEquals(3, manager.count());
    }

    @Test
    void add_ignoresNull() {
        BreadcrumbManager manager = new BreadcrumbManager(3);
        manager.add(null);
        assertEquals(0, manager.count());
    }

    @Test
    void zeroCapacity_holdsNothing() {
        BreadcrumbManager manager = new BreadcrumbManager(0);
        manager.add(crumb("a"));
        assertEquals(0, manager.count());
        assertTrue(manager.getAll().isEmpty());
    }

    @Test
    void negativeCapacity_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new BreadcrumbManager(-1));
    }

    @Test
    void getAll_returnsSnapshot() {
        BreadcrumbManager manager = new BreadcrumbManager(3);
        manager.add(crumb("a"));

        List<Breadcrumb> snapshot = manager.getAll();
        snapshot.clear();
        manager.add(crumb("b"));

        assertTrue(snapshot.isEmpty());
        assertEquals(2, manager.count());
    }

    @Test
    void clear_emptiesBuffer() {
        BreadcrumbManager manager = new BreadcrumbManager(3);
        manager.add(crumb("a"));
        manager.clear();
        assertEquals(0, manager.count());
        assertEquals(3, manager.getMaxSize());
    }

    @Test
    void concurrentAdds_neverExceedCapacity() throws Exception {
        BreadcrumbManager manager = new BreadcrumbManager(50);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        try {
            for (int t = 0; t < 8; t++) {
                int thread = t;
                pool.execute(() -> {
                    try {
                        start.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return;
                    }
                    for (int i = 0; i < 500; i++) manager.add(crumb(thread + "-" + i));
                });
            }
            start.countDown();
        } finally {
            pool.shutdown();
        }
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
        assertEquals(50, manager.count());
    }
}
