package com.field.audit.audit;

import com.field.audit.core.model.ChangeEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryChangeLog Tests")
class InMemoryChangeLogTest {

    private InMemoryChangeLog changeLog;

    @BeforeEach
    void setUp() {
        changeLog = new InMemoryChangeLog();
    }

    private static ChangeEntry entry(String entityId, String label) {
        return ChangeEntry.builder()
                .entityKind("node")
                .entityId(entityId)
                .revisionId("3")
                .fieldLabel(label)
                .diffText("Changed from: a\nTo: b")
                .timestamp(Instant.parse("2024-01-01T00:00:00Z"))
                .actorId("1")
                .build();
    }

    @Test
    @DisplayName("Should keep entries in append order")
    void testAppendOrder() {
        assertTrue(changeLog.append(entry("1", "Title")));
        assertTrue(changeLog.append(entry("1", "Body")));

        List<ChangeEntry> all = changeLog.findAll();
        assertEquals(2, all.size());
        assertEquals("Title", all.get(0).fieldLabel());
        assertEquals("Body", all.get(1).fieldLabel());
    }

    @Test
    @DisplayName("Should reject null entries")
    void testNullEntry() {
        assertFalse(changeLog.append(null));
        assertEquals(0, changeLog.count());
    }

    @Test
    @DisplayName("Should filter by record")
    void testFindByEntity() {
        changeLog.append(entry("1", "Title"));
        changeLog.append(entry("2", "Title"));
        changeLog.append(entry("1", "Body"));

        assertEquals(2, changeLog.findByEntity("node", "1").size());
        assertEquals(1, changeLog.findByEntity("node", "2").size());
        assertTrue(changeLog.findByEntity("media", "1").isEmpty());
    }

    @Test
    @DisplayName("findAll should return an immutable snapshot")
    void testFindAllImmutable() {
        changeLog.append(entry("1", "Title"));
        List<ChangeEntry> snapshot = changeLog.findAll();

        assertThrows(UnsupportedOperationException.class, () -> snapshot.add(entry("1", "Body")));
        changeLog.append(entry("1", "Body"));
        assertEquals(1, snapshot.size());
    }

    @Test
    @DisplayName("Should accept concurrent appends")
    void testConcurrentAppends() throws InterruptedException {
        int threads = 8;
        int perThread = 50;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch done = new CountDownLatch(threads);
        List<Throwable> errors = new ArrayList<>();

        for (int t = 0; t < threads; t++) {
            String entityId = String.valueOf(t);
            executor.submit(() -> {
                try {
                    for (int i = 0; i < perThread; i++) {
                        changeLog.append(entry(entityId, "Field " + i));
                    }
                } catch (Throwable e) {
                    synchronized (errors) {
                        errors.add(e);
                    }
                } finally {
                    done.countDown();
                }
            });
        }

        assertTrue(done.await(10, TimeUnit.SECONDS));
        executor.shutdown();
        assertTrue(errors.isEmpty());
        assertEquals(threads * perThread, changeLog.count());
    }
}
