package me.golemcore.context.domain.service;

import me.golemcore.context.domain.model.ContextWindowLog;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ContextWindowLogBufferTest {

    @Test
    void shouldReturnNewestEntriesOldestFirst() {
        ContextWindowLogBuffer buffer = new ContextWindowLogBuffer(10);
        for (int i = 1; i <= 5; i++) {
            buffer.append(entry("log-" + i));
        }

        List<ContextWindowLog> recent = buffer.recent(3);

        assertEquals(List.of("log-3", "log-4", "log-5"), recent.stream().map(ContextWindowLog::logId).toList());
    }

    @Test
    void shouldEvictOldestEntriesBeyondCapacity() {
        ContextWindowLogBuffer buffer = new ContextWindowLogBuffer(3);
        for (int i = 1; i <= 5; i++) {
            buffer.append(entry("log-" + i));
        }

        assertEquals(3, buffer.size());
        assertEquals(List.of("log-3", "log-4", "log-5"),
                buffer.recent(100).stream().map(ContextWindowLog::logId).toList());
    }

    @Test
    void shouldReturnSnapshotUnaffectedByLaterAppends() {
        ContextWindowLogBuffer buffer = new ContextWindowLogBuffer(5);
        buffer.append(entry("log-1"));

        List<ContextWindowLog> snapshot = buffer.recent(5);
        buffer.append(entry("log-2"));

        assertEquals(1, snapshot.size());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add(entry("log-3")));
    }

    @Test
    void shouldReturnEmptyForNonPositiveLimit() {
        ContextWindowLogBuffer buffer = new ContextWindowLogBuffer(5);
        buffer.append(entry("log-1"));

        assertTrue(buffer.recent(0).isEmpty());
    }

    @Test
    void shouldRejectNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new ContextWindowLogBuffer(0));
    }

    @Test
    void shouldStayBoundedUnderConcurrentAppends() throws Exception {
        int capacity = 50;
        int writers = 8;
        int appendsPerWriter = 500;
        ContextWindowLogBuffer buffer = new ContextWindowLogBuffer(capacity);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger oversized = new AtomicInteger();
        AtomicInteger unordered = new AtomicInteger();

        ExecutorService executor = Executors.newFixedThreadPool(writers + 1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int w = 0; w < writers; w++) {
                int writer = w;
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < appendsPerWriter; i++) {
                        buffer.append(entry(writer + "-" + i));
                    }
                    return null;
                }));
            }
            futures.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < appendsPerWriter; i++) {
                    List<ContextWindowLog> snapshot = buffer.recent(capacity * 2);
                    if (snapshot.size() > capacity) {
                        oversized.incrementAndGet();
                    }
                    if (!isOrderedPerWriter(snapshot)) {
                        unordered.incrementAndGet();
                    }
                }
                return null;
            }));

            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(0, oversized.get());
        assertEquals(0, unordered.get());
        assertEquals(capacity, buffer.size());
        assertEquals(capacity, buffer.recent(capacity * 2).size());
    }

    private boolean isOrderedPerWriter(List<ContextWindowLog> snapshot) {
        Map<String, Integer> lastSeen = new HashMap<>();
        for (ContextWindowLog log : snapshot) {
            String[] parts = log.logId().split("-");
            int sequence = Integer.parseInt(parts[1]);
            Integer previous = lastSeen.put(parts[0], sequence);
            if (previous != null && previous >= sequence) {
                return false;
            }
        }
        return true;
    }

    private ContextWindowLog entry(String logId) {
        return ContextWindowLog.builder()
                .logId(logId)
                .userId("user")
                .tenantId("tenant")
                .turnId("turn")
                .timestamp(Instant.parse("2026-03-01T12:00:00Z"))
                .build();
    }
}
