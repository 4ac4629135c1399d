package com.warden.core.audit;

import com.warden.core.events.EventBus;
import com.warden.core.events.GatewayEvent;
import com.warden.core.events.GatewayEvents;
import com.warden.core.metrics.GatewayMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class AsyncAuditLoggerTest {

    private AsyncAuditLogger logger;

    @AfterEach
    void tearDown() {
        if (logger != null) {
            logger.stop();
        }
    }

    private static AuditEvent event(int i) {
        return AuditEvent.builder(AuditEventType.REQUEST, "test").requestId("req-" + i).decision("APPROVED").build();
    }

    @Test
    void appendNeverBlocksAndFlushPersistsInOrder() {
        var store = new FlakyStore();
        logger = new AsyncAuditLogger(store, new EventBus(), null, 10, 3, 16);
        logger.start();

        for (int i = 0; i < 100; i++) {
            logger.append(event(i));
        }

        assertTrue(logger.flush(Duration.ofSeconds(5)));
        assertEquals(0, logger.backlog());
        assertEquals(100, store.written.size());
        for (int i = 0; i < 100; i++) {
            assertEquals("req-" + i, store.written.get(i).requestId());
        }
    }

    @Test
    void failedBatchesAreRetriedWithoutLoss() {
        var store = new FlakyStore();
        store.failuresLeft.set(2);
        var registry = new SimpleMeterRegistry();
        logger = new AsyncAuditLogger(store, new EventBus(), new GatewayMetrics(registry), 10, 5, 16);
        logger.start();

        logger.append(event(1));
        logger.append(event(2));

        assertTrue(logger.flush(Duration.ofSeconds(5)));
        assertEquals(List.of("req-1", "req-2"), store.written.stream().map(AuditEvent::requestId).toList());
        assertEquals(2.0, registry.get("warden.audit.write_failures").counter().count());
        assertFalse(logger.isAlertRaised());
    }

    @Test
    void persistentFailureRaisesOneAlertAndKeepsEvents() throws Exception {
        var store = new FlakyStore();
        store.down.set(true);
        var bus = new EventBus();
        var alerts = new CopyOnWriteArrayList<GatewayEvent>();
        bus.subscribe(GatewayEvents.ALERT_RAISED, alerts::add);
        logger = new AsyncAuditLogger(store, bus, null, 5, 3, 16);
        logger.start();

        logger.append(event(1));

        assertFalse(logger.flush(Duration.ofMillis(300)));
        assertTrue(logger.isAlertRaised());
        assertEquals(1, alerts.size());
        assertEquals("AUDIT_WRITE_FAILED", alerts.get(0).payload().get("kind"));
        assertEquals(1, logger.backlog());

        store.down.set(false);
        assertTrue(logger.flush(Duration.ofSeconds(5)));
        assertEquals(1, store.written.size());
    }

    @Test
    void flushWithoutWriterTimesOut() {
        logger = new AsyncAuditLogger(new FlakyStore(), new EventBus(), null, 10, 3, 16);

        logger.append(event(1));

        assertFalse(logger.flush(Duration.ofMillis(50)));
        assertEquals(1, logger.backlog());
        assertThrows(NullPointerException.class, () -> logger.append(null));
    }

    static class FlakyStore implements AuditStore {
        final List<AuditEvent> written = Collections.synchronizedList(new ArrayList<>());
        final AtomicInteger failuresLeft = new AtomicInteger();
        final AtomicBoolean down = new AtomicBoolean();

        @Override
        public void write(List<AuditEvent> batch) throws IOException {
            if (down.get() || failuresLeft.getAndDecrement() > 0) {
                throw new IOException("disk unavailable");
            }
            written.addAll(batch);
        }

        @Override
        public List<AuditEvent> recent(int count) {
            return List.of();
        }

        @Override
        public List<AuditEvent> eventsOn(LocalDate date) {
            return List.of();
        }

        @Override
        public List<AuditEvent> eventsByType(AuditEventType type, int limit) {
            return List.of();
        }

        @Override
        public IntegrityReport verify(LocalDate date) {
            return new IntegrityReport(date, "memory", 0, List.of());
        }

        @Override
        public int purgeOlderThan(int retentionDays) {
            return 0;
        }
    }
}
