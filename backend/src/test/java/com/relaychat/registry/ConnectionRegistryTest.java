package com.relaychat.registry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.relaychat.support.RecordingConnection;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class ConnectionRegistryTest {

    private final ConnectionRegistry registry = new ConnectionRegistry();

    @Test
    void addIsIdempotent() {
        RecordingConnection conn = RecordingConnection.healthy("c1");

        assertTrue(registry.add(conn));
        assertFalse(registry.add(conn));
        assertEquals(1, registry.size());
    }

    @Test
    void removeOfAbsentConnectionIsNoOp() {
        RecordingConnection present = RecordingConnection.healthy("c1");
        registry.add(present);

        assertFalse(registry.remove(RecordingConnection.healthy("c2")));
        assertTrue(registry.remove(present));
        assertFalse(registry.remove(present));
        assertEquals(0, registry.size());
    }

    @Test
    void snapshotIsStableWhileMembershipChanges() {
        RecordingConnection c1 = RecordingConnection.healthy("c1");
        RecordingConnection c2 = RecordingConnection.healthy("c2");
        registry.add(c1);
        registry.add(c2);

        List<ClientConnection> snapshot = registry.snapshot();
        registry.remove(c1);
        registry.add(RecordingConnection.healthy("c3"));

        assertEquals(2, snapshot.size());
        assertTrue(snapshot.contains(c1));
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add(c1));
        assertFalse(registry.snapshot().contains(c1));
        assertEquals(2, registry.snapshot().size());
    }

    @Test
    void concurrentAddRemoveAndSnapshotKeepMembershipConsistent() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> tasks = new ArrayList<>();
        List<RecordingConnection> kept = new ArrayList<>();

        for (int t = 0; t < 8; t++) {
            RecordingConnection keep = RecordingConnection.healthy("keep-" + t);
            kept.add(keep);
            int worker = t;
            tasks.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < 500; i++) {
                    RecordingConnection churn = RecordingConnection.healthy(worker + "-" + i);
                    registry.add(churn);
                    registry.snapshot();
                    registry.remove(churn);
                }
                registry.add(keep);
                return null;
            }));
        }
        start.countDown();
        for (Future<?> task : tasks) {
            task.get(30, TimeUnit.SECONDS);
        }
        pool.shutdown();

        assertEquals(8, registry.size());
        assertTrue(registry.snapshot().containsAll(kept));
    }
}
