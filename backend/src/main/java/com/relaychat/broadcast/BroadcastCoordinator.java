package com.relaychat.broadcast;

import com.relaychat.ingest.MessageCodec;
import com.relaychat.model.ChatMessage;
import com.relaychat.registry.ClientConnection;
import com.relaychat.registry.ConnectionRegistry;
import com.relaychat.store.MirrorStore;
import com.relaychat.store.PrimaryStore;
import com.relaychat.store.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs every accepted message through validate, primary insert, mirror append and
 * fan-out, in that order. Store failures are logged and the message still goes
 * out; a failed send evicts only that recipient.
 * <p>
 * Mirror append and fan-out happen under one lock, so the mirror's order is the
 * order in which every client receives broadcasts. The primary insert runs
 * outside it. Sends to all recipients run in parallel on the fan-out executor and
 * share one deadline of {@code relay.broadcast.send-time-limit-ms}; a recipient
 * whose send has not completed by then is evicted, so one stalled client holds up
 * the others by at most that limit.
 */
@Service
public class BroadcastCoordinator {

    private static final Logger log = LoggerFactory.getLogger(BroadcastCoordinator.class);

    private final PrimaryStore primaryStore;
    private final MirrorStore mirrorStore;
    private final ConnectionRegistry registry;
    private final MessageCodec codec;
    private final ExecutorService fanOutExecutor;
    private final long sendTimeLimitMillis;

    private final ReentrantLock sequencer = new ReentrantLock(true);

    public BroadcastCoordinator(PrimaryStore primaryStore,
                                MirrorStore mirrorStore,
                                ConnectionRegistry registry,
                                MessageCodec codec,
                                @Qualifier("fanOutExecutor") ExecutorService fanOutExecutor,
                                @Value("${relay.broadcast.send-time-limit-ms:5000}") long sendTimeLimitMillis) {
        this.primaryStore = primaryStore;
        this.mirrorStore = mirrorStore;
        this.registry = registry;
        this.codec = codec;
        this.fanOutExecutor = fanOutExecutor;
        this.sendTimeLimitMillis = sendTimeLimitMillis;
    }

    public BroadcastOutcome publish(ChatMessage message) {
        if (message == null || !message.isComplete()) {
            log.warn("Rejected message with missing username or body");
            return BroadcastOutcome.rejected();
        }

        ChatMessage relayed = message;
        try {
            relayed = primaryStore.insert(message);
        } catch (StoreUnavailableException e) {
            log.warn("Relaying message from '{}' without a storage id: {}", message.getUsername(), e.getMessage());
        }

        sequencer.lock();
        try {
            boolean mirrored = mirrorStore.append(relayed);
            if (!mirrored) {
                log.warn("Message from '{}' is missing from the mirror history", relayed.getUsername());
            }
            return fanOut(relayed, mirrored);
        } finally {
            sequencer.unlock();
        }
    }

    private BroadcastOutcome fanOut(ChatMessage message, boolean mirrored) {
        String frame = codec.encode(message);
        List<ClientConnection> recipients = registry.snapshot();
        int evicted = 0;

        Map<ClientConnection, Future<?>> sends = new LinkedHashMap<>();
        for (ClientConnection recipient : recipients) {
            try {
                sends.put(recipient, fanOutExecutor.submit(() -> {
                    recipient.send(frame);
                    return null;
                }));
            } catch (RejectedExecutionException e) {
                evicted += evict(recipient, "fan-out is saturated");
            }
        }

        int delivered = 0;
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(sendTimeLimitMillis);
        for (Map.Entry<ClientConnection, Future<?>> send : sends.entrySet()) {
            ClientConnection recipient = send.getKey();
            Future<?> pending = send.getValue();
            try {
                pending.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
                delivered++;
            } catch (ExecutionException e) {
                evicted += evict(recipient, e.getCause().getMessage());
            } catch (TimeoutException e) {
                pending.cancel(true);
                evicted += evict(recipient, "send did not complete within " + sendTimeLimitMillis + " ms");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                pending.cancel(true);
                evicted += evict(recipient, "broadcast interrupted");
            }
        }
        log.debug("Broadcast message from '{}' to {}/{} clients", message.getUsername(), delivered, recipients.size());
        return new BroadcastOutcome(true, message.getId(), mirrored, delivered, evicted);
    }

    private int evict(ClientConnection recipient, String reason) {
        log.warn("Failed to send to client {}, evicting it: {}", recipient.id(), reason);
        boolean removed = registry.remove(recipient);
        recipient.close();
        return removed ? 1 : 0;
    }
}
