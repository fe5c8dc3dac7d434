package com.relaychat.store;

import com.relaychat.model.ChatMessage;
import com.relaychat.repo.ChatMessageRepository;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Authoritative message store. Every call runs on a dedicated executor and the
 * caller waits at most {@code relay.primary.timeout-ms} for it, so a slow
 * database cannot hold up the broadcast pipeline.
 */
@Service
public class PrimaryStore {

    private final ChatMessageRepository repository;
    private final ExecutorService executor;
    private final long timeoutMillis;

    public PrimaryStore(ChatMessageRepository repository,
                        @Qualifier("primaryStoreExecutor") ExecutorService executor,
                        @Value("${relay.primary.timeout-ms:5000}") long timeoutMillis) {
        this.repository = repository;
        this.executor = executor;
        this.timeoutMillis = timeoutMillis;
    }

    /**
     * Stores a copy of the message.
     *
     * @return the stored copy, carrying its generated id
     */
    public ChatMessage insert(ChatMessage message) throws StoreUnavailableException {
        ChatMessage copy = message.detached();
        return withTimeout("insert", () -> repository.save(copy));
    }

    /**
     * The newest {@code limit} messages, oldest first.
     */
    public List<ChatMessage> recent(int limit) throws StoreUnavailableException {
        List<ChatMessage> latest = new ArrayList<>(
                withTimeout("read", () -> repository.findLatest(PageRequest.of(0, limit))));
        Collections.reverse(latest);
        return latest;
    }

    private <T> T withTimeout(String operation, Callable<T> call) throws StoreUnavailableException {
        Future<T> pending;
        try {
            pending = executor.submit(call);
        } catch (RejectedExecutionException e) {
            throw new StoreUnavailableException("Primary store is saturated, " + operation + " rejected", e);
        }
        try {
            return pending.get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pending.cancel(true);
            throw new StoreUnavailableException(
                    "Primary store " + operation + " did not complete within " + timeoutMillis + " ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            throw new StoreUnavailableException("Primary store " + operation + " failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreUnavailableException("Interrupted while waiting for primary store " + operation, e);
        }
    }
}
