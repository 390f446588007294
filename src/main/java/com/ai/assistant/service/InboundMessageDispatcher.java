package com.ai.assistant.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Hands inbound messages to the processing pool. Messages of one sender are chained so
 * they run strictly in arrival order; different senders run in parallel.
 */
@Service
public class InboundMessageDispatcher {

    private static final Logger log = LoggerFactory.getLogger(InboundMessageDispatcher.class);

    private final Map<String, CompletableFuture<Void>> tails = new ConcurrentHashMap<>();
    private final DialogueEngine dialogueEngine;
    private final Executor executor;

    public InboundMessageDispatcher(DialogueEngine dialogueEngine,
                                    @Qualifier("inboundMessageExecutor") Executor executor) {
        this.dialogueEngine = dialogueEngine;
        this.executor = executor;
    }

    /**
     * @return completes once the message has been processed, exceptionally if it was
     * rejected by the pool or processing threw
     */
    public CompletableFuture<Void> submit(String senderId, String text, Instant timestamp) {
        CompletableFuture<Void> done = new CompletableFuture<>();
        CompletableFuture<Void> previous = tails.put(senderId, done);
        if (previous == null) {
            schedule(done, senderId, text, timestamp);
        } else {
            previous.whenComplete((ignored, error) -> schedule(done, senderId, text, timestamp));
        }
        done.whenComplete((ignored, error) -> tails.remove(senderId, done));
        return done;
    }

    int pendingSenders() {
        return tails.size();
    }

    private void schedule(CompletableFuture<Void> done, String senderId, String text, Instant timestamp) {
        try {
            executor.execute(() -> {
                try {
                    dialogueEngine.handle(senderId, text, timestamp);
                    done.complete(null);
                } catch (RuntimeException e) {
                    log.error("[{}] Message processing failed", senderId, e);
                    done.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.error("[{}] Processing pool saturated, message dropped: '{}'", senderId, text);
            done.completeExceptionally(e);
        }
    }
}
