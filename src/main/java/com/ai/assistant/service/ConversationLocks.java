package com.ai.assistant.service;

import com.ai.assistant.config.DialogueProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One fair lock per sender. Work for different senders never contends.
 */
@Component
public class ConversationLocks {

    private static final Logger log = LoggerFactory.getLogger(ConversationLocks.class);

    // entries are never evicted; one small lock per sender that ever wrote
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Duration timeout;

    public ConversationLocks(DialogueProperties properties) {
        this.timeout = properties.lockTimeout();
    }

    /**
     * Runs {@code work} while holding the sender's lock.
     *
     * @return false when the lock could not be taken within the timeout
     */
    public boolean runExclusively(String senderId, Runnable work) {
        ReentrantLock lock = locks.computeIfAbsent(senderId, key -> new ReentrantLock(true));
        boolean acquired;
        try {
            acquired = lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[{}] Interrupted while waiting for conversation lock", senderId);
            return false;
        }
        if (!acquired) {
            log.error("[{}] Conversation lock not acquired within {}", senderId, timeout);
            return false;
        }
        try {
            work.run();
            return true;
        } finally {
            lock.unlock();
        }
    }
}
