package com.ai.assistant.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class InboundMessageDispatcherTest {

    private static final Instant AT = Instant.parse("2025-03-10T10:00:00Z");

    @Mock
    private DialogueEngine engine;

    @Test
    void messagesOfOneSenderRunInArrivalOrder() {
        QueuedExecutor executor = new QueuedExecutor();
        InboundMessageDispatcher dispatcher = new InboundMessageDispatcher(engine, executor);

        CompletableFuture<Void> first = dispatcher.submit("alice", "send an email", AT);
        CompletableFuture<Void> second = dispatcher.submit("alice", "bob@example.com", AT);
        // the second message waits for the first one to finish
        assertEquals(1, executor.queued());

        executor.runAll();

        assertTrue(first.isDone());
        assertTrue(second.isDone());
        InOrder order = inOrder(engine);
        order.verify(engine).handle("alice", "send an email", AT);
        order.verify(engine).handle("alice", "bob@example.com", AT);
        assertEquals(0, dispatcher.pendingSenders());
    }

    @Test
    void differentSendersAreScheduledIndependently() {
        QueuedExecutor executor = new QueuedExecutor();
        InboundMessageDispatcher dispatcher = new InboundMessageDispatcher(engine, executor);

        dispatcher.submit("alice", "hi", AT);
        dispatcher.submit("bob", "hi", AT);

        assertEquals(2, executor.queued());
        assertEquals(2, dispatcher.pendingSenders());
    }

    @Test
    void failureDoesNotBlockLaterMessages() {
        doThrow(new IllegalStateException("boom")).when(engine).handle("alice", "first", AT);
        InboundMessageDispatcher dispatcher = new InboundMessageDispatcher(engine, Runnable::run);

        CompletableFuture<Void> first = dispatcher.submit("alice", "first", AT);
        CompletableFuture<Void> second = dispatcher.submit("alice", "second", AT);

        assertTrue(first.isCompletedExceptionally());
        assertFalse(second.isCompletedExceptionally());
        verify(engine).handle("alice", "second", AT);
    }

    @Test
    void saturatedPoolCompletesExceptionally() {
        Executor rejecting = task -> {
            throw new RejectedExecutionException("queue full");
        };
        InboundMessageDispatcher dispatcher = new InboundMessageDispatcher(engine, rejecting);

        CompletableFuture<Void> result = dispatcher.submit("alice", "hello", AT);

        assertTrue(result.isCompletedExceptionally());
        verify(engine, never()).handle(anyString(), anyString(), any());
        assertEquals(0, dispatcher.pendingSenders());
    }

    private static class QueuedExecutor implements Executor {

        private final List<Runnable> tasks = new ArrayList<>();

        @Override
        public void execute(Runnable command) {
            tasks.add(command);
        }

        int queued() {
            return tasks.size();
        }

        void runAll() {
            while (!tasks.isEmpty()) {
                tasks.remove(0).run();
            }
        }
    }
}
