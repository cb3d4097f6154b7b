package com.animaframework.core.queue;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import com.animaframework.core.error.CommandQueueException;
import com.animaframework.core.error.ErrorCode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CompletionCorrelatorTest {

    private CompletionCorrelator correlator;

    @BeforeEach
    void setUp() {
        correlator = new CompletionCorrelator("test");
    }

    @Test
    void requestIdsIncrease() {
        CompletionCorrelator.Pending<String> first = correlator.register();
        long fireAndForget = correlator.nextRequestId();
        CompletionCorrelator.Pending<String> second = correlator.register();
        assertTrue(first.requestId() < fireAndForget);
        assertTrue(fireAndForget < second.requestId());
        assertEquals(2, correlator.pendingCount());
    }

    @Test
    void completeResolvesOnce() throws Exception {
        CompletionCorrelator.Pending<String> pending = correlator.register();
        correlator.complete(pending.requestId(), "done");
        assertEquals("done", pending.future().get());
        assertEquals(0, correlator.pendingCount());

        CommandQueueException e = assertThrows(CommandQueueException.class,
                () -> correlator.complete(pending.requestId(), "again"));
        assertEquals(ErrorCode.DUPLICATE_COMPLETION, e.getCode());
    }

    @Test
    void unknownIdIsIgnoredAfterClose() {
        correlator.close();
        assertDoesNotThrow(() -> correlator.complete(99, "late"));
        assertDoesNotThrow(() -> correlator.completeExceptionally(99, new RuntimeException()));
    }

    @Test
    void cancelledFutureStillCompletesNormally() {
        CompletionCorrelator.Pending<String> pending = correlator.register();
        pending.future().cancel(true);
        assertDoesNotThrow(() -> correlator.complete(pending.requestId(), "ignored"));
        assertEquals(0, correlator.pendingCount());
    }

    @Test
    void failAllFailsEveryPendingFuture() {
        CompletableFuture<Object> a = correlator.register().future();
        CompletableFuture<Object> b = correlator.register().future();

        assertEquals(2, correlator.failAll(() -> CommandQueueException.disposed("test")));

        for (CompletableFuture<Object> future : List.of(a, b)) {
            ExecutionException e = assertThrows(ExecutionException.class, future::get);
            assertEquals(ErrorCode.DISPOSED, ((CommandQueueException) e.getCause()).getCode());
        }
        assertTrue(correlator.isClosed());
    }

    @Test
    void failIsLenient() {
        CompletionCorrelator.Pending<Object> pending = correlator.register();
        assertTrue(correlator.fail(pending.requestId(), new IllegalStateException()));
        assertFalse(correlator.fail(pending.requestId(), new IllegalStateException()));
        assertTrue(pending.future().isCompletedExceptionally());
    }
}
