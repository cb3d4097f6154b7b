package com.animaframework.core.queue;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import com.animaframework.core.error.CommandQueueException;
import com.animaframework.core.error.ErrorCode;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 测试公用的资源读取和 Future 断言
 */
final class TestFixtures {

    static final String BASIC_ANIMATION = "fixtures/basic-animation.json";

    private TestFixtures() {
    }

    static byte[] bytes(String resource) {
        try (InputStream in = TestFixtures.class.getClassLoader().getResourceAsStream(resource)) {
            assertNotNull(in, "missing test resource " + resource);
            return in.readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static <T> T await(CompletableFuture<T> future) throws Exception {
        return future.get(5, TimeUnit.SECONDS);
    }

    static CommandQueueException awaitFailure(CompletableFuture<?> future, ErrorCode expected) {
        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        Throwable cause = e.getCause();
        while (!(cause instanceof CommandQueueException) && cause != null && cause.getCause() != null) {
            cause = cause.getCause();
        }
        CommandQueueException failure = assertInstanceOf(CommandQueueException.class, cause);
        assertEquals(expected, failure.getCode(), failure.getMessage());
        return failure;
    }
}
