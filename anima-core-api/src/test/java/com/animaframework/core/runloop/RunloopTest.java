package com.animaframework.core.runloop;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RunloopTest {

    private Runloop runloop;

    @AfterEach
    void tearDown() {
        if (runloop != null && runloop.isRunning()) {
            runloop.shutdown(1000);
        }
    }

    @Test
    void lifecycleCallbacksRunOnTheWorkerThread() throws InterruptedException {
        AtomicReference<Thread> startThread = new AtomicReference<>();
        AtomicReference<Thread> drainThread = new AtomicReference<>();
        AtomicReference<Thread> closeThread = new AtomicReference<>();
        CountDownLatch drained = new CountDownLatch(1);

        runloop = new Runloop("lifecycle");
        runloop.registerEventSource(new Runloop.EventSource() {
            @Override
            public int drain() {
                drainThread.set(Thread.currentThread());
                drained.countDown();
                return 0;
            }

            @Override
            public void onStart() {
                startThread.set(Thread.currentThread());
            }

            @Override
            public void onClose() {
                closeThread.set(Thread.currentThread());
            }
        });
        runloop.start();

        // start() 返回时 onStart 已经执行完毕
        assertNotNull(startThread.get());
        assertTrue(drained.await(5, TimeUnit.SECONDS));
        runloop.shutdown(5000);

        Thread worker = runloop.getCoreThread();
        assertEquals("anima-runloop-lifecycle", worker.getName());
        assertSame(worker, startThread.get());
        assertSame(worker, drainThread.get());
        assertSame(worker, closeThread.get());
        assertFalse(worker.isAlive());
        assertFalse(runloop.isRunning());
    }

    @Test
    void failingDrainDoesNotStopTheLoop() throws InterruptedException {
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch recovered = new CountDownLatch(1);
        runloop = new Runloop("failing");
        runloop.registerEventSource(() -> {
            if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException("boom");
            }
            recovered.countDown();
            return 0;
        });
        runloop.start();
        assertTrue(recovered.await(5, TimeUnit.SECONDS));
    }

    @Test
    void startRequiresAnEventSource() {
        runloop = new Runloop("empty");
        assertThrows(IllegalStateException.class, runloop::start);
    }

    @Test
    void shutdownFromWorkerThreadIsRejected() throws InterruptedException {
        AtomicReference<Throwable> failure = new AtomicReference<>();
        CountDownLatch attempted = new CountDownLatch(1);
        runloop = new Runloop("self-shutdown");
        runloop.registerEventSource(() -> {
            if (attempted.getCount() > 0) {
                try {
                    runloop.shutdown(10);
                } catch (Throwable t) {
                    failure.set(t);
                }
                attempted.countDown();
            }
            return 0;
        });
        runloop.start();
        assertTrue(attempted.await(5, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, failure.get());
        assertTrue(runloop.isRunning());
    }
}
