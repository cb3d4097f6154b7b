package com.animaframework.core.runloop;

import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.LockSupport;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.agrona.concurrent.Agent;
import org.agrona.concurrent.AgentRunner;
import org.agrona.concurrent.BackoffIdleStrategy;
import org.agrona.concurrent.IdleStrategy;

/**
 * Runloop 负责专属工作线程的管理。
 * 基于 Agrona AgentRunner 实现单线程事件循环，循环体由注册的 {@link EventSource} 提供。
 * <p>
 * 1. 使用 BackoffIdleStrategy 作自旋 -> yield -> park 折中，空闲时不忙等。
 * 2. 生产者提交任务后调用 {@link #wakeup()}（LockSupport.unpark）提高响应性。
 * 3. start() 会等待工作线程真正进入循环，保证 onStart/onClose 成对出现在工作线程上。
 */
@Slf4j
public class Runloop {

    private final String name;
    private final IdleStrategy idleStrategy;
    private final RunloopAgent coreAgent;
    private final CountDownLatch started = new CountDownLatch(1);
    private AgentRunner agentRunner;
    private volatile boolean running = false;
    @Getter
    private volatile Thread coreThread;
    private volatile EventSource eventSource;

    /**
     * 使用默认退避参数
     *
     * @param name runloop 名称（用于线程名）
     */
    public Runloop(String name) {
        this(name, 1, 1, TimeUnit.NANOSECONDS.toNanos(50), TimeUnit.MICROSECONDS.toNanos(100));
    }

    /**
     * 可配置版本
     *
     * @param name            名称
     * @param maxSpins        空闲时最多自旋次数
     * @param maxYields       空闲时最多 yield 次数
     * @param minParkPeriodNs 最短 park 时长
     * @param maxParkPeriodNs 最长 park 时长
     */
    public Runloop(String name, long maxSpins, long maxYields, long minParkPeriodNs, long maxParkPeriodNs) {
        this.name = Objects.requireNonNull(name, "name");
        this.idleStrategy = new BackoffIdleStrategy(maxSpins, maxYields, minParkPeriodNs, maxParkPeriodNs);
        this.coreAgent = new RunloopAgent();
    }

    /**
     * 注册事件源，必须在 {@link #start()} 之前调用
     */
    public void registerEventSource(EventSource source) {
        if (running) {
            throw new IllegalStateException("Runloop " + name + " already started");
        }
        eventSource = Objects.requireNonNull(source, "source");
        log.debug("Runloop {}: 事件源已注册。", name);
    }

    /**
     * 启动工作线程，并阻塞直到事件源的 onStart 在工作线程上执行完毕。
     */
    public void start() {
        if (running) {
            log.warn("Runloop {} already started.", name);
            return;
        }
        if (eventSource == null) {
            throw new IllegalStateException("Runloop " + name + " has no event source");
        }
        running = true;

        agentRunner = new AgentRunner(
                idleStrategy,
                throwable -> log.error("Runloop {}: 工作循环发生未捕获异常", name, throwable),
                null,
                coreAgent);

        Thread agentThread = new Thread(agentRunner, coreAgent.roleName());
        agentThread.setDaemon(true);
        agentThread.setUncaughtExceptionHandler((thread, ex) -> log.error("Runloop {} 线程发生未捕获异常", name, ex));
        coreThread = agentThread;
        agentThread.start();

        try {
            started.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Runloop {}: 等待启动时被中断。", name);
        }
        log.info("Runloop started. Thread: {}", agentThread.getName());
    }

    /**
     * 关闭 Runloop：停止工作循环，在工作线程上执行 onClose，然后等待线程退出。
     * 在工作线程自身上调用会直接抛出异常，因为线程无法 join 自己。
     */
    public void shutdown(long timeoutMillis) {
        if (!running) {
            log.warn("Runloop {} is not running, no need to shut down.", name);
            return;
        }
        if (isCoreThread()) {
            throw new IllegalStateException("Runloop " + name + " cannot be shut down from its own thread");
        }
        running = false;

        try {
            agentRunner.close();
        } catch (Exception e) {
            log.error("Runloop {} AgentRunner close error", name, e);
        }

        wakeup();

        Thread t = coreThread;
        try {
            if (t != null && t.isAlive()) {
                t.join(timeoutMillis);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Runloop {} shutdown interrupted.", name);
        }

        if (t != null && t.isAlive()) {
            log.warn("Runloop {}: 工作线程在 {} ms 内未退出。", name, timeoutMillis);
        } else {
            log.info("Runloop {} shutdown completed.", name);
        }
    }

    /**
     * 唤醒处于 park 状态的工作线程
     */
    public void wakeup() {
        Thread t = coreThread;
        if (t != null) {
            LockSupport.unpark(t);
        }
    }

    public boolean isRunning() {
        return running;
    }

    public boolean isCoreThread() {
        return Thread.currentThread() == coreThread;
    }

    /**
     * 工作循环的内容提供者。所有方法都在工作线程上调用。
     */
    public interface EventSource {

        /**
         * 处理一批事件
         *
         * @return 本次处理的事件数量，0 表示空闲
         */
        int drain();

        default void onStart() {
        }

        default void onClose() {
        }
    }

    private class RunloopAgent implements Agent {

        @Override
        public String roleName() {
            return "anima-runloop-%s".formatted(name);
        }

        @Override
        public int doWork() {
            return eventSource.drain();
        }

        @Override
        public void onStart() {
            try {
                eventSource.onStart();
            } finally {
                started.countDown();
            }
            log.info("{} started.", roleName());
        }

        @Override
        public void onClose() {
            try {
                eventSource.onClose();
            } finally {
                log.info("{} closed.", roleName());
            }
        }
    }
}
