package com.animaframework.core.queue;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import com.animaframework.core.backend.NativeBackend;
import com.animaframework.core.command.ArtboardCommandHandler;
import com.animaframework.core.command.Command;
import com.animaframework.core.command.CommandHandler;
import com.animaframework.core.command.CommandType;
import com.animaframework.core.command.FileCommandHandler;
import com.animaframework.core.command.PointerCommandHandler;
import com.animaframework.core.command.RenderCommandHandler;
import com.animaframework.core.command.StateMachineCommandHandler;
import com.animaframework.core.command.ViewModelCommandHandler;
import com.animaframework.core.command.WorkerTaskCommandHandler;
import com.animaframework.core.error.CommandQueueException;
import com.animaframework.core.error.ErrorCode;
import com.animaframework.core.handle.Handle;
import com.animaframework.core.handle.HandleRegistry;
import com.animaframework.core.handle.StateMachineHandle;
import com.animaframework.core.handle.ViewModelInstanceHandle;
import com.animaframework.core.metrics.QueueMetrics;
import com.animaframework.core.property.PropertyBus;
import com.animaframework.core.property.PropertyKey;
import com.animaframework.core.runloop.Runloop;
import com.codahale.metrics.Timer;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.agrona.concurrent.ManyToOneConcurrentLinkedQueue;

/**
 * 命令服务器：运行在队列专属工作线程上的命令执行端。
 * <p>
 * 作为 {@link Runloop} 的事件源，按 FIFO 顺序从多生产者单消费者通道取出命令，
 * 交给对应的 {@link CommandHandler} 同步执行。句柄注册表和原生后端只在这里被访问。
 * 任何单个命令的失败都不会终止工作循环。
 */
@Slf4j
@Getter
public class CommandServer implements Runloop.EventSource {

    private final String name;
    private final HandleRegistry registry;
    private final NativeBackend backend;
    private final PropertyBus propertyBus;
    private final QueueMetrics metrics;
    private final CompletionCorrelator correlator;
    private final Map<CommandType, CommandHandler> commandHandlers;
    @Getter(AccessLevel.NONE)
    private final ManyToOneConcurrentLinkedQueue<QueuedCommand> inbound;
    @Getter(AccessLevel.NONE)
    private final Consumer<StateMachineHandle> settledPublisher;
    private final int batchSize;
    @Setter
    private volatile CommandErrorListener errorListener;
    private volatile boolean closing;

    public CommandServer(String name, NativeBackend backend, PropertyBus propertyBus, QueueMetrics metrics,
            CompletionCorrelator correlator, Consumer<StateMachineHandle> settledPublisher, int batchSize) {
        this.name = name;
        this.backend = backend;
        this.propertyBus = propertyBus;
        this.metrics = metrics;
        this.correlator = correlator;
        this.settledPublisher = settledPublisher;
        this.batchSize = batchSize;
        registry = new HandleRegistry();
        inbound = new ManyToOneConcurrentLinkedQueue<>();
        commandHandlers = new EnumMap<>(CommandType.class);
        registerCommandHandlers();
    }

    private void registerCommandHandlers() {
        List<CommandHandler> handlers = List.of(
                new FileCommandHandler(),
                new ArtboardCommandHandler(),
                new StateMachineCommandHandler(),
                new ViewModelCommandHandler(),
                new RenderCommandHandler(),
                new PointerCommandHandler(),
                new WorkerTaskCommandHandler());
        for (CommandHandler handler : handlers) {
            for (CommandType type : handler.supportedTypes()) {
                CommandHandler previous = commandHandlers.put(type, handler);
                if (previous != null) {
                    throw new IllegalStateException("Command type " + type + " registered by both "
                            + previous.getClass().getSimpleName() + " and " + handler.getClass().getSimpleName());
                }
            }
        }
        for (CommandType type : CommandType.values()) {
            if (!commandHandlers.containsKey(type)) {
                throw new IllegalStateException("No handler registered for command type " + type);
            }
        }
    }

    /**
     * 放入通道，可在任意线程调用
     */
    boolean offer(QueuedCommand command) {
        return inbound.offer(command);
    }

    /**
     * 停止取新命令，正在执行的命令照常完成，剩余命令在 onClose 中取消
     */
    void beginClose() {
        closing = true;
    }

    @Override
    public void onStart() {
        registry.bindToCurrentThread();
        log.info("CommandServer {}: 工作线程就绪，后端 {}", name, backend.name());
    }

    @Override
    public int drain() {
        int processed = 0;
        QueuedCommand queued;
        while (!closing && processed < batchSize && (queued = inbound.poll()) != null) {
            execute(queued);
            processed++;
        }
        return processed;
    }

    private void execute(QueuedCommand queued) {
        Command command = queued.command();
        CommandHandler handler = commandHandlers.get(command.type());
        metrics.getCommands().mark();
        if (queued.query()) {
            metrics.getQueries().mark();
        }

        Object result = null;
        CommandQueueException failure = null;
        Timer.Context timer = metrics.getCommandExecutionTimer().time();
        try {
            result = handler.handle(this, command);
        } catch (Throwable t) {
            // Error 也在这里结束命令，否则查询永远不会完成并且工作循环会退出
            failure = toCommandQueueException(command, t);
        } finally {
            timer.stop();
        }

        if (command.type().isMutating()) {
            try {
                collectPropertyChanges();
            } catch (Throwable t) {
                log.error("CommandServer {}: 收集属性变化失败，命令 #{} {}", name, queued.requestId(),
                        command.type(), t);
            }
        }

        if (failure == null) {
            if (queued.query()) {
                correlator.complete(queued.requestId(), result);
            }
            log.debug("CommandServer {}: #{} {} 完成", name, queued.requestId(), command.type());
            return;
        }

        metrics.getCommandFailures().inc();
        if (queued.query()) {
            log.debug("CommandServer {}: 查询 #{} {} 失败: {}", name, queued.requestId(), command.type(),
                    failure.getMessage());
            correlator.completeExceptionally(queued.requestId(), failure);
        } else {
            reportFailure(queued, failure);
        }
    }

    private void reportFailure(QueuedCommand queued, CommandQueueException failure) {
        if (failure.getCode() == ErrorCode.COMMAND_FAILED) {
            log.error("CommandServer {}: 命令 #{} {} 执行失败", name, queued.requestId(), queued.command().type(),
                    failure);
        } else {
            log.warn("CommandServer {}: 命令 #{} {} 执行失败: {}", name, queued.requestId(),
                    queued.command().type(), failure.getMessage());
        }
        CommandErrorListener listener = errorListener;
        if (listener != null) {
            try {
                listener.onCommandFailed(queued.command(), failure);
            } catch (RuntimeException e) {
                log.error("CommandServer {}: CommandErrorListener 抛出异常", name, e);
            }
        }
    }

    private CommandQueueException toCommandQueueException(Command command, Throwable t) {
        if (t instanceof CommandQueueException cqe) {
            return cqe;
        }
        return new CommandQueueException(ErrorCode.COMMAND_FAILED,
                "%s failed: %s".formatted(command.type(), t.getMessage()), t);
    }

    /**
     * 把后端回报的属性变化翻译为句柄并发布给订阅者
     */
    private void collectPropertyChanges() {
        backend.drainPropertyChanges((nativeInstance, path, value) -> {
            Handle handle = registry.handleOf(nativeInstance).orElse(null);
            if (!(handle instanceof ViewModelInstanceHandle instance)) {
                return;
            }
            PropertyKey key = new PropertyKey(instance, path);
            if (propertyBus.hasSubscribers(key)) {
                metrics.getPublishedPropertyUpdates().inc(propertyBus.publish(key, value));
            }
        });
    }

    /**
     * 释放句柄并销毁其原生对象，只能在工作线程上调用
     */
    public void deleteHandle(Handle handle) {
        Object nativeObject = registry.free(handle);
        backend.destroy(nativeObject);
        if (handle instanceof ViewModelInstanceHandle instance) {
            propertyBus.closeHandle(instance);
        }
    }

    public void publishSettled(StateMachineHandle handle) {
        settledPublisher.accept(handle);
    }

    /**
     * 在工作线程上执行：取消仍在通道中的命令，销毁全部原生对象并关闭后端
     */
    @Override
    public void onClose() {
        int cancelled = cancelPending();
        List<Object> natives = registry.drainAll();
        for (Object nativeObject : natives) {
            try {
                backend.destroy(nativeObject);
            } catch (RuntimeException e) {
                log.error("CommandServer {}: 销毁原生对象失败", name, e);
            }
        }
        try {
            backend.close();
        } catch (RuntimeException e) {
            log.error("CommandServer {}: 关闭后端失败", name, e);
        }
        log.info("CommandServer {}: 已关闭，取消命令 {} 条，销毁原生对象 {} 个", name, cancelled, natives.size());
    }

    /**
     * 让通道中剩余的命令以 DISPOSED 结束
     *
     * @return 取消的命令数
     */
    int cancelPending() {
        int cancelled = 0;
        QueuedCommand queued;
        while ((queued = inbound.poll()) != null) {
            if (queued.query()) {
                correlator.fail(queued.requestId(), CommandQueueException.disposed(name));
            }
            cancelled++;
        }
        metrics.getCancelledCommands().inc(cancelled);
        return cancelled;
    }

    public int pendingCommandCount() {
        return inbound.size();
    }
}
