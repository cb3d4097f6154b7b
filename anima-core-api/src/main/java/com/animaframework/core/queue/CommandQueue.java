package com.animaframework.core.queue;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

import com.animaframework.core.backend.ArtboardSize;
import com.animaframework.core.backend.InputInfo;
import com.animaframework.core.backend.InputType;
import com.animaframework.core.backend.InstanceSource;
import com.animaframework.core.backend.NativeBackend;
import com.animaframework.core.backend.NativeBackends;
import com.animaframework.core.command.Command;
import com.animaframework.core.command.CommandType;
import com.animaframework.core.command.PackedDrawList;
import com.animaframework.core.config.QueueConfig;
import com.animaframework.core.config.QueueConfigLoader;
import com.animaframework.core.error.CommandQueueException;
import com.animaframework.core.handle.ArtboardHandle;
import com.animaframework.core.handle.FileHandle;
import com.animaframework.core.handle.StateMachineHandle;
import com.animaframework.core.handle.SurfaceHandle;
import com.animaframework.core.handle.ViewModelInstanceHandle;
import com.animaframework.core.metrics.QueueMetrics;
import com.animaframework.core.property.EventSubscription;
import com.animaframework.core.property.PropertyBus;
import com.animaframework.core.property.PropertyKey;
import com.animaframework.core.property.PropertySubscription;
import com.animaframework.core.property.PropertyType;
import com.animaframework.core.render.Alignment;
import com.animaframework.core.render.DrawCommand;
import com.animaframework.core.render.Fit;
import com.animaframework.core.render.ImageSurface;
import com.animaframework.core.render.PointerTarget;
import com.animaframework.core.runloop.Runloop;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 命令队列：调用方线程驱动渲染/动画引擎的唯一入口。
 * <p>
 * 1. 所有触及原生引擎的操作都被封装为 {@link Command}，在专属工作线程上按入队顺序执行。
 * 2. 查询返回 {@link CompletableFuture}，由工作线程通过请求 id 恰好完成一次；其他操作立即返回。
 * 3. 队列本身是引用计数资源：构造者持有第一次引用，计数归零时恰好销毁一次，
 *    未完成的查询以 DISPOSED 失败，工作线程退出并释放全部原生对象。
 * <p>
 * 所有公开方法都可以从任意线程调用。
 */
@Slf4j
public class CommandQueue implements RefCounted, AutoCloseable {

    public static final String CONSTRUCTOR_OWNER = "constructor";

    @Getter
    private final String name;
    @Getter
    private final QueueMetrics metrics;
    private final QueueConfig config;
    private final CompletionCorrelator correlator;
    private final PropertyBus propertyBus;
    private final CommandServer server;
    private final Runloop runloop;
    private final RefCount refCount;
    private final List<EventSubscription<StateMachineHandle>> settledSubscriptions = new CopyOnWriteArrayList<>();
    private final AtomicLong nextSettledSubscriptionId = new AtomicLong(1);
    private volatile boolean disposed;

    /**
     * 使用 classpath 上的配置和优先级最高的后端
     */
    public CommandQueue() {
        this(NativeBackends.loadDefault(), QueueConfigLoader.loadDefault());
    }

    public CommandQueue(NativeBackend backend) {
        this(backend, QueueConfigLoader.loadDefault());
    }

    public CommandQueue(NativeBackend backend, QueueConfig config) {
        Objects.requireNonNull(backend, "backend");
        this.config = Objects.requireNonNull(config, "config").validate();
        this.name = config.getName();
        metrics = new QueueMetrics(name);
        correlator = new CompletionCorrelator(name);
        propertyBus = new PropertyBus(config.getSubscriberBufferCapacity(), config.getOverflowPolicy(),
                metrics::recordDroppedPropertyUpdates);
        server = new CommandServer(name, backend, propertyBus, metrics, correlator, this::publishSettled,
                config.getCommandBatchSize());
        runloop = new Runloop(name, config.getIdleMaxSpins(), config.getIdleMaxYields(), config.getIdleMinParkNs(),
                config.getIdleMaxParkNs());
        runloop.registerEventSource(server);
        // 销毁要 join 工作线程，所以最后一次释放不能发生在工作线程上
        refCount = new RefCount("CommandQueue[" + name + "]", CONSTRUCTOR_OWNER, this::teardown,
                () -> !runloop.isCoreThread());

        metrics.registerGauge("pendingQueries", correlator::pendingCount);
        metrics.registerGauge("liveHandles", server.getRegistry()::liveCount);

        runloop.start();
        log.info("CommandQueue {}: 已创建，后端 {}", name, backend.name());
    }

    // ---------------------------------------------------------------- 引用计数

    @Override
    public int acquire(String owner) {
        return refCount.acquire(Objects.requireNonNull(owner, "owner"));
    }

    /**
     * 释放一次引用，计数归零时在当前线程上执行销毁（等待工作线程退出）。
     *
     * @throws CommandQueueException DOUBLE_RELEASE，释放次数超过持有次数时
     * @throws IllegalStateException 在工作线程上释放最后一次引用时
     */
    @Override
    public int release(String owner) {
        return refCount.release(Objects.requireNonNull(owner, "owner"));
    }

    /**
     * 释放构造者持有的引用
     */
    @Override
    public void close() {
        release(CONSTRUCTOR_OWNER);
    }

    @Override
    public int refCount() {
        return refCount.refCount();
    }

    @Override
    public boolean isDisposed() {
        return disposed;
    }

    @Override
    public Map<String, Integer> ownerCounts() {
        return refCount.ownerCounts();
    }

    private void teardown() {
        log.info("CommandQueue {}: 开始销毁", name);
        disposed = true;
        correlator.close();
        server.beginClose();
        runloop.shutdown(config.getShutdownTimeoutMs());
        correlator.failAll(() -> CommandQueueException.disposed(name));
        propertyBus.closeAll();
        settledSubscriptions.forEach(EventSubscription::close);
        log.info("CommandQueue {}: 已销毁", name);
    }

    // ---------------------------------------------------------------- 文件

    public CompletableFuture<FileHandle> loadFile(byte[] bytes) {
        return request(new Command.LoadFile(bytes));
    }

    public void deleteFile(FileHandle file) {
        send(new Command.DeleteFile(Objects.requireNonNull(file, "file")));
    }

    public CompletableFuture<List<String>> getArtboardNames(FileHandle file) {
        return request(new Command.ListArtboards(Objects.requireNonNull(file, "file")));
    }

    public CompletableFuture<List<String>> getViewModelNames(FileHandle file) {
        return request(new Command.ListViewModels(Objects.requireNonNull(file, "file")));
    }

    public CompletableFuture<List<String>> getViewModelInstanceNames(FileHandle file, String viewModelName) {
        return request(new Command.ListViewModelInstances(Objects.requireNonNull(file, "file"),
                Objects.requireNonNull(viewModelName, "viewModelName")));
    }

    // ---------------------------------------------------------------- 画板

    /**
     * @param name 画板名称，null 表示默认画板
     */
    public CompletableFuture<ArtboardHandle> createArtboard(FileHandle file, String name) {
        return request(new Command.CreateArtboard(Objects.requireNonNull(file, "file"), name));
    }

    public CompletableFuture<ArtboardHandle> createDefaultArtboard(FileHandle file) {
        return createArtboard(file, null);
    }

    public CompletableFuture<ArtboardHandle> createArtboardByName(FileHandle file, String name) {
        return createArtboard(file, Objects.requireNonNull(name, "name"));
    }

    public void deleteArtboard(ArtboardHandle artboard) {
        send(new Command.DeleteArtboard(Objects.requireNonNull(artboard, "artboard")));
    }

    public CompletableFuture<List<String>> getStateMachineNames(ArtboardHandle artboard) {
        return request(new Command.ListStateMachines(Objects.requireNonNull(artboard, "artboard")));
    }

    public CompletableFuture<ArtboardSize> getArtboardSize(ArtboardHandle artboard) {
        return request(new Command.GetArtboardSize(Objects.requireNonNull(artboard, "artboard")));
    }

    public void resizeArtboard(ArtboardHandle artboard, float width, float height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("artboard size must be positive, was " + width + "x" + height);
        }
        send(new Command.ResizeArtboard(Objects.requireNonNull(artboard, "artboard"), width, height));
    }

    public void resetArtboardSize(ArtboardHandle artboard) {
        send(new Command.ResetArtboardSize(Objects.requireNonNull(artboard, "artboard")));
    }

    // ---------------------------------------------------------------- 状态机

    /**
     * @param name 状态机名称，null 表示默认状态机
     */
    public CompletableFuture<StateMachineHandle> createStateMachine(ArtboardHandle artboard, String name) {
        return request(new Command.CreateStateMachine(Objects.requireNonNull(artboard, "artboard"), name));
    }

    public CompletableFuture<StateMachineHandle> createDefaultStateMachine(ArtboardHandle artboard) {
        return createStateMachine(artboard, null);
    }

    public CompletableFuture<StateMachineHandle> createStateMachineByName(ArtboardHandle artboard, String name) {
        return createStateMachine(artboard, Objects.requireNonNull(name, "name"));
    }

    public void deleteStateMachine(StateMachineHandle stateMachine) {
        send(new Command.DeleteStateMachine(Objects.requireNonNull(stateMachine, "stateMachine")));
    }

    /**
     * 推进状态机，不等待结果
     */
    public void advanceStateMachine(StateMachineHandle stateMachine, float deltaSeconds) {
        send(advanceCommand(stateMachine, deltaSeconds));
    }

    /**
     * 推进状态机并返回是否在本次推进中进入稳定状态
     */
    public CompletableFuture<Boolean> advance(StateMachineHandle stateMachine, float deltaSeconds) {
        return request(advanceCommand(stateMachine, deltaSeconds));
    }

    private Command advanceCommand(StateMachineHandle stateMachine, float deltaSeconds) {
        if (deltaSeconds < 0 || Float.isNaN(deltaSeconds)) {
            throw new IllegalArgumentException("deltaSeconds must be >= 0, was " + deltaSeconds);
        }
        return new Command.AdvanceStateMachine(Objects.requireNonNull(stateMachine, "stateMachine"), deltaSeconds);
    }

    public CompletableFuture<List<InputInfo>> getInputs(StateMachineHandle stateMachine) {
        return request(new Command.ListInputs(Objects.requireNonNull(stateMachine, "stateMachine")));
    }

    public CompletableFuture<List<String>> getInputNames(StateMachineHandle stateMachine) {
        return this.getInputs(stateMachine).thenApply(inputs -> inputs.stream().map(InputInfo::name).toList());
    }

    /**
     * 按名称查询输入信息，输入不存在时以 NOT_FOUND 失败
     */
    public CompletableFuture<InputInfo> getInputInfo(StateMachineHandle stateMachine, String inputName) {
        Objects.requireNonNull(inputName, "inputName");
        return this.getInputs(stateMachine).thenApply(inputs -> inputs.stream()
                .filter(input -> input.name().equals(inputName))
                .findFirst()
                .orElseThrow(() -> CommandQueueException.notFound("Input", inputName)));
    }

    public CompletableFuture<Float> getNumberInput(StateMachineHandle stateMachine, String inputName) {
        return request(new Command.GetInput(Objects.requireNonNull(stateMachine, "stateMachine"),
                Objects.requireNonNull(inputName, "inputName"), InputType.NUMBER));
    }

    public CompletableFuture<Boolean> getBooleanInput(StateMachineHandle stateMachine, String inputName) {
        return request(new Command.GetInput(Objects.requireNonNull(stateMachine, "stateMachine"),
                Objects.requireNonNull(inputName, "inputName"), InputType.BOOLEAN));
    }

    public void setNumberInput(StateMachineHandle stateMachine, String inputName, float value) {
        setInput(stateMachine, inputName, InputType.NUMBER, value);
    }

    public void setBooleanInput(StateMachineHandle stateMachine, String inputName, boolean value) {
        setInput(stateMachine, inputName, InputType.BOOLEAN, value);
    }

    public void fireTrigger(StateMachineHandle stateMachine, String inputName) {
        setInput(stateMachine, inputName, InputType.TRIGGER, null);
    }

    private void setInput(StateMachineHandle stateMachine, String inputName, InputType type, Object value) {
        send(new Command.SetInput(Objects.requireNonNull(stateMachine, "stateMachine"),
                Objects.requireNonNull(inputName, "inputName"), type, value));
    }

    public void bindViewModelInstance(StateMachineHandle stateMachine, ViewModelInstanceHandle instance) {
        send(new Command.BindViewModelInstance(Objects.requireNonNull(stateMachine, "stateMachine"),
                Objects.requireNonNull(instance, "instance")));
    }

    // ---------------------------------------------------------------- 指针

    /**
     * 指针按下，(x, y) 是目标表面上的坐标
     */
    public void pointerDown(PointerTarget target, int pointerId, float x, float y) {
        send(pointerCommand(CommandType.POINTER_DOWN, target, pointerId, x, y));
    }

    public void pointerMove(PointerTarget target, int pointerId, float x, float y) {
        send(pointerCommand(CommandType.POINTER_MOVE, target, pointerId, x, y));
    }

    public void pointerUp(PointerTarget target, int pointerId, float x, float y) {
        send(pointerCommand(CommandType.POINTER_UP, target, pointerId, x, y));
    }

    public void pointerExit(PointerTarget target, int pointerId) {
        send(new Command.Pointer(CommandType.POINTER_EXIT, Objects.requireNonNull(target, "target"), pointerId,
                -1f, -1f));
    }

    private Command pointerCommand(CommandType type, PointerTarget target, int pointerId, float x, float y) {
        if (!Float.isFinite(x) || !Float.isFinite(y)) {
            throw new IllegalArgumentException("pointer position must be finite, was (" + x + ", " + y + ")");
        }
        return new Command.Pointer(type, Objects.requireNonNull(target, "target"), pointerId, x, y);
    }

    // ---------------------------------------------------------------- 视图模型

    public CompletableFuture<ViewModelInstanceHandle> createBlankViewModelInstance(FileHandle file,
            String viewModelName) {
        return createViewModelInstance(file, viewModelName, null, InstanceSource.BLANK);
    }

    public CompletableFuture<ViewModelInstanceHandle> createDefaultViewModelInstance(FileHandle file,
            String viewModelName) {
        return createViewModelInstance(file, viewModelName, null, InstanceSource.DEFAULT);
    }

    public CompletableFuture<ViewModelInstanceHandle> createNamedViewModelInstance(FileHandle file,
            String viewModelName, String instanceName) {
        return createViewModelInstance(file, viewModelName, Objects.requireNonNull(instanceName, "instanceName"),
                InstanceSource.NAMED);
    }

    private CompletableFuture<ViewModelInstanceHandle> createViewModelInstance(FileHandle file, String viewModelName,
            String instanceName, InstanceSource source) {
        return request(new Command.CreateViewModelInstance(Objects.requireNonNull(file, "file"),
                Objects.requireNonNull(viewModelName, "viewModelName"), instanceName, source));
    }

    public void deleteViewModelInstance(ViewModelInstanceHandle instance) {
        send(new Command.DeleteViewModelInstance(Objects.requireNonNull(instance, "instance")));
    }

    public CompletableFuture<Float> getNumberProperty(ViewModelInstanceHandle instance, String path) {
        return getProperty(instance, path, PropertyType.NUMBER);
    }

    public CompletableFuture<String> getStringProperty(ViewModelInstanceHandle instance, String path) {
        return getProperty(instance, path, PropertyType.STRING);
    }

    public CompletableFuture<Boolean> getBooleanProperty(ViewModelInstanceHandle instance, String path) {
        return getProperty(instance, path, PropertyType.BOOLEAN);
    }

    public CompletableFuture<String> getEnumProperty(ViewModelInstanceHandle instance, String path) {
        return getProperty(instance, path, PropertyType.ENUM);
    }

    /**
     * @return ARGB 颜色
     */
    public CompletableFuture<Integer> getColorProperty(ViewModelInstanceHandle instance, String path) {
        return getProperty(instance, path, PropertyType.COLOR);
    }

    private <T> CompletableFuture<T> getProperty(ViewModelInstanceHandle instance, String path, PropertyType type) {
        return request(new Command.GetProperty(Objects.requireNonNull(instance, "instance"),
                Objects.requireNonNull(path, "path"), type));
    }

    public void setNumberProperty(ViewModelInstanceHandle instance, String path, float value) {
        setProperty(instance, path, PropertyType.NUMBER, value);
    }

    public void setStringProperty(ViewModelInstanceHandle instance, String path, String value) {
        setProperty(instance, path, PropertyType.STRING, Objects.requireNonNull(value, "value"));
    }

    public void setBooleanProperty(ViewModelInstanceHandle instance, String path, boolean value) {
        setProperty(instance, path, PropertyType.BOOLEAN, value);
    }

    public void setEnumProperty(ViewModelInstanceHandle instance, String path, String value) {
        setProperty(instance, path, PropertyType.ENUM, Objects.requireNonNull(value, "value"));
    }

    public void setColorProperty(ViewModelInstanceHandle instance, String path, int argb) {
        setProperty(instance, path, PropertyType.COLOR, argb);
    }

    public void fireTriggerProperty(ViewModelInstanceHandle instance, String path) {
        setProperty(instance, path, PropertyType.TRIGGER, null);
    }

    private void setProperty(ViewModelInstanceHandle instance, String path, PropertyType type, Object value) {
        send(new Command.SetProperty(Objects.requireNonNull(instance, "instance"),
                Objects.requireNonNull(path, "path"), type, value));
    }

    // ---------------------------------------------------------------- 订阅

    /**
     * 订阅某个属性的变化，接收任意值类型
     */
    public PropertySubscription<Object> subscribe(ViewModelInstanceHandle instance, String path) {
        return subscribe(instance, path, Object.class);
    }

    /**
     * 订阅某个属性的变化。
     * 订阅立即生效；句柄或属性不存在时，工作线程校验后以错误关闭订阅（见 {@link EventSubscription#failure()}）。
     */
    public <T> PropertySubscription<T> subscribe(ViewModelInstanceHandle instance, String path, Class<T> valueType) {
        PropertyKey key = new PropertyKey(instance, path);
        PropertySubscription<T> subscription = propertyBus.subscribe(key, valueType);
        if (!subscription.isClosed()) {
            send(new Command.SubscribeProperty(subscription.getId(), key));
        }
        return subscription;
    }

    /**
     * @return 订阅存在且此前未取消时返回 true
     */
    public boolean unsubscribe(long subscriptionId) {
        return propertyBus.unsubscribe(subscriptionId);
    }

    /**
     * 推进过程中进入稳定状态的状态机事件流
     */
    public EventSubscription<StateMachineHandle> settledEvents() {
        EventSubscription<StateMachineHandle> subscription = new EventSubscription<>(
                nextSettledSubscriptionId.getAndIncrement(), config.getSubscriberBufferCapacity(),
                config.getOverflowPolicy(), settledSubscriptions::remove);
        settledSubscriptions.add(subscription);
        if (disposed) {
            subscription.close();
        }
        return subscription;
    }

    private void publishSettled(StateMachineHandle handle) {
        for (EventSubscription<StateMachineHandle> subscription : settledSubscriptions) {
            subscription.publish(handle);
        }
    }

    // ---------------------------------------------------------------- 渲染

    public CompletableFuture<ImageSurface> createImageSurface(int width, int height) {
        ImageSurface.checkSize(width, height);
        CompletableFuture<SurfaceHandle> handle = request(new Command.CreateSurface(width, height));
        return handle.thenApply(h -> new ImageSurface(h, width, height));
    }

    public void deleteSurface(ImageSurface surface) {
        send(new Command.DeleteSurface(Objects.requireNonNull(surface, "surface").handle()));
    }

    /**
     * 绘制单个画板，不读回
     *
     * @param stateMachine 可为 null
     */
    public void draw(ImageSurface surface, ArtboardHandle artboard, StateMachineHandle stateMachine, Fit fit,
            Alignment alignment, int clearColor) {
        send(drawCommand(surface, artboard, stateMachine, fit, alignment, clearColor, null));
    }

    /**
     * 绘制单个画板并读回 RGBA 像素
     */
    public CompletableFuture<byte[]> drawToBuffer(ImageSurface surface, ArtboardHandle artboard,
            StateMachineHandle stateMachine, Fit fit, Alignment alignment, int clearColor) {
        Objects.requireNonNull(surface, "surface");
        return request(drawCommand(surface, artboard, stateMachine, fit, alignment, clearColor,
                new byte[surface.byteSize()]));
    }

    private Command drawCommand(ImageSurface surface, ArtboardHandle artboard, StateMachineHandle stateMachine,
            Fit fit, Alignment alignment, int clearColor, byte[] readback) {
        return new Command.Draw(Objects.requireNonNull(surface, "surface"),
                Objects.requireNonNull(artboard, "artboard"), stateMachine, Objects.requireNonNull(fit, "fit"),
                Objects.requireNonNull(alignment, "alignment"), clearColor, readback);
    }

    /**
     * 一次提交整批绘制，不读回。命令内容在入队时被复制，调用方可以立即复用。
     *
     * @throws IllegalArgumentException commands 为空时
     */
    public void drawBatch(ImageSurface surface, List<DrawCommand> commands, int clearColor) {
        send(new Command.DrawBatch(Objects.requireNonNull(surface, "surface"), pack(commands), clearColor, null));
    }

    public CompletableFuture<byte[]> drawBatchToBuffer(ImageSurface surface, List<DrawCommand> commands,
            int clearColor) {
        Objects.requireNonNull(surface, "surface");
        return drawBatchToBuffer(surface, commands, clearColor, new byte[surface.byteSize()]);
    }

    /**
     * 整批绘制并把 RGBA 像素读回到 dest
     *
     * @throws IllegalArgumentException commands 为空或 dest 小于 width * height * 4 时
     */
    public CompletableFuture<byte[]> drawBatchToBuffer(ImageSurface surface, List<DrawCommand> commands,
            int clearColor, byte[] dest) {
        Objects.requireNonNull(surface, "surface");
        Objects.requireNonNull(dest, "dest");
        if (dest.length < surface.byteSize()) {
            throw new IllegalArgumentException(
                    "buffer too small: %d < %d".formatted(dest.length, surface.byteSize()));
        }
        return request(new Command.DrawBatch(surface, pack(commands), clearColor, dest));
    }

    private PackedDrawList pack(List<DrawCommand> commands) {
        Objects.requireNonNull(commands, "commands");
        if (commands.isEmpty()) {
            throw new IllegalArgumentException("draw batch must not be empty");
        }
        return PackedDrawList.of(commands);
    }

    // ---------------------------------------------------------------- 其他

    /**
     * 在工作线程上执行任意任务，任务抛出的异常以 COMMAND_FAILED 返回
     */
    public <T> CompletableFuture<T> runOnWorker(Callable<T> task) {
        return request(new Command.RunOnWorker(task));
    }

    public void setErrorListener(CommandErrorListener listener) {
        server.setErrorListener(listener);
    }

    public int pendingQueryCount() {
        return correlator.pendingCount();
    }

    public boolean isWorkerThread() {
        return runloop.isCoreThread();
    }

    // ---------------------------------------------------------------- 入队

    private void send(Command command) {
        if (disposed) {
            log.warn("CommandQueue {}: 已销毁，丢弃命令 {}", name, command.type());
            return;
        }
        server.offer(new QueuedCommand(correlator.nextRequestId(), command, false));
        runloop.wakeup();
    }

    private <T> CompletableFuture<T> request(Command command) {
        if (disposed) {
            return CompletableFuture.failedFuture(CommandQueueException.disposed(name));
        }
        CompletionCorrelator.Pending<T> pending = correlator.register();
        server.offer(new QueuedCommand(pending.requestId(), command, true));
        if (disposed) {
            // 与销毁竞争：工作线程可能已经退出，自己结束这个请求
            correlator.fail(pending.requestId(), CommandQueueException.disposed(name));
        }
        runloop.wakeup();
        return pending.future();
    }

    @Override
    public String toString() {
        return "CommandQueue[" + name + ", refCount=" + refCount() + ", disposed=" + disposed + "]";
    }
}
