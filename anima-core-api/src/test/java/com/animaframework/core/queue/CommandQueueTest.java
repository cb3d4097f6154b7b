package com.animaframework.core.queue;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.animaframework.core.backend.ArtboardSize;
import com.animaframework.core.backend.InputInfo;
import com.animaframework.core.backend.InputType;
import com.animaframework.core.backend.software.SoftwareBackend;
import com.animaframework.core.command.Command;
import com.animaframework.core.config.QueueConfig;
import com.animaframework.core.error.CommandQueueException;
import com.animaframework.core.error.ErrorCode;
import com.animaframework.core.handle.ArtboardHandle;
import com.animaframework.core.handle.FileHandle;
import com.animaframework.core.handle.StateMachineHandle;
import com.animaframework.core.handle.ViewModelInstanceHandle;
import com.animaframework.core.property.EventSubscription;
import com.animaframework.core.property.PropertySubscription;
import com.animaframework.core.property.PropertyUpdate;
import com.animaframework.core.render.Alignment;
import com.animaframework.core.render.DrawCommand;
import com.animaframework.core.render.Fit;
import com.animaframework.core.render.ImageSurface;
import com.animaframework.core.render.PointerTarget;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static com.animaframework.core.queue.TestFixtures.BASIC_ANIMATION;
import static com.animaframework.core.queue.TestFixtures.await;
import static com.animaframework.core.queue.TestFixtures.awaitFailure;
import static com.animaframework.core.queue.TestFixtures.bytes;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

/**
 * CommandQueue 端到端测试，使用 SoftwareBackend 作为原生后端
 */
@ExtendWith(MockitoExtension.class)
class CommandQueueTest {

    private static final int TRANSPARENT = 0x00000000;

    @Mock
    private CommandErrorListener errorListener;

    private SoftwareBackend backend;
    private CommandQueue queue;

    @BeforeEach
    void setUp() {
        backend = new SoftwareBackend();
        queue = new CommandQueue(backend, QueueConfig.defaults().setName("queue-test"));
    }

    @AfterEach
    void tearDown() {
        if (!queue.isDisposed()) {
            queue.close();
        }
    }

    @Test
    @DisplayName("加载 -> 画板 -> 状态机 -> 推进 -> 批量绘制")
    void endToEndScenario() throws Exception {
        FileHandle file = await(queue.loadFile(bytes(BASIC_ANIMATION)));
        ArtboardHandle artboard = await(queue.createDefaultArtboard(file));
        StateMachineHandle stateMachine = await(queue.createDefaultStateMachine(artboard));
        assertFalse(await(queue.advance(stateMachine, 0.016f)));
        ImageSurface surface = await(queue.createImageSurface(100, 100));

        assertTrue(file.id() < artboard.id());
        assertTrue(artboard.id() < stateMachine.id());
        assertTrue(stateMachine.id() < surface.handle().id());

        DrawCommand command = new DrawCommand(artboard, stateMachine, DrawCommand.identity(), 100, 100);
        queue.drawBatch(surface, List.of(command), TRANSPARENT);
        byte[] pixels = await(queue.drawBatchToBuffer(surface, List.of(command), TRANSPARENT));
        assertEquals(100 * 100 * 4, pixels.length);
        assertEquals(0, queue.pendingQueryCount());
        assertEquals(2, queue.getMetrics().getDrawBatches().getCount());
    }

    @Test
    void repeatedLoadsAreDeterministic() throws Exception {
        byte[] bytes = bytes(BASIC_ANIMATION);
        FileHandle first = await(queue.loadFile(bytes));
        FileHandle second = await(queue.loadFile(bytes));

        assertNotEquals(first, second);
        assertEquals(List.of("Main", "Badge"), await(queue.getArtboardNames(first)));
        assertEquals(await(queue.getArtboardNames(first)), await(queue.getArtboardNames(second)));
        assertEquals(List.of("Player"), await(queue.getViewModelNames(second)));
        assertEquals(List.of("Hero", "Villain"), await(queue.getViewModelInstanceNames(second, "Player")));
    }

    @Test
    void malformedFileFailsWithoutKillingTheWorker() throws Exception {
        awaitFailure(queue.loadFile("definitely not an animation".getBytes(StandardCharsets.UTF_8)),
                ErrorCode.MALFORMED_RESOURCE);
        awaitFailure(queue.loadFile(new byte[0]), ErrorCode.MALFORMED_RESOURCE);
        awaitFailure(queue.loadFile("{\"version\": 1, \"artboards\": []}".getBytes(StandardCharsets.UTF_8)),
                ErrorCode.MALFORMED_RESOURCE);
        awaitFailure(queue.loadFile("{\"version\": 1, \"artboards\": [null]}".getBytes(StandardCharsets.UTF_8)),
                ErrorCode.MALFORMED_RESOURCE);

        assertNotNull(await(queue.loadFile(bytes(BASIC_ANIMATION))));
    }

    @Test
    void newerFormatVersionIsRejected() {
        String json = """
                {"version": 2, "artboards": [{"name": "A", "width": 1, "height": 1}]}
                """;
        awaitFailure(queue.loadFile(json.getBytes(StandardCharsets.UTF_8)), ErrorCode.UNSUPPORTED_VERSION);
    }

    @Test
    void namedLookupsReportNotFound() throws Exception {
        FileHandle file = await(queue.loadFile(bytes(BASIC_ANIMATION)));
        awaitFailure(queue.createArtboardByName(file, "Missing"), ErrorCode.NOT_FOUND);

        ArtboardHandle badge = await(queue.createArtboardByName(file, "Badge"));
        assertEquals(List.of(), await(queue.getStateMachineNames(badge)));
        awaitFailure(queue.createDefaultStateMachine(badge), ErrorCode.NOT_FOUND);

        ArtboardHandle main = await(queue.createArtboardByName(file, "Main"));
        assertEquals(List.of("Idle", "Spin"), await(queue.getStateMachineNames(main)));
        assertNotNull(await(queue.createStateMachineByName(main, "Spin")));
        awaitFailure(queue.createStateMachineByName(main, "Walk"), ErrorCode.NOT_FOUND);
    }

    @Test
    void deletedHandleIsInvalid() throws Exception {
        FileHandle file = await(queue.loadFile(bytes(BASIC_ANIMATION)));
        ArtboardHandle artboard = await(queue.createDefaultArtboard(file));
        queue.deleteArtboard(artboard);

        awaitFailure(queue.getArtboardSize(artboard), ErrorCode.INVALID_HANDLE);
        ArtboardHandle next = await(queue.createDefaultArtboard(file));
        assertTrue(next.id() > artboard.id());
    }

    @Test
    void artboardCanBeResizedAndReset() throws Exception {
        FileHandle file = await(queue.loadFile(bytes(BASIC_ANIMATION)));
        ArtboardHandle artboard = await(queue.createArtboardByName(file, "Badge"));
        assertEquals(new ArtboardSize(40, 20), await(queue.getArtboardSize(artboard)));

        queue.resizeArtboard(artboard, 80, 60);
        assertEquals(new ArtboardSize(80, 60), await(queue.getArtboardSize(artboard)));

        queue.resetArtboardSize(artboard);
        assertEquals(new ArtboardSize(40, 20), await(queue.getArtboardSize(artboard)));
        assertThrows(IllegalArgumentException.class, () -> queue.resizeArtboard(artboard, 0, 10));
    }

    @Test
    void stateMachineInputs() throws Exception {
        StateMachineHandle stateMachine = createStateMachine();

        assertEquals(List.of("speed", "hover", "restart"), await(queue.getInputNames(stateMachine)));
        assertEquals(new InputInfo("hover", InputType.BOOLEAN), await(queue.getInputInfo(stateMachine, "hover")));
        awaitFailure(queue.getInputInfo(stateMachine, "missing"), ErrorCode.NOT_FOUND);

        assertEquals(1.5f, await(queue.getNumberInput(stateMachine, "speed")));
        queue.setNumberInput(stateMachine, "speed", 3f);
        queue.setBooleanInput(stateMachine, "hover", true);
        assertEquals(3f, await(queue.getNumberInput(stateMachine, "speed")));
        assertTrue(await(queue.getBooleanInput(stateMachine, "hover")));

        awaitFailure(queue.getBooleanInput(stateMachine, "speed"), ErrorCode.COMMAND_FAILED);
    }

    @Test
    @DisplayName("指针事件经 fit 映射到画板坐标后触发状态机监听器")
    void pointerEventsReachStateMachineListeners() throws Exception {
        FileHandle file = await(queue.loadFile(bytes(BASIC_ANIMATION)));
        ArtboardHandle artboard = await(queue.createDefaultArtboard(file));
        StateMachineHandle stateMachine = await(queue.createDefaultStateMachine(artboard));
        // 100x100 画板拉伸到 200x200 表面
        PointerTarget stretched = PointerTarget.stretched(artboard, stateMachine, 200, 200);

        queue.pointerMove(stretched, 0, 150, 150);
        assertTrue(await(queue.getBooleanInput(stateMachine, "hover")));
        queue.pointerMove(stretched, 0, 210, 10);
        assertFalse(await(queue.getBooleanInput(stateMachine, "hover")));

        queue.pointerMove(stretched, 1, 20, 20);
        assertTrue(await(queue.getBooleanInput(stateMachine, "hover")));
        // 其他指针离开不影响 1 号指针
        queue.pointerExit(stretched, 0);
        assertTrue(await(queue.getBooleanInput(stateMachine, "hover")));
        queue.pointerExit(stretched, 1);
        assertFalse(await(queue.getBooleanInput(stateMachine, "hover")));

        // CONTAIN 居中：200x100 表面两侧各留 50 像素
        PointerTarget contained = new PointerTarget(artboard, stateMachine, Fit.CONTAIN, Alignment.CENTER, 200, 100);
        queue.pointerDown(contained, 0, 40, 50);
        assertEquals(1.5f, await(queue.getNumberInput(stateMachine, "speed")));
        queue.pointerDown(contained, 0, 60, 50);
        assertEquals(3f, await(queue.getNumberInput(stateMachine, "speed")));

        assertEquals(0, queue.getMetrics().getCommandFailures().getCount());
    }

    @Test
    void pointerEventsValidateTheirArguments() throws Exception {
        StateMachineHandle stateMachine = createStateMachine();
        ArtboardHandle artboard = new ArtboardHandle(1);
        assertThrows(NullPointerException.class, () -> PointerTarget.stretched(artboard, null, 10, 10));
        assertThrows(IllegalArgumentException.class, () -> PointerTarget.stretched(artboard, stateMachine, 0, 10));
        PointerTarget target = PointerTarget.stretched(artboard, stateMachine, 10, 10);
        assertThrows(IllegalArgumentException.class, () -> queue.pointerDown(target, 0, Float.NaN, 1));
        assertThrows(NullPointerException.class, () -> queue.pointerExit(null, 0));
    }

    @Test
    void viewModelInstances() throws Exception {
        FileHandle file = await(queue.loadFile(bytes(BASIC_ANIMATION)));
        ViewModelInstanceHandle hero = await(queue.createDefaultViewModelInstance(file, "Player"));
        ViewModelInstanceHandle villain = await(queue.createNamedViewModelInstance(file, "Player", "Villain"));
        ViewModelInstanceHandle blank = await(queue.createBlankViewModelInstance(file, "Player"));

        assertEquals("hero", await(queue.getStringProperty(hero, "title")));
        assertEquals("hard", await(queue.getEnumProperty(hero, "mode")));
        assertEquals(0xFFFF0000, await(queue.getColorProperty(hero, "tint")));
        assertTrue(await(queue.getBooleanProperty(villain, "active")));
        assertEquals("", await(queue.getStringProperty(blank, "title")));
        assertEquals("easy", await(queue.getEnumProperty(blank, "mode")));

        queue.setNumberProperty(blank, "progress", 0.75f);
        queue.setStringProperty(blank, "title", "renamed");
        queue.setColorProperty(blank, "tint", 0xFF00FF00);
        assertEquals(0.75f, await(queue.getNumberProperty(blank, "progress")));
        assertEquals("renamed", await(queue.getStringProperty(blank, "title")));
        assertEquals(0xFF00FF00, await(queue.getColorProperty(blank, "tint")));

        awaitFailure(queue.getNumberProperty(blank, "title"), ErrorCode.COMMAND_FAILED);
        awaitFailure(queue.getStringProperty(blank, "nickname"), ErrorCode.NOT_FOUND);
        awaitFailure(queue.createNamedViewModelInstance(file, "Player", "Sidekick"), ErrorCode.NOT_FOUND);
        awaitFailure(queue.createDefaultViewModelInstance(file, "Enemy"), ErrorCode.NOT_FOUND);
    }

    @Test
    @DisplayName("推进状态机驱动的属性变化按顺序发布给订阅者")
    void advancePublishesDrivenProperty() throws Exception {
        FileHandle file = await(queue.loadFile(bytes(BASIC_ANIMATION)));
        StateMachineHandle stateMachine = createStateMachine(file);
        ViewModelInstanceHandle instance = await(queue.createDefaultViewModelInstance(file, "Player"));
        queue.bindViewModelInstance(stateMachine, instance);

        PropertySubscription<Float> first = queue.subscribe(instance, "progress", Float.class);
        PropertySubscription<Object> second = queue.subscribe(instance, "progress");

        await(queue.advance(stateMachine, 0.125f));
        await(queue.advance(stateMachine, 0.125f));
        await(queue.advance(stateMachine, 0.25f));

        assertEquals(List.of(0.25f, 0.5f, 1f), first.drain().stream().map(PropertyUpdate::value).toList());
        assertEquals(List.of(0.25f, 0.5f, 1f), second.drain().stream().map(PropertyUpdate::value).toList());

        // 进度已到 1，再推进不产生变化
        await(queue.advance(stateMachine, 0.25f));
        assertNull(first.poll());

        first.close();
        assertFalse(queue.unsubscribe(first.getId()));
        assertTrue(queue.unsubscribe(second.getId()));
    }

    @Test
    void setPropertyAndTriggerArePublished() throws Exception {
        FileHandle file = await(queue.loadFile(bytes(BASIC_ANIMATION)));
        ViewModelInstanceHandle instance = await(queue.createDefaultViewModelInstance(file, "Player"));
        PropertySubscription<String> title = queue.subscribe(instance, "title", String.class);
        PropertySubscription<Boolean> jump = queue.subscribe(instance, "jump", Boolean.class);

        queue.setStringProperty(instance, "title", "first");
        queue.setStringProperty(instance, "title", "first");
        queue.setStringProperty(instance, "title", "second");
        queue.fireTriggerProperty(instance, "jump");

        PropertyUpdate<String> update = title.poll(5, TimeUnit.SECONDS);
        assertEquals("first", update.value());
        assertEquals(instance, update.handle());
        assertEquals("second", title.poll(5, TimeUnit.SECONDS).value());
        assertEquals(Boolean.TRUE, jump.poll(5, TimeUnit.SECONDS).value());
        assertNull(title.poll());
    }

    @Test
    void subscribingToMissingPropertyFailsTheSubscription() throws Exception {
        FileHandle file = await(queue.loadFile(bytes(BASIC_ANIMATION)));
        ViewModelInstanceHandle instance = await(queue.createDefaultViewModelInstance(file, "Player"));

        PropertySubscription<Object> missing = queue.subscribe(instance, "nickname");
        PropertySubscription<Object> stale = queue.subscribe(new ViewModelInstanceHandle(9_999), "title");
        await(queue.runOnWorker(() -> null));

        assertTrue(missing.isClosed());
        assertEquals(ErrorCode.NOT_FOUND,
                ((CommandQueueException) missing.failure().orElseThrow()).getCode());
        assertTrue(stale.isClosed());
        assertEquals(ErrorCode.INVALID_HANDLE,
                ((CommandQueueException) stale.failure().orElseThrow()).getCode());
    }

    @Test
    void deletingInstanceClosesItsSubscriptions() throws Exception {
        FileHandle file = await(queue.loadFile(bytes(BASIC_ANIMATION)));
        ViewModelInstanceHandle instance = await(queue.createDefaultViewModelInstance(file, "Player"));
        PropertySubscription<Object> subscription = queue.subscribe(instance, "title");

        queue.deleteViewModelInstance(instance);
        await(queue.runOnWorker(() -> null));

        assertTrue(subscription.isClosed());
        assertTrue(subscription.failure().isEmpty());
    }

    @Test
    void settledEventsAreEmittedOncePerSettle() throws Exception {
        StateMachineHandle stateMachine = createStateMachine();
        EventSubscription<StateMachineHandle> settled = queue.settledEvents();

        assertFalse(await(queue.advance(stateMachine, 0.25f)));
        assertTrue(await(queue.advance(stateMachine, 0.25f)));
        assertFalse(await(queue.advance(stateMachine, 0.25f)));
        assertEquals(List.of(stateMachine), settled.drain());

        queue.fireTrigger(stateMachine, "restart");
        assertFalse(await(queue.advance(stateMachine, 0.1f)));
        queue.advanceStateMachine(stateMachine, 0.5f);
        assertEquals(stateMachine, settled.poll(5, TimeUnit.SECONDS));
    }

    @Test
    void fireAndForgetFailuresReachTheErrorListener() throws Exception {
        queue.setErrorListener(errorListener);
        queue.deleteArtboard(new ArtboardHandle(4_242));

        ArgumentCaptor<Throwable> error = ArgumentCaptor.forClass(Throwable.class);
        verify(errorListener, timeout(5_000)).onCommandFailed(any(Command.DeleteArtboard.class), error.capture());
        assertEquals(ErrorCode.INVALID_HANDLE, ((CommandQueueException) error.getValue()).getCode());
        assertEquals(1, queue.getMetrics().getCommandFailures().getCount());

        // 工作线程仍然可用
        assertNotNull(await(queue.loadFile(bytes(BASIC_ANIMATION))));
    }

    @Test
    void batchReadbackRasterizesArtboards() throws Exception {
        FileHandle file = await(queue.loadFile(bytes(BASIC_ANIMATION)));
        ArtboardHandle main = await(queue.createArtboardByName(file, "Main"));
        ArtboardHandle badge = await(queue.createArtboardByName(file, "Badge"));
        ImageSurface surface = await(queue.createImageSurface(100, 100));

        float[] offset = {1, 0, 0, 1, 60, 70};
        List<DrawCommand> commands = List.of(
                new DrawCommand(main, null, DrawCommand.identity(), 50, 50),
                new DrawCommand(badge, null, offset, 40, 20));
        byte[] pixels = await(queue.drawBatchToBuffer(surface, commands, TRANSPARENT));

        assertPixel(pixels, 100, 10, 10, 0x33, 0x66, 0xCC, 0xFF);
        assertPixel(pixels, 100, 70, 80, 0x00, 0xFF, 0x00, 0xFF);
        assertPixel(pixels, 100, 55, 55, 0, 0, 0, 0);
        assertPixel(pixels, 100, 99, 0, 0, 0, 0, 0);
    }

    @Test
    void boundColorPropertyOverridesArtboardFill() throws Exception {
        FileHandle file = await(queue.loadFile(bytes(BASIC_ANIMATION)));
        ArtboardHandle main = await(queue.createDefaultArtboard(file));
        StateMachineHandle stateMachine = await(queue.createDefaultStateMachine(main));
        ViewModelInstanceHandle instance = await(queue.createDefaultViewModelInstance(file, "Player"));
        queue.bindViewModelInstance(stateMachine, instance);
        ImageSurface surface = await(queue.createImageSurface(10, 10));

        byte[] pixels = await(queue.drawBatchToBuffer(surface,
                List.of(new DrawCommand(main, stateMachine, DrawCommand.identity(), 10, 10)), TRANSPARENT));
        assertPixel(pixels, 10, 5, 5, 0xFF, 0x00, 0x00, 0xFF);
    }

    @Test
    void batchSkipsEntriesWithInvalidHandles() throws Exception {
        FileHandle file = await(queue.loadFile(bytes(BASIC_ANIMATION)));
        ArtboardHandle main = await(queue.createArtboardByName(file, "Main"));
        ArtboardHandle badge = await(queue.createArtboardByName(file, "Badge"));
        queue.deleteArtboard(main);
        ImageSurface surface = await(queue.createImageSurface(40, 20));

        byte[] pixels = await(queue.drawBatchToBuffer(surface, List.of(
                new DrawCommand(main, null, DrawCommand.identity(), 40, 20),
                new DrawCommand(badge, null, DrawCommand.identity(), 40, 20)), TRANSPARENT));

        assertPixel(pixels, 40, 20, 10, 0x00, 0xFF, 0x00, 0xFF);
        assertEquals(1, queue.getMetrics().getSkippedDrawCommands().getCount());
    }

    @Test
    void drawCommandsAreCopiedAtEnqueue() throws Exception {
        FileHandle file = await(queue.loadFile(bytes(BASIC_ANIMATION)));
        ArtboardHandle badge = await(queue.createArtboardByName(file, "Badge"));
        ImageSurface surface = await(queue.createImageSurface(40, 20));
        float[] transform = DrawCommand.identity();
        DrawCommand command = new DrawCommand(badge, null, transform, 40, 20);

        CompletableFuture<byte[]> readback = queue.drawBatchToBuffer(surface, List.of(command), TRANSPARENT);
        // 入队后立即改写复用的缓冲区，不影响已提交的绘制
        transform[4] = 1_000;
        assertPixel(await(readback), 40, 5, 5, 0x00, 0xFF, 0x00, 0xFF);
    }

    @Test
    void singleDrawAppliesFitAndAlignment() throws Exception {
        FileHandle file = await(queue.loadFile(bytes(BASIC_ANIMATION)));
        ArtboardHandle badge = await(queue.createArtboardByName(file, "Badge"));
        ImageSurface surface = await(queue.createImageSurface(100, 100));

        // 40x20 CONTAIN 到 100x100：放大 2.5 倍为 100x50，垂直居中
        byte[] pixels = await(queue.drawToBuffer(surface, badge, null, Fit.CONTAIN, Alignment.CENTER, TRANSPARENT));
        assertPixel(pixels, 100, 50, 10, 0, 0, 0, 0);
        assertPixel(pixels, 100, 50, 50, 0x00, 0xFF, 0x00, 0xFF);
        assertPixel(pixels, 100, 50, 90, 0, 0, 0, 0);
    }

    @Test
    void invalidDrawArgumentsFailOnTheCallerThread() throws Exception {
        FileHandle file = await(queue.loadFile(bytes(BASIC_ANIMATION)));
        ArtboardHandle artboard = await(queue.createDefaultArtboard(file));
        ImageSurface surface = await(queue.createImageSurface(8, 8));
        List<DrawCommand> commands = List.of(new DrawCommand(artboard, null, DrawCommand.identity(), 8, 8));

        assertThrows(IllegalArgumentException.class, () -> queue.drawBatch(surface, List.of(), TRANSPARENT));
        assertThrows(IllegalArgumentException.class,
                () -> queue.drawBatchToBuffer(surface, commands, TRANSPARENT, new byte[8 * 8 * 4 - 1]));
        assertThrows(IllegalArgumentException.class, () -> queue.createImageSurface(0, 10));
        assertThrows(IllegalArgumentException.class, () -> queue.createImageSurface(30000, 30000));
        assertThrows(NullPointerException.class, () -> queue.drawBatch(null, commands, TRANSPARENT));
    }

    @Test
    void runOnWorkerExecutesOnTheWorkerThread() throws Exception {
        assertFalse(queue.isWorkerThread());
        assertTrue(await(queue.runOnWorker(queue::isWorkerThread)));

        CommandQueueException failure = awaitFailure(queue.runOnWorker(() -> {
            throw new IllegalStateException("task failed");
        }), ErrorCode.COMMAND_FAILED);
        assertInstanceOf(IllegalStateException.class, failure.getCause());
    }

    @Test
    void errorThrownOnWorkerFailsOnlyThatQuery() throws Exception {
        CommandQueueException failure = awaitFailure(queue.runOnWorker(() -> {
            throw new AssertionError("worker task blew up");
        }), ErrorCode.COMMAND_FAILED);
        assertInstanceOf(AssertionError.class, failure.getCause());

        assertEquals(1, await(queue.runOnWorker(() -> 1)));
        assertNotNull(await(queue.loadFile(bytes(BASIC_ANIMATION))));
        assertEquals(0, queue.pendingQueryCount());
        assertEquals(1, queue.getMetrics().getCommandFailures().getCount());
    }

    @Test
    void referenceCountControlsDisposal() throws Exception {
        assertEquals(2, queue.acquire("ui"));
        assertEquals(Map.of("constructor", 1, "ui", 1), queue.ownerCounts());

        queue.close();
        assertFalse(queue.isDisposed());
        assertNotNull(await(queue.loadFile(bytes(BASIC_ANIMATION))));

        assertEquals(0, queue.release("ui"));
        assertTrue(queue.isDisposed());
        assertTrue(backend.isClosed());
        assertEquals(0, backend.liveObjectCount());

        awaitFailure(queue.loadFile(bytes(BASIC_ANIMATION)), ErrorCode.DISPOSED);
        CommandQueueException e = assertThrows(CommandQueueException.class, () -> queue.release("ui"));
        assertEquals(ErrorCode.DOUBLE_RELEASE, e.getCode());
        assertThrows(CommandQueueException.class, () -> queue.acquire("late"));
    }

    @Test
    void lastReleaseFromTheWorkerThreadIsRejected() {
        CommandQueueException failure = awaitFailure(
                queue.runOnWorker(() -> queue.release(CommandQueue.CONSTRUCTOR_OWNER)), ErrorCode.COMMAND_FAILED);
        assertInstanceOf(IllegalStateException.class, failure.getCause());
        assertEquals(1, queue.refCount());
    }

    @Test
    @DisplayName("销毁时仍在排队的查询以 DISPOSED 结束")
    void disposalFailsQueuedQueries() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch unblock = new CountDownLatch(1);
        CompletableFuture<String> blocker = queue.runOnWorker(() -> {
            entered.countDown();
            unblock.await();
            return "finished";
        });
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        CompletableFuture<FileHandle> queued = queue.loadFile(bytes(BASIC_ANIMATION));
        CompletableFuture<Boolean> another = queue.runOnWorker(() -> true);
        EventSubscription<StateMachineHandle> settled = queue.settledEvents();

        Thread disposer = new Thread(queue::close, "disposer");
        disposer.start();
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!queue.isDisposed() && System.nanoTime() < deadline) {
            Thread.onSpinWait();
        }
        assertTrue(queue.isDisposed());
        unblock.countDown();
        disposer.join(5_000);

        assertEquals("finished", await(blocker));
        awaitFailure(queued, ErrorCode.DISPOSED);
        awaitFailure(another, ErrorCode.DISPOSED);
        assertTrue(settled.isClosed());
        assertEquals(0, queue.pendingQueryCount());
        assertEquals(2, queue.getMetrics().getCancelledCommands().getCount());
    }

    @Test
    @DisplayName("与销毁并发的查询要么成功要么 DISPOSED，不会挂起")
    void queriesRacingDisposalNeverHang() throws Exception {
        byte[] bytes = bytes(BASIC_ANIMATION);
        List<CompletableFuture<FileHandle>> futures = new ArrayList<>();
        CountDownLatch start = new CountDownLatch(1);
        List<Thread> producers = new ArrayList<>();
        for (int t = 0; t < 4; t++) {
            Thread producer = new Thread(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                for (int i = 0; i < 200; i++) {
                    CompletableFuture<FileHandle> future = queue.loadFile(bytes);
                    synchronized (futures) {
                        futures.add(future);
                    }
                }
            });
            producers.add(producer);
            producer.start();
        }
        start.countDown();
        queue.close();
        for (Thread producer : producers) {
            producer.join(10_000);
        }

        int succeeded = 0;
        int disposed = 0;
        synchronized (futures) {
            for (CompletableFuture<FileHandle> future : futures) {
                try {
                    assertNotNull(future.get(5, TimeUnit.SECONDS));
                    succeeded++;
                } catch (ExecutionException e) {
                    assertEquals(ErrorCode.DISPOSED, ((CommandQueueException) e.getCause()).getCode());
                    disposed++;
                } catch (TimeoutException e) {
                    fail("query hung across disposal");
                }
            }
        }
        assertEquals(800, succeeded + disposed);
    }

    private StateMachineHandle createStateMachine() throws Exception {
        return createStateMachine(await(queue.loadFile(bytes(BASIC_ANIMATION))));
    }

    private StateMachineHandle createStateMachine(FileHandle file) throws Exception {
        ArtboardHandle artboard = await(queue.createDefaultArtboard(file));
        return await(queue.createDefaultStateMachine(artboard));
    }

    private static void assertPixel(byte[] rgba, int width, int x, int y, int r, int g, int b, int a) {
        int offset = (y * width + x) * 4;
        assertEquals(r, rgba[offset] & 0xFF, "red at " + x + "," + y);
        assertEquals(g, rgba[offset + 1] & 0xFF, "green at " + x + "," + y);
        assertEquals(b, rgba[offset + 2] & 0xFF, "blue at " + x + "," + y);
        assertEquals(a, rgba[offset + 3] & 0xFF, "alpha at " + x + "," + y);
    }
}
