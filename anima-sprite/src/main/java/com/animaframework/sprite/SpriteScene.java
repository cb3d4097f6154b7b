package com.animaframework.sprite;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;

import com.animaframework.core.backend.ArtboardSize;
import com.animaframework.core.error.CommandQueueException;
import com.animaframework.core.handle.ArtboardHandle;
import com.animaframework.core.handle.FileHandle;
import com.animaframework.core.handle.StateMachineHandle;
import com.animaframework.core.handle.ViewModelInstanceHandle;
import com.animaframework.core.queue.CommandQueue;
import com.animaframework.core.render.DrawCommand;
import com.animaframework.core.render.ImageSurface;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.agrona.collections.Int2ObjectHashMap;
import org.agrona.concurrent.ManyToOneConcurrentLinkedQueue;

/**
 * 精灵场景：持有一组精灵，每帧把它们排序、计算变换并作为一次批量绘制提交到 {@link CommandQueue}。
 * <p>
 * 线程约束：场景只在创建它的调用方线程上使用。{@link #createSprite} 的结果在工作线程上产生，
 * 先进入一个多生产者队列，由调用方线程在下一次访问场景时并入。
 * <p>
 * 排序结果按场景版本号缓存，只有增删精灵、可见性或 zIndex 变化时才重新排序；
 * DrawCommand 池和每个精灵的变换数组在稳态下不再分配。
 */
@Slf4j
public class SpriteScene implements AutoCloseable {

    private static final AtomicLong SCENE_IDS = new AtomicLong();

    private static final Comparator<Sprite> DRAW_ORDER = Comparator.comparingInt(Sprite::getZIndex)
            .thenComparingLong(Sprite::getInsertionOrder);

    @Getter
    private final CommandQueue queue;
    @Getter
    private final String owner;

    /** 插入顺序 */
    private final List<Sprite> sprites = new ArrayList<>();
    private final ManyToOneConcurrentLinkedQueue<Sprite> createdSprites = new ManyToOneConcurrentLinkedQueue<>();

    private long nextInsertionOrder;
    private long version;
    private long builtVersion = -1;
    /** 可见精灵，按绘制顺序（底层在前） */
    private final List<Sprite> sorted = new ArrayList<>();
    private final List<DrawCommand> drawPool = new ArrayList<>();
    private List<DrawCommand> drawView = Collections.emptyList();
    /** 指针 id 到当前悬停的精灵 */
    private final Int2ObjectHashMap<Sprite> hoveredSprites = new Int2ObjectHashMap<>();

    private volatile boolean closed;

    public SpriteScene(CommandQueue queue) {
        this.queue = Objects.requireNonNull(queue, "queue");
        this.owner = "sprite-scene-" + SCENE_IDS.incrementAndGet();
        queue.acquire(owner);
        log.info("SpriteScene {} created on queue {}", owner, queue.getName());
    }

    // ---------------------------------------------------------------- 精灵生命周期

    /**
     * 用文件的默认画板创建精灵，有状态机时同时创建默认状态机，尺寸取画板尺寸
     */
    public CompletableFuture<Sprite> createSprite(FileHandle file) {
        return createSprite(file, null, null, 0, 0);
    }

    /**
     * @param artboardName     null 表示默认画板
     * @param stateMachineName null 表示默认状态机（画板没有状态机时精灵不带状态机）
     */
    public CompletableFuture<Sprite> createSprite(FileHandle file, String artboardName, String stateMachineName) {
        return createSprite(file, artboardName, stateMachineName, 0, 0);
    }

    /**
     * 通过队列创建画板和状态机并加入场景。width/height 不大于 0 时使用画板尺寸。
     * <p>
     * 返回的 future 在工作线程上完成；精灵在调用方线程下一次访问场景时才出现在场景中。
     * 任何一步失败都会删除已经创建的句柄。
     */
    public CompletableFuture<Sprite> createSprite(FileHandle file, String artboardName, String stateMachineName,
            float width, float height) {
        return createSprite(file, artboardName, stateMachineName, width, height, SpriteViewModelConfig.NONE);
    }

    /**
     * 同上，并按 viewModelConfig 为精灵准备视图模型实例；精灵带状态机时实例绑定到该状态机
     */
    public CompletableFuture<Sprite> createSprite(FileHandle file, String artboardName, String stateMachineName,
            float width, float height, SpriteViewModelConfig viewModelConfig) {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(viewModelConfig, "viewModelConfig");
        checkOpen();
        return queue.createArtboard(file, artboardName)
                .thenCompose(artboard -> completeSprite(file, artboard, stateMachineName, width, height,
                        viewModelConfig))
                .thenApply(sprite -> {
                    if (closed) {
                        deleteHandles(sprite);
                        throw CommandQueueException.disposed(owner);
                    }
                    createdSprites.offer(sprite);
                    return sprite;
                });
    }

    private CompletableFuture<Sprite> completeSprite(FileHandle file, ArtboardHandle artboard,
            String stateMachineName, float width, float height, SpriteViewModelConfig viewModelConfig) {
        boolean ownsViewModel = !(viewModelConfig instanceof SpriteViewModelConfig.External);
        CompletableFuture<StateMachineHandle> stateMachine = stateMachineFor(artboard, stateMachineName);
        CompletableFuture<ViewModelInstanceHandle> viewModel = viewModelFor(file, viewModelConfig);
        CompletableFuture<ArtboardSize> size = width > 0 && height > 0
                ? CompletableFuture.completedFuture(new ArtboardSize(width, height))
                : queue.getArtboardSize(artboard);
        CompletableFuture<Sprite> sprite = stateMachine.thenCompose(sm -> viewModel.thenCombine(size,
                (vmi, displaySize) -> {
                    if (sm != null && vmi != null) {
                        queue.bindViewModelInstance(sm, vmi);
                    }
                    return new Sprite(queue, artboard, sm, vmi, ownsViewModel, displaySize.width(),
                            displaySize.height());
                }));
        return sprite.whenComplete((created, failure) -> {
            if (failure != null) {
                log.warn("SpriteScene {}: 创建精灵失败，删除画板 {}", owner, artboard, failure);
                stateMachine.thenAccept(sm -> {
                    if (sm != null) {
                        queue.deleteStateMachine(sm);
                    }
                });
                viewModel.thenAccept(vmi -> {
                    if (vmi != null && ownsViewModel) {
                        queue.deleteViewModelInstance(vmi);
                    }
                });
                queue.deleteArtboard(artboard);
            }
        });
    }

    private CompletableFuture<ViewModelInstanceHandle> viewModelFor(FileHandle file, SpriteViewModelConfig config) {
        if (config instanceof SpriteViewModelConfig.Named named) {
            return queue.createDefaultViewModelInstance(file, named.viewModelName());
        }
        if (config instanceof SpriteViewModelConfig.NamedInstance named) {
            return queue.createNamedViewModelInstance(file, named.viewModelName(), named.instanceName());
        }
        if (config instanceof SpriteViewModelConfig.External external) {
            return CompletableFuture.completedFuture(external.instance());
        }
        if (config instanceof SpriteViewModelConfig.AutoBind) {
            return queue.getViewModelNames(file).thenCompose(names -> names.isEmpty()
                    ? CompletableFuture.<ViewModelInstanceHandle>completedFuture(null)
                    : queue.createDefaultViewModelInstance(file, names.get(0)));
        }
        return CompletableFuture.completedFuture(null);
    }

    private CompletableFuture<StateMachineHandle> stateMachineFor(ArtboardHandle artboard, String name) {
        if (name != null) {
            return queue.createStateMachineByName(artboard, name);
        }
        return queue.getStateMachineNames(artboard).thenCompose(names -> names.isEmpty()
                ? CompletableFuture.<StateMachineHandle>completedFuture(null)
                : queue.createDefaultStateMachine(artboard));
    }

    /**
     * 用已有句柄创建精灵并立即加入场景。句柄的所有权转移给场景，{@link #removeSprite} 时删除。
     *
     * @param stateMachine 可为 null
     */
    public Sprite addSprite(ArtboardHandle artboard, StateMachineHandle stateMachine, float width, float height) {
        return addSprite(artboard, stateMachine, null, width, height);
    }

    /**
     * 同上，视图模型实例的所有权也转移给场景。状态机和实例都不为 null 时把实例绑定到状态机
     *
     * @param viewModelInstance 可为 null
     */
    public Sprite addSprite(ArtboardHandle artboard, StateMachineHandle stateMachine,
            ViewModelInstanceHandle viewModelInstance, float width, float height) {
        checkOpen();
        absorbCreated();
        Sprite sprite = new Sprite(queue, artboard, stateMachine, viewModelInstance, true, width, height);
        if (stateMachine != null && viewModelInstance != null) {
            queue.bindViewModelInstance(stateMachine, viewModelInstance);
        }
        attach(sprite);
        return sprite;
    }

    /**
     * 从场景移除精灵并删除它的状态机、画板以及它拥有的视图模型实例
     *
     * @return 精灵不在场景中时返回 false
     */
    public boolean removeSprite(Sprite sprite) {
        if (!detachSprite(sprite)) {
            return false;
        }
        deleteHandles(sprite);
        return true;
    }

    /**
     * 从场景移除精灵但保留句柄，之后由调用方负责删除
     */
    public boolean detachSprite(Sprite sprite) {
        absorbCreated();
        if (!sprites.remove(Objects.requireNonNull(sprite, "sprite"))) {
            return false;
        }
        sprite.detach();
        forgetHover(sprite);
        invalidate();
        return true;
    }

    public void clearSprites() {
        absorbCreated();
        for (Sprite sprite : sprites) {
            sprite.detach();
            deleteHandles(sprite);
        }
        sprites.clear();
        hoveredSprites.clear();
        invalidate();
    }

    public List<Sprite> getSprites() {
        absorbCreated();
        return List.copyOf(sprites);
    }

    public int getSpriteCount() {
        absorbCreated();
        return sprites.size();
    }

    public List<Sprite> getSpritesWithTag(SpriteTag tag) {
        Objects.requireNonNull(tag, "tag");
        absorbCreated();
        List<Sprite> result = new ArrayList<>();
        for (Sprite sprite : sprites) {
            if (sprite.hasTag(tag)) {
                result.add(sprite);
            }
        }
        return result;
    }

    public List<Sprite> getSpritesWithAllTags(Collection<SpriteTag> tags) {
        Objects.requireNonNull(tags, "tags");
        absorbCreated();
        List<Sprite> result = new ArrayList<>();
        for (Sprite sprite : sprites) {
            if (sprite.getTags().containsAll(tags)) {
                result.add(sprite);
            }
        }
        return result;
    }

    // ---------------------------------------------------------------- 每帧

    /**
     * 推进所有带状态机的精灵，fire-and-forget
     */
    public void advance(float deltaSeconds) {
        absorbCreated();
        for (Sprite sprite : sprites) {
            if (sprite.getStateMachine() != null) {
                queue.advanceStateMachine(sprite.getStateMachine(), deltaSeconds);
            }
        }
    }

    /**
     * 构建本帧的绘制列表：可见精灵按 zIndex 升序，相同 zIndex 保持插入顺序。
     * <p>
     * 返回的列表和其中的 DrawCommand 归场景所有，下一次调用时会被原地改写。
     */
    public List<DrawCommand> buildDrawCommands() {
        absorbCreated();
        if (builtVersion != version) {
            rebuildOrder();
        }
        for (int i = 0; i < sorted.size(); i++) {
            Sprite sprite = sorted.get(i);
            float[] transform = SpriteTransforms.compute(sprite, sprite.getTransformBuffer());
            drawPool.get(i).set(sprite.getArtboard(), sprite.getStateMachine(), transform, sprite.getWidth(),
                    sprite.getHeight());
        }
        return drawView;
    }

    private void rebuildOrder() {
        sorted.clear();
        for (Sprite sprite : sprites) {
            if (sprite.isVisible()) {
                sorted.add(sprite);
            }
        }
        sorted.sort(DRAW_ORDER);
        int count = sorted.size();
        if (drawPool.size() != count) {
            while (drawPool.size() < count) {
                drawPool.add(new DrawCommand());
            }
            while (drawPool.size() > count) {
                drawPool.remove(drawPool.size() - 1);
            }
            drawView = Collections.unmodifiableList(drawPool);
        }
        builtVersion = version;
        log.debug("SpriteScene {}: 重新排序 {} 个可见精灵", owner, count);
    }

    /**
     * 提交一次批量绘制。没有可见精灵时不提交。
     */
    public void render(ImageSurface surface, int clearColor) {
        Objects.requireNonNull(surface, "surface");
        List<DrawCommand> commands = buildDrawCommands();
        if (commands.isEmpty()) {
            log.debug("SpriteScene {}: 没有可见精灵，跳过绘制", owner);
            return;
        }
        queue.drawBatch(surface, commands, clearColor);
    }

    /**
     * 批量绘制并读回 RGBA 像素。没有可见精灵时直接返回填满清屏色的缓冲区。
     */
    public CompletableFuture<byte[]> renderToBuffer(ImageSurface surface, int clearColor) {
        Objects.requireNonNull(surface, "surface");
        List<DrawCommand> commands = buildDrawCommands();
        if (commands.isEmpty()) {
            return CompletableFuture.completedFuture(clearedBuffer(surface, clearColor));
        }
        return queue.drawBatchToBuffer(surface, commands, clearColor);
    }

    private static byte[] clearedBuffer(ImageSurface surface, int argb) {
        byte[] pixels = new byte[surface.byteSize()];
        for (int offset = 0; offset < pixels.length; offset += ImageSurface.BYTES_PER_PIXEL) {
            pixels[offset] = (byte) (argb >> 16);
            pixels[offset + 1] = (byte) (argb >> 8);
            pixels[offset + 2] = (byte) argb;
            pixels[offset + 3] = (byte) (argb >>> 24);
        }
        return pixels;
    }

    // ---------------------------------------------------------------- 命中测试

    /**
     * @return 包含该点的最上层可见精灵，没有时返回 null
     */
    public Sprite hitTest(float x, float y) {
        List<Sprite> order = drawOrder();
        for (int i = order.size() - 1; i >= 0; i--) {
            Sprite sprite = order.get(i);
            if (sprite.contains(x, y)) {
                return sprite;
            }
        }
        return null;
    }

    /**
     * @return 包含该点的全部可见精灵，最上层在前
     */
    public List<Sprite> hitTestAll(float x, float y) {
        List<Sprite> order = drawOrder();
        List<Sprite> hits = new ArrayList<>();
        for (int i = order.size() - 1; i >= 0; i--) {
            Sprite sprite = order.get(i);
            if (sprite.contains(x, y)) {
                hits.add(sprite);
            }
        }
        return hits;
    }

    private List<Sprite> drawOrder() {
        absorbCreated();
        if (builtVersion != version) {
            rebuildOrder();
        }
        return sorted;
    }

    // ---------------------------------------------------------------- 指针

    public Sprite pointerDown(float x, float y) {
        return pointerDown(x, y, 0);
    }

    /**
     * 把按下事件发给该点最上层的可见精灵
     *
     * @return 接收事件的精灵，没有时返回 null
     */
    public Sprite pointerDown(float x, float y, int pointerId) {
        Sprite hit = hitTest(x, y);
        return hit != null && hit.pointerDown(x, y, pointerId) ? hit : null;
    }

    public Sprite pointerMove(float x, float y) {
        return pointerMove(x, y, 0);
    }

    /**
     * 把移动事件发给该点最上层的可见精灵；该指针此前悬停的精灵不同时，先向它发送离开事件
     *
     * @return 当前悬停的精灵，没有时返回 null
     */
    public Sprite pointerMove(float x, float y, int pointerId) {
        Sprite hit = hitTest(x, y);
        Sprite previous = hit != null ? hoveredSprites.put(pointerId, hit) : hoveredSprites.remove(pointerId);
        if (previous != null && previous != hit) {
            previous.pointerExit(pointerId);
        }
        if (hit != null) {
            hit.pointerMove(x, y, pointerId);
        }
        return hit;
    }

    public Sprite pointerUp(float x, float y) {
        return pointerUp(x, y, 0);
    }

    /**
     * @return 接收事件的精灵，没有时返回 null
     */
    public Sprite pointerUp(float x, float y, int pointerId) {
        Sprite hit = hitTest(x, y);
        return hit != null && hit.pointerUp(x, y, pointerId) ? hit : null;
    }

    public void pointerExit() {
        pointerExit(0);
    }

    /**
     * 指针离开场景：向它悬停的精灵发送离开事件
     */
    public void pointerExit(int pointerId) {
        absorbCreated();
        Sprite previous = hoveredSprites.remove(pointerId);
        if (previous != null) {
            previous.pointerExit(pointerId);
        }
    }

    private void forgetHover(Sprite sprite) {
        hoveredSprites.values().removeIf(hovered -> hovered == sprite);
    }

    // ---------------------------------------------------------------- 内部

    void invalidate() {
        version++;
    }

    private void attach(Sprite sprite) {
        sprite.attach(this, nextInsertionOrder++);
        sprites.add(sprite);
        invalidate();
    }

    private void absorbCreated() {
        Sprite sprite;
        while ((sprite = createdSprites.poll()) != null) {
            if (closed) {
                deleteHandles(sprite);
            } else {
                attach(sprite);
            }
        }
    }

    private void deleteHandles(Sprite sprite) {
        if (sprite.ownsViewModelInstance()) {
            queue.deleteViewModelInstance(sprite.getViewModelInstance());
        }
        if (sprite.getStateMachine() != null) {
            queue.deleteStateMachine(sprite.getStateMachine());
        }
        queue.deleteArtboard(sprite.getArtboard());
    }

    private void checkOpen() {
        if (closed) {
            throw CommandQueueException.disposed(owner);
        }
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * 删除所有精灵的句柄并释放对队列的引用，可重复调用
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        clearSprites();
        closed = true;
        absorbCreated();
        queue.release(owner);
        log.info("SpriteScene {} closed", owner);
    }
}
