package com.animaframework.sprite;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import com.animaframework.core.handle.ArtboardHandle;
import com.animaframework.core.handle.StateMachineHandle;
import com.animaframework.core.handle.ViewModelInstanceHandle;
import com.animaframework.core.property.PropertySubscription;
import com.animaframework.core.queue.CommandQueue;
import com.animaframework.core.render.DrawCommand;
import com.animaframework.core.render.PointerTarget;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 场景中的一个精灵：画板/状态机句柄加上 2D 变换。
 * <p>
 * 只能在拥有场景的线程上修改。改变 zIndex 或可见性会使场景缓存的排序失效，
 * 位置、缩放、旋转在每帧构建时重新计算，不影响排序。
 * <p>
 * 属性读写和指针事件经场景的 {@link CommandQueue} 发往工作线程。
 */
@Slf4j
@Getter
public final class Sprite {

    @Getter(AccessLevel.NONE)
    private final CommandQueue queue;
    private final ArtboardHandle artboard;
    /** 可能为 null */
    private final StateMachineHandle stateMachine;
    /** 可能为 null */
    private final ViewModelInstanceHandle viewModelInstance;
    @Getter(AccessLevel.NONE)
    private final boolean ownsViewModelInstance;

    private float x;
    private float y;
    private SpriteScale scale = SpriteScale.UNSCALED;
    /** 顺时针角度 */
    private float rotation;
    private SpriteOrigin origin = SpriteOrigin.CENTER;
    private float width;
    private float height;
    private int zIndex;
    private boolean visible = true;

    @Getter(AccessLevel.NONE)
    private final Set<SpriteTag> tags = new LinkedHashSet<>();

    /** 每帧原地写入，DrawCommand 直接引用 */
    @Getter(AccessLevel.PACKAGE)
    private final float[] transformBuffer = DrawCommand.identity();

    /** 加入场景的顺序，排序时打破 zIndex 相同的情况 */
    @Getter(AccessLevel.PACKAGE)
    private long insertionOrder = -1;

    @Getter(AccessLevel.NONE)
    private SpriteScene scene;

    Sprite(CommandQueue queue, ArtboardHandle artboard, StateMachineHandle stateMachine,
            ViewModelInstanceHandle viewModelInstance, boolean ownsViewModelInstance, float width, float height) {
        this.queue = Objects.requireNonNull(queue, "queue");
        this.artboard = Objects.requireNonNull(artboard, "artboard");
        this.stateMachine = stateMachine;
        this.viewModelInstance = viewModelInstance;
        this.ownsViewModelInstance = viewModelInstance != null && ownsViewModelInstance;
        checkSize(width, height);
        this.width = width;
        this.height = height;
    }

    void attach(SpriteScene scene, long insertionOrder) {
        this.scene = scene;
        this.insertionOrder = insertionOrder;
    }

    void detach() {
        this.scene = null;
    }

    public boolean isAttached() {
        return scene != null;
    }

    public boolean hasViewModel() {
        return viewModelInstance != null;
    }

    /** 移除精灵时是否删除视图模型实例 */
    boolean ownsViewModelInstance() {
        return ownsViewModelInstance;
    }

    public Sprite setPosition(float x, float y) {
        this.x = x;
        this.y = y;
        return this;
    }

    public Sprite setX(float x) {
        this.x = x;
        return this;
    }

    public Sprite setY(float y) {
        this.y = y;
        return this;
    }

    public Sprite setScale(SpriteScale scale) {
        this.scale = Objects.requireNonNull(scale, "scale");
        return this;
    }

    public Sprite setScale(float scaleX, float scaleY) {
        return setScale(new SpriteScale(scaleX, scaleY));
    }

    public Sprite setRotation(float degrees) {
        if (!Float.isFinite(degrees)) {
            throw new IllegalArgumentException("rotation must be finite, was " + degrees);
        }
        this.rotation = degrees;
        return this;
    }

    public Sprite setOrigin(SpriteOrigin origin) {
        this.origin = Objects.requireNonNull(origin, "origin");
        return this;
    }

    public Sprite setSize(float width, float height) {
        checkSize(width, height);
        this.width = width;
        this.height = height;
        return this;
    }

    public Sprite setZIndex(int zIndex) {
        if (this.zIndex != zIndex) {
            this.zIndex = zIndex;
            invalidate();
        }
        return this;
    }

    public Sprite setVisible(boolean visible) {
        if (this.visible != visible) {
            this.visible = visible;
            invalidate();
        }
        return this;
    }

    public Sprite addTag(SpriteTag tag) {
        tags.add(Objects.requireNonNull(tag, "tag"));
        return this;
    }

    public boolean removeTag(SpriteTag tag) {
        return tags.remove(tag);
    }

    public boolean hasTag(SpriteTag tag) {
        return tags.contains(tag);
    }

    public Set<SpriteTag> getTags() {
        return Collections.unmodifiableSet(tags);
    }

    /**
     * 按当前状态计算一份新的变换
     */
    public float[] computeTransform() {
        return SpriteTransforms.compute(this, DrawCommand.identity());
    }

    public SpriteBounds getBounds() {
        return SpriteTransforms.bounds(computeTransform(), width, height);
    }

    /**
     * 世界坐标点是否落在精灵的（变换后）矩形内，不考虑可见性
     */
    public boolean contains(float worldX, float worldY) {
        float[] local = new float[2];
        return SpriteTransforms.toLocal(computeTransform(), worldX, worldY, local) && insideLocal(local);
    }

    // ---------------------------------------------------------------- 视图模型属性

    /**
     * 有视图模型实例时设置属性，否则设置状态机上同名的 NUMBER 输入
     */
    public void setNumber(String path, float value) {
        if (viewModelInstance != null) {
            queue.setNumberProperty(viewModelInstance, path, value);
        } else if (stateMachine != null) {
            queue.setNumberInput(stateMachine, path, value);
        } else {
            skipped("setNumber", path);
        }
    }

    /**
     * 有视图模型实例时设置属性，否则设置状态机上同名的 BOOLEAN 输入
     */
    public void setBoolean(String path, boolean value) {
        if (viewModelInstance != null) {
            queue.setBooleanProperty(viewModelInstance, path, value);
        } else if (stateMachine != null) {
            queue.setBooleanInput(stateMachine, path, value);
        } else {
            skipped("setBoolean", path);
        }
    }

    /**
     * 有视图模型实例时触发属性，否则触发状态机上同名的 TRIGGER 输入
     */
    public void fireTrigger(String path) {
        if (viewModelInstance != null) {
            queue.fireTriggerProperty(viewModelInstance, path);
        } else if (stateMachine != null) {
            queue.fireTrigger(stateMachine, path);
        } else {
            skipped("fireTrigger", path);
        }
    }

    public void setString(String path, String value) {
        if (viewModelInstance != null) {
            queue.setStringProperty(viewModelInstance, path, value);
        } else {
            skipped("setString", path);
        }
    }

    public void setEnum(String path, String value) {
        if (viewModelInstance != null) {
            queue.setEnumProperty(viewModelInstance, path, value);
        } else {
            skipped("setEnum", path);
        }
    }

    public void setColor(String path, int argb) {
        if (viewModelInstance != null) {
            queue.setColorProperty(viewModelInstance, path, argb);
        } else {
            skipped("setColor", path);
        }
    }

    /**
     * @throws IllegalStateException 精灵没有视图模型实例
     */
    public CompletableFuture<Float> getNumber(String path) {
        return queue.getNumberProperty(requireViewModel(), path);
    }

    public CompletableFuture<String> getString(String path) {
        return queue.getStringProperty(requireViewModel(), path);
    }

    public CompletableFuture<Boolean> getBoolean(String path) {
        return queue.getBooleanProperty(requireViewModel(), path);
    }

    public CompletableFuture<String> getEnum(String path) {
        return queue.getEnumProperty(requireViewModel(), path);
    }

    public CompletableFuture<Integer> getColor(String path) {
        return queue.getColorProperty(requireViewModel(), path);
    }

    /**
     * 订阅视图模型属性的变化
     *
     * @throws IllegalStateException 精灵没有视图模型实例
     */
    public <T> PropertySubscription<T> subscribe(String path, Class<T> valueType) {
        return queue.subscribe(requireViewModel(), path, valueType);
    }

    private ViewModelInstanceHandle requireViewModel() {
        if (viewModelInstance == null) {
            throw new IllegalStateException(this + " has no view model instance");
        }
        return viewModelInstance;
    }

    private void skipped(String operation, String path) {
        log.warn("{}: {}('{}') 被忽略，没有视图模型实例或状态机", this, operation, path);
    }

    // ---------------------------------------------------------------- 指针

    /**
     * 世界坐标的指针按下。点落在精灵矩形外时不发送
     *
     * @return 事件已发送到状态机
     */
    public boolean pointerDown(float worldX, float worldY, int pointerId) {
        float[] local = toPointerLocal(worldX, worldY);
        if (local == null || !insideLocal(local)) {
            return false;
        }
        queue.pointerDown(pointerTarget(), pointerId, local[0], local[1]);
        return true;
    }

    /**
     * 指针移动。矩形外的点也会发送，状态机据此处理离开
     */
    public boolean pointerMove(float worldX, float worldY, int pointerId) {
        float[] local = toPointerLocal(worldX, worldY);
        if (local == null) {
            return false;
        }
        queue.pointerMove(pointerTarget(), pointerId, local[0], local[1]);
        return true;
    }

    public boolean pointerUp(float worldX, float worldY, int pointerId) {
        float[] local = toPointerLocal(worldX, worldY);
        if (local == null) {
            return false;
        }
        queue.pointerUp(pointerTarget(), pointerId, local[0], local[1]);
        return true;
    }

    public void pointerExit(int pointerId) {
        if (stateMachine != null) {
            queue.pointerExit(pointerTarget(), pointerId);
        }
    }

    /**
     * 没有状态机或变换不可逆时返回 null
     */
    private float[] toPointerLocal(float worldX, float worldY) {
        if (stateMachine == null) {
            return null;
        }
        float[] local = new float[2];
        return SpriteTransforms.toLocal(computeTransform(), worldX, worldY, local) ? local : null;
    }

    private boolean insideLocal(float[] local) {
        return local[0] >= 0 && local[0] < width && local[1] >= 0 && local[1] < height;
    }

    /** 本地坐标以显示尺寸为单位，画板拉伸填满显示尺寸 */
    private PointerTarget pointerTarget() {
        return PointerTarget.stretched(artboard, stateMachine, width, height);
    }

    private void invalidate() {
        if (scene != null) {
            scene.invalidate();
        }
    }

    private static void checkSize(float width, float height) {
        if (!(width > 0) || !(height > 0)) {
            throw new IllegalArgumentException("sprite size must be positive, was " + width + "x" + height);
        }
    }

    @Override
    public String toString() {
        return "Sprite[" + artboard + ", " + stateMachine + ", pos=(" + x + ", " + y + "), z=" + zIndex
                + (visible ? "" : ", hidden") + "]";
    }
}
