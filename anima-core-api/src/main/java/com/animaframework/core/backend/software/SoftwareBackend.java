package com.animaframework.core.backend.software;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import com.animaframework.core.backend.ArtboardSize;
import com.animaframework.core.backend.InputInfo;
import com.animaframework.core.backend.InputType;
import com.animaframework.core.backend.InstanceSource;
import com.animaframework.core.backend.NativeBackend;
import com.animaframework.core.backend.PropertyChangeSink;
import com.animaframework.core.backend.ResolvedDraw;
import com.animaframework.core.error.CommandQueueException;
import com.animaframework.core.error.ErrorCode;
import com.animaframework.core.property.PropertyType;
import com.animaframework.core.render.ImageSurface;
import lombok.extern.slf4j.Slf4j;

/**
 * 纯 Java 的参考后端。
 * <p>
 * 文件是 JSON 动画文档（见 {@link AnimationDocument}）；状态机按时长推进并可驱动视图模型的 NUMBER 属性；
 * 绘制把每个画板的矩形经仿射变换以填充色光栅化到 ARGB 表面；
 * 指针事件落在画板矩形内时触发状态机的监听器，监听器设置输入。
 * 与真实原生上下文一样是线程亲和的：第一次调用之后，其他线程的访问会抛出 IllegalStateException。
 */
@Slf4j
public class SoftwareBackend implements NativeBackend {

    public static final String NAME = "software";

    private final Set<Object> liveObjects = Collections.newSetFromMap(new IdentityHashMap<>());
    private final List<Change> pendingChanges = new ArrayList<>();
    private volatile Thread ownerThread;
    private volatile boolean closed;

    @Override
    public String name() {
        return NAME;
    }

    // ---------------------------------------------------------------- 文件

    @Override
    public Object loadFile(byte[] bytes) {
        checkThread();
        return track(new SoftFile(AnimationDocuments.parse(bytes)));
    }

    @Override
    public List<String> artboardNames(Object file) {
        checkThread();
        return cast(file, SoftFile.class).document.getArtboards().stream()
                .map(AnimationDocument.ArtboardDef::getName)
                .toList();
    }

    @Override
    public List<String> viewModelNames(Object file) {
        checkThread();
        return cast(file, SoftFile.class).document.getViewModels().stream()
                .map(AnimationDocument.ViewModelDef::getName)
                .toList();
    }

    @Override
    public List<String> viewModelInstanceNames(Object file, String viewModelName) {
        checkThread();
        return findViewModel(cast(file, SoftFile.class), viewModelName).getInstances().stream()
                .map(AnimationDocument.InstanceDef::getName)
                .toList();
    }

    // ---------------------------------------------------------------- 画板

    @Override
    public Object createArtboard(Object file, String name) {
        checkThread();
        List<AnimationDocument.ArtboardDef> artboards = cast(file, SoftFile.class).document.getArtboards();
        AnimationDocument.ArtboardDef def = name == null ? artboards.get(0) : artboards.stream()
                .filter(a -> a.getName().equals(name))
                .findFirst()
                .orElseThrow(() -> CommandQueueException.notFound("Artboard", name));
        return track(new SoftArtboard(def));
    }

    @Override
    public List<String> stateMachineNames(Object artboard) {
        checkThread();
        return cast(artboard, SoftArtboard.class).def.getStateMachines().stream()
                .map(AnimationDocument.StateMachineDef::getName)
                .toList();
    }

    @Override
    public ArtboardSize artboardSize(Object artboard) {
        checkThread();
        SoftArtboard softArtboard = cast(artboard, SoftArtboard.class);
        return new ArtboardSize(softArtboard.width, softArtboard.height);
    }

    @Override
    public void resizeArtboard(Object artboard, float width, float height) {
        checkThread();
        SoftArtboard softArtboard = cast(artboard, SoftArtboard.class);
        softArtboard.width = width;
        softArtboard.height = height;
    }

    @Override
    public void resetArtboardSize(Object artboard) {
        checkThread();
        SoftArtboard softArtboard = cast(artboard, SoftArtboard.class);
        softArtboard.width = softArtboard.def.getWidth();
        softArtboard.height = softArtboard.def.getHeight();
    }

    // ---------------------------------------------------------------- 状态机

    @Override
    public Object createStateMachine(Object artboard, String name) {
        checkThread();
        SoftArtboard softArtboard = cast(artboard, SoftArtboard.class);
        List<AnimationDocument.StateMachineDef> stateMachines = softArtboard.def.getStateMachines();
        AnimationDocument.StateMachineDef def;
        if (name == null) {
            if (stateMachines.isEmpty()) {
                throw CommandQueueException.notFound("Default state machine of artboard",
                        softArtboard.def.getName());
            }
            def = stateMachines.get(0);
        } else {
            def = stateMachines.stream()
                    .filter(s -> s.getName().equals(name))
                    .findFirst()
                    .orElseThrow(() -> CommandQueueException.notFound("State machine", name));
        }
        return track(new SoftStateMachine(def, softArtboard));
    }

    @Override
    public boolean advance(Object stateMachine, float deltaSeconds) {
        checkThread();
        SoftStateMachine sm = cast(stateMachine, SoftStateMachine.class);
        if (sm.restartRequested) {
            sm.restartRequested = false;
            sm.elapsed = 0f;
            sm.settled = false;
        }
        boolean wasSettled = sm.settled;
        sm.elapsed += deltaSeconds;
        float duration = sm.def.getDuration();
        float progress = duration <= 0 ? 1f : Math.min(1f, sm.elapsed / duration);
        if (sm.def.getDrives() != null && sm.bound != null
                && sm.bound.types.get(sm.def.getDrives()) == PropertyType.NUMBER) {
            write(sm.bound, sm.def.getDrives(), progress);
        }
        sm.settled = progress >= 1f;
        return sm.settled && !wasSettled;
    }

    @Override
    public List<InputInfo> inputs(Object stateMachine) {
        checkThread();
        return cast(stateMachine, SoftStateMachine.class).def.getInputs().stream()
                .map(input -> new InputInfo(input.getName(), input.getType()))
                .toList();
    }

    @Override
    public Object getInput(Object stateMachine, String name, InputType type) {
        checkThread();
        SoftStateMachine sm = cast(stateMachine, SoftStateMachine.class);
        requireInputType(sm, name, type);
        return sm.inputValues.get(name);
    }

    @Override
    public void setInput(Object stateMachine, String name, InputType type, Object value) {
        checkThread();
        SoftStateMachine sm = cast(stateMachine, SoftStateMachine.class);
        requireInputType(sm, name, type);
        applyInput(sm, name, type, value);
    }

    private void applyInput(SoftStateMachine sm, String name, InputType type, Object value) {
        switch (type) {
            case NUMBER -> sm.inputValues.put(name, ((Number) value).floatValue());
            case BOOLEAN -> sm.inputValues.put(name, (Boolean) value);
            case TRIGGER -> sm.restartRequested = true;
            default -> throw new IllegalArgumentException("Unknown input type " + type);
        }
    }

    private void requireInputType(SoftStateMachine sm, String name, InputType type) {
        AnimationDocument.InputDef input = sm.def.getInputs().stream()
                .filter(i -> i.getName().equals(name))
                .findFirst()
                .orElseThrow(() -> CommandQueueException.notFound("Input", name));
        if (input.getType() != type) {
            throw PropertyValues.typeMismatch(name, input.getType(), type);
        }
    }

    // ---------------------------------------------------------------- 指针

    @Override
    public void pointerDown(Object stateMachine, int pointerId, float x, float y) {
        checkThread();
        SoftStateMachine sm = cast(stateMachine, SoftStateMachine.class);
        if (inside(sm, x, y)) {
            sm.pointersOver.add(pointerId);
            fireListeners(sm, AnimationDocument.ListenerEvent.DOWN);
        }
    }

    @Override
    public void pointerMove(Object stateMachine, int pointerId, float x, float y) {
        checkThread();
        SoftStateMachine sm = cast(stateMachine, SoftStateMachine.class);
        if (inside(sm, x, y)) {
            sm.pointersOver.add(pointerId);
            fireListeners(sm, AnimationDocument.ListenerEvent.MOVE);
        } else if (sm.pointersOver.remove(pointerId)) {
            fireListeners(sm, AnimationDocument.ListenerEvent.EXIT);
        }
    }

    @Override
    public void pointerUp(Object stateMachine, int pointerId, float x, float y) {
        checkThread();
        SoftStateMachine sm = cast(stateMachine, SoftStateMachine.class);
        if (inside(sm, x, y)) {
            fireListeners(sm, AnimationDocument.ListenerEvent.UP);
        }
    }

    @Override
    public void pointerExit(Object stateMachine, int pointerId) {
        checkThread();
        SoftStateMachine sm = cast(stateMachine, SoftStateMachine.class);
        if (sm.pointersOver.remove(pointerId)) {
            fireListeners(sm, AnimationDocument.ListenerEvent.EXIT);
        }
    }

    private static boolean inside(SoftStateMachine sm, float x, float y) {
        return x >= 0 && y >= 0 && x < sm.artboard.width && y < sm.artboard.height;
    }

    private void fireListeners(SoftStateMachine sm, AnimationDocument.ListenerEvent event) {
        for (AnimationDocument.ListenerDef listener : sm.def.getListeners()) {
            if (listener.getEvent() == event) {
                InputType type = sm.def.getInputs().stream()
                        .filter(input -> input.getName().equals(listener.getInput()))
                        .findFirst()
                        .orElseThrow(() -> CommandQueueException.notFound("Input", listener.getInput()))
                        .getType();
                log.trace("状态机 {} 监听 {} -> {}", sm.def.getName(), event, listener.getInput());
                applyInput(sm, listener.getInput(), type, listener.getValue());
            }
        }
    }

    // ---------------------------------------------------------------- 视图模型

    @Override
    public Object createViewModelInstance(Object file, String viewModelName, String instanceName,
            InstanceSource source) {
        checkThread();
        AnimationDocument.ViewModelDef viewModel = findViewModel(cast(file, SoftFile.class), viewModelName);
        SoftViewModelInstance instance = new SoftViewModelInstance(viewModel);
        for (AnimationDocument.PropertyDef property : viewModel.getProperties()) {
            Object value = source == InstanceSource.BLANK || property.getType() == PropertyType.TRIGGER
                    ? PropertyValues.blank(property.getType(), property.getValues())
                    : PropertyValues.coerce(property.getType(), property.getValue(), property.getValues(),
                            property.getName());
            instance.values.put(property.getName(), value);
        }
        AnimationDocument.InstanceDef preset = switch (source) {
            case BLANK -> null;
            case DEFAULT -> viewModel.getInstances().isEmpty() ? null : viewModel.getInstances().get(0);
            case NAMED -> viewModel.getInstances().stream()
                    .filter(i -> i.getName().equals(instanceName))
                    .findFirst()
                    .orElseThrow(() -> CommandQueueException.notFound("View model instance", instanceName));
        };
        if (preset != null) {
            preset.getValues().forEach((path, raw) -> {
                AnimationDocument.PropertyDef property = findProperty(instance, path);
                instance.values.put(path, PropertyValues.coerce(property.getType(), raw, property.getValues(), path));
            });
        }
        return track(instance);
    }

    @Override
    public void bindViewModelInstance(Object stateMachine, Object instance) {
        checkThread();
        cast(stateMachine, SoftStateMachine.class).bound = cast(instance, SoftViewModelInstance.class);
    }

    @Override
    public Optional<PropertyType> propertyType(Object instance, String propertyPath) {
        checkThread();
        return Optional.ofNullable(cast(instance, SoftViewModelInstance.class).types.get(propertyPath));
    }

    @Override
    public Object getProperty(Object instance, String propertyPath, PropertyType type) {
        checkThread();
        SoftViewModelInstance vmi = cast(instance, SoftViewModelInstance.class);
        requirePropertyType(vmi, propertyPath, type);
        return vmi.values.get(propertyPath);
    }

    @Override
    public void setProperty(Object instance, String propertyPath, PropertyType type, Object value) {
        checkThread();
        SoftViewModelInstance vmi = cast(instance, SoftViewModelInstance.class);
        AnimationDocument.PropertyDef property = requirePropertyType(vmi, propertyPath, type);
        if (type == PropertyType.TRIGGER) {
            pendingChanges.add(new Change(vmi, propertyPath, Boolean.TRUE));
            return;
        }
        write(vmi, propertyPath, PropertyValues.coerce(type, value, property.getValues(), propertyPath));
    }

    @Override
    public void drainPropertyChanges(PropertyChangeSink sink) {
        checkThread();
        if (pendingChanges.isEmpty()) {
            return;
        }
        List<Change> changes = new ArrayList<>(pendingChanges);
        pendingChanges.clear();
        for (Change change : changes) {
            if (liveObjects.contains(change.instance())) {
                sink.propertyChanged(change.instance(), change.path(), change.value());
            }
        }
    }

    private void write(SoftViewModelInstance vmi, String path, Object value) {
        Object previous = vmi.values.put(path, value);
        if (!Objects.equals(previous, value)) {
            pendingChanges.add(new Change(vmi, path, value));
        }
    }

    private AnimationDocument.PropertyDef requirePropertyType(SoftViewModelInstance vmi, String path,
            PropertyType type) {
        AnimationDocument.PropertyDef property = findProperty(vmi, path);
        if (property.getType() != type) {
            throw PropertyValues.typeMismatch(path, property.getType(), type);
        }
        return property;
    }

    private AnimationDocument.PropertyDef findProperty(SoftViewModelInstance vmi, String path) {
        return vmi.def.getProperties().stream()
                .filter(p -> p.getName().equals(path))
                .findFirst()
                .orElseThrow(() -> CommandQueueException.notFound("Property", path));
    }

    private AnimationDocument.ViewModelDef findViewModel(SoftFile file, String viewModelName) {
        return file.document.getViewModels().stream()
                .filter(v -> v.getName().equals(viewModelName))
                .findFirst()
                .orElseThrow(() -> CommandQueueException.notFound("View model", viewModelName));
    }

    // ---------------------------------------------------------------- 渲染

    @Override
    public Object createSurface(int width, int height) {
        checkThread();
        ImageSurface.checkSize(width, height);
        return track(new SoftSurface(width, height));
    }

    @Override
    public void drawBatch(Object surface, List<ResolvedDraw> draws, int clearColor) {
        checkThread();
        SoftSurface softSurface = cast(surface, SoftSurface.class);
        SoftwareRasterizer.clear(softSurface.pixels, clearColor);
        for (ResolvedDraw draw : draws) {
            SoftArtboard artboard = cast(draw.artboard(), SoftArtboard.class);
            SoftStateMachine stateMachine = draw.stateMachine() != null
                    ? cast(draw.stateMachine(), SoftStateMachine.class)
                    : null;
            SoftwareRasterizer.fillRect(softSurface.pixels, softSurface.width, softSurface.height,
                    draw.transform(), draw.width(), draw.height(), fillColor(artboard, stateMachine));
        }
        log.trace("绘制 {} 个画板到 {}x{} 表面", draws.size(), softSurface.width, softSurface.height);
    }

    private int fillColor(SoftArtboard artboard, SoftStateMachine stateMachine) {
        String fillProperty = artboard.def.getFillProperty();
        if (fillProperty != null && stateMachine != null && stateMachine.bound != null
                && stateMachine.bound.types.get(fillProperty) == PropertyType.COLOR) {
            return (Integer) stateMachine.bound.values.get(fillProperty);
        }
        return artboard.color;
    }

    @Override
    public void readPixels(Object surface, byte[] dest) {
        checkThread();
        SoftSurface softSurface = cast(surface, SoftSurface.class);
        if (dest.length < softSurface.pixels.length * 4) {
            throw new IllegalArgumentException(
                    "buffer too small: %d < %d".formatted(dest.length, softSurface.pixels.length * 4));
        }
        SoftwareRasterizer.toRgba(softSurface.pixels, dest);
    }

    // ---------------------------------------------------------------- 生命周期

    @Override
    public void destroy(Object nativeObject) {
        checkThread();
        if (!liveObjects.remove(nativeObject)) {
            throw new IllegalStateException("Native object destroyed twice or never created: " + nativeObject);
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        checkThread();
        closed = true;
        if (!liveObjects.isEmpty()) {
            log.warn("SoftwareBackend 关闭时仍有 {} 个原生对象未销毁", liveObjects.size());
        }
        liveObjects.clear();
        pendingChanges.clear();
        log.info("SoftwareBackend 已关闭");
    }

    /**
     * 尚未销毁的原生对象数量
     */
    public int liveObjectCount() {
        return liveObjects.size();
    }

    public boolean isClosed() {
        return closed;
    }

    private Object track(Object nativeObject) {
        liveObjects.add(nativeObject);
        return nativeObject;
    }

    private <T> T cast(Object nativeObject, Class<T> type) {
        if (!type.isInstance(nativeObject)) {
            throw new CommandQueueException(ErrorCode.COMMAND_FAILED, "Expected %s but got %s".formatted(
                    type.getSimpleName(), nativeObject == null ? "null" : nativeObject.getClass().getSimpleName()));
        }
        if (!liveObjects.contains(nativeObject)) {
            throw new IllegalStateException("Use of destroyed native object " + nativeObject);
        }
        return type.cast(nativeObject);
    }

    private void checkThread() {
        if (closed) {
            throw new IllegalStateException("SoftwareBackend is closed");
        }
        Thread current = Thread.currentThread();
        if (ownerThread == null) {
            ownerThread = current;
        } else if (ownerThread != current) {
            throw new IllegalStateException("SoftwareBackend is confined to " + ownerThread.getName()
                    + " but was called from " + current.getName());
        }
    }

    private record Change(Object instance, String path, Object value) {
    }

    private static final class SoftFile {
        private final AnimationDocument document;

        private SoftFile(AnimationDocument document) {
            this.document = document;
        }
    }

    private static final class SoftArtboard {
        private final AnimationDocument.ArtboardDef def;
        private final int color;
        private float width;
        private float height;

        private SoftArtboard(AnimationDocument.ArtboardDef def) {
            this.def = def;
            this.color = PropertyValues.parseColor(def.getColor());
            this.width = def.getWidth();
            this.height = def.getHeight();
        }
    }

    private static final class SoftStateMachine {
        private final AnimationDocument.StateMachineDef def;
        private final Map<String, Object> inputValues = new LinkedHashMap<>();
        private float elapsed;
        private boolean settled;
        private boolean restartRequested;
        private SoftViewModelInstance bound;
        /** 只读尺寸，用作指针命中区域 */
        private final SoftArtboard artboard;
        /** 当前位于画板内的指针 */
        private final Set<Integer> pointersOver = new HashSet<>();

        private SoftStateMachine(AnimationDocument.StateMachineDef def, SoftArtboard artboard) {
            this.def = def;
            this.artboard = artboard;
            for (AnimationDocument.InputDef input : def.getInputs()) {
                switch (input.getType()) {
                    case NUMBER -> inputValues.put(input.getName(),
                            input.getValue() instanceof Number n ? n.floatValue() : 0f);
                    case BOOLEAN -> inputValues.put(input.getName(), Boolean.TRUE.equals(input.getValue()));
                    case TRIGGER -> inputValues.put(input.getName(), Boolean.FALSE);
                    default -> throw new IllegalArgumentException("Unknown input type " + input.getType());
                }
            }
        }
    }

    private static final class SoftViewModelInstance {
        private final AnimationDocument.ViewModelDef def;
        private final Map<String, PropertyType> types = new LinkedHashMap<>();
        private final Map<String, Object> values = new LinkedHashMap<>();

        private SoftViewModelInstance(AnimationDocument.ViewModelDef def) {
            this.def = def;
            for (AnimationDocument.PropertyDef property : def.getProperties()) {
                types.put(property.getName(), property.getType());
            }
        }
    }

    private static final class SoftSurface {
        private final int width;
        private final int height;
        private final int[] pixels;

        private SoftSurface(int width, int height) {
            this.width = width;
            this.height = height;
            this.pixels = new int[width * height];
        }
    }
}
