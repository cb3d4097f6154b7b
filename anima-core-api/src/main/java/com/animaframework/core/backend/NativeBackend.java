package com.animaframework.core.backend;

import java.util.List;
import java.util.Optional;

import com.animaframework.core.property.PropertyType;

/**
 * 原生渲染/动画引擎的窄接口，每个原生操作对应一个方法。
 * <p>
 * 所有方法只会在命令队列的工作线程上被调用，实现可以假定线程独占，不需要额外加锁。
 * 原生对象以不透明的 Object 表示，句柄到原生对象的映射由核心维护。
 * 可恢复的失败应抛出 {@link com.animaframework.core.error.CommandQueueException}，
 * 其他异常会被工作线程包装为 COMMAND_FAILED。
 */
public interface NativeBackend extends AutoCloseable {

    String name();

    // ---------------------------------------------------------------- 文件

    /**
     * 解析文件字节
     *
     * @throws com.animaframework.core.error.CommandQueueException MALFORMED_RESOURCE 或 UNSUPPORTED_VERSION
     */
    Object loadFile(byte[] bytes);

    List<String> artboardNames(Object file);

    List<String> viewModelNames(Object file);

    List<String> viewModelInstanceNames(Object file, String viewModelName);

    // ---------------------------------------------------------------- 画板

    /**
     * @param name 画板名称，null 表示默认画板
     */
    Object createArtboard(Object file, String name);

    List<String> stateMachineNames(Object artboard);

    ArtboardSize artboardSize(Object artboard);

    void resizeArtboard(Object artboard, float width, float height);

    void resetArtboardSize(Object artboard);

    // ---------------------------------------------------------------- 状态机

    /**
     * @param name 状态机名称，null 表示默认状态机
     */
    Object createStateMachine(Object artboard, String name);

    /**
     * 推进状态机
     *
     * @return 本次推进后状态机是否刚刚进入稳定状态
     */
    boolean advance(Object stateMachine, float deltaSeconds);

    List<InputInfo> inputs(Object stateMachine);

    Object getInput(Object stateMachine, String name, InputType type);

    /**
     * 设置输入值；TRIGGER 类型忽略 value 直接触发
     */
    void setInput(Object stateMachine, String name, InputType type, Object value);

    // ---------------------------------------------------------------- 指针

    /**
     * 指针按下，坐标为画板本地坐标（0..width, 0..height）
     */
    void pointerDown(Object stateMachine, int pointerId, float x, float y);

    void pointerMove(Object stateMachine, int pointerId, float x, float y);

    void pointerUp(Object stateMachine, int pointerId, float x, float y);

    /**
     * 指针离开画板
     */
    void pointerExit(Object stateMachine, int pointerId);

    // ---------------------------------------------------------------- 视图模型

    Object createViewModelInstance(Object file, String viewModelName, String instanceName, InstanceSource source);

    void bindViewModelInstance(Object stateMachine, Object instance);

    Optional<PropertyType> propertyType(Object instance, String propertyPath);

    Object getProperty(Object instance, String propertyPath, PropertyType type);

    /**
     * 设置属性值；TRIGGER 类型忽略 value 直接触发
     */
    void setProperty(Object instance, String propertyPath, PropertyType type, Object value);

    /**
     * 回报自上次调用以来发生变化的属性，并清空变化记录
     */
    void drainPropertyChanges(PropertyChangeSink sink);

    // ---------------------------------------------------------------- 渲染

    Object createSurface(int width, int height);

    /**
     * 在一次提交中清屏并按顺序绘制全部记录。draws 及其元素在返回后会被复用
     */
    void drawBatch(Object surface, List<ResolvedDraw> draws, int clearColor);

    /**
     * 将表面像素以 RGBA 行优先顺序读回到 dest
     */
    void readPixels(Object surface, byte[] dest);

    // ---------------------------------------------------------------- 生命周期

    /**
     * 销毁单个原生对象
     */
    void destroy(Object nativeObject);

    /**
     * 释放原生上下文
     */
    @Override
    void close();
}
