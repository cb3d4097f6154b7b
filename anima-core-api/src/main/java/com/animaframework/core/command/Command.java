package com.animaframework.core.command;

import java.util.Objects;
import java.util.concurrent.Callable;

import com.animaframework.core.backend.InputType;
import com.animaframework.core.backend.InstanceSource;
import com.animaframework.core.handle.ArtboardHandle;
import com.animaframework.core.handle.FileHandle;
import com.animaframework.core.handle.StateMachineHandle;
import com.animaframework.core.handle.SurfaceHandle;
import com.animaframework.core.handle.ViewModelInstanceHandle;
import com.animaframework.core.property.PropertyKey;
import com.animaframework.core.property.PropertyType;
import com.animaframework.core.render.Alignment;
import com.animaframework.core.render.Fit;
import com.animaframework.core.render.ImageSurface;
import com.animaframework.core.render.PointerTarget;

/**
 * 入队到工作线程的命令。每种操作一个 record，携带各自的类型化参数，
 * 由调用方线程构造，工作线程恰好消费一次。
 */
public sealed interface Command {

    CommandType type();

    // ---------------------------------------------------------------- 文件

    record LoadFile(byte[] bytes) implements Command {
        public LoadFile {
            Objects.requireNonNull(bytes, "bytes");
        }

        @Override
        public CommandType type() {
            return CommandType.LOAD_FILE;
        }
    }

    record DeleteFile(FileHandle file) implements Command {
        @Override
        public CommandType type() {
            return CommandType.DELETE_FILE;
        }
    }

    record ListArtboards(FileHandle file) implements Command {
        @Override
        public CommandType type() {
            return CommandType.LIST_ARTBOARDS;
        }
    }

    record ListViewModels(FileHandle file) implements Command {
        @Override
        public CommandType type() {
            return CommandType.LIST_VIEW_MODELS;
        }
    }

    record ListViewModelInstances(FileHandle file, String viewModelName) implements Command {
        @Override
        public CommandType type() {
            return CommandType.LIST_VIEW_MODEL_INSTANCES;
        }
    }

    // ---------------------------------------------------------------- 画板

    /**
     * @param name null 表示默认画板
     */
    record CreateArtboard(FileHandle file, String name) implements Command {
        @Override
        public CommandType type() {
            return CommandType.CREATE_ARTBOARD;
        }
    }

    record DeleteArtboard(ArtboardHandle artboard) implements Command {
        @Override
        public CommandType type() {
            return CommandType.DELETE_ARTBOARD;
        }
    }

    record ListStateMachines(ArtboardHandle artboard) implements Command {
        @Override
        public CommandType type() {
            return CommandType.LIST_STATE_MACHINES;
        }
    }

    record GetArtboardSize(ArtboardHandle artboard) implements Command {
        @Override
        public CommandType type() {
            return CommandType.GET_ARTBOARD_SIZE;
        }
    }

    record ResizeArtboard(ArtboardHandle artboard, float width, float height) implements Command {
        @Override
        public CommandType type() {
            return CommandType.RESIZE_ARTBOARD;
        }
    }

    record ResetArtboardSize(ArtboardHandle artboard) implements Command {
        @Override
        public CommandType type() {
            return CommandType.RESET_ARTBOARD_SIZE;
        }
    }

    // ---------------------------------------------------------------- 状态机

    /**
     * @param name null 表示默认状态机
     */
    record CreateStateMachine(ArtboardHandle artboard, String name) implements Command {
        @Override
        public CommandType type() {
            return CommandType.CREATE_STATE_MACHINE;
        }
    }

    record DeleteStateMachine(StateMachineHandle stateMachine) implements Command {
        @Override
        public CommandType type() {
            return CommandType.DELETE_STATE_MACHINE;
        }
    }

    record AdvanceStateMachine(StateMachineHandle stateMachine, float deltaSeconds) implements Command {
        @Override
        public CommandType type() {
            return CommandType.ADVANCE_STATE_MACHINE;
        }
    }

    record ListInputs(StateMachineHandle stateMachine) implements Command {
        @Override
        public CommandType type() {
            return CommandType.LIST_INPUTS;
        }
    }

    record GetInput(StateMachineHandle stateMachine, String name, InputType inputType) implements Command {
        @Override
        public CommandType type() {
            return CommandType.GET_INPUT;
        }
    }

    /**
     * TRIGGER 类型的 value 为 null
     */
    record SetInput(StateMachineHandle stateMachine, String name, InputType inputType, Object value)
            implements Command {
        @Override
        public CommandType type() {
            return CommandType.SET_INPUT;
        }
    }

    record BindViewModelInstance(StateMachineHandle stateMachine, ViewModelInstanceHandle instance)
            implements Command {
        @Override
        public CommandType type() {
            return CommandType.BIND_VIEW_MODEL_INSTANCE;
        }
    }

    // ---------------------------------------------------------------- 指针

    /**
     * @param type POINTER_DOWN、POINTER_MOVE、POINTER_UP 或 POINTER_EXIT
     * @param x    表面坐标，POINTER_EXIT 时忽略
     */
    record Pointer(CommandType type, PointerTarget target, int pointerId, float x, float y) implements Command {
        public Pointer {
            Objects.requireNonNull(target, "target");
            if (type != CommandType.POINTER_DOWN && type != CommandType.POINTER_MOVE
                    && type != CommandType.POINTER_UP && type != CommandType.POINTER_EXIT) {
                throw new IllegalArgumentException("Not a pointer command type: " + type);
            }
        }
    }

    // ---------------------------------------------------------------- 视图模型

    /**
     * @param viewModelName null 表示文件的默认视图模型
     * @param instanceName  仅 NAMED 时使用
     */
    record CreateViewModelInstance(FileHandle file, String viewModelName, String instanceName,
                                   InstanceSource source) implements Command {
        @Override
        public CommandType type() {
            return CommandType.CREATE_VIEW_MODEL_INSTANCE;
        }
    }

    record DeleteViewModelInstance(ViewModelInstanceHandle instance) implements Command {
        @Override
        public CommandType type() {
            return CommandType.DELETE_VIEW_MODEL_INSTANCE;
        }
    }

    record GetProperty(ViewModelInstanceHandle instance, String path, PropertyType propertyType)
            implements Command {
        @Override
        public CommandType type() {
            return CommandType.GET_PROPERTY;
        }
    }

    record SetProperty(ViewModelInstanceHandle instance, String path, PropertyType propertyType, Object value)
            implements Command {
        @Override
        public CommandType type() {
            return CommandType.SET_PROPERTY;
        }
    }

    /**
     * 在工作线程上校验订阅的句柄和属性，失败时关闭订阅
     */
    record SubscribeProperty(long subscriptionId, PropertyKey key) implements Command {
        @Override
        public CommandType type() {
            return CommandType.SUBSCRIBE_PROPERTY;
        }
    }

    // ---------------------------------------------------------------- 渲染

    record CreateSurface(int width, int height) implements Command {
        @Override
        public CommandType type() {
            return CommandType.CREATE_SURFACE;
        }
    }

    record DeleteSurface(SurfaceHandle surface) implements Command {
        @Override
        public CommandType type() {
            return CommandType.DELETE_SURFACE;
        }
    }

    /**
     * 单画板绘制
     *
     * @param stateMachine 可为 null
     * @param readback     非 null 时绘制完成后读回像素
     */
    record Draw(ImageSurface surface, ArtboardHandle artboard, StateMachineHandle stateMachine, Fit fit,
                Alignment alignment, int clearColor, byte[] readback) implements Command {
        @Override
        public CommandType type() {
            return CommandType.DRAW;
        }
    }

    /**
     * 批量绘制
     *
     * @param readback 非 null 时绘制完成后读回像素
     */
    record DrawBatch(ImageSurface surface, PackedDrawList draws, int clearColor, byte[] readback)
            implements Command {
        @Override
        public CommandType type() {
            return CommandType.DRAW_BATCH;
        }
    }

    record RunOnWorker(Callable<?> task) implements Command {
        public RunOnWorker {
            Objects.requireNonNull(task, "task");
        }

        @Override
        public CommandType type() {
            return CommandType.RUN_ON_WORKER;
        }
    }
}
