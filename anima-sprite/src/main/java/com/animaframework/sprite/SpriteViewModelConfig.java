package com.animaframework.sprite;

import java.util.Objects;

import com.animaframework.core.handle.ViewModelInstanceHandle;

/**
 * 创建精灵时如何得到它的视图模型实例。
 * <p>
 * 除 {@link External} 外，实例由精灵创建并在移除精灵时删除；External 的实例由调用方管理。
 * 精灵带状态机时，实例会绑定到该状态机。
 */
public sealed interface SpriteViewModelConfig {

    SpriteViewModelConfig NONE = new None();
    SpriteViewModelConfig AUTO_BIND = new AutoBind();

    /** 不创建视图模型实例 */
    record None() implements SpriteViewModelConfig {
    }

    /** 文件的第一个视图模型及其默认实例；文件没有视图模型时不创建 */
    record AutoBind() implements SpriteViewModelConfig {
    }

    /** 指定视图模型的默认实例 */
    record Named(String viewModelName) implements SpriteViewModelConfig {
        public Named {
            Objects.requireNonNull(viewModelName, "viewModelName");
        }
    }

    record NamedInstance(String viewModelName, String instanceName) implements SpriteViewModelConfig {
        public NamedInstance {
            Objects.requireNonNull(viewModelName, "viewModelName");
            Objects.requireNonNull(instanceName, "instanceName");
        }
    }

    /** 调用方已创建的实例，精灵不负责删除 */
    record External(ViewModelInstanceHandle instance) implements SpriteViewModelConfig {
        public External {
            Objects.requireNonNull(instance, "instance");
        }
    }
}
