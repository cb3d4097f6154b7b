package com.animaframework.core.backend;

/**
 * 状态机输入类型
 */
public enum InputType {
    NUMBER,
    BOOLEAN,
    TRIGGER
}
