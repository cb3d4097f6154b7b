package com.animaframework.core.backend;

/**
 * 状态机输入的描述信息
 */
public record InputInfo(String name, InputType type) {
}
