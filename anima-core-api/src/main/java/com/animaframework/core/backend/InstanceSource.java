package com.animaframework.core.backend;

/**
 * 创建视图模型实例的方式
 */
public enum InstanceSource {

    /**
     * 所有属性取类型默认值
     */
    BLANK,

    /**
     * 文件中为该视图模型定义的默认实例
     */
    DEFAULT,

    /**
     * 文件中按名称定义的实例
     */
    NAMED
}
