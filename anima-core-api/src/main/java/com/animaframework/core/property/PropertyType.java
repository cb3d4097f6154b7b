package com.animaframework.core.property;

/**
 * 视图模型属性的数据类型，以及每种类型在 Java 侧的值类型
 */
public enum PropertyType {
    NUMBER(Float.class),
    STRING(String.class),
    BOOLEAN(Boolean.class),
    ENUM(String.class),
    COLOR(Integer.class),
    // 触发器没有值，更新中固定为 Boolean.TRUE
    TRIGGER(Boolean.class);

    private final Class<?> valueType;

    PropertyType(Class<?> valueType) {
        this.valueType = valueType;
    }

    public Class<?> getValueType() {
        return valueType;
    }
}
