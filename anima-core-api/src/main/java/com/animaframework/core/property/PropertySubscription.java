package com.animaframework.core.property;

import java.util.function.Consumer;

import lombok.Getter;

/**
 * 对单个 (句柄, 属性路径) 的订阅
 */
@Getter
public class PropertySubscription<T> extends EventSubscription<PropertyUpdate<T>> {

    private final PropertyKey key;
    private final Class<T> valueType;

    PropertySubscription(long id, PropertyKey key, Class<T> valueType, int capacity, OverflowPolicy policy,
            Consumer<EventSubscription<PropertyUpdate<T>>> onClose) {
        super(id, capacity, policy, onClose);
        this.key = key;
        this.valueType = valueType;
    }

    @Override
    public String toString() {
        return "PropertySubscription[" + getId() + ", " + key.handle() + ", " + key.propertyPath() + "]";
    }
}
