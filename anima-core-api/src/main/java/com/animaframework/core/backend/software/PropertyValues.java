package com.animaframework.core.backend.software;

import java.util.List;

import com.animaframework.core.error.CommandQueueException;
import com.animaframework.core.error.ErrorCode;
import com.animaframework.core.property.PropertyType;

/**
 * 文档中的原始 JSON 值与属性值类型之间的转换
 */
final class PropertyValues {

    private PropertyValues() {
    }

    /**
     * 类型的空白值
     */
    static Object blank(PropertyType type, List<String> enumValues) {
        return switch (type) {
            case NUMBER -> 0f;
            case STRING -> "";
            case BOOLEAN, TRIGGER -> Boolean.FALSE;
            case ENUM -> enumValues == null || enumValues.isEmpty() ? "" : enumValues.get(0);
            case COLOR -> 0xFF000000;
        };
    }

    /**
     * 把文档或调用方给出的值转换为属性的值类型
     */
    static Object coerce(PropertyType type, Object raw, List<String> enumValues, String path) {
        if (raw == null) {
            return blank(type, enumValues);
        }
        return switch (type) {
            case NUMBER -> {
                if (raw instanceof Number number) {
                    yield number.floatValue();
                }
                throw mismatch(path, type, raw);
            }
            case STRING -> {
                if (raw instanceof String s) {
                    yield s;
                }
                throw mismatch(path, type, raw);
            }
            case BOOLEAN, TRIGGER -> {
                if (raw instanceof Boolean b) {
                    yield b;
                }
                throw mismatch(path, type, raw);
            }
            case ENUM -> {
                if (!(raw instanceof String s)) {
                    throw mismatch(path, type, raw);
                }
                if (enumValues != null && !enumValues.isEmpty() && !enumValues.contains(s)) {
                    throw CommandQueueException.notFound("Enum value of " + path, s);
                }
                yield s;
            }
            case COLOR -> {
                if (raw instanceof Number number) {
                    yield number.intValue();
                }
                if (raw instanceof String s) {
                    yield parseColor(s);
                }
                throw mismatch(path, type, raw);
            }
        };
    }

    /**
     * 解析 "#RRGGBB" 或 "#AARRGGBB"，返回 ARGB
     */
    static int parseColor(String color) {
        if (color == null || !color.startsWith("#") || (color.length() != 7 && color.length() != 9)) {
            throw CommandQueueException.malformed("invalid color '" + color + "'", null);
        }
        try {
            long value = Long.parseLong(color.substring(1), 16);
            return color.length() == 7 ? (int) (0xFF000000L | value) : (int) value;
        } catch (NumberFormatException e) {
            throw CommandQueueException.malformed("invalid color '" + color + "'", e);
        }
    }

    static CommandQueueException mismatch(String path, Object expected, Object actual) {
        return new CommandQueueException(ErrorCode.COMMAND_FAILED, "'%s' expects %s but got %s".formatted(path,
                expected, actual == null ? "null" : actual.getClass().getSimpleName()));
    }

    static CommandQueueException typeMismatch(String path, Object declared, Object requested) {
        return new CommandQueueException(ErrorCode.COMMAND_FAILED,
                "'%s' is declared as %s, not %s".formatted(path, declared, requested));
    }
}
