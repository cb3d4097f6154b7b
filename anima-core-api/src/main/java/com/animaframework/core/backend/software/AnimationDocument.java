package com.animaframework.core.backend.software;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.animaframework.core.backend.InputType;
import com.animaframework.core.property.PropertyType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * {@link SoftwareBackend} 读取的 JSON 动画文档。
 * 集合字段及其元素显式为 null 时解析失败。
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AnimationDocument {

    @JsonProperty("version")
    private Integer version;

    @JsonProperty("artboards")
    @JsonSetter(nulls = Nulls.FAIL, contentNulls = Nulls.FAIL)
    private List<ArtboardDef> artboards = new ArrayList<>();

    @JsonProperty("view_models")
    @JsonSetter(nulls = Nulls.FAIL, contentNulls = Nulls.FAIL)
    private List<ViewModelDef> viewModels = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ArtboardDef {

        @JsonProperty("name")
        private String name;

        @JsonProperty("width")
        private float width;

        @JsonProperty("height")
        private float height;

        /**
         * 填充色，"#RRGGBB" 或 "#AARRGGBB"
         */
        @JsonProperty("color")
        private String color = "#FF000000";

        /**
         * 可选：绑定的视图模型实例中覆盖填充色的 COLOR 属性
         */
        @JsonProperty("fill_property")
        private String fillProperty;

        @JsonProperty("state_machines")
        @JsonSetter(nulls = Nulls.FAIL, contentNulls = Nulls.FAIL)
        private List<StateMachineDef> stateMachines = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StateMachineDef {

        @JsonProperty("name")
        private String name;

        /**
         * 动画时长（秒），推进累计时间达到时长后进入稳定状态
         */
        @JsonProperty("duration")
        private float duration = 1f;

        /**
         * 可选：每次推进时写入进度 (0..1) 的 NUMBER 属性
         */
        @JsonProperty("drives")
        private String drives;

        @JsonProperty("inputs")
        @JsonSetter(nulls = Nulls.FAIL, contentNulls = Nulls.FAIL)
        private List<InputDef> inputs = new ArrayList<>();

        /**
         * 指针监听器，命中区域是整个画板
         */
        @JsonProperty("listeners")
        @JsonSetter(nulls = Nulls.FAIL, contentNulls = Nulls.FAIL)
        private List<ListenerDef> listeners = new ArrayList<>();
    }

    public enum ListenerEvent {
        DOWN,
        MOVE,
        UP,
        /** 指针离开画板，或移动到画板之外 */
        EXIT
    }

    /**
     * 指针事件发生时设置一个输入；TRIGGER 输入忽略 value
     */
    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ListenerDef {

        @JsonProperty("event")
        private ListenerEvent event;

        @JsonProperty("input")
        private String input;

        @JsonProperty("value")
        private Object value;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class InputDef {

        @JsonProperty("name")
        private String name;

        @JsonProperty("type")
        private InputType type;

        @JsonProperty("value")
        private Object value;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ViewModelDef {

        @JsonProperty("name")
        private String name;

        @JsonProperty("properties")
        @JsonSetter(nulls = Nulls.FAIL, contentNulls = Nulls.FAIL)
        private List<PropertyDef> properties = new ArrayList<>();

        @JsonProperty("instances")
        @JsonSetter(nulls = Nulls.FAIL, contentNulls = Nulls.FAIL)
        private List<InstanceDef> instances = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PropertyDef {

        @JsonProperty("name")
        private String name;

        @JsonProperty("type")
        private PropertyType type;

        @JsonProperty("value")
        private Object value;

        /**
         * ENUM 属性的可选值
         */
        @JsonProperty("values")
        @JsonSetter(nulls = Nulls.FAIL, contentNulls = Nulls.FAIL)
        private List<String> values = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class InstanceDef {

        @JsonProperty("name")
        private String name;

        @JsonProperty("values")
        @JsonSetter(nulls = Nulls.FAIL, contentNulls = Nulls.FAIL)
        private Map<String, Object> values = new LinkedHashMap<>();
    }
}
