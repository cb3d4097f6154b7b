package com.animaframework.core.backend.software;

import java.io.IOException;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.animaframework.core.backend.InputType;
import com.animaframework.core.error.CommandQueueException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import lombok.extern.slf4j.Slf4j;

/**
 * 动画文档的解析与校验
 */
@Slf4j
public final class AnimationDocuments {

    /**
     * 支持的最高文档格式版本
     */
    public static final int SUPPORTED_VERSION = 1;

    private static final ObjectMapper objectMapper = JsonMapper.builder()
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();

    private AnimationDocuments() {
    }

    /**
     * 解析并校验文档
     *
     * @throws CommandQueueException MALFORMED_RESOURCE 或 UNSUPPORTED_VERSION
     */
    public static AnimationDocument parse(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw CommandQueueException.malformed("empty file", null);
        }
        AnimationDocument document;
        try {
            document = objectMapper.readValue(bytes, AnimationDocument.class);
        } catch (JsonProcessingException e) {
            throw CommandQueueException.malformed(e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw CommandQueueException.malformed(e.getMessage(), e);
        }
        if (document == null) {
            throw CommandQueueException.malformed("empty document", null);
        }
        if (document.getVersion() == null) {
            throw CommandQueueException.malformed("missing version", null);
        }
        if (document.getVersion() > SUPPORTED_VERSION) {
            throw CommandQueueException.unsupportedVersion(document.getVersion(), SUPPORTED_VERSION);
        }
        validate(document);
        log.debug("解析动画文档: {} 个画板, {} 个视图模型", document.getArtboards().size(),
                nonNull(document.getViewModels()).size());
        return document;
    }

    private static void validate(AnimationDocument document) {
        if (document.getArtboards() == null || document.getArtboards().isEmpty()) {
            throw CommandQueueException.malformed("file has no artboards", null);
        }
        Set<String> artboardNames = new HashSet<>();
        for (AnimationDocument.ArtboardDef artboard : document.getArtboards()) {
            requireName(artboard.getName(), "artboard", artboardNames);
            if (artboard.getWidth() <= 0 || artboard.getHeight() <= 0) {
                throw CommandQueueException.malformed("artboard '%s' has non-positive size".formatted(
                        artboard.getName()), null);
            }
            PropertyValues.parseColor(artboard.getColor());
            Set<String> stateMachineNames = new HashSet<>();
            for (AnimationDocument.StateMachineDef stateMachine : nonNull(artboard.getStateMachines())) {
                requireName(stateMachine.getName(), "state machine", stateMachineNames);
                Set<String> inputNames = new HashSet<>();
                Map<String, InputType> inputTypes = new HashMap<>();
                for (AnimationDocument.InputDef input : nonNull(stateMachine.getInputs())) {
                    requireName(input.getName(), "input", inputNames);
                    if (input.getType() == null) {
                        throw CommandQueueException.malformed("input '%s' has no type".formatted(input.getName()),
                                null);
                    }
                    inputTypes.put(input.getName(), input.getType());
                }
                for (AnimationDocument.ListenerDef listener : nonNull(stateMachine.getListeners())) {
                    validateListener(stateMachine.getName(), listener, inputTypes);
                }
            }
        }
        Set<String> viewModelNames = new HashSet<>();
        for (AnimationDocument.ViewModelDef viewModel : nonNull(document.getViewModels())) {
            requireName(viewModel.getName(), "view model", viewModelNames);
            Set<String> propertyNames = new HashSet<>();
            for (AnimationDocument.PropertyDef property : nonNull(viewModel.getProperties())) {
                requireName(property.getName(), "property", propertyNames);
                if (property.getType() == null) {
                    throw CommandQueueException.malformed("property '%s' has no type".formatted(property.getName()),
                            null);
                }
            }
            Set<String> instanceNames = new HashSet<>();
            for (AnimationDocument.InstanceDef instance : nonNull(viewModel.getInstances())) {
                requireName(instance.getName(), "view model instance", instanceNames);
            }
        }
    }

    private static void validateListener(String stateMachine, AnimationDocument.ListenerDef listener,
            Map<String, InputType> inputTypes) {
        if (listener.getEvent() == null) {
            throw CommandQueueException.malformed("listener of '%s' has no event".formatted(stateMachine), null);
        }
        InputType type = inputTypes.get(listener.getInput());
        if (type == null) {
            throw CommandQueueException.malformed("listener of '%s' targets unknown input '%s'".formatted(
                    stateMachine, listener.getInput()), null);
        }
        boolean valueMatches = switch (type) {
            case NUMBER -> listener.getValue() instanceof Number;
            case BOOLEAN -> listener.getValue() instanceof Boolean;
            case TRIGGER -> true;
        };
        if (!valueMatches) {
            throw CommandQueueException.malformed("listener of '%s' sets %s input '%s' to %s".formatted(
                    stateMachine, type, listener.getInput(), listener.getValue()), null);
        }
    }

    private static void requireName(String name, String what, Set<String> seen) {
        if (name == null || name.isBlank()) {
            throw CommandQueueException.malformed(what + " without a name", null);
        }
        if (!seen.add(name)) {
            throw CommandQueueException.malformed("duplicate %s '%s'".formatted(what, name), null);
        }
    }

    private static <T> List<T> nonNull(List<T> list) {
        return list != null ? list : List.of();
    }
}
