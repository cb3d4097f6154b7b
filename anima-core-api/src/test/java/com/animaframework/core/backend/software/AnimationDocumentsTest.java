package com.animaframework.core.backend.software;

import java.nio.charset.StandardCharsets;

import com.animaframework.core.backend.InputType;
import com.animaframework.core.error.CommandQueueException;
import com.animaframework.core.error.ErrorCode;
import com.animaframework.core.property.PropertyType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AnimationDocumentsTest {

    private static AnimationDocument parse(String json) {
        return AnimationDocuments.parse(json.getBytes(StandardCharsets.UTF_8));
    }

    private static void assertRejected(String json, ErrorCode expected) {
        CommandQueueException e = assertThrows(CommandQueueException.class, () -> parse(json));
        assertEquals(expected, e.getCode(), e.getMessage());
    }

    @Test
    void parsesMinimalDocumentWithDefaults() {
        AnimationDocument document = parse("""
                {"version": 1, "artboards": [{"name": "A", "width": 10, "height": 5}], "extra": true}
                """);

        AnimationDocument.ArtboardDef artboard = document.getArtboards().get(0);
        assertEquals("A", artboard.getName());
        assertEquals("#FF000000", artboard.getColor());
        assertTrue(artboard.getStateMachines().isEmpty());
        assertTrue(document.getViewModels().isEmpty());
    }

    @Test
    void typesAreCaseInsensitive() {
        AnimationDocument document = parse("""
                {"version": 1,
                 "artboards": [{"name": "A", "width": 1, "height": 1,
                   "state_machines": [{"name": "S", "inputs": [{"name": "go", "type": "TRIGGER"}]}]}],
                 "view_models": [{"name": "VM", "properties": [{"name": "c", "type": "Color"}]}]}
                """);

        assertEquals(InputType.TRIGGER,
                document.getArtboards().get(0).getStateMachines().get(0).getInputs().get(0).getType());
        assertEquals(PropertyType.COLOR, document.getViewModels().get(0).getProperties().get(0).getType());
    }

    @Test
    void structuralProblemsAreMalformed() {
        assertRejected("", ErrorCode.MALFORMED_RESOURCE);
        assertRejected("{\"version\": 1} trailing", ErrorCode.MALFORMED_RESOURCE);
        assertRejected("{\"artboards\": [{\"name\": \"A\", \"width\": 1, \"height\": 1}]}",
                ErrorCode.MALFORMED_RESOURCE);
        assertRejected("""
                {"version": 1, "artboards": [{"name": "A", "width": 1, "height": 1},
                                             {"name": "A", "width": 1, "height": 1}]}
                """, ErrorCode.MALFORMED_RESOURCE);
        assertRejected("""
                {"version": 1, "artboards": [{"name": "A", "width": 0, "height": 1}]}
                """, ErrorCode.MALFORMED_RESOURCE);
        assertRejected("""
                {"version": 1, "artboards": [{"name": "A", "width": 1, "height": 1, "color": "red"}]}
                """, ErrorCode.MALFORMED_RESOURCE);
    }

    @Test
    void explicitNullsAreMalformed() {
        String artboard = "{\"name\": \"A\", \"width\": 1, \"height\": 1%s}";
        assertRejected("{\"version\": 1, \"artboards\": [null]}", ErrorCode.MALFORMED_RESOURCE);
        assertRejected("{\"version\": 1, \"artboards\": null}", ErrorCode.MALFORMED_RESOURCE);
        assertRejected("{\"version\": 1, \"artboards\": [" + artboard.formatted(", \"state_machines\": null") + "]}",
                ErrorCode.MALFORMED_RESOURCE);
        assertRejected("{\"version\": 1, \"artboards\": [" + artboard.formatted(", \"state_machines\": [null]")
                + "]}", ErrorCode.MALFORMED_RESOURCE);
        assertRejected("{\"version\": 1, \"artboards\": ["
                + artboard.formatted(", \"state_machines\": [{\"name\": \"S\", \"inputs\": null}]") + "]}",
                ErrorCode.MALFORMED_RESOURCE);

        String withArtboard = "{\"version\": 1, \"artboards\": [" + artboard.formatted("") + "], ";
        assertRejected(withArtboard + "\"view_models\": null}", ErrorCode.MALFORMED_RESOURCE);
        assertRejected(withArtboard + "\"view_models\": [{\"name\": \"VM\", \"properties\": null}]}",
                ErrorCode.MALFORMED_RESOURCE);
        assertRejected(withArtboard + "\"view_models\": [{\"name\": \"VM\", \"instances\": null}]}",
                ErrorCode.MALFORMED_RESOURCE);
        assertRejected(withArtboard + "\"view_models\": [{\"name\": \"VM\", \"instances\": [null]}]}",
                ErrorCode.MALFORMED_RESOURCE);
        assertRejected(withArtboard
                + "\"view_models\": [{\"name\": \"VM\", \"instances\": [{\"name\": \"I\", \"values\": null}]}]}",
                ErrorCode.MALFORMED_RESOURCE);
    }

    @Test
    void listenersMustTargetDeclaredInputsWithMatchingValues() {
        String template = """
                {"version": 1, "artboards": [{"name": "A", "width": 1, "height": 1,
                  "state_machines": [{"name": "S",
                    "inputs": [{"name": "on", "type": "boolean"}, {"name": "go", "type": "trigger"}],
                    "listeners": [%s]}]}]}
                """;

        AnimationDocument document = parse(template.formatted(
                "{\"event\": \"Down\", \"input\": \"on\", \"value\": true}, {\"event\": \"up\", \"input\": \"go\"}"));
        AnimationDocument.StateMachineDef stateMachine = document.getArtboards().get(0).getStateMachines().get(0);
        assertEquals(2, stateMachine.getListeners().size());
        assertEquals(AnimationDocument.ListenerEvent.DOWN, stateMachine.getListeners().get(0).getEvent());

        assertRejected(template.formatted("{\"input\": \"on\", \"value\": true}"), ErrorCode.MALFORMED_RESOURCE);
        assertRejected(template.formatted("{\"event\": \"down\", \"input\": \"off\", \"value\": true}"),
                ErrorCode.MALFORMED_RESOURCE);
        assertRejected(template.formatted("{\"event\": \"down\", \"input\": \"on\", \"value\": 1}"),
                ErrorCode.MALFORMED_RESOURCE);
        assertRejected(template.formatted("{\"event\": \"hover\", \"input\": \"on\", \"value\": true}"),
                ErrorCode.MALFORMED_RESOURCE);
        assertRejected(template.formatted("null"), ErrorCode.MALFORMED_RESOURCE);
    }

    @Test
    void newerVersionIsUnsupported() {
        assertRejected("""
                {"version": 7, "artboards": [{"name": "A", "width": 1, "height": 1}]}
                """, ErrorCode.UNSUPPORTED_VERSION);
    }

    @Test
    void colorsParseToArgb() {
        assertEquals(0xFF00FF00, PropertyValues.parseColor("#00FF00"));
        assertEquals(0x8000FF00, PropertyValues.parseColor("#8000FF00"));
        assertThrows(CommandQueueException.class, () -> PropertyValues.parseColor("#XYZXYZ"));
    }
}
