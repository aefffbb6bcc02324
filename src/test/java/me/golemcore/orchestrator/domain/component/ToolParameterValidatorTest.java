package me.golemcore.orchestrator.domain.component;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolParameterValidatorTest {

    private static final Map<String, Object> SCHEMA = Map.of(
            "type", "object",
            "properties", Map.of(
                    "message", Map.of("type", "string"),
                    "count", Map.of("type", "integer"),
                    "ratio", Map.of("type", "number"),
                    "force", Map.of("type", "boolean"),
                    "filters", Map.of("type", "object"),
                    "tags", Map.of("type", "array"),
                    "mode", Map.of("type", "string", "enum", List.of("fast", "safe"))),
            "required", List.of("message"));

    @Test
    void shouldAcceptValidParameters() {
        Map<String, Object> params = Map.of(
                "message", "hi",
                "count", 3,
                "ratio", 0.5,
                "force", true,
                "filters", Map.of("region", "nyc3"),
                "tags", List.of("a"),
                "mode", "safe");

        assertTrue(ToolParameterValidator.validate(SCHEMA, params).isEmpty());
    }

    @Test
    void shouldAcceptUndeclaredFields() {
        assertTrue(ToolParameterValidator.validate(SCHEMA, Map.of("message", "hi", "user_id", "42")).isEmpty());
    }

    @Test
    void shouldReportMissingRequiredField() {
        Optional<String> error = ToolParameterValidator.validate(SCHEMA, Map.of("count", 1));

        assertEquals(Optional.of("Missing required parameter: message"), error);
    }

    @Test
    void shouldTreatNullRequiredValueAsMissing() {
        Map<String, Object> params = new HashMap<>();
        params.put("message", null);

        assertEquals(Optional.of("Missing required parameter: message"),
                ToolParameterValidator.validate(SCHEMA, params));
    }

    @Test
    void shouldReportWrongType() {
        Optional<String> error = ToolParameterValidator.validate(SCHEMA, Map.of("message", "hi", "force", "yes"));

        assertEquals(Optional.of("Invalid parameter 'force': expected boolean but got string"), error);
    }

    @Test
    void shouldRejectFractionForInteger() {
        Optional<String> error = ToolParameterValidator.validate(SCHEMA, Map.of("message", "hi", "count", 1.5));

        assertTrue(error.isPresent());
        assertTrue(error.get().startsWith("Invalid parameter 'count'"));
    }

    @Test
    void shouldRejectValueOutsideEnum() {
        Optional<String> error = ToolParameterValidator.validate(SCHEMA, Map.of("message", "hi", "mode", "yolo"));

        assertEquals(Optional.of("Invalid parameter 'mode': must be one of [fast, safe]"), error);
    }

    @Test
    void shouldAcceptAnythingWithoutSchema() {
        assertTrue(ToolParameterValidator.validate(null, Map.of("x", 1)).isEmpty());
    }
}
