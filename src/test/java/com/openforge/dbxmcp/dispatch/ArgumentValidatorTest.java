package com.openforge.dbxmcp.dispatch;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.openforge.dbxmcp.tool.ParamType;
import com.openforge.dbxmcp.tool.ParameterSpec;
import com.openforge.dbxmcp.tool.ToolDescriptor;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ArgumentValidatorTest {

    private final ArgumentValidator validator = new ArgumentValidator();

    private static final ToolDescriptor LIST_RUNS = descriptor(
            ParameterSpec.required("job_id", ParamType.INTEGER, "ID of the job"),
            new ParameterSpec("limit", ParamType.INTEGER, false, 25, "page size"),
            ParameterSpec.optional("active_only", ParamType.BOOLEAN, null),
            ParameterSpec.optional("tags", ParamType.OBJECT, null),
            ParameterSpec.optional("run_ids", ParamType.ARRAY, null));

    private static ToolDescriptor descriptor(ParameterSpec... specs) {
        Map<String, ParameterSpec> params = new LinkedHashMap<>();
        for (ParameterSpec spec : specs) {
            params.put(spec.name(), spec);
        }
        return ToolDescriptor.builder()
                .name("list_runs")
                .parameters(params)
                .handler((arguments, context) -> JsonNodeFactory.instance.objectNode())
                .build();
    }

    @Test
    void defaultsAreAppliedForAbsentOptionals() {
        Map<String, Object> validated = validator.validate(LIST_RUNS, Map.of("job_id", 7));

        assertThat(validated).containsEntry("job_id", 7).containsEntry("limit", 25);
        assertThat(validated).doesNotContainKey("active_only");
    }

    @Test
    void explicitValueBeatsDefault() {
        Map<String, Object> validated = validator.validate(LIST_RUNS, Map.of("job_id", 7, "limit", 5));

        assertThat(validated).containsEntry("limit", 5);
    }

    @Test
    void missingRequiredParameterIsNamed() {
        assertThatThrownBy(() -> validator.validate(LIST_RUNS, Map.of()))
                .isInstanceOfSatisfying(ValidationException.class, e -> {
                    assertThat(e.getToolName()).isEqualTo("list_runs");
                    assertThat(e.getViolations()).containsExactly("missing required parameter 'job_id'");
                });
    }

    @Test
    void explicitNullCountsAsMissing() {
        Map<String, Object> args = new HashMap<>();
        args.put("job_id", null);

        assertThatThrownBy(() -> validator.validate(LIST_RUNS, args))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("job_id");
    }

    @Test
    void unknownParametersAreRejected() {
        assertThatThrownBy(() -> validator.validate(LIST_RUNS, Map.of("job_id", 1, "jobid", 1)))
                .isInstanceOfSatisfying(ValidationException.class,
                        e -> assertThat(e.getViolations()).containsExactly("unknown parameter 'jobid'"));
    }

    @Test
    void typeMismatchesAreAllReported() {
        Map<String, Object> args = Map.of(
                "job_id", "7",
                "active_only", "yes",
                "tags", List.of("a"));

        assertThatThrownBy(() -> validator.validate(LIST_RUNS, args))
                .isInstanceOfSatisfying(ValidationException.class, e -> assertThat(e.getViolations())
                        .containsExactlyInAnyOrder(
                                "parameter 'job_id' must be of type integer but was string",
                                "parameter 'active_only' must be of type boolean but was string",
                                "parameter 'tags' must be of type object but was array"));
    }

    @Test
    void wholeDoublesCountAsIntegers() {
        assertThat(validator.validate(LIST_RUNS, Map.of("job_id", 7.0))).containsEntry("job_id", 7.0);
        assertThatThrownBy(() -> validator.validate(LIST_RUNS, Map.of("job_id", 7.5)))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void nullArgumentMapIsEmpty() {
        ToolDescriptor noParams = descriptor();

        assertThat(validator.validate(noParams, null)).isEmpty();
    }
}
