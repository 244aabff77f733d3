package com.braindump.orchestrator.model.convert;

import com.braindump.orchestrator.model.DemoStep;
import com.braindump.orchestrator.model.DemoStepStatus;
import com.braindump.orchestrator.model.DemoStepType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DemoStepsConverterTest {

    final DemoStepsConverter converter = new DemoStepsConverter();

    @Test
    void write_usesStableEnumStrings() {
        String json = converter.convertToDatabaseColumn(List.of(
                new DemoStep(1, "Open the login page", "Form visible", DemoStepType.VISUAL, DemoStepStatus.PENDING, null)));

        assertThat(json).contains("\"schemaVersion\":1").contains("\"type\":\"visual\"").contains("\"status\":\"pending\"");
    }

    @Test
    void read_unversionedArray_isAccepted() {
        List<DemoStep> steps = converter.convertToEntityAttribute(
                "[{\"order\":1,\"description\":\"Click login\",\"type\":\"manual\",\"status\":\"passed\"}]");

        assertThat(steps).singleElement().satisfies(s -> {
            assertThat(s.type()).isEqualTo(DemoStepType.MANUAL);
            assertThat(s.status()).isEqualTo(DemoStepStatus.PASSED);
        });
    }

    @Test
    void read_corruptPayload_givesNoSteps() {
        assertThat(converter.convertToEntityAttribute("{oops")).isEmpty();
    }

    @Test
    void read_jsonNullLiteral_givesNoSteps() {
        assertThat(converter.convertToEntityAttribute("null")).isEmpty();
    }

    @Test
    void read_nullSteps_areDropped() {
        assertThat(converter.convertToEntityAttribute(
                "{\"schemaVersion\":1,\"steps\":[null,{\"order\":1,\"description\":\"Click login\"}]}"))
                .singleElement()
                .extracting(DemoStep::description)
                .isEqualTo("Click login");
        assertThat(converter.convertToEntityAttribute("[null]")).isEmpty();
    }
}
