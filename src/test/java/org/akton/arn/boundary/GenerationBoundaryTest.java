package org.akton.arn.boundary;

import org.akton.arn.ArnError;
import org.akton.arn.Outcome;
import org.akton.arn.id.EntropyUnavailableException;
import org.akton.arn.ops.ArnErrorReporter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

class GenerationBoundaryTest {

    private GenerationBoundary boundary;
    private List<String> reportedOperations;
    private List<ArnError> reportedErrors;

    @BeforeEach
    void setUp() {
        reportedOperations = new ArrayList<>();
        reportedErrors = new ArrayList<>();
        ArnErrorReporter reporter = (operation, error) -> {
            reportedOperations.add(operation);
            reportedErrors.add(error);
        };
        boundary = GenerationBoundary.withReporter(reporter);
    }

    @Test
    void call_success_returnsOk() {
        UUID value = new UUID(1, 2);

        Outcome<UUID> result = boundary.call("TestOp", () -> value);

        assertThat(result.getOrThrow()).isEqualTo(value);
        assertThat(reportedErrors).isEmpty();
    }

    @Test
    void call_checkedException_returnsGenerationFailed() {
        Outcome<UUID> result = boundary.call("ArnCodec.create", () -> {
            throw new EntropyUnavailableException("no entropy", new IllegalStateException("closed"));
        });

        assertThat(result.error()).hasValueSatisfying(error -> {
            assertThat(error).isInstanceOf(ArnError.GenerationFailed.class);
            ArnError.GenerationFailed failed = (ArnError.GenerationFailed) error;
            assertThat(failed.reason()).isEqualTo("no entropy");
            assertThat(failed.cause().type()).isEqualTo(IllegalStateException.class.getName());
            assertThat(failed.cause().fingerprint()).startsWith("IllegalStateException@");
            assertThat(failed.cause().detail()).isEqualTo("closed");
        });
        assertThat(reportedOperations).containsExactly("ArnCodec.create");
    }

    @Test
    void call_exceptionWithoutMessage_usesTypeName() {
        Outcome<UUID> result = boundary.call("TestOp", () -> {
            throw new Exception();
        });

        assertThat(result.error()).hasValueSatisfying(error ->
                assertThat(((ArnError.GenerationFailed) error).reason()).isEqualTo("Exception"));
    }

    @Test
    void call_runtimeException_propagates() {
        assertThatThrownBy(() -> boundary.call("TestOp", () -> {
            throw new IllegalStateException("defect");
        }))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("defect");

        assertThat(reportedErrors).isEmpty();
    }

    @Test
    void silent_doesNotRequireReporter() {
        Outcome<UUID> result = GenerationBoundary.silent().call("TestOp", () -> {
            throw new EntropyUnavailableException("gone");
        });

        assertThat(result.isFail()).isTrue();
    }

    @Test
    void constructor_rejectsNullReporter() {
        assertThatThrownBy(() -> new GenerationBoundary(null))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("reporter");
    }
}
