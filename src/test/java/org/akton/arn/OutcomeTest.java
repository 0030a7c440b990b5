package org.akton.arn;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class OutcomeTest {

    private static final ArnError MALFORMED = new ArnError.MalformedArn("arn:prod", 2);

    @Test
    void ok_containsValue() {
        Outcome<String> outcome = Outcome.ok("hello");

        assertThat(outcome.isOk()).isTrue();
        assertThat(outcome.isFail()).isFalse();
        assertThat(outcome).isInstanceOf(Outcome.Ok.class);
        assertThat(((Outcome.Ok<String>) outcome).value()).isEqualTo("hello");
        assertThat(outcome.error()).isEmpty();
    }

    @Test
    void ok_rejectsNullValue() {
        assertThatThrownBy(() -> Outcome.ok(null))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void ok_getOrThrow_returnsValue() {
        assertThat(Outcome.ok("hello").getOrThrow()).isEqualTo("hello");
    }

    @Test
    void ok_getOrElse_returnsValue() {
        assertThat(Outcome.ok("hello").getOrElse("default")).isEqualTo("hello");
    }

    @Test
    void fail_containsError() {
        Outcome<String> outcome = Outcome.fail(MALFORMED);

        assertThat(outcome.isOk()).isFalse();
        assertThat(outcome.isFail()).isTrue();
        assertThat(((Outcome.Fail<String>) outcome).failure()).isEqualTo(MALFORMED);
        assertThat(outcome.error()).contains(MALFORMED);
    }

    @Test
    void fail_getOrThrow_throwsWithError() {
        Outcome<String> outcome = Outcome.fail(MALFORMED);

        assertThatThrownBy(outcome::getOrThrow)
                .isInstanceOf(ArnFailedException.class)
                .hasMessageContaining("arn:malformed")
                .hasMessageContaining("found 2")
                .extracting(e -> ((ArnFailedException) e).error())
                .isEqualTo(MALFORMED);
    }

    @Test
    void fail_getOrElse_returnsDefault() {
        Outcome<String> outcome = Outcome.fail(MALFORMED);

        assertThat(outcome.getOrElse("default")).isEqualTo("default");
        assertThat(outcome.getOrElseGet(() -> "computed")).isEqualTo("computed");
    }

    @Test
    void ok_map_transformsValue() {
        Outcome<Integer> mapped = Outcome.ok("hello").map(String::length);

        assertThat(mapped.getOrThrow()).isEqualTo(5);
    }

    @Test
    void fail_map_propagatesError() {
        Outcome<Integer> mapped = Outcome.<String>fail(MALFORMED).map(String::length);

        assertThat(mapped.isFail()).isTrue();
        assertThat(mapped.error()).contains(MALFORMED);
    }

    @Test
    void ok_flatMap_canReturnFailure() {
        Outcome<Integer> flatMapped = Outcome.ok("hello").flatMap(s -> Outcome.fail(MALFORMED));

        assertThat(flatMapped.error()).contains(MALFORMED);
    }

    @Test
    void fail_flatMap_doesNotInvokeMapper() {
        Outcome<Integer> flatMapped = Outcome.<String>fail(MALFORMED).flatMap(s -> {
            throw new AssertionError("must not be called");
        });

        assertThat(flatMapped.isFail()).isTrue();
    }

    @Test
    void fail_recover_appliesRecovery() {
        Outcome<String> recovered = Outcome.<String>fail(MALFORMED).recover(e -> e.code().name());

        assertThat(recovered.getOrThrow()).isEqualTo("malformed");
    }

    @Test
    void ok_recover_returnsOriginal() {
        assertThat(Outcome.ok("hello").recover(e -> "recovered").getOrThrow()).isEqualTo("hello");
    }

    @Test
    void onFailure_runsOnlyForFailures() {
        List<ArnError> seen = new ArrayList<>();

        Outcome.ok("hello").onFailure(seen::add);
        Outcome.fail(MALFORMED).onFailure(seen::add);

        assertThat(seen).containsExactly(MALFORMED);
    }
}
