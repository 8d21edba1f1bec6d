package io.simconvert.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for {@link ConversionResult}. */
class ConversionResultTest {

    @Test
    void convertedResultIsChanged() {
        var result = ConversionResult.converted(3, 11, List.of(3, 4, 5, 6, 7, 8, 9, 10), List.of());

        assertThat(result.status()).isEqualTo(ConversionResult.Status.CONVERTED);
        assertThat(result.isConverted()).isTrue();
        assertThat(result.isUpToDate()).isFalse();
        assertThat(result.isUnsupported()).isFalse();
        assertThat(result.changed()).isTrue();
        assertThat(result.fromVersion()).isEqualTo(3);
        assertThat(result.toVersion()).isEqualTo(11);
        assertThat(result.appliedSteps()).hasSize(8);
        assertThat(result.failedSteps()).isEmpty();
    }

    @Test
    void upToDateResultIsUnchanged() {
        var result = ConversionResult.upToDate(11);

        assertThat(result.isUpToDate()).isTrue();
        assertThat(result.changed()).isFalse();
        assertThat(result.fromVersion()).isEqualTo(result.toVersion()).isEqualTo(11);
    }

    @Test
    void unsupportedResultIsUnchanged() {
        var result = ConversionResult.unsupported(42);

        assertThat(result.isUnsupported()).isTrue();
        assertThat(result.changed()).isFalse();
        assertThat(result.toVersion()).isEqualTo(42);
    }

    @Test
    void abortedResultIsChangedOnlyWhenVersionMoved() {
        assertThat(ConversionResult.aborted(2, 5, List.of(2, 3, 4), List.of(5)).changed())
                .isTrue();
        assertThat(ConversionResult.aborted(2, 2, List.of(), List.of(2)).changed())
                .isFalse();
    }

    @Test
    void stepListsAreCopied() {
        List<Integer> applied = new ArrayList<>(List.of(0));
        var result = ConversionResult.converted(0, 1, applied, List.of());

        applied.add(99);

        assertThat(result.appliedSteps()).containsExactly(0);
        assertThatThrownBy(() -> result.appliedSteps().add(1)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void convertedRequiresStepLists() {
        assertThatThrownBy(() -> ConversionResult.converted(0, 1, null, List.of()))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("appliedSteps must not be null");
    }

    @Test
    void toStringContainsStatus() {
        assertThat(ConversionResult.upToDate(11).toString()).contains("UP_TO_DATE").contains("11");
        assertThat(ConversionResult.converted(0, 11, List.of(0), List.of(4)).toString())
                .contains("CONVERTED")
                .contains("0->11")
                .contains("failed=[4]");
        assertThat(ConversionResult.aborted(0, 4, List.of(0, 1, 2, 3), List.of(4)).toString())
                .contains("ABORTED");
    }
}
