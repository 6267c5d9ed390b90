package com.ppm.backend.simulation;

import com.ppm.backend.exception.ConstructionValidationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CorrelationMatrixTest {

    @Test
    void rejectsCoefficientOutsideRange() {
        assertThatThrownBy(() -> CorrelationMatrix.builder(List.of("R1", "R2")).correlate("R1", "R2", 1.5))
                .isInstanceOf(ConstructionValidationException.class)
                .hasMessageContaining("[-1, 1]");
    }

    @Test
    void rejectsConflictingDuplicatePair() {
        CorrelationMatrix.Builder builder = CorrelationMatrix.builder(List.of("R1", "R2"))
                .correlate("R1", "R2", 0.5);

        assertThatThrownBy(() -> builder.correlate("R2", "R1", 0.3))
                .isInstanceOf(ConstructionValidationException.class)
                .hasMessageContaining("supplied twice");
    }

    @Test
    void acceptsSameCoefficientTwice() {
        CorrelationMatrix matrix = CorrelationMatrix.builder(List.of("R1", "R2"))
                .correlate("R1", "R2", 0.5)
                .correlate("R2", "R1", 0.5)
                .build();

        assertThat(matrix.getCoefficients()).hasSize(1);
        assertThat(matrix.coefficient("R2", "R1")).isEqualTo(0.5);
    }

    @Test
    void rejectsSelfPairAndUnknownRisk() {
        assertThatThrownBy(() -> CorrelationMatrix.builder(List.of("R1", "R2")).correlate("R1", "R1", 0.5))
                .isInstanceOf(ConstructionValidationException.class);
        assertThatThrownBy(() -> CorrelationMatrix.builder(List.of("R1", "R2")).correlate("R1", "R3", 0.5))
                .isInstanceOf(ConstructionValidationException.class)
                .hasMessageContaining("R3");
    }

    @Test
    void denseMatrixIsSymmetricWithUnitDiagonal() {
        CorrelationMatrix matrix = CorrelationMatrix.builder(List.of("A", "B", "C"))
                .correlate("A", "B", 0.4)
                .correlate("C", "B", -0.2)
                .build();

        double[][] dense = matrix.toDense(List.of("A", "B", "C"));

        assertThat(dense[0]).containsExactly(1.0, 0.4, 0.0);
        assertThat(dense[1]).containsExactly(0.4, 1.0, -0.2);
        assertThat(dense[2]).containsExactly(0.0, -0.2, 1.0);
    }
}
