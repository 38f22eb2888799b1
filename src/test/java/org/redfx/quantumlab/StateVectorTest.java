package org.redfx.quantumlab;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.Map;
import org.junit.jupiter.api.Test;

public class StateVectorTest {

    @Test
    void zeroStateHasAllWeightOnFirstIndex() {
        StateVector sv = StateVector.zero(3);
        assertThat(sv.getNumberQubits()).isEqualTo(3);
        assertThat(sv.getDimension()).isEqualTo(8);
        assertThat(sv.getAmplitude(0)).isEqualTo(Complex.ONE);
        assertThat(sv.norm()).isEqualTo(1.0);
        assertThat(sv.getProbability("000")).isEqualTo(1.0);
    }

    @Test
    void probabilitiesByBitStringSkipZeros() {
        double h = 1 / Math.sqrt(2);
        StateVector sv = new StateVector(new Complex[]{
            new Complex(h), Complex.ZERO, Complex.ZERO, new Complex(0, h)});
        Map<String, Double> probs = sv.getProbabilitiesByBitString(1e-10);
        assertThat(probs).containsOnlyKeys("00", "11");
        assertThat(probs.get("11")).isCloseTo(0.5, within(1e-12));
    }

    @Test
    void amplitudeArrayIsCopied() {
        Complex[] amps = {Complex.ONE, Complex.ZERO};
        StateVector sv = new StateVector(amps);
        amps[0] = Complex.ZERO;
        sv.getAmplitudes()[1] = Complex.ONE;
        assertThat(sv.getAmplitude(0)).isEqualTo(Complex.ONE);
        assertThat(sv.getAmplitude(1)).isEqualTo(Complex.ZERO);
    }

    @Test
    void requireNormalizedReportsTheNorm() {
        StateVector sv = new StateVector(new Complex[]{Complex.ONE, Complex.ONE});
        assertThatExceptionOfType(NormalizationException.class)
                .isThrownBy(() -> sv.requireNormalized(1e-9))
                .matches(e -> e.getNorm() == 2.0);
    }

    @Test
    void dimensionMustBeAPowerOfTwo() {
        assertThatThrownBy(() -> new StateVector(new Complex[3])).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> StateVector.basis(2, 4)).isInstanceOf(IndexOutOfBoundsException.class);
    }
}
