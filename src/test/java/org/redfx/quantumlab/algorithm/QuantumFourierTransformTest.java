package org.redfx.quantumlab.algorithm;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;
import org.redfx.quantumlab.BitStrings;
import org.redfx.quantumlab.Complex;
import org.redfx.quantumlab.Program;
import org.redfx.quantumlab.StateVector;
import org.redfx.quantumlab.local.SimpleQuantumExecutionEnvironment;

public class QuantumFourierTransformTest {

    private final SimpleQuantumExecutionEnvironment env = new SimpleQuantumExecutionEnvironment(51L);

    @Test
    void roundTripRestoresEveryBasisState() {
        for (int i = 0; i < 8; i++) {
            String state = BitStrings.toBitString(i, 3);
            assertThat(env.sample(QuantumFourierTransform.roundTripProgram(state), 1000).getCounts())
                    .as(state).containsOnlyKeys(state);
        }
    }

    @Test
    void uniformSuperpositionTransformsToZero() {
        assertThat(env.sample(QuantumFourierTransform.superpositionProgram(3), 100).getCounts())
                .containsOnlyKeys("000");
    }

    @Test
    void descendingRegisterGivesDiscreteFourierTransform() {
        // QFT|x> = sum_k e^{2 pi i x k / N} |k> / sqrt N when qubit n-1 is the most significant
        int n = 3;
        int dim = 1 << n;
        for (int x = 0; x < dim; x++) {
            Program.Builder b = Program.builder(n);
            for (int q = 0; q < n; q++) {
                if (((x >> q) & 1) == 1) {
                    b.x(q);
                }
            }
            QuantumFourierTransform.qft(b, QuantumFourierTransform.descending(n));
            StateVector sv = env.evolve(b.build());
            for (int k = 0; k < dim; k++) {
                Complex expected = Complex.exp(2 * Math.PI * x * k / dim).mul(1 / Math.sqrt(dim));
                assertThat(sv.getAmplitude(k).isCloseTo(expected, 1e-9)).as("x=%d k=%d", x, k).isTrue();
            }
        }
    }

    @Test
    void inverseUndoesForwardOnArbitraryState() {
        Program.Builder b = Program.builder(3).ry(0, 0.3).rx(1, 1.1).h(2).cp(0.7, 2, 0);
        StateVector before = env.evolve(b.build());
        QuantumFourierTransform.qft(b, 0, 1, 2);
        QuantumFourierTransform.inverseQft(b, 0, 1, 2);
        assertThat(env.evolve(b.build()).isCloseTo(before, 1e-9)).isTrue();
    }

    @Test
    void registers() {
        assertThat(QuantumFourierTransform.ascending(3)).containsExactly(0, 1, 2);
        assertThat(QuantumFourierTransform.descending(3)).containsExactly(2, 1, 0);
        assertThat(env.evolve(QuantumFourierTransform.qft(Program.builder(1), 0).build()).getProbability("1"))
                .isCloseTo(0.5, within(1e-12));
    }
}
