package org.redfx.quantumlab.nd4j;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.Random;
import org.junit.jupiter.api.Test;
import org.redfx.quantumlab.Complex;
import org.redfx.quantumlab.Histogram;
import org.redfx.quantumlab.Program;
import org.redfx.quantumlab.StateVector;
import org.redfx.quantumlab.algorithm.QuantumFourierTransform;
import org.redfx.quantumlab.gate.Cnot;
import org.redfx.quantumlab.gate.X;
import org.redfx.quantumlab.local.SimpleQuantumExecutionEnvironment;

public class Nd4jQuantumExecutionEnvironmentTest {

    private final Nd4jQuantumExecutionEnvironment nd4j = new Nd4jQuantumExecutionEnvironment();
    private final SimpleQuantumExecutionEnvironment simple = new SimpleQuantumExecutionEnvironment();

    @Test
    void expandPlacesLocalMatrixOnTheRightQubit() {
        Complex[][] m = Nd4jQuantumExecutionEnvironment.expand(new X(1), 2);
        // X on qubit 1 maps |00> <-> |10> and |01> <-> |11>
        assertThat(m[2][0]).isEqualTo(Complex.ONE);
        assertThat(m[0][2]).isEqualTo(Complex.ONE);
        assertThat(m[3][1]).isEqualTo(Complex.ONE);
        assertThat(m[1][3]).isEqualTo(Complex.ONE);
        assertThat(m[0][0]).isEqualTo(Complex.ZERO);
        assertThat(m[1][0]).isEqualTo(Complex.ZERO);
    }

    @Test
    void expandedCnotFlipsTargetWhenControlIsSet() {
        Complex[][] m = Nd4jQuantumExecutionEnvironment.expand(new Cnot(0, 2), 3);
        assertThat(m[0b101][0b001]).isEqualTo(Complex.ONE);
        assertThat(m[0b111][0b011]).isEqualTo(Complex.ONE);
        assertThat(m[0b010][0b010]).isEqualTo(Complex.ONE);
        assertThat(m[0b110][0b010]).isEqualTo(Complex.ZERO);
    }

    @Test
    void mmulMultipliesComplexMatrices() {
        Complex[][] a = {{Complex.ONE, Complex.I}, {Complex.ZERO, Complex.ONE}};
        Complex[][] b = {{Complex.I}, {Complex.ONE}};
        Complex[][] c = Nd4jQuantumExecutionEnvironment.mmul(a, b);
        assertThat(c[0][0].isCloseTo(new Complex(0, 2), 1e-12)).isTrue();
        assertThat(c[1][0].isCloseTo(Complex.ONE, 1e-12)).isTrue();
    }

    @Test
    void mmulRejectsMismatchedShapes() {
        Complex[][] a = {{Complex.ONE, Complex.ONE}};
        Complex[][] b = {{Complex.ONE}};
        assertThatThrownBy(() -> Nd4jQuantumExecutionEnvironment.mmul(a, b))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void agreesWithClosedFormKernelsOnRandomCircuits() {
        Random random = new Random(5);
        for (int round = 0; round < 5; round++) {
            Program.Builder b = Program.builder(4);
            for (int g = 0; g < 25; g++) {
                int q = random.nextInt(4);
                int o = (q + 1 + random.nextInt(3)) % 4;
                double theta = random.nextDouble() * 2 * Math.PI;
                switch (random.nextInt(10)) {
                    case 0: b.h(q); break;
                    case 1: b.x(q); break;
                    case 2: b.y(q); break;
                    case 3: b.z(q); break;
                    case 4: b.rx(q, theta); break;
                    case 5: b.ry(q, theta); break;
                    case 6: b.phase(q, theta); break;
                    case 7: b.cx(q, o); break;
                    case 8: b.cp(theta, q, o); break;
                    default: b.swap(q, o); break;
                }
            }
            b.ccx(0, 1, 3).mcz(new int[]{0, 2, 3}, 1).rz(2, 0.4);
            Program p = b.build();
            StateVector expected = simple.evolve(p);
            StateVector actual = nd4j.evolve(p);
            assertThat(actual.isCloseTo(expected, 1e-9)).as("round %d", round).isTrue();
        }
    }

    @Test
    void agreesOnQuantumFourierTransform() {
        Program.Builder b = Program.builder(3).x(0).h(2);
        QuantumFourierTransform.qft(b, 0, 1, 2);
        Program p = b.build();
        assertThat(nd4j.evolve(p).isCloseTo(simple.evolve(p), 1e-9)).isTrue();
    }

    @Test
    void samplesBellPair() {
        Histogram h = nd4j.sample(Program.builder(2, 2).h(0).cx(0, 1).measureAll().build(), 400);
        assertThat(h.getCounts()).containsOnlyKeys("00", "11");
        assertThat(h.getProbability("00")).isCloseTo(0.5, within(0.1));
    }

    @Test
    void registersBeyondTheDenseLimitAreRejected() {
        Program big = Program.builder(Nd4jQuantumExecutionEnvironment.MAX_QUBITS + 6).h(0).build();
        assertThatThrownBy(() -> nd4j.evolve(big))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at most " + Nd4jQuantumExecutionEnvironment.MAX_QUBITS);
        Program measured = Program.builder(Nd4jQuantumExecutionEnvironment.MAX_QUBITS + 1, 1).h(0).measure(0, 0).build();
        assertThatThrownBy(() -> nd4j.sample(measured, 10)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Nd4jQuantumExecutionEnvironment.expand(new X(0), Nd4jQuantumExecutionEnvironment.MAX_QUBITS + 1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void largestSupportedRegisterStillEvolves() {
        Program p = Program.builder(Nd4jQuantumExecutionEnvironment.MAX_QUBITS).h(0).x(9).build();
        assertThat(nd4j.evolve(p).getProbability("1000000001")).isCloseTo(0.5, within(1e-9));
    }
}
