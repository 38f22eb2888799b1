package org.redfx.quantumlab.gate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.redfx.quantumlab.Complex;

public class GateMatrixTest {

    private static final double TOLERANCE = 1e-12;

    private static void assertUnitary(UnitaryGate gate) {
        Complex[][] m = gate.getMatrix();
        int dim = m.length;
        assertThat(dim).as(gate.toString()).isEqualTo(1 << gate.getAffectedQubitIndexes().length);
        for (int i = 0; i < dim; i++) {
            for (int j = 0; j < dim; j++) {
                Complex sum = Complex.ZERO;
                for (int k = 0; k < dim; k++) {
                    sum = sum.add(m[i][k].mul(m[j][k].conjugate()));
                }
                Complex expected = i == j ? Complex.ONE : Complex.ZERO;
                assertThat(sum.isCloseTo(expected, TOLERANCE)).as(gate + " row " + i + " col " + j).isTrue();
            }
        }
    }

    @Test
    void everyGateIsUnitary() {
        List<UnitaryGate> gates = List.of(
                new Hadamard(0), new X(0), new Y(0), new Z(0), new PhaseShift(0, 0.7),
                new Rotation(0, Rotation.Axis.X, 1.1), new Rotation(0, Rotation.Axis.Y, -0.4),
                new Rotation(0, Rotation.Axis.Z, 2.5), new Cnot(0, 1), new Cz(1, 0),
                new ControlledPhase(0, 1, Math.PI / 3), new Toffoli(0, 1, 2),
                MultiControlledGate.mcz(new int[]{1, 2, 3}, 0), new Swap(0, 2));
        gates.forEach(GateMatrixTest::assertUnitary);
    }

    @Test
    void controlledMatrixIsOrderedTargetThenControl() {
        Cnot cnot = new Cnot(1, 0);
        assertThat(cnot.getAffectedQubitIndexes()).containsExactly(0, 1);
        Complex[][] m = cnot.getMatrix();
        assertThat(m[0][0]).isEqualTo(Complex.ONE);
        assertThat(m[2][2]).isEqualTo(Complex.ONE);
        assertThat(m[1][3]).isEqualTo(Complex.ONE);
        assertThat(m[3][1]).isEqualTo(Complex.ONE);
        assertThat(m[1][1]).isEqualTo(Complex.ZERO);
    }

    @Test
    void toffoliOnlySwapsTheLastTwoLocalStates() {
        Complex[][] m = new Toffoli(1, 2, 0).getMatrix();
        for (int row = 0; row < 8; row++) {
            for (int col = 0; col < 8; col++) {
                boolean one = row < 6 ? row == col : (row ^ 1) == col;
                assertThat(m[row][col]).isEqualTo(one ? Complex.ONE : Complex.ZERO);
            }
        }
    }

    @Test
    void swapExchangesMixedStates() {
        Complex[][] m = new Swap(0, 1).getMatrix();
        assertThat(m[1][2]).isEqualTo(Complex.ONE);
        assertThat(m[2][1]).isEqualTo(Complex.ONE);
        assertThat(m[0][0]).isEqualTo(Complex.ONE);
        assertThat(m[3][3]).isEqualTo(Complex.ONE);
    }

    @Test
    void multiControlledGateNeedsAControl() {
        assertThatThrownBy(() -> MultiControlledGate.mcx(new int[0], 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void highestAffectedQubit() {
        assertThat(new Toffoli(4, 1, 2).getHighestAffectedQubitIndex()).isEqualTo(4);
        assertThat(new Measurement(3, 0).getHighestAffectedQubitIndex()).isEqualTo(3);
    }

    @Test
    void writingIntoAReturnedMatrixDoesNotLeakIntoOtherGates() {
        new Hadamard(0).getMatrix()[1][1] = Complex.HC;
        new X(0).getMatrix()[0][0] = Complex.ONE;
        new Y(0).getMatrix()[0][1] = Complex.ZERO;
        new Z(0).getMatrix()[1][1] = Complex.ONE;
        new Cnot(0, 1).getMatrix()[3][3] = Complex.ONE;

        assertThat(new Hadamard(5).getMatrix()[1][1]).isEqualTo(Complex.HCN);
        assertThat(new X(5).getMatrix()[0][0]).isEqualTo(Complex.ZERO);
        assertThat(new Y(5).getMatrix()[0][1]).isEqualTo(Complex.I.negate());
        assertThat(new Z(5).getMatrix()[1][1]).isEqualTo(Complex.ONE.negate());
        assertThat(new Cnot(0, 1).getMatrix()[3][3]).isEqualTo(Complex.ZERO);
        assertUnitary(new Hadamard(2));
    }
}
