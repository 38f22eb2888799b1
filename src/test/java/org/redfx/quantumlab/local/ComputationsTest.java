package org.redfx.quantumlab.local;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.redfx.quantumlab.Complex;

public class ComputationsTest {

    private static Complex[] basis(int dim) {
        Complex[] v = new Complex[dim];
        for (int i = 0; i < dim; i++) {
            v[i] = new Complex(i);
        }
        return v;
    }

    @Test
    void notSwapsPairsOnlyWhereControlsAreSet() {
        Complex[] v = basis(8);
        Computations.applyNot(v, 0, Computations.mask(2));
        assertThat(v).extracting(c -> (int) c.r).containsExactly(0, 1, 2, 3, 5, 4, 7, 6);
    }

    @Test
    void phaseNeedsTargetAndControls() {
        Complex[] v = basis(4);
        Computations.applyPhase(v, 1, Complex.ONE.negate(), Computations.mask(0));
        assertThat(v).extracting(c -> (int) c.r).containsExactly(0, 1, 2, -3);
    }

    @Test
    void permutateVectorSwapsQubits() {
        Complex[] v = basis(4);
        Complex[] p = Computations.permutateVector(v, 0, 1);
        assertThat(p).extracting(c -> (int) c.r).containsExactly(0, 2, 1, 3);
    }
}
