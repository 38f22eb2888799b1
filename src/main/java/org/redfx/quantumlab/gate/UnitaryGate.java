package org.redfx.quantumlab.gate;

import org.redfx.quantumlab.Complex;

public abstract class UnitaryGate extends Gate {

    protected UnitaryGate(int... affected) {
        super(affected);
    }

    /**
     * Returns the 2<sup>k</sup>&times;2<sup>k</sup> matrix of this gate over its k affected qubits.
     */
    public abstract Complex[][] getMatrix();

    /**
     * Builds the matrix of {@code base} (acting on local bit 0) controlled by local bits
     * 1..nControls: identity unless every control bit is set.
     */
    static Complex[][] controlledMatrix(Complex[][] base, int nControls) {
        int dim = 1 << (nControls + 1);
        int controlMask = (dim - 1) & ~1;
        Complex[][] answer = new Complex[dim][dim];
        for (int row = 0; row < dim; row++) {
            for (int col = 0; col < dim; col++) {
                Complex el = Complex.ZERO;
                if ((row & controlMask) == (col & controlMask)) {
                    if ((row & controlMask) == controlMask) {
                        el = base[row & 1][col & 1];
                    } else if (row == col) {
                        el = Complex.ONE;
                    }
                }
                answer[row][col] = el;
            }
        }
        return answer;
    }
}
