package org.redfx.quantumlab.gate;

import org.redfx.quantumlab.Complex;

/**
 * Pauli-X (NOT).
 */
public class X extends SingleQubitGate {

    public X(int idx) {
        super(idx);
    }

    @Override
    public Complex[][] getMatrix() {
        return new Complex[][]{{Complex.ZERO, Complex.ONE}, {Complex.ONE, Complex.ZERO}};
    }

    @Override
    public String getName() {
        return "X";
    }
}
