package org.redfx.quantumlab.gate;

import org.redfx.quantumlab.Complex;

public class Y extends SingleQubitGate {

    public Y(int idx) {
        super(idx);
    }

    @Override
    public Complex[][] getMatrix() {
        return new Complex[][]{{Complex.ZERO, Complex.I.negate()}, {Complex.I, Complex.ZERO}};
    }

    @Override
    public String getName() {
        return "Y";
    }
}
