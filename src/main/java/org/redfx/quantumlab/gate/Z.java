package org.redfx.quantumlab.gate;

import org.redfx.quantumlab.Complex;

public class Z extends SingleQubitGate {

    public Z(int idx) {
        super(idx);
    }

    @Override
    public Complex[][] getMatrix() {
        return new Complex[][]{{Complex.ONE, Complex.ZERO}, {Complex.ZERO, Complex.ONE.negate()}};
    }

    @Override
    public String getName() {
        return "Z";
    }
}
