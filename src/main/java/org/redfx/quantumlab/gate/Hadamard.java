package org.redfx.quantumlab.gate;

import org.redfx.quantumlab.Complex;

public class Hadamard extends SingleQubitGate {

    public Hadamard(int idx) {
        super(idx);
    }

    @Override
    public Complex[][] getMatrix() {
        return new Complex[][]{{Complex.HC, Complex.HC}, {Complex.HC, Complex.HCN}};
    }

    @Override
    public String getName() {
        return "H";
    }
}
