package org.redfx.quantumlab.gate;

import org.redfx.quantumlab.Complex;

/**
 * diag(1, e<sup>i&theta;</sup>).
 */
public class PhaseShift extends SingleQubitGate {

    private final double theta;

    public PhaseShift(int idx, double theta) {
        super(idx);
        this.theta = theta;
    }

    public double getTheta() {
        return theta;
    }

    @Override
    public Complex[][] getMatrix() {
        return new Complex[][]{{Complex.ONE, Complex.ZERO}, {Complex.ZERO, Complex.exp(theta)}};
    }

    @Override
    public String getName() {
        return "P(" + theta + ")";
    }
}
