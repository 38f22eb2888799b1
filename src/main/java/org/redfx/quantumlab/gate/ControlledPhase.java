package org.redfx.quantumlab.gate;

/**
 * Multiplies the amplitude by e<sup>i&theta;</sup> where both qubits are 1. The gate is
 * symmetric in control and target.
 */
public class ControlledPhase extends ControlledGate {

    public ControlledPhase(int control, int target, double theta) {
        super(control, new PhaseShift(target, theta));
    }

    public double getTheta() {
        return ((PhaseShift) getBaseGate()).getTheta();
    }

    @Override
    public String getName() {
        return "CP(" + getTheta() + ")";
    }
}
