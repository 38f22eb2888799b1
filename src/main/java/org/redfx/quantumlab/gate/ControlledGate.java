package org.redfx.quantumlab.gate;

import org.redfx.quantumlab.Complex;

/**
 * A single-qubit gate applied to its target only where the control qubit is 1.
 * Local matrix order is (target, control).
 */
public class ControlledGate extends UnitaryGate {

    private final int control;
    private final SingleQubitGate base;

    public ControlledGate(int control, SingleQubitGate base) {
        super(base.getMainQubitIndex(), control);
        this.control = control;
        this.base = base;
    }

    public int getControlIndex() {
        return control;
    }

    public int getTargetIndex() {
        return base.getMainQubitIndex();
    }

    public SingleQubitGate getBaseGate() {
        return base;
    }

    @Override
    public Complex[][] getMatrix() {
        return controlledMatrix(base.getMatrix(), 1);
    }

    @Override
    public String getName() {
        return "C" + base.getName();
    }
}
