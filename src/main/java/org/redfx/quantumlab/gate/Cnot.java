package org.redfx.quantumlab.gate;

public class Cnot extends ControlledGate {

    public Cnot(int control, int target) {
        super(control, new X(target));
    }

    @Override
    public String getName() {
        return "CNOT";
    }
}
