package org.redfx.quantumlab.gate;

public class Cz extends ControlledGate {

    public Cz(int control, int target) {
        super(control, new Z(target));
    }

    @Override
    public String getName() {
        return "CZ";
    }
}
