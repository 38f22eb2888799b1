package org.redfx.quantumlab.gate;

public class Toffoli extends MultiControlledGate {

    public Toffoli(int control1, int control2, int target) {
        super(new int[]{control1, control2}, new X(target));
    }

    @Override
    public String getName() {
        return "CCX";
    }
}
