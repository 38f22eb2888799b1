package org.redfx.quantumlab.gate;

public abstract class SingleQubitGate extends UnitaryGate {

    private final int idx;

    protected SingleQubitGate(int idx) {
        super(idx);
        this.idx = idx;
    }

    public int getMainQubitIndex() {
        return idx;
    }
}
