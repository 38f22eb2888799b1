package org.redfx.quantumlab.gate;

/**
 * Records the outcome of measuring a qubit into a classical bit. Measurements are
 * terminal: the engine samples them after all unitary gates have been applied.
 */
public class Measurement extends Gate {

    private final int qubit;
    private final int clbit;

    public Measurement(int qubit, int clbit) {
        super(qubit);
        this.qubit = qubit;
        this.clbit = clbit;
    }

    public int getQubitIndex() {
        return qubit;
    }

    public int getClbitIndex() {
        return clbit;
    }

    @Override
    public String getName() {
        return "M->c" + clbit;
    }
}
