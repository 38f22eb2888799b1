package org.redfx.quantumlab.vqe;

import org.redfx.quantumlab.Program;

/**
 * Alternating layers of RY rotations on every qubit and a linear CNOT chain
 * (0&rarr;1, 1&rarr;2, &hellip;), ending with a rotation layer. Amplitudes stay real.
 */
public class RealAmplitudesAnsatz implements Ansatz {

    private final int nQubits;
    private final int reps;

    public RealAmplitudesAnsatz(int nQubits, int reps) {
        if (nQubits <= 0) {
            throw new IllegalArgumentException("number of qubits must be >= 1, got " + nQubits);
        }
        if (reps < 0) {
            throw new IllegalArgumentException("reps must be >= 0, got " + reps);
        }
        this.nQubits = nQubits;
        this.reps = reps;
    }

    @Override
    public int getNumberQubits() {
        return nQubits;
    }

    @Override
    public int getNumberParameters() {
        return nQubits * (reps + 1);
    }

    @Override
    public Program bind(double[] parameters) {
        if (parameters.length != getNumberParameters()) {
            throw new IllegalArgumentException("expected " + getNumberParameters()
                    + " parameters, got " + parameters.length);
        }
        Program.Builder b = Program.builder(nQubits);
        for (int layer = 0; layer <= reps; layer++) {
            for (int q = 0; q < nQubits; q++) {
                b.ry(q, parameters[layer * nQubits + q]);
            }
            if (layer < reps) {
                for (int q = 0; q + 1 < nQubits; q++) {
                    b.cx(q, q + 1);
                }
            }
        }
        return b.build();
    }
}
