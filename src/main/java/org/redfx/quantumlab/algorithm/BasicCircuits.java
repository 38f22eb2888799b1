package org.redfx.quantumlab.algorithm;

import org.redfx.quantumlab.Program;

/**
 * Small superposition and entanglement circuits, all measured on every qubit.
 */
public final class BasicCircuits {

    private BasicCircuits() {
    }

    /** H on a single qubit: a fair quantum coin. */
    public static Program hello() {
        return coin(1);
    }

    public static Program coin(int nQubits) {
        Program.Builder b = Program.builder(nQubits, nQubits);
        b.h(QuantumFourierTransform.ascending(nQubits));
        return b.measureAll().build();
    }

    /** (|00&rang; + |11&rang;)/&radic;2 */
    public static Program bellPair() {
        return Program.builder(2, 2).h(0).cx(0, 1).measureAll().build();
    }

    /** H&otimes;H, four equally likely outcomes and no entanglement. */
    public static Program productSuperposition() {
        return Program.builder(2, 2).h(0, 1).measureAll().build();
    }
}
