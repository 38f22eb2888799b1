package org.redfx.quantumlab;

import org.redfx.quantumlab.pauli.PauliOperator;

/**
 * Runs {@link Program}s. Every call starts from a fresh |0&hellip;0&rang; state and owns it
 * until it returns, so independent calls never share amplitudes.
 */
public interface QuantumExecutionEnvironment {

    /**
     * Applies every unitary gate of the program, in order, and returns the final state.
     * Measurements are ignored. Deterministic.
     */
    StateVector evolve(Program p);

    /**
     * Samples the measured classical bits {@code shots} times. A program without
     * measurements is sampled as if every qubit i were measured into bit i.
     */
    Histogram sample(Program p, int shots);

    /**
     * Samples with the engine's configured default shot count.
     */
    Histogram sample(Program p);

    /**
     * Returns the real expectation value &lang;&psi;|H|&psi;&rang; of the operator against the
     * program's final state.
     */
    double expectation(Program p, PauliOperator operator);
}
