package org.redfx.quantumlab.vqe;

import org.redfx.quantumlab.Program;

/**
 * A parameterized circuit template. Binding a parameter vector yields a concrete program.
 */
public interface Ansatz {

    int getNumberQubits();

    int getNumberParameters();

    Program bind(double[] parameters);
}
