package org.redfx.quantumlab.vqe;

import org.redfx.quantumlab.pauli.PauliOperator;

public final class Hamiltonians {

    private Hamiltonians() {
    }

    /**
     * Simplified two-qubit H2 Hamiltonian in Hartree. Its lowest eigenvalue is about
     * -1.857275.
     */
    public static PauliOperator h2() {
        return PauliOperator.builder()
                .add("II", -1.052373245772859)
                .add("IZ", 0.39793742484318045)
                .add("ZI", -0.39793742484318045)
                .add("ZZ", -0.01128010425624393)
                .add("XX", 0.18093119978423156)
                .build();
    }
}
