package org.redfx.quantumlab.pauli;

import java.util.Objects;

/**
 * A real coefficient times a tensor product of single-qubit Paulis. The string is
 * big-endian: character {@code p} acts on qubit {@code length - 1 - p}.
 */
public final class PauliTerm {

    private final double coefficient;
    private final String paulis;

    public PauliTerm(String paulis, double coefficient) {
        Objects.requireNonNull(paulis, "paulis");
        if (paulis.isEmpty()) {
            throw new IllegalArgumentException("a Pauli string needs at least one letter");
        }
        for (int p = 0; p < paulis.length(); p++) {
            char c = paulis.charAt(p);
            if (c != 'I' && c != 'X' && c != 'Y' && c != 'Z') {
                throw new IllegalArgumentException("Pauli string may only contain I, X, Y, Z, got '" + paulis + "'");
            }
        }
        if (!Double.isFinite(coefficient)) {
            throw new IllegalArgumentException("coefficient must be finite, got " + coefficient);
        }
        this.paulis = paulis;
        this.coefficient = coefficient;
    }

    public double getCoefficient() {
        return coefficient;
    }

    public String getPaulis() {
        return paulis;
    }

    public int getNumberQubits() {
        return paulis.length();
    }

    public char getPauli(int qubit) {
        return paulis.charAt(paulis.length() - 1 - qubit);
    }

    @Override
    public String toString() {
        return coefficient + "*" + paulis;
    }
}
