package org.redfx.quantumlab.pauli;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A weighted sum of Pauli strings of equal length.
 */
public final class PauliOperator {

    private final int nQubits;
    private final List<PauliTerm> terms;

    public PauliOperator(List<PauliTerm> terms) {
        if (terms.isEmpty()) {
            throw new IllegalArgumentException("a Pauli operator needs at least one term");
        }
        int n = terms.get(0).getNumberQubits();
        for (PauliTerm term : terms) {
            if (term.getNumberQubits() != n) {
                throw new IllegalArgumentException("all Pauli strings must have length " + n + ", got " + term);
            }
        }
        this.nQubits = n;
        this.terms = Collections.unmodifiableList(new ArrayList<>(terms));
    }

    public static Builder builder() {
        return new Builder();
    }

    public int getNumberQubits() {
        return nQubits;
    }

    public List<PauliTerm> getTerms() {
        return terms;
    }

    @Override
    public String toString() {
        return terms.toString();
    }

    public static final class Builder {

        private final List<PauliTerm> terms = new ArrayList<>();

        private Builder() {
        }

        public Builder add(String paulis, double coefficient) {
            terms.add(new PauliTerm(paulis, coefficient));
            return this;
        }

        public PauliOperator build() {
            return new PauliOperator(terms);
        }
    }
}
