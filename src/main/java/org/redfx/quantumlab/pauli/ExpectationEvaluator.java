package org.redfx.quantumlab.pauli;

import org.redfx.quantumlab.Complex;
import org.redfx.quantumlab.StateVector;

/**
 * Computes &lang;&psi;|H|&psi;&rang; for a weighted Pauli sum H.
 */
public final class ExpectationEvaluator {

    private ExpectationEvaluator() {
    }

    public static double expectation(StateVector state, PauliOperator operator) {
        if (operator.getNumberQubits() != state.getNumberQubits()) {
            throw new IllegalArgumentException("operator acts on " + operator.getNumberQubits()
                    + " qubits but the state has " + state.getNumberQubits());
        }
        Complex[] psi = state.getAmplitudes();
        double answer = 0;
        for (PauliTerm term : operator.getTerms()) {
            answer += term.getCoefficient() * expectation(psi, term).r;
        }
        return answer;
    }

    /**
     * &lang;&psi;|P|&psi;&rang; for a single Pauli string. The string maps basis state i to
     * phase(i) &middot; |i XOR flipMask&rang;, so no intermediate vector is needed.
     */
    static Complex expectation(Complex[] psi, PauliTerm term) {
        int n = term.getNumberQubits();
        int flipMask = 0;
        for (int q = 0; q < n; q++) {
            char p = term.getPauli(q);
            if (p == 'X' || p == 'Y') {
                flipMask |= 1 << q;
            }
        }
        Complex sum = Complex.ZERO;
        for (int i = 0; i < psi.length; i++) {
            if (psi[i].abssqr() == 0) {
                continue;
            }
            Complex phase = Complex.ONE;
            for (int q = 0; q < n; q++) {
                boolean one = ((i >> q) & 1) == 1;
                switch (term.getPauli(q)) {
                    case 'Z':
                        if (one) {
                            phase = phase.negate();
                        }
                        break;
                    case 'Y':
                        // Y|0> = i|1>, Y|1> = -i|0>
                        phase = phase.mul(one ? Complex.I.negate() : Complex.I);
                        break;
                    default:
                        break;
                }
            }
            int j = i ^ flipMask;
            sum = sum.add(psi[j].conjugate().mul(phase).mul(psi[i]));
        }
        return sum;
    }
}
