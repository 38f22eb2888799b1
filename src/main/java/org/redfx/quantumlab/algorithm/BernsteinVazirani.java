package org.redfx.quantumlab.algorithm;

import org.redfx.quantumlab.BitStrings;
import org.redfx.quantumlab.Histogram;
import org.redfx.quantumlab.Program;

/**
 * Recovers a hidden string a from the oracle f(x) = a&middot;x (mod 2) in a single query.
 */
public final class BernsteinVazirani {

    private BernsteinVazirani() {
    }

    public static Program build(String secret) {
        BitStrings.requireBinary(secret, "secret");
        int n = secret.length();
        Program.Builder b = Program.builder(n + 1, n);
        b.x(n);
        b.h(QuantumFourierTransform.ascending(n + 1));
        oracle(b, secret);
        b.h(QuantumFourierTransform.ascending(n));
        for (int i = 0; i < n; i++) {
            b.measure(i, i);
        }
        return b.build();
    }

    /**
     * One CNOT from input qubit i onto the ancilla (qubit n) for every set bit i of the
     * secret.
     */
    public static Program.Builder oracle(Program.Builder b, String secret) {
        int n = secret.length();
        for (int i = 0; i < n; i++) {
            if (BitStrings.isSet(secret, i)) {
                b.cx(i, n);
            }
        }
        return b;
    }

    public static String recoverSecret(Histogram histogram) {
        return histogram.mostFrequent();
    }
}
