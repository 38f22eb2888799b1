package org.redfx.quantumlab.algorithm;

import org.redfx.quantumlab.Histogram;
import org.redfx.quantumlab.Program;

public final class DeutschJozsa {

    public enum Classification {
        CONSTANT, BALANCED
    }

    /** Share of all-zero outcomes above which an oracle is classified as constant. */
    public static final double CONSTANT_THRESHOLD = 0.8;

    private DeutschJozsa() {
    }

    /**
     * n input qubits and one ancilla prepared in |-&rang;; only the inputs are measured.
     */
    public static Program build(int n, DeutschJozsaOracle oracle) {
        if (n <= 0) {
            throw new IllegalArgumentException("n must be >= 1, got " + n);
        }
        if (oracle == null) {
            throw new IllegalArgumentException("oracle must not be null");
        }
        Program.Builder b = Program.builder(n + 1, n);
        b.x(n);
        b.h(QuantumFourierTransform.ascending(n + 1));
        oracle.apply(b, n);
        b.h(QuantumFourierTransform.ascending(n));
        for (int i = 0; i < n; i++) {
            b.measure(i, i);
        }
        return b.build();
    }

    public static Classification classify(Histogram histogram, int n) {
        String zeros = "0".repeat(n);
        if (histogram.getCount(zeros) > CONSTANT_THRESHOLD * histogram.getShots()) {
            return Classification.CONSTANT;
        }
        return Classification.BALANCED;
    }
}
