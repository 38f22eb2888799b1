package org.redfx.quantumlab.algorithm;

import org.redfx.quantumlab.BitStrings;
import org.redfx.quantumlab.Histogram;
import org.redfx.quantumlab.Program;

/**
 * Phase estimation for the single-qubit phase unitary U = diag(1, e<sup>2&pi;i&phi;</sup>)
 * with eigenstate |1&rang;.
 * <p>
 * Qubits 0..nCounting-1 form the counting register, qubit nCounting holds the eigenstate.
 * Counting qubit k controls U<sup>2<sup>k</sup></sup>, so the register encodes &phi; with
 * qubit nCounting-1 as its most significant bit. The inverse QFT therefore runs over the
 * register from the highest qubit down, and the measured big-endian bitstring reads
 * directly as the binary fraction 0.b<sub>1</sub>b<sub>2</sub>&hellip;
 */
public final class PhaseEstimation {

    private PhaseEstimation() {
    }

    public static Program build(int nCounting, double phase) {
        if (nCounting <= 0) {
            throw new IllegalArgumentException("number of counting qubits must be >= 1, got " + nCounting);
        }
        if (!(phase >= 0 && phase <= 1)) {
            throw new IllegalArgumentException("phase must be between 0 and 1, got " + phase);
        }
        int eigen = nCounting;
        Program.Builder b = Program.builder(nCounting + 1, nCounting);
        b.x(eigen);
        b.h(QuantumFourierTransform.ascending(nCounting));
        for (int k = 0; k < nCounting; k++) {
            b.cp(2 * Math.PI * phase * Math.pow(2, k), k, eigen);
        }
        QuantumFourierTransform.inverseQft(b, QuantumFourierTransform.descending(nCounting));
        for (int k = 0; k < nCounting; k++) {
            b.measure(k, k);
        }
        return b.build();
    }

    /**
     * Reads a bitstring as a binary fraction: character i contributes 2<sup>-(i+1)</sup>.
     */
    public static double binaryToPhase(String bits) {
        BitStrings.requireBinary(bits, "bits");
        double phase = 0;
        for (int i = 0; i < bits.length(); i++) {
            if (bits.charAt(i) == '1') {
                phase += Math.pow(2, -(i + 1));
            }
        }
        return phase;
    }

    public static double estimatePhase(Histogram histogram) {
        return binaryToPhase(histogram.mostFrequent());
    }
}
