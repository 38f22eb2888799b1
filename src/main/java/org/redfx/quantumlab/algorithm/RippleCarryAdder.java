package org.redfx.quantumlab.algorithm;

import org.redfx.quantumlab.BitStrings;
import org.redfx.quantumlab.Program;

/**
 * Cuccaro ripple-carry adder built from MAJ (majority) and UMA (unmajority-add) blocks.
 * <p>
 * Layout for {@code bits}-bit operands: register a on qubits 0..bits-1, register b on
 * bits..2&middot;bits-1 (both least significant bit first), carry-in on 2&middot;bits and
 * carry-out on 2&middot;bits+1. The sum replaces b; b<sub>i</sub> is measured into classical
 * bit i and the carry-out into classical bit {@code bits}, so the result bitstring reads as
 * the binary sum.
 */
public final class RippleCarryAdder {

    private RippleCarryAdder() {
    }

    public static Program build(int a, int b, int bits) {
        if (bits <= 0) {
            throw new IllegalArgumentException("bits must be >= 1, got " + bits);
        }
        if (2 * bits + 2 > Program.Builder.MAX_QUBITS) {
            throw new IllegalArgumentException("bits must be <= " + (Program.Builder.MAX_QUBITS - 2) / 2 + ", got " + bits);
        }
        int limit = 1 << bits;
        if (a < 0 || a >= limit) {
            throw new IllegalArgumentException("a must be between 0 and " + (limit - 1) + ", got " + a);
        }
        if (b < 0 || b >= limit) {
            throw new IllegalArgumentException("b must be between 0 and " + (limit - 1) + ", got " + b);
        }
        int[] aQubits = new int[bits];
        int[] bQubits = new int[bits];
        for (int i = 0; i < bits; i++) {
            aQubits[i] = i;
            bQubits[i] = bits + i;
        }
        int carryIn = 2 * bits;
        int carryOut = 2 * bits + 1;

        Program.Builder pb = Program.builder(2 * bits + 2, bits + 1);
        for (int i = 0; i < bits; i++) {
            if (((a >> i) & 1) == 1) {
                pb.x(aQubits[i]);
            }
            if (((b >> i) & 1) == 1) {
                pb.x(bQubits[i]);
            }
        }
        add(pb, aQubits, bQubits, carryIn, carryOut);
        for (int i = 0; i < bits; i++) {
            pb.measure(bQubits[i], i);
        }
        pb.measure(carryOut, bits);
        return pb.build();
    }

    /**
     * Adds register a into register b. {@code carryIn} must hold |0&rang; and is restored to it.
     */
    public static Program.Builder add(Program.Builder pb, int[] aQubits, int[] bQubits, int carryIn, int carryOut) {
        int n = aQubits.length;
        if (n == 0 || bQubits.length != n) {
            throw new IllegalArgumentException("registers must be non-empty and of equal size");
        }
        for (int i = 0; i < n; i++) {
            majority(pb, i == 0 ? carryIn : aQubits[i - 1], bQubits[i], aQubits[i]);
        }
        pb.cx(aQubits[n - 1], carryOut);
        for (int i = n - 1; i >= 0; i--) {
            unmajority(pb, i == 0 ? carryIn : aQubits[i - 1], bQubits[i], aQubits[i]);
        }
        return pb;
    }

    static void majority(Program.Builder pb, int c, int b, int a) {
        pb.cx(a, b);
        pb.cx(a, c);
        pb.ccx(c, b, a);
    }

    static void unmajority(Program.Builder pb, int c, int b, int a) {
        pb.ccx(c, b, a);
        pb.cx(a, c);
        pb.cx(c, b);
    }

    public static int decode(String bits) {
        return BitStrings.toIndex(bits);
    }
}
