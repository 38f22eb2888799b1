package org.redfx.quantumlab.algorithm;

import org.redfx.quantumlab.BitStrings;
import org.redfx.quantumlab.Program;

/**
 * Grover search for a single marked bitstring.
 */
public final class Grover {

    private Grover() {
    }

    /**
     * floor(&pi;/4 &middot; &radic;2<sup>n</sup>), at least 1.
     */
    public static int optimalIterations(int n) {
        if (n <= 0) {
            throw new IllegalArgumentException("n must be >= 1, got " + n);
        }
        int iterations = (int) Math.floor(Math.PI / 4 * Math.sqrt(Math.pow(2, n)));
        return Math.max(1, iterations);
    }

    public static Program build(String target) {
        return build(target, null);
    }

    /**
     * Uniform superposition, {@code iterations} rounds of oracle plus diffuser, then a
     * measurement of every qubit. A {@code null} iteration count uses
     * {@link #optimalIterations(int)}.
     */
    public static Program build(String target, Integer iterations) {
        BitStrings.requireBinary(target, "target");
        int n = target.length();
        int rounds = iterations == null ? optimalIterations(n) : iterations;
        if (rounds < 0) {
            throw new IllegalArgumentException("iterations must be >= 0, got " + rounds);
        }
        Program.Builder b = Program.builder(n, n);
        b.h(QuantumFourierTransform.ascending(n));
        for (int r = 0; r < rounds; r++) {
            oracle(b, target);
            diffuser(b, n);
        }
        return b.measureAll().build();
    }

    /**
     * Flips the sign of the amplitude of {@code target} and nothing else.
     */
    public static Program.Builder oracle(Program.Builder b, String target) {
        int n = target.length();
        flipZeros(b, target);
        fullyControlledZ(b, n);
        flipZeros(b, target);
        return b;
    }

    /**
     * Reflection about the uniform superposition, 2|s&rang;&lang;s| - I (up to global phase).
     */
    public static Program.Builder diffuser(Program.Builder b, int n) {
        int[] all = QuantumFourierTransform.ascending(n);
        b.h(all);
        b.x(all);
        fullyControlledZ(b, n);
        b.x(all);
        b.h(all);
        return b;
    }

    private static void flipZeros(Program.Builder b, String target) {
        for (int i = 0; i < target.length(); i++) {
            if (!BitStrings.isSet(target, i)) {
                b.x(i);
            }
        }
    }

    static void fullyControlledZ(Program.Builder b, int n) {
        if (n == 1) {
            b.z(0);
        } else if (n == 2) {
            b.cz(0, 1);
        } else {
            int[] controls = QuantumFourierTransform.ascending(n - 1);
            b.mcz(controls, n - 1);
        }
    }
}
