package org.redfx.quantumlab.algorithm;

import org.redfx.quantumlab.BitStrings;
import org.redfx.quantumlab.Program;

/**
 * Quantum Fourier transform and its inverse over an ordered register.
 * <p>
 * Element {@code j} of the register array plays the role of qubit {@code j} of the
 * textbook construction: a Hadamard on it, followed by controlled-phase rotations from
 * every later element {@code k} with angle 2&pi;/2<sup>k-j+1</sup>, and a final swap
 * network reversing the register. The inverse is the exact mirror image.
 */
public final class QuantumFourierTransform {

    private QuantumFourierTransform() {
    }

    public static Program.Builder qft(Program.Builder b, int... register) {
        int n = register.length;
        for (int j = 0; j < n; j++) {
            b.h(register[j]);
            for (int k = j + 1; k < n; k++) {
                b.cp(angle(j, k), register[k], register[j]);
            }
        }
        for (int i = 0; i < n / 2; i++) {
            b.swap(register[i], register[n - i - 1]);
        }
        return b;
    }

    public static Program.Builder inverseQft(Program.Builder b, int... register) {
        int n = register.length;
        for (int i = 0; i < n / 2; i++) {
            b.swap(register[i], register[n - i - 1]);
        }
        for (int j = n - 1; j >= 0; j--) {
            for (int k = n - 1; k > j; k--) {
                b.cp(-angle(j, k), register[k], register[j]);
            }
            b.h(register[j]);
        }
        return b;
    }

    private static double angle(int j, int k) {
        return 2 * Math.PI / Math.pow(2, k - j + 1);
    }

    /**
     * Prepares the basis state {@code initialState}, applies the QFT and then its inverse, and
     * measures every qubit. The result should reproduce {@code initialState}.
     */
    public static Program roundTripProgram(String initialState) {
        BitStrings.requireBinary(initialState, "initial state");
        int n = initialState.length();
        Program.Builder b = Program.builder(n, n);
        for (int i = 0; i < n; i++) {
            if (BitStrings.isSet(initialState, i)) {
                b.x(i);
            }
        }
        int[] register = ascending(n);
        qft(b, register);
        inverseQft(b, register);
        return b.measureAll().build();
    }

    /**
     * QFT applied to the uniform superposition, measured on every qubit.
     */
    public static Program superpositionProgram(int n) {
        Program.Builder b = Program.builder(n, n);
        int[] register = ascending(n);
        b.h(register);
        qft(b, register);
        return b.measureAll().build();
    }

    static int[] ascending(int n) {
        int[] answer = new int[n];
        for (int i = 0; i < n; i++) {
            answer[i] = i;
        }
        return answer;
    }

    static int[] descending(int n) {
        int[] answer = new int[n];
        for (int i = 0; i < n; i++) {
            answer[i] = n - 1 - i;
        }
        return answer;
    }
}
