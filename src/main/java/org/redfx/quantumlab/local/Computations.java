package org.redfx.quantumlab.local;

import org.redfx.quantumlab.Complex;

/**
 * In-place amplitude kernels. A {@code controlMask} restricts a kernel to the basis
 * states in which every masked qubit is 1; a mask of 0 means uncontrolled.
 */
public final class Computations {

    private Computations() {
    }

    public static void applyMatrix(Complex[] vector, int target, Complex[][] m, int controlMask) {
        int tmask = 1 << target;
        for (int i = 0; i < vector.length; i++) {
            if ((i & tmask) != 0 || (i & controlMask) != controlMask) {
                continue;
            }
            int j = i | tmask;
            Complex a0 = vector[i];
            Complex a1 = vector[j];
            vector[i] = m[0][0].mul(a0).add(m[0][1].mul(a1));
            vector[j] = m[1][0].mul(a0).add(m[1][1].mul(a1));
        }
    }

    public static void applyNot(Complex[] vector, int target, int controlMask) {
        int tmask = 1 << target;
        for (int i = 0; i < vector.length; i++) {
            if ((i & tmask) != 0 || (i & controlMask) != controlMask) {
                continue;
            }
            int j = i | tmask;
            Complex tmp = vector[i];
            vector[i] = vector[j];
            vector[j] = tmp;
        }
    }

    /**
     * Multiplies by {@code phase} every amplitude whose target and control bits are all 1.
     */
    public static void applyPhase(Complex[] vector, int target, Complex phase, int controlMask) {
        int mask = (1 << target) | controlMask;
        for (int i = 0; i < vector.length; i++) {
            if ((i & mask) == mask) {
                vector[i] = vector[i].mul(phase);
            }
        }
    }

    public static Complex[] permutateVector(Complex[] vector, int a, int b) {
        int amask = 1 << a;
        int bmask = 1 << b;
        int dim = vector.length;
        Complex[] answer = new Complex[dim];
        for (int i = 0; i < dim; i++) {
            int j = i;
            int x = (amask & i) / amask;
            int y = (bmask & i) / bmask;
            if (x != y) {
                j ^= amask;
                j ^= bmask;
            }
            answer[i] = vector[j];
        }
        return answer;
    }

    public static int mask(int... qubits) {
        int answer = 0;
        for (int q : qubits) {
            answer |= 1 << q;
        }
        return answer;
    }
}
