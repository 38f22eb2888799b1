package org.redfx.quantumlab;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The 2<sup>n</sup> complex amplitudes of an n-qubit register, indexed by the
 * integer encoding of the basis state (qubit 0 is the least significant bit).
 */
public final class StateVector {

    private final int nQubits;
    private final Complex[] amplitudes;

    public StateVector(Complex[] amplitudes) {
        int dim = amplitudes.length;
        if (dim == 0 || Integer.bitCount(dim) != 1) {
            throw new IllegalArgumentException("amplitude count must be a power of two, got " + dim);
        }
        this.nQubits = Integer.numberOfTrailingZeros(dim);
        this.amplitudes = amplitudes.clone();
    }

    /**
     * Creates |0&hellip;0&rang; on {@code nQubits} qubits.
     */
    public static StateVector zero(int nQubits) {
        return basis(nQubits, 0);
    }

    public static StateVector basis(int nQubits, int index) {
        if (nQubits <= 0) {
            throw new IllegalArgumentException("number of qubits must be >= 1, got " + nQubits);
        }
        int dim = 1 << nQubits;
        if (index < 0 || index >= dim) {
            throw new IndexOutOfBoundsException("basis index " + index + " outside [0, " + dim + ")");
        }
        Complex[] amps = new Complex[dim];
        Arrays.fill(amps, Complex.ZERO);
        amps[index] = Complex.ONE;
        return new StateVector(amps);
    }

    public int getNumberQubits() {
        return nQubits;
    }

    public int getDimension() {
        return amplitudes.length;
    }

    public Complex getAmplitude(int index) {
        return amplitudes[index];
    }

    public Complex[] getAmplitudes() {
        return amplitudes.clone();
    }

    public double[] getProbabilities() {
        double[] answer = new double[amplitudes.length];
        for (int i = 0; i < amplitudes.length; i++) {
            answer[i] = amplitudes[i].abssqr();
        }
        return answer;
    }

    public double getProbability(String bits) {
        BitStrings.requireBinary(bits, nQubits, "bits");
        return amplitudes[BitStrings.toIndex(bits)].abssqr();
    }

    /**
     * Probabilities of all basis states above {@code epsilon}, keyed by big-endian bitstring,
     * in increasing index order.
     */
    public Map<String, Double> getProbabilitiesByBitString(double epsilon) {
        Map<String, Double> answer = new LinkedHashMap<>();
        for (int i = 0; i < amplitudes.length; i++) {
            double p = amplitudes[i].abssqr();
            if (p > epsilon) {
                answer.put(BitStrings.toBitString(i, nQubits), p);
            }
        }
        return answer;
    }

    /**
     * Sum of squared amplitude magnitudes.
     */
    public double norm() {
        double sum = 0;
        for (Complex amplitude : amplitudes) {
            sum += amplitude.abssqr();
        }
        return sum;
    }

    public StateVector requireNormalized(double tolerance) {
        double norm = norm();
        if (Double.isNaN(norm) || Math.abs(norm - 1) > tolerance) {
            throw new NormalizationException(norm, tolerance);
        }
        return this;
    }

    public boolean isCloseTo(StateVector other, double tolerance) {
        if (other.amplitudes.length != amplitudes.length) {
            return false;
        }
        for (int i = 0; i < amplitudes.length; i++) {
            if (!amplitudes[i].isCloseTo(other.amplitudes[i], tolerance)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "StateVector{nQubits=" + nQubits + ", amplitudes=" + Arrays.toString(amplitudes) + "}";
    }
}
