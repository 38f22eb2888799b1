package org.redfx.quantumlab;

/**
 * Thrown when a state no longer has unit norm after gate application. This always
 * points at a defect in a gate kernel, never at user input.
 */
public class NormalizationException extends IllegalStateException {

    private final double norm;

    public NormalizationException(double norm, double tolerance) {
        super("state vector norm " + norm + " deviates from 1 by more than " + tolerance);
        this.norm = norm;
    }

    public double getNorm() {
        return norm;
    }
}
