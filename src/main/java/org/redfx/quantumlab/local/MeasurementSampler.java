package org.redfx.quantumlab.local;

import org.redfx.quantumlab.NormalizationException;

/**
 * Categorical sampler over basis-state probabilities, using inverse-CDF lookup.
 * <p>
 * Probabilities below {@code epsilon} are treated as exactly zero and the remaining mass
 * is renormalized so the cumulative distribution ends at exactly 1.
 */
public final class MeasurementSampler {

    private final double[] cdf;

    public MeasurementSampler(double[] probabilities, double epsilon) {
        double[] p = new double[probabilities.length];
        double total = 0;
        for (int i = 0; i < p.length; i++) {
            p[i] = probabilities[i] < epsilon ? 0 : probabilities[i];
            total += p[i];
        }
        if (!(total > 0)) {
            throw new NormalizationException(total, epsilon);
        }
        cdf = new double[p.length];
        double acc = 0;
        int last = 0;
        for (int i = 0; i < p.length; i++) {
            acc += p[i] / total;
            cdf[i] = acc;
            if (p[i] > 0) {
                last = i;
            }
        }
        for (int i = last; i < cdf.length; i++) {
            cdf[i] = 1.0;
        }
    }

    /**
     * Returns the basis index selected by a uniform variate {@code u} in [0, 1).
     */
    public int sample(double u) {
        int lo = 0;
        int hi = cdf.length - 1;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (cdf[mid] <= u) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }
}
