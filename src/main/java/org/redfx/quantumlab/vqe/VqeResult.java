package org.redfx.quantumlab.vqe;

import java.util.Arrays;

public final class VqeResult {

    private final double energy;
    private final double[] parameters;
    private final int evaluations;

    public VqeResult(double energy, double[] parameters, int evaluations) {
        this.energy = energy;
        this.parameters = parameters.clone();
        this.evaluations = evaluations;
    }

    public double getEnergy() {
        return energy;
    }

    public double[] getParameters() {
        return parameters.clone();
    }

    public int getEvaluations() {
        return evaluations;
    }

    @Override
    public String toString() {
        return "VqeResult{energy=" + energy + ", parameters=" + Arrays.toString(parameters)
                + ", evaluations=" + evaluations + "}";
    }
}
