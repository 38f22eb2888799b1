package org.redfx.quantumlab.gate;

import java.util.Arrays;

/**
 * An operation in a {@link org.redfx.quantumlab.Program}. Instances are immutable.
 */
public abstract class Gate {

    private final int[] affected;

    protected Gate(int... affected) {
        for (int i = 0; i < affected.length; i++) {
            for (int j = i + 1; j < affected.length; j++) {
                if (affected[i] == affected[j]) {
                    throw new IllegalArgumentException(getClass().getSimpleName()
                            + " uses qubit " + affected[i] + " more than once");
                }
            }
        }
        this.affected = affected.clone();
    }

    /**
     * The qubits this gate acts on. For unitary gates, position {@code b} in this array is
     * bit {@code b} of the row and column index of {@link UnitaryGate#getMatrix()}.
     */
    public int[] getAffectedQubitIndexes() {
        return affected.clone();
    }

    public int getHighestAffectedQubitIndex() {
        return Arrays.stream(affected).max().getAsInt();
    }

    public abstract String getName();

    @Override
    public String toString() {
        return getName() + Arrays.toString(affected);
    }
}
