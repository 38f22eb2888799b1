package org.redfx.quantumlab.algorithm;

import org.redfx.quantumlab.Program;

/**
 * The oracles the Deutsch-Jozsa builder supports. Inputs live on qubits 0..n-1, the
 * ancilla on qubit n.
 */
public enum DeutschJozsaOracle {

    /** f(x) = 0 */
    CONSTANT_ZERO(true) {
        @Override
        void apply(Program.Builder b, int n) {
        }
    },
    /** f(x) = 1 */
    CONSTANT_ONE(true) {
        @Override
        void apply(Program.Builder b, int n) {
            b.x(n);
        }
    },
    /** f(x) = x<sub>0</sub> */
    BALANCED_FIRST(false) {
        @Override
        void apply(Program.Builder b, int n) {
            b.cx(0, n);
        }
    },
    /** f(x) = x<sub>0</sub> &oplus; &hellip; &oplus; x<sub>n-1</sub> */
    BALANCED_PARITY(false) {
        @Override
        void apply(Program.Builder b, int n) {
            for (int i = 0; i < n; i++) {
                b.cx(i, n);
            }
        }
    };

    private final boolean constant;

    DeutschJozsaOracle(boolean constant) {
        this.constant = constant;
    }

    public boolean isConstant() {
        return constant;
    }

    abstract void apply(Program.Builder b, int n);
}
