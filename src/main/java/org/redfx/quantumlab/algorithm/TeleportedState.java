package org.redfx.quantumlab.algorithm;

import org.redfx.quantumlab.Program;

public enum TeleportedState {

    /** |0&rang; */
    ZERO {
        @Override
        void prepare(Program.Builder b, int qubit) {
        }
    },
    /** |1&rang; */
    ONE {
        @Override
        void prepare(Program.Builder b, int qubit) {
            b.x(qubit);
        }
    },
    /** (|0&rang; + |1&rang;)/&radic;2 */
    PLUS {
        @Override
        void prepare(Program.Builder b, int qubit) {
            b.h(qubit);
        }
    },
    /** (|0&rang; - |1&rang;)/&radic;2 */
    MINUS {
        @Override
        void prepare(Program.Builder b, int qubit) {
            b.x(qubit);
            b.h(qubit);
        }
    };

    abstract void prepare(Program.Builder b, int qubit);
}
