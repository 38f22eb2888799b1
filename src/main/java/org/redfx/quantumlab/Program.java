package org.redfx.quantumlab;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.redfx.quantumlab.gate.Cnot;
import org.redfx.quantumlab.gate.ControlledPhase;
import org.redfx.quantumlab.gate.Cz;
import org.redfx.quantumlab.gate.Gate;
import org.redfx.quantumlab.gate.Hadamard;
import org.redfx.quantumlab.gate.Measurement;
import org.redfx.quantumlab.gate.MultiControlledGate;
import org.redfx.quantumlab.gate.PhaseShift;
import org.redfx.quantumlab.gate.Rotation;
import org.redfx.quantumlab.gate.Swap;
import org.redfx.quantumlab.gate.Toffoli;
import org.redfx.quantumlab.gate.X;
import org.redfx.quantumlab.gate.Y;
import org.redfx.quantumlab.gate.Z;

/**
 * An immutable, ordered list of gates over {@code nQubits} qubits and {@code nClbits}
 * classical bits. Programs are assembled with a {@link Builder}, which rejects every
 * operation that refers to a qubit or classical bit outside the declared sizes.
 */
public final class Program {

    private final int nQubits;
    private final int nClbits;
    private final List<Gate> gates;

    private Program(int nQubits, int nClbits, List<Gate> gates) {
        this.nQubits = nQubits;
        this.nClbits = nClbits;
        this.gates = Collections.unmodifiableList(new ArrayList<>(gates));
    }

    public static Builder builder(int nQubits) {
        return new Builder(nQubits, 0);
    }

    public static Builder builder(int nQubits, int nClbits) {
        return new Builder(nQubits, nClbits);
    }

    public int getNumberQubits() {
        return nQubits;
    }

    public int getNumberClbits() {
        return nClbits;
    }

    public List<Gate> getGates() {
        return gates;
    }

    public List<Measurement> getMeasurements() {
        return gates.stream()
                .filter(g -> g instanceof Measurement)
                .map(g -> (Measurement) g)
                .collect(Collectors.toList());
    }

    public boolean hasMeasurements() {
        return gates.stream().anyMatch(g -> g instanceof Measurement);
    }

    @Override
    public String toString() {
        return "Program{nQubits=" + nQubits + ", nClbits=" + nClbits + ", gates=" + gates + "}";
    }

    public static final class Builder {

        /** Largest register whose amplitudes fit an int-indexed array. */
        public static final int MAX_QUBITS = 30;

        private final int nQubits;
        private final int nClbits;
        private final List<Gate> gates = new ArrayList<>();
        private final BitSet usedClbits = new BitSet();
        private final BitSet measuredQubits = new BitSet();

        private Builder(int nQubits, int nClbits) {
            if (nQubits <= 0) {
                throw new IllegalArgumentException("number of qubits must be >= 1, got " + nQubits);
            }
            if (nQubits > MAX_QUBITS) {
                throw new IllegalArgumentException("number of qubits must be <= " + MAX_QUBITS + ", got " + nQubits);
            }
            if (nClbits < 0 || nClbits > nQubits) {
                throw new IllegalArgumentException("number of classical bits must be in [0, "
                        + nQubits + "], got " + nClbits);
            }
            this.nQubits = nQubits;
            this.nClbits = nClbits;
        }

        public int getNumberQubits() {
            return nQubits;
        }

        public int getNumberClbits() {
            return nClbits;
        }

        public Builder add(Gate gate) {
            Objects.requireNonNull(gate, "gate");
            for (int idx : gate.getAffectedQubitIndexes()) {
                Objects.checkIndex(idx, nQubits);
            }
            if (gate instanceof Measurement) {
                Measurement m = (Measurement) gate;
                Objects.checkIndex(m.getClbitIndex(), nClbits);
                if (usedClbits.get(m.getClbitIndex())) {
                    throw new IllegalStateException("classical bit " + m.getClbitIndex() + " is already assigned");
                }
                usedClbits.set(m.getClbitIndex());
                measuredQubits.set(m.getQubitIndex());
            } else {
                for (int idx : gate.getAffectedQubitIndexes()) {
                    if (measuredQubits.get(idx)) {
                        throw new IllegalStateException("gate " + gate + " acts on qubit " + idx
                                + " after it was measured");
                    }
                }
            }
            gates.add(gate);
            return this;
        }

        public Builder h(int... idx) {
            for (int i : idx) {
                add(new Hadamard(i));
            }
            return this;
        }

        public Builder x(int... idx) {
            for (int i : idx) {
                add(new X(i));
            }
            return this;
        }

        public Builder y(int... idx) {
            for (int i : idx) {
                add(new Y(i));
            }
            return this;
        }

        public Builder z(int... idx) {
            for (int i : idx) {
                add(new Z(i));
            }
            return this;
        }

        public Builder phase(int idx, double theta) {
            return add(new PhaseShift(idx, theta));
        }

        public Builder rx(int idx, double theta) {
            return add(new Rotation(idx, Rotation.Axis.X, theta));
        }

        public Builder ry(int idx, double theta) {
            return add(new Rotation(idx, Rotation.Axis.Y, theta));
        }

        public Builder rz(int idx, double theta) {
            return add(new Rotation(idx, Rotation.Axis.Z, theta));
        }

        public Builder cx(int control, int target) {
            return add(new Cnot(control, target));
        }

        public Builder cz(int control, int target) {
            return add(new Cz(control, target));
        }

        public Builder cp(double theta, int control, int target) {
            return add(new ControlledPhase(control, target, theta));
        }

        public Builder ccx(int control1, int control2, int target) {
            return add(new Toffoli(control1, control2, target));
        }

        public Builder mcx(int[] controls, int target) {
            return add(MultiControlledGate.mcx(controls, target));
        }

        public Builder mcz(int[] controls, int target) {
            return add(MultiControlledGate.mcz(controls, target));
        }

        public Builder swap(int index1, int index2) {
            return add(new Swap(index1, index2));
        }

        public Builder measure(int qubit, int clbit) {
            return add(new Measurement(qubit, clbit));
        }

        /**
         * Measures qubit i into classical bit i for every qubit; needs as many classical
         * bits as qubits.
         */
        public Builder measureAll() {
            if (nClbits != nQubits) {
                throw new IllegalStateException("measureAll needs " + nQubits + " classical bits, program has " + nClbits);
            }
            for (int i = 0; i < nQubits; i++) {
                measure(i, i);
            }
            return this;
        }

        public Program build() {
            return new Program(nQubits, nClbits, gates);
        }
    }
}
