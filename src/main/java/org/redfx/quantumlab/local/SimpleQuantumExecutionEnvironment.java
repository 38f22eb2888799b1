package org.redfx.quantumlab.local;

import org.redfx.quantumlab.Complex;
import org.redfx.quantumlab.config.SimulatorConfig;
import org.redfx.quantumlab.gate.ControlledGate;
import org.redfx.quantumlab.gate.MultiControlledGate;
import org.redfx.quantumlab.gate.PhaseShift;
import org.redfx.quantumlab.gate.SingleQubitGate;
import org.redfx.quantumlab.gate.Swap;
import org.redfx.quantumlab.gate.UnitaryGate;
import org.redfx.quantumlab.gate.X;
import org.redfx.quantumlab.gate.Z;

/**
 * Statevector engine that applies each gate as a closed-form update of the amplitude
 * pairs it touches: X swaps amplitudes, Z and phase gates multiply, other single-qubit
 * gates contract their 2&times;2 matrix. Controlled variants restrict the same kernels to
 * the amplitudes where every control bit is 1.
 */
public class SimpleQuantumExecutionEnvironment extends AbstractExecutionEnvironment {

    public SimpleQuantumExecutionEnvironment() {
        this(SimulatorConfig.defaults());
    }

    public SimpleQuantumExecutionEnvironment(long seed) {
        this(seeded(seed));
    }

    public SimpleQuantumExecutionEnvironment(SimulatorConfig config) {
        super(config);
    }

    private static SimulatorConfig seeded(long seed) {
        SimulatorConfig cfg = SimulatorConfig.defaults();
        cfg.seed = seed;
        return cfg;
    }

    @Override
    protected Complex[] applyGate(UnitaryGate gate, Complex[] vector, int nQubits) {
        if (gate instanceof Swap) {
            Swap swap = (Swap) gate;
            return Computations.permutateVector(vector, swap.getIndex1(), swap.getIndex2());
        }
        SingleQubitGate base;
        int controlMask;
        if (gate instanceof SingleQubitGate) {
            base = (SingleQubitGate) gate;
            controlMask = 0;
        } else if (gate instanceof ControlledGate) {
            ControlledGate cg = (ControlledGate) gate;
            base = cg.getBaseGate();
            controlMask = Computations.mask(cg.getControlIndex());
        } else if (gate instanceof MultiControlledGate) {
            MultiControlledGate mcg = (MultiControlledGate) gate;
            base = mcg.getBaseGate();
            controlMask = Computations.mask(mcg.getControlIndexes());
        } else {
            throw new IllegalArgumentException("unsupported gate " + gate);
        }
        int target = base.getMainQubitIndex();
        if (base instanceof X) {
            Computations.applyNot(vector, target, controlMask);
        } else if (base instanceof Z) {
            Computations.applyPhase(vector, target, Complex.ONE.negate(), controlMask);
        } else if (base instanceof PhaseShift) {
            Computations.applyPhase(vector, target, Complex.exp(((PhaseShift) base).getTheta()), controlMask);
        } else {
            Computations.applyMatrix(vector, target, base.getMatrix(), controlMask);
        }
        return vector;
    }
}
