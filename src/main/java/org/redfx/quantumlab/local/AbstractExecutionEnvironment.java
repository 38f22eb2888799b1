package org.redfx.quantumlab.local;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.redfx.quantumlab.BitStrings;
import org.redfx.quantumlab.Complex;
import org.redfx.quantumlab.Histogram;
import org.redfx.quantumlab.Program;
import org.redfx.quantumlab.QuantumExecutionEnvironment;
import org.redfx.quantumlab.StateVector;
import org.redfx.quantumlab.config.SimulatorConfig;
import org.redfx.quantumlab.gate.Gate;
import org.redfx.quantumlab.gate.Measurement;
import org.redfx.quantumlab.gate.UnitaryGate;
import org.redfx.quantumlab.pauli.ExpectationEvaluator;
import org.redfx.quantumlab.pauli.PauliOperator;

/**
 * Shared evolve/sample/expectation pipeline. Subclasses only decide how a single unitary
 * gate transforms the amplitude array.
 */
public abstract class AbstractExecutionEnvironment implements QuantumExecutionEnvironment {

    private static final Logger LOG = LogManager.getLogger(AbstractExecutionEnvironment.class);

    private final double probabilityEpsilon;
    private final double normalizationTolerance;
    private final int defaultShots;
    private final UniformRandomProvider rng;

    protected AbstractExecutionEnvironment(SimulatorConfig config) {
        config.validate();
        this.probabilityEpsilon = config.probabilityEpsilon;
        this.normalizationTolerance = config.normalizationTolerance;
        this.defaultShots = config.defaultShots;
        this.rng = config.seed == null
                ? RandomSource.XO_RO_SHI_RO_128_PP.create()
                : RandomSource.XO_RO_SHI_RO_128_PP.create(config.seed);
    }

    /**
     * Applies one unitary gate. Implementations may update {@code vector} in place and return
     * it, or return a new array.
     */
    protected abstract Complex[] applyGate(UnitaryGate gate, Complex[] vector, int nQubits);

    @Override
    public StateVector evolve(Program p) {
        int nQubits = p.getNumberQubits();
        Complex[] probs = new Complex[1 << nQubits];
        Arrays.fill(probs, Complex.ZERO);
        probs[0] = Complex.ONE;
        int cnt = 0;
        for (Gate gate : p.getGates()) {
            if (gate instanceof Measurement) {
                continue;
            }
            if (!(gate instanceof UnitaryGate)) {
                throw new IllegalArgumentException("unsupported gate " + gate);
            }
            probs = applyGate((UnitaryGate) gate, probs, nQubits);
            cnt++;
        }
        LOG.debug("Evolved {} qubits through {} gates", nQubits, cnt);
        return new StateVector(probs).requireNormalized(normalizationTolerance);
    }

    @Override
    public Histogram sample(Program p) {
        return sample(p, defaultShots);
    }

    @Override
    public Histogram sample(Program p, int shots) {
        if (shots <= 0) {
            throw new IllegalArgumentException("shots must be >= 1, got " + shots);
        }
        int nQubits = p.getNumberQubits();
        List<Measurement> measurements = p.getMeasurements();
        int width;
        int[] qubitForClbit;
        if (measurements.isEmpty()) {
            width = nQubits;
            qubitForClbit = new int[width];
            for (int i = 0; i < width; i++) {
                qubitForClbit[i] = i;
            }
        } else {
            width = p.getNumberClbits();
            qubitForClbit = new int[width];
            Arrays.fill(qubitForClbit, -1);
            for (Measurement m : measurements) {
                qubitForClbit[m.getClbitIndex()] = m.getQubitIndex();
            }
        }

        StateVector state = evolve(p);
        MeasurementSampler sampler = new MeasurementSampler(state.getProbabilities(), probabilityEpsilon);
        int[] hits = new int[state.getDimension()];
        synchronized (rng) {
            for (int s = 0; s < shots; s++) {
                hits[sampler.sample(rng.nextDouble())]++;
            }
        }

        Map<String, Integer> counts = new HashMap<>();
        for (int i = 0; i < hits.length; i++) {
            if (hits[i] > 0) {
                counts.merge(toClassicalBits(i, qubitForClbit), hits[i], Integer::sum);
            }
        }
        LOG.debug("Sampled {} shots over {} classical bits: {} distinct outcomes", shots, width, counts.size());
        return new Histogram(width, counts);
    }

    @Override
    public double expectation(Program p, PauliOperator operator) {
        if (operator.getNumberQubits() != p.getNumberQubits()) {
            throw new IllegalArgumentException("operator acts on " + operator.getNumberQubits()
                    + " qubits but the program has " + p.getNumberQubits());
        }
        return ExpectationEvaluator.expectation(evolve(p), operator);
    }

    /**
     * Projects a basis index onto the classical register; bits no measurement writes read 0.
     */
    static String toClassicalBits(int basisIndex, int[] qubitForClbit) {
        int value = 0;
        for (int c = 0; c < qubitForClbit.length; c++) {
            int q = qubitForClbit[c];
            if (q >= 0 && ((basisIndex >> q) & 1) == 1) {
                value |= 1 << c;
            }
        }
        return BitStrings.toBitString(value, qubitForClbit.length);
    }
}
