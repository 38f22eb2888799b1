package org.redfx.quantumlab.vqe;

import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.NelderMeadSimplex;
import org.apache.commons.math3.optim.nonlinear.scalar.noderiv.SimplexOptimizer;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.redfx.quantumlab.QuantumExecutionEnvironment;
import org.redfx.quantumlab.config.SimulatorConfig;
import org.redfx.quantumlab.pauli.PauliOperator;

/**
 * Variational eigensolver: a Nelder-Mead simplex search over the ansatz parameters with
 * the expectation value as a black-box objective.
 */
public class VqeSolver {

    private static final Logger LOG = LogManager.getLogger(VqeSolver.class);

    private final QuantumExecutionEnvironment environment;
    private final SimulatorConfig.Vqe settings;

    public VqeSolver(QuantumExecutionEnvironment environment, SimulatorConfig.Vqe settings) {
        this.environment = environment;
        this.settings = settings;
    }

    public VqeSolver(QuantumExecutionEnvironment environment) {
        this(environment, SimulatorConfig.defaults().vqe);
    }

    /**
     * Starts from a point drawn uniformly from [-&pi;, &pi;) per parameter with the configured
     * seed.
     */
    public VqeResult minimize(Ansatz ansatz, PauliOperator operator) {
        UniformRandomProvider rng = RandomSource.XO_RO_SHI_RO_128_PP.create(settings.initialPointSeed);
        double[] initial = new double[ansatz.getNumberParameters()];
        for (int i = 0; i < initial.length; i++) {
            initial[i] = -Math.PI + 2 * Math.PI * rng.nextDouble();
        }
        return minimize(ansatz, operator, initial);
    }

    public VqeResult minimize(Ansatz ansatz, PauliOperator operator, double[] initial) {
        if (initial.length != ansatz.getNumberParameters()) {
            throw new IllegalArgumentException("expected " + ansatz.getNumberParameters()
                    + " initial parameters, got " + initial.length);
        }
        ExpectationObjective objective = new ExpectationObjective(environment, ansatz, operator);
        SimplexOptimizer optimizer = new SimplexOptimizer(settings.relativeThreshold, settings.absoluteThreshold);
        PointValuePair optimum = optimizer.optimize(
                new MaxEval(settings.maxEvaluations),
                new ObjectiveFunction(objective),
                GoalType.MINIMIZE,
                new InitialGuess(initial),
                new NelderMeadSimplex(initial.length, settings.initialSimplexSize));
        VqeResult result = new VqeResult(optimum.getValue(), optimum.getPoint(), objective.getEvaluations());
        LOG.info("VQE converged to {} after {} evaluations", result.getEnergy(), result.getEvaluations());
        return result;
    }
}
