package org.redfx.quantumlab.vqe;

import java.util.concurrent.atomic.AtomicInteger;
import org.apache.commons.math3.analysis.MultivariateFunction;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.redfx.quantumlab.QuantumExecutionEnvironment;
import org.redfx.quantumlab.pauli.PauliOperator;

/**
 * Binds a parameter vector into the ansatz and returns the expectation value of the
 * operator; one simulation per call.
 */
public class ExpectationObjective implements MultivariateFunction {

    private static final Logger LOG = LogManager.getLogger(ExpectationObjective.class);

    private final QuantumExecutionEnvironment environment;
    private final Ansatz ansatz;
    private final PauliOperator operator;
    private final AtomicInteger evaluations = new AtomicInteger();

    public ExpectationObjective(QuantumExecutionEnvironment environment, Ansatz ansatz, PauliOperator operator) {
        if (ansatz.getNumberQubits() != operator.getNumberQubits()) {
            throw new IllegalArgumentException("ansatz has " + ansatz.getNumberQubits()
                    + " qubits but the operator acts on " + operator.getNumberQubits());
        }
        this.environment = environment;
        this.ansatz = ansatz;
        this.operator = operator;
    }

    @Override
    public double value(double[] parameters) {
        double energy = environment.expectation(ansatz.bind(parameters), operator);
        int n = evaluations.incrementAndGet();
        LOG.trace("evaluation {}: {}", n, energy);
        return energy;
    }

    public int getEvaluations() {
        return evaluations.get();
    }
}
