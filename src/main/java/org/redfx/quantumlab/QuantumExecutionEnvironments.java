package org.redfx.quantumlab;

import org.redfx.quantumlab.config.SimulatorConfig;
import org.redfx.quantumlab.local.SimpleQuantumExecutionEnvironment;
import org.redfx.quantumlab.nd4j.Nd4jQuantumExecutionEnvironment;

public final class QuantumExecutionEnvironments {

    private QuantumExecutionEnvironments() {
    }

    /**
     * Creates a new engine of the kind the configuration names. Each call returns an
     * independent instance with its own sampler state.
     */
    public static QuantumExecutionEnvironment create(SimulatorConfig config) {
        config.validate();
        if (SimulatorConfig.ENGINE_ND4J.equals(config.engine)) {
            return new Nd4jQuantumExecutionEnvironment(config);
        }
        return new SimpleQuantumExecutionEnvironment(config);
    }

    public static QuantumExecutionEnvironment create() {
        return create(SimulatorConfig.loadDefault());
    }
}
