package org.redfx.quantumlab;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.redfx.quantumlab.config.SimulatorConfig;
import org.redfx.quantumlab.local.SimpleQuantumExecutionEnvironment;
import org.redfx.quantumlab.nd4j.Nd4jQuantumExecutionEnvironment;

public class QuantumExecutionEnvironmentsTest {

    @Test
    void defaultEngineIsLocal() {
        assertThat(QuantumExecutionEnvironments.create()).isInstanceOf(SimpleQuantumExecutionEnvironment.class);
    }

    @Test
    void engineIsSelectedByName() {
        SimulatorConfig cfg = SimulatorConfig.defaults();
        cfg.engine = "ND4J";
        assertThat(QuantumExecutionEnvironments.create(cfg)).isInstanceOf(Nd4jQuantumExecutionEnvironment.class);
        cfg.engine = "bogus";
        assertThatThrownBy(() -> QuantumExecutionEnvironments.create(cfg)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void seededEnginesAreIndependentButReproducible() {
        SimulatorConfig cfg = SimulatorConfig.defaults();
        cfg.seed = 2024L;
        Program p = Program.builder(2, 2).h(0, 1).measureAll().build();
        QuantumExecutionEnvironment first = QuantumExecutionEnvironments.create(cfg);
        QuantumExecutionEnvironment second = QuantumExecutionEnvironments.create(cfg);
        assertThat(first).isNotSameAs(second);
        assertThat(first.sample(p, 300).getCounts()).isEqualTo(second.sample(p, 300).getCounts());
    }
}
