package org.redfx.quantumlab.algorithm;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.redfx.quantumlab.Histogram;
import org.redfx.quantumlab.local.SimpleQuantumExecutionEnvironment;

public class TeleportationTest {

    private final SimpleQuantumExecutionEnvironment env = new SimpleQuantumExecutionEnvironment(81L);

    @Test
    void zeroArrivesAsZero() {
        Histogram h = env.sample(Teleportation.build(TeleportedState.ZERO), 500);
        assertThat(h.getCounts().keySet()).isSubsetOf("000", "001", "110", "111");
        int[] marginal = Teleportation.correctedMarginal(h);
        assertThat(marginal[0]).isEqualTo(500);
        assertThat(marginal[1]).isZero();
    }

    @Test
    void oneArrivesAsOne() {
        Histogram h = env.sample(Teleportation.build(TeleportedState.ONE), 500);
        assertThat(h.getCounts().keySet()).isSubsetOf("010", "011", "100", "101");
        int[] marginal = Teleportation.correctedMarginal(h);
        assertThat(marginal[1]).isEqualTo(500);
    }

    @Test
    void superpositionsStayBalanced() {
        for (TeleportedState state : new TeleportedState[]{TeleportedState.PLUS, TeleportedState.MINUS}) {
            int[] marginal = Teleportation.correctedMarginal(env.sample(Teleportation.build(state), 2000));
            assertThat(marginal[0] / 2000.0).as(state.name()).isBetween(0.4, 0.6);
        }
    }

    @Test
    void correctionFlipsOnMiddleBit() {
        Map<String, Integer> counts = new HashMap<>();
        counts.put("000", 1);
        counts.put("010", 2);
        counts.put("110", 4);
        counts.put("101", 8);
        int[] marginal = Teleportation.correctedMarginal(new Histogram(3, counts));
        assertThat(marginal).containsExactly(1 + 4, 2 + 8);
    }

    @Test
    void flippingOnTheFirstBitWouldLoseTheState() {
        Histogram h = env.sample(Teleportation.build(TeleportedState.ZERO), 2000);
        int ones = 0;
        for (Map.Entry<String, Integer> entry : h.getCounts().entrySet()) {
            String bits = entry.getKey();
            boolean raw = bits.charAt(0) == '1';
            if (bits.charAt(2) == '1' ? !raw : raw) {
                ones += entry.getValue();
            }
        }
        assertThat(ones / 2000.0).isBetween(0.4, 0.6);
        assertThat(Teleportation.correctedMarginal(h)[1]).isZero();
    }

    @Test
    void rejectsBadInput() {
        assertThatThrownBy(() -> Teleportation.build(null)).isInstanceOf(IllegalArgumentException.class);
        Map<String, Integer> counts = new HashMap<>();
        counts.put("00", 1);
        assertThatThrownBy(() -> Teleportation.correctedMarginal(new Histogram(2, counts)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
