package org.redfx.quantumlab.algorithm;

import java.util.Map;
import org.redfx.quantumlab.BitStrings;
import org.redfx.quantumlab.Histogram;
import org.redfx.quantumlab.Program;

/**
 * Three-qubit teleportation without in-circuit classical control. The X correction on
 * the output qubit is applied afterwards by {@link #correctedMarginal(Histogram)}.
 */
public final class Teleportation {

    private Teleportation() {
    }

    public static Program build(TeleportedState state) {
        if (state == null) {
            throw new IllegalArgumentException("state must not be null");
        }
        Program.Builder b = Program.builder(3, 3);
        state.prepare(b, 0);
        // Bell pair on 1 and 2
        b.h(1);
        b.cx(1, 2);
        // Bell measurement basis on 0 and 1
        b.cx(0, 1);
        b.h(0);
        b.measure(0, 0);
        b.measure(1, 1);
        b.measure(2, 2);
        return b.build();
    }

    /**
     * Counts of 0 and 1 for the teleported qubit (classical bit 2) after the X correction:
     * the outcome is flipped whenever qubit 1, measured into classical bit 1, read 1. The Z
     * correction selected by qubit 0 does not change computational-basis statistics.
     * <p>
     * Ports of the lab demo should note that its summary flips on classical bit 0 instead.
     * That rule leaves the teleported qubit at 50/50 for |0&rang; and |1&rang; alike, so it is
     * not used here.
     */
    public static int[] correctedMarginal(Histogram histogram) {
        if (histogram.getWidth() != 3) {
            throw new IllegalArgumentException("expected 3-bit outcomes, got width " + histogram.getWidth());
        }
        int[] answer = new int[2];
        for (Map.Entry<String, Integer> entry : histogram.getCounts().entrySet()) {
            String bits = entry.getKey();
            boolean raw = BitStrings.isSet(bits, 2);
            boolean corrected = BitStrings.isSet(bits, 1) ? !raw : raw;
            answer[corrected ? 1 : 0] += entry.getValue();
        }
        return answer;
    }
}
