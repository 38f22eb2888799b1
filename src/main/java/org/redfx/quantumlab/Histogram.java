package org.redfx.quantumlab;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Shot counts per measured bitstring. All keys have the same length and the counts add
 * up to {@link #getShots()}.
 */
public final class Histogram {

    private final int width;
    private final int shots;
    private final SortedMap<String, Integer> counts;

    public Histogram(int width, Map<String, Integer> counts) {
        if (width <= 0) {
            throw new IllegalArgumentException("bitstring width must be >= 1, got " + width);
        }
        int total = 0;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            BitStrings.requireBinary(entry.getKey(), width, "histogram key");
            if (entry.getValue() < 0) {
                throw new IllegalArgumentException("negative count for " + entry.getKey());
            }
            total += entry.getValue();
        }
        if (total <= 0) {
            throw new IllegalArgumentException("a histogram needs at least one shot");
        }
        this.width = width;
        this.shots = total;
        this.counts = Collections.unmodifiableSortedMap(new TreeMap<>(counts));
    }

    public int getWidth() {
        return width;
    }

    public int getShots() {
        return shots;
    }

    public SortedMap<String, Integer> getCounts() {
        return counts;
    }

    public int getCount(String bits) {
        return counts.getOrDefault(bits, 0);
    }

    public double getProbability(String bits) {
        return getCount(bits) / (double) shots;
    }

    /**
     * Returns the bitstring with the highest count; ties resolve to the smallest bitstring.
     */
    public String mostFrequent() {
        String best = null;
        int bestCount = -1;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }

    /**
     * Counts of {@code 0} and {@code 1} for a single classical bit, indexed by value.
     */
    public int[] marginal(int clbit) {
        if (clbit < 0 || clbit >= width) {
            throw new IndexOutOfBoundsException("classical bit " + clbit + " outside [0, " + width + ")");
        }
        int[] answer = new int[2];
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            answer[BitStrings.isSet(entry.getKey(), clbit) ? 1 : 0] += entry.getValue();
        }
        return answer;
    }

    @Override
    public String toString() {
        return counts.toString();
    }
}
