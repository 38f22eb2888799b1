package org.redfx.quantumlab.gate;

import java.util.Arrays;
import org.redfx.quantumlab.Complex;

/**
 * An X or Z (or any single-qubit gate) on the target, applied only where every control
 * qubit is 1. Local matrix order is (target, controls...).
 */
public class MultiControlledGate extends UnitaryGate {

    private final int[] controls;
    private final SingleQubitGate base;

    public MultiControlledGate(int[] controls, SingleQubitGate base) {
        super(concat(base.getMainQubitIndex(), controls));
        if (controls.length == 0) {
            throw new IllegalArgumentException("a multi-controlled gate needs at least one control");
        }
        this.controls = controls.clone();
        this.base = base;
    }

    public static MultiControlledGate mcx(int[] controls, int target) {
        return new MultiControlledGate(controls, new X(target));
    }

    public static MultiControlledGate mcz(int[] controls, int target) {
        return new MultiControlledGate(controls, new Z(target));
    }

    private static int[] concat(int target, int[] controls) {
        int[] answer = new int[controls.length + 1];
        answer[0] = target;
        System.arraycopy(controls, 0, answer, 1, controls.length);
        return answer;
    }

    public int[] getControlIndexes() {
        return controls.clone();
    }

    public int getTargetIndex() {
        return base.getMainQubitIndex();
    }

    public SingleQubitGate getBaseGate() {
        return base;
    }

    @Override
    public Complex[][] getMatrix() {
        return controlledMatrix(base.getMatrix(), controls.length);
    }

    @Override
    public String getName() {
        return "MC" + base.getName() + Arrays.toString(controls);
    }
}
