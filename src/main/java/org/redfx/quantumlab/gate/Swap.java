package org.redfx.quantumlab.gate;

import org.redfx.quantumlab.Complex;

public class Swap extends UnitaryGate {

    private final int index1;
    private final int index2;

    public Swap(int index1, int index2) {
        super(index1, index2);
        this.index1 = index1;
        this.index2 = index2;
    }

    public int getIndex1() {
        return index1;
    }

    public int getIndex2() {
        return index2;
    }

    @Override
    public Complex[][] getMatrix() {
        Complex[][] answer = new Complex[4][4];
        for (int row = 0; row < 4; row++) {
            for (int col = 0; col < 4; col++) {
                int swapped = ((col & 1) << 1) | ((col >> 1) & 1);
                answer[row][col] = row == swapped ? Complex.ONE : Complex.ZERO;
            }
        }
        return answer;
    }

    @Override
    public String getName() {
        return "SWAP";
    }
}
