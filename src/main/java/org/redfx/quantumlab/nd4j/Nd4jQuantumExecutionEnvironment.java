package org.redfx.quantumlab.nd4j;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.factory.Nd4j;
import org.redfx.quantumlab.Complex;
import org.redfx.quantumlab.Program;
import org.redfx.quantumlab.StateVector;
import org.redfx.quantumlab.config.SimulatorConfig;
import org.redfx.quantumlab.local.AbstractExecutionEnvironment;
import org.redfx.quantumlab.local.Computations;
import org.redfx.quantumlab.gate.Swap;
import org.redfx.quantumlab.gate.UnitaryGate;

/**
 * Engine that expands every gate to its full 2<sup>n</sup>&times;2<sup>n</sup> operator and
 * multiplies it with the state using ND4J. Much slower than the closed-form kernels; it
 * exists as an independent check on them and for small registers only.
 */
public class Nd4jQuantumExecutionEnvironment extends AbstractExecutionEnvironment {

    private static final Logger LOG = LogManager.getLogger(Nd4jQuantumExecutionEnvironment.class);

    /**
     * Largest register this engine accepts. Every gate becomes a dense
     * 2<sup>n</sup>&times;2<sup>n</sup> operator, which at 10 qubits is already about a million
     * entries.
     */
    public static final int MAX_QUBITS = 10;

    public Nd4jQuantumExecutionEnvironment() {
        this(SimulatorConfig.defaults());
    }

    public Nd4jQuantumExecutionEnvironment(SimulatorConfig config) {
        super(config);
    }

    @Override
    public StateVector evolve(Program p) {
        requireSupported(p.getNumberQubits());
        return super.evolve(p);
    }

    @Override
    protected Complex[] applyGate(UnitaryGate gate, Complex[] vector, int nQubits) {
        if (gate instanceof Swap) {
            Swap pg = (Swap) gate;
            return Computations.permutateVector(vector, pg.getIndex1(), pg.getIndex2());
        }
        Complex[][] matrix = expand(gate, nQubits);
        Complex[][] column = new Complex[vector.length][1];
        for (int i = 0; i < vector.length; i++) {
            column[i][0] = vector[i];
        }
        Complex[][] product = mmul(matrix, column);
        Complex[] answer = new Complex[vector.length];
        for (int i = 0; i < vector.length; i++) {
            answer[i] = product[i][0];
        }
        return answer;
    }

    /**
     * Embeds the gate's local matrix in the full register: entry (r, c) is zero unless r and c
     * agree on every qubit the gate does not touch.
     */
    static Complex[][] expand(UnitaryGate gate, int nQubits) {
        requireSupported(nQubits);
        int[] affected = gate.getAffectedQubitIndexes();
        Complex[][] local = gate.getMatrix();
        int dim = 1 << nQubits;
        if (local.length != 1 << affected.length) {
            throw new IllegalArgumentException("wrong matrix size " + local.length + " for gate " + gate);
        }
        int affectedMask = Computations.mask(affected);
        Complex[][] answer = new Complex[dim][dim];
        for (int r = 0; r < dim; r++) {
            int lr = localIndex(r, affected);
            for (int c = 0; c < dim; c++) {
                if (((r ^ c) & ~affectedMask) != 0) {
                    answer[r][c] = Complex.ZERO;
                } else {
                    answer[r][c] = local[lr][localIndex(c, affected)];
                }
            }
        }
        return answer;
    }

    private static void requireSupported(int nQubits) {
        if (nQubits > MAX_QUBITS) {
            throw new IllegalArgumentException("the nd4j engine supports at most " + MAX_QUBITS
                    + " qubits, got " + nQubits + "; use the local engine for larger registers");
        }
    }

    private static int localIndex(int index, int[] affected) {
        int answer = 0;
        for (int b = 0; b < affected.length; b++) {
            answer |= ((index >> affected[b]) & 1) << b;
        }
        return answer;
    }

    public static Complex[][] mmul(Complex[][] a, Complex[][] b) {
        long l0 = System.currentTimeMillis();
        int arow = a.length;
        int acol = a[0].length;
        int brow = b.length;
        int bcol = b[0].length;
        if (acol != brow) {
            throw new IllegalArgumentException("#cols a " + acol + " != #rows b " + brow);
        }
        double[][] ar = new double[arow][acol];
        double[][] ai = new double[arow][acol];
        double[][] br = new double[brow][bcol];
        double[][] bi = new double[brow][bcol];
        for (int i = 0; i < arow; i++) {
            for (int k = 0; k < acol; k++) {
                ar[i][k] = a[i][k].r;
                ai[i][k] = a[i][k].i;
            }
        }
        for (int k = 0; k < brow; k++) {
            for (int j = 0; j < bcol; j++) {
                br[k][j] = b[k][j].r;
                bi[k][j] = b[k][j].i;
            }
        }
        INDArray n_ar = Nd4j.createFromArray(ar);
        INDArray n_ai = Nd4j.createFromArray(ai);
        INDArray n_br = Nd4j.createFromArray(br);
        INDArray n_bi = Nd4j.createFromArray(bi);
        INDArray n_r = n_ar.mmul(n_br).sub(n_ai.mmul(n_bi));
        INDArray n_i = n_ai.mmul(n_br).add(n_ar.mmul(n_bi));

        Complex[][] answer = new Complex[arow][bcol];
        for (int i = 0; i < arow; i++) {
            for (int j = 0; j < bcol; j++) {
                answer[i][j] = new Complex(n_r.getDouble(i, j), n_i.getDouble(i, j));
            }
        }
        LOG.trace("ND4J mmul {}x{} . {}x{} took {} ms", arow, acol, brow, bcol, System.currentTimeMillis() - l0);
        return answer;
    }
}
