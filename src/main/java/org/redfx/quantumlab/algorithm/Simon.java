package org.redfx.quantumlab.algorithm;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.redfx.quantumlab.BitStrings;
import org.redfx.quantumlab.Program;

/**
 * Simon's algorithm with a literal oracle: the input register is copied onto the output
 * register and then XORed with itself wherever the secret has a 1, giving
 * f(x) = x AND NOT s, which satisfies f(x) = f(x &oplus; s). This is not a black-box
 * oracle; for secrets with more than one set bit the measured strings do not pin the
 * secret down, and {@link #recoverSecret} reports that instead of guessing.
 */
public final class Simon {

    private Simon() {
    }

    public static Program build(String secret) {
        BitStrings.requireBinary(secret, "secret");
        int n = secret.length();
        Program.Builder b = Program.builder(2 * n, n);
        int[] inputs = QuantumFourierTransform.ascending(n);
        b.h(inputs);
        oracle(b, secret);
        b.h(inputs);
        for (int i = 0; i < n; i++) {
            b.measure(i, i);
        }
        return b.build();
    }

    public static Program.Builder oracle(Program.Builder b, String secret) {
        int n = secret.length();
        for (int i = 0; i < n; i++) {
            b.cx(i, n + i);
        }
        for (int i = 0; i < n; i++) {
            if (BitStrings.isSet(secret, i)) {
                b.cx(i, n + i);
            }
        }
        return b;
    }

    public static boolean isOrthogonal(String y, String s) {
        BitStrings.requireBinary(y, "y");
        BitStrings.requireBinary(s, y.length(), "s");
        return Integer.bitCount(BitStrings.toIndex(y) & BitStrings.toIndex(s)) % 2 == 0;
    }

    /**
     * Solves y&middot;s = 0 (mod 2) for all measured y by Gaussian elimination over GF(2) and
     * returns a basis of the solution space. The basis is empty when only s = 0 solves it.
     */
    public static List<String> nullSpace(Collection<String> measurements, int n) {
        if (n <= 0) {
            throw new IllegalArgumentException("n must be >= 1, got " + n);
        }
        List<Integer> rows = new ArrayList<>();
        for (String y : measurements) {
            BitStrings.requireBinary(y, n, "measurement");
            rows.add(BitStrings.toIndex(y));
        }

        int[] pivotColumnOfRow = new int[n];
        boolean[] isPivot = new boolean[n];
        int rank = 0;
        for (int col = 0; col < n && rank < rows.size(); col++) {
            int bit = 1 << col;
            int sel = -1;
            for (int r = rank; r < rows.size(); r++) {
                if ((rows.get(r) & bit) != 0) {
                    sel = r;
                    break;
                }
            }
            if (sel < 0) {
                continue;
            }
            int pivot = rows.get(sel);
            rows.set(sel, rows.get(rank));
            rows.set(rank, pivot);
            for (int r = 0; r < rows.size(); r++) {
                if (r != rank && (rows.get(r) & bit) != 0) {
                    rows.set(r, rows.get(r) ^ pivot);
                }
            }
            pivotColumnOfRow[rank] = col;
            isPivot[col] = true;
            rank++;
        }

        List<String> basis = new ArrayList<>();
        for (int free = 0; free < n; free++) {
            if (isPivot[free]) {
                continue;
            }
            int s = 1 << free;
            for (int r = 0; r < rank; r++) {
                if ((rows.get(r) & (1 << free)) != 0) {
                    s |= 1 << pivotColumnOfRow[r];
                }
            }
            basis.add(BitStrings.toBitString(s, n));
        }
        return basis;
    }

    /**
     * Returns the secret when the measurements leave exactly one non-zero candidate.
     */
    public static Optional<String> recoverSecret(Collection<String> measurements, int n) {
        List<String> basis = nullSpace(measurements, n);
        if (basis.size() != 1) {
            return Optional.empty();
        }
        return Optional.of(basis.get(0));
    }
}
