package org.redfx.quantumlab;

/**
 * Immutable complex number used for amplitudes and gate matrix entries.
 */
public final class Complex {

    public static final Complex ZERO = new Complex(0., 0.);
    public static final Complex ONE = new Complex(1., 0.);
    public static final Complex I = new Complex(0., 1.);
    public static final Complex HC = new Complex(1 / Math.sqrt(2), 0.);
    public static final Complex HCN = new Complex(-1 / Math.sqrt(2), 0.);

    public final double r;
    public final double i;

    public Complex(double r, double i) {
        this.r = r;
        this.i = i;
    }

    public Complex(double r) {
        this(r, 0.);
    }

    /**
     * Returns e^(i&theta;).
     */
    public static Complex exp(double theta) {
        return new Complex(Math.cos(theta), Math.sin(theta));
    }

    public Complex add(Complex b) {
        return new Complex(r + b.r, i + b.i);
    }

    public Complex sub(Complex b) {
        return new Complex(r - b.r, i - b.i);
    }

    public Complex mul(Complex b) {
        return new Complex(r * b.r - i * b.i, r * b.i + i * b.r);
    }

    public Complex mul(double b) {
        return new Complex(r * b, i * b);
    }

    public Complex negate() {
        return new Complex(-r, -i);
    }

    public Complex conjugate() {
        return new Complex(r, -i);
    }

    public double abssqr() {
        return r * r + i * i;
    }

    public double mod() {
        return Math.sqrt(abssqr());
    }

    public boolean isCloseTo(Complex other, double tolerance) {
        return Math.abs(r - other.r) <= tolerance && Math.abs(i - other.i) <= tolerance;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Complex)) return false;
        Complex other = (Complex) obj;
        return Double.compare(r, other.r) == 0 && Double.compare(i, other.i) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(r) * 31 + Double.hashCode(i);
    }

    @Override
    public String toString() {
        return "(" + r + ", " + i + ")";
    }
}
