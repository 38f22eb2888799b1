package org.redfx.quantumlab.gate;

import org.redfx.quantumlab.Complex;

/**
 * Rotation by {@code theta} around the X, Y or Z axis of the Bloch sphere.
 */
public class Rotation extends SingleQubitGate {

    public enum Axis {
        X, Y, Z
    }

    private final Axis axis;
    private final double theta;

    public Rotation(int idx, Axis axis, double theta) {
        super(idx);
        this.axis = axis;
        this.theta = theta;
    }

    public Axis getAxis() {
        return axis;
    }

    public double getTheta() {
        return theta;
    }

    @Override
    public Complex[][] getMatrix() {
        double c = Math.cos(theta / 2);
        double s = Math.sin(theta / 2);
        switch (axis) {
            case X:
                return new Complex[][]{
                    {new Complex(c), new Complex(0, -s)},
                    {new Complex(0, -s), new Complex(c)}};
            case Y:
                return new Complex[][]{
                    {new Complex(c), new Complex(-s)},
                    {new Complex(s), new Complex(c)}};
            case Z:
                return new Complex[][]{
                    {Complex.exp(-theta / 2), Complex.ZERO},
                    {Complex.ZERO, Complex.exp(theta / 2)}};
            default:
                throw new IllegalStateException("unknown axis " + axis);
        }
    }

    @Override
    public String getName() {
        return "R" + axis.name().toLowerCase() + "(" + theta + ")";
    }
}
