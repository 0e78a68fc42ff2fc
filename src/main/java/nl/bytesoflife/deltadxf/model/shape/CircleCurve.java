package nl.bytesoflife.deltadxf.model.shape;

import org.locationtech.jts.geom.Coordinate;

import java.util.Locale;

/**
 * Full circle in the plane through {@code center} perpendicular to {@code normal}.
 * The parameter is the angle in radians, measured from the plane's X direction.
 * For the default normal (0,0,1) the X direction is the global X axis.
 */
public final class CircleCurve implements Curve {

    private final Coordinate center;
    private final double radius;
    private final double[] normal;
    private final double[] xDir;
    private final double[] yDir;

    public CircleCurve(Coordinate center, double[] normal, double radius) {
        if (!(radius > 0)) {
            throw new IllegalArgumentException("Circle radius must be positive: " + radius);
        }
        this.center = new Coordinate(center.x, center.y, LineCurve.z(center));
        this.radius = radius;
        this.normal = unit(normal);
        this.xDir = xDirection(this.normal);
        this.yDir = cross(this.normal, this.xDir);
    }

    public Coordinate getCenter() {
        return new Coordinate(center);
    }

    public double getRadius() {
        return radius;
    }

    public double[] getNormal() {
        return normal.clone();
    }

    @Override
    public Coordinate value(double t) {
        double c = Math.cos(t) * radius;
        double s = Math.sin(t) * radius;
        return new Coordinate(
            center.x + c * xDir[0] + s * yDir[0],
            center.y + c * xDir[1] + s * yDir[1],
            center.z + c * xDir[2] + s * yDir[2]);
    }

    private static double[] unit(double[] v) {
        double length = Math.sqrt(v[0] * v[0] + v[1] * v[1] + v[2] * v[2]);
        if (length == 0) {
            throw new IllegalArgumentException("Circle normal must not be zero");
        }
        return new double[]{v[0] / length, v[1] / length, v[2] / length};
    }

    // Global X projected into the circle plane, falling back to global Y for normals along X
    private static double[] xDirection(double[] n) {
        double[] axis = Math.abs(n[0]) > 0.9 ? new double[]{0, 1, 0} : new double[]{1, 0, 0};
        double dot = axis[0] * n[0] + axis[1] * n[1] + axis[2] * n[2];
        return unit(new double[]{axis[0] - dot * n[0], axis[1] - dot * n[1], axis[2] - dot * n[2]});
    }

    private static double[] cross(double[] a, double[] b) {
        return new double[]{
            a[1] * b[2] - a[2] * b[1],
            a[2] * b[0] - a[0] * b[2],
            a[0] * b[1] - a[1] * b[0]
        };
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "CircleCurve[center=(%.4f,%.4f,%.4f), r=%.4f]",
            center.x, center.y, center.z, radius);
    }
}
