package nl.bytesoflife.deltadxf.model.shape;

import org.locationtech.jts.geom.Coordinate;

/**
 * Unbounded straight line through {@code origin}, parametrized by distance along a unit direction.
 */
public final class LineCurve implements Curve {

    private final Coordinate origin;
    private final double dx;
    private final double dy;
    private final double dz;

    public LineCurve(Coordinate origin, double dx, double dy, double dz) {
        double length = Math.sqrt(dx * dx + dy * dy + dz * dz);
        if (length == 0) {
            throw new IllegalArgumentException("Line direction must not be zero");
        }
        this.origin = new Coordinate(origin.x, origin.y, z(origin));
        this.dx = dx / length;
        this.dy = dy / length;
        this.dz = dz / length;
    }

    public Coordinate getOrigin() {
        return new Coordinate(origin);
    }

    public double[] getDirection() {
        return new double[]{dx, dy, dz};
    }

    @Override
    public Coordinate value(double t) {
        return new Coordinate(origin.x + dx * t, origin.y + dy * t, origin.z + dz * t);
    }

    static double z(Coordinate c) {
        return Double.isNaN(c.getZ()) ? 0 : c.getZ();
    }

    @Override
    public String toString() {
        return String.format(java.util.Locale.US, "LineCurve[(%.4f,%.4f,%.4f) dir (%.4f,%.4f,%.4f)]",
            origin.x, origin.y, origin.z, dx, dy, dz);
    }
}
