package nl.bytesoflife.deltadxf.model.shape;

import org.locationtech.jts.geom.Coordinate;

import java.util.List;
import java.util.Locale;

/**
 * A bounded piece of a curve, between parameters {@code first} and {@code last}.
 */
public final class Edge implements Shape {

    private final Curve curve;
    private final double first;
    private final double last;

    public Edge(Curve curve, double first, double last) {
        this.curve = curve;
        this.first = first;
        this.last = last;
    }

    public Curve getCurve() {
        return curve;
    }

    public double getFirst() {
        return first;
    }

    public double getLast() {
        return last;
    }

    public Coordinate getStart() {
        return curve.value(first);
    }

    public Coordinate getEnd() {
        return curve.value(last);
    }

    @Override
    public ShapeType getShapeType() {
        return ShapeType.EDGE;
    }

    @Override
    public List<Shape> getSubShapes() {
        return List.of();
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "Edge[%s, %.6f..%.6f]", curve, first, last);
    }
}
