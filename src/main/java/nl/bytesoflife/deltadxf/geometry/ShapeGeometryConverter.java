package nl.bytesoflife.deltadxf.geometry;

import nl.bytesoflife.deltadxf.model.shape.*;
import org.locationtech.jts.geom.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts shapes into JTS geometries, tessellating circles and arcs.
 */
public class ShapeGeometryConverter {

    private static final int ARC_SEGMENTS = 32;
    private final GeometryFactory factory = new GeometryFactory();

    public List<Geometry> convert(List<? extends Shape> shapes) {
        List<Geometry> geometries = new ArrayList<>();

        for (Shape shape : shapes) {
            Geometry geom = convertShape(shape);
            if (geom != null && !geom.isEmpty()) {
                geometries.add(geom);
            }
        }

        return geometries;
    }

    public Geometry convertShape(Shape shape) {
        if (shape instanceof Edge edge) {
            return convertEdge(edge);
        } else if (shape instanceof Wire wire) {
            return convertWire(wire);
        } else if (shape instanceof Face face) {
            return convertFace(face);
        }
        List<Geometry> parts = convert(shape.getSubShapes());
        return factory.createGeometryCollection(parts.toArray(new Geometry[0]));
    }

    /**
     * 2D bounding envelope of all shapes; a null envelope when nothing converts.
     */
    public Envelope envelope(List<? extends Shape> shapes) {
        Envelope envelope = new Envelope();
        for (Geometry geom : convert(shapes)) {
            envelope.expandToInclude(geom.getEnvelopeInternal());
        }
        return envelope;
    }

    private Geometry convertEdge(Edge edge) {
        return factory.createLineString(edgeToCoordinates(edge).toArray(new Coordinate[0]));
    }

    private Geometry convertWire(Wire wire) {
        List<Coordinate> coords = wireToCoordinates(wire);
        if (coords.size() < 2) return null;
        return factory.createLineString(coords.toArray(new Coordinate[0]));
    }

    private Geometry convertFace(Face face) {
        LinearRing shell = toRing(face.getOuterWire());
        if (shell == null) return null;

        List<LinearRing> holes = new ArrayList<>();
        for (Wire inner : face.getInnerWires()) {
            LinearRing hole = toRing(inner);
            if (hole != null) {
                holes.add(hole);
            }
        }
        return factory.createPolygon(shell, holes.toArray(new LinearRing[0]));
    }

    private LinearRing toRing(Wire wire) {
        List<Coordinate> coords = wireToCoordinates(wire);
        if (coords.isEmpty()) return null;

        // Close the ring
        Coordinate first = coords.get(0);
        Coordinate last = coords.get(coords.size() - 1);
        if (first.x != last.x || first.y != last.y) {
            coords.add(new Coordinate(first));
        }
        if (coords.size() < 4) return null; // Need at least 3 + closing point
        return factory.createLinearRing(coords.toArray(new Coordinate[0]));
    }

    private List<Coordinate> wireToCoordinates(Wire wire) {
        List<Coordinate> coords = new ArrayList<>();
        for (Edge edge : wire.getEdges()) {
            List<Coordinate> edgeCoords = edgeToCoordinates(edge);
            // Skip the first point when it repeats the previous edge's end
            int from = coords.isEmpty() ? 0 : 1;
            for (int i = from; i < edgeCoords.size(); i++) {
                coords.add(edgeCoords.get(i));
            }
        }
        return coords;
    }

    List<Coordinate> edgeToCoordinates(Edge edge) {
        Curve curve = edge.getCurve();
        Curve basis = curve instanceof TrimmedCurve trimmed ? trimmed.getBasis() : curve;
        if (basis instanceof LineCurve) {
            return List.of(edge.getStart(), edge.getEnd());
        }

        List<Coordinate> coords = new ArrayList<>();
        double sweep = edge.getLast() - edge.getFirst();
        int segments = Math.max(8, (int) (Math.abs(sweep) / (2 * Math.PI) * ARC_SEGMENTS));
        for (int i = 0; i <= segments; i++) {
            double t = (double) i / segments;
            coords.add(curve.value(edge.getFirst() + sweep * t));
        }
        return coords;
    }
}
