package nl.bytesoflife.deltadxf.geometry;

import nl.bytesoflife.deltadxf.model.shape.*;
import org.locationtech.jts.geom.Coordinate;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Default {@link GeometryKernel} over the immutable shape model.
 */
public class ShapeFactory implements GeometryKernel {

    public static final double[] Z_AXIS = {0, 0, 1};

    private static final double TWO_PI = 2 * Math.PI;
    private static final double PERIOD_TOLERANCE = 1e-9;
    private static final double POINT_TOLERANCE = 1e-12;

    @Override
    public Edge makeEdgeFromLine(Coordinate p1, Coordinate p2) {
        Coordinate a = point(p1);
        Coordinate b = point(p2);
        double length = a.distance3D(b);
        if (length <= POINT_TOLERANCE) {
            throw new GeometryException("Cannot make a line edge between coincident points " + a);
        }
        LineCurve line = new LineCurve(a, b.x - a.x, b.y - a.y, b.z - a.z);
        return new Edge(line, 0, length);
    }

    @Override
    public Edge makeEdgeFromCircle(Coordinate center, double[] normal, double radius,
                                   double startParam, double endParam) {
        if (!(radius > 0) || Double.isInfinite(radius)) {
            throw new GeometryException("Circle radius must be positive and finite: " + radius);
        }
        if (!Double.isFinite(startParam) || !Double.isFinite(endParam)) {
            throw new GeometryException("Circle parameters must be finite");
        }
        CircleCurve circle;
        try {
            circle = new CircleCurve(point(center), normal, radius);
        } catch (IllegalArgumentException e) {
            throw new GeometryException(e.getMessage());
        }

        double end = endParam;
        while (end <= startParam) {
            end += TWO_PI;
        }
        if (end - startParam >= TWO_PI - PERIOD_TOLERANCE) {
            return new Edge(circle, startParam, startParam + TWO_PI);
        }
        return new Edge(new TrimmedCurve(circle, startParam, end), startParam, end);
    }

    @Override
    public Wire makeWireFromPoints(List<Coordinate> points, boolean closed) {
        List<Coordinate> distinct = dropConsecutiveDuplicates(points);
        if (closed && distinct.size() > 1
                && distinct.get(0).distance3D(distinct.get(distinct.size() - 1)) <= POINT_TOLERANCE) {
            distinct.remove(distinct.size() - 1);
        }
        if (distinct.size() < 2) {
            throw new GeometryException("A wire needs at least 2 distinct points, got " + distinct.size());
        }

        List<Edge> edges = new ArrayList<>();
        for (int i = 0; i < distinct.size() - 1; i++) {
            edges.add(makeEdgeFromLine(distinct.get(i), distinct.get(i + 1)));
        }
        if (closed && distinct.size() > 2) {
            edges.add(makeEdgeFromLine(distinct.get(distinct.size() - 1), distinct.get(0)));
        }
        return new Wire(edges);
    }

    @Override
    public Face makeFaceFromPolygon(List<Coordinate> points) {
        List<Coordinate> distinct = dropConsecutiveDuplicates(points);
        if (distinct.size() > 1
                && distinct.get(0).distance3D(distinct.get(distinct.size() - 1)) <= POINT_TOLERANCE) {
            distinct.remove(distinct.size() - 1);
        }
        if (distinct.size() < 3) {
            throw new GeometryException("A face needs at least 3 distinct points, got " + distinct.size());
        }
        if (newellNormalLength(distinct) <= POINT_TOLERANCE) {
            throw new GeometryException("Face polygon has no area");
        }
        return new Face(makeWireFromPoints(distinct, true));
    }

    @Override
    public Compound makeCompound(List<? extends Shape> shapes) {
        return new Compound(shapes);
    }

    @Override
    public ShapeType shapeKind(Shape shape) {
        return shape.getShapeType();
    }

    @Override
    public CurveKind classifyCurve(Edge edge) {
        Curve curve = edge.getCurve();
        if (curve instanceof LineCurve) {
            return CurveKind.LINE;
        } else if (curve instanceof CircleCurve) {
            boolean full = edge.getLast() - edge.getFirst() >= TWO_PI - PERIOD_TOLERANCE;
            return full ? CurveKind.CIRCLE : CurveKind.TRIMMED_CIRCLE;
        } else if (curve instanceof TrimmedCurve trimmed && trimmed.getBasis() instanceof CircleCurve) {
            return CurveKind.TRIMMED_CIRCLE;
        }
        return CurveKind.OTHER;
    }

    @Override
    public List<Edge> edges(Shape shape) {
        List<Edge> edges = new ArrayList<>();
        Deque<Shape> stack = new ArrayDeque<>();
        stack.push(shape);
        while (!stack.isEmpty()) {
            Shape current = stack.pop();
            if (current instanceof Edge edge) {
                edges.add(edge);
                continue;
            }
            List<? extends Shape> subShapes = current.getSubShapes();
            for (int i = subShapes.size() - 1; i >= 0; i--) {
                stack.push(subShapes.get(i));
            }
        }
        return edges;
    }

    @Override
    public List<Edge> wireEdges(Wire wire) {
        return wire.getEdges();
    }

    @Override
    public List<Edge> faceBoundary(Face face) {
        return face.getOuterWire().getEdges();
    }

    @Override
    public List<Face> faces(Shape shape) {
        List<Face> faces = new ArrayList<>();
        Deque<Shape> stack = new ArrayDeque<>();
        stack.push(shape);
        while (!stack.isEmpty()) {
            Shape current = stack.pop();
            if (current instanceof Face face) {
                faces.add(face);
            } else if (current instanceof Compound || current instanceof CompSolid || current instanceof Solid) {
                List<? extends Shape> subShapes = current.getSubShapes();
                for (int i = subShapes.size() - 1; i >= 0; i--) {
                    stack.push(subShapes.get(i));
                }
            }
        }
        return faces;
    }

    private static Coordinate point(Coordinate c) {
        if (!Double.isFinite(c.x) || !Double.isFinite(c.y)) {
            throw new GeometryException("Point coordinates must be finite: " + c);
        }
        double z = Double.isNaN(c.getZ()) ? 0 : c.getZ();
        if (Double.isInfinite(z)) {
            throw new GeometryException("Point coordinates must be finite: " + c);
        }
        return new Coordinate(c.x, c.y, z);
    }

    private static List<Coordinate> dropConsecutiveDuplicates(List<Coordinate> points) {
        List<Coordinate> distinct = new ArrayList<>(points.size());
        for (Coordinate p : points) {
            Coordinate c = point(p);
            if (distinct.isEmpty() || distinct.get(distinct.size() - 1).distance3D(c) > POINT_TOLERANCE) {
                distinct.add(c);
            }
        }
        return distinct;
    }

    private static double newellNormalLength(List<Coordinate> ring) {
        double nx = 0, ny = 0, nz = 0;
        for (int i = 0; i < ring.size(); i++) {
            Coordinate a = ring.get(i);
            Coordinate b = ring.get((i + 1) % ring.size());
            nx += (a.y - b.y) * (a.z + b.z);
            ny += (a.z - b.z) * (a.x + b.x);
            nz += (a.x - b.x) * (a.y + b.y);
        }
        return Math.sqrt(nx * nx + ny * ny + nz * nz);
    }
}
